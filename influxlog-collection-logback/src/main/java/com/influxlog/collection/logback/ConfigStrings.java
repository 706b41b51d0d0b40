package com.influxlog.collection.logback;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Parses the list and mapping values accepted by the appender setters. */
final class ConfigStrings {
    private ConfigStrings() {}

    /** {@code "a, b ,c"} to {@code [a, b, c]}; blank entries are skipped. */
    static List<String> list(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String part : value.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) out.add(p);
        }
        return out;
    }

    /** {@code "tenant=tenant_id,region"} to {@code {tenant=tenant_id, region=region}}. */
    static Map<String, String> mapping(String value) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String entry : list(value)) {
            int eq = entry.indexOf('=');
            if (eq < 0) {
                out.put(entry, entry);
                continue;
            }
            String attr = entry.substring(0, eq).trim();
            String name = entry.substring(eq + 1).trim();
            if (attr.isEmpty()) throw new IllegalArgumentException("Missing attribute name in '" + entry + "'");
            out.put(attr, name.isEmpty() ? attr : name);
        }
        return out;
    }
}
