package com.influxlog.record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Logger-name helpers.
 *
 * <p>The store reserves {@code .} inside measurement names, so the logging framework's dotted
 * hierarchy is rewritten to a {@code :}-separated one before it becomes a measurement.
 */
public final class LoggerNames {
    public static final char FRAMEWORK_SEPARATOR = '.';
    public static final char STORE_SEPARATOR = ':';
    public static final String ROOT = "root";

    private LoggerNames() {}

    /** {@code "a.b.c"} becomes {@code "a:b:c"}; an empty or blank name becomes {@code "root"}. */
    public static String toMeasurement(String loggerName) {
        if (loggerName == null || loggerName.isBlank()) return ROOT;
        return loggerName.replace(FRAMEWORK_SEPARATOR, STORE_SEPARATOR);
    }

    /**
     * Returns the name followed by each of its ancestors, nearest first: {@code "a:b:c"} yields
     * {@code ["a:b:c", "a:b", "a"]}. Accepts either separator. Empty segments are kept as written.
     */
    public static List<String> ancestors(String loggerName) {
        String name = toMeasurement(loggerName);
        List<String> out = new ArrayList<>();
        out.add(name);
        int idx = name.lastIndexOf(STORE_SEPARATOR);
        while (idx > 0) {
            name = name.substring(0, idx);
            out.add(name);
            idx = name.lastIndexOf(STORE_SEPARATOR);
        }
        return Collections.unmodifiableList(out);
    }
}
