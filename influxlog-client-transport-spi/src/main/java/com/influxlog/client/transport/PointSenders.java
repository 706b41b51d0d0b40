package com.influxlog.client.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;

/** Looks up {@link PointSenderProvider}s on the class path. */
public final class PointSenders {
    public static final String DEFAULT_TRANSPORT = "jdkhttp";

    private PointSenders() {}

    public static PointSender create(String transport, StoreOptions options) {
        return provider(transport, PointSenders.class.getClassLoader()).create(options);
    }

    public static PointSenderProvider provider(String transport, ClassLoader loader) {
        String wanted = (transport == null || transport.isBlank() ? DEFAULT_TRANSPORT : transport.trim())
                .toLowerCase(Locale.ROOT);
        List<String> seen = new ArrayList<>();
        for (PointSenderProvider p : ServiceLoader.load(PointSenderProvider.class, loader)) {
            if (p.name().equalsIgnoreCase(wanted)) return p;
            seen.add(p.name());
        }
        throw new IllegalArgumentException("No point sender transport named '" + wanted + "'; available: " + seen);
    }
}
