package com.influxlog.record;

import java.util.Locale;

/**
 * Closed severity set carried by a {@link LogRecord}.
 *
 * <p>Each constant has a syslog-style numeric code and a symbolic name; both mappings are one-to-one
 * so either rendering can be turned back into the constant.
 */
public enum Severity {
    CRITICAL(2),
    ERROR(3),
    WARNING(4),
    INFO(6),
    DEBUG(7);

    private final int code;

    Severity(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public String symbolicName() {
        return name();
    }

    /** Renders the severity as a tag value: the symbolic name when {@code symbolic}, else the code. */
    public String render(boolean symbolic) {
        return symbolic ? symbolicName() : Integer.toString(code);
    }

    public static Severity fromCode(int code) {
        for (Severity s : values()) {
            if (s.code == code) return s;
        }
        throw new IllegalArgumentException("Unknown severity code: " + code);
    }

    public static Severity fromName(String name) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Severity name is blank");
        String n = name.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(n)) return WARNING;
        if ("FATAL".equals(n)) return CRITICAL;
        return valueOf(n);
    }
}
