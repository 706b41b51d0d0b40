package com.influxlog.point;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;

/**
 * InfluxDB line protocol encoder, nanosecond precision.
 *
 * <pre>{@code
 * measurement[,tag=value...] field=value[,field=value...] timestamp
 * }</pre>
 */
public final class LineProtocol {

    private LineProtocol() {}

    public static String encode(Point point) {
        StringBuilder sb = new StringBuilder(128);
        appendPoint(sb, point);
        return sb.toString();
    }

    /** One line per point, each terminated by {@code \n}. */
    public static String encode(Collection<Point> points) {
        StringBuilder sb = new StringBuilder(points.size() * 128);
        for (Point p : points) {
            appendPoint(sb, p);
            sb.append('\n');
        }
        return sb.toString();
    }

    public static long epochNanos(Instant ts) {
        return Math.addExact(Math.multiplyExact(ts.getEpochSecond(), 1_000_000_000L), ts.getNano());
    }

    private static void appendPoint(StringBuilder sb, Point p) {
        escapeMeasurement(sb, p.measurement());
        for (Map.Entry<String, String> tag : p.tags().entrySet()) {
            sb.append(',');
            escapeKey(sb, tag.getKey());
            sb.append('=');
            escapeKey(sb, tag.getValue());
        }
        sb.append(' ');
        boolean first = true;
        for (Map.Entry<String, Object> field : p.fields().entrySet()) {
            if (!first) sb.append(',');
            first = false;
            escapeKey(sb, field.getKey());
            sb.append('=');
            appendFieldValue(sb, field.getValue());
        }
        sb.append(' ').append(epochNanos(p.timestamp()));
    }

    private static void appendFieldValue(StringBuilder sb, Object v) {
        if (v instanceof Long) {
            sb.append(((Long) v).longValue()).append('i');
        } else if (v instanceof Double) {
            sb.append(((Double) v).doubleValue());
        } else if (v instanceof Boolean) {
            sb.append(((Boolean) v).booleanValue());
        } else {
            sb.append('"');
            String s = String.valueOf(v);
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (c == '"' || c == '\\') sb.append('\\');
                sb.append(c);
            }
            sb.append('"');
        }
    }

    private static void escapeMeasurement(StringBuilder sb, String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case ',':
                case ' ':
                    sb.append('\\').append(c);
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\\':
                    // a trailing backslash would escape the following separator
                    if (i == s.length() - 1) sb.append('\\');
                    sb.append(c);
                    break;
                default:
                    sb.append(c);
            }
        }
    }

    // tag keys, tag values and field keys
    private static void escapeKey(StringBuilder sb, String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case ',':
                case '=':
                case ' ':
                    sb.append('\\').append(c);
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\\':
                    // a trailing backslash would escape the following separator
                    if (i == s.length() - 1) sb.append('\\');
                    sb.append(c);
                    break;
                default:
                    sb.append(c);
            }
        }
    }
}
