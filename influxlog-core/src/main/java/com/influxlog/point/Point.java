package com.influxlog.point;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One timestamped observation: measurement, tag set, field set and timestamp.
 *
 * <p>Tags and fields are held in key order, which is also the order line protocol writes them in.
 * Field values are limited to {@link String}, {@link Long}, {@link Double} and {@link Boolean}.
 */
public final class Point {
    private final String measurement;
    private final SortedMap<String, String> tags;
    private final SortedMap<String, Object> fields;
    private final Instant timestamp;

    public Point(String measurement, Map<String, String> tags, Map<String, Object> fields, Instant timestamp) {
        if (measurement == null || measurement.isBlank()) throw new MalformedPointException("measurement is blank");
        this.measurement = measurement;
        this.tags = Collections.unmodifiableSortedMap(new TreeMap<>(tags == null ? Map.of() : tags));
        this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields == null ? Map.of() : fields));
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        if (this.fields.isEmpty()) throw new MalformedPointException("point " + measurement + " has no fields");
        for (String key : this.tags.keySet()) {
            if (this.fields.containsKey(key)) {
                throw new MalformedPointException("key '" + key + "' is both a tag and a field in " + measurement);
            }
        }
        for (Map.Entry<String, Object> e : this.fields.entrySet()) {
            Object v = e.getValue();
            if (!(v instanceof String || v instanceof Long || v instanceof Double || v instanceof Boolean)) {
                throw new MalformedPointException("field '" + e.getKey() + "' has unsupported value type "
                        + (v == null ? "null" : v.getClass().getName()));
            }
        }
    }

    public String measurement() {
        return measurement;
    }

    public SortedMap<String, String> tags() {
        return tags;
    }

    public SortedMap<String, Object> fields() {
        return fields;
    }

    public Instant timestamp() {
        return timestamp;
    }

    /** Same tags, fields and timestamp under another measurement. */
    public Point withMeasurement(String other) {
        return new Point(other, tags, fields, timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Point)) return false;
        Point p = (Point) o;
        return measurement.equals(p.measurement)
                && tags.equals(p.tags)
                && fields.equals(p.fields)
                && timestamp.equals(p.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags, fields, timestamp);
    }

    @Override
    public String toString() {
        return LineProtocol.encode(this);
    }
}
