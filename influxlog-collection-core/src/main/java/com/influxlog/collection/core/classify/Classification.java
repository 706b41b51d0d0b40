package com.influxlog.collection.core.classify;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** Result of classifying one record. {@code rejected} maps skipped attribute names to the reason. */
public final class Classification {
    private final String measurement;
    private final SortedMap<String, String> tags;
    private final SortedMap<String, Object> fields;
    private final Instant timestamp;
    private final Map<String, String> rejected;

    Classification(
            String measurement,
            Map<String, String> tags,
            Map<String, Object> fields,
            Instant timestamp,
            Map<String, String> rejected) {
        this.measurement = measurement;
        this.tags = Collections.unmodifiableSortedMap(new TreeMap<>(tags));
        this.fields = Collections.unmodifiableSortedMap(new TreeMap<>(fields));
        this.timestamp = timestamp;
        this.rejected = Collections.unmodifiableMap(new LinkedHashMap<>(rejected));
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

    public Map<String, String> rejected() {
        return rejected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Classification)) return false;
        Classification c = (Classification) o;
        return measurement.equals(c.measurement)
                && tags.equals(c.tags)
                && fields.equals(c.fields)
                && timestamp.equals(c.timestamp)
                && rejected.equals(c.rejected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measurement, tags, fields, timestamp, rejected);
    }

    @Override
    public String toString() {
        return "Classification{" + measurement + ", tags=" + tags + ", fields=" + fields + ", at " + timestamp
                + (rejected.isEmpty() ? "" : ", rejected=" + rejected) + "}";
    }
}
