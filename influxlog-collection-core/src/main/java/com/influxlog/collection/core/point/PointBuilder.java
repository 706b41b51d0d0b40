package com.influxlog.collection.core.point;

import com.influxlog.collection.core.classify.Classification;
import com.influxlog.point.MalformedPointException;
import com.influxlog.point.Point;
import java.time.Instant;
import java.util.Map;

/**
 * Assembles classified records into immutable {@link Point}s.
 *
 * <p>A {@link MalformedPointException} here means classification broke its own guarantees; callers
 * drop the record rather than try to repair it.
 */
public final class PointBuilder {

    public Point build(String measurement, Map<String, String> tags, Map<String, Object> fields, Instant timestamp) {
        return new Point(measurement, tags, fields, timestamp);
    }

    public Point build(Classification classification) {
        return build(
                classification.measurement(),
                classification.tags(),
                classification.fields(),
                classification.timestamp());
    }

    /** Copy of {@code point} attributed to {@code measurement}. */
    public Point relocate(Point point, String measurement) {
        if (measurement == null || measurement.isBlank()) {
            throw new MalformedPointException("cannot relocate " + point.measurement() + " to a blank measurement");
        }
        return point.withMeasurement(measurement);
    }
}
