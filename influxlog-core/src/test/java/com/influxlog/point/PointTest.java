package com.influxlog.point;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PointTest {

    private static final Instant TS = Instant.parse("2024-03-01T10:15:30.123456789Z");

    @Test
    void overlapping_tag_and_field_keys_are_rejected() {
        assertThrows(
                MalformedPointException.class,
                () -> new Point("m", Map.of("level", "3"), Map.of("level", "x"), TS));
    }

    @Test
    void unsupported_field_values_are_rejected() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("short_message", 12);
        assertThrows(MalformedPointException.class, () -> new Point("m", Map.of(), fields, TS));
    }

    @Test
    void blank_measurement_is_rejected() {
        assertThrows(MalformedPointException.class, () -> new Point(" ", Map.of(), Map.of("a", "b"), TS));
    }

    @Test
    void points_are_immutable_and_comparable_by_value() {
        Map<String, String> tags = new HashMap<>(Map.of("level", "6"));
        Point a = new Point("m", tags, Map.of("short_message", "hi"), TS);
        tags.put("extra", "x");

        assertThat(a.tags()).containsOnlyKeys("level");
        assertThat(a).isEqualTo(new Point("m", Map.of("level", "6"), Map.of("short_message", "hi"), TS));
        assertThat(a.withMeasurement("n").measurement()).isEqualTo("n");
        assertThat(a.withMeasurement("n").fields()).isEqualTo(a.fields());
    }
}
