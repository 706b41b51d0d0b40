package com.influxlog.collection.core.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.influxlog.record.LogRecord;
import com.influxlog.record.LoggerNames;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Splits a {@link LogRecord} into measurement, tags, fields and timestamp.
 *
 * <p>Stateless apart from its configuration; the same record always classifies to an equal
 * {@link Classification}. Attribute problems never throw: the attribute is listed in
 * {@link Classification#rejected()} and left out.
 */
public final class RecordClassifier {
    public static final String LEVEL_TAG = "level";
    public static final String LEVEL_NAME_FIELD = "level_name";
    public static final String LOGGER_TAG = "logger";
    public static final String SHORT_MESSAGE_FIELD = "short_message";
    public static final String FULL_MESSAGE_FIELD = "full_message";
    public static final Set<String> RESERVED_KEYS =
            Set.of(LEVEL_TAG, LEVEL_NAME_FIELD, LOGGER_TAG, SHORT_MESSAGE_FIELD, FULL_MESSAGE_FIELD);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ClassificationConfig config;

    public RecordClassifier(ClassificationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ClassificationConfig config() {
        return config;
    }

    public static Classification classify(LogRecord record, ClassificationConfig config) {
        return new RecordClassifier(config).classify(record);
    }

    public Classification classify(LogRecord record) {
        Objects.requireNonNull(record, "record");
        String loggerMeasurement = LoggerNames.toMeasurement(record.loggerName());
        String measurement = config.measurement() != null ? config.measurement() : loggerMeasurement;

        Map<String, String> tags = new LinkedHashMap<>();
        Map<String, Object> fields = new LinkedHashMap<>();
        Map<String, String> rejected = new LinkedHashMap<>();

        tags.put(LEVEL_TAG, record.severity().render(config.levelNames()));
        tags.put(LOGGER_TAG, loggerMeasurement);
        fields.put(LEVEL_NAME_FIELD, record.severity().symbolicName());
        fields.put(SHORT_MESSAGE_FIELD, record.message() == null ? "" : record.message());

        if (config.includeStacktrace() && record.stackTrace() != null) {
            try {
                fields.put(FULL_MESSAGE_FIELD, fullMessage(record));
            } catch (ClassificationException e) {
                rejected.put(e.attribute(), e.getMessage());
            }
        }

        List<Candidate> candidates = candidates(record);
        List<Candidate> untagged = new ArrayList<>(candidates.size());
        for (Candidate c : candidates) {
            try {
                if (!tryTag(c, tags)) untagged.add(c);
            } catch (ClassificationException e) {
                rejected.put(e.attribute(), e.getMessage());
            }
        }
        for (Candidate c : untagged) {
            try {
                tryField(c, tags, fields);
            } catch (ClassificationException e) {
                rejected.put(e.attribute(), e.getMessage());
            }
        }
        return new Classification(measurement, tags, fields, record.createdAt(), rejected);
    }

    private boolean tryTag(Candidate c, Map<String, String> tags) throws ClassificationException {
        if (config.excludeTags().contains(c.name)) return false;
        String key;
        if (config.includeTags().containsKey(c.name)) {
            key = config.includeTags().get(c.name);
        } else if (config.extraTags() && c.extra && isBounded(c.value)) {
            key = c.name;
        } else {
            return false;
        }
        checkKey(c.name, key);
        if (tags.containsKey(key)) throw new ClassificationException(c.name, "tag '" + key + "' already set");
        tags.put(key, tagValue(c.name, c.value));
        return true;
    }

    private void tryField(Candidate c, Map<String, String> tags, Map<String, Object> fields)
            throws ClassificationException {
        if (config.excludeFields().contains(c.name)) return;
        String key;
        if (config.includeFields().containsKey(c.name)) {
            key = config.includeFields().get(c.name);
        } else if (!c.extra || config.extraFields()) {
            key = c.name;
        } else {
            return;
        }
        checkKey(c.name, key);
        if (tags.containsKey(key) || fields.containsKey(key)) {
            throw new ClassificationException(c.name, "key '" + key + "' already set");
        }
        fields.put(key, fieldValue(c.name, c.value));
    }

    private List<Candidate> candidates(LogRecord r) {
        List<Candidate> out = new ArrayList<>();
        if (config.debuggingFields()) {
            addStandard(out, "file", r.fileName());
            addStandard(out, "line", r.lineNumber());
            addStandard(out, "function", r.function());
            addStandard(out, "thread_name", r.threadName());
            addStandard(out, "pid", r.processId());
        }
        addStandard(out, "host", config.localname());
        r.extras().forEach((name, value) -> out.add(new Candidate(name, value, true)));
        return out;
    }

    private static void addStandard(List<Candidate> out, String name, Object value) {
        if (value != null) out.add(new Candidate(name, value, false));
    }

    private String fullMessage(LogRecord r) throws ClassificationException {
        List<String> lines = new ArrayList<>();
        if (r.message() != null && !r.message().isEmpty()) lines.add(r.message());
        for (String line : r.stackTrace().split("\\r?\\n")) {
            if (!line.isBlank()) lines.add(line);
        }
        try {
            return MAPPER.writeValueAsString(lines);
        } catch (JsonProcessingException e) {
            throw new ClassificationException(FULL_MESSAGE_FIELD, "stack trace could not be rendered", e);
        }
    }

    private static void checkKey(String attribute, String key) throws ClassificationException {
        if (key == null || key.isEmpty()) throw new ClassificationException(attribute, "empty key");
        if (RESERVED_KEYS.contains(key)) throw new ClassificationException(attribute, "'" + key + "' is reserved");
    }

    private static boolean isBounded(Object v) {
        return v instanceof Boolean || v instanceof Enum;
    }

    static String tagValue(String attribute, Object v) throws ClassificationException {
        if (v == null) throw new ClassificationException(attribute, "null value");
        String s = v instanceof Enum ? ((Enum<?>) v).name() : stringify(attribute, v);
        if (s.isEmpty()) throw new ClassificationException(attribute, "empty tag value");
        return s;
    }

    static Object fieldValue(String attribute, Object v) throws ClassificationException {
        if (v == null) throw new ClassificationException(attribute, "null value");
        if (v instanceof Boolean) return v;
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof AtomicInteger || v instanceof AtomicLong) return ((Number) v).longValue();
        if (v instanceof BigInteger) {
            BigInteger bi = (BigInteger) v;
            return bi.bitLength() < 64 ? (Object) bi.longValue() : bi.toString();
        }
        if (v instanceof Number) {
            double d = ((Number) v).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ClassificationException(attribute, "non-finite number " + d);
            }
            return d;
        }
        if (v instanceof Enum) return ((Enum<?>) v).name();
        return stringify(attribute, v);
    }

    // toString() is application code
    private static String stringify(String attribute, Object v) throws ClassificationException {
        String s;
        try {
            s = v.toString();
        } catch (RuntimeException e) {
            throw new ClassificationException(attribute, "toString() failed: " + e, e);
        }
        if (s == null) throw new ClassificationException(attribute, "toString() returned null");
        return s;
    }

    private static final class Candidate {
        final String name;
        final Object value;
        final boolean extra;

        Candidate(String name, Object value, boolean extra) {
            this.name = name;
            this.value = value;
            this.extra = extra;
        }
    }
}
