package com.influxlog.collection.core.classify;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides how record attributes are split into tags and fields. Supplied once, immutable.
 *
 * <h3>Precedence</h3>
 * <ul>
 *   <li>Explicit includes win over the {@code extra*} auto flags.</li>
 *   <li>An exclude only suppresses the classification it names; an attribute in both exclude sets is
 *       never emitted.</li>
 *   <li>An attribute that qualifies as a tag is never also a field.</li>
 * </ul>
 */
public final class ClassificationConfig {
    private final String measurement;
    private final Map<String, String> includeTags;
    private final Map<String, String> includeFields;
    private final Set<String> excludeTags;
    private final Set<String> excludeFields;
    private final boolean extraTags;
    private final boolean extraFields;
    private final boolean includeStacktrace;
    private final boolean levelNames;
    private final boolean debuggingFields;
    private final String localname;

    private ClassificationConfig(Builder b) {
        this.measurement = (b.measurement == null || b.measurement.isBlank()) ? null : b.measurement;
        this.includeTags = Collections.unmodifiableMap(new LinkedHashMap<>(b.includeTags));
        this.includeFields = Collections.unmodifiableMap(new LinkedHashMap<>(b.includeFields));
        this.excludeTags = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludeTags));
        this.excludeFields = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludeFields));
        this.extraTags = b.extraTags;
        this.extraFields = b.extraFields;
        this.includeStacktrace = b.includeStacktrace;
        this.levelNames = b.levelNames;
        this.debuggingFields = b.debuggingFields;
        this.localname = (b.localname == null || b.localname.isBlank()) ? null : b.localname;
    }

    /** Measurement override, or {@code null} to derive it from the logger name. */
    public String measurement() {
        return measurement;
    }

    public Map<String, String> includeTags() {
        return includeTags;
    }

    public Map<String, String> includeFields() {
        return includeFields;
    }

    public Set<String> excludeTags() {
        return excludeTags;
    }

    public Set<String> excludeFields() {
        return excludeFields;
    }

    /** Tag extras of bounded cardinality ({@link Boolean}, {@link Enum}) that no include mentions. */
    public boolean extraTags() {
        return extraTags;
    }

    /** Emit extras that no include mentions as fields. */
    public boolean extraFields() {
        return extraFields;
    }

    public boolean includeStacktrace() {
        return includeStacktrace;
    }

    public boolean levelNames() {
        return levelNames;
    }

    /** Add source file, line, function, thread name and pid as attributes. */
    public boolean debuggingFields() {
        return debuggingFields;
    }

    /** Value of the {@code host} attribute, or {@code null} for none. */
    public String localname() {
        return localname;
    }

    public static ClassificationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String measurement;
        private final Map<String, String> includeTags = new LinkedHashMap<>();
        private final Map<String, String> includeFields = new LinkedHashMap<>();
        private final Set<String> excludeTags = new LinkedHashSet<>();
        private final Set<String> excludeFields = new LinkedHashSet<>();
        private boolean extraTags = true;
        private boolean extraFields = true;
        private boolean includeStacktrace = true;
        private boolean levelNames;
        private boolean debuggingFields = true;
        private String localname;

        private Builder() {}

        public Builder measurement(String measurement) {
            this.measurement = measurement;
            return this;
        }

        /** Emit {@code attribute} as tag {@code tagName}. */
        public Builder includeTag(String attribute, String tagName) {
            includeTags.put(attribute, tagName == null || tagName.isBlank() ? attribute : tagName);
            return this;
        }

        public Builder includeTags(Map<String, String> mapping) {
            if (mapping != null) mapping.forEach(this::includeTag);
            return this;
        }

        /** Shorthand for tags that keep the attribute's name. */
        public Builder includeTags(Collection<String> attributes) {
            if (attributes != null) attributes.forEach(a -> includeTag(a, a));
            return this;
        }

        /** Emit {@code attribute} as field {@code fieldName}. */
        public Builder includeField(String attribute, String fieldName) {
            includeFields.put(attribute, fieldName == null || fieldName.isBlank() ? attribute : fieldName);
            return this;
        }

        public Builder includeFields(Map<String, String> mapping) {
            if (mapping != null) mapping.forEach(this::includeField);
            return this;
        }

        public Builder excludeTag(String attribute) {
            excludeTags.add(attribute);
            return this;
        }

        public Builder excludeTags(Collection<String> attributes) {
            if (attributes != null) excludeTags.addAll(attributes);
            return this;
        }

        public Builder excludeField(String attribute) {
            excludeFields.add(attribute);
            return this;
        }

        public Builder excludeFields(Collection<String> attributes) {
            if (attributes != null) excludeFields.addAll(attributes);
            return this;
        }

        public Builder extraTags(boolean extraTags) {
            this.extraTags = extraTags;
            return this;
        }

        public Builder extraFields(boolean extraFields) {
            this.extraFields = extraFields;
            return this;
        }

        public Builder includeStacktrace(boolean includeStacktrace) {
            this.includeStacktrace = includeStacktrace;
            return this;
        }

        public Builder levelNames(boolean levelNames) {
            this.levelNames = levelNames;
            return this;
        }

        public Builder debuggingFields(boolean debuggingFields) {
            this.debuggingFields = debuggingFields;
            return this;
        }

        public Builder localname(String localname) {
            this.localname = localname;
            return this;
        }

        public ClassificationConfig build() {
            return new ClassificationConfig(this);
        }
    }
}
