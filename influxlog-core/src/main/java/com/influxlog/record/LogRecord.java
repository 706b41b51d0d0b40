package com.influxlog.record;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One log record as handed over by the host logging framework.
 *
 * <p>Extras are kept in insertion order. Source location and thread data are optional and only
 * surface as attributes when the classifier is asked for debugging fields.
 */
public final class LogRecord {
    private final String loggerName;
    private final Severity severity;
    private final String message;
    private final String stackTrace;
    private final Map<String, Object> extras;
    private final Instant createdAt;
    private final String fileName;
    private final Integer lineNumber;
    private final String function;
    private final String threadName;
    private final Long processId;

    private LogRecord(Builder b) {
        this.loggerName = b.loggerName == null ? "" : b.loggerName;
        this.severity = Objects.requireNonNull(b.severity, "severity");
        this.message = b.message;
        this.stackTrace = b.stackTrace;
        this.extras = Collections.unmodifiableMap(new LinkedHashMap<>(b.extras));
        this.createdAt = b.createdAt == null ? Instant.now() : b.createdAt;
        this.fileName = b.fileName;
        this.lineNumber = b.lineNumber;
        this.function = b.function;
        this.threadName = b.threadName;
        this.processId = b.processId;
    }

    public String loggerName() {
        return loggerName;
    }

    public Severity severity() {
        return severity;
    }

    public String message() {
        return message;
    }

    /** Rendered stack trace, or {@code null} when the record carries no exception. */
    public String stackTrace() {
        return stackTrace;
    }

    public Map<String, Object> extras() {
        return extras;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public String fileName() {
        return fileName;
    }

    public Integer lineNumber() {
        return lineNumber;
    }

    public String function() {
        return function;
    }

    public String threadName() {
        return threadName;
    }

    public Long processId() {
        return processId;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "LogRecord{" + loggerName + " " + severity + " @" + createdAt + ": " + message + "}";
    }

    public static final class Builder {
        private String loggerName;
        private Severity severity = Severity.INFO;
        private String message;
        private String stackTrace;
        private final Map<String, Object> extras = new LinkedHashMap<>();
        private Instant createdAt;
        private String fileName;
        private Integer lineNumber;
        private String function;
        private String threadName;
        private Long processId;

        private Builder() {}

        public Builder loggerName(String loggerName) {
            this.loggerName = loggerName;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder stackTrace(String stackTrace) {
            this.stackTrace = stackTrace;
            return this;
        }

        public Builder thrown(Throwable t) {
            if (t == null) {
                this.stackTrace = null;
                return this;
            }
            StringWriter sw = new StringWriter();
            try (PrintWriter pw = new PrintWriter(sw)) {
                t.printStackTrace(pw);
            }
            this.stackTrace = sw.toString();
            return this;
        }

        public Builder extra(String name, Object value) {
            if (name != null) this.extras.put(name, value);
            return this;
        }

        public Builder extras(Map<String, ?> extras) {
            if (extras != null) extras.forEach(this::extra);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder fileName(String fileName) {
            this.fileName = fileName;
            return this;
        }

        public Builder lineNumber(Integer lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        public Builder processId(Long processId) {
            this.processId = processId;
            return this;
        }

        public LogRecord build() {
            return new LogRecord(this);
        }
    }
}
