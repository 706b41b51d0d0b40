package com.influxlog.collection.core.writer;

import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.point.MalformedPointException;
import com.influxlog.point.Point;
import com.influxlog.record.LogRecord;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;

/** Point conversion, counters and error reporting shared by the writers. */
@Slf4j
abstract class AbstractPointWriter implements PointWriter {
    protected final PointFactory factory;
    protected final String database;
    protected final ErrorReporter errors;

    private final LongAdder written = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    AbstractPointWriter(PointFactory factory, String database, ErrorReporter errors) {
        this.factory = Objects.requireNonNull(factory, "factory");
        if (database == null || database.isBlank()) throw new IllegalArgumentException("database is required");
        this.database = database;
        this.errors = errors == null ? ErrorReporter.logging(log) : errors;
    }

    @Override
    public String database() {
        return database;
    }

    public long pointsWritten() {
        return written.sum();
    }

    public long pointsDropped() {
        return dropped.sum();
    }

    /** Points for {@code record}, or {@code null} after reporting why it could not be converted. */
    protected List<Point> pointsFor(LogRecord record) {
        try {
            return factory.toPoints(record);
        } catch (MalformedPointException | IllegalArgumentException e) {
            dropped.increment();
            report("Dropped malformed log record " + record, e);
            return null;
        } catch (RuntimeException e) {
            dropped.increment();
            report("Could not convert log record " + record, e);
            return null;
        }
    }

    protected void recordWritten(int points) {
        written.add(points);
    }

    protected void recordDropped(int points) {
        dropped.add(points);
    }

    protected void report(String message, Throwable error) {
        try {
            errors.report(message, error);
        } catch (RuntimeException reporterFailure) {
            log.warn("Error reporter failed while reporting '{}'", message, reporterFailure);
        }
    }
}
