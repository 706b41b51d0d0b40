package com.influxlog.collection.core.writer;

import com.influxlog.client.transport.PointSender;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.point.Point;
import com.influxlog.record.LogRecord;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every record as soon as it is emitted, on the calling thread.
 *
 * <p>With {@code lazyInit} the sender is created by the first {@link #emit}; a failed creation is
 * reported and attempted again on the next record.
 */
@Slf4j
public class ImmediatePointWriter extends AbstractPointWriter {
    private final Supplier<? extends PointSender> senderFactory;
    private final Object initLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile PointSender sender;

    public ImmediatePointWriter(
            PointFactory factory,
            String database,
            Supplier<? extends PointSender> senderFactory,
            boolean lazyInit,
            ErrorReporter errors) {
        super(factory, database, errors);
        this.senderFactory = Objects.requireNonNull(senderFactory, "senderFactory");
        if (!lazyInit) sender();
    }

    public ImmediatePointWriter(PointFactory factory, String database, PointSender sender, ErrorReporter errors) {
        this(factory, database, () -> sender, false, errors);
    }

    @Override
    public boolean emit(LogRecord record) {
        if (closed.get() || record == null) return false;
        List<Point> points = pointsFor(record);
        if (points == null) return false;

        PointSender s;
        try {
            s = sender();
        } catch (RuntimeException e) {
            recordDropped(points.size());
            report("Could not connect point sender for database " + database, e);
            return false;
        }
        try {
            s.write(database, points);
            recordWritten(points.size());
            return true;
        } catch (IOException | RuntimeException e) {
            recordDropped(points.size());
            report("Failed to write " + points.size() + " points to " + database, e);
            return false;
        }
    }

    /** Nothing is held back, so there is nothing to flush. */
    @Override
    public void flush() {}

    public boolean isInitialized() {
        return sender != null;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        PointSender s = sender;
        if (s == null) return;
        try {
            s.close();
        } catch (IOException e) {
            report("Failed to close point sender for database " + database, e);
        }
    }

    private PointSender sender() {
        PointSender s = sender;
        if (s != null) return s;
        synchronized (initLock) {
            if (sender == null) {
                sender = Objects.requireNonNull(senderFactory.get(), "point sender factory returned null");
                log.debug("Point sender ready for database {}: {}", database, sender.getClass().getSimpleName());
            }
            return sender;
        }
    }
}
