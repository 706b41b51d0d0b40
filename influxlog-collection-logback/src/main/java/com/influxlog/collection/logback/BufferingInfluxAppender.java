package com.influxlog.collection.logback;

import ch.qos.logback.core.util.Duration;
import com.influxlog.client.transport.PointSender;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.collection.core.writer.BufferingPointWriter;
import com.influxlog.collection.core.writer.ErrorReporter;
import com.influxlog.collection.core.writer.PointWriter;
import java.util.function.Supplier;

/**
 * Buffers events and writes them in batches from a background thread.
 *
 * <p>A batch goes out when {@code capacity} points are buffered or {@code flushInterval} elapsed.
 * Stopping the appender writes whatever is left.
 */
public class BufferingInfluxAppender extends AbstractInfluxAppender {
    private int capacity = BufferingPointWriter.DEFAULT_CAPACITY;
    private Duration flushInterval = Duration.buildBySeconds(BufferingPointWriter.DEFAULT_FLUSH_INTERVAL.getSeconds());
    private int maxPendingBatches = BufferingPointWriter.DEFAULT_MAX_PENDING_BATCHES;
    private Duration closeTimeout = Duration.buildBySeconds(BufferingPointWriter.DEFAULT_CLOSE_TIMEOUT.getSeconds());

    @Override
    protected PointWriter createWriter(
            PointFactory factory, String database, Supplier<PointSender> senders, ErrorReporter errors) {
        return BufferingPointWriter.builder()
                .factory(factory)
                .sender(senders.get())
                .database(database)
                .capacity(capacity)
                .flushInterval(java.time.Duration.ofMillis(flushInterval.getMilliseconds()))
                .maxPendingBatches(maxPendingBatches)
                .closeTimeout(java.time.Duration.ofMillis(closeTimeout.getMilliseconds()))
                .errors(errors)
                .build();
    }

    /** Writes buffered points now and waits for the write. */
    public void flush() {
        PointWriter w = writer();
        if (w != null) w.flush();
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public void setFlushInterval(Duration flushInterval) {
        this.flushInterval = flushInterval;
    }

    public void setMaxPendingBatches(int maxPendingBatches) {
        this.maxPendingBatches = maxPendingBatches;
    }

    public void setCloseTimeout(Duration closeTimeout) {
        this.closeTimeout = closeTimeout;
    }
}
