package com.influxlog.collection.core.writer;

import com.influxlog.client.transport.PointSender;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.point.Point;
import com.influxlog.record.LogRecord;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects points in memory and writes them in batches.
 *
 * <p>A batch is written when the buffer reaches {@code capacity} points or when {@code flushInterval}
 * passes without a flush, whichever comes first. Producers only hold the buffer monitor long enough to
 * append or swap; store I/O happens on a single daemon thread, so batches reach the store in the order
 * they were cut.
 *
 * <p>A capacity flush does not make the producer wait: the full buffer is handed to the flush thread
 * and {@link #emit} returns. At most {@code maxPendingBatches} handed-over batches may wait for that
 * thread; beyond that new batches are dropped and reported. A batch the store rejects is dropped,
 * never re-queued.
 */
@Slf4j
public class BufferingPointWriter extends AbstractPointWriter {
    public static final int DEFAULT_CAPACITY = 64;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_PENDING_BATCHES = 16;
    public static final Duration DEFAULT_CLOSE_TIMEOUT = Duration.ofSeconds(10);
    /** Name of the thread that writes batches; events logged on it are not fed back. */
    public static final String THREAD_NAME = "influxlog-flush";

    public enum State {
        IDLE,
        ACCUMULATING,
        FLUSHING,
        CLOSED
    }

    private final PointSender sender;
    private final int capacity;
    private final Duration flushInterval;
    private final int maxPendingBatches;
    private final Duration closeTimeout;
    private final ScheduledThreadPoolExecutor flusher;

    private final Object lock = new Object();
    private List<Point> buffer; // guarded by lock
    private ScheduledFuture<?> timer; // guarded by lock
    private boolean closed; // guarded by lock
    private volatile Thread flushThread;

    private final AtomicInteger pendingBatches = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final LongAdder flushes = new LongAdder();

    private BufferingPointWriter(Builder b) {
        super(b.factory, b.database, b.errors);
        this.sender = Objects.requireNonNull(b.sender, "sender");
        if (b.capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + b.capacity);
        if (b.flushInterval == null || b.flushInterval.isZero() || b.flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be positive: " + b.flushInterval);
        }
        if (b.maxPendingBatches < 1) {
            throw new IllegalArgumentException("maxPendingBatches must be positive: " + b.maxPendingBatches);
        }
        this.capacity = b.capacity;
        this.flushInterval = b.flushInterval;
        this.maxPendingBatches = b.maxPendingBatches;
        this.closeTimeout = b.closeTimeout == null ? DEFAULT_CLOSE_TIMEOUT : b.closeTimeout;
        this.buffer = new ArrayList<>(capacity);
        this.flusher = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, THREAD_NAME);
            t.setDaemon(true);
            flushThread = t;
            return t;
        });
        // timers are re-armed on every flush; cancelled ones must not pile up in the queue
        flusher.setRemoveOnCancelPolicy(true);
        synchronized (lock) {
            armTimer();
        }
        log.debug(
                "Buffering writer started database={} capacity={} flushInterval={}",
                database,
                capacity,
                flushInterval);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean emit(LogRecord record) {
        if (record == null) return false;
        List<Point> points = pointsFor(record);
        if (points == null) return false;
        synchronized (lock) {
            if (closed) return false;
            buffer.addAll(points);
            if (buffer.size() >= capacity) {
                handOver(swap());
                armTimer();
            }
        }
        return true;
    }

    /** Cuts the current buffer and waits until it, and every batch cut before it, was written or dropped. */
    @Override
    public void flush() {
        if (Thread.currentThread() == flushThread) {
            flushFromTimer();
            return;
        }
        Future<?> done;
        synchronized (lock) {
            if (closed) return;
            List<Point> batch = swap();
            armTimer();
            try {
                done = flusher.submit(() -> deliver(batch));
            } catch (RejectedExecutionException e) {
                drop(batch, "flush thread is not accepting work", e);
                return;
            }
        }
        await(done);
    }

    /**
     * Writes the remaining points, stops the timer and the flush thread, then closes the sender.
     * Emits after this point are ignored.
     */
    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            cancelTimer();
            List<Point> remaining = swap();
            try {
                flusher.execute(() -> deliver(remaining));
            } catch (RejectedExecutionException e) {
                drop(remaining, "flush thread is not accepting work", e);
            }
        }
        flusher.shutdown();
        try {
            if (!flusher.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> abandoned = flusher.shutdownNow();
                report(
                        "Flush thread for " + database + " did not finish within " + closeTimeout + "; "
                                + abandoned.size() + " pending batches abandoned",
                        null);
            }
        } catch (InterruptedException ie) {
            flusher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        try {
            sender.close();
        } catch (IOException e) {
            report("Failed to close point sender for database " + database, e);
        }
        log.debug(
                "Buffering writer closed database={} written={} dropped={}",
                database,
                pointsWritten(),
                pointsDropped());
    }

    public State state() {
        synchronized (lock) {
            if (closed) return State.CLOSED;
            if (inFlight.get() > 0) return State.FLUSHING;
            return buffer.isEmpty() ? State.IDLE : State.ACCUMULATING;
        }
    }

    public int bufferedPoints() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    /** Batches written successfully so far. */
    public long flushCount() {
        return flushes.sum();
    }

    /** Whether the flush thread has stopped for good. */
    public boolean isTerminated() {
        return flusher.isTerminated();
    }

    /** Tasks waiting on the flush thread, timers included. */
    int queuedTasks() {
        return flusher.getQueue().size();
    }

    public int capacity() {
        return capacity;
    }

    public Duration flushInterval() {
        return flushInterval;
    }

    // caller holds lock
    private List<Point> swap() {
        List<Point> batch = buffer;
        buffer = new ArrayList<>(capacity);
        return batch;
    }

    // caller holds lock
    private void handOver(List<Point> batch) {
        if (pendingBatches.incrementAndGet() > maxPendingBatches) {
            pendingBatches.decrementAndGet();
            drop(batch, maxPendingBatches + " batches already waiting for the flush thread", null);
            return;
        }
        try {
            flusher.execute(() -> {
                pendingBatches.decrementAndGet();
                deliver(batch);
            });
        } catch (RejectedExecutionException e) {
            pendingBatches.decrementAndGet();
            drop(batch, "flush thread is not accepting work", e);
        }
    }

    // caller holds lock; restarts the interval so a timer flush never follows right after another flush
    private void armTimer() {
        cancelTimer();
        long millis = flushInterval.toMillis();
        timer = flusher.scheduleWithFixedDelay(this::flushFromTimer, millis, millis, TimeUnit.MILLISECONDS);
    }

    // caller holds lock
    private void cancelTimer() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
    }

    private void flushFromTimer() {
        List<Point> batch;
        synchronized (lock) {
            if (closed || buffer.isEmpty()) return;
            batch = swap();
        }
        deliver(batch);
    }

    private void deliver(List<Point> batch) {
        if (batch.isEmpty()) return;
        inFlight.incrementAndGet();
        try {
            sender.write(database, batch);
            flushes.increment();
            recordWritten(batch.size());
        } catch (IOException | RuntimeException e) {
            recordDropped(batch.size());
            report("Failed to write batch of " + batch.size() + " points to " + database + "; batch dropped", e);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private void drop(List<Point> batch, String reason, Throwable cause) {
        if (batch.isEmpty()) return;
        recordDropped(batch.size());
        report("Dropped batch of " + batch.size() + " points for " + database + ": " + reason, cause);
    }

    private void await(Future<?> done) {
        try {
            done.get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        } catch (TimeoutException e) {
            report("Flush of " + database + " still running after " + closeTimeout, e);
        } catch (ExecutionException e) {
            report("Flush of " + database + " failed", e.getCause());
        }
    }

    public static final class Builder {
        private PointFactory factory;
        private PointSender sender;
        private String database;
        private int capacity = DEFAULT_CAPACITY;
        private Duration flushInterval = DEFAULT_FLUSH_INTERVAL;
        private int maxPendingBatches = DEFAULT_MAX_PENDING_BATCHES;
        private Duration closeTimeout = DEFAULT_CLOSE_TIMEOUT;
        private ErrorReporter errors;

        private Builder() {}

        public Builder factory(PointFactory factory) {
            this.factory = factory;
            return this;
        }

        public Builder sender(PointSender sender) {
            this.sender = sender;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder flushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
            return this;
        }

        public Builder maxPendingBatches(int maxPendingBatches) {
            this.maxPendingBatches = maxPendingBatches;
            return this;
        }

        public Builder closeTimeout(Duration closeTimeout) {
            this.closeTimeout = closeTimeout;
            return this;
        }

        public Builder errors(ErrorReporter errors) {
            this.errors = errors;
            return this;
        }

        public BufferingPointWriter build() {
            return new BufferingPointWriter(this);
        }
    }
}
