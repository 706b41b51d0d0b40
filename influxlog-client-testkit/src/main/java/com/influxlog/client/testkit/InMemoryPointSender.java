package com.influxlog.client.testkit;

import com.influxlog.client.transport.DeliveryException;
import com.influxlog.client.transport.PointSender;
import com.influxlog.point.Point;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double that records written batches in memory.
 *
 * <p>Failures can be queued with {@link #failNext(int)} or switched on with {@link #failAll(boolean)};
 * a failed write is counted but its batch is not recorded.
 */
public class InMemoryPointSender implements PointSender {
    private final List<Batch> batches = new ArrayList<>();
    private final AtomicInteger failuresPending = new AtomicInteger();
    private final AtomicBoolean failAll = new AtomicBoolean();
    private final AtomicInteger failedWrites = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Duration writeDelay = Duration.ZERO;

    @Override
    public void write(String database, List<Point> points) throws IOException {
        sleep(writeDelay);
        if (failAll.get() || failuresPending.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            failedWrites.incrementAndGet();
            throw new DeliveryException("simulated store failure for " + points.size() + " points");
        }
        synchronized (batches) {
            batches.add(new Batch(database, List.copyOf(points)));
            batches.notifyAll();
        }
    }

    public List<Batch> batches() {
        synchronized (batches) {
            return List.copyOf(batches);
        }
    }

    public List<Point> points() {
        List<Point> all = new ArrayList<>();
        for (Batch b : batches()) all.addAll(b.points());
        return all;
    }

    /** Blocks until at least {@code count} batches were recorded; returns whether that happened in time. */
    public boolean awaitBatches(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (batches) {
            while (batches.size() < count) {
                long left = deadline - System.nanoTime();
                if (left <= 0) return false;
                TimeUnit.NANOSECONDS.timedWait(batches, left);
            }
            return true;
        }
    }

    public void failNext(int writes) {
        failuresPending.set(writes);
    }

    public void failAll(boolean fail) {
        failAll.set(fail);
    }

    public int failedWrites() {
        return failedWrites.get();
    }

    /** Makes every write take at least {@code delay}, to keep a flush in flight. */
    public void writeDelay(Duration delay) {
        this.writeDelay = delay == null ? Duration.ZERO : delay;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void clear() {
        synchronized (batches) {
            batches.clear();
        }
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private static void sleep(Duration d) throws IOException {
        if (d.isZero() || d.isNegative()) return;
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ie);
        }
    }

    public record Batch(String database, List<Point> points) {
        public int size() {
            return points.size();
        }
    }
}
