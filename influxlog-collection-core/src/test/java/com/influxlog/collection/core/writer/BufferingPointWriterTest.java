package com.influxlog.collection.core.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.influxlog.client.testkit.InMemoryPointSender;
import com.influxlog.collection.core.classify.ClassificationConfig;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.point.Point;
import com.influxlog.record.LogRecord;
import com.influxlog.record.Severity;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BufferingPointWriterTest {

    private static final Duration LONG = Duration.ofHours(1);
    private static final Duration WAIT = Duration.ofSeconds(5);

    private final PointFactory factory =
            new PointFactory(ClassificationConfig.builder().debuggingFields(false).build(), false);
    private final InMemoryPointSender sender = new InMemoryPointSender();
    private final List<String> reported = new CopyOnWriteArrayList<>();
    private BufferingPointWriter writer;

    @AfterEach
    void tearDown() {
        if (writer != null) writer.close();
    }

    private BufferingPointWriter writer(int capacity, Duration interval) {
        return writer(BufferingPointWriter.builder().capacity(capacity).flushInterval(interval));
    }

    private BufferingPointWriter writer(BufferingPointWriter.Builder builder) {
        writer = builder.factory(factory)
                .sender(sender)
                .database("logs")
                .errors((message, error) -> reported.add(message))
                .build();
        return writer;
    }

    private static LogRecord record(String seq) {
        return LogRecord.builder()
                .loggerName("orders.api")
                .severity(Severity.INFO)
                .message("order accepted")
                .extra("seq", seq)
                .build();
    }

    @Test
    void reaching_capacity_writes_exactly_one_batch() throws Exception {
        writer(4, LONG);

        for (int i = 0; i < 4; i++) assertThat(writer.emit(record("r" + i))).isTrue();

        assertThat(sender.awaitBatches(1, WAIT)).isTrue();
        assertThat(sender.batches()).singleElement().extracting(InMemoryPointSender.Batch::size).isEqualTo(4);
        assertThat(writer.bufferedPoints()).isZero();
    }

    @Test
    void interval_flushes_a_partial_buffer() throws Exception {
        writer(4, Duration.ofMillis(200));

        for (int i = 0; i < 3; i++) writer.emit(record("r" + i));

        assertThat(sender.awaitBatches(1, WAIT)).isTrue();
        Thread.sleep(500);

        assertThat(sender.batches()).singleElement().satisfies(b -> {
            assertThat(b.size()).isEqualTo(3);
            assertThat(b.database()).isEqualTo("logs");
        });
    }

    @Test
    void nothing_is_written_before_capacity_or_interval() {
        writer(4, LONG);

        writer.emit(record("r0"));

        assertThat(sender.batches()).isEmpty();
        assertThat(writer.bufferedPoints()).isEqualTo(1);
        assertThat(writer.state()).isEqualTo(BufferingPointWriter.State.ACCUMULATING);
    }

    @Test
    void close_writes_remaining_points_and_stops_the_flush_thread() {
        writer(100, LONG);
        for (int i = 0; i < 5; i++) writer.emit(record("r" + i));

        writer.close();

        assertThat(sender.points()).hasSize(5);
        assertThat(writer.bufferedPoints()).isZero();
        assertThat(writer.isTerminated()).isTrue();
        assertThat(writer.state()).isEqualTo(BufferingPointWriter.State.CLOSED);
        assertThat(sender.isClosed()).isTrue();
        assertThat(writer.emit(record("late"))).isFalse();
    }

    @Test
    void close_twice_is_harmless() {
        writer(4, LONG);
        writer.emit(record("r0"));

        writer.close();
        writer.close();

        assertThat(sender.batches()).hasSize(1);
    }

    @Test
    void rejected_batch_is_reported_and_not_resent() throws Exception {
        writer(2, LONG);
        sender.failNext(1);

        writer.emit(record("lost-1"));
        writer.emit(record("lost-2"));
        writer.emit(record("kept-1"));
        writer.emit(record("kept-2"));
        assertThat(sender.awaitBatches(1, WAIT)).isTrue();
        writer.close();

        assertThat(sender.points())
                .extracting(p -> p.fields().get("seq"))
                .containsExactly("kept-1", "kept-2");
        assertThat(sender.failedWrites()).isEqualTo(1);
        assertThat(writer.pointsDropped()).isEqualTo(2);
        assertThat(writer.flushCount()).isEqualTo(1);
        assertThat(reported).anySatisfy(m -> assertThat(m).contains("batch dropped"));
    }

    @Test
    void flush_waits_for_the_batch_to_be_written() {
        writer(100, LONG);
        sender.writeDelay(Duration.ofMillis(200));
        for (int i = 0; i < 3; i++) writer.emit(record("r" + i));

        writer.flush();

        assertThat(sender.batches()).singleElement().extracting(InMemoryPointSender.Batch::size).isEqualTo(3);
        assertThat(writer.bufferedPoints()).isZero();
    }

    @Test
    void emit_during_slow_flush_goes_to_the_fresh_buffer() {
        writer(2, LONG);
        sender.writeDelay(Duration.ofMillis(500));
        writer.emit(record("r0"));
        writer.emit(record("r1"));

        long started = System.nanoTime();
        writer.emit(record("r2"));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMillis).isLessThan(250);
        assertThat(writer.bufferedPoints()).isEqualTo(1);
    }

    @Test
    void batches_beyond_the_backlog_limit_are_dropped() {
        writer(BufferingPointWriter.builder()
                .capacity(1)
                .flushInterval(LONG)
                .maxPendingBatches(1)
                .closeTimeout(WAIT));
        sender.writeDelay(Duration.ofMillis(300));

        for (int i = 0; i < 5; i++) writer.emit(record("r" + i));
        writer.close();

        assertThat(writer.pointsDropped()).isGreaterThanOrEqualTo(3);
        assertThat(writer.pointsWritten() + writer.pointsDropped()).isEqualTo(5);
        assertThat(reported).anySatisfy(m -> assertThat(m).contains("already waiting"));
    }

    @Test
    void concurrent_producers_lose_and_duplicate_nothing() throws Exception {
        writer(BufferingPointWriter.builder()
                .capacity(64)
                .flushInterval(Duration.ofMillis(50))
                .maxPendingBatches(1_000));
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < threads; t++) {
            int id = t;
            pool.execute(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perThread; i++) writer.emit(record(id + "-" + i));
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        writer.close();

        List<Object> seqs =
                sender.points().stream().map(p -> p.fields().get("seq")).collect(Collectors.toList());
        assertThat(seqs).hasSize(threads * perThread).doesNotHaveDuplicates();
        assertThat(sender.batches()).allSatisfy(b -> assertThat(b.size()).isLessThanOrEqualTo(64));
        assertThat(writer.pointsDropped()).isZero();
    }

    @Test
    void rearmed_timers_do_not_pile_up() throws Exception {
        writer(1, LONG);

        for (int i = 0; i < 50; i++) writer.emit(record("r" + i));
        assertThat(sender.awaitBatches(50, WAIT)).isTrue();

        assertThat(writer.queuedTasks()).isLessThanOrEqualTo(2);
    }

    @Test
    void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> writer(0, LONG));
        assertThrows(IllegalArgumentException.class, () -> writer(4, Duration.ZERO));
        assertThrows(
                IllegalArgumentException.class,
                () -> BufferingPointWriter.builder()
                        .factory(factory)
                        .sender(sender)
                        .capacity(4)
                        .build());
    }

    @Test
    void every_point_keeps_its_measurement() {
        writer(2, LONG);
        writer.emit(record("r0"));
        writer.emit(record("r1"));
        writer.close();

        assertThat(sender.points()).extracting(Point::measurement).containsOnly("orders:api");
    }
}
