package com.influxlog.collection.logback;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.core.status.Status;
import com.influxlog.client.testkit.InMemoryPointSender;
import com.influxlog.collection.core.writer.BufferingPointWriter;
import com.influxlog.point.Point;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class InfluxAppenderTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger logger = context.getLogger("appender.test.orders");
    private final InMemoryPointSender sender = new InMemoryPointSender();
    private InfluxAppender appender;

    @BeforeEach
    void setUp() {
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
        appender = new InfluxAppender();
        appender.setContext(context);
        appender.setName("influx-test");
        appender.setDatabase("logs");
        appender.setDebuggingFields(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAndStopAllAppenders();
    }

    private void attach() {
        appender.start();
        logger.addAppender(appender);
    }

    private List<Status> errorsFrom(Object origin) {
        return context.getStatusManager().getCopyOfStatusList().stream()
                .filter(s -> s.getOrigin() == origin && s.getLevel() == Status.ERROR)
                .collect(Collectors.toList());
    }

    @Test
    void writes_event_as_classified_points_with_backpop() {
        appender.setSender(sender);
        attach();

        logger.atInfo()
                .addKeyValue("order_id", 17L)
                .addKeyValue("priority", true)
                .log("order {} placed", 17);

        assertThat(sender.batches()).hasSize(1);
        assertThat(sender.points())
                .extracting(Point::measurement)
                .containsExactly("appender:test:orders", "appender:test", "appender");
        Point p = sender.points().get(0);
        assertThat(p.tags())
                .containsEntry("level", "6")
                .containsEntry("logger", "appender:test:orders")
                .containsEntry("priority", "true");
        assertThat(p.fields()).containsEntry("order_id", 17L).containsEntry("short_message", "order 17 placed");
    }

    @Test
    void measurement_override_writes_one_point() {
        appender.setSender(sender);
        appender.setMeasurement("app");
        attach();

        logger.warn("slow query");

        assertThat(sender.points()).extracting(Point::measurement).containsExactly("app");
    }

    @Test
    void does_not_start_without_database() {
        appender.setDatabase(" ");
        appender.setSender(sender);

        appender.start();

        assertThat(appender.isStarted()).isFalse();
        assertThat(errorsFrom(appender)).anySatisfy(s -> assertThat(s.getMessage()).contains("No database"));
    }

    @Test
    void store_failure_goes_to_status_channel_not_to_caller() {
        sender.failAll(true);
        appender.setSender(sender);
        attach();

        assertThatCode(() -> logger.error("payment failed", new IllegalStateException("declined")))
                .doesNotThrowAnyException();

        assertThat(sender.batches()).isEmpty();
        assertThat(errorsFrom(appender)).anySatisfy(s -> assertThat(s.getMessage()).contains("Failed to write"));
    }

    @Test
    void lazy_init_looks_up_transport_on_first_event() {
        MemoryTransportProvider.SENDER.clear();
        int before = MemoryTransportProvider.CREATED.get();
        appender.setTransport("memory");
        appender.setLazyInit(true);
        attach();

        assertThat(MemoryTransportProvider.CREATED.get()).isEqualTo(before);

        logger.info("first");
        logger.info("second");

        assertThat(MemoryTransportProvider.CREATED.get()).isEqualTo(before + 1);
        assertThat(MemoryTransportProvider.SENDER.batches()).hasSize(2);
    }

    @Test
    void unknown_transport_is_reported() {
        appender.setTransport("carrier-pigeon");
        appender.setLazyInit(true);
        attach();

        logger.info("lost");

        assertThat(errorsFrom(appender)).anySatisfy(s -> assertThat(s.getMessage()).contains("Could not connect"));
    }

    @Test
    void events_from_own_loggers_are_ignored() {
        appender.setSender(sender);
        appender.start();
        Logger own = context.getLogger("com.influxlog.client.transport.okhttp.OkHttpPointSender");

        appender.doAppend(new LoggingEvent(Logger.class.getName(), own, Level.INFO, "posted", null, null));

        assertThat(sender.batches()).isEmpty();
        appender.stop();
    }

    @Test
    void events_logged_on_the_flush_thread_are_ignored() {
        appender.setSender(sender);
        appender.start();
        Logger httpClient = context.getLogger("org.apache.hc.client5.http.headers");
        LoggingEvent e =
                new LoggingEvent(Logger.class.getName(), httpClient, Level.DEBUG, ">> POST /write", null, null);
        e.setThreadName(BufferingPointWriter.THREAD_NAME);

        appender.doAppend(e);

        assertThat(sender.batches()).isEmpty();
        appender.stop();
    }

    @Test
    void stop_closes_the_sender() {
        appender.setSender(sender);
        attach();

        appender.stop();

        assertThat(sender.isClosed()).isTrue();
        assertThat(appender.isStarted()).isFalse();
    }

    @Test
    void store_settings_fall_back_to_defaults() {
        appender.setHost("influx.internal");
        appender.setUsername("writer");
        appender.setPassword("s3cret");
        appender.setRetentionPolicy("weekly");

        assertThat(appender.storeOptions().host()).isEqualTo("influx.internal");
        assertThat(appender.storeOptions().writeUri("logs").toString()).contains("rp=weekly");
        assertThat(appender.storeOptions().basicAuthorization()).startsWith("Basic ");
    }
}
