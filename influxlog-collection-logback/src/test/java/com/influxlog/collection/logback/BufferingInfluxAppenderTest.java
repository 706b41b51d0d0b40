package com.influxlog.collection.logback;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.core.util.Duration;
import com.influxlog.client.testkit.InMemoryPointSender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class BufferingInfluxAppenderTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger logger = context.getLogger("buffered.jobs");
    private final InMemoryPointSender sender = new InMemoryPointSender();
    private BufferingInfluxAppender appender;

    @BeforeEach
    void setUp() {
        logger.setLevel(Level.INFO);
        logger.setAdditive(false);
        appender = new BufferingInfluxAppender();
        appender.setContext(context);
        appender.setName("influx-buffered-test");
        appender.setDatabase("logs");
        appender.setSender(sender);
        appender.setBackpop(false);
        appender.setDebuggingFields(false);
        appender.setCapacity(2);
        appender.setFlushInterval(Duration.valueOf("1 hour"));
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAndStopAllAppenders();
    }

    @Test
    void full_buffer_is_written_in_one_batch() throws Exception {
        logger.info("job 1 done");
        logger.info("job 2 done");

        assertThat(sender.awaitBatches(1, java.time.Duration.ofSeconds(5))).isTrue();
        assertThat(sender.batches().get(0).size()).isEqualTo(2);
    }

    @Test
    void flush_writes_a_partial_buffer() {
        logger.info("job 1 done");

        appender.flush();

        assertThat(sender.points()).hasSize(1);
    }

    @Test
    void stop_writes_what_is_left() throws Exception {
        logger.info("job 1 done");
        logger.info("job 2 done");
        logger.info("job 3 done");

        appender.stop();

        assertThat(sender.points()).hasSize(3);
        assertThat(sender.isClosed()).isTrue();
    }
}
