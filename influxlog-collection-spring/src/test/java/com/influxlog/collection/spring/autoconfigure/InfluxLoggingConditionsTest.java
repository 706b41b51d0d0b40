package com.influxlog.collection.spring.autoconfigure;

import static org.assertj.core.api.Assertions.assertThat;

import com.influxlog.client.testkit.InMemoryPointSender;
import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.collection.core.writer.ImmediatePointWriter;
import com.influxlog.collection.core.writer.PointWriter;
import com.influxlog.record.LogRecord;
import com.influxlog.record.Severity;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class InfluxLoggingConditionsTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(InfluxLoggingAutoConfiguration.class))
            .withPropertyValues("influxlog.logger=conditions.test");

    @Test
    void nothing_is_installed_without_database() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(InfluxLoggingProperties.class);
            assertThat(ctx).doesNotHaveBean(PointWriter.class);
            assertThat(ctx).doesNotHaveBean(LogbackAppenderInstaller.class);
        });
    }

    @Test
    void disabled_switch_wins_over_database() {
        runner.withPropertyValues("influxlog.enabled=false", "influxlog.database=app_logs")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(PointWriter.class));
    }

    @Test
    void immediate_mode_uses_the_immediate_writer() {
        runner.withPropertyValues(
                        "influxlog.database=app_logs", "influxlog.mode=immediate", "influxlog.lazy-init=true")
                .withBean(PointSender.class, InMemoryPointSender::new)
                .run(ctx -> {
                    assertThat(ctx).getBean(PointWriter.class).isInstanceOf(ImmediatePointWriter.class);
                    assertThat(((ImmediatePointWriter) ctx.getBean(PointWriter.class)).isInitialized())
                            .isFalse();
                });
    }

    @Test
    void lazy_init_defers_creating_the_transport() {
        int before = CountingTransportProvider.CREATED.get();
        runner.withPropertyValues(
                        "influxlog.database=app_logs",
                        "influxlog.mode=immediate",
                        "influxlog.lazy-init=true",
                        "influxlog.store.transport=counting")
                .run(ctx -> {
                    PointWriter writer = ctx.getBean(PointWriter.class);

                    assertThat(CountingTransportProvider.CREATED.get()).isEqualTo(before);

                    writer.emit(LogRecord.builder()
                            .loggerName("orders")
                            .severity(Severity.INFO)
                            .message("first")
                            .build());

                    assertThat(CountingTransportProvider.CREATED.get()).isEqualTo(before + 1);
                });
    }

    @Test
    void buffering_mode_creates_the_transport_at_startup() {
        int before = CountingTransportProvider.CREATED.get();
        runner.withPropertyValues("influxlog.database=app_logs", "influxlog.store.transport=counting")
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed();
                    assertThat(CountingTransportProvider.CREATED.get()).isEqualTo(before + 1);
                });
    }

    @Test
    void store_properties_map_onto_store_options() {
        runner.withPropertyValues(
                        "influxlog.database=app_logs",
                        "influxlog.store.url=https://influx.internal:9999/proxy",
                        "influxlog.store.username=writer",
                        "influxlog.store.password=s3cret",
                        "influxlog.store.retention-policy=weekly",
                        "influxlog.store.read-timeout=750ms")
                .withBean(PointSender.class, InMemoryPointSender::new)
                .run(ctx -> {
                    StoreOptions options = ctx.getBean(StoreOptions.class);
                    assertThat(options.writeUri("app_logs").toString())
                            .isEqualTo("https://influx.internal:9999/proxy/write?db=app_logs&precision=ns&rp=weekly");
                    assertThat(options.readTimeout()).hasMillis(750);
                    assertThat(options.basicAuthorization()).startsWith("Basic ");
                });
    }

    @Test
    void unknown_transport_fails_startup() {
        runner.withPropertyValues("influxlog.database=app_logs", "influxlog.store.transport=carrier-pigeon")
                .run(ctx -> assertThat(ctx).hasFailed());
    }
}
