package com.influxlog.collection.spring.autoconfigure;

import ch.qos.logback.classic.LoggerContext;
import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.PointSenders;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.collection.core.classify.ClassificationConfig;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.collection.core.writer.BufferingPointWriter;
import com.influxlog.collection.core.writer.ErrorReporter;
import com.influxlog.collection.core.writer.ImmediatePointWriter;
import com.influxlog.collection.core.writer.PointWriter;
import com.influxlog.collection.logback.StatusErrorReporter;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

@AutoConfiguration
@ConditionalOnClass(LoggerContext.class)
@ConditionalOnProperty(prefix = "influxlog", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(InfluxLoggingProperties.class)
public class InfluxLoggingAutoConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "influxlog", name = "database")
    static class WriterConfig {

        @Bean
        @ConditionalOnMissingBean
        public ClassificationConfig influxClassificationConfig(InfluxLoggingProperties p) {
            return ClassificationConfig.builder()
                    .measurement(p.getMeasurement())
                    .includeTags(p.getIncludeTags())
                    .includeFields(p.getIncludeFields())
                    .excludeTags(p.getExcludeTags())
                    .excludeFields(p.getExcludeFields())
                    .extraTags(p.isExtraTags())
                    .extraFields(p.isExtraFields())
                    .includeStacktrace(p.isIncludeStacktrace())
                    .levelNames(p.isLevelNames())
                    .debuggingFields(p.isDebuggingFields())
                    .localname(p.getLocalname())
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public PointFactory influxPointFactory(ClassificationConfig config, InfluxLoggingProperties p) {
            return new PointFactory(config, p.isBackpop());
        }

        @Bean
        @ConditionalOnMissingBean
        public StoreOptions influxStoreOptions(InfluxLoggingProperties p) {
            InfluxLoggingProperties.Store s = p.getStore();
            StoreOptions.Builder b = StoreOptions.defaults().toBuilder();
            if (s.getUrl() != null && !s.getUrl().isBlank()) b.url(s.getUrl());
            if (s.getHost() != null) b.host(s.getHost());
            if (s.getPort() != null) b.port(s.getPort());
            if (s.getSsl() != null) b.ssl(s.getSsl());
            if (s.getPath() != null) b.path(s.getPath());
            if (s.getUsername() != null) b.username(s.getUsername());
            if (s.getPassword() != null) b.password(s.getPassword());
            if (s.getRetentionPolicy() != null) b.retentionPolicy(s.getRetentionPolicy());
            if (s.getConnectTimeout() != null) b.connectTimeout(s.getConnectTimeout());
            if (s.getReadTimeout() != null) b.readTimeout(s.getReadTimeout());
            return b.build();
        }

        // created on first use so lazy-init can defer it; closed by the writer it is handed to
        @Bean(destroyMethod = "")
        @Lazy
        @ConditionalOnMissingBean(PointSender.class)
        public PointSender influxPointSender(StoreOptions options, InfluxLoggingProperties p) {
            return PointSenders.create(p.getStore().getTransport(), options);
        }

        @Bean
        @ConditionalOnMissingBean
        public ErrorReporter influxErrorReporter() {
            ILoggerFactory factory = LoggerFactory.getILoggerFactory();
            if (factory instanceof LoggerContext) {
                return new StatusErrorReporter((LoggerContext) factory, PointWriter.class.getName());
            }
            return ErrorReporter.logging(LoggerFactory.getLogger(PointWriter.class));
        }

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean(PointWriter.class)
        public PointWriter influxPointWriter(
                PointFactory factory,
                ObjectProvider<PointSender> senders,
                ErrorReporter errors,
                InfluxLoggingProperties p) {
            if (p.getMode() == InfluxLoggingProperties.Mode.IMMEDIATE) {
                return new ImmediatePointWriter(
                        factory, p.getDatabase(), () -> senders.getObject(), p.isLazyInit(), errors);
            }
            return BufferingPointWriter.builder()
                    .factory(factory)
                    .sender(senders.getObject())
                    .database(p.getDatabase())
                    .capacity(p.getCapacity())
                    .flushInterval(p.getFlushInterval())
                    .maxPendingBatches(p.getMaxPendingBatches())
                    .closeTimeout(p.getCloseTimeout())
                    .errors(errors)
                    .build();
        }

        @Bean
        @ConditionalOnMissingBean
        public LogbackAppenderInstaller influxAppenderInstaller(PointWriter writer, InfluxLoggingProperties p) {
            return new LogbackAppenderInstaller(writer, p.getLogger(), p.isDebuggingFields());
        }
    }
}
