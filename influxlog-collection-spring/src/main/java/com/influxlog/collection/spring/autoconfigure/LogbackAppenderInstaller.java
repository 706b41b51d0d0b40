package com.influxlog.collection.spring.autoconfigure;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.influxlog.collection.core.writer.PointWriter;
import com.influxlog.collection.logback.PointWriterAppender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

/** Attaches a {@link PointWriterAppender} to a Logback logger for the lifetime of the context. */
@Slf4j
@RequiredArgsConstructor
public class LogbackAppenderInstaller implements InitializingBean, DisposableBean {
    static final String APPENDER_NAME = "INFLUXLOG";

    private final PointWriter writer;
    private final String loggerName;
    private final boolean callerData;

    private Logger target;
    private PointWriterAppender appender;

    @Override
    public void afterPropertiesSet() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext)) {
            log.warn("Logback is not the active SLF4J backend ({}); log records will not reach InfluxDB", factory);
            return;
        }
        LoggerContext context = (LoggerContext) factory;
        appender = new PointWriterAppender(writer, callerData);
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.start();
        target = context.getLogger(loggerName);
        target.addAppender(appender);
        log.info("Writing logs of '{}' to InfluxDB database {}", loggerName, writer.database());
    }

    @Override
    public void destroy() {
        if (target == null) return;
        target.detachAppender(appender);
        appender.stop();
        target = null;
    }

    public PointWriterAppender getAppender() {
        return appender;
    }
}
