package com.influxlog.collection.logback;

import com.influxlog.client.transport.PointSender;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.collection.core.writer.ErrorReporter;
import com.influxlog.collection.core.writer.ImmediatePointWriter;
import com.influxlog.collection.core.writer.PointWriter;
import java.util.function.Supplier;

/**
 * Writes each event to InfluxDB while the logging call waits.
 *
 * <pre>{@code
 * <appender name="INFLUX" class="com.influxlog.collection.logback.InfluxAppender">
 *   <database>app_logs</database>
 *   <host>influx.internal</host>
 *   <includeTags>tenant=tenant_id,region</includeTags>
 * </appender>
 * }</pre>
 */
public class InfluxAppender extends AbstractInfluxAppender {
    private boolean lazyInit;

    @Override
    protected PointWriter createWriter(
            PointFactory factory, String database, Supplier<PointSender> senders, ErrorReporter errors) {
        return new ImmediatePointWriter(factory, database, senders, lazyInit, errors);
    }

    /** Defers connecting to the store until the first event. */
    public void setLazyInit(boolean lazyInit) {
        this.lazyInit = lazyInit;
    }
}
