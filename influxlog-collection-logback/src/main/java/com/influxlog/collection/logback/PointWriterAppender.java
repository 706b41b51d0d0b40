package com.influxlog.collection.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import com.influxlog.collection.core.writer.PointWriter;
import java.util.Objects;

/**
 * Feeds events into a {@link PointWriter} owned by someone else, such as a Spring context.
 * Stopping the appender leaves the writer open.
 */
public class PointWriterAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {
    private final PointWriter writer;
    private final boolean callerData;

    public PointWriterAppender(PointWriter writer, boolean callerData) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.callerData = callerData;
    }

    @Override
    protected void append(ILoggingEvent event) {
        if (AbstractInfluxAppender.isOwnEvent(event)) return;
        writer.emit(LoggingEventRecords.toRecord(event, callerData));
    }

    public PointWriter getWriter() {
        return writer;
    }
}
