package com.influxlog.collection.core.writer;

import com.influxlog.record.LogRecord;
import java.io.Closeable;

/** Delivers log records to the store as points. Implementations never throw from {@link #emit}. */
public interface PointWriter extends Closeable {

    /**
     * Accepts one record.
     *
     * @return {@code false} when the record was dropped or the writer is closed
     */
    boolean emit(LogRecord record);

    /** Writes whatever is pending and waits for it. */
    void flush();

    @Override
    void close();

    String database();
}
