package com.influxlog.collection.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import com.influxlog.record.LogRecord;
import com.influxlog.record.Severity;
import java.util.List;
import java.util.Map;
import org.slf4j.Marker;
import org.slf4j.event.KeyValuePair;

/** Converts Logback events into {@link LogRecord}s. */
public final class LoggingEventRecords {
    public static final String FATAL_MARKER = "FATAL";

    private static final long PID = ProcessHandle.current().pid();

    private LoggingEventRecords() {}

    /**
     * @param callerData whether to resolve file, line and method of the logging call; this walks the
     *     stack and is only accurate on the thread that logged
     */
    public static LogRecord toRecord(ILoggingEvent event, boolean callerData) {
        LogRecord.Builder b = LogRecord.builder()
                .loggerName(event.getLoggerName())
                .severity(severity(event))
                .message(event.getFormattedMessage())
                .createdAt(event.getInstant())
                .threadName(event.getThreadName())
                .processId(PID);

        IThrowableProxy tp = event.getThrowableProxy();
        if (tp != null) b.stackTrace(ThrowableProxyUtil.asString(tp));

        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null) b.extras(mdc);
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        if (pairs != null) {
            for (KeyValuePair kv : pairs) {
                if (kv.key != null) b.extra(kv.key, kv.value);
            }
        }

        if (callerData) {
            StackTraceElement[] cd = event.getCallerData();
            if (cd != null && cd.length > 0) {
                b.fileName(cd[0].getFileName());
                if (cd[0].getLineNumber() >= 0) b.lineNumber(cd[0].getLineNumber());
                b.function(cd[0].getMethodName());
            }
        }
        return b.build();
    }

    static Severity severity(ILoggingEvent event) {
        if (hasFatalMarker(event.getMarkerList())) return Severity.CRITICAL;
        Level level = event.getLevel();
        if (level == null) return Severity.INFO;
        switch (level.toInt()) {
            case Level.ERROR_INT:
                return Severity.ERROR;
            case Level.WARN_INT:
                return Severity.WARNING;
            case Level.INFO_INT:
                return Severity.INFO;
            default:
                return Severity.DEBUG;
        }
    }

    private static boolean hasFatalMarker(List<Marker> markers) {
        if (markers == null) return false;
        for (Marker m : markers) {
            if (m != null && m.contains(FATAL_MARKER)) return true;
        }
        return false;
    }
}
