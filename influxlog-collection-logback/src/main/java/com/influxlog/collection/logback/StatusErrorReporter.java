package com.influxlog.collection.logback;

import ch.qos.logback.core.Context;
import ch.qos.logback.core.status.ErrorStatus;
import com.influxlog.collection.core.writer.ErrorReporter;
import java.util.Objects;
import lombok.RequiredArgsConstructor;

/** Reports writer failures to a Logback context's status manager instead of through a logger. */
@RequiredArgsConstructor
public class StatusErrorReporter implements ErrorReporter {
    private final Context context;
    private final Object origin;

    @Override
    public void report(String message, Throwable error) {
        Objects.requireNonNull(context, "context").getStatusManager().add(new ErrorStatus(message, origin, error));
    }
}
