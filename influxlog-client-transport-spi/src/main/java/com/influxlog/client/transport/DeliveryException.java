package com.influxlog.client.transport;

import java.io.IOException;

/** The store was reached but did not accept a batch, or a batch could not be handed to it. */
public class DeliveryException extends IOException {
    private final int statusCode;

    public DeliveryException(String message) {
        this(message, -1, null);
    }

    public DeliveryException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public DeliveryException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status returned by the store, or {@code -1} when there was none. */
    public int statusCode() {
        return statusCode;
    }
}
