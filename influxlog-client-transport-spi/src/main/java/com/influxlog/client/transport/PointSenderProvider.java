package com.influxlog.client.transport;

/**
 * Factory for a named {@link PointSender}; implementations are registered in
 * {@code META-INF/services/com.influxlog.client.transport.PointSenderProvider}.
 */
public interface PointSenderProvider {

    /** Short transport name used in configuration, e.g. {@code jdkhttp}. */
    String name();

    PointSender create(StoreOptions options);
}
