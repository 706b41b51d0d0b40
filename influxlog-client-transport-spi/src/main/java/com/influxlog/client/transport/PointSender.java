package com.influxlog.client.transport;

import com.influxlog.point.LineProtocol;
import com.influxlog.point.Point;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Minimal transport SPI: write one batch of points to a database of the time-series store.
 */
public interface PointSender extends Closeable {
    String CONTENT_TYPE = "text/plain; charset=utf-8";

    /**
     * Writes {@code points} to {@code database} in one request.
     *
     * @throws DeliveryException when the store rejects the batch
     * @throws IOException when the store cannot be reached
     */
    void write(String database, List<Point> points) throws IOException;

    @Override
    default void close() throws IOException {
        /* no-op */
    }

    static byte[] lineProtocolBody(List<Point> points) {
        return LineProtocol.encode(points).getBytes(StandardCharsets.UTF_8);
    }
}
