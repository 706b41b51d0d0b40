package com.influxlog.client.transport.jdkhttp;

import com.influxlog.client.transport.DeliveryException;
import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.point.Point;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

/** JDK11+ HttpClient sender (zero external deps). */
public class JdkHttpPointSender implements PointSender {
    private final StoreOptions options;
    private final HttpClient client;

    public JdkHttpPointSender(StoreOptions options) {
        this.options = options;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(options.connectTimeout())
                .build();
    }

    @Override
    public void write(String database, List<Point> points) throws IOException {
        if (points == null || points.isEmpty()) return;
        HttpRequest.Builder req = HttpRequest.newBuilder(options.writeUri(database))
                .timeout(options.readTimeout())
                .header("Content-Type", CONTENT_TYPE)
                .POST(HttpRequest.BodyPublishers.ofByteArray(PointSender.lineProtocolBody(points)));
        String auth = options.basicAuthorization();
        if (auth != null) req.header("Authorization", auth);
        try {
            HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() / 100 != 2) {
                throw new DeliveryException(
                        "HTTP " + resp.statusCode() + " writing " + points.size() + " points to " + database + ": "
                                + resp.body(),
                        resp.statusCode(),
                        null);
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ie);
        }
    }
}
