package com.influxlog.client.transport.okhttp;

import com.influxlog.client.transport.DeliveryException;
import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.point.Point;
import java.io.IOException;
import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.List;
import okhttp3.Dns;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based sender. */
public class OkHttpPointSender implements PointSender {
    private static final Logger log = LoggerFactory.getLogger(OkHttpPointSender.class);
    private static final MediaType LINE_PROTOCOL = MediaType.parse(CONTENT_TYPE);
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final StoreOptions options;
    private final OkHttpClient client;

    public OkHttpPointSender(StoreOptions options) {
        this.options = options;
        this.client = new OkHttpClient.Builder()
                .dns(PREFER_IPV4_DNS)
                .connectTimeout(options.connectTimeout())
                .readTimeout(options.readTimeout())
                .build();
    }

    @Override
    public void write(String database, List<Point> points) throws IOException {
        if (points == null || points.isEmpty()) return;
        String endpoint = options.writeUri(database).toString();
        Request.Builder req = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(PointSender.lineProtocolBody(points), LINE_PROTOCOL));
        String auth = options.basicAuthorization();
        if (auth != null) req.header("Authorization", auth);
        if (log.isDebugEnabled()) log.debug("Writing {} points to {}", points.size(), endpoint);
        try (Response r = client.newCall(req.build()).execute()) {
            if (!r.isSuccessful()) {
                String responseBody = r.body() != null ? r.body().string() : "";
                throw new DeliveryException(
                        "HTTP " + r.code() + " writing " + points.size() + " points to " + database + ": "
                                + responseBody,
                        r.code(),
                        null);
            }
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
