package com.influxlog.client.transport.apache;

import com.influxlog.client.transport.DeliveryException;
import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.point.Point;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Apache HttpClient 5 sender. */
public class ApachePointSender implements PointSender {
    private static final Logger log = LoggerFactory.getLogger(ApachePointSender.class);
    private static final ContentType LINE_PROTOCOL = ContentType.create("text/plain", "UTF-8");

    private final StoreOptions options;
    private final CloseableHttpClient client;

    public ApachePointSender(StoreOptions options) {
        this.options = options;
        RequestConfig config = RequestConfig.custom()
                .setConnectTimeout(Timeout.of(options.connectTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .setResponseTimeout(Timeout.of(options.readTimeout().toMillis(), TimeUnit.MILLISECONDS))
                .build();
        this.client = HttpClients.custom()
                .setDefaultRequestConfig(config)
                .disableAutomaticRetries()
                .build();
    }

    @Override
    public void write(String database, List<Point> points) throws IOException {
        if (points == null || points.isEmpty()) return;
        HttpPost post = new HttpPost(options.writeUri(database));
        post.setEntity(new ByteArrayEntity(PointSender.lineProtocolBody(points), LINE_PROTOCOL));
        String auth = options.basicAuthorization();
        if (auth != null) post.setHeader("Authorization", auth);
        log.debug("Writing {} points to {}", points.size(), post.getRequestUri());
        client.execute(post, response -> {
            int status = response.getCode();
            String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity());
            if (status / 100 != 2) {
                throw new DeliveryException(
                        "HTTP " + status + " writing " + points.size() + " points to " + database + ": " + body,
                        status,
                        null);
            }
            return null;
        });
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
