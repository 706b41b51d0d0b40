package com.influxlog.client.transport.apache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.influxlog.client.transport.DeliveryException;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.point.Point;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ApachePointSenderTest {

    private static final Point POINT =
            new Point("svc", Map.of("level", "4"), Map.of("short_message", "careful"), Instant.EPOCH);

    private MockWebServer server;
    private ApachePointSender sender;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        sender = new ApachePointSender(StoreOptions.builder()
                .host(server.getHostName())
                .port(server.getPort())
                .path("/proxy/")
                .build());
    }

    @AfterEach
    void tearDown() throws Exception {
        sender.close();
        server.shutdown();
    }

    @Test
    void posts_to_prefixed_write_endpoint() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        sender.write("logs", List.of(POINT));

        RecordedRequest req = server.takeRequest();
        assertThat(req.getPath()).isEqualTo("/proxy/write?db=logs&precision=ns");
        assertThat(req.getBody().readUtf8()).isEqualTo("svc,level=4 short_message=\"careful\" 0\n");
    }

    @Test
    void server_error_is_a_delivery_exception() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        assertThatThrownBy(() -> sender.write("logs", List.of(POINT)))
                .isInstanceOf(DeliveryException.class)
                .hasMessageContaining("503");
    }
}
