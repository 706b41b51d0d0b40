package com.influxlog.collection.spring.autoconfigure;

import com.influxlog.client.transport.PointSenders;
import com.influxlog.collection.core.writer.BufferingPointWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for writing application logs to InfluxDB.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * influxlog:
 *   database: app_logs
 *   mode: buffering          # or immediate
 *   include-tags:
 *     tenant: tenant_id
 *   exclude-fields: [secret]
 *   store:
 *     url: https://influx.internal:8086
 *     username: writer
 * }</pre>
 *
 * <p>Nothing is installed until {@code influxlog.database} is set.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "influxlog")
public class InfluxLoggingProperties {

    public enum Mode {
        /** Write on the logging thread, one request per event. */
        IMMEDIATE,
        /** Buffer and write batches from a background thread. */
        BUFFERING
    }

    /** Master switch. */
    private boolean enabled = true;

    private Mode mode = Mode.BUFFERING;

    private String database;

    /** Logger the appender is attached to. */
    private String logger = org.slf4j.Logger.ROOT_LOGGER_NAME;

    /** Fixed measurement for every point; disables backpop. */
    private String measurement;

    private boolean lazyInit;

    /** Attribute name to tag name. */
    private Map<String, String> includeTags = new LinkedHashMap<>();

    /** Attribute name to field name. */
    private Map<String, String> includeFields = new LinkedHashMap<>();

    private List<String> excludeTags = new ArrayList<>();
    private List<String> excludeFields = new ArrayList<>();
    private boolean extraTags = true;
    private boolean extraFields = true;
    private boolean includeStacktrace = true;
    private boolean backpop = true;
    private boolean levelNames;
    private boolean debuggingFields = true;
    private String localname;

    private int capacity = BufferingPointWriter.DEFAULT_CAPACITY;
    private Duration flushInterval = BufferingPointWriter.DEFAULT_FLUSH_INTERVAL;
    private int maxPendingBatches = BufferingPointWriter.DEFAULT_MAX_PENDING_BATCHES;
    private Duration closeTimeout = BufferingPointWriter.DEFAULT_CLOSE_TIMEOUT;

    private final Store store = new Store();

    /** Where and how points are sent; unset values fall back to the transport defaults. */
    @Getter
    @Setter
    public static class Store {
        private String transport = PointSenders.DEFAULT_TRANSPORT;
        private String url;
        private String host;
        private Integer port;
        private Boolean ssl;
        private String path;
        private String username;
        private String password;
        private String retentionPolicy;
        private Duration connectTimeout;
        private Duration readTimeout;
    }
}
