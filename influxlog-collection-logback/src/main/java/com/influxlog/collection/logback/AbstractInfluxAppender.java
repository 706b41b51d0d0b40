package com.influxlog.collection.logback;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import ch.qos.logback.core.util.Duration;
import com.influxlog.client.transport.PointSender;
import com.influxlog.client.transport.PointSenders;
import com.influxlog.client.transport.StoreOptions;
import com.influxlog.collection.core.classify.ClassificationConfig;
import com.influxlog.collection.core.point.PointFactory;
import com.influxlog.collection.core.writer.BufferingPointWriter;
import com.influxlog.collection.core.writer.ErrorReporter;
import com.influxlog.collection.core.writer.PointWriter;
import java.util.function.Supplier;

/**
 * Settings and lifecycle shared by the InfluxDB appenders.
 *
 * <p>Every setter is reachable from {@code logback.xml}; mappings are written as
 * {@code attr=name,attr2=name2} and sets as comma-separated names. Store settings that are not given
 * fall back to {@link StoreOptions#defaults()}. Failures are reported on the Logback status channel.
 */
public abstract class AbstractInfluxAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {
    /**
     * Events from this library's own loggers, or logged on the flush thread by a transport's HTTP
     * client, are not written, so a write never feeds itself.
     */
    static final String OWN_LOGGER_PREFIX = "com.influxlog.";

    private String database;
    private String measurement;
    private String includeTags;
    private String includeFields;
    private String excludeTags;
    private String excludeFields;
    private boolean extraTags = true;
    private boolean extraFields = true;
    private boolean includeStacktrace = true;
    private boolean backpop = true;
    private boolean levelNames;
    private boolean debuggingFields = true;
    private String localname;

    private String transport = PointSenders.DEFAULT_TRANSPORT;
    private String url;
    private String host;
    private int port;
    private Boolean ssl;
    private String path;
    private String username;
    private String password;
    private String retentionPolicy;
    private Duration connectTimeout;
    private Duration readTimeout;
    private PointSender sender;

    private volatile PointWriter writer;

    @Override
    public void start() {
        if (isStarted()) return;
        if (database == null || database.isBlank()) {
            addError("No database set for appender [" + name + "]");
            return;
        }
        try {
            PointFactory factory = new PointFactory(classificationConfig(), backpop);
            writer = createWriter(factory, database, senderSupplier(), this::addError);
        } catch (RuntimeException e) {
            addError("Could not start appender [" + name + "]", e);
            return;
        }
        super.start();
        addInfo("Writing log records to database " + database + " via "
                + (sender != null ? sender.getClass().getSimpleName() : transport));
    }

    @Override
    public void stop() {
        if (!isStarted()) return;
        super.stop();
        PointWriter w = writer;
        writer = null;
        if (w == null) return;
        w.close();
    }

    @Override
    protected void append(ILoggingEvent event) {
        PointWriter w = writer;
        if (w == null || isOwnEvent(event)) return;
        w.emit(LoggingEventRecords.toRecord(event, debuggingFields));
    }

    /** Builds the writer once settings are validated; called from {@link #start()}. */
    protected abstract PointWriter createWriter(
            PointFactory factory, String database, Supplier<PointSender> senders, ErrorReporter errors);

    protected PointWriter writer() {
        return writer;
    }

    static boolean isOwnEvent(ILoggingEvent event) {
        if (BufferingPointWriter.THREAD_NAME.equals(event.getThreadName())) return true;
        String logger = event.getLoggerName();
        return logger != null && logger.startsWith(OWN_LOGGER_PREFIX);
    }

    ClassificationConfig classificationConfig() {
        return ClassificationConfig.builder()
                .measurement(measurement)
                .includeTags(ConfigStrings.mapping(includeTags))
                .includeFields(ConfigStrings.mapping(includeFields))
                .excludeTags(ConfigStrings.list(excludeTags))
                .excludeFields(ConfigStrings.list(excludeFields))
                .extraTags(extraTags)
                .extraFields(extraFields)
                .includeStacktrace(includeStacktrace)
                .levelNames(levelNames)
                .debuggingFields(debuggingFields)
                .localname(localname)
                .build();
    }

    StoreOptions storeOptions() {
        StoreOptions.Builder b = StoreOptions.defaults().toBuilder();
        if (url != null && !url.isBlank()) b.url(url);
        if (host != null && !host.isBlank()) b.host(host);
        if (port > 0) b.port(port);
        if (ssl != null) b.ssl(ssl);
        if (path != null) b.path(path);
        if (username != null) b.username(username);
        if (password != null) b.password(password);
        if (retentionPolicy != null) b.retentionPolicy(retentionPolicy);
        if (connectTimeout != null) b.connectTimeout(java.time.Duration.ofMillis(connectTimeout.getMilliseconds()));
        if (readTimeout != null) b.readTimeout(java.time.Duration.ofMillis(readTimeout.getMilliseconds()));
        return b.build();
    }

    private Supplier<PointSender> senderSupplier() {
        PointSender provided = sender;
        if (provided != null) return () -> provided;
        String name = transport;
        StoreOptions options = storeOptions();
        return () -> PointSenders.create(name, options);
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public void setMeasurement(String measurement) {
        this.measurement = measurement;
    }

    public void setIncludeTags(String includeTags) {
        this.includeTags = includeTags;
    }

    public void setIncludeFields(String includeFields) {
        this.includeFields = includeFields;
    }

    public void setExcludeTags(String excludeTags) {
        this.excludeTags = excludeTags;
    }

    public void setExcludeFields(String excludeFields) {
        this.excludeFields = excludeFields;
    }

    public void setExtraTags(boolean extraTags) {
        this.extraTags = extraTags;
    }

    public void setExtraFields(boolean extraFields) {
        this.extraFields = extraFields;
    }

    public void setIncludeStacktrace(boolean includeStacktrace) {
        this.includeStacktrace = includeStacktrace;
    }

    public boolean isBackpop() {
        return backpop;
    }

    public void setBackpop(boolean backpop) {
        this.backpop = backpop;
    }

    public void setLevelNames(boolean levelNames) {
        this.levelNames = levelNames;
    }

    public void setDebuggingFields(boolean debuggingFields) {
        this.debuggingFields = debuggingFields;
    }

    public void setLocalname(String localname) {
        this.localname = localname;
    }

    public void setTransport(String transport) {
        this.transport = transport;
    }

    /** Base URL of the store, e.g. {@code https://influx.internal:8086}; host and port settings win. */
    public void setUrl(String url) {
        this.url = url;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public void setSsl(boolean ssl) {
        this.ssl = ssl;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public void setRetentionPolicy(String retentionPolicy) {
        this.retentionPolicy = retentionPolicy;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    /** Uses {@code sender} instead of looking up {@link #setTransport(String) transport}. */
    public void setSender(PointSender sender) {
        this.sender = sender;
    }
}
