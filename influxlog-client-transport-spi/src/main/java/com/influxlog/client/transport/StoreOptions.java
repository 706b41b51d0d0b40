package com.influxlog.client.transport;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Connection options passed through to a {@link PointSender}. The transports only read them; the
 * collection layer never interprets them.
 */
public final class StoreOptions {
    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8086;
    public static final String PROP_URL = "influxlog.store.url";
    public static final String ENV_URL = "INFLUXLOG_STORE_URL";

    private final String host;
    private final int port;
    private final boolean ssl;
    private final String path;
    private final String username;
    private final String password;
    private final String retentionPolicy;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    private StoreOptions(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.ssl = b.ssl;
        this.path = normalizePath(b.path);
        this.username = b.username;
        this.password = b.password;
        this.retentionPolicy = b.retentionPolicy;
        this.connectTimeout = b.connectTimeout;
        this.readTimeout = b.readTimeout;
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public boolean ssl() {
        return ssl;
    }

    public String path() {
        return path;
    }

    public String username() {
        return username;
    }

    public String password() {
        return password;
    }

    public String retentionPolicy() {
        return retentionPolicy;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration readTimeout() {
        return readTimeout;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    /** {@code Basic ...} header value, or {@code null} without credentials. */
    public String basicAuthorization() {
        if (!hasCredentials()) return null;
        String pair = username + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
    }

    /** The {@code /write} endpoint for {@code database} at nanosecond precision. */
    public URI writeUri(String database) {
        if (database == null || database.isBlank()) throw new IllegalArgumentException("database is required");
        StringBuilder sb = new StringBuilder()
                .append(ssl ? "https" : "http")
                .append("://")
                .append(host)
                .append(':')
                .append(port)
                .append(path)
                .append("/write?db=")
                .append(encode(database))
                .append("&precision=ns");
        if (retentionPolicy != null && !retentionPolicy.isBlank()) {
            sb.append("&rp=").append(encode(retentionPolicy));
        }
        return URI.create(sb.toString());
    }

    public Builder toBuilder() {
        return new Builder()
                .host(host)
                .port(port)
                .ssl(ssl)
                .path(path)
                .username(username)
                .password(password)
                .retentionPolicy(retentionPolicy)
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout);
    }

    /** Defaults, overridden by {@value #PROP_URL} or {@value #ENV_URL} when either is set. */
    public static StoreOptions defaults() {
        String sys = System.getProperty(PROP_URL);
        if (sys != null && !sys.isBlank()) return builder().url(sys).build();
        String env = System.getenv(ENV_URL);
        if (env != null && !env.isBlank()) return builder().url(env).build();
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        // credentials deliberately left out
        return "StoreOptions{" + (ssl ? "https" : "http") + "://" + host + ":" + port + path
                + (hasCredentials() ? ", user=" + username : "") + "}";
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String normalizePath(String p) {
        if (p == null || p.isBlank() || "/".equals(p.trim())) return "";
        String t = p.trim();
        if (!t.startsWith("/")) t = "/" + t;
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }

    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private boolean ssl;
        private String path;
        private String username;
        private String password;
        private String retentionPolicy;
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(5);

        private Builder() {}

        /** Sets scheme, host, port and path from a base URL such as {@code https://influx:8086/proxy}. */
        public Builder url(String url) {
            URI uri = URI.create(url.trim());
            if (uri.getHost() == null) throw new IllegalArgumentException("Store URL has no host: " + url);
            this.ssl = "https".equalsIgnoreCase(uri.getScheme());
            this.host = uri.getHost();
            this.port = uri.getPort() > 0 ? uri.getPort() : (ssl ? 443 : DEFAULT_PORT);
            this.path = uri.getPath();
            return this;
        }

        public Builder host(String host) {
            if (host != null && !host.isBlank()) this.host = host.trim();
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder retentionPolicy(String retentionPolicy) {
            this.retentionPolicy = retentionPolicy;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            if (connectTimeout != null) this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            if (readTimeout != null) this.readTimeout = readTimeout;
            return this;
        }

        public StoreOptions build() {
            return new StoreOptions(this);
        }
    }
}
