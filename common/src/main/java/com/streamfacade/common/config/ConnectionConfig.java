/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.streamfacade.common.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.streamfacade.common.util.Durations;
import com.streamfacade.common.util.JsonUtil;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Connection settings, usually read from a JSON file:
 *
 * <pre>
 * {
 *   "servers": ["${NATS_URL:nats://localhost:4222}"],
 *   "connection_name": "order-service",
 *   "connect_timeout": "5s",
 *   "drain_timeout": "30s",
 *   "pull_wait": "1s",
 *   "stream_defaults": { "storage": "FILE", "duplicate_window": "2m" }
 * }
 * </pre>
 *
 * String values may contain placeholders, see {@link ConfigPropertyResolver}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionConfig {

    @JsonProperty("servers")
    private List<String> servers = new ArrayList<>();

    @JsonProperty("connection_name")
    private String connectionName = "streamfacade";

    @JsonProperty("connect_timeout")
    private String connectTimeout = "5s";

    /** Upper bound for waiting on a delivery loop to finish its in-flight message during close. */
    @JsonProperty("drain_timeout")
    private String drainTimeout = "30s";

    /** How long a single pull request waits on the server before it is renewed. */
    @JsonProperty("pull_wait")
    private String pullWait = "1s";

    @JsonProperty("stream_defaults")
    private StreamDefaults streamDefaults = new StreamDefaults();

    public ConnectionConfig() {}

    public static ConnectionConfig defaults() {
        return new ConnectionConfig();
    }

    public static ConnectionConfig load(Path file) {
        return load(file, new ConfigPropertyResolver());
    }

    public static ConnectionConfig load(Path file, ConfigPropertyResolver resolver) {
        return from(JsonUtil.readMap(file), resolver);
    }

    public static ConnectionConfig fromJson(String json) {
        return fromJson(json, new ConfigPropertyResolver());
    }

    public static ConnectionConfig fromJson(String json, ConfigPropertyResolver resolver) {
        return from(JsonUtil.readMap(json), resolver);
    }

    private static ConnectionConfig from(Map<String, Object> raw, ConfigPropertyResolver resolver) {
        resolver.resolveMap(raw);
        ConnectionConfig config = JsonUtil.convert(raw, ConnectionConfig.class);
        if (config.streamDefaults == null) config.streamDefaults = new StreamDefaults();
        // fail early on unparsable durations
        config.connectTimeout();
        config.drainTimeout();
        config.pullWait();
        config.streamDefaults.maxAge();
        config.streamDefaults.duplicateWindow();
        return config;
    }

    public List<String> getServers() { return servers; }
    public void setServers(List<String> servers) { this.servers = servers; }
    public String getConnectionName() { return connectionName; }
    public void setConnectionName(String connectionName) { this.connectionName = connectionName; }
    public String getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(String connectTimeout) { this.connectTimeout = connectTimeout; }
    public String getDrainTimeout() { return drainTimeout; }
    public void setDrainTimeout(String drainTimeout) { this.drainTimeout = drainTimeout; }
    public String getPullWait() { return pullWait; }
    public void setPullWait(String pullWait) { this.pullWait = pullWait; }
    public StreamDefaults getStreamDefaults() { return streamDefaults; }
    public void setStreamDefaults(StreamDefaults streamDefaults) { this.streamDefaults = streamDefaults; }

    @JsonIgnore
    public Duration connectTimeout() { return Durations.parse(connectTimeout, Duration.ofSeconds(5)); }

    @JsonIgnore
    public Duration drainTimeout() { return Durations.parse(drainTimeout, Duration.ofSeconds(30)); }

    @JsonIgnore
    public Duration pullWait() { return Durations.parse(pullWait, Duration.ofSeconds(1)); }
}
