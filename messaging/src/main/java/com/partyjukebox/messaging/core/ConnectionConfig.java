/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import com.partyjukebox.common.model.ClientRole;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable connection settings for one realtime client.
 *
 * <p>Settings are read from a flat {@code Map<String, Object>} with snake_case keys,
 * the same shape the broker layer accepts in {@code initialize(Map)}. Durations accept
 * a plain number of milliseconds or a suffixed string ({@code "500ms"}, {@code "30s"},
 * {@code "5m"}, {@code "PT30S"}).</p>
 *
 * <h3>Role defaults</h3>
 * <p>The display and controller surfaces share one implementation and differ only in
 * defaults: the controller backs off more gently, retries longer, tolerates slower
 * heartbeats, and adds a flat delay to reconnects while the device is backgrounded.</p>
 */
public final class ConnectionConfig {

    public static final String URL = "url";
    public static final String CLIENT_ROLE = "client_role";
    public static final String RECONNECT_INTERVAL = "reconnect_interval_ms";
    public static final String MAX_RECONNECT_INTERVAL = "max_reconnect_interval_ms";
    public static final String RECONNECT_BACKOFF_FACTOR = "reconnect_backoff_factor";
    public static final String MAX_RECONNECT_ATTEMPTS = "max_reconnect_attempts";
    public static final String HEARTBEAT_INTERVAL = "heartbeat_interval_ms";
    public static final String HEARTBEAT_TIMEOUT_MULTIPLIER = "heartbeat_timeout_multiplier";
    public static final String BACKGROUND_HEARTBEAT_TIMEOUT_MULTIPLIER = "background_heartbeat_timeout_multiplier";
    public static final String HEARTBEAT_ON_ANY_MESSAGE = "heartbeat_on_any_message";
    public static final String CONNECTION_TIMEOUT = "connection_timeout_ms";
    public static final String BACKGROUND_RECONNECT_DELAY = "background_reconnect_delay_ms";
    public static final String VISIBILITY_CHANGE_RECONNECT = "visibility_change_reconnect";
    public static final String CIRCUIT_BREAKER_COOLDOWN = "circuit_breaker_cooldown_ms";
    public static final String MIN_CONNECT_SPACING = "min_connect_spacing_ms";

    static final String CLIENT_TYPE_PARAM = "clientType";

    private final URI url;
    private final ClientRole role;
    private final Duration reconnectInterval;
    private final Duration maxReconnectInterval;
    private final double backoffFactor;
    private final int maxReconnectAttempts;
    private final Duration heartbeatInterval;
    private final double heartbeatTimeoutMultiplier;
    private final double backgroundHeartbeatTimeoutMultiplier;
    private final boolean heartbeatOnAnyMessage;
    private final Duration connectionTimeout;
    private final Duration backgroundReconnectDelay;
    private final boolean visibilityChangeReconnect;
    private final Duration circuitBreakerCooldown;
    private final Duration minConnectSpacing;

    private ConnectionConfig(Map<String, Object> values) {
        this.url = parseUrl(values.get(URL));
        this.role = parseRole(values.get(CLIENT_ROLE));
        this.reconnectInterval = positiveDuration(values, RECONNECT_INTERVAL);
        this.maxReconnectInterval = positiveDuration(values, MAX_RECONNECT_INTERVAL);
        this.backoffFactor = doubleValue(values, RECONNECT_BACKOFF_FACTOR);
        this.maxReconnectAttempts = (int) doubleValue(values, MAX_RECONNECT_ATTEMPTS);
        this.heartbeatInterval = positiveDuration(values, HEARTBEAT_INTERVAL);
        this.heartbeatTimeoutMultiplier = doubleValue(values, HEARTBEAT_TIMEOUT_MULTIPLIER);
        this.backgroundHeartbeatTimeoutMultiplier = doubleValue(values, BACKGROUND_HEARTBEAT_TIMEOUT_MULTIPLIER);
        this.heartbeatOnAnyMessage = booleanValue(values, HEARTBEAT_ON_ANY_MESSAGE);
        this.connectionTimeout = positiveDuration(values, CONNECTION_TIMEOUT);
        this.backgroundReconnectDelay = duration(values, BACKGROUND_RECONNECT_DELAY);
        this.visibilityChangeReconnect = booleanValue(values, VISIBILITY_CHANGE_RECONNECT);
        this.circuitBreakerCooldown = positiveDuration(values, CIRCUIT_BREAKER_COOLDOWN);
        this.minConnectSpacing = duration(values, MIN_CONNECT_SPACING);

        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException(RECONNECT_BACKOFF_FACTOR + " must be >= 1, got " + backoffFactor);
        }
        if (maxReconnectAttempts < 1) {
            throw new IllegalArgumentException(MAX_RECONNECT_ATTEMPTS + " must be >= 1, got " + maxReconnectAttempts);
        }
        if (maxReconnectInterval.compareTo(reconnectInterval) < 0) {
            throw new IllegalArgumentException(MAX_RECONNECT_INTERVAL + " must not be below " + RECONNECT_INTERVAL);
        }
        if (heartbeatTimeoutMultiplier < 1.0 || backgroundHeartbeatTimeoutMultiplier < 1.0) {
            throw new IllegalArgumentException("Heartbeat timeout multipliers must be >= 1");
        }
    }

    // ─── Factories ──────────────────────────────────────────────────

    /** Role defaults for the given endpoint. */
    public static ConnectionConfig forRole(ClientRole role, String url) {
        Map<String, Object> values = defaults(role);
        values.put(URL, url);
        return new ConnectionConfig(values);
    }

    /**
     * Builds a config from raw settings. The role (default {@code display}) selects
     * the defaults that fill every key the map leaves out.
     */
    public static ConnectionConfig fromMap(Map<String, Object> settings) {
        Object rawRole = settings.get(CLIENT_ROLE);
        ClientRole role = rawRole == null ? ClientRole.DISPLAY : parseRole(rawRole);
        Map<String, Object> values = defaults(role);
        settings.forEach((key, value) -> {
            if (value != null) values.put(key, value);
        });
        return new ConnectionConfig(values);
    }

    /**
     * Returns a copy with the given keys replaced. Keys absent from {@code partial}
     * keep their current value; changing the role does not re-apply role defaults.
     */
    public ConnectionConfig merge(Map<String, Object> partial) {
        Map<String, Object> values = toMap();
        partial.forEach((key, value) -> {
            if (value != null) values.put(key, value);
        });
        return new ConnectionConfig(values);
    }

    static Map<String, Object> defaults(ClientRole role) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(CLIENT_ROLE, role.wireName());
        d.put(MAX_RECONNECT_INTERVAL, 30_000L);
        d.put(HEARTBEAT_TIMEOUT_MULTIPLIER, 2.0);
        d.put(HEARTBEAT_ON_ANY_MESSAGE, false);
        d.put(CIRCUIT_BREAKER_COOLDOWN, 300_000L);
        d.put(MIN_CONNECT_SPACING, 1_000L);
        if (role == ClientRole.CONTROLLER) {
            d.put(RECONNECT_INTERVAL, 2_000L);
            d.put(RECONNECT_BACKOFF_FACTOR, 1.5);
            d.put(MAX_RECONNECT_ATTEMPTS, 15);
            d.put(HEARTBEAT_INTERVAL, 45_000L);
            d.put(BACKGROUND_HEARTBEAT_TIMEOUT_MULTIPLIER, 3.0);
            d.put(CONNECTION_TIMEOUT, 15_000L);
            d.put(BACKGROUND_RECONNECT_DELAY, 5_000L);
            d.put(VISIBILITY_CHANGE_RECONNECT, true);
        } else {
            d.put(RECONNECT_INTERVAL, 1_000L);
            d.put(RECONNECT_BACKOFF_FACTOR, 2.0);
            d.put(MAX_RECONNECT_ATTEMPTS, 10);
            d.put(HEARTBEAT_INTERVAL, 30_000L);
            d.put(BACKGROUND_HEARTBEAT_TIMEOUT_MULTIPLIER, 2.0);
            d.put(CONNECTION_TIMEOUT, 10_000L);
            d.put(BACKGROUND_RECONNECT_DELAY, 0L);
            d.put(VISIBILITY_CHANGE_RECONNECT, false);
        }
        return d;
    }

    /** Normalized view of every setting, durations in milliseconds. */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(URL, url.toString());
        m.put(CLIENT_ROLE, role.wireName());
        m.put(RECONNECT_INTERVAL, reconnectInterval.toMillis());
        m.put(MAX_RECONNECT_INTERVAL, maxReconnectInterval.toMillis());
        m.put(RECONNECT_BACKOFF_FACTOR, backoffFactor);
        m.put(MAX_RECONNECT_ATTEMPTS, maxReconnectAttempts);
        m.put(HEARTBEAT_INTERVAL, heartbeatInterval.toMillis());
        m.put(HEARTBEAT_TIMEOUT_MULTIPLIER, heartbeatTimeoutMultiplier);
        m.put(BACKGROUND_HEARTBEAT_TIMEOUT_MULTIPLIER, backgroundHeartbeatTimeoutMultiplier);
        m.put(HEARTBEAT_ON_ANY_MESSAGE, heartbeatOnAnyMessage);
        m.put(CONNECTION_TIMEOUT, connectionTimeout.toMillis());
        m.put(BACKGROUND_RECONNECT_DELAY, backgroundReconnectDelay.toMillis());
        m.put(VISIBILITY_CHANGE_RECONNECT, visibilityChangeReconnect);
        m.put(CIRCUIT_BREAKER_COOLDOWN, circuitBreakerCooldown.toMillis());
        m.put(MIN_CONNECT_SPACING, minConnectSpacing.toMillis());
        return m;
    }

    /**
     * Endpoint with the role declared in the {@code clientType} query parameter.
     * Other query parameters are kept; an existing {@code clientType} is replaced.
     */
    public URI handshakeUri() {
        List<String> params = new ArrayList<>();
        String rawQuery = url.getRawQuery();
        if (rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) continue;
                String name = URLDecoder.decode(pair.split("=", 2)[0], StandardCharsets.UTF_8);
                if (!CLIENT_TYPE_PARAM.equals(name)) params.add(pair);
            }
        }
        params.add(CLIENT_TYPE_PARAM + "=" + URLEncoder.encode(role.wireName(), StandardCharsets.UTF_8));

        StringBuilder sb = new StringBuilder();
        sb.append(url.getScheme()).append("://").append(url.getRawAuthority());
        if (url.getRawPath() != null) sb.append(url.getRawPath());
        sb.append('?').append(String.join("&", params));
        if (url.getRawFragment() != null) sb.append('#').append(url.getRawFragment());
        return URI.create(sb.toString());
    }

    // ─── Accessors ──────────────────────────────────────────────────

    public URI url() { return url; }
    public ClientRole role() { return role; }
    public Duration reconnectInterval() { return reconnectInterval; }
    public Duration maxReconnectInterval() { return maxReconnectInterval; }
    public double backoffFactor() { return backoffFactor; }
    public int maxReconnectAttempts() { return maxReconnectAttempts; }
    public Duration heartbeatInterval() { return heartbeatInterval; }
    public double heartbeatTimeoutMultiplier() { return heartbeatTimeoutMultiplier; }
    public double backgroundHeartbeatTimeoutMultiplier() { return backgroundHeartbeatTimeoutMultiplier; }
    public boolean heartbeatOnAnyMessage() { return heartbeatOnAnyMessage; }
    public Duration connectionTimeout() { return connectionTimeout; }
    public Duration backgroundReconnectDelay() { return backgroundReconnectDelay; }
    public boolean visibilityChangeReconnect() { return visibilityChangeReconnect; }
    public Duration circuitBreakerCooldown() { return circuitBreakerCooldown; }
    public Duration minConnectSpacing() { return minConnectSpacing; }

    @Override
    public String toString() {
        return "ConnectionConfig{url=" + url + ", role=" + role.wireName()
                + ", reconnect=" + reconnectInterval.toMillis() + "ms x" + backoffFactor
                + " (max " + maxReconnectInterval.toMillis() + "ms, " + maxReconnectAttempts + " attempts)"
                + ", heartbeat=" + heartbeatInterval.toMillis() + "ms}";
    }

    // ─── Parsing ────────────────────────────────────────────────────

    private static URI parseUrl(Object raw) {
        if (raw == null || raw.toString().isBlank()) {
            throw new IllegalArgumentException(URL + " is required");
        }
        URI uri;
        try {
            uri = URI.create(raw.toString().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + URL + " '" + raw + "'", e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException(URL + " must use ws:// or wss://, got '" + raw + "'");
        }
        return uri;
    }

    private static ClientRole parseRole(Object raw) {
        if (raw instanceof ClientRole r) return r;
        return ClientRole.fromWireName(raw == null ? null : raw.toString());
    }

    private static Duration positiveDuration(Map<String, Object> values, String key) {
        Duration d = duration(values, key);
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(key + " must be positive, got " + d.toMillis() + "ms");
        }
        return d;
    }

    /**
     * Parses a duration value. Supports:
     * <ul>
     *   <li>{@link Duration} or plain number → milliseconds</li>
     *   <li>{@code "500ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
     *   <li>ISO-8601 ({@code "PT30S"})</li>
     * </ul>
     */
    static Duration duration(Map<String, Object> values, String key) {
        Object raw = values.get(key);
        if (raw instanceof Duration d) return d;
        if (raw instanceof Number n) return Duration.ofMillis(n.longValue());
        if (raw == null || raw.toString().isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        String val = raw.toString().trim().toLowerCase(Locale.ROOT);
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase(Locale.ROOT));
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.replace("ms", "").trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.replace("s", "").trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.replace("m", "").trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.replace("h", "").trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid duration for " + key + ": '" + raw + "'", e);
        }
    }

    private static double doubleValue(Map<String, Object> values, String key) {
        Object raw = values.get(key);
        if (raw instanceof Number n) return n.doubleValue();
        if (raw == null || raw.toString().isBlank()) {
            throw new IllegalArgumentException(key + " is required");
        }
        try {
            return Double.parseDouble(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + raw + "'", e);
        }
    }

    private static boolean booleanValue(Map<String, Object> values, String key) {
        Object raw = values.get(key);
        if (raw instanceof Boolean b) return b;
        return raw != null && "true".equalsIgnoreCase(raw.toString().trim());
    }
}
