/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.config;

import com.partyjukebox.client.integration.JukeboxStateAdapter;
import com.partyjukebox.messaging.config.ConnectionManagerFactory;
import com.partyjukebox.messaging.core.ConnectionConfig;
import com.partyjukebox.messaging.core.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the one connection manager of this client and the adapter that feeds
 * application state from it. Settings left blank fall back to the role defaults.
 */
@Configuration
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    @Value("${jukebox.connection.url:ws://localhost:3001/ws}")
    private String url;

    @Value("${jukebox.connection.client-role:display}")
    private String clientRole;

    @Value("${jukebox.connection.reconnect-interval-ms:}")
    private String reconnectIntervalMs;

    @Value("${jukebox.connection.max-reconnect-interval-ms:}")
    private String maxReconnectIntervalMs;

    @Value("${jukebox.connection.reconnect-backoff-factor:}")
    private String reconnectBackoffFactor;

    @Value("${jukebox.connection.max-reconnect-attempts:}")
    private String maxReconnectAttempts;

    @Value("${jukebox.connection.heartbeat-interval-ms:}")
    private String heartbeatIntervalMs;

    @Value("${jukebox.connection.heartbeat-timeout-multiplier:}")
    private String heartbeatTimeoutMultiplier;

    @Value("${jukebox.connection.background-heartbeat-timeout-multiplier:}")
    private String backgroundHeartbeatTimeoutMultiplier;

    @Value("${jukebox.connection.heartbeat-on-any-message:}")
    private String heartbeatOnAnyMessage;

    @Value("${jukebox.connection.connection-timeout-ms:}")
    private String connectionTimeoutMs;

    @Value("${jukebox.connection.background-reconnect-delay-ms:}")
    private String backgroundReconnectDelayMs;

    @Value("${jukebox.connection.visibility-change-reconnect:}")
    private String visibilityChangeReconnect;

    @Value("${jukebox.connection.circuit-breaker-cooldown-ms:}")
    private String circuitBreakerCooldownMs;

    @Value("${jukebox.connection.min-connect-spacing-ms:}")
    private String minConnectSpacingMs;

    @Bean
    public ConnectionConfig connectionConfig() {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(ConnectionConfig.URL, url);
        settings.put(ConnectionConfig.CLIENT_ROLE, clientRole);
        putIfSet(settings, ConnectionConfig.RECONNECT_INTERVAL, reconnectIntervalMs);
        putIfSet(settings, ConnectionConfig.MAX_RECONNECT_INTERVAL, maxReconnectIntervalMs);
        putIfSet(settings, ConnectionConfig.RECONNECT_BACKOFF_FACTOR, reconnectBackoffFactor);
        putIfSet(settings, ConnectionConfig.MAX_RECONNECT_ATTEMPTS, maxReconnectAttempts);
        putIfSet(settings, ConnectionConfig.HEARTBEAT_INTERVAL, heartbeatIntervalMs);
        putIfSet(settings, ConnectionConfig.HEARTBEAT_TIMEOUT_MULTIPLIER, heartbeatTimeoutMultiplier);
        putIfSet(settings, ConnectionConfig.BACKGROUND_HEARTBEAT_TIMEOUT_MULTIPLIER, backgroundHeartbeatTimeoutMultiplier);
        putIfSet(settings, ConnectionConfig.HEARTBEAT_ON_ANY_MESSAGE, heartbeatOnAnyMessage);
        putIfSet(settings, ConnectionConfig.CONNECTION_TIMEOUT, connectionTimeoutMs);
        putIfSet(settings, ConnectionConfig.BACKGROUND_RECONNECT_DELAY, backgroundReconnectDelayMs);
        putIfSet(settings, ConnectionConfig.VISIBILITY_CHANGE_RECONNECT, visibilityChangeReconnect);
        putIfSet(settings, ConnectionConfig.CIRCUIT_BREAKER_COOLDOWN, circuitBreakerCooldownMs);
        putIfSet(settings, ConnectionConfig.MIN_CONNECT_SPACING, minConnectSpacingMs);

        ConnectionConfig config = ConnectionConfig.fromMap(settings);
        log.info("Realtime connection configured: {}", config);
        return config;
    }

    @Bean(destroyMethod = "close")
    public ConnectionManager connectionManager(ConnectionConfig connectionConfig) {
        return ConnectionManagerFactory.create(connectionConfig);
    }

    @Bean(destroyMethod = "close")
    public JukeboxStateAdapter jukeboxStateAdapter(ConnectionManager connectionManager) {
        JukeboxStateAdapter adapter = new JukeboxStateAdapter(connectionManager);
        adapter.start();
        return adapter;
    }

    private static void putIfSet(Map<String, Object> settings, String key, String value) {
        if (value != null && !value.isBlank()) {
            settings.put(key, value.trim());
        }
    }
}
