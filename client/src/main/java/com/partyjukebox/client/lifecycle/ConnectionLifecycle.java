/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.lifecycle;

import com.partyjukebox.messaging.core.ConnectionConfig;
import com.partyjukebox.messaging.core.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Opens the realtime connection once the application is ready and drops it when
 * the context closes. The manager bean itself is closed by the container afterwards.
 */
@Component
public class ConnectionLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycle.class);

    private final ConnectionManager connectionManager;

    @Value("${jukebox.client.auto-connect:true}")
    private boolean autoConnect;

    public ConnectionLifecycle(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        ConnectionConfig config = connectionManager.getConfig();
        log.info("╔════════════════════════════════════════════════════════════════════╗");
        log.info("║  Party Jukebox {} client ready", config.role().wireName());
        log.info("║  Endpoint: {}", config.handshakeUri());
        log.info("╚════════════════════════════════════════════════════════════════════╝");
        if (!autoConnect) {
            log.info("Auto-connect disabled (jukebox.client.auto-connect=false); waiting for an explicit connect");
            return;
        }
        connectionManager.connect().whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("Initial connection failed, recovery continues in the background: {}",
                        error.getMessage());
            } else {
                log.info("Initial connection established");
            }
        });
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        log.info("Context closing, disconnecting realtime connection");
        connectionManager.disconnect();
    }

    void setAutoConnect(boolean autoConnect) {
        this.autoConnect = autoConnect;
    }
}
