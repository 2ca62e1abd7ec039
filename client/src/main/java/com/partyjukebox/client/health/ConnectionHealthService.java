/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.health;

import com.partyjukebox.common.model.ConnectionState;
import com.partyjukebox.messaging.core.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically samples the connection manager and logs health transitions.
 *
 * <pre>
 * HEALTHY    connected and the socket reports open
 * DEGRADED   connecting, reconnecting, or connected with a closed socket
 * UNHEALTHY  error, disconnected, or circuit breaker open
 * </pre>
 */
@Service
public class ConnectionHealthService {

    private static final Logger log = LoggerFactory.getLogger(ConnectionHealthService.class);

    /** One sample of the connection. */
    public record Report(ConnectionHealth health, ConnectionState state, int reconnectAttempt,
                         boolean circuitOpen, long dispatchedMessages, long listenerFailures,
                         Instant checkedAt) {}

    private final ConnectionManager connectionManager;
    private final Clock clock;
    private volatile Report lastReport;

    @Autowired
    public ConnectionHealthService(ConnectionManager connectionManager) {
        this(connectionManager, Clock.systemUTC());
    }

    ConnectionHealthService(ConnectionManager connectionManager, Clock clock) {
        this.connectionManager = connectionManager;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${jukebox.client.health-check-interval-ms:30000}")
    public void checkHealth() {
        ConnectionState state = connectionManager.getConnectionStatus();
        boolean circuitOpen = connectionManager.isCircuitOpen();
        ConnectionHealth health = evaluate(state, circuitOpen, connectionManager.isConnected());
        Report report = new Report(health, state, connectionManager.getReconnectAttempt(), circuitOpen,
                connectionManager.getDispatchedMessageCount(), connectionManager.getListenerFailureCount(),
                clock.instant());

        Report previous = lastReport;
        lastReport = report;
        if (previous != null && report.listenerFailures() > previous.listenerFailures()) {
            log.warn("{} listener failure(s) since the last health check",
                    report.listenerFailures() - previous.listenerFailures());
        }
        if (previous == null || previous.health() != health) {
            if (health.compareTo(previous == null ? ConnectionHealth.HEALTHY : previous.health()) > 0) {
                log.warn("Connection health {}: state={}, attempt={}, circuitOpen={}",
                        health, state.wireName(), report.reconnectAttempt(), circuitOpen);
            } else {
                log.info("Connection health {}: state={}", health, state.wireName());
            }
        } else {
            log.debug("Connection health unchanged: {}", health);
        }
    }

    public Report getLastReport() { return lastReport; }

    public ConnectionHealth getHealth() {
        Report report = lastReport;
        return report == null ? ConnectionHealth.UNHEALTHY : report.health();
    }

    static ConnectionHealth evaluate(ConnectionState state, boolean circuitOpen, boolean socketOpen) {
        if (circuitOpen) return ConnectionHealth.UNHEALTHY;
        return switch (state) {
            case CONNECTED -> socketOpen ? ConnectionHealth.HEALTHY : ConnectionHealth.DEGRADED;
            case CONNECTING, RECONNECTING -> ConnectionHealth.DEGRADED;
            case ERROR, DISCONNECTED -> ConnectionHealth.UNHEALTHY;
        };
    }
}
