/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.health;

import com.partyjukebox.common.model.ConnectionState;
import com.partyjukebox.messaging.core.ConnectionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConnectionHealthServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T21:00:00Z");

    private ConnectionManager manager;
    private ConnectionHealthService service;

    @BeforeEach
    void setUp() {
        manager = mock(ConnectionManager.class);
        service = new ConnectionHealthService(manager, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldBeUnhealthyBeforeFirstCheck() {
        assertThat(service.getLastReport()).isNull();
        assertThat(service.getHealth()).isEqualTo(ConnectionHealth.UNHEALTHY);
    }

    @Test
    void shouldReportHealthyConnection() {
        when(manager.getConnectionStatus()).thenReturn(ConnectionState.CONNECTED);
        when(manager.isConnected()).thenReturn(true);

        service.checkHealth();

        ConnectionHealthService.Report report = service.getLastReport();
        assertThat(report.health()).isEqualTo(ConnectionHealth.HEALTHY);
        assertThat(report.state()).isEqualTo(ConnectionState.CONNECTED);
        assertThat(report.circuitOpen()).isFalse();
        assertThat(report.checkedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldCaptureReconnectProgress() {
        when(manager.getConnectionStatus()).thenReturn(ConnectionState.RECONNECTING);
        when(manager.getReconnectAttempt()).thenReturn(4);

        service.checkHealth();

        assertThat(service.getHealth()).isEqualTo(ConnectionHealth.DEGRADED);
        assertThat(service.getLastReport().reconnectAttempt()).isEqualTo(4);
    }

    @Test
    void shouldFollowTransitionsBetweenChecks() {
        when(manager.getConnectionStatus()).thenReturn(ConnectionState.CONNECTED);
        when(manager.isConnected()).thenReturn(true);
        service.checkHealth();

        when(manager.getConnectionStatus()).thenReturn(ConnectionState.ERROR);
        when(manager.isConnected()).thenReturn(false);
        when(manager.isCircuitOpen()).thenReturn(true);
        service.checkHealth();

        assertThat(service.getHealth()).isEqualTo(ConnectionHealth.UNHEALTHY);
        assertThat(service.getLastReport().circuitOpen()).isTrue();
    }

    @Test
    void shouldCarryEventBusCounters() {
        when(manager.getConnectionStatus()).thenReturn(ConnectionState.CONNECTED);
        when(manager.isConnected()).thenReturn(true);
        when(manager.getDispatchedMessageCount()).thenReturn(42L);
        when(manager.getListenerFailureCount()).thenReturn(0L, 3L);

        service.checkHealth();
        service.checkHealth();

        ConnectionHealthService.Report report = service.getLastReport();
        assertThat(report.dispatchedMessages()).isEqualTo(42);
        assertThat(report.listenerFailures()).isEqualTo(3);
        assertThat(report.health()).isEqualTo(ConnectionHealth.HEALTHY);
    }

    @Test
    void shouldMapStatesToHealth() {
        assertThat(ConnectionHealthService.evaluate(ConnectionState.CONNECTED, false, true))
                .isEqualTo(ConnectionHealth.HEALTHY);
        assertThat(ConnectionHealthService.evaluate(ConnectionState.CONNECTED, false, false))
                .isEqualTo(ConnectionHealth.DEGRADED);
        assertThat(ConnectionHealthService.evaluate(ConnectionState.CONNECTING, false, false))
                .isEqualTo(ConnectionHealth.DEGRADED);
        assertThat(ConnectionHealthService.evaluate(ConnectionState.DISCONNECTED, false, false))
                .isEqualTo(ConnectionHealth.UNHEALTHY);
        assertThat(ConnectionHealthService.evaluate(ConnectionState.RECONNECTING, true, false))
                .isEqualTo(ConnectionHealth.UNHEALTHY);
    }
}
