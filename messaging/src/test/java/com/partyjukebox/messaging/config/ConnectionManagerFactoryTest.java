/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.config;

import com.partyjukebox.common.model.ClientRole;
import com.partyjukebox.common.model.ConnectionState;
import com.partyjukebox.messaging.core.ConnectionConfig;
import com.partyjukebox.messaging.core.ConnectionManager;
import com.partyjukebox.messaging.transport.FakeTransportFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionManagerFactoryTest {

    @Test
    void shouldNameThreadAfterRole() {
        assertThat(ConnectionManagerFactory.threadName(ClientRole.CONTROLLER)).isEqualTo("jukebox-controller-connection");
        assertThat(ConnectionManagerFactory.threadName(ClientRole.DISPLAY)).isEqualTo("jukebox-display-connection");
    }

    @Test
    void shouldCreateDisconnectedManagerWithRoleDefaults() {
        try (ConnectionManager manager = ConnectionManagerFactory.forController("ws://localhost:3001/ws")) {
            assertThat(manager.getConnectionStatus()).isEqualTo(ConnectionState.DISCONNECTED);
            assertThat(manager.getConfig().role()).isEqualTo(ClientRole.CONTROLLER);
            assertThat(manager.isConnected()).isFalse();
        }
    }

    @Test
    void shouldBuildFromSettingsMap() {
        ConnectionConfig config = ConnectionConfig.fromMap(Map.of(
                ConnectionConfig.URL, "ws://localhost:3001/ws",
                ConnectionConfig.MAX_RECONNECT_ATTEMPTS, 4));

        try (ConnectionManager manager = ConnectionManagerFactory.create(config, new FakeTransportFactory())) {
            assertThat(manager.getConfig().role()).isEqualTo(ClientRole.DISPLAY);
            assertThat(manager.getConfig().maxReconnectAttempts()).isEqualTo(4);
        }
    }
}
