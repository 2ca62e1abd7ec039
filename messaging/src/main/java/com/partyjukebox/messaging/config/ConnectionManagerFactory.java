/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.config;

import com.partyjukebox.common.model.ClientRole;
import com.partyjukebox.messaging.core.ConnectionConfig;
import com.partyjukebox.messaging.core.ConnectionManager;
import com.partyjukebox.messaging.core.ExecutorTaskScheduler;
import com.partyjukebox.messaging.transport.JdkWebSocketTransportFactory;
import com.partyjukebox.messaging.transport.TransportFactory;

import java.util.Map;

/**
 * Factory to create ConnectionManager instances for a client role.
 * Each manager gets its own connection thread named {@code jukebox-<role>-connection}.
 */
public final class ConnectionManagerFactory {

    private ConnectionManagerFactory() {}

    public static ConnectionManager create(ConnectionConfig config) {
        return create(config, new JdkWebSocketTransportFactory());
    }

    public static ConnectionManager create(ConnectionConfig config, TransportFactory transportFactory) {
        return new ConnectionManager(config, new ExecutorTaskScheduler(threadName(config.role())), transportFactory);
    }

    public static ConnectionManager create(Map<String, Object> settings) {
        return create(ConnectionConfig.fromMap(settings));
    }

    public static ConnectionManager forDisplay(String url) {
        return create(ConnectionConfig.forRole(ClientRole.DISPLAY, url));
    }

    public static ConnectionManager forController(String url) {
        return create(ConnectionConfig.forRole(ClientRole.CONTROLLER, url));
    }

    static String threadName(ClientRole role) {
        return "jukebox-" + role.wireName() + "-connection";
    }
}
