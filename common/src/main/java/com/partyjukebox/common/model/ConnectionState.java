/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import java.util.Locale;

/**
 * Connection lifecycle states of the realtime connection.
 * The wire name is what the synthetic connection_established message carries in its status field.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConnectionState fromWireName(String value) {
        if (value == null) throw new IllegalArgumentException("Connection state must not be null");
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
