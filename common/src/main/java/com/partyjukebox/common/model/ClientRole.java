/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import java.util.Locale;

/**
 * Role a client declares during the handshake, sent as the clientType query parameter.
 */
public enum ClientRole {
    CONTROLLER,
    DISPLAY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClientRole fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Client role must be 'controller' or 'display'");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown client role '" + value + "'", e);
        }
    }
}
