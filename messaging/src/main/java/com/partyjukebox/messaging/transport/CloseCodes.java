/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

/**
 * WebSocket close codes with special meaning to the connection manager.
 */
public final class CloseCodes {

    /** Normal closure. Terminal: no reconnect follows. */
    public static final int NORMAL = 1000;

    /** Abnormal closure, also used for a locally detected heartbeat timeout. */
    public static final int ABNORMAL = 1006;

    /** Server is at capacity. */
    public static final int TRY_AGAIN_LATER = 1013;

    public static final String MAXIMUM_CONNECTIONS = "Maximum connections";

    private CloseCodes() {}

    /** Whether the close means the server is refusing connections for now. */
    public static boolean isServerRejection(int code, String reason) {
        return code == TRY_AGAIN_LATER || (reason != null && reason.contains(MAXIMUM_CONNECTIONS));
    }
}
