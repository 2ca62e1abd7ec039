/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.exception;

/**
 * A connection attempt did not complete. Also used when an explicit disconnect
 * cancels an attempt in flight.
 */
public class ConnectionException extends JukeboxException {
    public ConnectionException(String message) {
        super("JUKEBOX_CONNECTION_FAILED", message);
    }

    public ConnectionException(String message, Throwable cause) {
        super("JUKEBOX_CONNECTION_FAILED", message, cause);
    }
}
