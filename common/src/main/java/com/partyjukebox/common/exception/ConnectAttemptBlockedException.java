/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.exception;

public class ConnectAttemptBlockedException extends JukeboxException {

    public enum Reason {
        /** Less than the minimum spacing has passed since the previous attempt. */
        RATE_LIMITED,
        /** The circuit breaker is open after exhausting reconnect attempts. */
        CIRCUIT_OPEN
    }

    private final Reason reason;

    public ConnectAttemptBlockedException(Reason reason, String message) {
        super("JUKEBOX_CONNECT_BLOCKED", message);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
