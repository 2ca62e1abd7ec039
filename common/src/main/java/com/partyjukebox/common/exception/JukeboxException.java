/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.exception;

/**
 * Base exception for all jukebox client errors.
 */
public class JukeboxException extends RuntimeException {
    private final String errorCode;

    public JukeboxException(String message) {
        super(message);
        this.errorCode = "JUKEBOX_GENERIC";
    }

    public JukeboxException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public JukeboxException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
