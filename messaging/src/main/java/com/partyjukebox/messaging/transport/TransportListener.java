/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

/**
 * Receives transport events. Implementations may be called from I/O threads and
 * are expected to hand the event off rather than do work inline.
 */
public interface TransportListener {

    void onOpen(Transport transport);

    /** A complete text frame, already reassembled from its parts. */
    void onText(Transport transport, String text);

    void onClose(Transport transport, int code, String reason);

    /** Handshake or I/O failure. No further events follow for this transport. */
    void onError(Transport transport, Throwable error);
}
