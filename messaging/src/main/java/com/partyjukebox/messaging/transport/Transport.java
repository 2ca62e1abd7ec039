/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

/**
 * Handle for one physical bidirectional connection.
 *
 * <p>A transport is single-use: once closed or aborted it never reopens. Events for
 * it are delivered to the {@link TransportListener} it was opened with, each carrying
 * the transport instance so the owner can ignore callbacks from a superseded one.</p>
 */
public interface Transport {

    /** True while the underlying socket is open for both directions. */
    boolean isOpen();

    /** Starts a graceful close handshake. Safe to call more than once. */
    void close(int code, String reason);

    /** Drops the connection immediately without a close handshake. */
    void abort();
}
