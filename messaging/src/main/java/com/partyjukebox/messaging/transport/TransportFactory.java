/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

import java.net.URI;
import java.time.Duration;

/**
 * Opens transports. The returned handle exists immediately; the outcome of the
 * handshake arrives later through {@link TransportListener#onOpen} or
 * {@link TransportListener#onError}.
 */
@FunctionalInterface
public interface TransportFactory {

    Transport open(URI uri, Duration connectTimeout, TransportListener listener);
}
