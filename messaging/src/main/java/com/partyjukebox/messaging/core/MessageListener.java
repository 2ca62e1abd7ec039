/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential. Patent Pending.
 */
package com.partyjukebox.messaging.core;

import com.partyjukebox.common.model.ServerMessage;

/**
 * Callback interface for receiving decoded messages of a subscribed type.
 * Invoked on the connection thread; implementations must not block.
 */
@FunctionalInterface
public interface MessageListener {
    /**
     * Called when a message of a subscribed type is dispatched.
     * @param message the decoded message
     */
    void onMessage(ServerMessage message);
}
