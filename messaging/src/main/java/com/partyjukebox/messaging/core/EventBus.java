/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import com.partyjukebox.common.model.MessageType;
import com.partyjukebox.common.model.ServerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Type-keyed registry of message listeners.
 *
 * <p>Dispatch is keyed on {@link ServerMessage#type()}. A listener that throws is
 * logged and skipped; the remaining listeners still run and the exception never
 * reaches the caller of {@link #emit(ServerMessage)}.</p>
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<MessageType, Set<MessageListener>> listeners = new ConcurrentHashMap<>();
    private final AtomicLong dispatchedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public void subscribe(MessageType type, MessageListener listener) {
        listeners.computeIfAbsent(type, t -> new CopyOnWriteArraySet<>()).add(listener);
    }

    /** Removes the listener; unknown listeners are ignored. */
    public void unsubscribe(MessageType type, MessageListener listener) {
        Set<MessageListener> set = listeners.get(type);
        if (set != null) {
            set.remove(listener);
        }
    }

    public void emit(ServerMessage message) {
        Set<MessageListener> set = listeners.get(message.type());
        if (set == null || set.isEmpty()) return;
        for (MessageListener listener : set) {
            try {
                listener.onMessage(message);
                dispatchedCount.incrementAndGet();
            } catch (Exception e) {
                failedCount.incrementAndGet();
                log.error("Listener error on message type '{}'", message.type(), e);
            }
        }
    }

    int listenerCount(MessageType type) {
        Set<MessageListener> set = listeners.get(type);
        return set == null ? 0 : set.size();
    }

    public void clear() {
        listeners.clear();
    }

    public long getDispatchedCount() { return dispatchedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
}
