/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Message types carried in the {@code type} field of the wire envelope.
 *
 * <p>{@link #CONNECTION_ESTABLISHED} is never sent by the server; the connection
 * manager synthesizes it whenever its {@link ConnectionState} changes.</p>
 */
public enum MessageType {
    CONNECTION_ESTABLISHED("connection_established"),
    INITIAL_STATE("initial_state"),
    QUEUE_UPDATED("queue_updated"),
    PLAYBACK_UPDATED("playback_updated"),
    TRACK_ADDED("track_added"),
    TRACK_FINISHED("track_finished"),
    ERROR_OCCURRED("error_occurred"),
    HEARTBEAT("heartbeat");

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::wireName, Function.identity()));

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /** Resolves a wire name; empty for anything outside the fixed set. */
    public static Optional<MessageType> fromWireName(String wireName) {
        if (wireName == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() { return wireName; }
}
