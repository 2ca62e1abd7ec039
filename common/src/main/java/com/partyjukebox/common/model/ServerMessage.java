/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.partyjukebox.common.util.JsonUtil;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded wire envelope: {@code {type, timestamp, sequenceNumber, data}}.
 *
 * <p>The {@code type} tag selects which subscribers receive the message. The
 * {@code data} payload is opaque to the connection layer; consumers bind it to
 * their own views (see {@link QueueView} and {@link PlaybackView}).</p>
 *
 * @param type           message tag
 * @param timestamp      ISO-8601 timestamp as sent by the peer
 * @param sequenceNumber server-assigned sequence hint, 0 when absent
 * @param data           payload object, never null
 */
public record ServerMessage(MessageType type, String timestamp, long sequenceNumber, JsonNode data) {

    public ServerMessage {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        if (data == null || data.isNull() || data.isMissingNode()) {
            data = JsonUtil.mapper().createObjectNode();
        }
    }

    /**
     * Builds the local status-change message the connection manager emits on every state change.
     */
    public static ServerMessage connectionStatus(ConnectionState state, Instant at) {
        ObjectNode data = JsonUtil.mapper().createObjectNode();
        data.put("status", state.wireName());
        data.put("timestamp", at.toString());
        return new ServerMessage(MessageType.CONNECTION_ESTABLISHED, at.toString(), 0L, data);
    }

    /**
     * Reads the status carried by a locally emitted connection_established message.
     * Empty for any other message, including the server's own acknowledgment, which
     * carries client and server info instead of a status.
     */
    public Optional<ConnectionState> connectionState() {
        if (type != MessageType.CONNECTION_ESTABLISHED || !data.path("status").isTextual()) {
            return Optional.empty();
        }
        return Optional.of(ConnectionState.fromWireName(data.get("status").asText()));
    }

    /** Binds the payload to a view class. */
    public <T> T dataAs(Class<T> viewType) {
        return JsonUtil.treeToValue(data, viewType);
    }
}
