/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.partyjukebox.common.model.MessageType;
import com.partyjukebox.common.model.ServerMessage;
import com.partyjukebox.common.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * JSON codec for the wire envelope {@code {type, timestamp, sequenceNumber, data}}.
 *
 * <p>Malformed frames (not a JSON object, missing {@code type} or {@code timestamp},
 * or a {@code type} outside {@link MessageType}) decode to empty and are logged at warn.</p>
 */
public class MessageCodec {

    private static final Logger log = LoggerFactory.getLogger(MessageCodec.class);

    public Optional<ServerMessage> decode(String frame) {
        JsonNode root;
        try {
            root = JsonUtil.readTree(frame);
        } catch (JsonProcessingException e) {
            log.warn("Dropping unparseable frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("Dropping frame that is not a JSON object: {}", abbreviate(frame));
            return Optional.empty();
        }

        String typeName = text(root, "type");
        String timestamp = text(root, "timestamp");
        if (typeName == null || timestamp == null) {
            log.warn("Dropping invalid frame without type/timestamp: {}", abbreviate(frame));
            return Optional.empty();
        }
        Optional<MessageType> type = MessageType.fromWireName(typeName);
        if (type.isEmpty()) {
            log.warn("Dropping frame with unknown type '{}'", typeName);
            return Optional.empty();
        }

        long sequence = root.path("sequenceNumber").asLong(0L);
        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            data = JsonUtil.mapper().createObjectNode();
        }
        return Optional.of(new ServerMessage(type.get(), timestamp, sequence, data));
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) return null;
        return node.asText();
    }

    private static String abbreviate(String frame) {
        if (frame == null) return "null";
        return frame.length() <= 200 ? frame : frame.substring(0, 200) + "...";
    }
}
