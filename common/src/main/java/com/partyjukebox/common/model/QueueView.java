/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Queue snapshot as carried by queue_updated (and by the queue part of initial_state).
 * Track entries stay as raw JSON; their shape belongs to the server's domain model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueueView(
        @JsonProperty("currentTrack") JsonNode currentTrack,
        @JsonProperty("upcomingTracks") List<JsonNode> upcomingTracks,
        @JsonProperty("totalLength") int totalLength,
        @JsonProperty("isEmpty") boolean empty) {

    public QueueView {
        upcomingTracks = upcomingTracks == null ? List.of() : List.copyOf(upcomingTracks);
    }

    public static QueueView emptyQueue() {
        return new QueueView(null, List.of(), 0, true);
    }

    public boolean hasCurrentTrack() {
        return currentTrack != null && !currentTrack.isNull();
    }
}
