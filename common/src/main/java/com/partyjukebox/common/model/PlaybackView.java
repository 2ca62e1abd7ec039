/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Playback snapshot as carried by playback_updated (and by the playback part of initial_state).
 *
 * @param status one of idle, resolving, playing, paused, error
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlaybackView(
        @JsonProperty("status") String status,
        @JsonProperty("currentTrack") JsonNode currentTrack,
        @JsonProperty("position") double position,
        @JsonProperty("duration") double duration,
        @JsonProperty("volume") double volume,
        @JsonProperty("error") String error) {

    public static PlaybackView idle() {
        return new PlaybackView("idle", null, 0, 0, 0, null);
    }

    public boolean isPlaying() {
        return "playing".equals(status);
    }
}
