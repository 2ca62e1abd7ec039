/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.partyjukebox.common.model.ConnectionState;
import com.partyjukebox.common.model.PlaybackView;
import com.partyjukebox.common.model.QueueView;

/**
 * Receives application-level state changes from {@link JukeboxStateAdapter}.
 * All methods default to no-ops so views implement only what they render.
 */
public interface StateChangeListener {

    default void onQueueChanged(QueueView queue) {}

    default void onPlaybackChanged(PlaybackView playback) {}

    default void onTrackAdded(JsonNode track) {}

    default void onTrackFinished(JsonNode details) {}

    default void onConnectionStatusChanged(ConnectionState state) {}

    /** A user-facing error message; empty when a previous error has cleared. */
    default void onError(String message) {}
}
