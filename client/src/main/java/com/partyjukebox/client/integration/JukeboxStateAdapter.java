/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.client.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.partyjukebox.common.exception.JukeboxException;
import com.partyjukebox.common.model.ConnectionState;
import com.partyjukebox.common.model.MessageType;
import com.partyjukebox.common.model.PlaybackView;
import com.partyjukebox.common.model.QueueView;
import com.partyjukebox.common.model.ServerMessage;
import com.partyjukebox.common.util.JsonUtil;
import com.partyjukebox.messaging.core.ConnectionManager;
import com.partyjukebox.messaging.core.MessageListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Turns decoded server messages into the latest queue and playback snapshot.
 *
 * <p>Subscribes to every peer message type on {@link #start()} and drops all of its
 * subscriptions on {@link #close()}. An {@code initial_state} message is expanded into
 * a queue update followed by a playback update. Sequence numbers are tracked but only
 * advisory: a regression is logged and the message is still applied.</p>
 */
public class JukeboxStateAdapter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JukeboxStateAdapter.class);

    static final String CONNECTION_LOST = "Connection lost. Attempting to reconnect...";
    static final String TRACK_FAILED = "Track playback failed, skipping to next";
    static final String GENERIC_SERVER_ERROR = "Connection error occurred";

    private final ConnectionManager connectionManager;
    private final Map<MessageType, MessageListener> subscriptions = new EnumMap<>(MessageType.class);
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile QueueView queue = QueueView.emptyQueue();
    private volatile PlaybackView playback = PlaybackView.idle();
    private volatile ConnectionState connectionState;
    private volatile String lastError;
    private volatile long lastSequenceNumber;

    public JukeboxStateAdapter(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
        this.connectionState = connectionManager.getConnectionStatus();
        subscriptions.put(MessageType.CONNECTION_ESTABLISHED, this::onConnectionEstablished);
        subscriptions.put(MessageType.INITIAL_STATE, this::onInitialState);
        subscriptions.put(MessageType.QUEUE_UPDATED, this::onQueueUpdated);
        subscriptions.put(MessageType.PLAYBACK_UPDATED, this::onPlaybackUpdated);
        subscriptions.put(MessageType.TRACK_ADDED, this::onTrackAdded);
        subscriptions.put(MessageType.TRACK_FINISHED, this::onTrackFinished);
        subscriptions.put(MessageType.ERROR_OCCURRED, this::onErrorOccurred);
        subscriptions.put(MessageType.HEARTBEAT, this::onHeartbeat);
    }

    public void start() {
        subscriptions.forEach(connectionManager::subscribe);
        log.info("State adapter subscribed to {} message types", subscriptions.size());
    }

    @Override
    public void close() {
        subscriptions.forEach(connectionManager::unsubscribe);
        listeners.clear();
        log.info("State adapter unsubscribed");
    }

    public void addListener(StateChangeListener listener) { listeners.add(listener); }
    public void removeListener(StateChangeListener listener) { listeners.remove(listener); }

    public QueueView getQueue() { return queue; }
    public PlaybackView getPlayback() { return playback; }
    public ConnectionState getConnectionState() { return connectionState; }
    public String getLastError() { return lastError; }
    public long getLastSequenceNumber() { return lastSequenceNumber; }
    public boolean isConnected() { return connectionManager.isConnected(); }

    // ─── Message handlers ───────────────────────────────────────────

    private void onConnectionEstablished(ServerMessage message) {
        message.connectionState().ifPresentOrElse(state -> {
            connectionState = state;
            notifyListeners(l -> l.onConnectionStatusChanged(state));
            if (state == ConnectionState.ERROR) {
                reportError(CONNECTION_LOST);
            } else if (state == ConnectionState.CONNECTED && lastError != null) {
                reportError("");
            }
        }, () -> log.info("Server acknowledged connection: clientId={}, clientType={}",
                message.data().path("clientId").asText("?"),
                message.data().path("clientType").asText("?")));
    }

    private void onInitialState(ServerMessage message) {
        trackSequence(message);
        JsonNode queueData = message.data().get("queue");
        if (queueData != null && queueData.isObject()) {
            applyQueue(queueData);
        }
        JsonNode playbackData = message.data().get("playback");
        if (playbackData != null && playbackData.isObject()) {
            applyPlayback(playbackData);
        }
        log.info("Initial state applied: {} upcoming track(s), playback {}",
                queue.upcomingTracks().size(), playback.status());
    }

    private void onQueueUpdated(ServerMessage message) {
        trackSequence(message);
        applyQueue(message.data());
    }

    private void onPlaybackUpdated(ServerMessage message) {
        trackSequence(message);
        applyPlayback(message.data());
    }

    private void onTrackAdded(ServerMessage message) {
        trackSequence(message);
        log.debug("Track added: {}", message.data().path("track").path("title").asText(""));
        notifyListeners(l -> l.onTrackAdded(message.data()));
    }

    private void onTrackFinished(ServerMessage message) {
        trackSequence(message);
        notifyListeners(l -> l.onTrackFinished(message.data()));
        if ("error".equals(message.data().path("reason").asText(null))) {
            reportError(TRACK_FAILED);
        }
    }

    private void onErrorOccurred(ServerMessage message) {
        trackSequence(message);
        String text = message.data().path("message").asText("");
        reportError(text.isBlank() ? GENERIC_SERVER_ERROR : text);
    }

    private void onHeartbeat(ServerMessage message) {
        log.trace("Heartbeat at {}", message.timestamp());
    }

    // ─── Helpers ────────────────────────────────────────────────────

    private void applyQueue(JsonNode data) {
        QueueView next;
        try {
            next = JsonUtil.treeToValue(data, QueueView.class);
        } catch (JukeboxException e) {
            log.warn("Ignoring queue update that does not bind: {}", e.getMessage());
            reportError("Failed to update queue display");
            return;
        }
        queue = next;
        notifyListeners(l -> l.onQueueChanged(next));
    }

    private void applyPlayback(JsonNode data) {
        PlaybackView next;
        try {
            next = JsonUtil.treeToValue(data, PlaybackView.class);
        } catch (JukeboxException e) {
            log.warn("Ignoring playback update that does not bind: {}", e.getMessage());
            reportError("Failed to update playback status");
            return;
        }
        playback = next;
        notifyListeners(l -> l.onPlaybackChanged(next));
    }

    private void trackSequence(ServerMessage message) {
        long sequence = message.sequenceNumber();
        if (sequence <= 0) return;
        long previous = lastSequenceNumber;
        if (sequence <= previous) {
            log.debug("Sequence went from {} to {} on {}, applying anyway", previous, sequence, message.type());
        }
        lastSequenceNumber = sequence;
    }

    private void reportError(String message) {
        lastError = message.isEmpty() ? null : message;
        notifyListeners(l -> l.onError(message));
    }

    private void notifyListeners(Consumer<StateChangeListener> event) {
        for (StateChangeListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (Exception e) {
                log.error("State listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
