/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.partyjukebox.common.util.JsonUtil;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerMessageTest {

    @Test
    void shouldCarryStatusInConnectionMessage() {
        Instant at = Instant.parse("2025-06-01T18:30:00Z");

        ServerMessage message = ServerMessage.connectionStatus(ConnectionState.RECONNECTING, at);

        assertThat(message.type()).isEqualTo(MessageType.CONNECTION_ESTABLISHED);
        assertThat(message.data().path("status").asText()).isEqualTo("reconnecting");
        assertThat(message.data().path("timestamp").asText()).isEqualTo("2025-06-01T18:30:00Z");
        assertThat(message.connectionState()).contains(ConnectionState.RECONNECTING);
    }

    @Test
    void shouldHaveNoStatusForServerAcknowledgment() throws Exception {
        JsonNode data = JsonUtil.readTree("{\"clientId\":\"client_abc\",\"clientType\":\"display\"}");

        ServerMessage ack = new ServerMessage(MessageType.CONNECTION_ESTABLISHED, "2025-06-01T18:30:00Z", 0, data);

        assertThat(ack.connectionState()).isEmpty();
    }

    @Test
    void shouldDefaultMissingData() {
        ServerMessage message = new ServerMessage(MessageType.HEARTBEAT, "2025-06-01T18:30:00Z", 0, null);

        assertThat(message.data().isObject()).isTrue();
        assertThat(message.connectionState()).isEmpty();
    }

    @Test
    void shouldBindQueuePayload() throws Exception {
        JsonNode data = JsonUtil.readTree("""
                {"currentTrack":{"id":"t1","title":"Intro"},
                 "upcomingTracks":[{"id":"t2"},{"id":"t3"}],
                 "totalLength":3,"isEmpty":false,"extra":"ignored"}
                """);
        ServerMessage message = new ServerMessage(MessageType.QUEUE_UPDATED, "2025-06-01T18:30:00Z", 9, data);

        QueueView queue = message.dataAs(QueueView.class);

        assertThat(queue.hasCurrentTrack()).isTrue();
        assertThat(queue.currentTrack().path("title").asText()).isEqualTo("Intro");
        assertThat(queue.upcomingTracks()).hasSize(2);
        assertThat(queue.totalLength()).isEqualTo(3);
        assertThat(queue.empty()).isFalse();
    }

    @Test
    void shouldBindPlaybackPayload() throws Exception {
        JsonNode data = JsonUtil.readTree(
                "{\"status\":\"playing\",\"position\":42.5,\"duration\":180,\"volume\":70}");
        ServerMessage message = new ServerMessage(MessageType.PLAYBACK_UPDATED, "2025-06-01T18:30:00Z", 10, data);

        PlaybackView playback = message.dataAs(PlaybackView.class);

        assertThat(playback.isPlaying()).isTrue();
        assertThat(playback.position()).isEqualTo(42.5);
        assertThat(playback.volume()).isEqualTo(70.0);
        assertThat(playback.error()).isNull();
    }

    @Test
    void shouldRequireTypeAndTimestamp() {
        assertThatThrownBy(() -> new ServerMessage(null, "2025-06-01T18:30:00Z", 0, null))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ServerMessage(MessageType.HEARTBEAT, null, 0, null))
                .isInstanceOf(NullPointerException.class);
    }
}
