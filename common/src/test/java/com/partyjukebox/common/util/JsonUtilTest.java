/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.partyjukebox.common.exception.JukeboxException;
import com.partyjukebox.common.model.PlaybackView;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonUtilTest {

    @Test
    void shouldIgnoreUnknownProperties() throws Exception {
        PlaybackView view = JsonUtil.treeToValue(
                JsonUtil.readTree("{\"status\":\"paused\",\"bitrate\":320}"), PlaybackView.class);

        assertThat(view.status()).isEqualTo("paused");
    }

    @Test
    void shouldWrapBindingFailures() throws Exception {
        assertThatThrownBy(() -> JsonUtil.treeToValue(JsonUtil.readTree("{\"position\":\"later\"}"), PlaybackView.class))
                .isInstanceOf(JukeboxException.class)
                .satisfies(e -> assertThat(((JukeboxException) e).getErrorCode()).isEqualTo("JUKEBOX_JSON"));
    }

    @Test
    void shouldSurfaceParseFailuresAsCheckedException() {
        assertThatThrownBy(() -> JsonUtil.readTree("{broken"))
                .isInstanceOf(JsonProcessingException.class);
    }
}
