/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CloseCodesTest {

    @Test
    void shouldDetectServerRejection() {
        assertThat(CloseCodes.isServerRejection(1013, null)).isTrue();
        assertThat(CloseCodes.isServerRejection(1008, "Maximum connections reached")).isTrue();
        assertThat(CloseCodes.isServerRejection(1006, "")).isFalse();
        assertThat(CloseCodes.isServerRejection(1000, "Normal closure")).isFalse();
    }
}
