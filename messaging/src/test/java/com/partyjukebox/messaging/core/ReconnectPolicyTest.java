/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectPolicyTest {

    private static ReconnectPolicy policy(int maxAttempts, long backgroundExtraMs) {
        return new ReconnectPolicy(Duration.ofMillis(1000), Duration.ofMillis(30_000), 2.0,
                maxAttempts, Duration.ofMillis(backgroundExtraMs));
    }

    @Test
    void shouldDoubleDelayUntilCapped() {
        ReconnectPolicy policy = policy(10, 0);

        assertThat(policy.delayMillis(1)).isEqualTo(1000);
        assertThat(policy.delayMillis(2)).isEqualTo(2000);
        assertThat(policy.delayMillis(3)).isEqualTo(4000);
        assertThat(policy.delayMillis(4)).isEqualTo(8000);
        assertThat(policy.delayMillis(5)).isEqualTo(16000);
        assertThat(policy.delayMillis(6)).isEqualTo(30000);  // capped
        assertThat(policy.delayMillis(7)).isEqualTo(30000);
    }

    @Test
    void shouldApplyGentlerControllerCurve() {
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofMillis(2000), Duration.ofMillis(30_000), 1.5,
                15, Duration.ofMillis(5000));

        assertThat(policy.delayMillis(1)).isEqualTo(2000);
        assertThat(policy.delayMillis(2)).isEqualTo(3000);
        assertThat(policy.delayMillis(3)).isEqualTo(4500);
    }

    @Test
    void shouldIncrementBeforeComputingNextDelay() {
        ReconnectPolicy policy = policy(10, 0);

        assertThat(policy.recordFailure()).isEqualTo(1);
        assertThat(policy.nextDelay(false)).isEqualTo(Duration.ofMillis(1000));
        assertThat(policy.recordFailure()).isEqualTo(2);
        assertThat(policy.nextDelay(false)).isEqualTo(Duration.ofMillis(2000));
    }

    @Test
    void shouldAddBackgroundDelayAfterCap() {
        ReconnectPolicy policy = policy(10, 5000);
        for (int i = 0; i < 8; i++) policy.recordFailure();

        assertThat(policy.nextDelay(false)).isEqualTo(Duration.ofMillis(30_000));
        assertThat(policy.nextDelay(true)).isEqualTo(Duration.ofMillis(35_000));
    }

    @Test
    void shouldClampCounterAtMaxAttempts() {
        ReconnectPolicy policy = policy(3, 0);

        policy.recordFailure();
        policy.skip(5);

        assertThat(policy.getCurrentAttempt()).isEqualTo(3);
        assertThat(policy.isExhausted()).isTrue();
        assertThat(policy.recordFailure()).isEqualTo(3);
    }

    @Test
    void shouldResetToZero() {
        ReconnectPolicy policy = policy(10, 0);
        policy.recordFailure();
        policy.recordFailure();

        policy.reset();

        assertThat(policy.getCurrentAttempt()).isZero();
        assertThat(policy.isExhausted()).isFalse();
    }

    @Test
    void shouldKeepAttemptWhenReconfigured() {
        ReconnectPolicy policy = policy(10, 0);
        policy.skip(6);

        policy.reconfigure(Duration.ofMillis(500), Duration.ofMillis(10_000), 2.0, 4, Duration.ZERO);

        assertThat(policy.getCurrentAttempt()).isEqualTo(4);
        assertThat(policy.delayMillis(2)).isEqualTo(1000);
    }

    @Test
    void shouldRejectZeroAttempt() {
        assertThatThrownBy(() -> policy(10, 0).delayMillis(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
