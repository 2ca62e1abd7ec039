/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import java.time.Duration;

/**
 * Exponential backoff calculator with attempt bookkeeping.
 *
 * <p>{@code delay(n) = min(base * factor^(n-1), max)}; when the host is backgrounded a flat
 * extra delay is added after the cap. The attempt counter stays within
 * {@code [0, maxAttempts]}.</p>
 */
public class ReconnectPolicy {

    private long baseIntervalMs;
    private long maxIntervalMs;
    private double backoffFactor;
    private int maxAttempts;
    private long backgroundExtraDelayMs;
    private volatile int currentAttempt;

    public ReconnectPolicy(Duration baseInterval, Duration maxInterval, double backoffFactor,
                           int maxAttempts, Duration backgroundExtraDelay) {
        reconfigure(baseInterval, maxInterval, backoffFactor, maxAttempts, backgroundExtraDelay);
    }

    public static ReconnectPolicy from(ConnectionConfig config) {
        return new ReconnectPolicy(config.reconnectInterval(), config.maxReconnectInterval(),
                config.backoffFactor(), config.maxReconnectAttempts(), config.backgroundReconnectDelay());
    }

    /** Applies new parameters; the current attempt is kept, clamped to the new maximum. */
    public void reconfigure(Duration baseInterval, Duration maxInterval, double backoffFactor,
                            int maxAttempts, Duration backgroundExtraDelay) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (backoffFactor < 1.0) throw new IllegalArgumentException("backoffFactor must be >= 1");
        this.baseIntervalMs = baseInterval.toMillis();
        this.maxIntervalMs = maxInterval.toMillis();
        this.backoffFactor = backoffFactor;
        this.maxAttempts = maxAttempts;
        this.backgroundExtraDelayMs = backgroundExtraDelay.toMillis();
        this.currentAttempt = Math.min(currentAttempt, maxAttempts);
    }

    /** Pure backoff term for the given 1-based attempt. */
    public long delayMillis(int attempt) {
        if (attempt < 1) throw new IllegalArgumentException("attempt is 1-based, got " + attempt);
        double raw = baseIntervalMs * Math.pow(backoffFactor, attempt - 1);
        return (long) Math.min(raw, maxIntervalMs);
    }

    /** Delay for the current attempt, including the background overlay. */
    public Duration nextDelay(boolean backgrounded) {
        long delay = delayMillis(Math.max(currentAttempt, 1));
        if (backgrounded) delay += backgroundExtraDelayMs;
        return Duration.ofMillis(delay);
    }

    /** Counts one more failed attempt and returns the new attempt number. */
    public int recordFailure() {
        currentAttempt = Math.min(currentAttempt + 1, maxAttempts);
        return currentAttempt;
    }

    /** Advances the counter by extra steps without scheduling anything. */
    public void skip(int steps) {
        currentAttempt = Math.min(currentAttempt + steps, maxAttempts);
    }

    public boolean isExhausted() {
        return currentAttempt >= maxAttempts;
    }

    public void reset() {
        currentAttempt = 0;
    }

    public int getCurrentAttempt() { return currentAttempt; }
    public int getMaxAttempts() { return maxAttempts; }
}
