/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Blocks reconnect attempts after sustained failure until a cooldown passes.
 *
 * <p>The breaker only records state; the {@link ConnectionManager} owns the
 * cooldown timer and calls {@link #reset()} when it fires.</p>
 */
public class CircuitBreaker {

    private volatile boolean tripped;
    private volatile Instant trippedAt;
    private volatile Duration cooldown;

    public CircuitBreaker(Duration cooldown) {
        this.cooldown = cooldown;
    }

    /**
     * Opens the breaker.
     *
     * @return true if this call tripped it, false if it was already open
     */
    public boolean trip(Instant now) {
        if (tripped) return false;
        tripped = true;
        trippedAt = now;
        return true;
    }

    public void reset() {
        tripped = false;
        trippedAt = null;
    }

    public boolean isTripped() { return tripped; }

    Instant getTrippedAt() { return trippedAt; }

    public Duration getCooldown() { return cooldown; }

    public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }

    /** Time left before the breaker may reset; zero when closed or elapsed. */
    public Duration remainingCooldown(Instant now) {
        Instant at = trippedAt;
        if (!tripped || at == null) return Duration.ZERO;
        Duration left = Duration.between(now, at.plus(cooldown));
        return left.isNegative() ? Duration.ZERO : left;
    }
}
