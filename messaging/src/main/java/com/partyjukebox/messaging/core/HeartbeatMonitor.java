/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

/**
 * Liveness watchdog for an open connection.
 *
 * <p>Ticks every heartbeat interval and compares the time since the last liveness
 * signal against {@code interval * multiplier}, using the background multiplier while
 * the host is backgrounded. A stale connection fires the timeout callback once and
 * the monitor stops itself; it never throws into the scheduler.</p>
 */
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final TaskScheduler scheduler;
    private final Runnable onTimeout;
    private final BooleanSupplier backgrounded;

    private Duration interval;
    private double timeoutMultiplier;
    private double backgroundTimeoutMultiplier;

    private TaskScheduler.ScheduledTask tickTask;
    private volatile Instant lastLiveness;

    public HeartbeatMonitor(TaskScheduler scheduler, Duration interval, double timeoutMultiplier,
                            double backgroundTimeoutMultiplier, BooleanSupplier backgrounded,
                            Runnable onTimeout) {
        this.scheduler = scheduler;
        this.interval = interval;
        this.timeoutMultiplier = timeoutMultiplier;
        this.backgroundTimeoutMultiplier = backgroundTimeoutMultiplier;
        this.backgrounded = backgrounded;
        this.onTimeout = onTimeout;
    }

    public void start() {
        stop();
        lastLiveness = scheduler.now();
        tickTask = scheduler.scheduleAtFixedRate(this::check, interval, interval);
        log.debug("Heartbeat monitor started: interval={}ms", interval.toMillis());
    }

    public void stop() {
        if (tickTask != null) {
            tickTask.cancel();
            tickTask = null;
        }
        lastLiveness = null;
    }

    /** Records a liveness signal. Ignored while stopped. */
    public void touch() {
        if (tickTask != null) {
            lastLiveness = scheduler.now();
        }
    }

    public boolean isRunning() {
        return tickTask != null;
    }

    public Instant getLastLiveness() { return lastLiveness; }

    /** Takes effect on the next {@link #start()}. */
    public void reconfigure(Duration interval, double timeoutMultiplier, double backgroundTimeoutMultiplier) {
        this.interval = interval;
        this.timeoutMultiplier = timeoutMultiplier;
        this.backgroundTimeoutMultiplier = backgroundTimeoutMultiplier;
    }

    /** Timeout window currently in force. */
    public Duration currentTimeout() {
        double multiplier = backgrounded.getAsBoolean() ? backgroundTimeoutMultiplier : timeoutMultiplier;
        return Duration.ofMillis((long) (interval.toMillis() * multiplier));
    }

    private void check() {
        Instant last = lastLiveness;
        if (tickTask == null || last == null) return;
        Duration silence = Duration.between(last, scheduler.now());
        Duration timeout = currentTimeout();
        if (silence.compareTo(timeout) > 0) {
            log.warn("Heartbeat timeout: no liveness signal for {}ms (limit {}ms)",
                    silence.toMillis(), timeout.toMillis());
            stop();
            onTimeout.run();
        }
    }
}
