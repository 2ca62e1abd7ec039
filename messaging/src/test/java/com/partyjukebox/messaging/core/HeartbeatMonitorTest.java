/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class HeartbeatMonitorTest {

    private ManualTaskScheduler scheduler;
    private AtomicInteger timeouts;
    private AtomicBoolean backgrounded;
    private HeartbeatMonitor monitor;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        timeouts = new AtomicInteger();
        backgrounded = new AtomicBoolean();
        monitor = new HeartbeatMonitor(scheduler, Duration.ofSeconds(45), 2.0, 3.0,
                backgrounded::get, timeouts::incrementAndGet);
    }

    @Test
    void shouldFireOnceWhenSilenceExceedsWindow() {
        monitor.start();

        scheduler.advance(Duration.ofSeconds(90));
        assertThat(timeouts).hasValue(0);
        scheduler.advance(Duration.ofSeconds(45));
        assertThat(timeouts).hasValue(1);
        assertThat(monitor.isRunning()).isFalse();

        scheduler.advance(Duration.ofMinutes(10));
        assertThat(timeouts).hasValue(1);
    }

    @Test
    void shouldStayQuietWhileTouched() {
        monitor.start();

        for (int i = 0; i < 10; i++) {
            scheduler.advance(Duration.ofSeconds(40));
            monitor.touch();
        }

        assertThat(timeouts).hasValue(0);
        assertThat(monitor.getLastLiveness()).isEqualTo(scheduler.now());
    }

    @Test
    void shouldUseWiderWindowWhenBackgrounded() {
        backgrounded.set(true);
        monitor.start();

        scheduler.advance(Duration.ofSeconds(135));
        assertThat(timeouts).hasValue(0);
        scheduler.advance(Duration.ofSeconds(45));
        assertThat(timeouts).hasValue(1);
        assertThat(monitor.currentTimeout()).isEqualTo(Duration.ofSeconds(135));
    }

    @Test
    void shouldIgnoreTouchWhileStopped() {
        monitor.touch();

        assertThat(monitor.getLastLiveness()).isNull();
        assertThat(scheduler.pendingCount()).isZero();
    }

    @Test
    void shouldCancelTickOnStop() {
        monitor.start();
        assertThat(scheduler.pendingCount()).isEqualTo(1);

        monitor.stop();

        assertThat(scheduler.pendingCount()).isZero();
        scheduler.advance(Duration.ofMinutes(10));
        assertThat(timeouts).hasValue(0);
    }
}
