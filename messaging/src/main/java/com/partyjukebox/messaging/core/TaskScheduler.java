/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import java.time.Duration;
import java.time.Instant;

/**
 * The single logical execution context a {@link ConnectionManager} runs on.
 *
 * <p>Every state mutation, transport callback and timer body of one manager is
 * executed by its scheduler, one at a time. Timers return a {@link ScheduledTask}
 * handle so the manager can cancel them on teardown.</p>
 */
public interface TaskScheduler extends AutoCloseable {

    /** Runs the task on the scheduler, inline when the caller is already on it. */
    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, Duration delay);

    ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /** Current time as seen by this scheduler. */
    Instant now();

    /** Stops the scheduler; pending timers are discarded. */
    @Override
    void close();

    /** Cancellable handle for a scheduled timer. */
    interface ScheduledTask {
        void cancel();

        boolean isCancelled();
    }
}
