/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by one daemon thread.
 *
 * <p>Task bodies are wrapped so that nothing thrown by a timer or callback escapes
 * onto the executor thread; failures are logged and the loop keeps running.</p>
 */
public class ExecutorTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final Clock clock;
    private volatile Thread loopThread;

    public ExecutorTaskScheduler(String threadName) {
        this(threadName, Clock.systemUTC());
    }

    public ExecutorTaskScheduler(String threadName, Clock clock) {
        this.clock = clock;
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        if (Thread.currentThread() == loopThread) {
            guarded(task).run();
            return;
        }
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler {} is shut down, dropping task", loopThreadName());
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        try {
            return new FutureHandle(executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler {} is shut down, timer not armed", loopThreadName());
            return FutureHandle.CANCELLED;
        }
    }

    @Override
    public ScheduledTask scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period) {
        try {
            return new FutureHandle(executor.scheduleAtFixedRate(guarded(task),
                    initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler {} is shut down, periodic timer not armed", loopThreadName());
            return FutureHandle.CANCELLED;
        }
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public void close() {
        executor.shutdown();
        if (Thread.currentThread() == loopThread) return;
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Scheduler {} did not drain in time, forcing shutdown", loopThreadName());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Unhandled error in connection task on {}", loopThreadName(), e);
            }
        };
    }

    private String loopThreadName() {
        Thread t = loopThread;
        return t != null ? t.getName() : "<not started>";
    }

    private record FutureHandle(ScheduledFuture<?> future) implements ScheduledTask {
        static final ScheduledTask CANCELLED = new ScheduledTask() {
            @Override public void cancel() { }
            @Override public boolean isCancelled() { return true; }
        };

        @Override
        public void cancel() { future.cancel(false); }

        @Override
        public boolean isCancelled() { return future.isCancelled(); }
    }
}
