/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.core;

import com.partyjukebox.common.exception.ConnectAttemptBlockedException;
import com.partyjukebox.common.exception.ConnectionException;
import com.partyjukebox.common.model.ConnectionState;
import com.partyjukebox.common.model.MessageType;
import com.partyjukebox.common.model.ServerMessage;
import com.partyjukebox.messaging.transport.CloseCodes;
import com.partyjukebox.messaging.transport.Transport;
import com.partyjukebox.messaging.transport.TransportFactory;
import com.partyjukebox.messaging.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the real-time connection of one client and is the only object the rest of
 * the application talks to.
 *
 * <h3>State machine</h3>
 * <pre>
 *   DISCONNECTED --connect()--------------&gt; CONNECTING
 *   CONNECTING   --open-------------------&gt; CONNECTED
 *   CONNECTING   --error / timeout--------&gt; ERROR --&gt; RECONNECTING
 *   CONNECTED    --close 1000-------------&gt; DISCONNECTED   (terminal)
 *   CONNECTED    --other close / silence--&gt; ERROR --&gt; RECONNECTING
 *   RECONNECTING --timer------------------&gt; CONNECTING
 *   any          --disconnect()-----------&gt; DISCONNECTED
 * </pre>
 * When the reconnect budget is spent the circuit breaker trips and the manager
 * stays in ERROR until the cooldown elapses; the cooldown re-arms the budget but
 * does not reconnect on its own.
 *
 * <h3>Threading</h3>
 * All state lives on the {@link TaskScheduler} loop. Public operations and transport
 * callbacks are posted there; getters read {@code volatile} snapshots. Every state
 * change is broadcast as a {@link MessageType#CONNECTION_ESTABLISHED} message.
 */
public class ConnectionManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    static final Duration VISIBILITY_STABILIZATION_DELAY = Duration.ofSeconds(1);
    private static final int REJECTION_EXTRA_STEPS = 2;

    private final TaskScheduler scheduler;
    private final TransportFactory transportFactory;
    private final MessageCodec codec;
    private final EventBus eventBus;
    private final ReconnectPolicy reconnectPolicy;
    private final CircuitBreaker circuitBreaker;
    private final HeartbeatMonitor heartbeatMonitor;
    private final TransportListener transportEvents = new TransportEvents();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ConnectionConfig config;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile Transport transport;
    private volatile boolean backgrounded;

    // Loop-confined
    private CompletableFuture<Void> pendingConnect;
    private Instant lastConnectAttempt;
    private TaskScheduler.ScheduledTask reconnectTimer;
    private TaskScheduler.ScheduledTask connectionTimeoutTimer;
    private TaskScheduler.ScheduledTask cooldownTimer;
    private TaskScheduler.ScheduledTask visibilityTimer;

    public ConnectionManager(ConnectionConfig config, TaskScheduler scheduler, TransportFactory transportFactory) {
        this(config, scheduler, transportFactory, new MessageCodec(), new EventBus());
    }

    public ConnectionManager(ConnectionConfig config, TaskScheduler scheduler, TransportFactory transportFactory,
                             MessageCodec codec, EventBus eventBus) {
        this.config = config;
        this.scheduler = scheduler;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.eventBus = eventBus;
        this.reconnectPolicy = ReconnectPolicy.from(config);
        this.circuitBreaker = new CircuitBreaker(config.circuitBreakerCooldown());
        this.heartbeatMonitor = new HeartbeatMonitor(scheduler, config.heartbeatInterval(),
                config.heartbeatTimeoutMultiplier(), config.backgroundHeartbeatTimeoutMultiplier(),
                () -> backgrounded, this::onHeartbeatTimeout);
    }

    // ─── Public API ─────────────────────────────────────────────────

    /**
     * Opens the connection.
     *
     * @return completes once CONNECTED; fails with {@link ConnectionException} when the
     *         handshake fails, times out or is cancelled by {@link #disconnect()}, and with
     *         {@link ConnectAttemptBlockedException} when the breaker is open or the
     *         previous attempt was too recent. While an attempt is in flight the same
     *         attempt is returned.
     */
    public CompletableFuture<Void> connect() {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new ConnectionException("Connection manager is closed"));
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        scheduler.execute(() -> relay(startAttempt(true), result));
        return result;
    }

    /** Drops the connection and every pending timer. Always succeeds. */
    public void disconnect() {
        scheduler.execute(this::doDisconnect);
    }

    public void subscribe(MessageType type, MessageListener listener) {
        eventBus.subscribe(type, listener);
    }

    public void unsubscribe(MessageType type, MessageListener listener) {
        eventBus.unsubscribe(type, listener);
    }

    /** True only when the state is CONNECTED and the socket itself is still open. */
    public boolean isConnected() {
        Transport t = transport;
        return state == ConnectionState.CONNECTED && t != null && t.isOpen();
    }

    public ConnectionState getConnectionStatus() { return state; }

    public ConnectionConfig getConfig() { return config; }

    public int getReconnectAttempt() { return reconnectPolicy.getCurrentAttempt(); }

    public boolean isCircuitOpen() { return circuitBreaker.isTripped(); }

    public boolean isBackgrounded() { return backgrounded; }

    /** Listener invocations that completed normally, across all message types. */
    public long getDispatchedMessageCount() { return eventBus.getDispatchedCount(); }

    /** Listener invocations that threw and were isolated by the event bus. */
    public long getListenerFailureCount() { return eventBus.getFailedCount(); }

    /**
     * Merges the given settings into the current configuration. Reconnect settings
     * apply at once and keep the attempt counter. A new endpoint or role while
     * connected triggers a disconnect followed by a fresh connect.
     *
     * @throws IllegalArgumentException if the merged configuration is invalid
     */
    public void updateConfig(Map<String, Object> partial) {
        config.merge(partial);
        Map<String, Object> settings = new LinkedHashMap<>(partial);
        scheduler.execute(() -> {
            ConnectionConfig next;
            try {
                next = config.merge(settings);
            } catch (IllegalArgumentException e) {
                log.warn("Config update rejected after a concurrent change: {}", e.getMessage());
                return;
            }
            applyConfig(next);
        });
    }

    /** Records host visibility. Coming back to the foreground may trigger a reconnect. */
    public void setBackgrounded(boolean value) {
        scheduler.execute(() -> {
            boolean wasBackgrounded = backgrounded;
            backgrounded = value;
            if (wasBackgrounded && !value) {
                onReturnedToForeground();
            }
        });
    }

    /** Tears the manager down: disconnects, drops all subscriptions and stops the scheduler. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Closing connection manager ({})", config.role().wireName());
        scheduler.execute(() -> {
            doDisconnect();
            cancel(cooldownTimer);
            cooldownTimer = null;
            eventBus.clear();
        });
        scheduler.close();
    }

    // ─── Connect path ───────────────────────────────────────────────

    private CompletableFuture<Void> startAttempt(boolean manual) {
        if (state == ConnectionState.CONNECTING && pendingConnect != null) {
            log.debug("Connect requested while already connecting, joining in-flight attempt");
            return pendingConnect;
        }
        if (state == ConnectionState.CONNECTED) {
            return CompletableFuture.completedFuture(null);
        }
        if (circuitBreaker.isTripped()) {
            Duration remaining = circuitBreaker.remainingCooldown(scheduler.now());
            log.warn("Connect blocked: circuit breaker open for another {}ms", remaining.toMillis());
            return CompletableFuture.failedFuture(new ConnectAttemptBlockedException(
                    ConnectAttemptBlockedException.Reason.CIRCUIT_OPEN,
                    "Circuit breaker open, retry in " + remaining.toMillis() + "ms"));
        }
        Instant now = scheduler.now();
        Duration wait = remainingSpacing(now);
        if (!wait.isZero()) {
            log.warn("Connect blocked: previous attempt was less than {}ms ago",
                    config.minConnectSpacing().toMillis());
            return CompletableFuture.failedFuture(new ConnectAttemptBlockedException(
                    ConnectAttemptBlockedException.Reason.RATE_LIMITED,
                    "Connect attempts are rate limited, retry in " + wait.toMillis() + "ms"));
        }
        if (manual) {
            cancel(reconnectTimer);
            reconnectTimer = null;
        }
        lastConnectAttempt = now;
        return openTransport();
    }

    private CompletableFuture<Void> openTransport() {
        Transport previous = transport;
        if (previous != null) {
            log.debug("Aborting transport replaced by a new attempt");
            releaseTransport();
            previous.abort();
        }
        failPending(new ConnectionException("Connection attempt superseded by a newer one"));
        CompletableFuture<Void> attempt = new CompletableFuture<>();
        pendingConnect = attempt;
        setState(ConnectionState.CONNECTING);

        ConnectionConfig cfg = config;
        URI uri = cfg.handshakeUri();
        log.info("Connecting to {} as {}", uri, cfg.role().wireName());
        Transport opened;
        try {
            opened = transportFactory.open(uri, cfg.connectionTimeout(), transportEvents);
        } catch (RuntimeException e) {
            log.warn("Could not open connection to {}: {}", uri, e.getMessage());
            connectionFailed(new ConnectionException("Could not open connection to " + uri, e));
            return attempt;
        }
        transport = opened;
        cancel(connectionTimeoutTimer);
        connectionTimeoutTimer = scheduler.schedule(() -> onConnectionTimeout(opened), cfg.connectionTimeout());
        return attempt;
    }

    private void onConnectionTimeout(Transport timedOut) {
        if (timedOut != transport || state != ConnectionState.CONNECTING) return;
        connectionTimeoutTimer = null;
        long millis = config.connectionTimeout().toMillis();
        log.warn("Connection attempt timed out after {}ms", millis);
        timedOut.abort();
        connectionFailed(new ConnectionException("Connection timeout after " + millis + "ms"));
    }

    // ─── Transport events (loop thread) ─────────────────────────────

    private void handleOpen(Transport opened) {
        if (opened != transport) {
            log.debug("Ignoring open from a superseded transport");
            opened.abort();
            return;
        }
        cancel(connectionTimeoutTimer);
        connectionTimeoutTimer = null;
        cancel(reconnectTimer);
        reconnectTimer = null;
        cancel(cooldownTimer);
        cooldownTimer = null;
        reconnectPolicy.reset();
        circuitBreaker.reset();

        heartbeatMonitor.start();
        setState(ConnectionState.CONNECTED);
        if (state != ConnectionState.CONNECTED) {
            log.debug("Left CONNECTED from inside a state listener, now {}", state.wireName());
            return;
        }
        log.info("Connected to {}", config.url());
        completePending();
    }

    private void handleText(Transport source, String text) {
        if (source != transport) return;
        codec.decode(text).ifPresent(message -> {
            if (message.type() == MessageType.HEARTBEAT || config.heartbeatOnAnyMessage()) {
                heartbeatMonitor.touch();
            }
            log.debug("Received {} (seq {})", message.type(), message.sequenceNumber());
            eventBus.emit(message);
        });
    }

    private void handleClose(Transport source, int code, String reason) {
        if (source != transport) {
            log.debug("Ignoring close {} from a superseded transport", code);
            return;
        }
        if (code == CloseCodes.NORMAL) {
            log.info("Connection closed normally: {}", reason);
            releaseTransport();
            failPending(new ConnectionException("Connection closed before it was established: " + reason));
            setState(ConnectionState.DISCONNECTED);
            return;
        }
        if (CloseCodes.isServerRejection(code, reason)) {
            log.warn("Server rejected connection (code {}, reason '{}'), backing off", code, reason);
            reconnectPolicy.skip(REJECTION_EXTRA_STEPS);
        } else {
            log.warn("Connection closed abnormally (code {}, reason '{}')", code, reason);
        }
        connectionFailed(new ConnectionException("Connection closed (code " + code + "): " + reason));
    }

    private void handleError(Transport source, Throwable error) {
        if (source != transport) return;
        log.warn("Connection error: {}", error.toString());
        source.abort();
        connectionFailed(new ConnectionException("Connection failed: " + error.getMessage(), error));
    }

    private void onHeartbeatTimeout() {
        Transport current = transport;
        if (current == null || state != ConnectionState.CONNECTED) return;
        current.abort();
        handleClose(current, CloseCodes.ABNORMAL, "Heartbeat timeout");
    }

    // ─── Failure and recovery ───────────────────────────────────────

    private void connectionFailed(ConnectionException cause) {
        releaseTransport();
        failPending(cause);
        setState(ConnectionState.ERROR);
        if (state != ConnectionState.ERROR) {
            log.debug("State listener moved the connection to {}, no reconnect scheduled", state.wireName());
            return;
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed.get()) return;
        cancel(reconnectTimer);
        reconnectTimer = null;
        if (circuitBreaker.isTripped()) return;

        if (reconnectPolicy.isExhausted()) {
            circuitBreaker.trip(scheduler.now());
            log.error("Max reconnection attempts ({}) reached, circuit breaker open for {}ms",
                    reconnectPolicy.getMaxAttempts(), circuitBreaker.getCooldown().toMillis());
            setState(ConnectionState.ERROR);
            cancel(cooldownTimer);
            cooldownTimer = scheduler.schedule(this::onCooldownElapsed, circuitBreaker.getCooldown());
            return;
        }

        int attempt = reconnectPolicy.recordFailure();
        Duration delay = reconnectPolicy.nextDelay(backgrounded);
        log.info("Reconnecting in {}ms (attempt {}/{}{})", delay.toMillis(), attempt,
                reconnectPolicy.getMaxAttempts(), backgrounded ? ", backgrounded" : "");
        setState(ConnectionState.RECONNECTING);
        if (state != ConnectionState.RECONNECTING) return;
        reconnectTimer = scheduler.schedule(this::onReconnectTimer, delay);
    }

    private void onReconnectTimer() {
        reconnectTimer = null;
        if (closed.get()) return;
        if (state != ConnectionState.RECONNECTING && state != ConnectionState.ERROR) {
            log.debug("Reconnect timer fired in state {}, ignoring", state);
            return;
        }
        if (circuitBreaker.isTripped()) return;

        Duration wait = remainingSpacing(scheduler.now());
        if (!wait.isZero()) {
            log.debug("Reconnect inside minimum spacing, re-arming in {}ms", wait.toMillis());
            reconnectTimer = scheduler.schedule(this::onReconnectTimer, wait);
            return;
        }
        lastConnectAttempt = scheduler.now();
        openTransport().whenComplete((ignored, error) -> {
            if (error != null) log.debug("Reconnect attempt failed: {}", error.getMessage());
        });
    }

    private void onCooldownElapsed() {
        cooldownTimer = null;
        if (!circuitBreaker.isTripped()) return;
        circuitBreaker.reset();
        reconnectPolicy.reset();
        log.info("Circuit breaker cooldown elapsed, reconnect attempts re-enabled");
    }

    private void onReturnedToForeground() {
        if (!config.visibilityChangeReconnect()) return;
        cancel(visibilityTimer);
        visibilityTimer = scheduler.schedule(() -> {
            visibilityTimer = null;
            if (state == ConnectionState.ERROR || state == ConnectionState.DISCONNECTED) {
                log.info("Back in foreground while {}, reconnecting", state.wireName());
                startAttempt(true).whenComplete((ignored, error) -> {
                    if (error != null) log.debug("Foreground reconnect not started: {}", error.getMessage());
                });
            }
        }, VISIBILITY_STABILIZATION_DELAY);
    }

    // ─── Disconnect and config ──────────────────────────────────────

    private void doDisconnect() {
        cancel(reconnectTimer);
        reconnectTimer = null;
        cancel(visibilityTimer);
        visibilityTimer = null;
        Transport current = transport;
        releaseTransport();
        if (current != null) {
            current.close(CloseCodes.NORMAL, "Client disconnect");
        }
        failPending(new ConnectionException("Connection attempt cancelled by disconnect"));
        if (state != ConnectionState.DISCONNECTED) {
            setState(ConnectionState.DISCONNECTED);
            log.info("Disconnected");
        }
    }

    private void applyConfig(ConnectionConfig next) {
        ConnectionConfig previous = config;
        config = next;
        reconnectPolicy.reconfigure(next.reconnectInterval(), next.maxReconnectInterval(),
                next.backoffFactor(), next.maxReconnectAttempts(), next.backgroundReconnectDelay());
        circuitBreaker.setCooldown(next.circuitBreakerCooldown());
        heartbeatMonitor.reconfigure(next.heartbeatInterval(), next.heartbeatTimeoutMultiplier(),
                next.backgroundHeartbeatTimeoutMultiplier());
        log.info("Connection config updated: {}", next);

        boolean endpointChanged = !previous.handshakeUri().equals(next.handshakeUri());
        if (state != ConnectionState.CONNECTED) return;
        if (endpointChanged) {
            log.info("Endpoint changed to {}, reconnecting", next.handshakeUri());
            doDisconnect();
            lastConnectAttempt = null;
            startAttempt(true).whenComplete((ignored, error) -> {
                if (error != null) log.warn("Reconnect to new endpoint failed: {}", error.getMessage());
            });
        } else if (!previous.heartbeatInterval().equals(next.heartbeatInterval())) {
            heartbeatMonitor.start();
        }
    }

    // ─── Helpers ────────────────────────────────────────────────────

    private void setState(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) return;
        state = next;
        log.info("Connection state {} -> {}", previous.wireName(), next.wireName());
        eventBus.emit(ServerMessage.connectionStatus(next, scheduler.now()));
    }

    private Duration remainingSpacing(Instant now) {
        if (lastConnectAttempt == null) return Duration.ZERO;
        Duration remaining = config.minConnectSpacing().minus(Duration.between(lastConnectAttempt, now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    private void releaseTransport() {
        transport = null;
        cancel(connectionTimeoutTimer);
        connectionTimeoutTimer = null;
        heartbeatMonitor.stop();
    }

    private void completePending() {
        CompletableFuture<Void> attempt = pendingConnect;
        pendingConnect = null;
        if (attempt != null) attempt.complete(null);
    }

    private void failPending(Throwable cause) {
        CompletableFuture<Void> attempt = pendingConnect;
        pendingConnect = null;
        if (attempt != null) attempt.completeExceptionally(cause);
    }

    private static void relay(CompletableFuture<Void> source, CompletableFuture<Void> target) {
        source.whenComplete((value, error) -> {
            if (error != null) target.completeExceptionally(error);
            else target.complete(value);
        });
    }

    private static void cancel(TaskScheduler.ScheduledTask task) {
        if (task != null) task.cancel();
    }

    /** Hands every transport event to the loop thread. */
    private final class TransportEvents implements TransportListener {
        @Override
        public void onOpen(Transport t) {
            scheduler.execute(() -> handleOpen(t));
        }

        @Override
        public void onText(Transport t, String text) {
            scheduler.execute(() -> handleText(t, text));
        }

        @Override
        public void onClose(Transport t, int code, String reason) {
            scheduler.execute(() -> handleClose(t, code, reason));
        }

        @Override
        public void onError(Transport t, Throwable error) {
            scheduler.execute(() -> handleError(t, error));
        }
    }
}
