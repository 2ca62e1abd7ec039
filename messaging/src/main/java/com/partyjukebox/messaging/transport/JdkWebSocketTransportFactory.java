/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TransportFactory} on top of the JDK {@link java.net.http.WebSocket} client.
 *
 * <p>Text frames delivered in several parts are reassembled before they reach the
 * listener. Each transport reports at most one terminal event, either a close or an
 * error. Handshake failures are reported asynchronously, never from inside
 * {@link #open}.</p>
 */
public class JdkWebSocketTransportFactory implements TransportFactory {

    private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransportFactory.class);

    private final HttpClient httpClient;

    public JdkWebSocketTransportFactory() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(15))
                .build());
    }

    public JdkWebSocketTransportFactory(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public Transport open(URI uri, Duration connectTimeout, TransportListener listener) {
        JdkTransport transport = new JdkTransport(uri, listener);
        log.debug("Opening WebSocket to {}", uri);
        httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .buildAsync(uri, transport)
                .whenCompleteAsync((ws, error) -> {
                    if (error != null) {
                        transport.handshakeFailed(unwrap(error));
                    } else {
                        transport.attach(ws);
                    }
                });
        return transport;
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /** One socket plus its listener adapter. */
    private static final class JdkTransport implements Transport, WebSocket.Listener {

        private final URI uri;
        private final TransportListener listener;
        private final StringBuilder textBuffer = new StringBuilder();
        private final AtomicBoolean opened = new AtomicBoolean();
        private final AtomicBoolean terminated = new AtomicBoolean();
        private volatile WebSocket socket;
        private volatile boolean closeRequested;

        JdkTransport(URI uri, TransportListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        // ─── Transport ──────────────────────────────────────────────

        @Override
        public boolean isOpen() {
            WebSocket ws = socket;
            return ws != null && !terminated.get() && !ws.isInputClosed() && !ws.isOutputClosed();
        }

        @Override
        public void close(int code, String reason) {
            closeRequested = true;
            WebSocket ws = socket;
            if (ws == null || ws.isOutputClosed()) return;
            ws.sendClose(code, reason).whenComplete((w, error) -> {
                if (error != null) {
                    log.debug("Close handshake to {} failed, aborting: {}", uri, error.getMessage());
                    ws.abort();
                }
            });
        }

        @Override
        public void abort() {
            closeRequested = true;
            terminated.set(true);
            WebSocket ws = socket;
            if (ws != null) ws.abort();
        }

        // ─── Handshake outcome ──────────────────────────────────────

        void attach(WebSocket ws) {
            socket = ws;
            if (closeRequested) {
                ws.abort();
            }
        }

        void handshakeFailed(Throwable error) {
            if (terminated.compareAndSet(false, true)) {
                log.debug("WebSocket handshake to {} failed: {}", uri, error.toString());
                listener.onError(this, error);
            }
        }

        // ─── WebSocket.Listener ─────────────────────────────────────

        @Override
        public void onOpen(WebSocket ws) {
            socket = ws;
            if (closeRequested) {
                ws.abort();
                return;
            }
            if (opened.compareAndSet(false, true)) {
                ws.request(1);
                listener.onOpen(this);
            }
        }

        @Override
        public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
            textBuffer.append(data);
            if (last) {
                String text = textBuffer.toString();
                textBuffer.setLength(0);
                if (!terminated.get()) {
                    listener.onText(this, text);
                }
            }
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket ws, ByteBuffer data, boolean last) {
            log.debug("Ignoring binary frame ({} bytes) from {}", data.remaining(), uri);
            ws.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
            if (terminated.compareAndSet(false, true)) {
                listener.onClose(this, statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket ws, Throwable error) {
            if (terminated.compareAndSet(false, true)) {
                listener.onError(this, error);
            }
        }
    }
}
