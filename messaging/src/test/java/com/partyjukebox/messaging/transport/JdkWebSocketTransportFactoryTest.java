/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class JdkWebSocketTransportFactoryTest {

    @Test
    void shouldReportRefusedHandshakeAsError() throws Exception {
        int port;
        try (ServerSocket unused = new ServerSocket(0)) {
            port = unused.getLocalPort();
        }
        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        CompletableFuture<Transport> opened = new CompletableFuture<>();

        Transport transport = new JdkWebSocketTransportFactory().open(
                URI.create("ws://127.0.0.1:" + port + "/ws?clientType=display"),
                Duration.ofSeconds(2),
                new TransportListener() {
                    @Override public void onOpen(Transport t) { opened.complete(t); }
                    @Override public void onText(Transport t, String text) { }
                    @Override public void onClose(Transport t, int code, String reason) { }
                    @Override public void onError(Transport t, Throwable error) { failure.complete(error); }
                });

        assertThat(failure.get(10, TimeUnit.SECONDS)).isNotNull();
        assertThat(opened).isNotDone();
        assertThat(transport.isOpen()).isFalse();
    }

    @Test
    void shouldTolerateCloseBeforeHandshakeCompletes() throws Exception {
        int port;
        try (ServerSocket unused = new ServerSocket(0)) {
            port = unused.getLocalPort();
        }
        Transport transport = new JdkWebSocketTransportFactory().open(
                URI.create("ws://127.0.0.1:" + port + "/ws"),
                Duration.ofSeconds(2),
                new TransportListener() {
                    @Override public void onOpen(Transport t) { }
                    @Override public void onText(Transport t, String text) { }
                    @Override public void onClose(Transport t, int code, String reason) { }
                    @Override public void onError(Transport t, Throwable error) { }
                });
        transport.close(CloseCodes.NORMAL, "Client disconnect");

        assertThat(transport.isOpen()).isFalse();
    }
}
