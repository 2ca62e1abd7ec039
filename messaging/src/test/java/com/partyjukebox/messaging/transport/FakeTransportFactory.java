/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.partyjukebox.messaging.transport;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Scripted transports for tests. Nothing happens on a transport until the test
 * fires an event on it.
 */
public class FakeTransportFactory implements TransportFactory {

    private final List<FakeTransport> opened = new ArrayList<>();

    @Override
    public Transport open(URI uri, Duration connectTimeout, TransportListener listener) {
        FakeTransport transport = new FakeTransport(uri, listener);
        opened.add(transport);
        return transport;
    }

    public int openCount() {
        return opened.size();
    }

    public FakeTransport last() {
        if (opened.isEmpty()) throw new IllegalStateException("No transport opened yet");
        return opened.get(opened.size() - 1);
    }

    public FakeTransport get(int index) {
        return opened.get(index);
    }

    public static final class FakeTransport implements Transport {
        private final URI uri;
        private final TransportListener listener;
        private boolean open;
        private boolean aborted;
        private Integer closeCode;
        private String closeReason;

        FakeTransport(URI uri, TransportListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        public URI uri() { return uri; }

        public void fireOpen() {
            open = true;
            listener.onOpen(this);
        }

        public void fireText(String text) {
            listener.onText(this, text);
        }

        public void fireClose(int code, String reason) {
            open = false;
            listener.onClose(this, code, reason);
        }

        public void fireError(Throwable error) {
            open = false;
            listener.onError(this, error);
        }

        /** Simulates the socket dying without any event reaching the listener. */
        public void dropSilently() {
            open = false;
        }

        @Override
        public boolean isOpen() { return open; }

        @Override
        public void close(int code, String reason) {
            open = false;
            closeCode = code;
            closeReason = reason;
        }

        @Override
        public void abort() {
            open = false;
            aborted = true;
        }

        public boolean isAborted() { return aborted; }
        public Integer getCloseCode() { return closeCode; }
        public String getCloseReason() { return closeReason; }
    }
}
