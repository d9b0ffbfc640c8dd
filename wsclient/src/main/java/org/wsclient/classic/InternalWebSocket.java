/*
 * ====================================================================
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 * ====================================================================
 *
 * This software consists of voluntary contributions made by many
 * individuals on behalf of the Apache Software Foundation.  For more
 * information on the Apache Software Foundation, please see
 * <http://www.apache.org/>.
 *
 */
package org.wsclient.classic;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.Internal;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wsclient.api.WebSocket;
import org.wsclient.api.WebSocketClientConfig;
import org.wsclient.api.WebSocketListener;
import org.wsclient.api.WebSocketState;
import org.wsclient.frame.FrameReader;
import org.wsclient.frame.FrameWriter;
import org.wsclient.frame.Opcode;
import org.wsclient.frame.WebSocketProtocolException;
import org.wsclient.message.CloseCodec;
import org.wsclient.message.Message;
import org.wsclient.message.MessageAssembler;
import org.wsclient.transport.Transport;

/**
 * Open WebSocket over an upgraded {@link Transport}. Owns the reader thread,
 * the send lock and the connection state.
 */
@Internal
@Contract(threading = ThreadingBehavior.SAFE)
final class InternalWebSocket implements WebSocket {

    private static final Logger LOG = LoggerFactory.getLogger(InternalWebSocket.class);

    private final String host;
    private final int port;
    private final String path;
    private final Transport transport;
    private final WebSocketListener listener;
    private final WebSocketClientConfig config;
    private final FrameWriter frameWriter;
    private final Consumer<InternalWebSocket> onClosed;

    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicReference<WebSocketState> state = new AtomicReference<>(WebSocketState.OPEN);
    private final AtomicReference<Exception> failure = new AtomicReference<>();
    private final AtomicBoolean disconnected = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean closeSent = new AtomicBoolean();

    private volatile Thread reader;

    InternalWebSocket(
            final String host,
            final int port,
            final String path,
            final Transport transport,
            final WebSocketListener listener,
            final WebSocketClientConfig config,
            final SecureRandom random,
            final Consumer<InternalWebSocket> onClosed) {
        this.host = host;
        this.port = port;
        this.path = path;
        this.transport = Args.notNull(transport, "Transport");
        this.listener = Args.notNull(listener, "Listener");
        this.config = Args.notNull(config, "Config");
        this.frameWriter = new FrameWriter(Args.notNull(random, "Random"));
        this.onClosed = onClosed;
    }

    /**
     * Starts the reader thread. Called once, after the handshake has completed.
     */
    void start() {
        final ClassicReaderPump pump = new ClassicReaderPump(
                this,
                new FrameReader(transport, config.getMaxFramePayload()),
                new MessageAssembler(config.getMaxMessageSize()));
        final Thread thread = new Thread(pump, "ws-reader-" + host + ":" + port);
        thread.setDaemon(true);
        reader = thread;
        thread.start();
    }

    @Override
    public void send(final ByteBuffer payload, final Opcode opcode, final Timeout timeout) throws IOException {
        Args.notNull(opcode, "Opcode");
        if (state.get() != WebSocketState.OPEN) {
            throw new ConnectionClosedException("WebSocket is " + state.get());
        }
        final ByteBuffer frame = frameWriter.frame(opcode, payload);
        final Timeout effective = timeout != null ? timeout : config.getSendTimeout();
        sendLock.lock();
        try {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{} >> {} ({} bytes)", this, opcode, payload != null ? payload.remaining() : 0);
            }
            transport.send(frame, effective);
            if (opcode == Opcode.CLOSE) {
                closeSent.set(true);
            }
        } catch (final SocketTimeoutException ex) {
            if (ex.bytesTransferred > 0) {
                // a partial frame is on the wire; nothing can follow it
                fail(ex);
            }
            throw ex;
        } finally {
            sendLock.unlock();
        }
    }

    @Override
    public void send(final ByteBuffer payload, final Opcode opcode) throws IOException {
        send(payload, opcode, null);
    }

    @Override
    public void sendText(final CharSequence data) throws IOException {
        Args.notNull(data, "Data");
        send(StandardCharsets.UTF_8.encode(CharBuffer.wrap(data)), Opcode.TEXT);
    }

    @Override
    public void sendBinary(final ByteBuffer data) throws IOException {
        send(data, Opcode.BINARY);
    }

    @Override
    public void ping(final ByteBuffer data) throws IOException {
        send(data, Opcode.PING);
    }

    @Override
    public void sendClose(final int statusCode, final String reason) throws IOException {
        send(ByteBuffer.wrap(CloseCodec.encode(statusCode, reason)), Opcode.CLOSE);
    }

    /**
     * Handles one complete message on the reader thread.
     *
     * @return {@code false} if the read loop must stop
     */
    boolean dispatch(final Message message) throws IOException {
        final Opcode opcode = message.getOpcode();
        switch (opcode) {
            case CLOSE: {
                final WebSocketState prior = state.getAndSet(WebSocketState.CLOSED);
                final ByteBuffer payload = message.payload();
                final int code = CloseCodec.readCloseCode(payload);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{}: close frame received (code {}, reason '{}')", this, code,
                            CloseCodec.readCloseReason(payload));
                }
                if (prior == WebSocketState.OPEN && !closeSent.get()) {
                    sendCloseQuietly(CloseCodec.isValidCloseCodeToSend(code) ? code : CloseCodec.NORMAL_CLOSURE);
                }
                return false;
            }
            case PING:
                if (state.get() == WebSocketState.OPEN) {
                    send(message.payload(), Opcode.PONG);
                }
                break;
            default:
                break;
        }
        listener.onMessage(this, message.payload(), opcode);
        return true;
    }

    /**
     * Called by the reader thread when the read loop has ended.
     */
    void onReaderExit(final Exception cause) {
        final WebSocketState prior = state.getAndSet(WebSocketState.CLOSED);
        Exception reported = failure.get() != null ? failure.get() : cause;
        if (prior == WebSocketState.CLOSING && reported instanceof IOException) {
            // caused by our own shutdown
            reported = null;
        }
        if (prior == WebSocketState.OPEN && !closeSent.get() && cause instanceof WebSocketProtocolException) {
            sendCloseQuietly(((WebSocketProtocolException) cause).getCloseCode());
        }
        if (reported != null && LOG.isDebugEnabled()) {
            LOG.debug("{}: connection failed: {}", this, reported.toString());
        }
        closeTransport();
        if (disconnected.compareAndSet(false, true)) {
            try {
                listener.onDisconnect(this, reported);
            } catch (final RuntimeException ex) {
                LOG.warn("{}: disconnect listener failed", this, ex);
            }
            if (onClosed != null) {
                onClosed.accept(this);
            }
        }
    }

    private void sendCloseQuietly(final int code) {
        // never wait behind a stalled sender
        if (!sendLock.tryLock()) {
            return;
        }
        try {
            final byte[] payload = CloseCodec.encode(code, "");
            transport.send(frameWriter.frame(Opcode.CLOSE, ByteBuffer.wrap(payload)), config.getCloseWaitTimeout());
            closeSent.set(true);
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: could not send close frame: {}", this, ex.getMessage());
            }
        } finally {
            sendLock.unlock();
        }
    }

    private void fail(final Exception cause) {
        failure.compareAndSet(null, cause);
        closeTransport();
    }

    private void closeTransport() {
        try {
            transport.close();
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: error closing transport: {}", this, ex.getMessage());
            }
        }
    }

    @Override
    public boolean isOpen() {
        return state.get() == WebSocketState.OPEN;
    }

    @Override
    public WebSocketState getState() {
        return state.get();
    }

    @Override
    public void shutdown() {
        if (!state.compareAndSet(WebSocketState.OPEN, WebSocketState.CLOSING)) {
            return;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: shutdown", this);
        }
        try {
            transport.halfCloseWrite();
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("{}: half-close failed, closing: {}", this, ex.getMessage());
            }
            closeTransport();
        }
    }

    @Override
    public boolean awaitTermination(final TimeValue waitTime) throws InterruptedException {
        final Thread thread = reader;
        if (thread == null) {
            return state.get() == WebSocketState.CLOSED;
        }
        if (thread == Thread.currentThread()) {
            return false;
        }
        if (waitTime == null) {
            thread.join();
        } else if (TimeValue.isPositive(waitTime)) {
            thread.join(waitTime.toMilliseconds());
        }
        return !thread.isAlive();
    }

    @Override
    public void close(final CloseMode closeMode) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (closeMode == CloseMode.IMMEDIATE) {
                state.compareAndSet(WebSocketState.OPEN, WebSocketState.CLOSING);
                closeTransport();
            } else {
                shutdown();
                if (!awaitTermination(config.getCloseWaitTimeout())) {
                    closeTransport();
                }
            }
            awaitTermination(null);
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            closeTransport();
        }
    }

    @Override
    public void close() {
        close(CloseMode.GRACEFUL);
    }

    @Override
    public String getRemoteHost() {
        return host;
    }

    @Override
    public int getRemotePort() {
        return port;
    }

    @Override
    public String getRemotePath() {
        return path;
    }

    @Override
    public String toString() {
        return "ws://" + host + ":" + port + path;
    }

}
