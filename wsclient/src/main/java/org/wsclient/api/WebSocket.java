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
package org.wsclient.api;

import java.io.IOException;
import java.nio.ByteBuffer;

import org.apache.hc.core5.io.ModalCloseable;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.wsclient.frame.Opcode;

/**
 * Client-side WebSocket connection.
 *
 * <p>Instances are returned by {@link org.wsclient.classic.ClassicWebSocketClient}
 * once the upgrade handshake (RFC&nbsp;6455) has succeeded. A dedicated reader
 * thread receives frames and reports them to the {@link WebSocketListener}.</p>
 *
 * <h3>Thread-safety</h3>
 * <p>All methods may be called from any thread. Sends are serialized so that
 * frames written by concurrent callers never interleave on the wire. Sends block
 * until the frame has been handed to the transport.</p>
 *
 * <h3>Closing</h3>
 * <p>{@link #shutdown()} half-closes the stream and lets the reader drain it;
 * {@link #close(org.apache.hc.core5.io.CloseMode)} additionally waits for the
 * reader thread to finish. Neither performs a CLOSE handshake on its own; call
 * {@link #sendClose(int, String)} first for that.</p>
 */
public interface WebSocket extends ModalCloseable {

    /**
     * Sends a single, unfragmented frame.
     *
     * @param timeout upper bound for the write; {@code null} uses the configured send timeout
     * @throws java.net.SocketTimeoutException if the write did not complete in time
     * @throws org.apache.hc.core5.http.ConnectionClosedException if the connection is not open
     * @throws IOException on transport failure
     */
    void send(ByteBuffer payload, Opcode opcode, Timeout timeout) throws IOException;

    void send(ByteBuffer payload, Opcode opcode) throws IOException;

    void sendText(CharSequence data) throws IOException;

    void sendBinary(ByteBuffer data) throws IOException;

    /**
     * Sends a PING; the peer's PONG arrives through {@link WebSocketListener#onMessage}.
     */
    void ping(ByteBuffer data) throws IOException;

    /**
     * Sends a CLOSE frame with the given status code and reason. The peer is
     * expected to answer with its own CLOSE, which ends the connection.
     */
    void sendClose(int statusCode, String reason) throws IOException;

    boolean isOpen();

    WebSocketState getState();

    /**
     * Requests local shutdown: half-closes the write side so the peer sees end
     * of stream. Returns immediately. Has no effect unless the connection is open.
     */
    void shutdown();

    /**
     * Waits for the reader thread to finish.
     *
     * @param waitTime maximum time to wait; {@code null} waits indefinitely
     * @return {@code true} if the reader has finished
     */
    boolean awaitTermination(TimeValue waitTime) throws InterruptedException;

    /**
     * Same as {@code close(CloseMode.GRACEFUL)}.
     */
    @Override
    void close();

    String getRemoteHost();

    int getRemotePort();

    String getRemotePath();

}
