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

import java.nio.ByteBuffer;

import org.wsclient.frame.Opcode;

/**
 * Application callbacks of a client-side WebSocket.
 *
 * <h3>Threading</h3>
 * Callbacks run on the connection's reader thread. While a callback runs no
 * further frames are read, which also delays automatic PONG replies, so
 * implementations should return quickly and hand long work to their own executors.
 */
public interface WebSocketListener {

    /**
     * Called for every complete message, including PING and PONG frames.
     * A PING has already been answered when this is called. CLOSE frames
     * are not delivered here.
     *
     * @param payload read-only view of the message payload
     * @param opcode  the data opcode of the message; never {@link Opcode#CONTINUATION}
     */
    default void onMessage(final WebSocket ws, final ByteBuffer payload, final Opcode opcode) {
    }

    /**
     * Called exactly once when the reader stops.
     *
     * @param cause the error that ended the connection, or {@code null} if it
     *              was closed cleanly by either side
     */
    default void onDisconnect(final WebSocket ws, final Exception cause) {
    }

}
