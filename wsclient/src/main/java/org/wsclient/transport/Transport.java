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
package org.wsclient.transport;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;

import org.apache.hc.core5.util.Timeout;

/**
 * A connected, ordered, reliable byte stream.
 * <p>
 * Implementations must allow one thread to block in {@link #receive} while
 * other threads call {@link #send}, {@link #halfCloseWrite} or {@link #close}.
 * Closing the transport must release a thread blocked in {@link #receive}.
 * </p>
 */
public interface Transport extends Closeable {

    /**
     * Writes all remaining bytes of {@code src}.
     *
     * @param src     the bytes to write
     * @param timeout maximum time to wait for the peer to accept the bytes;
     *                {@code null} or disabled means wait indefinitely
     * @return the number of bytes written
     * @throws java.net.SocketTimeoutException if the timeout expires; its
     *                {@code bytesTransferred} field holds the bytes already written
     * @throws IOException on any other transport failure
     */
    int send(ByteBuffer src, Timeout timeout) throws IOException;

    /**
     * Blocks until at least one byte is available or the stream ends.
     *
     * @param peek if {@code true} the returned bytes remain available to the
     *             next call
     * @return the number of bytes copied, or {@code -1} at end of stream
     */
    int receive(byte[] dst, int off, int len, boolean peek) throws IOException;

    /**
     * Shuts down the write side of the stream; the read side stays usable.
     */
    void halfCloseWrite() throws IOException;

    boolean isOpen();

    InetSocketAddress getRemoteAddress();

}
