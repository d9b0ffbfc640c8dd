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
package org.wsclient.handshake;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.ByteArrayBuffer;
import org.wsclient.transport.Transport;

/**
 * Reads HTTP response heads off a {@link Transport} without consuming
 * anything past the terminating empty line, so the first WebSocket frame
 * stays in the stream for the frame reader.
 */
final class HandshakeResponseReader {

    private static final byte[] TERMINATOR = {'\r', '\n', '\r', '\n'};

    private final Transport transport;
    private final int maxHeadSize;
    private final byte[] chunk;

    HandshakeResponseReader(final Transport transport, final int maxHeadSize) {
        this.transport = Args.notNull(transport, "Transport");
        this.maxHeadSize = Args.positive(maxHeadSize, "Max head size");
        this.chunk = new byte[4096];
    }

    /**
     * @return the response head including its terminator, or {@code null} if
     *         the peer closed the stream before a complete head arrived
     */
    String readHead() throws IOException, ProtocolException {
        final ByteArrayBuffer head = new ByteArrayBuffer(1024);
        while (true) {
            final int n = transport.receive(chunk, 0, chunk.length, true);
            if (n < 0) {
                return null;
            }
            final int before = head.length();
            head.append(chunk, 0, n);
            final int end = indexOfTerminator(head, Math.max(0, before - (TERMINATOR.length - 1)));
            final int take = end >= 0 ? end + TERMINATOR.length - before : n;
            if (consume(take) < 0) {
                return null;
            }
            if (end >= 0) {
                return new String(head.array(), 0, end + TERMINATOR.length, StandardCharsets.ISO_8859_1);
            }
            if (head.length() > maxHeadSize) {
                throw new ProtocolException("Response head exceeds " + maxHeadSize + " bytes");
            }
        }
    }

    /**
     * Discards {@code count} bytes of response body.
     *
     * @return {@code false} if the stream ended first
     */
    boolean skip(final long count) throws IOException {
        long remaining = count;
        while (remaining > 0) {
            final int n = transport.receive(chunk, 0, (int) Math.min(chunk.length, remaining), false);
            if (n < 0) {
                return false;
            }
            remaining -= n;
        }
        return true;
    }

    /**
     * Discards a {@code chunked} response body including its trailer section.
     *
     * @return {@code false} if the stream ended first
     * @throws ProtocolException if a chunk header is malformed
     */
    boolean skipChunked() throws IOException, ProtocolException {
        while (true) {
            final String header = readLine();
            if (header == null) {
                return false;
            }
            final int ext = header.indexOf(';');
            final String sizeText = (ext >= 0 ? header.substring(0, ext) : header).trim();
            final long size;
            try {
                size = Long.parseLong(sizeText, 16);
            } catch (final NumberFormatException ex) {
                throw new ProtocolException("Invalid chunk header: " + header);
            }
            if (size < 0) {
                throw new ProtocolException("Invalid chunk header: " + header);
            }
            if (size == 0) {
                String trailer;
                do {
                    trailer = readLine();
                    if (trailer == null) {
                        return false;
                    }
                } while (!trailer.isEmpty());
                return true;
            }
            if (!skip(size)) {
                return false;
            }
            final String crlf = readLine();
            if (crlf == null) {
                return false;
            }
            if (!crlf.isEmpty()) {
                throw new ProtocolException("Missing CRLF after chunk data");
            }
        }
    }

    /**
     * @return the next line without its {@code CRLF}, or {@code null} if the stream ended first
     */
    private String readLine() throws IOException, ProtocolException {
        final ByteArrayBuffer line = new ByteArrayBuffer(64);
        while (true) {
            final int n = transport.receive(chunk, 0, 1, false);
            if (n < 0) {
                return null;
            }
            if (n == 0) {
                continue;
            }
            if (chunk[0] == '\n') {
                int len = line.length();
                if (len > 0 && line.byteAt(len - 1) == '\r') {
                    len--;
                }
                return new String(line.array(), 0, len, StandardCharsets.ISO_8859_1);
            }
            line.append(chunk[0]);
            if (line.length() > maxHeadSize) {
                throw new ProtocolException("Line exceeds " + maxHeadSize + " bytes");
            }
        }
    }

    private int consume(final int count) throws IOException {
        int remaining = count;
        while (remaining > 0) {
            final int n = transport.receive(chunk, 0, remaining, false);
            if (n < 0) {
                return -1;
            }
            remaining -= n;
        }
        return count;
    }

    private static int indexOfTerminator(final ByteArrayBuffer buf, final int from) {
        outer:
        for (int i = from; i <= buf.length() - TERMINATOR.length; i++) {
            for (int j = 0; j < TERMINATOR.length; j++) {
                if (buf.byteAt(i + j) != TERMINATOR[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

}
