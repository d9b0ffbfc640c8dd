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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.apache.hc.core5.http.ProtocolException;
import org.junit.jupiter.api.Test;
import org.wsclient.transport.ScriptedTransport;

class HandshakeResponseReaderTest {

    private static final String HEAD = "HTTP/1.1 101 Switching Protocols\r\nUpgrade: websocket\r\n\r\n";

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    @Test
    void head_is_read_and_trailing_bytes_stay_in_stream() throws Exception {
        final ScriptedTransport transport = ScriptedTransport.of(bytes(HEAD + "\u0081\u0002hi"));
        final HandshakeResponseReader reader = new HandshakeResponseReader(transport, 1024);
        assertEquals(HEAD, reader.readHead());
        assertEquals(4, transport.unread());
    }

    @Test
    void terminator_split_across_reads_is_found() throws Exception {
        for (final int chunk : new int[]{1, 2, 3, 5, 7}) {
            final ScriptedTransport transport = ScriptedTransport.of(bytes(HEAD + "xyz")).setMaxChunk(chunk);
            final HandshakeResponseReader reader = new HandshakeResponseReader(transport, 1024);
            assertEquals(HEAD, reader.readHead());
            assertEquals(3, transport.unread());
        }
    }

    @Test
    void end_of_stream_before_head_completes_returns_null() throws Exception {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("HTTP/1.1 101 Switching\r\n"));
        assertNull(new HandshakeResponseReader(transport, 1024).readHead());
    }

    @Test
    void oversized_head_is_rejected() {
        final StringBuilder sb = new StringBuilder("HTTP/1.1 101 OK\r\n");
        for (int i = 0; i < 100; i++) {
            sb.append("X-Filler-").append(i).append(": aaaaaaaaaaaaaaaa\r\n");
        }
        final ScriptedTransport transport = ScriptedTransport.of(bytes(sb.toString()));
        assertThrows(ProtocolException.class, () -> new HandshakeResponseReader(transport, 256).readHead());
    }

    @Test
    void skip_discards_body_bytes() throws Exception {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("0123456789")).setMaxChunk(3);
        final HandshakeResponseReader reader = new HandshakeResponseReader(transport, 1024);
        assertTrue(reader.skip(8));
        assertEquals(2, transport.unread());
        assertFalse(reader.skip(5));
    }

    @Test
    void chunked_body_with_extension_and_trailer_is_skipped() throws Exception {
        final String body = "5;name=value\r\nhello\r\n3\r\n!!!\r\n0\r\nX-Trailer: t\r\n\r\n";
        final ScriptedTransport transport = ScriptedTransport.of(bytes(body + "next")).setMaxChunk(3);
        assertTrue(new HandshakeResponseReader(transport, 1024).skipChunked());
        assertEquals(4, transport.unread());
    }

    @Test
    void chunked_body_cut_short_reports_end_of_stream() throws Exception {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("a\r\nabc"));
        assertFalse(new HandshakeResponseReader(transport, 1024).skipChunked());
    }

    @Test
    void malformed_chunk_size_is_rejected() {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("zz\r\n\r\n"));
        assertThrows(ProtocolException.class, () -> new HandshakeResponseReader(transport, 1024).skipChunked());
    }

}
