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
package org.wsclient.frame;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.ByteBuffer;
import java.security.SecureRandom;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.wsclient.transport.ScriptedTransport;

class FrameCodecTest {

    private static final byte[] KEY = {0x37, (byte) 0xFA, 0x21, 0x3D};

    private static byte[] pattern(final int len) {
        final byte[] p = new byte[len];
        for (int i = 0; i < len; i++) {
            p[i] = (byte) (i * 31 + 7);
        }
        return p;
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 125, 126, 65535, 65536})
    void written_frame_reads_back_with_same_payload(final int len) throws Exception {
        final byte[] payload = pattern(len);
        final ByteBuffer wire = new FrameWriter(new SecureRandom()).frame(Opcode.BINARY, ByteBuffer.wrap(payload));
        final byte[] bytes = new byte[wire.remaining()];
        wire.get(bytes);

        final FrameReader reader = new FrameReader(ScriptedTransport.of(bytes), 1 << 20);
        final Frame frame = reader.readFrame();
        assertTrue(frame.isFin());
        assertTrue(frame.isMasked());
        assertEquals(Opcode.BINARY, frame.getOpcode());
        assertArrayEquals(payload, FrameFixtures.payloadOf(frame));
        assertNull(reader.readFrame());
    }

    @Test
    void header_uses_shortest_length_encoding() {
        final FrameWriter writer = new FrameWriter(new SecureRandom());
        assertEquals(2 + 4 + 125, writer.frame(Opcode.TEXT, ByteBuffer.allocate(125), KEY).remaining());
        assertEquals(4 + 4 + 126, writer.frame(Opcode.TEXT, ByteBuffer.allocate(126), KEY).remaining());
        assertEquals(4 + 4 + 65535, writer.frame(Opcode.TEXT, ByteBuffer.allocate(65535), KEY).remaining());
        assertEquals(10 + 4 + 65536, writer.frame(Opcode.TEXT, ByteBuffer.allocate(65536), KEY).remaining());
    }

    @Test
    void writer_sets_fin_mask_bit_and_key() {
        final ByteBuffer payload = ByteBuffer.wrap(new byte[]{'H', 'i'});
        final ByteBuffer wire = new FrameWriter(new SecureRandom()).frame(Opcode.TEXT, payload, KEY);
        assertEquals(0x81, wire.get(0) & 0xFF);
        assertEquals(0x80 | 2, wire.get(1) & 0xFF);
        for (int i = 0; i < 4; i++) {
            assertEquals(KEY[i], wire.get(2 + i));
        }
        assertEquals((byte) ('H' ^ KEY[0]), wire.get(6));
        assertEquals((byte) ('i' ^ KEY[1]), wire.get(7));
        // source buffer is left untouched
        assertEquals(2, payload.remaining());
    }

    @Test
    void writer_rejects_oversized_control_payload_and_bad_key() {
        final FrameWriter writer = new FrameWriter(new SecureRandom());
        assertThrows(IllegalArgumentException.class,
                () -> writer.frame(Opcode.PING, ByteBuffer.allocate(126)));
        assertThrows(IllegalArgumentException.class,
                () -> writer.frame(Opcode.TEXT, ByteBuffer.allocate(1), new byte[3]));
        assertThrows(IllegalArgumentException.class,
                () -> writer.frame(Opcode.INVALID, ByteBuffer.allocate(1)));
    }

    @Test
    void reader_accepts_unmasked_server_frame() throws Exception {
        final byte[] wire = FrameFixtures.serverText(false, Opcode.TEXT, "Hel");
        final Frame frame = new FrameReader(ScriptedTransport.of(wire), 1024).readFrame();
        assertFalse(frame.isFin());
        assertFalse(frame.isMasked());
        assertEquals(Opcode.TEXT, frame.getOpcode());
        assertEquals(3, frame.getPayloadLength());
    }

    @Test
    void reader_maps_reserved_opcode_to_invalid() throws Exception {
        final byte[] wire = {(byte) 0x83, 0};
        assertEquals(Opcode.INVALID, new FrameReader(ScriptedTransport.of(wire), 1024).readFrame().getOpcode());
    }

    @Test
    void reader_returns_null_when_stream_ends_mid_frame() throws Exception {
        final byte[] full = FrameFixtures.serverFrame(Opcode.BINARY, pattern(300));
        for (final int cut : new int[]{1, 3, 100}) {
            final byte[] partial = new byte[cut];
            System.arraycopy(full, 0, partial, 0, cut);
            assertNull(new FrameReader(ScriptedTransport.of(partial), 1024).readFrame());
        }
    }

    @Test
    void reader_handles_frame_split_across_reads() throws Exception {
        final byte[] wire = FrameFixtures.serverFrame(Opcode.BINARY, pattern(70000));
        final ScriptedTransport transport = ScriptedTransport.of(wire).setMaxChunk(7);
        final Frame frame = new FrameReader(transport, 1 << 20).readFrame();
        assertArrayEquals(pattern(70000), FrameFixtures.payloadOf(frame));
    }

    @Test
    void reader_rejects_frame_above_limit() {
        final byte[] wire = FrameFixtures.serverFrame(Opcode.BINARY, new byte[200]);
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> new FrameReader(ScriptedTransport.of(wire), 100).readFrame());
        assertEquals(WebSocketProtocolException.MESSAGE_TOO_BIG, ex.getCloseCode());
    }

    @Test
    void reader_rejects_64bit_length_with_high_bit_set() {
        final byte[] wire = {(byte) 0x82, 127, (byte) 0x80, 0, 0, 0, 0, 0, 0, 0};
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> new FrameReader(ScriptedTransport.of(wire), 100).readFrame());
        assertEquals(WebSocketProtocolException.PROTOCOL_ERROR, ex.getCloseCode());
    }

    @Test
    void reader_rejects_oversized_control_frame() {
        final byte[] wire = FrameFixtures.serverFrame(Opcode.PING, new byte[126]);
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> new FrameReader(ScriptedTransport.of(wire), 1024).readFrame());
        assertEquals(WebSocketProtocolException.PROTOCOL_ERROR, ex.getCloseCode());
    }

    @Test
    void reader_rejects_fragmented_control_frame() {
        final byte[] wire = FrameFixtures.serverText(false, Opcode.PONG, "x");
        final WebSocketProtocolException ex = assertThrows(WebSocketProtocolException.class,
                () -> new FrameReader(ScriptedTransport.of(wire), 1024).readFrame());
        assertEquals(WebSocketProtocolException.PROTOCOL_ERROR, ex.getCloseCode());
    }

    @Test
    void reader_accepts_control_frame_at_limit() throws Exception {
        final byte[] wire = FrameFixtures.serverFrame(Opcode.CLOSE, pattern(Frame.MAX_CONTROL_PAYLOAD));
        final Frame frame = new FrameReader(ScriptedTransport.of(wire), 1024).readFrame();
        assertEquals(Frame.MAX_CONTROL_PAYLOAD, frame.getPayloadLength());
    }

}
