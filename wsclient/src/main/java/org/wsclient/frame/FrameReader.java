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

import java.io.IOException;

import org.apache.hc.core5.util.Args;
import org.wsclient.transport.Transport;

/**
 * Blocking RFC 6455 frame reader.
 * <p>
 * End of stream at any point of a frame is reported as {@code null}: the peer
 * has closed the connection. Masked frames are accepted and unmasked.
 * </p>
 */
public final class FrameReader {

    private final Transport transport;
    private final int maxFramePayload;
    private final byte[] header = new byte[8];
    private final byte[] maskKey = new byte[FrameMask.KEY_LENGTH];

    public FrameReader(final Transport transport, final int maxFramePayload) {
        this.transport = Args.notNull(transport, "Transport");
        this.maxFramePayload = Args.positive(maxFramePayload, "Max frame payload");
    }

    /**
     * @return the next frame, or {@code null} if the stream ended
     * @throws WebSocketProtocolException if the frame length is invalid or too large,
     *         or a control frame is fragmented or longer than {@link Frame#MAX_CONTROL_PAYLOAD}
     */
    public Frame readFrame() throws IOException {
        if (!readFully(header, 2)) {
            return null;
        }
        final int b0 = header[0] & 0xFF;
        final int b1 = header[1] & 0xFF;
        final boolean fin = (b0 & 0x80) != 0;
        final Opcode opcode = Opcode.valueOf(b0 & 0x0F);
        final boolean masked = (b1 & 0x80) != 0;
        long len = b1 & 0x7F;

        if (len == 126) {
            if (!readFully(header, 2)) {
                return null;
            }
            len = (header[0] & 0xFF) << 8 | header[1] & 0xFF;
        } else if (len == 127) {
            if (!readFully(header, 8)) {
                return null;
            }
            len = 0;
            for (int i = 0; i < 8; i++) {
                len = len << 8 | header[i] & 0xFF;
            }
            if (len < 0) {
                throw new WebSocketProtocolException(WebSocketProtocolException.PROTOCOL_ERROR,
                        "Invalid 64-bit length");
            }
        }
        if (opcode.isControl()) {
            if (!fin) {
                throw new WebSocketProtocolException(WebSocketProtocolException.PROTOCOL_ERROR,
                        "Fragmented " + opcode + " frame");
            }
            if (len > Frame.MAX_CONTROL_PAYLOAD) {
                throw new WebSocketProtocolException(WebSocketProtocolException.PROTOCOL_ERROR,
                        opcode + " frame payload too large: " + len);
            }
        }
        if (len > maxFramePayload) {
            throw new WebSocketProtocolException(WebSocketProtocolException.MESSAGE_TOO_BIG,
                    "Frame too large: " + len);
        }
        if (masked && !readFully(maskKey, FrameMask.KEY_LENGTH)) {
            return null;
        }

        final byte[] payload = new byte[(int) len];
        if (!readFully(payload, payload.length)) {
            return null;
        }
        if (masked) {
            FrameMask.apply(payload, maskKey);
        }
        return new Frame(fin, opcode, masked, payload);
    }

    private boolean readFully(final byte[] dst, final int len) throws IOException {
        int off = 0;
        while (off < len) {
            final int n = transport.receive(dst, off, len - off, false);
            if (n < 0) {
                return false;
            }
            off += n;
        }
        return true;
    }

}
