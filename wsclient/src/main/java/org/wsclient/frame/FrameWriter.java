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

import java.nio.ByteBuffer;
import java.security.SecureRandom;

import org.apache.hc.core5.util.Args;

/**
 * Encodes client-to-server frames.
 * <p>
 * Every frame is final (FIN set) and masked with a fresh key drawn from the
 * random source handed to the constructor.
 * </p>
 */
public final class FrameWriter {

    public static final int FIN = 0x80;

    private static final int MASK_BIT = 0x80;

    private final SecureRandom random;

    public FrameWriter(final SecureRandom random) {
        this.random = Args.notNull(random, "Random");
    }

    /**
     * @return header, mask key and masked payload in a single buffer ready to write
     */
    public ByteBuffer frame(final Opcode opcode, final ByteBuffer payload) {
        final byte[] key = new byte[FrameMask.KEY_LENGTH];
        random.nextBytes(key);
        return frame(opcode, payload, key);
    }

    public ByteBuffer frame(final Opcode opcode, final ByteBuffer payload, final byte[] maskKey) {
        Args.notNull(opcode, "Opcode");
        Args.check(opcode != Opcode.INVALID, "Invalid opcode");
        Args.check(maskKey != null && maskKey.length == FrameMask.KEY_LENGTH, "Mask key must be 4 bytes");
        final int len = payload != null ? payload.remaining() : 0;
        if (opcode.isControl() && len > Frame.MAX_CONTROL_PAYLOAD) {
            throw new IllegalArgumentException("Control frame payload too large: " + len);
        }

        final int headerLength = headerLength(len);
        final byte[] out = new byte[headerLength + len];
        writeHeader(out, opcode, len, maskKey);
        if (len > 0) {
            payload.duplicate().get(out, headerLength, len);
            FrameMask.apply(out, headerLength, len, maskKey);
        }
        return ByteBuffer.wrap(out);
    }

    static int headerLength(final long len) {
        final int lengthBytes = len <= 125 ? 0 : len <= 0xFFFF ? 2 : 8;
        return 2 + lengthBytes + FrameMask.KEY_LENGTH;
    }

    private static void writeHeader(final byte[] out, final Opcode opcode, final long len, final byte[] maskKey) {
        out[0] = (byte) (FIN | opcode.code() & 0x0F);
        int pos;
        if (len <= 125) {
            out[1] = (byte) (MASK_BIT | len);
            pos = 2;
        } else if (len <= 0xFFFF) {
            out[1] = (byte) (MASK_BIT | 126);
            out[2] = (byte) (len >>> 8);
            out[3] = (byte) len;
            pos = 4;
        } else {
            out[1] = (byte) (MASK_BIT | 127);
            for (int i = 0; i < 8; i++) {
                out[2 + i] = (byte) (len >>> (56 - 8 * i));
            }
            pos = 10;
        }
        System.arraycopy(maskKey, 0, out, pos, FrameMask.KEY_LENGTH);
    }

}
