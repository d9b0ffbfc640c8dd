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
package org.wsclient.message;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Encoding and decoding of RFC 6455 CLOSE frame payloads.
 */
public final class CloseCodec {

    public static final int NORMAL_CLOSURE = 1000;
    public static final int NO_STATUS_RECEIVED = 1005;

    static final int MAX_REASON_LENGTH = 123;

    private CloseCodec() {
    }

    public static int readCloseCode(final ByteBuffer p) {
        if (p.remaining() >= 2) {
            final int b1 = p.get() & 0xFF;
            final int b2 = p.get() & 0xFF;
            return b1 << 8 | b2;
        }
        return NO_STATUS_RECEIVED;
    }

    /**
     * @return the UTF-8 reason following the status code, or an empty string if absent or malformed
     */
    public static String readCloseReason(final ByteBuffer p) {
        if (!p.hasRemaining()) {
            return "";
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(p.slice())
                    .toString();
        } catch (final CharacterCodingException e) {
            return "";
        }
    }

    public static byte[] encode(final int code, final String reason) {
        if (!isValidCloseCodeToSend(code)) {
            throw new IllegalArgumentException("Invalid close code: " + code);
        }
        final byte[] reasonBytes = reason != null ? reason.getBytes(StandardCharsets.UTF_8) : new byte[0];
        if (reasonBytes.length > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("Close reason too long");
        }
        final byte[] payload = new byte[2 + reasonBytes.length];
        payload[0] = (byte) (code >> 8 & 0xFF);
        payload[1] = (byte) (code & 0xFF);
        System.arraycopy(reasonBytes, 0, payload, 2, reasonBytes.length);
        return payload;
    }

    /**
     * Codes an endpoint may put on the wire; 1005, 1006 and 1015 are reserved for local reporting.
     */
    public static boolean isValidCloseCodeToSend(final int code) {
        switch (code) {
            case 1000: // normal
            case 1001: // going away
            case 1002: // protocol error
            case 1003: // unsupported data
            case 1007: // invalid payload
            case 1008: // policy violation
            case 1009: // message too big
            case 1010: // mandatory extension
            case 1011: // internal error
                return true;
            default:
                return code >= 3000 && code <= 4999;
        }
    }

}
