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

/**
 * RFC 6455 frame opcodes.
 * <p>
 * The 4-bit opcode values that RFC 6455 leaves reserved (0x3-0x7, 0xB-0xF)
 * decode to {@link #INVALID}.
 * </p>
 */
public enum Opcode {

    CONTINUATION(0x0),
    TEXT(0x1),
    BINARY(0x2),
    CLOSE(0x8),
    PING(0x9),
    PONG(0xA),
    INVALID(-1);

    private final int code;

    Opcode(final int code) {
        this.code = code;
    }

    /**
     * @return the 4-bit wire value, or {@code -1} for {@link #INVALID}
     */
    public int code() {
        return code;
    }

    public boolean isControl() {
        return this == CLOSE || this == PING || this == PONG;
    }

    public static Opcode valueOf(final int code) {
        switch (code & 0x0F) {
            case 0x0:
                return CONTINUATION;
            case 0x1:
                return TEXT;
            case 0x2:
                return BINARY;
            case 0x8:
                return CLOSE;
            case 0x9:
                return PING;
            case 0xA:
                return PONG;
            default:
                return INVALID;
        }
    }

}
