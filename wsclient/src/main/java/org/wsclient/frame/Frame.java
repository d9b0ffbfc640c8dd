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

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * A single decoded WebSocket frame. The payload has already been unmasked.
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class Frame {

    /**
     * Largest payload a control frame may carry.
     */
    public static final int MAX_CONTROL_PAYLOAD = 125;

    private final boolean fin;
    private final Opcode opcode;
    private final boolean masked;
    private final byte[] payload;

    public Frame(final boolean fin, final Opcode opcode, final boolean masked, final byte[] payload) {
        this.fin = fin;
        this.opcode = Args.notNull(opcode, "Opcode");
        this.masked = masked;
        this.payload = payload != null ? payload : new byte[0];
    }

    public boolean isFin() {
        return fin;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    /**
     * @return {@code true} if the frame arrived with the MASK bit set
     */
    public boolean isMasked() {
        return masked;
    }

    public int getPayloadLength() {
        return payload.length;
    }

    public ByteBuffer payload() {
        return ByteBuffer.wrap(payload).asReadOnlyBuffer();
    }

    @Override
    public String toString() {
        return "[fin=" + fin + ", opcode=" + opcode + ", masked=" + masked + ", length=" + payload.length + "]";
    }

}
