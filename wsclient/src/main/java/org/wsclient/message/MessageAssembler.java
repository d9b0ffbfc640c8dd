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

import org.apache.hc.core5.util.ByteArrayBuffer;
import org.wsclient.frame.Frame;
import org.wsclient.frame.Opcode;
import org.wsclient.frame.WebSocketProtocolException;

/**
 * Joins fragmented frames into messages.
 * <p>
 * Not thread safe: owned by the reader thread of a single connection. The
 * pending opcode and the accumulated bytes are reset every time a message is
 * released.
 * </p>
 */
public final class MessageAssembler {

    private final long maxMessageSize;
    private final ByteArrayBuffer buffer;
    private Opcode pendingOpcode;
    private boolean inProgress;

    /**
     * @param maxMessageSize upper bound of a reassembled message, {@code 0} for none
     */
    public MessageAssembler(final long maxMessageSize) {
        this.maxMessageSize = maxMessageSize;
        this.buffer = new ByteArrayBuffer(1024);
    }

    /**
     * Feeds one frame.
     *
     * @return the completed message, or {@code null} if more fragments are expected
     * @throws WebSocketProtocolException on a stray continuation or an oversized message
     */
    public Message accept(final Frame frame) {
        final Opcode opcode = frame.getOpcode();
        if (opcode.isControl()) {
            // control frames may arrive between the fragments of a message
            return new Message(opcode, toArray(frame));
        }
        if (!frame.isFin()) {
            if (opcode != Opcode.INVALID && opcode != Opcode.CONTINUATION) {
                pendingOpcode = opcode;
            }
            inProgress = true;
            append(frame);
            return null;
        }
        if (inProgress) {
            append(frame);
            if (pendingOpcode == null) {
                reset();
                throw new WebSocketProtocolException(WebSocketProtocolException.PROTOCOL_ERROR,
                        "Fragmented message without a data opcode");
            }
            final Message message = new Message(pendingOpcode, buffer.toByteArray());
            reset();
            return message;
        }
        if (opcode == Opcode.CONTINUATION) {
            throw new WebSocketProtocolException(WebSocketProtocolException.PROTOCOL_ERROR,
                    "Continuation frame without a message in progress");
        }
        checkSize(frame.getPayloadLength());
        return new Message(opcode, toArray(frame));
    }

    public boolean isInProgress() {
        return inProgress;
    }

    public void reset() {
        buffer.clear();
        pendingOpcode = null;
        inProgress = false;
    }

    private void append(final Frame frame) {
        final int length = frame.getPayloadLength();
        checkSize((long) buffer.length() + length);
        buffer.append(toArray(frame), 0, length);
    }

    private void checkSize(final long size) {
        if (maxMessageSize > 0 && size > maxMessageSize) {
            reset();
            throw new WebSocketProtocolException(WebSocketProtocolException.MESSAGE_TOO_BIG,
                    "Message exceeds " + maxMessageSize + " bytes");
        }
    }

    private static byte[] toArray(final Frame frame) {
        final byte[] bytes = new byte[frame.getPayloadLength()];
        frame.payload().get(bytes);
        return bytes;
    }

}
