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

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;

import org.apache.hc.core5.annotation.Internal;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} over a non-blocking {@link SocketChannel}.
 * <p>
 * Reads and writes wait on two separate selectors so that a write can be
 * bounded by a timeout while the reader thread stays parked on the read side.
 * Inbound bytes are staged in a buffer, which is what makes peeking possible.
 * </p>
 */
@Internal
public final class SocketChannelTransport implements Transport {

    private static final Logger LOG = LoggerFactory.getLogger(SocketChannelTransport.class);

    private final SocketChannel channel;
    private final InetSocketAddress remoteAddress;
    private final Selector readSelector;
    private final Selector writeSelector;
    private final ByteBuffer inbound;

    /**
     * @param channel a connected channel; it is switched to non-blocking mode
     */
    public SocketChannelTransport(final SocketChannel channel, final int bufferSize) throws IOException {
        this.channel = Args.notNull(channel, "Channel");
        Args.positive(bufferSize, "Buffer size");
        this.remoteAddress = (InetSocketAddress) channel.getRemoteAddress();
        this.channel.configureBlocking(false);
        this.readSelector = Selector.open();
        this.writeSelector = Selector.open();
        this.channel.register(readSelector, SelectionKey.OP_READ);
        this.channel.register(writeSelector, SelectionKey.OP_WRITE);
        this.inbound = ByteBuffer.allocate(bufferSize);
        this.inbound.flip();
    }

    @Override
    public int send(final ByteBuffer src, final Timeout timeout) throws IOException {
        final long deadline = Timeout.isPositive(timeout) ? System.currentTimeMillis() + timeout.toMilliseconds() : 0;
        int total = 0;
        try {
            while (src.hasRemaining()) {
                final int n = channel.write(src);
                if (n > 0) {
                    total += n;
                    continue;
                }
                long wait = 0;
                if (deadline > 0) {
                    wait = deadline - System.currentTimeMillis();
                    if (wait <= 0) {
                        final SocketTimeoutException ex = new SocketTimeoutException("Send timed out after " + timeout);
                        ex.bytesTransferred = total;
                        throw ex;
                    }
                }
                writeSelector.select(wait);
                writeSelector.selectedKeys().clear();
                if (!channel.isOpen()) {
                    throw new ClosedChannelException();
                }
            }
        } catch (final ClosedSelectorException ex) {
            throw new ClosedChannelException();
        }
        return total;
    }

    @Override
    public int receive(final byte[] dst, final int off, final int len, final boolean peek) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (!inbound.hasRemaining() && fill() < 0) {
            return -1;
        }
        final int n = Math.min(len, inbound.remaining());
        if (peek) {
            final ByteBuffer view = inbound.duplicate();
            view.get(dst, off, n);
        } else {
            inbound.get(dst, off, n);
        }
        return n;
    }

    private int fill() throws IOException {
        inbound.compact();
        try {
            while (true) {
                final int n = channel.read(inbound);
                if (n != 0) {
                    return n;
                }
                readSelector.select();
                readSelector.selectedKeys().clear();
                if (!channel.isOpen()) {
                    throw new ClosedChannelException();
                }
            }
        } catch (final ClosedSelectorException ex) {
            throw new ClosedChannelException();
        } finally {
            inbound.flip();
        }
    }

    @Override
    public void halfCloseWrite() throws IOException {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} shutting down output", remoteAddress);
        }
        channel.shutdownOutput();
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public InetSocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    @Override
    public void close() throws IOException {
        if (!channel.isOpen()) {
            return;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} closing", remoteAddress);
        }
        try {
            channel.close();
        } finally {
            readSelector.close();
            writeSelector.close();
        }
    }

    @Override
    public String toString() {
        return "SocketChannelTransport[" + remoteAddress + "]";
    }

}
