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
package org.wsclient.classic;

import java.io.IOException;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.channels.SocketChannel;

import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wsclient.transport.SocketChannelTransport;
import org.wsclient.transport.Transport;

/**
 * Resolves the host and tries each address in turn until one accepts a TCP connection.
 */
public final class DefaultConnector implements WebSocketConnector {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultConnector.class);

    public static final int DEFAULT_BUFFER_SIZE = 8 * 1024;

    private final boolean tcpNoDelay;
    private final int bufferSize;

    public DefaultConnector(final boolean tcpNoDelay, final int bufferSize) {
        this.tcpNoDelay = tcpNoDelay;
        this.bufferSize = Args.positive(bufferSize, "Buffer size");
    }

    public DefaultConnector() {
        this(true, DEFAULT_BUFFER_SIZE);
    }

    @Override
    public Transport connect(final String host, final int port, final Timeout connectTimeout) throws IOException {
        Args.notBlank(host, "Host");
        final InetAddress[] addresses = InetAddress.getAllByName(host);
        final int timeoutMs = Timeout.isPositive(connectTimeout) ? connectTimeout.toMillisecondsIntBound() : 0;
        IOException last = null;
        for (final InetAddress address : addresses) {
            final InetSocketAddress remote = new InetSocketAddress(address, port);
            final SocketChannel channel = SocketChannel.open();
            try {
                channel.socket().setTcpNoDelay(tcpNoDelay);
                channel.socket().connect(remote, timeoutMs);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Connected to {}", remote);
                }
                return new SocketChannelTransport(channel, bufferSize);
            } catch (final IOException ex) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Connect to {} failed: {}", remote, ex.getMessage());
                }
                channel.close();
                last = ex;
            }
        }
        final ConnectException ex = new ConnectException("Could not connect to " + host + ":" + port);
        if (last != null) {
            ex.initCause(last);
        }
        throw ex;
    }

}
