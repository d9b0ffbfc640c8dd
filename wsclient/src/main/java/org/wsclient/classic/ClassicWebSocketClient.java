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
import java.net.URI;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.io.ModalCloseable;
import org.apache.hc.core5.util.Args;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wsclient.api.WebSocket;
import org.wsclient.api.WebSocketClientConfig;
import org.wsclient.api.WebSocketListener;
import org.wsclient.handshake.HandshakeNegotiator;
import org.wsclient.transport.Transport;

/**
 * Classic (blocking) WebSocket client with a pluggable transport connector.
 * {@code connect} returns once the upgrade has completed and the reader
 * thread of the new connection has started.
 */
public final class ClassicWebSocketClient implements ModalCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ClassicWebSocketClient.class);

    private static final int DEFAULT_PORT = 80;

    private final WebSocketConnector connector;
    private final WebSocketClientConfig config;
    private final SecureRandom random;
    private final Set<InternalWebSocket> sessions = Collections.newSetFromMap(new ConcurrentHashMap<>());

    public ClassicWebSocketClient() {
        this(WebSocketClientConfig.DEFAULT);
    }

    public ClassicWebSocketClient(final WebSocketClientConfig config) {
        this(new DefaultConnector(config.isTcpNoDelay(), config.getBufferSize()), config);
    }

    public ClassicWebSocketClient(final WebSocketConnector connector, final WebSocketClientConfig config) {
        this(connector, config, new SecureRandom());
    }

    /**
     * @param random source of handshake keys and frame masks
     */
    public ClassicWebSocketClient(
            final WebSocketConnector connector,
            final WebSocketClientConfig config,
            final SecureRandom random) {
        this.connector = Args.notNull(connector, "Connector");
        this.config = Args.notNull(config, "Config");
        this.random = Args.notNull(random, "Random");
    }

    /**
     * Opens a connection to {@code ws://host:port/path}.
     *
     * @throws java.net.UnknownHostException if the host cannot be resolved
     * @throws java.net.ConnectException if no address of the host accepts the connection
     * @throws org.apache.hc.client5.http.auth.AuthenticationException if authentication fails
     * @throws org.apache.hc.core5.http.ConnectionClosedException if the peer closes during the handshake
     * @throws ProtocolException if the server does not accept the upgrade
     */
    public WebSocket connect(
            final String host,
            final int port,
            final String path,
            final WebSocketListener listener) throws IOException, ProtocolException {
        Args.notBlank(host, "Host");
        Args.checkRange(port, 1, 65535, "Port");
        Args.notNull(listener, "Listener");
        final String requestPath = path == null || path.isEmpty() ? "/" : path;

        final Transport transport = connector.connect(host, port, config.getConnectTimeout());
        try {
            final HandshakeNegotiator negotiator = new HandshakeNegotiator(
                    transport, config.getSecurityProvider(), random, config.getSendTimeout());
            negotiator.negotiate(host, port, requestPath);
        } catch (final IOException | ProtocolException | RuntimeException ex) {
            closeQuietly(transport);
            throw ex;
        }

        final InternalWebSocket session = new InternalWebSocket(
                host, port, requestPath, transport, listener, config, random, sessions::remove);
        sessions.add(session);
        session.start();
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: open", session);
        }
        return session;
    }

    /**
     * Opens a connection to a {@code ws} URI. The port defaults to 80 and the
     * path to {@code /}; a query is sent as part of the request target.
     */
    public WebSocket connect(final URI uri, final WebSocketListener listener) throws IOException, ProtocolException {
        Args.notNull(uri, "URI");
        final String scheme = uri.getScheme() != null ? uri.getScheme().toLowerCase(Locale.ROOT) : null;
        if (!"ws".equals(scheme)) {
            throw new ProtocolException("Unsupported URI scheme: " + uri.getScheme());
        }
        final String host = uri.getHost();
        if (host == null) {
            throw new ProtocolException("URI has no host: " + uri);
        }
        final int port = uri.getPort() > 0 ? uri.getPort() : DEFAULT_PORT;
        final StringBuilder path = new StringBuilder();
        path.append(uri.getRawPath() != null && !uri.getRawPath().isEmpty() ? uri.getRawPath() : "/");
        if (uri.getRawQuery() != null) {
            path.append('?').append(uri.getRawQuery());
        }
        return connect(host, port, path.toString(), listener);
    }

    /**
     * Closes every connection opened by this client that is still alive.
     */
    @Override
    public void close(final CloseMode closeMode) {
        final List<InternalWebSocket> snapshot = new ArrayList<>(sessions);
        for (final InternalWebSocket session : snapshot) {
            session.close(closeMode);
        }
        sessions.clear();
    }

    @Override
    public void close() {
        close(CloseMode.GRACEFUL);
    }

    private static void closeQuietly(final Transport transport) {
        try {
            transport.close();
        } catch (final IOException ex) {
            if (LOG.isDebugEnabled()) {
                LOG.debug("Error closing transport: {}", ex.getMessage());
            }
        }
    }

}
