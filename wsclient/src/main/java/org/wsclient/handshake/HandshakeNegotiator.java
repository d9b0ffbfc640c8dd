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
package org.wsclient.handshake;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.security.SecureRandom;
import java.util.Base64;

import org.apache.hc.client5.http.auth.AuthenticationException;
import org.apache.hc.client5.http.auth.StandardAuthScheme;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.http.HeaderElements;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wsclient.auth.AuthChallenge;
import org.wsclient.auth.SecurityContext;
import org.wsclient.auth.SecurityProvider;
import org.wsclient.auth.SecurityToken;
import org.wsclient.transport.Transport;

/**
 * Drives the opening handshake over a connected {@link Transport}, including
 * the {@code 401} retry loop of connection-based authentication schemes.
 * <p>
 * Each retry resends the original upgrade request, with the same key, plus an
 * {@code Authorization} header carrying the next token of the exchange. One
 * {@link SecurityContext} is acquired on the first challenge and reused for
 * every later round.
 * </p>
 */
public final class HandshakeNegotiator {

    private static final Logger LOG = LoggerFactory.getLogger(HandshakeNegotiator.class);

    public static final int DEFAULT_MAX_HEAD_SIZE = 64 * 1024;

    private final Transport transport;
    private final SecurityProvider securityProvider;
    private final SecureRandom random;
    private final Timeout sendTimeout;
    private final HandshakeResponseReader reader;

    /**
     * @param securityProvider may be {@code null}, in which case any authentication challenge fails the handshake
     */
    public HandshakeNegotiator(
            final Transport transport,
            final SecurityProvider securityProvider,
            final SecureRandom random,
            final Timeout sendTimeout) {
        this.transport = Args.notNull(transport, "Transport");
        this.securityProvider = securityProvider;
        this.random = Args.notNull(random, "Random");
        this.sendTimeout = sendTimeout;
        this.reader = new HandshakeResponseReader(transport, DEFAULT_MAX_HEAD_SIZE);
    }

    /**
     * Performs the upgrade.
     *
     * @return the {@code 101} response
     * @throws ConnectionClosedException if the peer closed the stream before the handshake completed
     * @throws AuthenticationException if an authentication challenge could not be answered
     * @throws ProtocolException if the response is malformed or does not accept the upgrade
     */
    public HandshakeResponse negotiate(final String host, final int port, final String path)
            throws IOException, ProtocolException {
        final Handshake.Request request = Handshake.buildRequest(host, port, path, random);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{} >> {}", host, request);
        }
        transport.send(request.encode(null), sendTimeout);

        SecurityContext securityContext = null;
        String scheme = null;
        boolean providerComplete = false;
        try {
            while (true) {
                final String head = reader.readHead();
                if (head == null) {
                    throw new ConnectionClosedException("Connection closed by peer during handshake");
                }
                final HandshakeResponse response = HandshakeResponse.parse(head);
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} << {}", host, response.getStatusLine());
                }
                final String wwwAuthenticate = response.getHeader(HttpHeaders.WWW_AUTHENTICATE);
                if (response.getStatusCode() != HttpStatus.SC_UNAUTHORIZED || wwwAuthenticate == null) {
                    Handshake.validate101(response, request.getSecKey());
                    return response;
                }

                final AuthChallenge challenge = AuthChallenge.parse(wwwAuthenticate);
                if (providerComplete) {
                    throw new AuthenticationException(challenge.getScheme() + " authentication rejected by " + host);
                }
                if (securityContext == null) {
                    scheme = challenge.getScheme();
                    checkSupported(scheme);
                    securityContext = securityProvider.acquireCredentials(scheme);
                } else if (!scheme.equals(challenge.getScheme())) {
                    throw new AuthenticationException("Authentication scheme changed from " + scheme
                            + " to " + challenge.getScheme());
                }
                discardBody(response);

                final SecurityToken token = securityContext.initialize(targetName(scheme), decode(challenge));
                if (token.isEmpty()) {
                    throw new AuthenticationException(scheme + " security provider produced no token");
                }
                providerComplete = token.isComplete();
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} >> {} (Authorization: {}, {})", host, request, scheme, token);
                }
                final String credentials = scheme + " " + Base64.getEncoder().encodeToString(token.getToken());
                transport.send(request.encode(new BasicHeader(HttpHeaders.AUTHORIZATION, credentials)), sendTimeout);
            }
        } finally {
            if (securityContext != null) {
                securityContext.dispose();
            }
        }
    }

    private void checkSupported(final String scheme) throws AuthenticationException {
        if (!StandardAuthScheme.NTLM.equals(scheme) && !StandardAuthScheme.SPNEGO.equals(scheme)) {
            throw new AuthenticationException("Unsupported authentication scheme: " + scheme);
        }
        if (securityProvider == null || !securityProvider.supports(scheme)) {
            throw new AuthenticationException("No security provider configured for " + scheme + " authentication");
        }
    }

    private String targetName(final String scheme) throws AuthenticationException {
        if (!StandardAuthScheme.SPNEGO.equals(scheme)) {
            return null;
        }
        final String fqdn = canonicalHostName(transport.getRemoteAddress());
        if (fqdn == null) {
            throw new AuthenticationException("Cannot do Negotiate authentication as FQDN not found");
        }
        return "HTTP/" + fqdn;
    }

    static String canonicalHostName(final InetSocketAddress remote) {
        if (remote == null) {
            return null;
        }
        if (remote.isUnresolved()) {
            return remote.getHostString();
        }
        final InetAddress address = remote.getAddress();
        final String name = address.getCanonicalHostName();
        return name.equals(address.getHostAddress()) ? null : name;
    }

    private static byte[] decode(final AuthChallenge challenge) throws AuthenticationException {
        try {
            return Base64.getDecoder().decode(challenge.getToken().trim());
        } catch (final IllegalArgumentException ex) {
            throw new AuthenticationException("Malformed " + challenge.getScheme() + " challenge", ex);
        }
    }

    private void discardBody(final HandshakeResponse response) throws IOException, ProtocolException {
        final String transferEncoding = response.getHeader(HttpHeaders.TRANSFER_ENCODING);
        if (transferEncoding != null) {
            if (!HeaderElements.CHUNKED_ENCODING.equalsIgnoreCase(transferEncoding.trim())) {
                throw new ProtocolException("Unsupported transfer encoding: " + transferEncoding);
            }
            if (!reader.skipChunked()) {
                throw new ConnectionClosedException("Connection closed by peer during handshake");
            }
            return;
        }
        final String contentLength = response.getHeader(HttpHeaders.CONTENT_LENGTH);
        if (contentLength == null) {
            return;
        }
        final long length;
        try {
            length = Long.parseLong(contentLength.trim());
        } catch (final NumberFormatException ex) {
            throw new ProtocolException("Invalid Content-Length: " + contentLength);
        }
        if (length > 0 && !reader.skip(length)) {
            throw new ConnectionClosedException("Connection closed by peer during handshake");
        }
    }

}
