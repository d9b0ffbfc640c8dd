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

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Args;

/**
 * RFC 6455 opening handshake: request construction and 101 response validation.
 */
public final class Handshake {

    public static final String SEC_WS_VERSION = "13";
    public static final String SEC_WS_KEY = "Sec-WebSocket-Key";
    public static final String SEC_WS_VERSION_HEADER = "Sec-WebSocket-Version";
    public static final String SEC_WS_ACCEPT = "Sec-WebSocket-Accept";
    public static final String WEBSOCKET = "websocket";

    static final String MAGIC_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

    private static final int NONCE_LENGTH = 16;

    private Handshake() {
    }

    public static final class Request {

        private final String requestLine;
        private final List<Header> headers;
        private final String secKey;

        Request(final String requestLine, final List<Header> headers, final String secKey) {
            this.requestLine = requestLine;
            this.headers = Collections.unmodifiableList(headers);
            this.secKey = secKey;
        }

        public String getRequestLine() {
            return requestLine;
        }

        public List<Header> getHeaders() {
            return headers;
        }

        public String getSecKey() {
            return secKey;
        }

        /**
         * Encodes the request head, optionally followed by one more header
         * (the {@code Authorization} header of a retry).
         */
        public ByteBuffer encode(final Header extra) {
            final StringBuilder sb = new StringBuilder(256);
            sb.append(requestLine).append("\r\n");
            for (final Header h : headers) {
                sb.append(h.getName()).append(": ").append(h.getValue()).append("\r\n");
            }
            if (extra != null) {
                sb.append(extra.getName()).append(": ").append(extra.getValue()).append("\r\n");
            }
            sb.append("\r\n");
            return ByteBuffer.wrap(sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        }

        @Override
        public String toString() {
            return requestLine;
        }

    }

    public static Request buildRequest(final String host, final int port, final String path, final SecureRandom random) {
        Args.notBlank(host, "Host");
        Args.notNull(random, "Random");
        final String target = path == null || path.isEmpty() ? "/" : path;
        final String secKey = randomKey(random);

        final List<Header> hdrs = new ArrayList<>();
        hdrs.add(new BasicHeader(HttpHeaders.HOST, host + ":" + port));
        hdrs.add(new BasicHeader(HttpHeaders.UPGRADE, WEBSOCKET));
        hdrs.add(new BasicHeader(HttpHeaders.CONNECTION, "Upgrade"));
        hdrs.add(new BasicHeader(SEC_WS_KEY, secKey));
        hdrs.add(new BasicHeader(SEC_WS_VERSION_HEADER, SEC_WS_VERSION));
        return new Request("GET " + target + " HTTP/1.1", hdrs, secKey);
    }

    /**
     * Checks that {@code response} accepts the upgrade offered with {@code secKey}.
     */
    public static void validate101(final HandshakeResponse response, final String secKey) throws ProtocolException {
        if (response.getStatusCode() != HttpStatus.SC_SWITCHING_PROTOCOLS) {
            throw new ProtocolException("Server returned HTTP status " + response.getStatusCode() + ", expected 101");
        }
        final String upgrade = response.getHeader(HttpHeaders.UPGRADE);
        if (upgrade == null || !WEBSOCKET.equalsIgnoreCase(upgrade.trim())) {
            throw new ProtocolException("Missing/invalid Upgrade header: " + upgrade);
        }
        final String connection = response.getHeader(HttpHeaders.CONNECTION);
        if (connection == null || !containsToken(connection, "upgrade")) {
            throw new ProtocolException("Missing/invalid Connection header: " + connection);
        }
        final String accept = response.getHeader(SEC_WS_ACCEPT);
        if (accept == null || !computeAccept(secKey).equals(accept.trim())) {
            throw new ProtocolException("Invalid value for Sec-WebSocket-Accept: " + accept);
        }
    }

    /**
     * @return base64(SHA-1(key + GUID)) as defined in RFC 6455 section 1.3
     */
    public static String computeAccept(final String secKey) {
        Args.notNull(secKey, "Key");
        try {
            final MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            final byte[] digest = sha1.digest((secKey + MAGIC_GUID).getBytes(StandardCharsets.ISO_8859_1));
            return Base64.getEncoder().encodeToString(digest);
        } catch (final NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-1 not supported", ex);
        }
    }

    static String randomKey(final SecureRandom random) {
        final byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        return Base64.getEncoder().encodeToString(nonce);
    }

    private static boolean containsToken(final String value, final String token) {
        for (final String part : value.split(",")) {
            if (part.trim().toLowerCase(Locale.ROOT).equals(token)) {
                return true;
            }
        }
        return false;
    }

}
