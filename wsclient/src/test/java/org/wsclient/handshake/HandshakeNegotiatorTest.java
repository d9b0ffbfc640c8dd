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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import org.apache.hc.client5.http.auth.AuthenticationException;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.http.ProtocolException;
import org.junit.jupiter.api.Test;
import org.wsclient.auth.SecurityContext;
import org.wsclient.auth.SecurityProvider;
import org.wsclient.auth.SecurityToken;
import org.wsclient.transport.ScriptedTransport;

class HandshakeNegotiatorTest {

    private static final byte[] TYPE1 = {1, 1, 1};
    private static final byte[] TYPE2 = {2, 2, 2, 2};
    private static final byte[] TYPE3 = {3, 3, 3, 3, 3};

    private static byte[] bytes(final String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static String b64(final byte[] b) {
        return Base64.getEncoder().encodeToString(b);
    }

    private static String unauthorized(final String challenge, final String body) {
        return "HTTP/1.1 401 Unauthorized\r\n" +
                "WWW-Authenticate: " + challenge + "\r\n" +
                "Content-Length: " + body.length() + "\r\n" +
                "\r\n" + body;
    }

    private static HandshakeNegotiator negotiator(final ScriptedTransport transport, final SecurityProvider provider) {
        return new HandshakeNegotiator(transport, provider, new SampleNonceRandom(), null);
    }

    /**
     * Splits what the client sent into request heads.
     */
    private static List<String> requests(final ScriptedTransport transport) {
        final String all = new String(transport.sent(), StandardCharsets.ISO_8859_1);
        final List<String> heads = new ArrayList<>();
        int start = 0;
        int end;
        while ((end = all.indexOf("\r\n\r\n", start)) >= 0) {
            heads.add(all.substring(start, end + 4));
            start = end + 4;
        }
        return heads;
    }

    @Test
    void plain_upgrade_succeeds() throws Exception {
        final ScriptedTransport transport = ScriptedTransport.of(bytes(HandshakeTest.response101(HandshakeTest.SAMPLE_ACCEPT)));
        final HandshakeResponse response = negotiator(transport, null).negotiate("example.com", 80, "/chat");
        assertEquals(101, response.getStatusCode());
        final List<String> sent = requests(transport);
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).startsWith("GET /chat HTTP/1.1\r\n"));
        assertTrue(sent.get(0).contains("Sec-WebSocket-Key: " + HandshakeTest.SAMPLE_KEY + "\r\n"));
    }

    @Test
    void ntlm_challenge_is_answered_until_upgrade() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final SecurityContext context = mock(SecurityContext.class);
        when(provider.supports("NTLM")).thenReturn(true);
        when(provider.acquireCredentials("NTLM")).thenReturn(context);
        when(context.initialize(isNull(), eq(new byte[0])))
                .thenReturn(new SecurityToken(TYPE1, SecurityToken.Status.CONTINUE));
        when(context.initialize(isNull(), eq(TYPE2)))
                .thenReturn(new SecurityToken(TYPE3, SecurityToken.Status.COMPLETE));

        final ScriptedTransport transport = ScriptedTransport.of(bytes(
                unauthorized("NTLM", "denied") +
                unauthorized("NTLM " + b64(TYPE2), "") +
                HandshakeTest.response101(HandshakeTest.SAMPLE_ACCEPT)));

        final HandshakeResponse response = negotiator(transport, provider).negotiate("example.com", 80, "/");
        assertEquals(101, response.getStatusCode());

        final List<String> sent = requests(transport);
        assertEquals(3, sent.size());
        assertFalse(sent.get(0).contains("Authorization"));
        assertTrue(sent.get(1).contains("Authorization: NTLM " + b64(TYPE1) + "\r\n"));
        assertTrue(sent.get(2).contains("Authorization: NTLM " + b64(TYPE3) + "\r\n"));
        // same key on every attempt
        for (final String request : sent) {
            assertTrue(request.contains("Sec-WebSocket-Key: " + HandshakeTest.SAMPLE_KEY + "\r\n"));
        }
        verify(provider, times(1)).acquireCredentials("NTLM");
        verify(context).dispose();
        assertEquals(0, transport.unread());
    }

    @Test
    void negotiate_uses_http_service_name_of_host() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final SecurityContext context = mock(SecurityContext.class);
        when(provider.supports("Negotiate")).thenReturn(true);
        when(provider.acquireCredentials("Negotiate")).thenReturn(context);
        when(context.initialize(anyString(), any(byte[].class)))
                .thenReturn(new SecurityToken(TYPE1, SecurityToken.Status.COMPLETE));

        final ScriptedTransport transport = new ScriptedTransport(
                InetSocketAddress.createUnresolved("web.example.com", 80));
        transport.feed(bytes(unauthorized("Negotiate", "")
                + HandshakeTest.response101(HandshakeTest.SAMPLE_ACCEPT))).eof();

        negotiator(transport, provider).negotiate("web.example.com", 80, "/");
        verify(context).initialize("HTTP/web.example.com", new byte[0]);
    }

    @Test
    void challenge_without_provider_fails() {
        final ScriptedTransport transport = ScriptedTransport.of(bytes(unauthorized("NTLM", "")));
        assertThrows(AuthenticationException.class,
                () -> negotiator(transport, null).negotiate("example.com", 80, "/"));
    }

    @Test
    void unsupported_scheme_fails() {
        final SecurityProvider provider = mock(SecurityProvider.class);
        when(provider.supports(anyString())).thenReturn(true);
        final ScriptedTransport transport = ScriptedTransport.of(bytes(unauthorized("Basic realm=\"x\"", "")));
        assertThrows(AuthenticationException.class,
                () -> negotiator(transport, provider).negotiate("example.com", 80, "/"));
    }

    @Test
    void challenge_after_completed_exchange_is_a_rejection() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final SecurityContext context = mock(SecurityContext.class);
        when(provider.supports("NTLM")).thenReturn(true);
        when(provider.acquireCredentials("NTLM")).thenReturn(context);
        when(context.initialize(any(), any(byte[].class)))
                .thenReturn(new SecurityToken(TYPE3, SecurityToken.Status.COMPLETE));

        final ScriptedTransport transport = ScriptedTransport.of(bytes(
                unauthorized("NTLM " + b64(TYPE2), "") + unauthorized("NTLM", "")));
        final AuthenticationException ex = assertThrows(AuthenticationException.class,
                () -> negotiator(transport, provider).negotiate("example.com", 80, "/"));
        assertTrue(ex.getMessage().contains("rejected"));
        verify(context).dispose();
    }

    @Test
    void empty_token_from_provider_fails() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final SecurityContext context = mock(SecurityContext.class);
        when(provider.supports("NTLM")).thenReturn(true);
        when(provider.acquireCredentials("NTLM")).thenReturn(context);
        when(context.initialize(any(), any(byte[].class)))
                .thenReturn(new SecurityToken(new byte[0], SecurityToken.Status.CONTINUE));
        final ScriptedTransport transport = ScriptedTransport.of(bytes(unauthorized("NTLM", "")));
        assertThrows(AuthenticationException.class,
                () -> negotiator(transport, provider).negotiate("example.com", 80, "/"));
    }

    @Test
    void unauthorized_without_challenge_is_a_protocol_error() {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("HTTP/1.1 401 Unauthorized\r\n\r\n"));
        final ProtocolException ex = assertThrows(ProtocolException.class,
                () -> negotiator(transport, null).negotiate("example.com", 80, "/"));
        assertTrue(ex.getMessage().contains("401"));
    }

    @Test
    void peer_close_during_handshake() {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("HTTP/1.1 101 Switch"));
        assertThrows(ConnectionClosedException.class,
                () -> negotiator(transport, null).negotiate("example.com", 80, "/"));
    }

    @Test
    void malformed_status_line_fails() {
        final ScriptedTransport transport = ScriptedTransport.of(bytes("NOT-HTTP\r\n\r\n"));
        assertThrows(ProtocolException.class,
                () -> negotiator(transport, null).negotiate("example.com", 80, "/"));
    }

    @Test
    void canonical_host_name_of_unresolved_address_is_its_host_string() {
        assertEquals("ws.example.org",
                HandshakeNegotiator.canonicalHostName(InetSocketAddress.createUnresolved("ws.example.org", 80)));
        assertNull(HandshakeNegotiator.canonicalHostName(null));
    }

    @Test
    void no_security_context_for_plain_upgrade() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final ScriptedTransport transport = ScriptedTransport.of(bytes(HandshakeTest.response101(HandshakeTest.SAMPLE_ACCEPT)));
        negotiator(transport, provider).negotiate("example.com", 80, "/");
        verify(provider, never()).acquireCredentials(anyString());
        assertEquals(0, transport.unread());
    }

    @Test
    void chunked_challenge_body_is_skipped() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final SecurityContext context = mock(SecurityContext.class);
        when(provider.supports("NTLM")).thenReturn(true);
        when(provider.acquireCredentials("NTLM")).thenReturn(context);
        when(context.initialize(any(), any(byte[].class)))
                .thenReturn(new SecurityToken(TYPE1, SecurityToken.Status.COMPLETE));

        final ScriptedTransport transport = ScriptedTransport.of(bytes(
                "HTTP/1.1 401 Unauthorized\r\n" +
                "WWW-Authenticate: NTLM\r\n" +
                "Transfer-Encoding: chunked\r\n" +
                "\r\n" +
                "6\r\ndenied\r\n0\r\n\r\n" +
                HandshakeTest.response101(HandshakeTest.SAMPLE_ACCEPT)));

        final HandshakeResponse response = negotiator(transport, provider).negotiate("example.com", 80, "/");
        assertEquals(101, response.getStatusCode());
        assertEquals(2, requests(transport).size());
        assertEquals(0, transport.unread());
    }

    @Test
    void unsupported_transfer_encoding_on_challenge_fails() throws Exception {
        final SecurityProvider provider = mock(SecurityProvider.class);
        final SecurityContext context = mock(SecurityContext.class);
        when(provider.supports("NTLM")).thenReturn(true);
        when(provider.acquireCredentials("NTLM")).thenReturn(context);

        final ScriptedTransport transport = ScriptedTransport.of(bytes(
                "HTTP/1.1 401 Unauthorized\r\n" +
                "WWW-Authenticate: NTLM\r\n" +
                "Transfer-Encoding: gzip, chunked\r\n" +
                "\r\n"));
        final ProtocolException ex = assertThrows(ProtocolException.class,
                () -> negotiator(transport, provider).negotiate("example.com", 80, "/"));
        assertTrue(ex.getMessage().contains("gzip"));
        verify(context).dispose();
    }

}
