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
package org.wsclient.auth;

import java.util.Base64;

import org.apache.hc.client5.http.auth.AuthenticationException;
import org.apache.hc.client5.http.auth.ChallengeType;
import org.apache.hc.client5.http.auth.CredentialsProvider;
import org.apache.hc.client5.http.auth.MalformedChallengeException;
import org.apache.hc.client5.http.auth.NTCredentials;
import org.apache.hc.client5.http.auth.StandardAuthScheme;
import org.apache.hc.client5.http.impl.auth.NTLMScheme;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHttpRequest;
import org.apache.hc.core5.util.Args;

/**
 * {@link SecurityProvider} for {@code NTLM} driven by the HttpClient NTLM engine.
 * <p>
 * The engine speaks in {@code Authorization} header values; this adapter feeds
 * it the raw challenge bytes and hands back the raw response message.
 * </p>
 */
public final class NtlmSecurityProvider implements SecurityProvider {

    private final NTCredentials credentials;

    public NtlmSecurityProvider(final NTCredentials credentials) {
        this.credentials = Args.notNull(credentials, "Credentials");
    }

    public NtlmSecurityProvider(final String userName, final char[] password, final String workstation, final String domain) {
        this(new NTCredentials(userName, password, workstation, domain));
    }

    @Override
    public boolean supports(final String scheme) {
        return StandardAuthScheme.NTLM.equalsIgnoreCase(scheme);
    }

    @Override
    public SecurityContext acquireCredentials(final String scheme) throws AuthenticationException {
        if (!supports(scheme)) {
            throw new AuthenticationException("Unsupported authentication scheme: " + scheme);
        }
        return new NtlmContext(new NTLMScheme());
    }

    private final class NtlmContext implements SecurityContext {

        private final NTLMScheme scheme;
        private final HttpClientContext context;
        private final CredentialsProvider credentialsProvider;

        NtlmContext(final NTLMScheme scheme) {
            this.scheme = scheme;
            this.context = HttpClientContext.create();
            this.credentialsProvider = (authScope, httpContext) -> credentials;
        }

        @Override
        public SecurityToken initialize(final String targetName, final byte[] inputToken) throws AuthenticationException {
            final String challenge = inputToken != null && inputToken.length > 0
                    ? Base64.getEncoder().encodeToString(inputToken)
                    : null;
            try {
                scheme.processChallenge(
                        new org.apache.hc.client5.http.auth.AuthChallenge(ChallengeType.TARGET, StandardAuthScheme.NTLM, challenge, null), context);
            } catch (final MalformedChallengeException ex) {
                throw new AuthenticationException(ex.getMessage(), ex);
            }
            final HttpHost host = new HttpHost(targetName != null ? targetName : "localhost");
            if (!scheme.isResponseReady(host, credentialsProvider, context)) {
                throw new AuthenticationException("NTLM credentials not available");
            }
            final String header = scheme.generateAuthResponse(host, new BasicHttpRequest("GET", "/"), context);
            final String prefix = StandardAuthScheme.NTLM + " ";
            final String encoded = header.startsWith(prefix) ? header.substring(prefix.length()) : header;
            final byte[] token;
            try {
                token = Base64.getDecoder().decode(encoded.trim());
            } catch (final IllegalArgumentException ex) {
                throw new AuthenticationException("Malformed NTLM message: " + ex.getMessage(), ex);
            }
            return new SecurityToken(token,
                    scheme.isChallengeComplete() ? SecurityToken.Status.COMPLETE : SecurityToken.Status.CONTINUE);
        }

        @Override
        public void dispose() {
        }

    }

}
