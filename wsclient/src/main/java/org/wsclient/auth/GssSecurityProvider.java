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

import org.apache.hc.client5.http.auth.AuthenticationException;
import org.apache.hc.client5.http.auth.StandardAuthScheme;
import org.apache.hc.core5.util.Args;
import org.ietf.jgss.GSSContext;
import org.ietf.jgss.GSSCredential;
import org.ietf.jgss.GSSException;
import org.ietf.jgss.GSSManager;
import org.ietf.jgss.GSSName;
import org.ietf.jgss.Oid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecurityProvider} backed by the JDK GSS-API (Kerberos through SPNEGO).
 * <p>
 * Credentials come from the default login context of the JVM, usually the
 * Kerberos ticket cache. The target name is expected in {@code HTTP/host} form
 * and is imported as a host based service name.
 * </p>
 */
public final class GssSecurityProvider implements SecurityProvider {

    private static final Logger LOG = LoggerFactory.getLogger(GssSecurityProvider.class);

    static final String SPNEGO_OID = "1.3.6.1.5.5.2";

    private final GSSManager manager;
    private final boolean delegateCredentials;

    public GssSecurityProvider(final GSSManager manager, final boolean delegateCredentials) {
        this.manager = Args.notNull(manager, "GSS manager");
        this.delegateCredentials = delegateCredentials;
    }

    public GssSecurityProvider() {
        this(GSSManager.getInstance(), true);
    }

    @Override
    public boolean supports(final String scheme) {
        return StandardAuthScheme.SPNEGO.equalsIgnoreCase(scheme);
    }

    @Override
    public SecurityContext acquireCredentials(final String scheme) throws AuthenticationException {
        if (!supports(scheme)) {
            throw new AuthenticationException("Unsupported authentication scheme: " + scheme);
        }
        try {
            final Oid mechanism = new Oid(SPNEGO_OID);
            final GSSCredential credential = manager.createCredential(
                    null, GSSCredential.DEFAULT_LIFETIME, mechanism, GSSCredential.INITIATE_ONLY);
            return new GssContext(mechanism, credential);
        } catch (final GSSException ex) {
            throw new AuthenticationException("Cannot acquire " + scheme + " credentials: " + ex.getMessage(), ex);
        }
    }

    static String toHostBasedService(final String targetName) {
        final int slash = targetName.indexOf('/');
        return slash < 0 ? targetName : targetName.substring(0, slash) + "@" + targetName.substring(slash + 1);
    }

    private final class GssContext implements SecurityContext {

        private final Oid mechanism;
        private final GSSCredential credential;
        private GSSContext context;

        GssContext(final Oid mechanism, final GSSCredential credential) {
            this.mechanism = mechanism;
            this.credential = credential;
        }

        @Override
        public SecurityToken initialize(final String targetName, final byte[] inputToken) throws AuthenticationException {
            try {
                if (context == null) {
                    if (targetName == null) {
                        throw new AuthenticationException("Negotiate authentication requires a target name");
                    }
                    final GSSName peer = manager.createName(toHostBasedService(targetName), GSSName.NT_HOSTBASED_SERVICE);
                    context = manager.createContext(peer, mechanism, credential, GSSContext.DEFAULT_LIFETIME);
                    context.requestMutualAuth(true);
                    context.requestCredDeleg(delegateCredentials);
                }
                final byte[] input = inputToken != null ? inputToken : new byte[0];
                final byte[] output = context.initSecContext(input, 0, input.length);
                return new SecurityToken(output,
                        context.isEstablished() ? SecurityToken.Status.COMPLETE : SecurityToken.Status.CONTINUE);
            } catch (final GSSException ex) {
                throw new AuthenticationException("GSS context initialization failed: " + ex.getMessage(), ex);
            }
        }

        @Override
        public void dispose() {
            try {
                if (context != null) {
                    context.dispose();
                }
                credential.dispose();
            } catch (final GSSException ex) {
                if (LOG.isDebugEnabled()) {
                    LOG.debug("Error disposing GSS context", ex);
                }
            }
        }

    }

}
