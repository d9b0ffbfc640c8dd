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

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;

/**
 * Scheme and opaque token of a {@code WWW-Authenticate} challenge.
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class AuthChallenge {

    private final String scheme;
    private final String token;

    public AuthChallenge(final String scheme, final String token) {
        this.scheme = Args.notNull(scheme, "Scheme");
        this.token = token != null ? token : "";
    }

    /**
     * Splits a header value at its first space. A value without a space
     * is a bare scheme with an empty token.
     */
    public static AuthChallenge parse(final String headerValue) {
        Args.notNull(headerValue, "Header value");
        final int space = headerValue.indexOf(' ');
        if (space < 0) {
            return new AuthChallenge(headerValue, "");
        }
        return new AuthChallenge(headerValue.substring(0, space), headerValue.substring(space + 1));
    }

    public String getScheme() {
        return scheme;
    }

    /**
     * @return the base64 token, empty on a first round
     */
    public String getToken() {
        return token;
    }

    @Override
    public String toString() {
        return token.isEmpty() ? scheme : scheme + " " + token;
    }

}
