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

/**
 * Output of one {@link SecurityContext#initialize} round.
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class SecurityToken {

    public enum Status {
        /** The peer is expected to answer with another challenge. */
        CONTINUE,
        /** The context is established on the client side. */
        COMPLETE
    }

    private final byte[] token;
    private final Status status;

    public SecurityToken(final byte[] token, final Status status) {
        this.token = token != null ? token.clone() : new byte[0];
        this.status = status;
    }

    public byte[] getToken() {
        return token.clone();
    }

    public boolean isEmpty() {
        return token.length == 0;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isComplete() {
        return status == Status.COMPLETE;
    }

    @Override
    public String toString() {
        return "[status=" + status + ", length=" + token.length + "]";
    }

}
