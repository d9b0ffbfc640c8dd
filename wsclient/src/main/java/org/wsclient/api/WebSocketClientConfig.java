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
package org.wsclient.api;

import org.apache.hc.core5.annotation.Contract;
import org.apache.hc.core5.annotation.ThreadingBehavior;
import org.apache.hc.core5.util.Args;
import org.apache.hc.core5.util.Timeout;
import org.wsclient.auth.SecurityProvider;

/**
 * Immutable WebSocket client configuration.
 */
@Contract(threading = ThreadingBehavior.IMMUTABLE)
public final class WebSocketClientConfig {

    public static final WebSocketClientConfig DEFAULT = custom().build();

    private final Timeout connectTimeout;
    private final Timeout closeWaitTimeout;
    private final Timeout sendTimeout;

    // Framing
    private final int maxFramePayload;
    private final long maxMessageSize;

    // Socket
    private final boolean tcpNoDelay;
    private final int bufferSize;

    // Authentication
    private final SecurityProvider securityProvider;

    private WebSocketClientConfig(
            final Timeout connectTimeout,
            final Timeout closeWaitTimeout,
            final Timeout sendTimeout,
            final int maxFramePayload,
            final long maxMessageSize,
            final boolean tcpNoDelay,
            final int bufferSize,
            final SecurityProvider securityProvider) {
        this.connectTimeout = connectTimeout;
        this.closeWaitTimeout = closeWaitTimeout;
        this.sendTimeout = sendTimeout;
        this.maxFramePayload = maxFramePayload;
        this.maxMessageSize = maxMessageSize;
        this.tcpNoDelay = tcpNoDelay;
        this.bufferSize = bufferSize;
        this.securityProvider = securityProvider;
    }

    public Timeout getConnectTimeout() {
        return connectTimeout;
    }

    public Timeout getCloseWaitTimeout() {
        return closeWaitTimeout;
    }

    /**
     * Default bound for a single frame write; {@link Timeout#DISABLED} waits indefinitely.
     */
    public Timeout getSendTimeout() {
        return sendTimeout;
    }

    public int getMaxFramePayload() {
        return maxFramePayload;
    }

    /**
     * Upper bound for a reassembled message; {@code 0} means unlimited.
     */
    public long getMaxMessageSize() {
        return maxMessageSize;
    }

    public boolean isTcpNoDelay() {
        return tcpNoDelay;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * Backend answering NTLM / Negotiate challenges, or {@code null} if
     * authentication is not supported.
     */
    public SecurityProvider getSecurityProvider() {
        return securityProvider;
    }

    @Override
    public String toString() {
        return "WebSocketClientConfig{" +
                "connectTimeout=" + connectTimeout +
                ", closeWaitTimeout=" + closeWaitTimeout +
                ", sendTimeout=" + sendTimeout +
                ", maxFramePayload=" + maxFramePayload +
                ", maxMessageSize=" + maxMessageSize +
                ", tcpNoDelay=" + tcpNoDelay +
                ", bufferSize=" + bufferSize +
                ", securityProvider=" + securityProvider +
                '}';
    }

    public static Builder custom() {
        return new Builder();
    }

    public static final class Builder {

        private Timeout connectTimeout = Timeout.ofSeconds(10);
        private Timeout closeWaitTimeout = Timeout.ofSeconds(5);
        private Timeout sendTimeout = Timeout.DISABLED;

        private int maxFramePayload = 16 * 1024 * 1024;
        private long maxMessageSize = 0L;

        private boolean tcpNoDelay = true;
        private int bufferSize = 8 * 1024;

        private SecurityProvider securityProvider;

        Builder() {
        }

        public Builder setConnectTimeout(final Timeout v) {
            this.connectTimeout = v;
            return this;
        }

        public Builder setCloseWaitTimeout(final Timeout v) {
            this.closeWaitTimeout = v;
            return this;
        }

        public Builder setSendTimeout(final Timeout v) {
            this.sendTimeout = v;
            return this;
        }

        public Builder setMaxFramePayload(final int v) {
            this.maxFramePayload = v;
            return this;
        }

        public Builder setMaxMessageSize(final long v) {
            this.maxMessageSize = v;
            return this;
        }

        public Builder setTcpNoDelay(final boolean v) {
            this.tcpNoDelay = v;
            return this;
        }

        public Builder setBufferSize(final int v) {
            this.bufferSize = v;
            return this;
        }

        public Builder setSecurityProvider(final SecurityProvider v) {
            this.securityProvider = v;
            return this;
        }

        public WebSocketClientConfig build() {
            Args.notNull(connectTimeout, "Connect timeout");
            Args.notNull(closeWaitTimeout, "Close wait timeout");
            Args.notNull(sendTimeout, "Send timeout");
            Args.positive(maxFramePayload, "Max frame payload");
            Args.notNegative(maxMessageSize, "Max message size");
            Args.positive(bufferSize, "Buffer size");
            return new WebSocketClientConfig(
                    connectTimeout,
                    closeWaitTimeout,
                    sendTimeout,
                    maxFramePayload,
                    maxMessageSize,
                    tcpNoDelay,
                    bufferSize,
                    securityProvider);
        }
    }

}
