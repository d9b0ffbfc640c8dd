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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.hc.core5.http.ProtocolException;
import org.apache.hc.core5.util.Args;

/**
 * Status and headers of one HTTP response to the upgrade request.
 * <p>
 * Header names are matched exactly. When a name repeats, the last value wins.
 * </p>
 */
public final class HandshakeResponse {

    private final String statusLine;
    private final int statusCode;
    private final Map<String, String> headers;

    HandshakeResponse(final String statusLine, final int statusCode, final Map<String, String> headers) {
        this.statusLine = statusLine;
        this.statusCode = statusCode;
        this.headers = Collections.unmodifiableMap(headers);
    }

    /**
     * Parses a response head.
     *
     * @param head status line and header lines, each terminated by CRLF,
     *             with or without the trailing empty line
     */
    public static HandshakeResponse parse(final String head) throws ProtocolException {
        Args.notNull(head, "Response head");
        final String[] lines = head.split("\r\n");
        final String statusLine = lines.length > 0 ? lines[0] : "";
        final int statusCode = parseStatusCode(statusLine);

        final Map<String, String> headers = new LinkedHashMap<>();
        for (int i = 1; i < lines.length; i++) {
            final String line = lines[i];
            final int colon = line.indexOf(':');
            if (colon > 0) {
                headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
            }
        }
        return new HandshakeResponse(statusLine, statusCode, headers);
    }

    static int parseStatusCode(final String statusLine) throws ProtocolException {
        final int space = statusLine.indexOf(' ');
        if (space < 0) {
            throw new ProtocolException("Malformed status line: " + statusLine);
        }
        int end = statusLine.indexOf(' ', space + 1);
        if (end < 0) {
            end = statusLine.length();
        }
        final String token = statusLine.substring(space + 1, end);
        if (token.isEmpty() || token.length() > 3) {
            throw new ProtocolException("Malformed status line: " + statusLine);
        }
        for (int i = 0; i < token.length(); i++) {
            final char ch = token.charAt(i);
            if (ch < '0' || ch > '9') {
                throw new ProtocolException("Malformed status line: " + statusLine);
            }
        }
        return Integer.parseInt(token);
    }

    public String getStatusLine() {
        return statusLine;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getHeader(final String name) {
        return headers.get(name);
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return statusLine;
    }

}
