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
package org.wsclient.frame;

/**
 * RFC 6455 section 5.3 payload masking. Applying the same key twice restores the input.
 */
public final class FrameMask {

    public static final int KEY_LENGTH = 4;

    private FrameMask() {
    }

    public static void apply(final byte[] data, final int off, final int len, final byte[] key) {
        for (int i = 0; i < len; i++) {
            data[off + i] ^= key[i & 3];
        }
    }

    public static void apply(final byte[] data, final byte[] key) {
        apply(data, 0, data.length, key);
    }

}
