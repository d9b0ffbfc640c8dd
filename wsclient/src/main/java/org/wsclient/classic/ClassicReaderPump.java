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
package org.wsclient.classic;

import org.apache.hc.core5.annotation.Internal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wsclient.frame.Frame;
import org.wsclient.frame.FrameReader;
import org.wsclient.message.Message;
import org.wsclient.message.MessageAssembler;

/**
 * Blocking read loop of a connection: frames are read, reassembled and
 * dispatched until the session asks to stop, the stream ends or an error
 * occurs. The session is notified exactly once on exit.
 */
@Internal
final class ClassicReaderPump implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ClassicReaderPump.class);

    private final InternalWebSocket session;
    private final FrameReader frameReader;
    private final MessageAssembler assembler;

    ClassicReaderPump(final InternalWebSocket session, final FrameReader frameReader, final MessageAssembler assembler) {
        this.session = session;
        this.frameReader = frameReader;
        this.assembler = assembler;
    }

    @Override
    public void run() {
        Exception cause = null;
        try {
            while (true) {
                final Frame frame = frameReader.readFrame();
                if (frame == null) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("{}: end of stream", session);
                    }
                    break;
                }
                if (LOG.isDebugEnabled()) {
                    LOG.debug("{} << {}", session, frame);
                }
                final Message message = assembler.accept(frame);
                if (message != null && !session.dispatch(message)) {
                    break;
                }
            }
        } catch (final Exception ex) {
            cause = ex;
        } finally {
            assembler.reset();
            session.onReaderExit(cause);
        }
    }

}
