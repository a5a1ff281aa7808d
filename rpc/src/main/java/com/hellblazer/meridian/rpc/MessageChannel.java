/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Meridian.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.meridian.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * Bidirectional asynchronous transport between two event loops.
 * <p>
 * A message posted on one port is delivered as a task on the event loop of the other port, so delivery is FIFO per
 * direction. Nothing is ordered between the two directions.
 *
 * @author hal.hildebrand
 */
public class MessageChannel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageChannel.class);

    private final Port     port1;
    private final Port     port2;
    private volatile boolean closed;

    public MessageChannel(EventLoop loop1, EventLoop loop2) {
        if (loop1 == null || loop2 == null) {
            throw new IllegalArgumentException("Event loops cannot be null");
        }
        port1 = new Port(loop1);
        port2 = new Port(loop2);
        port1.peer = port2;
        port2.peer = port1;
    }

    public MessagePort port1() {
        return port1;
    }

    public MessagePort port2() {
        return port2;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stop delivering messages in both directions. Messages already queued on a loop are dropped when they run.
     */
    @Override
    public void close() {
        closed = true;
    }

    private final class Port implements MessagePort {
        private final EventLoop        loop;
        private final Deque<Message>   backlog = new ArrayDeque<>();
        private volatile Port          peer;
        private Consumer<Message>      handler;

        private Port(EventLoop loop) {
            this.loop = loop;
        }

        @Override
        public void postMessage(Message message) {
            if (closed) {
                throw new IllegalStateException("Channel is closed");
            }
            var moved = message.transfer();
            peer.loop.execute(() -> peer.deliver(moved));
        }

        @Override
        public void setMessageHandler(Consumer<Message> handler) {
            loop.execute(() -> {
                this.handler = handler;
                while (handler != null && !backlog.isEmpty()) {
                    handler.accept(backlog.pollFirst());
                }
            });
        }

        @Override
        public EventLoop getEventLoop() {
            return loop;
        }

        // Runs on this port's loop
        private void deliver(Message message) {
            if (closed) {
                log.debug("Dropping {} on closed channel", message.functionName());
                return;
            }
            if (handler == null) {
                backlog.addLast(message);
                return;
            }
            handler.accept(message);
        }
    }
}
