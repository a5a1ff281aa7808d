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

import java.util.function.Consumer;

/**
 * One end of a {@link MessageChannel}.
 *
 * @author hal.hildebrand
 */
public interface MessagePort {

    /**
     * Post a message to the other end. Transferred buffers are moved: the caller's handles are detached when this
     * returns.
     */
    void postMessage(Message message);

    /**
     * Install the receiver of messages posted by the other end. Messages that arrived before a handler was installed
     * are delivered to it in order.
     */
    void setMessageHandler(Consumer<Message> handler);

    /**
     * @return the event loop on which messages arriving at this port are handled
     */
    EventLoop getEventLoop();
}
