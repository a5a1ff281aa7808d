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

/**
 * The two endpoints of a frontend/worker channel.
 *
 * @author hal.hildebrand
 */
public record EndpointPair(MessageChannel channel, RpcEndpoint frontend, RpcEndpoint backend) {

    /**
     * Connect a frontend loop to a worker loop. The frontend holds its messages until the worker announces itself;
     * the worker announces itself as soon as it is created.
     */
    public static EndpointPair create(EventLoop frontendLoop, EventLoop backendLoop) {
        var channel = new MessageChannel(frontendLoop, backendLoop);
        var frontend = new RpcEndpoint(channel.port1(), Side.MAIN, true);
        var backend = new RpcEndpoint(channel.port2(), Side.WORKER, false);
        backend.signalReady();
        return new EndpointPair(channel, frontend, backend);
    }
}
