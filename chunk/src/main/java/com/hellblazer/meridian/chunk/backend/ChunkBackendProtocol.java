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
package com.hellblazer.meridian.chunk.backend;

import com.hellblazer.meridian.chunk.ChunkRpcIds;
import com.hellblazer.meridian.rpc.CancellationToken;
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.RpcValue;
import com.hellblazer.meridian.rpc.shared.SharedObjectRegistry;

import java.util.concurrent.CompletableFuture;

/**
 * Registration of the worker-side chunk types and handlers.
 *
 * @author hal.hildebrand
 */
public final class ChunkBackendProtocol {
    private static boolean registered;

    private ChunkBackendProtocol() {
    }

    public static synchronized void register() {
        if (registered) {
            return;
        }
        registered = true;
        SharedObjectRegistry.register(ChunkRpcIds.CHUNK_QUEUE_MANAGER, ChunkQueueManager::new);
        SharedObjectRegistry.register(ChunkRpcIds.CHUNK_MANAGER, ChunkManager::new);
        RpcEndpoint.registerHandler(ChunkRpcIds.CHUNK_SOURCE_INVALIDATE, ChunkBackendProtocol::invalidateSource);
        RpcEndpoint.registerPromiseHandler(ChunkRpcIds.REQUEST_CHUNK_STATISTICS,
                                           ChunkBackendProtocol::requestChunkStatistics);
    }

    private static void invalidateSource(RpcEndpoint rpc, Message message) {
        var source = rpc.get(Payloads.requireLong(message.payload(), "id"), ChunkSource.class);
        source.getChunkManager().getQueueManager().invalidateSourceCache(source);
    }

    private static CompletableFuture<RpcValue> requestChunkStatistics(RpcEndpoint rpc, Message message,
                                                                      CancellationToken token) {
        var queueManager = rpc.get(Payloads.requireLong(message.payload(), "queueManager"), ChunkQueueManager.class);
        var sources = Payloads.array();
        for (var source : queueManager.getSources()) {
            var entry = sources.addObject();
            entry.put("id", source.getRpcId());
            entry.set("statistics", source.getStatistics().toJson());
        }
        return CompletableFuture.completedFuture(RpcValue.of(sources));
    }
}
