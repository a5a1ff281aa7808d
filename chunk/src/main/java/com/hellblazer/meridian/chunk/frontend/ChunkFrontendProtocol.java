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
package com.hellblazer.meridian.chunk.frontend;

import com.hellblazer.meridian.chunk.ChunkRpcIds;
import com.hellblazer.meridian.chunk.LayerChunkProgress;
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registration of the frontend chunk handlers.
 *
 * @author hal.hildebrand
 */
public final class ChunkFrontendProtocol {
    private static final Logger  log = LoggerFactory.getLogger(ChunkFrontendProtocol.class);
    private static boolean registered;

    private ChunkFrontendProtocol() {
    }

    public static synchronized void register() {
        if (registered) {
            return;
        }
        registered = true;
        RpcEndpoint.registerHandler(ChunkRpcIds.CHUNK_UPDATE, ChunkFrontendProtocol::updateChunk);
        RpcEndpoint.registerHandler(ChunkRpcIds.CHUNK_LAYER_STATISTICS, ChunkFrontendProtocol::updateLayerStatistics);
    }

    private static void updateChunk(RpcEndpoint rpc, Message message) {
        var sourceId = Payloads.requireLong(message.payload(), "source");
        if (!rpc.has(sourceId)) {
            log.debug("Dropping chunk update for disposed source {}", sourceId);
            return;
        }
        var source = rpc.get(sourceId, FrontendChunkSource.class);
        source.applyUpdate(message);
        source.getChunkManager().getQueueManager().visibleChunksChanged().dispatch();
    }

    private static void updateLayerStatistics(RpcEndpoint rpc, Message message) {
        for (var entry : Payloads.requireArray(message.payload(), "layers")) {
            var layerId = Payloads.requireLong(entry, "id");
            if (!rpc.has(layerId)) {
                log.debug("Dropping progress of disposed layer {}", layerId);
                continue;
            }
            rpc.get(layerId, FrontendChunkRenderLayer.class).setProgress(LayerChunkProgress.fromJson(entry));
        }
    }
}
