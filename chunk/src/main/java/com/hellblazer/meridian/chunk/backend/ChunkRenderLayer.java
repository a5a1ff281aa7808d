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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.chunk.ChunkPriorityTier;
import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.chunk.LayerChunkProgress;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedObject;

/**
 * Worker side of a layer that requests chunks on every recompute. Requests made through
 * {@link #requestChunk(ChunkManager, Chunk, ChunkPriorityTier, double, boolean)} are counted, and the chunk manager
 * reports the counts to the layer's owner after each pass.
 *
 * @author hal.hildebrand
 */
public abstract class ChunkRenderLayer extends SharedObject {
    long chunkManagerGeneration = -1;

    private int numVisibleChunksNeeded;
    private int numVisibleChunksAvailable;
    private int numPrefetchChunksNeeded;
    private int numPrefetchChunksAvailable;

    protected ChunkRenderLayer(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
    }

    public LayerChunkProgress getProgress() {
        return new LayerChunkProgress(numVisibleChunksNeeded, numVisibleChunksAvailable, numPrefetchChunksNeeded,
                                      numPrefetchChunksAvailable);
    }

    protected void requestChunk(ChunkManager chunkManager, Chunk chunk, ChunkPriorityTier tier, double priority) {
        requestChunk(chunkManager, chunk, tier, priority, true);
    }

    /**
     * Request the chunk for this pass and count it toward this layer's progress.
     */
    protected void requestChunk(ChunkManager chunkManager, Chunk chunk, ChunkPriorityTier tier, double priority,
                                boolean toFrontend) {
        chunkManager.registerLayer(this);
        if (!chunkManager.requestChunk(chunk, tier, priority, toFrontend)) {
            return;
        }
        var available = isAvailable(chunk, toFrontend && !chunk.isBackendOnly());
        if (tier == ChunkPriorityTier.VISIBLE) {
            numVisibleChunksNeeded++;
            if (available) {
                numVisibleChunksAvailable++;
            }
        } else {
            numPrefetchChunksNeeded++;
            if (available) {
                numPrefetchChunksAvailable++;
            }
        }
    }

    void resetProgress() {
        numVisibleChunksNeeded = 0;
        numVisibleChunksAvailable = 0;
        numPrefetchChunksNeeded = 0;
        numPrefetchChunksAvailable = 0;
    }

    private static boolean isAvailable(Chunk chunk, boolean onFrontend) {
        var state = chunk.getState();
        if (onFrontend) {
            return state == ChunkState.GPU_MEMORY;
        }
        return state == ChunkState.SYSTEM_MEMORY_WORKER || state == ChunkState.GPU_MEMORY;
    }
}
