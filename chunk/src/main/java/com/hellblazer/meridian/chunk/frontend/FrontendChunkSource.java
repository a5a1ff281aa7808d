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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.chunk.ChunkRpcIds;
import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.ProtocolViolationException;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owner of a chunk source. Holds the chunks the worker has sent and applies the worker's state updates to them.
 * <p>
 * Sources are created through {@link FrontendChunkManager#getChunkSource}, which creates the counterpart.
 *
 * @author hal.hildebrand
 */
public abstract class FrontendChunkSource extends SharedObject {
    private static final Logger log = LoggerFactory.getLogger(FrontendChunkSource.class);

    private final FrontendChunkManager       chunkManager;
    private final Map<String, FrontendChunk> chunks = new LinkedHashMap<>();

    protected FrontendChunkSource(FrontendChunkManager chunkManager) {
        this.chunkManager = chunkManager;
    }

    @Override
    public void initializeCounterpart(RpcEndpoint rpc, ObjectNode options) {
        // Not a counted reference: the manager releases its sources before it is disposed
        options.put("chunkManager", chunkManager.getRpcId());
        super.initializeCounterpart(rpc, options);
    }

    public FrontendChunkManager getChunkManager() {
        return chunkManager;
    }

    public FrontendChunk getChunk(String key) {
        return chunks.get(key);
    }

    public Collection<FrontendChunk> getChunks() {
        return Collections.unmodifiableCollection(chunks.values());
    }

    public int getChunkCount() {
        return chunks.size();
    }

    /**
     * Have the worker discard everything it downloaded for this source and fetch it again. The frontend copies are
     * dropped when the worker confirms.
     */
    public void invalidateCache() {
        var payload = Payloads.object();
        payload.put("id", getRpcId());
        getRpc().invoke(ChunkRpcIds.CHUNK_SOURCE_INVALIDATE, payload);
    }

    /**
     * Construct the frontend copy of a chunk from the fields written by the worker chunk's serialization.
     */
    protected abstract FrontendChunk createChunk(String key, Message update);

    /**
     * Called after a chunk has been added.
     */
    protected void chunkAdded(FrontendChunk chunk) {
    }

    /**
     * Called after a chunk has been removed, once its GPU memory is freed.
     */
    protected void chunkRemoved(FrontendChunk chunk) {
    }

    void applyUpdate(Message update) {
        var payload = update.payload();
        if (!Payloads.has(payload, "id")) {
            log.debug("{} invalidated, dropping {} chunks", this, chunks.size());
            clearChunks();
            return;
        }
        var key = Payloads.requireText(payload, "id");
        var state = Payloads.requireEnum(payload, "state", ChunkState.class);
        if (state == ChunkState.EXPIRED) {
            deleteChunk(key);
            return;
        }
        FrontendChunk chunk;
        if (payload.path("new").asBoolean(false)) {
            deleteChunk(key);
            chunk = createChunk(key, update);
            chunks.put(key, chunk);
            chunkAdded(chunk);
        } else {
            chunk = chunks.get(key);
            if (chunk == null) {
                throw new ProtocolViolationException(String.format("%s has no chunk %s", this, key));
            }
        }
        var oldState = chunk.getState();
        chunk.setState(state);
        if (state == ChunkState.GPU_MEMORY) {
            chunk.copyToGpu();
        } else if (oldState == ChunkState.GPU_MEMORY) {
            chunk.freeGpuMemory();
        }
    }

    private void deleteChunk(String key) {
        var chunk = chunks.remove(key);
        if (chunk == null) {
            return;
        }
        if (chunk.getState() == ChunkState.GPU_MEMORY) {
            chunk.freeGpuMemory();
        }
        chunkRemoved(chunk);
    }

    private void clearChunks() {
        for (var key : List.copyOf(chunks.keySet())) {
            deleteChunk(key);
        }
    }

    @Override
    protected void disposed() {
        clearChunks();
        super.disposed();
    }

    @Override
    public String toString() {
        return String.format("%s[%s chunks=%d]", getClass().getSimpleName(), isShared() ? getRpcId() : "-",
                             chunks.size());
    }
}
