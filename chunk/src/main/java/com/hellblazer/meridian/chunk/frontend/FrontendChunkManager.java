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
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.shared.SharedObject;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Owner of a chunk manager, and the memo of the chunk sources created under it.
 *
 * @author hal.hildebrand
 */
public class FrontendChunkManager extends SharedObject {
    private final FrontendChunkQueueManager        queueManager;
    private final Map<String, FrontendChunkSource> sources = new LinkedHashMap<>();

    public FrontendChunkManager(FrontendChunkQueueManager queueManager) {
        this.queueManager = queueManager;
        queueManager.addRef();
        registerDisposer(queueManager::release);
        registerDisposer(this::releaseSources);
        var options = Payloads.object();
        options.set("chunkQueueManager", queueManager.addCounterpartRef().toJson());
        initializeCounterpart(queueManager.getRpc(), options);
    }

    @Override
    public String getRpcTypeId() {
        return ChunkRpcIds.CHUNK_MANAGER;
    }

    public FrontendChunkQueueManager getQueueManager() {
        return queueManager;
    }

    /**
     * Return the source registered under the key, creating it and its counterpart on first use. The caller receives
     * a reference it must release; the manager keeps its own until it is disposed.
     *
     * @throws IllegalStateException if the source registered under the key is of a different type
     */
    public <S extends FrontendChunkSource> S getChunkSource(String key, Class<S> type, Supplier<S> factory) {
        var existing = sources.get(key);
        if (existing != null && !existing.isDisposed()) {
            if (!type.isInstance(existing)) {
                throw new IllegalStateException(
                String.format("Source %s is a %s, not a %s", key, existing.getClass().getSimpleName(),
                              type.getSimpleName()));
            }
            existing.addRef();
            return type.cast(existing);
        }
        var source = factory.get();
        source.initializeCounterpart(getRpc(), Payloads.object());
        sources.put(key, source);
        source.addRef();
        return source;
    }

    public int getSourceCount() {
        return sources.size();
    }

    private void releaseSources() {
        var held = List.copyOf(sources.values());
        sources.clear();
        for (var source : held) {
            if (!source.isDisposed()) {
                source.release();
            }
        }
    }
}
