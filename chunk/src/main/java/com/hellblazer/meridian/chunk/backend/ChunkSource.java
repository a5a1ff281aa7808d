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
import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.chunk.ChunkStatistics;
import com.hellblazer.meridian.rpc.CancellationToken;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.Registration;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Worker-side counterpart of a chunk source: a registry of chunks by key and the entry point that downloads them.
 * <p>
 * When the owner disposes the source, the chunks it still holds are dropped from the queue manager.
 *
 * @author hal.hildebrand
 */
public abstract class ChunkSource extends SharedObject {
    private static final Logger log = LoggerFactory.getLogger(ChunkSource.class);

    private final ChunkManager                          chunkManager;
    private final Map<String, Chunk>                    chunks    = new LinkedHashMap<>();
    private final Map<String, List<ChunkStateListener>> listeners = new HashMap<>();
    private long                                        downloadCount;
    private long                                        downloadNanos;
    private long                                        failureCount;

    protected ChunkSource(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        this.chunkManager = rpc.get(Payloads.requireLong(options, "chunkManager"), ChunkManager.class);
        chunkManager.getQueueManager().addSource(this);
    }

    /**
     * Download and decode the chunk's payload, storing it in the chunk. The returned future may complete on any
     * thread; the result is applied on the event loop. Implementations should stop early when the token is
     * canceled.
     */
    public abstract CompletableFuture<Void> download(Chunk chunk, CancellationToken token);

    /**
     * Whether a failed download should be queued again rather than left {@code FAILED}.
     */
    public boolean shouldRetry(Chunk chunk, Throwable error) {
        return false;
    }

    public ChunkManager getChunkManager() {
        return chunkManager;
    }

    public Chunk getChunk(String key) {
        return chunks.get(key);
    }

    public Collection<Chunk> getChunks() {
        return Collections.unmodifiableCollection(chunks.values());
    }

    public int getChunkCount() {
        return chunks.size();
    }

    public Registration addStateListener(String key, ChunkStateListener listener) {
        var keyListeners = listeners.computeIfAbsent(key, k -> new ArrayList<>());
        keyListeners.add(listener);
        return () -> {
            var current = listeners.get(key);
            if (current != null && current.remove(listener) && current.isEmpty()) {
                listeners.remove(key);
            }
        };
    }

    /**
     * @return a snapshot of this source's chunks and download history
     */
    public ChunkStatistics getStatistics() {
        var statistics = new ChunkStatistics();
        for (var chunk : chunks.values()) {
            statistics.addChunk(chunk.getState(), chunk.getPriorityTier(), chunk.getSystemMemoryBytes(),
                                chunk.getGpuMemoryBytes());
        }
        statistics.addDownloads(downloadCount, downloadNanos, failureCount);
        return statistics;
    }

    /**
     * Return the chunk with the given key, creating it in state {@code NEW} if absent.
     *
     * @throws IllegalStateException if the existing chunk is of a different type
     */
    protected <C extends Chunk> C getOrCreateChunk(String key, Class<C> type, Supplier<C> factory) {
        var existing = chunks.get(key);
        if (existing != null) {
            if (!type.isInstance(existing)) {
                throw new IllegalStateException(
                String.format("Chunk %s is a %s, not a %s", key, existing.getClass().getSimpleName(),
                              type.getSimpleName()));
            }
            return type.cast(existing);
        }
        var chunk = factory.get();
        chunk.attach(this, key);
        addChunk(chunk);
        return chunk;
    }

    void addChunk(Chunk chunk) {
        chunks.put(chunk.getKey(), chunk);
    }

    void removeChunk(Chunk chunk) {
        chunks.remove(chunk.getKey());
        chunk.detach();
    }

    void chunkStateChanged(Chunk chunk, ChunkState oldState) {
        var keyListeners = listeners.get(chunk.getKey());
        if (keyListeners == null) {
            return;
        }
        for (var listener : List.copyOf(keyListeners)) {
            try {
                listener.stateChanged(chunk, oldState);
            } catch (RuntimeException e) {
                log.warn("State listener of {} failed", chunk, e);
            }
        }
    }

    void recordDownload(long nanos) {
        downloadCount++;
        downloadNanos += nanos;
    }

    void recordFailure() {
        failureCount++;
    }

    @Override
    protected void disposed() {
        var queueManager = chunkManager.getQueueManager();
        for (var chunk : List.copyOf(chunks.values())) {
            queueManager.dropChunk(chunk);
        }
        listeners.clear();
        queueManager.removeSource(this);
        super.disposed();
    }

    @Override
    public String toString() {
        return String.format("%s[%s chunks=%d]", getClass().getSimpleName(), isShared() ? getRpcId() : "-",
                             chunks.size());
    }
}
