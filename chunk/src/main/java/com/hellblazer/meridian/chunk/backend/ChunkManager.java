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
import com.hellblazer.meridian.chunk.ChunkRpcIds;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import com.hellblazer.meridian.rpc.shared.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects chunk requests during a recompute pass and hands the resulting priorities to the queue manager.
 * <p>
 * A pass dispatches {@link #recomputeChunkPriorities()} and then {@link #recomputeChunkPrioritiesLate()}; listeners
 * call {@link #requestChunk} for every chunk they want. When both signals have run, every chunk requested in this
 * pass takes its most urgent requested priority, and every chunk that was in an ordered tier but was not requested
 * drops to {@code RECENT}.
 *
 * @author hal.hildebrand
 */
public class ChunkManager extends SharedObject {
    private static final Logger                 log   = LoggerFactory.getLogger(ChunkManager.class);
    private static final List<ChunkPriorityTier> TIERS = List.of(ChunkPriorityTier.VISIBLE,
                                                                  ChunkPriorityTier.PREFETCH);

    private final ChunkQueueManager                          queueManager;
    private final Map<ChunkPriorityTier, List<Chunk>>        existingTierChunks = new EnumMap<>(
    ChunkPriorityTier.class);
    private final List<Chunk>                                newTierChunks      = new ArrayList<>();
    private final Signal                                     recomputeChunkPriorities     = new Signal();
    private final Signal                                     recomputeChunkPrioritiesLate = new Signal();
    private final List<ChunkRenderLayer>                     layers             = new ArrayList<>();
    private boolean                                          updatePending;
    private boolean                                          layerStatisticsPending;

    public ChunkManager(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        queueManager = rpc.getRef(Payloads.require(options, "chunkQueueManager"), ChunkQueueManager.class);
        registerDisposer(queueManager::release);
        registerDisposer(queueManager.gpuMemoryChanged().add(this::gpuMemoryChanged));
        for (var tier : TIERS) {
            existingTierChunks.put(tier, new ArrayList<>());
        }
    }

    @Override
    public String getRpcTypeId() {
        return ChunkRpcIds.CHUNK_MANAGER;
    }

    public ChunkQueueManager getQueueManager() {
        return queueManager;
    }

    public Signal recomputeChunkPriorities() {
        return recomputeChunkPriorities;
    }

    /**
     * Dispatched after {@link #recomputeChunkPriorities()}, for requests that depend on the state left by the first
     * round.
     */
    public Signal recomputeChunkPrioritiesLate() {
        return recomputeChunkPrioritiesLate;
    }

    public boolean isUpdatePending() {
        return updatePending;
    }

    public void scheduleUpdateChunkPriorities() {
        if (updatePending || isDisposed()) {
            return;
        }
        updatePending = true;
        getRpc().getEventLoop().execute(this::recomputeChunkPriorityQueues);
    }

    public boolean requestChunk(Chunk chunk, ChunkPriorityTier tier, double priority) {
        return requestChunk(chunk, tier, priority, true);
    }

    /**
     * Request a chunk in the current pass. Of several requests for the same chunk, the most urgent wins.
     *
     * @param toFrontend whether the chunk's data should be copied to the frontend once downloaded
     * @return false if the request was ignored
     * @throws IllegalArgumentException if the tier is {@code RECENT}
     */
    public boolean requestChunk(Chunk chunk, ChunkPriorityTier tier, double priority, boolean toFrontend) {
        if (tier == ChunkPriorityTier.RECENT) {
            throw new IllegalArgumentException("Chunks cannot be requested in the RECENT tier");
        }
        if (!Double.isFinite(priority)) {
            log.warn("Ignoring request for {} with priority {}", chunk, priority);
            return false;
        }
        chunk.newlyRequestedToFrontend |= toFrontend;
        if (chunk.newPriorityTier == ChunkPriorityTier.RECENT) {
            newTierChunks.add(chunk);
        }
        if (ChunkPriorityTier.isMoreUrgent(tier, priority, chunk.newPriorityTier, chunk.newPriority)) {
            chunk.newPriorityTier = tier;
            chunk.newPriority = priority;
        }
        return true;
    }

    /**
     * Include the layer in the progress report of the current pass, resetting its counts on its first request of the
     * pass.
     */
    public void registerLayer(ChunkRenderLayer layer) {
        var generation = recomputeChunkPriorities.getDispatchCount();
        if (layer.chunkManagerGeneration != generation) {
            layer.chunkManagerGeneration = generation;
            layer.resetProgress();
            layers.add(layer);
        }
    }

    public List<ChunkRenderLayer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    void recomputeChunkPriorityQueues() {
        if (!updatePending || isDisposed()) {
            return;
        }
        updatePending = false;
        layers.clear();
        recomputeChunkPriorities.dispatch();
        recomputeChunkPrioritiesLate.dispatch();
        updateQueueState(TIERS);
        scheduleLayerStatistics();
    }

    // Availability counts depend on GPU residency
    private void gpuMemoryChanged() {
        if (!layers.isEmpty()) {
            scheduleUpdateChunkPriorities();
        }
    }

    private void scheduleLayerStatistics() {
        if (layers.isEmpty() || layerStatisticsPending) {
            return;
        }
        layerStatisticsPending = true;
        getRpc().getEventLoop().execute(this::sendLayerStatistics);
    }

    private void sendLayerStatistics() {
        layerStatisticsPending = false;
        if (isDisposed()) {
            return;
        }
        var entries = Payloads.array();
        for (var layer : layers) {
            if (layer.isDisposed()) {
                continue;
            }
            var entry = layer.getProgress().toJson();
            entry.put("id", layer.getRpcId());
            entries.add(entry);
        }
        if (entries.isEmpty()) {
            return;
        }
        var payload = Payloads.object();
        payload.put("id", getRpcId());
        payload.set("layers", entries);
        getRpc().invoke(ChunkRpcIds.CHUNK_LAYER_STATISTICS, payload);
        log.trace("{} reported progress of {} layers", this, entries.size());
    }

    /**
     * Move chunks that were not requested in the given tiers to {@code RECENT} and apply the requests of this pass.
     */
    void updateQueueState(List<ChunkPriorityTier> tiers) {
        for (var tier : tiers) {
            var chunks = existingTierChunks.get(tier);
            var previous = List.copyOf(chunks);
            chunks.clear();
            for (var chunk : previous) {
                if (chunk.newPriorityTier == ChunkPriorityTier.RECENT) {
                    queueManager.performChunkPriorityUpdate(chunk);
                }
            }
        }
        var requested = List.copyOf(newTierChunks);
        newTierChunks.clear();
        for (var chunk : requested) {
            queueManager.performChunkPriorityUpdate(chunk);
            var current = existingTierChunks.get(chunk.getPriorityTier());
            if (chunk.getSource() != null && current != null) {
                current.add(chunk);
            }
        }
        queueManager.scheduleUpdate();
    }

    @Override
    public String toString() {
        return String.format("ChunkManager[%s visible=%d prefetch=%d]", isShared() ? getRpcId() : "-",
                             existingTierChunks.get(ChunkPriorityTier.VISIBLE).size(),
                             existingTierChunks.get(ChunkPriorityTier.PREFETCH).size());
    }
}
