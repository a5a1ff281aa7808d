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
import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.rpc.CancellationTokenSource;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.TransferableBuffer;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import com.hellblazer.meridian.rpc.shared.SharedWatchableValue;
import com.hellblazer.meridian.rpc.shared.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Worker-side scheduler of chunk downloads and frontend transfers under three capacities: GPU memory, system memory
 * and concurrent downloads.
 * <p>
 * Each pass first copies the most urgent decoded chunks to the frontend while GPU capacity allows, then starts the
 * most urgent queued downloads while download and system memory capacity allow. When a capacity is exhausted, less
 * urgent chunks are evicted, least urgent first; a promotion never evicts a chunk at least as urgent as itself and
 * never evicts a pinned chunk. Passes are debounced: any number of {@link #scheduleUpdate()} calls before a pass
 * runs result in a single pass.
 *
 * @author hal.hildebrand
 */
public class ChunkQueueManager extends SharedObject {
    private static final Logger log = LoggerFactory.getLogger(ChunkQueueManager.class);

    private final AvailableCapacity  gpuMemoryCapacity;
    private final AvailableCapacity  systemMemoryCapacity;
    private final AvailableCapacity  downloadCapacity;
    private final Set<ChunkSource>   sources                 = new LinkedHashSet<>();
    private final ChunkPriorityQueue queuedDownloadPromotion = new ChunkPriorityQueue("queuedDownloadPromotion");
    private final ChunkPriorityQueue downloadEviction        = new ChunkPriorityQueue("downloadEviction");
    private final ChunkPriorityQueue systemMemoryEviction    = new ChunkPriorityQueue("systemMemoryEviction");
    private final ChunkPriorityQueue gpuMemoryPromotion      = new ChunkPriorityQueue("gpuMemoryPromotion");
    private final ChunkPriorityQueue gpuMemoryEviction       = new ChunkPriorityQueue("gpuMemoryEviction");
    private final Signal             gpuMemoryChanged        = new Signal();
    private boolean                  updatePending;
    private long                     gpuMemoryGeneration;
    private int                      numQueued;
    private int                      numFailed;

    public ChunkQueueManager(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        gpuMemoryCapacity = capacity(rpc, options, "gpuMemoryCapacity");
        systemMemoryCapacity = capacity(rpc, options, "systemMemoryCapacity");
        downloadCapacity = capacity(rpc, options, "downloadCapacity");
    }

    private static Throwable unwrap(Throwable error) {
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    @Override
    public String getRpcTypeId() {
        return ChunkRpcIds.CHUNK_QUEUE_MANAGER;
    }

    public AvailableCapacity getGpuMemoryCapacity() {
        return gpuMemoryCapacity;
    }

    public AvailableCapacity getSystemMemoryCapacity() {
        return systemMemoryCapacity;
    }

    public AvailableCapacity getDownloadCapacity() {
        return downloadCapacity;
    }

    /**
     * Fires after a pass that changed which chunks are resident in GPU memory.
     */
    public Signal gpuMemoryChanged() {
        return gpuMemoryChanged;
    }

    public Set<ChunkSource> getSources() {
        return Collections.unmodifiableSet(sources);
    }

    public int getNumQueued() {
        return numQueued;
    }

    public int getNumFailed() {
        return numFailed;
    }

    public boolean isUpdatePending() {
        return updatePending;
    }

    public void scheduleUpdate() {
        if (updatePending || isDisposed()) {
            return;
        }
        updatePending = true;
        getRpc().getEventLoop().execute(this::process);
    }

    /**
     * Apply the priority a chunk accumulated during the last recompute pass.
     */
    public void performChunkPriorityUpdate(Chunk chunk) {
        if (chunk.getSource() == null) {
            chunk.resetNewPriority();
            return;
        }
        if (chunk.getPriorityTier() == chunk.newPriorityTier && chunk.getPriority() == chunk.newPriority
        && chunk.isRequestedToFrontend() == chunk.newlyRequestedToFrontend) {
            chunk.resetNewPriority();
            return;
        }
        log.trace("{}: priority {}:{} -> {}:{}", chunk.getKey(), chunk.getPriorityTier(), chunk.getPriority(),
                  chunk.newPriorityTier, chunk.newPriority);
        removeChunkFromQueues(chunk);
        chunk.updatePriorityProperties();
        if (chunk.getState() == ChunkState.NEW) {
            chunk.setState(ChunkState.QUEUED);
            adjustCapacitiesForChunk(chunk, true);
        }
        addChunkToQueues(chunk);
    }

    public void updateChunkState(Chunk chunk, ChunkState newState) {
        if (newState == chunk.getState()) {
            return;
        }
        log.trace("{}: state {} -> {}", chunk.getKey(), chunk.getState(), newState);
        adjustCapacitiesForChunk(chunk, false);
        removeChunkFromQueues(chunk);
        chunk.setState(newState);
        adjustCapacitiesForChunk(chunk, true);
        addChunkToQueues(chunk);
        scheduleUpdate();
    }

    /**
     * Requeue every chunk of the source, discarding downloaded data, and tell the frontend to drop its copies.
     */
    public void invalidateSourceCache(ChunkSource source) {
        for (var chunk : List.copyOf(source.getChunks())) {
            switch (chunk.getState()) {
                case DOWNLOADING:
                    cancelDownload(chunk);
                    break;
                case SYSTEM_MEMORY_WORKER:
                    chunk.freeSystemMemory();
                    break;
                default:
                    break;
            }
            updateChunkState(chunk, ChunkState.QUEUED);
        }
        var payload = Payloads.object();
        payload.put("source", source.getRpcId());
        getRpc().invoke(ChunkRpcIds.CHUNK_UPDATE, payload);
        log.debug("Invalidated {}", source);
        scheduleUpdate();
    }

    void addSource(ChunkSource source) {
        sources.add(source);
    }

    void removeSource(ChunkSource source) {
        sources.remove(source);
    }

    /**
     * Remove a chunk whose source is going away, releasing whatever capacity it holds.
     */
    void dropChunk(Chunk chunk) {
        if (chunk.getState() == ChunkState.DOWNLOADING) {
            cancelDownload(chunk);
        }
        adjustCapacitiesForChunk(chunk, false);
        removeChunkFromQueues(chunk);
        chunk.getSource().removeChunk(chunk);
        scheduleUpdate();
    }

    void adjustCapacitiesForChunk(Chunk chunk, boolean add) {
        var factor = add ? 1 : -1;
        switch (chunk.getState()) {
            case FAILED:
                numFailed += factor;
                break;
            case QUEUED:
                numQueued += factor;
                break;
            case DOWNLOADING:
                downloadCapacity.adjust(factor * chunk.getDownloadSlots(), factor * chunk.getSystemMemoryBytes());
                systemMemoryCapacity.adjust(factor, factor * chunk.getSystemMemoryBytes());
                break;
            case SYSTEM_MEMORY:
            case SYSTEM_MEMORY_WORKER:
                systemMemoryCapacity.adjust(factor, factor * chunk.getSystemMemoryBytes());
                break;
            case GPU_MEMORY:
                systemMemoryCapacity.adjust(factor, factor * chunk.getSystemMemoryBytes());
                gpuMemoryCapacity.adjust(factor, factor * chunk.getGpuMemoryBytes());
                break;
            default:
                break;
        }
    }

    void process() {
        if (!updatePending || isDisposed()) {
            return;
        }
        updatePending = false;
        var generation = gpuMemoryGeneration;
        processGpuPromotions();
        processDownloadPromotions();
        enforceSystemMemoryLimit();
        log.trace("Queued: {}, failed: {}, download: {}, memory: {}, gpu: {}", numQueued, numFailed,
                  downloadCapacity, systemMemoryCapacity, gpuMemoryCapacity);
        if (generation != gpuMemoryGeneration) {
            gpuMemoryChanged.dispatch();
        }
    }

    private AvailableCapacity capacity(RpcEndpoint rpc, ObjectNode options, String name) {
        var limits = Payloads.requireObject(options, name);
        var itemLimit = rpc.getRef(Payloads.require(limits, "itemLimit"), SharedWatchableValue.class);
        var sizeLimit = rpc.getRef(Payloads.require(limits, "sizeLimit"), SharedWatchableValue.class);
        registerDisposer(itemLimit::release);
        registerDisposer(sizeLimit::release);
        var capacity = new AvailableCapacity(itemLimit, sizeLimit);
        registerDisposer(capacity::release);
        capacity.capacityChanged().add(this::scheduleUpdate);
        return capacity;
    }

    private List<ChunkPriorityQueue> queuesFor(Chunk chunk) {
        switch (chunk.getState()) {
            case QUEUED:
                return List.of(queuedDownloadPromotion);
            case DOWNLOADING:
                return List.of(downloadEviction, systemMemoryEviction);
            case SYSTEM_MEMORY_WORKER:
            case SYSTEM_MEMORY:
                if (chunk.getPriorityTier() != ChunkPriorityTier.RECENT && !chunk.isBackendOnly()
                && chunk.isRequestedToFrontend()) {
                    return List.of(systemMemoryEviction, gpuMemoryPromotion);
                }
                return List.of(systemMemoryEviction);
            case GPU_MEMORY:
                return List.of(systemMemoryEviction, gpuMemoryEviction);
            default:
                return List.of();
        }
    }

    private void removeChunkFromQueues(Chunk chunk) {
        for (var queue : queuesFor(chunk)) {
            queue.remove(chunk);
        }
    }

    private void addChunkToQueues(Chunk chunk) {
        var state = chunk.getState();
        if ((state == ChunkState.QUEUED || state == ChunkState.FAILED)
        && chunk.getPriorityTier() == ChunkPriorityTier.RECENT) {
            // No longer desired and holding no data
            chunk.getSource().removeChunk(chunk);
            adjustCapacitiesForChunk(chunk, false);
            return;
        }
        for (var queue : queuesFor(chunk)) {
            queue.add(chunk);
        }
    }

    /**
     * Evict candidates until the capacity can hold {@code size} more bytes and one more item.
     *
     * @return false if the promotion must be deferred
     */
    private boolean tryToFreeCapacity(long size, AvailableCapacity capacity, Chunk promotion,
                                      ChunkPriorityQueue evictionQueue, Iterator<Chunk> candidates,
                                      Consumer<Chunk> evict) {
        while (capacity.getAvailableItems() < 1 || capacity.getAvailableSize() < size) {
            Chunk candidate = null;
            while (candidates.hasNext()) {
                var next = candidates.next();
                if (next != promotion && !next.isPinned() && next.getSource() != null && evictionQueue.contains(
                next)) {
                    candidate = next;
                    break;
                }
            }
            if (candidate == null) {
                return false;
            }
            if (!ChunkPriorityTier.isMoreUrgent(promotion.getPriorityTier(), promotion.getPriority(),
                                                candidate.getPriorityTier(), candidate.getPriority())) {
                return false;
            }
            log.debug("Evicting {} for {}", candidate, promotion);
            evict.accept(candidate);
        }
        return true;
    }

    private void processGpuPromotions() {
        var evictionCandidates = gpuMemoryEviction.leastUrgentFirst().iterator();
        for (var candidate : gpuMemoryPromotion.mostUrgentFirst()) {
            if (!gpuMemoryPromotion.contains(candidate)) {
                continue;
            }
            if (!tryToFreeCapacity(candidate.getGpuMemoryBytes(), gpuMemoryCapacity, candidate, gpuMemoryEviction,
                                   evictionCandidates, this::evictFromGpuMemory)) {
                break;
            }
            copyChunkToGpu(candidate);
            updateChunkState(candidate, ChunkState.GPU_MEMORY);
        }
    }

    private void processDownloadPromotions() {
        var downloadCandidates = downloadEviction.leastUrgentFirst().iterator();
        var memoryCandidates = systemMemoryEviction.leastUrgentFirst().iterator();
        for (var candidate : queuedDownloadPromotion.mostUrgentFirst()) {
            if (!queuedDownloadPromotion.contains(candidate)) {
                continue;
            }
            // The size of a chunk that has not been downloaded is unknown
            if (!tryToFreeCapacity(0, downloadCapacity, candidate, downloadEviction, downloadCandidates,
                                   this::evict)) {
                return;
            }
            if (!tryToFreeCapacity(0, systemMemoryCapacity, candidate, systemMemoryEviction, memoryCandidates,
                                   this::evict)) {
                return;
            }
            updateChunkState(candidate, ChunkState.DOWNLOADING);
            startDownload(candidate);
        }
    }

    /**
     * Downloads complete after the pass that started them, so usage can exceed the system memory limit. Only chunks
     * that are no longer desired are evicted to bring it back under.
     */
    private void enforceSystemMemoryLimit() {
        for (var chunk : systemMemoryEviction.leastUrgentFirst()) {
            if (systemMemoryCapacity.getAvailableSize() >= 0 && systemMemoryCapacity.getAvailableItems() >= 0) {
                return;
            }
            if (chunk.getPriorityTier() != ChunkPriorityTier.RECENT) {
                return;
            }
            if (chunk.isPinned() || !systemMemoryEviction.contains(chunk)) {
                continue;
            }
            log.debug("Evicting {} to fit system memory {}", chunk, systemMemoryCapacity);
            evict(chunk);
        }
    }

    private void evict(Chunk chunk) {
        switch (chunk.getState()) {
            case DOWNLOADING:
                cancelDownload(chunk);
                break;
            case GPU_MEMORY:
                gpuMemoryGeneration++;
                // fall through
            case SYSTEM_MEMORY_WORKER:
            case SYSTEM_MEMORY:
                freeChunkSystemMemory(chunk);
                break;
            default:
                break;
        }
        // May remove the chunk from its source
        updateChunkState(chunk, ChunkState.QUEUED);
    }

    private void evictFromGpuMemory(Chunk chunk) {
        freeChunkGpuMemory(chunk);
        updateChunkState(chunk, ChunkState.SYSTEM_MEMORY);
    }

    private void freeChunkGpuMemory(Chunk chunk) {
        gpuMemoryGeneration++;
        sendState(chunk, ChunkState.SYSTEM_MEMORY);
    }

    private void freeChunkSystemMemory(Chunk chunk) {
        if (chunk.getState() == ChunkState.SYSTEM_MEMORY_WORKER) {
            chunk.freeSystemMemory();
        } else {
            sendState(chunk, ChunkState.EXPIRED);
        }
    }

    private void copyChunkToGpu(Chunk chunk) {
        gpuMemoryGeneration++;
        if (chunk.getState() == ChunkState.SYSTEM_MEMORY) {
            sendState(chunk, ChunkState.GPU_MEMORY);
            return;
        }
        var message = Payloads.object();
        var transfers = new LinkedHashMap<String, TransferableBuffer>();
        chunk.serialize(message, transfers);
        message.put("state", ChunkState.GPU_MEMORY.name());
        getRpc().invoke(ChunkRpcIds.CHUNK_UPDATE, message, transfers);
    }

    private void sendState(Chunk chunk, ChunkState state) {
        var message = Payloads.object();
        message.put("id", chunk.getKey());
        message.put("source", chunk.getSource().getRpcId());
        message.put("state", state.name());
        getRpc().invoke(ChunkRpcIds.CHUNK_UPDATE, message);
    }

    private void startDownload(Chunk chunk) {
        var token = new CancellationTokenSource();
        chunk.downloadToken = token;
        var source = chunk.getSource();
        var start = System.nanoTime();
        CompletableFuture<Void> download;
        try {
            download = source.download(chunk, token);
        } catch (RuntimeException e) {
            download = CompletableFuture.failedFuture(e);
        }
        download.whenCompleteAsync((result, error) -> {
            if (chunk.downloadToken != token) {
                log.trace("Ignoring superseded download of {}", chunk.getKey());
                return;
            }
            chunk.downloadToken = null;
            if (error == null) {
                source.recordDownload(System.nanoTime() - start);
                chunk.downloadSucceeded();
            } else {
                downloadFailed(chunk, unwrap(error));
            }
        }, getRpc().getEventLoop());
    }

    private void downloadFailed(Chunk chunk, Throwable error) {
        var source = chunk.getSource();
        chunk.recordFailure(error);
        source.recordFailure();
        if (source.shouldRetry(chunk, error)) {
            log.debug("Retrying {} after failure {}: {}", chunk.getKey(), chunk.getFailedAttempts(), error.toString());
            updateChunkState(chunk, ChunkState.QUEUED);
        } else {
            log.warn("Error retrieving chunk {}: {}", chunk.getKey(), error.toString());
            updateChunkState(chunk, ChunkState.FAILED);
        }
    }

    private void cancelDownload(Chunk chunk) {
        var token = chunk.downloadToken;
        chunk.downloadToken = null;
        if (token != null) {
            token.cancel();
        }
        // The source may have stored a payload before the completion was applied
        chunk.freeSystemMemory();
    }

    @Override
    public String toString() {
        return String.format("ChunkQueueManager[sources=%d, queued=%d, failed=%d, gpu=(%s), memory=(%s)]",
                             sources.size(), numQueued, numFailed, gpuMemoryCapacity, systemMemoryCapacity);
    }
}
