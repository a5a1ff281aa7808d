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
import com.hellblazer.meridian.rpc.CancellationTokenSource;
import com.hellblazer.meridian.rpc.Registration;
import com.hellblazer.meridian.rpc.TransferableBuffer;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker-side unit of streamed data.
 * <p>
 * A chunk carries two priorities: the one reflected in the queues ({@link #getPriorityTier()},
 * {@link #getPriority()}) and the one accumulated by requests during the current recompute pass, which replaces it
 * when the pass ends. Memory accounting changes go through the queue manager so that capacities stay consistent.
 * Subclasses hold the payload and account for it in {@link #downloadSucceeded()}.
 *
 * @author hal.hildebrand
 */
public class Chunk {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    final long              sequence = SEQUENCE.incrementAndGet();
    ChunkPriorityTier       newPriorityTier = ChunkPriorityTier.RECENT;
    double                  newPriority     = Double.NEGATIVE_INFINITY;
    boolean                 newlyRequestedToFrontend;
    CancellationTokenSource downloadToken;

    private ChunkSource       source;
    private String            key;
    private ChunkState        state        = ChunkState.NEW;
    private ChunkPriorityTier priorityTier = ChunkPriorityTier.RECENT;
    private double            priority     = Double.NEGATIVE_INFINITY;
    private long              systemMemoryBytes;
    private long              gpuMemoryBytes;
    private int               downloadSlots = 1;
    private boolean           backendOnly;
    private boolean           requestedToFrontend;
    private int               failedAttempts;
    private Throwable         error;
    private int               pinCount;

    void attach(ChunkSource source, String key) {
        this.source = source;
        this.key = key;
    }

    void detach() {
        source = null;
        error = null;
    }

    public String getKey() {
        return key;
    }

    public ChunkSource getSource() {
        return source;
    }

    public ChunkState getState() {
        return state;
    }

    public ChunkPriorityTier getPriorityTier() {
        return priorityTier;
    }

    public double getPriority() {
        return priority;
    }

    public ChunkPriorityTier getNewPriorityTier() {
        return newPriorityTier;
    }

    public double getNewPriority() {
        return newPriority;
    }

    public long getSystemMemoryBytes() {
        return systemMemoryBytes;
    }

    public long getGpuMemoryBytes() {
        return gpuMemoryBytes;
    }

    public int getDownloadSlots() {
        return downloadSlots;
    }

    public boolean isBackendOnly() {
        return backendOnly;
    }

    public boolean isRequestedToFrontend() {
        return requestedToFrontend;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    public Throwable getError() {
        return error;
    }

    public boolean isPinned() {
        return pinCount > 0;
    }

    /**
     * Forbid eviction of this chunk until the matching {@link #unpin()}.
     */
    public void pin() {
        pinCount++;
    }

    public void unpin() {
        if (pinCount == 0) {
            throw new IllegalStateException("Chunk " + key + " is not pinned");
        }
        if (--pinCount == 0 && source != null) {
            getQueueManager().scheduleUpdate();
        }
    }

    /**
     * Observe state changes of this chunk's key in its source.
     */
    public Registration addStateListener(ChunkStateListener listener) {
        if (source == null) {
            throw new IllegalStateException("Chunk " + key + " has been removed from its source");
        }
        return source.addStateListener(key, listener);
    }

    public ChunkQueueManager getQueueManager() {
        return source.getChunkManager().getQueueManager();
    }

    public ChunkManager getChunkManager() {
        return source.getChunkManager();
    }

    protected void setBackendOnly(boolean backendOnly) {
        this.backendOnly = backendOnly;
    }

    protected void setSystemMemoryBytes(long bytes) {
        if (bytes == systemMemoryBytes) {
            return;
        }
        var queueManager = getQueueManager();
        queueManager.adjustCapacitiesForChunk(this, false);
        systemMemoryBytes = bytes;
        queueManager.adjustCapacitiesForChunk(this, true);
        queueManager.scheduleUpdate();
    }

    protected void setGpuMemoryBytes(long bytes) {
        if (bytes == gpuMemoryBytes) {
            return;
        }
        var queueManager = getQueueManager();
        queueManager.adjustCapacitiesForChunk(this, false);
        gpuMemoryBytes = bytes;
        queueManager.adjustCapacitiesForChunk(this, true);
        queueManager.scheduleUpdate();
    }

    protected void setDownloadSlots(int slots) {
        if (slots == downloadSlots) {
            return;
        }
        var queueManager = getQueueManager();
        queueManager.adjustCapacitiesForChunk(this, false);
        downloadSlots = slots;
        queueManager.adjustCapacitiesForChunk(this, true);
        queueManager.scheduleUpdate();
    }

    /**
     * Called on the event loop once the source has stored the decoded payload. Subclasses account for the payload's
     * memory before calling this.
     */
    protected void downloadSucceeded() {
        getQueueManager().updateChunkState(this, ChunkState.SYSTEM_MEMORY_WORKER);
    }

    /**
     * Drop the worker's copy of the payload.
     */
    protected void freeSystemMemory() {
    }

    /**
     * Write the fields the frontend needs to construct its copy of this chunk.
     */
    protected void serialize(ObjectNode message, Map<String, TransferableBuffer> transfers) {
        message.put("id", key);
        message.put("source", source.getRpcId());
        message.put("new", true);
    }

    void setState(ChunkState newState) {
        if (newState == state) {
            return;
        }
        var oldState = state;
        state = newState;
        if (source != null) {
            source.chunkStateChanged(this, oldState);
        }
    }

    void recordFailure(Throwable cause) {
        failedAttempts++;
        error = cause;
    }

    void updatePriorityProperties() {
        priorityTier = newPriorityTier;
        priority = newPriority;
        requestedToFrontend = newlyRequestedToFrontend;
        newPriorityTier = ChunkPriorityTier.RECENT;
        newPriority = Double.NEGATIVE_INFINITY;
        newlyRequestedToFrontend = false;
    }

    void resetNewPriority() {
        newPriorityTier = ChunkPriorityTier.RECENT;
        newPriority = Double.NEGATIVE_INFINITY;
        newlyRequestedToFrontend = false;
    }

    @Override
    public String toString() {
        return String.format("Chunk[%s %s %s:%s]", key, state, priorityTier, priority);
    }
}
