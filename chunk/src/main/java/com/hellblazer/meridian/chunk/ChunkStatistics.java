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
package com.hellblazer.meridian.chunk;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.Payloads;

/**
 * Snapshot of a chunk source: chunk count and accounted memory per state and tier, plus download totals.
 *
 * @author hal.hildebrand
 */
public class ChunkStatistics {
    private static final int STATES = ChunkState.values().length;
    private static final int TIERS  = ChunkPriorityTier.values().length;

    private final long[][] counts      = new long[STATES][TIERS];
    private final long[][] systemBytes = new long[STATES][TIERS];
    private final long[][] gpuBytes    = new long[STATES][TIERS];
    private long           downloads;
    private long           downloadNanos;
    private long           failures;

    public static ChunkStatistics fromJson(JsonNode json) {
        var statistics = new ChunkStatistics();
        for (var entry : Payloads.requireArray(json, "chunks")) {
            var state = Payloads.requireEnum(entry, "state", ChunkState.class);
            var tier = Payloads.requireEnum(entry, "tier", ChunkPriorityTier.class);
            var s = state.ordinal();
            var t = tier.ordinal();
            statistics.counts[s][t] = Payloads.requireLong(entry, "count");
            statistics.systemBytes[s][t] = Payloads.requireLong(entry, "systemMemoryBytes");
            statistics.gpuBytes[s][t] = Payloads.requireLong(entry, "gpuMemoryBytes");
        }
        statistics.downloads = Payloads.requireLong(json, "downloads");
        statistics.downloadNanos = Payloads.requireLong(json, "downloadTimeNanos");
        statistics.failures = Payloads.requireLong(json, "failures");
        return statistics;
    }

    public void addChunk(ChunkState state, ChunkPriorityTier tier, long systemMemoryBytes, long gpuMemoryBytes) {
        counts[state.ordinal()][tier.ordinal()]++;
        systemBytes[state.ordinal()][tier.ordinal()] += systemMemoryBytes;
        gpuBytes[state.ordinal()][tier.ordinal()] += gpuMemoryBytes;
    }

    public void addDownloads(long count, long totalNanos, long failed) {
        downloads += count;
        downloadNanos += totalNanos;
        failures += failed;
    }

    public long getChunkCount(ChunkState state, ChunkPriorityTier tier) {
        return counts[state.ordinal()][tier.ordinal()];
    }

    public long getChunkCount(ChunkState state) {
        var total = 0L;
        for (var tier : ChunkPriorityTier.values()) {
            total += getChunkCount(state, tier);
        }
        return total;
    }

    public long getSystemMemoryBytes(ChunkState state, ChunkPriorityTier tier) {
        return systemBytes[state.ordinal()][tier.ordinal()];
    }

    public long getGpuMemoryBytes(ChunkState state, ChunkPriorityTier tier) {
        return gpuBytes[state.ordinal()][tier.ordinal()];
    }

    /**
     * @return bytes held in system memory on either side, including downloads in progress
     */
    public long getTotalSystemMemoryBytes() {
        var total = 0L;
        for (var state : ChunkState.values()) {
            if (state.occupiesSystemMemory()) {
                for (var tier : ChunkPriorityTier.values()) {
                    total += getSystemMemoryBytes(state, tier);
                }
            }
        }
        return total;
    }

    public long getTotalGpuMemoryBytes() {
        var total = 0L;
        for (var tier : ChunkPriorityTier.values()) {
            total += getGpuMemoryBytes(ChunkState.GPU_MEMORY, tier);
        }
        return total;
    }

    public long getDownloadCount() {
        return downloads;
    }

    public long getDownloadTimeNanos() {
        return downloadNanos;
    }

    public long getFailureCount() {
        return failures;
    }

    public ObjectNode toJson() {
        var json = Payloads.object();
        var chunks = json.putArray("chunks");
        for (var state : ChunkState.values()) {
            for (var tier : ChunkPriorityTier.values()) {
                var s = state.ordinal();
                var t = tier.ordinal();
                if (counts[s][t] == 0) {
                    continue;
                }
                var entry = chunks.addObject();
                entry.put("state", state.name());
                entry.put("tier", tier.name());
                entry.put("count", counts[s][t]);
                entry.put("systemMemoryBytes", systemBytes[s][t]);
                entry.put("gpuMemoryBytes", gpuBytes[s][t]);
            }
        }
        json.put("downloads", downloads);
        json.put("downloadTimeNanos", downloadNanos);
        json.put("failures", failures);
        return json;
    }

    @Override
    public String toString() {
        return String.format("ChunkStatistics[queued=%d, downloading=%d, worker=%d, gpu=%d, failed=%d, downloads=%d]",
                             getChunkCount(ChunkState.QUEUED), getChunkCount(ChunkState.DOWNLOADING),
                             getChunkCount(ChunkState.SYSTEM_MEMORY_WORKER), getChunkCount(ChunkState.GPU_MEMORY),
                             getChunkCount(ChunkState.FAILED), downloads);
    }
}
