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
import com.hellblazer.meridian.chunk.CapacitySpecification;
import com.hellblazer.meridian.chunk.ChunkQueueConfiguration;
import com.hellblazer.meridian.chunk.ChunkRpcIds;
import com.hellblazer.meridian.chunk.ChunkStatistics;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import com.hellblazer.meridian.rpc.shared.SharedWatchableValue;
import com.hellblazer.meridian.rpc.shared.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Owner of the worker's queue manager. The capacity limits are shared values owned here, so changing them on the
 * frontend reschedules the worker.
 *
 * @author hal.hildebrand
 */
public class FrontendChunkQueueManager extends SharedObject {
    private static final Logger log = LoggerFactory.getLogger(FrontendChunkQueueManager.class);

    private final SharedWatchableValue gpuMemoryItemLimit;
    private final SharedWatchableValue gpuMemorySizeLimit;
    private final SharedWatchableValue systemMemoryItemLimit;
    private final SharedWatchableValue systemMemorySizeLimit;
    private final SharedWatchableValue downloadItemLimit;
    private final SharedWatchableValue downloadSizeLimit;
    private final Signal               visibleChunksChanged = new Signal();

    public FrontendChunkQueueManager(RpcEndpoint rpc, ChunkQueueConfiguration configuration) {
        gpuMemoryItemLimit = limit(rpc, configuration.getGpuMemory().itemLimit());
        gpuMemorySizeLimit = limit(rpc, configuration.getGpuMemory().sizeLimit());
        systemMemoryItemLimit = limit(rpc, configuration.getSystemMemory().itemLimit());
        systemMemorySizeLimit = limit(rpc, configuration.getSystemMemory().sizeLimit());
        downloadItemLimit = limit(rpc, configuration.getDownload().itemLimit());
        downloadSizeLimit = limit(rpc, configuration.getDownload().sizeLimit());
        var options = Payloads.object();
        options.set("gpuMemoryCapacity", capacityOptions(gpuMemoryItemLimit, gpuMemorySizeLimit));
        options.set("systemMemoryCapacity", capacityOptions(systemMemoryItemLimit, systemMemorySizeLimit));
        options.set("downloadCapacity", capacityOptions(downloadItemLimit, downloadSizeLimit));
        initializeCounterpart(rpc, options);
        log.debug("Created {} with {}", this, configuration);
    }

    private static ObjectNode capacityOptions(SharedWatchableValue itemLimit, SharedWatchableValue sizeLimit) {
        var options = Payloads.object();
        options.set("itemLimit", itemLimit.addCounterpartRef().toJson());
        options.set("sizeLimit", sizeLimit.addCounterpartRef().toJson());
        return options;
    }

    @Override
    public String getRpcTypeId() {
        return ChunkRpcIds.CHUNK_QUEUE_MANAGER;
    }

    /**
     * Change the limits; the worker applies them on its next pass, evicting as needed.
     */
    public void applyConfiguration(ChunkQueueConfiguration configuration) {
        gpuMemoryItemLimit.setValue(configuration.getGpuMemory().itemLimit());
        gpuMemorySizeLimit.setValue(configuration.getGpuMemory().sizeLimit());
        systemMemoryItemLimit.setValue(configuration.getSystemMemory().itemLimit());
        systemMemorySizeLimit.setValue(configuration.getSystemMemory().sizeLimit());
        downloadItemLimit.setValue(configuration.getDownload().itemLimit());
        downloadSizeLimit.setValue(configuration.getDownload().sizeLimit());
    }

    public ChunkQueueConfiguration getConfiguration() {
        return ChunkQueueConfiguration.builder()
                                      .withGpuMemory(new CapacitySpecification(gpuMemoryItemLimit.longValue(),
                                                                               gpuMemorySizeLimit.longValue()))
                                      .withSystemMemory(
                                      new CapacitySpecification(systemMemoryItemLimit.longValue(),
                                                                systemMemorySizeLimit.longValue()))
                                      .withDownload(new CapacitySpecification(downloadItemLimit.longValue(),
                                                                              downloadSizeLimit.longValue()))
                                      .build();
    }

    public SharedWatchableValue getGpuMemorySizeLimit() {
        return gpuMemorySizeLimit;
    }

    public SharedWatchableValue getSystemMemorySizeLimit() {
        return systemMemorySizeLimit;
    }

    public SharedWatchableValue getDownloadItemLimit() {
        return downloadItemLimit;
    }

    /**
     * Fires after the worker has added, removed or moved a chunk on the frontend.
     */
    public Signal visibleChunksChanged() {
        return visibleChunksChanged;
    }

    /**
     * Ask the worker for per-source statistics. Sources disposed while the request was in flight are omitted.
     */
    public CompletableFuture<Map<FrontendChunkSource, ChunkStatistics>> getStatistics() {
        var payload = Payloads.object();
        payload.put("queueManager", getRpcId());
        return getRpc().promiseInvoke(ChunkRpcIds.REQUEST_CHUNK_STATISTICS, payload).thenApply(result -> {
            var statistics = new LinkedHashMap<FrontendChunkSource, ChunkStatistics>();
            for (var entry : result.value()) {
                var id = Payloads.requireLong(entry, "id");
                if (getRpc().has(id)) {
                    statistics.put(getRpc().get(id, FrontendChunkSource.class),
                                   ChunkStatistics.fromJson(Payloads.require(entry, "statistics")));
                }
            }
            return statistics;
        });
    }

    private SharedWatchableValue limit(RpcEndpoint rpc, long value) {
        var limit = SharedWatchableValue.makeOwner(rpc, value);
        registerDisposer(limit::release);
        return limit;
    }
}
