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

import com.hellblazer.meridian.chunk.CapacitySpecification;
import com.hellblazer.meridian.chunk.ChunkPriorityTier;
import com.hellblazer.meridian.chunk.ChunkQueueConfiguration;
import com.hellblazer.meridian.chunk.frontend.ChunkFrontendProtocol;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkManager;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkQueueManager;
import com.hellblazer.meridian.chunk.frontend.TestFrontendChunkSource;
import com.hellblazer.meridian.rpc.EndpointPair;
import com.hellblazer.meridian.rpc.PolledEventLoop;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Frontend and worker chunk managers on polled loops. Chunks are requested through {@link #desire} and the requests
 * are replayed on every recompute until {@link #forget}.
 */
public class ChunkTestHarness {
    static {
        ChunkBackendProtocol.register();
        ChunkFrontendProtocol.register();
        TestChunkSource.register();
    }

    public final PolledEventLoop           frontendLoop = new PolledEventLoop("frontend");
    public final PolledEventLoop           backendLoop  = new PolledEventLoop("backend");
    public final RpcEndpoint               frontend;
    public final RpcEndpoint               backend;
    public final FrontendChunkQueueManager frontendQueueManager;
    public final FrontendChunkManager      frontendChunkManager;
    public final ChunkQueueManager         queueManager;
    public final ChunkManager              chunkManager;

    private final Map<Chunk, Request> desired = new LinkedHashMap<>();

    public ChunkTestHarness(ChunkQueueConfiguration configuration) {
        var pair = EndpointPair.create(frontendLoop, backendLoop);
        frontend = pair.frontend();
        backend = pair.backend();
        frontendQueueManager = new FrontendChunkQueueManager(frontend, configuration);
        frontendChunkManager = new FrontendChunkManager(frontendQueueManager);
        drain();
        queueManager = backend.get(frontendQueueManager.getRpcId(), ChunkQueueManager.class);
        chunkManager = backend.get(frontendChunkManager.getRpcId(), ChunkManager.class);
        chunkManager.recomputeChunkPriorities().add(
        () -> desired.forEach((chunk, request) -> chunkManager.requestChunk(chunk, request.tier, request.priority)));
    }

    /**
     * GPU memory of 1 MB, the given system memory and download limits.
     */
    public static ChunkQueueConfiguration configuration(long systemMemoryBytes, long downloads) {
        return ChunkQueueConfiguration.builder()
                                      .withGpuMemory(CapacitySpecification.ofBytes(1L << 20))
                                      .withSystemMemory(CapacitySpecification.ofBytes(systemMemoryBytes))
                                      .withDownload(CapacitySpecification.ofItems(downloads))
                                      .build();
    }

    public int drain() {
        return PolledEventLoop.drainAll(frontendLoop, backendLoop);
    }

    public TestFrontendChunkSource addSource(String key) {
        var source = frontendChunkManager.getChunkSource(key, TestFrontendChunkSource.class,
                                                         () -> new TestFrontendChunkSource(frontendChunkManager));
        drain();
        return source;
    }

    public TestChunkSource backendSource(TestFrontendChunkSource source) {
        return backend.get(source.getRpcId(), TestChunkSource.class);
    }

    public void desire(Chunk chunk, ChunkPriorityTier tier, double priority) {
        desired.put(chunk, new Request(tier, priority));
    }

    public void forget(Chunk chunk) {
        desired.remove(chunk);
    }

    public void forgetAll() {
        desired.clear();
    }

    /**
     * Run a recompute and everything it triggers.
     */
    public void recompute() {
        chunkManager.scheduleUpdateChunkPriorities();
        drain();
    }

    private record Request(ChunkPriorityTier tier, double priority) {
    }
}
