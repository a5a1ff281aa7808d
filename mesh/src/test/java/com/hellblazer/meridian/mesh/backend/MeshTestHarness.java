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
package com.hellblazer.meridian.mesh.backend;

import com.hellblazer.meridian.chunk.ChunkQueueConfiguration;
import com.hellblazer.meridian.chunk.backend.ChunkManager;
import com.hellblazer.meridian.chunk.frontend.ChunkFrontendProtocol;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkManager;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkQueueManager;
import com.hellblazer.meridian.mesh.frontend.FrontendFragmentSource;
import com.hellblazer.meridian.mesh.frontend.TestFrontendMeshSource;
import com.hellblazer.meridian.rpc.EndpointPair;
import com.hellblazer.meridian.rpc.PolledEventLoop;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Frontend and worker chunk managers on polled loops, with the mesh types registered.
 */
public class MeshTestHarness {
    static {
        MeshBackendProtocol.register();
        ChunkFrontendProtocol.register();
        InMemoryMeshSource.register();
    }

    public final PolledEventLoop           frontendLoop = new PolledEventLoop("frontend");
    public final PolledEventLoop           backendLoop  = new PolledEventLoop("backend");
    public final RpcEndpoint               frontend;
    public final RpcEndpoint               backend;
    public final FrontendChunkQueueManager frontendQueueManager;
    public final FrontendChunkManager      frontendChunkManager;
    public final ChunkManager              chunkManager;

    public MeshTestHarness() {
        var pair = EndpointPair.create(frontendLoop, backendLoop);
        frontend = pair.frontend();
        backend = pair.backend();
        frontendQueueManager = new FrontendChunkQueueManager(frontend, ChunkQueueConfiguration.minimalConfig());
        frontendChunkManager = new FrontendChunkManager(frontendQueueManager);
        drain();
        chunkManager = backend.get(frontendChunkManager.getRpcId(), ChunkManager.class);
    }

    public static byte[] bytes(ByteBuffer buffer) {
        var view = buffer.duplicate();
        var bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }

    public int drain() {
        return PolledEventLoop.drainAll(frontendLoop, backendLoop);
    }

    /**
     * Drain both loops until the condition holds; work completed on other threads is posted to the loops.
     */
    public void drainUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        var deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            drain();
            if (condition.getAsBoolean()) {
                return;
            }
            if (System.nanoTime() > deadline) {
                fail("Condition not reached within " + timeout);
            }
            Thread.sleep(5);
        }
    }

    public TestFrontendMeshSource addMeshSource(String key) {
        var fragmentSource = frontendChunkManager.getChunkSource(key + "#fragments", FrontendFragmentSource.class,
                                                                 () -> new FrontendFragmentSource(
                                                                 frontendChunkManager));
        var source = frontendChunkManager.getChunkSource(key, TestFrontendMeshSource.class,
                                                         () -> new TestFrontendMeshSource(frontendChunkManager,
                                                                                          fragmentSource));
        fragmentSource.release();
        drain();
        return source;
    }
}
