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
import com.hellblazer.meridian.chunk.frontend.TestFrontendChunkSource;
import com.hellblazer.meridian.rpc.CancellationToken;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedObjectRegistry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * Scriptable source: downloads complete immediately unless {@link #autoComplete} is off, in which case they wait
 * for {@link #complete(String)}. Keys in {@link #failing} fail.
 */
public class TestChunkSource extends ChunkSource {
    public final Map<String, Long>                    sizes     = new HashMap<>();
    public final Map<String, CompletableFuture<Void>> pending   = new LinkedHashMap<>();
    public final List<String>                         downloads = new ArrayList<>();
    public final List<String>                         canceled  = new ArrayList<>();
    public final Set<String>                          failing   = new HashSet<>();
    public boolean                                    autoComplete = true;
    public int                                        retries;

    TestChunkSource(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
    }

    static synchronized void register() {
        if (!SharedObjectRegistry.isRegistered(TestFrontendChunkSource.TYPE_ID)) {
            SharedObjectRegistry.register(TestFrontendChunkSource.TYPE_ID, TestChunkSource::new);
        }
    }

    @Override
    public String getRpcTypeId() {
        return TestFrontendChunkSource.TYPE_ID;
    }

    public TestChunk chunk(String key) {
        return getOrCreateChunk(key, TestChunk.class, TestChunk::new);
    }

    @Override
    public CompletableFuture<Void> download(Chunk chunk, CancellationToken token) {
        var key = chunk.getKey();
        downloads.add(key);
        var future = new CompletableFuture<Void>();
        token.add(() -> {
            canceled.add(key);
            future.completeExceptionally(new CancellationException());
        });
        ((TestChunk) chunk).size = sizes.getOrDefault(key, 100L);
        if (failing.contains(key)) {
            future.completeExceptionally(new IOException("Unreachable: " + key));
        } else if (autoComplete) {
            future.complete(null);
        } else {
            pending.put(key, future);
        }
        return future;
    }

    @Override
    public boolean shouldRetry(Chunk chunk, Throwable error) {
        return chunk.getFailedAttempts() <= retries;
    }

    public void complete(String key) {
        pending.remove(key).complete(null);
    }
}
