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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.mesh.MeshManifest;
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.CancellationToken;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Meshes stored as files: {@code <root>/<objectId>.json} holds the manifest and {@code <root>/<objectId>/<fragmentId>}
 * the bytes of each fragment. Files are read on a small pool of I/O threads.
 *
 * @author hal.hildebrand
 */
public class DirectoryMeshSource extends MeshSource {
    private static final Logger        log         = LoggerFactory.getLogger(DirectoryMeshSource.class);
    private static final int           IO_THREADS  = 2;
    private static final AtomicInteger POOL_NUMBER = new AtomicInteger();

    private final Path            root;
    private final ExecutorService io;

    DirectoryMeshSource(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        root = Path.of(Payloads.requireText(options, "root")).toAbsolutePath().normalize();
        var pool = POOL_NUMBER.incrementAndGet();
        var threads = new AtomicInteger();
        io = Executors.newFixedThreadPool(IO_THREADS, r -> {
            var t = new Thread(r, String.format("mesh-io-%d-%d", pool, threads.incrementAndGet()));
            t.setDaemon(true);
            return t;
        });
        log.debug("Serving meshes from {}", root);
    }

    @Override
    public String getRpcTypeId() {
        return MeshRpcIds.DIRECTORY_MESH_SOURCE;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    protected CompletableFuture<MeshManifest> downloadManifest(ManifestChunk chunk, CancellationToken token) {
        var path = resolve(chunk.getKey() + ".json");
        return CompletableFuture.supplyAsync(() -> {
            token.throwIfCanceled();
            try (var is = Files.newInputStream(path)) {
                return MeshManifest.parse(is);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, io);
    }

    @Override
    protected CompletableFuture<byte[]> downloadFragment(FragmentChunk chunk, CancellationToken token) {
        var path = resolve(chunk.getManifestChunk().getKey() + "/" + chunk.getFragmentId());
        return CompletableFuture.supplyAsync(() -> {
            token.throwIfCanceled();
            try {
                return Files.readAllBytes(path);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, io);
    }

    private Path resolve(String relative) {
        var path = root.resolve(relative).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException(String.format("%s is outside of %s", relative, root));
        }
        return path;
    }

    @Override
    protected void disposed() {
        io.shutdownNow();
        super.disposed();
    }
}
