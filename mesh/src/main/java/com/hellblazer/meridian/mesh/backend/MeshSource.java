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
import com.hellblazer.meridian.chunk.backend.Chunk;
import com.hellblazer.meridian.chunk.backend.ChunkSource;
import com.hellblazer.meridian.mesh.MeshKeys;
import com.hellblazer.meridian.mesh.MeshManifest;
import com.hellblazer.meridian.rpc.CancellationToken;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.util.concurrent.CompletableFuture;

/**
 * Two level source of mesh objects: a manifest chunk per object listing its fragments, and fragment chunks, held by
 * a {@link FragmentSource}, with the geometry. Subclasses fetch manifests and fragment bytes; the decoded results
 * are stored on the event loop.
 *
 * @author hal.hildebrand
 */
public abstract class MeshSource extends ChunkSource {
    private final FragmentSource fragmentSource;

    protected MeshSource(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        fragmentSource = rpc.getRef(Payloads.require(options, "fragmentSource"), FragmentSource.class);
        registerDisposer(fragmentSource::release);
        fragmentSource.setMeshSource(this);
    }

    public FragmentSource getFragmentSource() {
        return fragmentSource;
    }

    public ManifestChunk getChunk(long objectId) {
        return getOrCreateChunk(MeshKeys.objectKey(objectId), ManifestChunk.class, () -> new ManifestChunk(objectId));
    }

    public FragmentChunk getFragmentChunk(ManifestChunk manifestChunk, String fragmentId) {
        return fragmentSource.getFragmentChunk(manifestChunk, fragmentId);
    }

    @Override
    public CompletableFuture<Void> download(Chunk chunk, CancellationToken token) {
        var manifestChunk = (ManifestChunk) chunk;
        return downloadManifest(manifestChunk, token).thenAcceptAsync(manifest -> {
            if (!token.isCanceled()) {
                manifestChunk.setManifest(manifest);
            }
        }, getRpc().getEventLoop());
    }

    /**
     * Fetch and decode the manifest of the chunk's object. May complete on any thread.
     */
    protected abstract CompletableFuture<MeshManifest> downloadManifest(ManifestChunk chunk, CancellationToken token);

    /**
     * Fetch the bytes of a fragment. May complete on any thread.
     */
    protected abstract CompletableFuture<byte[]> downloadFragment(FragmentChunk chunk, CancellationToken token);

    CompletableFuture<Void> fetchFragment(FragmentChunk chunk, CancellationToken token) {
        return downloadFragment(chunk, token).thenAcceptAsync(data -> {
            if (!token.isCanceled()) {
                chunk.setData(data);
            }
        }, getRpc().getEventLoop());
    }

    @Override
    protected void disposed() {
        fragmentSource.setMeshSource(null);
        super.disposed();
    }
}
