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
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.CancellationToken;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.util.concurrent.CompletableFuture;

/**
 * Holds the fragment chunks of a mesh source; downloads are delegated to that source.
 *
 * @author hal.hildebrand
 */
public class FragmentSource extends ChunkSource {
    private MeshSource meshSource;

    FragmentSource(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
    }

    @Override
    public String getRpcTypeId() {
        return MeshRpcIds.FRAGMENT_SOURCE;
    }

    public MeshSource getMeshSource() {
        return meshSource;
    }

    @Override
    public CompletableFuture<Void> download(Chunk chunk, CancellationToken token) {
        if (meshSource == null || meshSource.isDisposed()) {
            return CompletableFuture.failedFuture(new IllegalStateException(this + " has no mesh source"));
        }
        return meshSource.fetchFragment((FragmentChunk) chunk, token);
    }

    void setMeshSource(MeshSource meshSource) {
        this.meshSource = meshSource;
    }

    FragmentChunk getFragmentChunk(ManifestChunk manifestChunk, String fragmentId) {
        return getOrCreateChunk(MeshKeys.fragmentKey(manifestChunk.getKey(), fragmentId), FragmentChunk.class,
                                () -> new FragmentChunk(manifestChunk, fragmentId));
    }

    @Override
    protected void disposed() {
        meshSource = null;
        super.disposed();
    }
}
