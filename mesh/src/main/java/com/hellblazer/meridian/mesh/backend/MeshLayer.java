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
import com.hellblazer.meridian.chunk.ChunkPriorityTier;
import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.chunk.backend.ChunkManager;
import com.hellblazer.meridian.chunk.backend.ChunkRenderLayer;
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import com.hellblazer.meridian.rpc.shared.SharedIdSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Requests the meshes of the visible segments: each segment's manifest, and once the manifest is on the worker,
 * every fragment it lists at a lower priority than the manifest. Manifests count as available once downloaded,
 * fragments once in GPU memory.
 *
 * @author hal.hildebrand
 */
public class MeshLayer extends ChunkRenderLayer {
    public static final double MANIFEST_CHUNK_PRIORITY = 100;
    public static final double FRAGMENT_CHUNK_PRIORITY = 50;

    private static final Logger log = LoggerFactory.getLogger(MeshLayer.class);

    private final ChunkManager chunkManager;
    private final SharedIdSet  visibleSegments;
    private final MeshSource   source;

    MeshLayer(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        chunkManager = rpc.getRef(Payloads.require(options, "chunkManager"), ChunkManager.class);
        registerDisposer(chunkManager::release);
        visibleSegments = rpc.getRef(Payloads.require(options, "visibleSegments"), SharedIdSet.class);
        registerDisposer(visibleSegments::release);
        source = rpc.getRef(Payloads.require(options, "source"), MeshSource.class);
        registerDisposer(source::release);
        registerDisposer(chunkManager.recomputeChunkPriorities().add(this::updateChunkPriorities));
        registerDisposer(visibleSegments.changed().add(chunkManager::scheduleUpdateChunkPriorities));
        chunkManager.scheduleUpdateChunkPriorities();
    }

    @Override
    public String getRpcTypeId() {
        return MeshRpcIds.MESH_LAYER;
    }

    public MeshSource getSource() {
        return source;
    }

    public SharedIdSet getVisibleSegments() {
        return visibleSegments;
    }

    private void updateChunkPriorities() {
        // Reported even when nothing is visible
        chunkManager.registerLayer(this);
        for (var segment : visibleSegments.values()) {
            var manifestChunk = source.getChunk(segment);
            requestChunk(chunkManager, manifestChunk, ChunkPriorityTier.VISIBLE, MANIFEST_CHUNK_PRIORITY);
            var manifest = manifestChunk.getManifest();
            if (manifestChunk.getState() != ChunkState.SYSTEM_MEMORY_WORKER || manifest == null) {
                continue;
            }
            for (var fragmentId : manifest.fragments()) {
                requestChunk(chunkManager, source.getFragmentChunk(manifestChunk, fragmentId),
                             ChunkPriorityTier.VISIBLE, FRAGMENT_CHUNK_PRIORITY);
            }
        }
        log.trace("{} requested {} segments", this, visibleSegments.size());
    }
}
