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
package com.hellblazer.meridian.mesh.frontend;

import com.hellblazer.meridian.chunk.frontend.FrontendChunkManager;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkRenderLayer;
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.shared.SharedIdSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Owner of a mesh layer: the meshes of the segments in {@code visibleSegments} are streamed from {@code source}.
 *
 * @author hal.hildebrand
 */
public class FrontendMeshLayer extends FrontendChunkRenderLayer {
    private final FrontendMeshSource source;
    private final SharedIdSet        visibleSegments;

    public FrontendMeshLayer(FrontendChunkManager chunkManager, FrontendMeshSource source,
                             SharedIdSet visibleSegments) {
        this.source = source;
        this.visibleSegments = visibleSegments;
        chunkManager.addRef();
        registerDisposer(chunkManager::release);
        source.addRef();
        registerDisposer(source::release);
        visibleSegments.addRef();
        registerDisposer(visibleSegments::release);
        var options = Payloads.object();
        options.set("chunkManager", chunkManager.addCounterpartRef().toJson());
        options.set("source", source.addCounterpartRef().toJson());
        options.set("visibleSegments", visibleSegments.addCounterpartRef().toJson());
        initializeCounterpart(chunkManager.getRpc(), options);
    }

    @Override
    public String getRpcTypeId() {
        return MeshRpcIds.MESH_LAYER;
    }

    public FrontendMeshSource getSource() {
        return source;
    }

    public SharedIdSet getVisibleSegments() {
        return visibleSegments;
    }

    /**
     * @return the fragments of the visible segments that are in GPU memory
     */
    public List<FrontendFragmentChunk> getVisibleFragments() {
        var fragments = new ArrayList<FrontendFragmentChunk>();
        for (var segment : visibleSegments.values()) {
            fragments.addAll(source.getFragments(segment));
        }
        return fragments;
    }
}
