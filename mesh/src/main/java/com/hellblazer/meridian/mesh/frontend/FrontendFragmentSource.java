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

import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.chunk.frontend.FrontendChunk;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkManager;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkSource;
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Owner of a {@code mesh/FragmentSource}. Fragments are indexed by the key of the object they belong to.
 *
 * @author hal.hildebrand
 */
public class FrontendFragmentSource extends FrontendChunkSource {
    private final Map<String, Set<FrontendFragmentChunk>> fragmentsByObject = new HashMap<>();

    public FrontendFragmentSource(FrontendChunkManager chunkManager) {
        super(chunkManager);
    }

    @Override
    public String getRpcTypeId() {
        return MeshRpcIds.FRAGMENT_SOURCE;
    }

    /**
     * @return the fragments of the object that are in GPU memory
     */
    public List<FrontendFragmentChunk> getFragments(String objectKey) {
        var indexed = fragmentsByObject.get(objectKey);
        if (indexed == null) {
            return List.of();
        }
        var fragments = new ArrayList<FrontendFragmentChunk>(indexed.size());
        for (var fragment : indexed) {
            if (fragment.getState() == ChunkState.GPU_MEMORY) {
                fragments.add(fragment);
            }
        }
        return fragments;
    }

    public int getIndexedObjectCount() {
        return fragmentsByObject.size();
    }

    @Override
    protected FrontendChunk createChunk(String key, Message update) {
        var payload = update.payload();
        return new FrontendFragmentChunk(this, key, Payloads.requireText(payload, "objectKey"),
                                         Payloads.requireText(payload, "fragmentId"),
                                         update.requireTransfer("data").buffer());
    }

    @Override
    protected void chunkAdded(FrontendChunk chunk) {
        var fragment = (FrontendFragmentChunk) chunk;
        fragmentsByObject.computeIfAbsent(fragment.getObjectKey(), k -> new LinkedHashSet<>()).add(fragment);
    }

    @Override
    protected void chunkRemoved(FrontendChunk chunk) {
        var fragment = (FrontendFragmentChunk) chunk;
        var indexed = fragmentsByObject.get(fragment.getObjectKey());
        if (indexed != null && indexed.remove(fragment) && indexed.isEmpty()) {
            fragmentsByObject.remove(fragment.getObjectKey());
        }
    }
}
