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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.chunk.frontend.FrontendChunk;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkManager;
import com.hellblazer.meridian.chunk.frontend.FrontendChunkSource;
import com.hellblazer.meridian.mesh.MeshKeys;
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.ProtocolViolationException;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.util.List;

/**
 * Owner of a mesh source. The fragment source is created first and handed to the counterpart as a reference.
 *
 * @author hal.hildebrand
 */
public abstract class FrontendMeshSource extends FrontendChunkSource {
    private final FrontendFragmentSource fragmentSource;

    protected FrontendMeshSource(FrontendChunkManager chunkManager, FrontendFragmentSource fragmentSource) {
        super(chunkManager);
        this.fragmentSource = fragmentSource;
        fragmentSource.addRef();
        registerDisposer(fragmentSource::release);
    }

    @Override
    public void initializeCounterpart(RpcEndpoint rpc, ObjectNode options) {
        options.set("fragmentSource", fragmentSource.addCounterpartRef().toJson());
        super.initializeCounterpart(rpc, options);
    }

    public FrontendFragmentSource getFragmentSource() {
        return fragmentSource;
    }

    /**
     * @return the fragments of the object that are in GPU memory
     */
    public List<FrontendFragmentChunk> getFragments(long objectId) {
        return fragmentSource.getFragments(MeshKeys.objectKey(objectId));
    }

    @Override
    protected FrontendChunk createChunk(String key, Message update) {
        throw new ProtocolViolationException("Manifest chunks are not shipped to the frontend: " + key);
    }
}
