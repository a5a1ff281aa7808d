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
import com.hellblazer.meridian.chunk.frontend.FrontendChunkManager;
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.nio.file.Path;

/**
 * Owner of a {@code mesh/DirectoryMeshSource}.
 *
 * @author hal.hildebrand
 */
public class FrontendDirectoryMeshSource extends FrontendMeshSource {
    private final Path root;

    private FrontendDirectoryMeshSource(FrontendChunkManager chunkManager, FrontendFragmentSource fragmentSource,
                                        Path root) {
        super(chunkManager, fragmentSource);
        this.root = root;
    }

    /**
     * Return the source for the directory, creating it and its fragment source on first use. The caller must release
     * the returned source.
     */
    public static FrontendDirectoryMeshSource get(FrontendChunkManager chunkManager, Path root) {
        var normalized = root.toAbsolutePath().normalize();
        var key = "mesh:" + normalized.toUri();
        var fragmentSource = chunkManager.getChunkSource(key + "#fragments", FrontendFragmentSource.class,
                                                         () -> new FrontendFragmentSource(chunkManager));
        try {
            return chunkManager.getChunkSource(key, FrontendDirectoryMeshSource.class,
                                               () -> new FrontendDirectoryMeshSource(chunkManager, fragmentSource,
                                                                                     normalized));
        } finally {
            fragmentSource.release();
        }
    }

    @Override
    public String getRpcTypeId() {
        return MeshRpcIds.DIRECTORY_MESH_SOURCE;
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public void initializeCounterpart(RpcEndpoint rpc, ObjectNode options) {
        options.put("root", root.toString());
        super.initializeCounterpart(rpc, options);
    }
}
