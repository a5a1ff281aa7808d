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

import com.hellblazer.meridian.chunk.backend.ChunkBackendProtocol;
import com.hellblazer.meridian.mesh.MeshRpcIds;
import com.hellblazer.meridian.rpc.shared.SharedObjectRegistry;

/**
 * Registration of the worker-side mesh types.
 *
 * @author hal.hildebrand
 */
public final class MeshBackendProtocol {
    private static boolean registered;

    private MeshBackendProtocol() {
    }

    public static synchronized void register() {
        if (registered) {
            return;
        }
        registered = true;
        ChunkBackendProtocol.register();
        SharedObjectRegistry.register(MeshRpcIds.FRAGMENT_SOURCE, FragmentSource::new);
        SharedObjectRegistry.register(MeshRpcIds.MESH_LAYER, MeshLayer::new);
        SharedObjectRegistry.register(MeshRpcIds.DIRECTORY_MESH_SOURCE, DirectoryMeshSource::new);
    }
}
