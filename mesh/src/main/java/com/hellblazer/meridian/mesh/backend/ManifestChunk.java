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

import com.hellblazer.meridian.chunk.ChunkPriorityTier;
import com.hellblazer.meridian.chunk.backend.Chunk;
import com.hellblazer.meridian.mesh.MeshManifest;

/**
 * The fragment list of one object. Manifests stay on the worker.
 *
 * @author hal.hildebrand
 */
public class ManifestChunk extends Chunk {
    /**
     * Accounted size of a decoded manifest, which is not measured.
     */
    public static final long MANIFEST_BYTES = 100;

    private final long   objectId;
    private MeshManifest manifest;

    ManifestChunk(long objectId) {
        this.objectId = objectId;
        setBackendOnly(true);
    }

    public long getObjectId() {
        return objectId;
    }

    /**
     * @return the fragment list, or null until downloaded
     */
    public MeshManifest getManifest() {
        return manifest;
    }

    void setManifest(MeshManifest manifest) {
        this.manifest = manifest;
    }

    @Override
    protected void downloadSucceeded() {
        setSystemMemoryBytes(MANIFEST_BYTES);
        super.downloadSucceeded();
        // The fragments can be requested now
        if (getPriorityTier() == ChunkPriorityTier.VISIBLE) {
            getChunkManager().scheduleUpdateChunkPriorities();
        }
    }

    @Override
    protected void freeSystemMemory() {
        manifest = null;
    }
}
