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

import com.hellblazer.meridian.chunk.frontend.FrontendChunk;

import java.nio.ByteBuffer;

/**
 * Frontend copy of a fragment's encoded geometry, holding the buffer transferred by the worker without copying it.
 *
 * @author hal.hildebrand
 */
public class FrontendFragmentChunk extends FrontendChunk {
    private final String     objectKey;
    private final String     fragmentId;
    private final ByteBuffer data;
    private boolean          uploaded;

    public FrontendFragmentChunk(FrontendFragmentSource source, String key, String objectKey, String fragmentId,
                                 ByteBuffer data) {
        super(source, key);
        this.objectKey = objectKey;
        this.fragmentId = fragmentId;
        this.data = data;
    }

    public String getObjectKey() {
        return objectKey;
    }

    public String getFragmentId() {
        return fragmentId;
    }

    /**
     * @return a read-only view of the encoded geometry moved from the worker
     */
    public ByteBuffer getData() {
        return data.asReadOnlyBuffer();
    }

    public boolean isUploaded() {
        return uploaded;
    }

    @Override
    protected void copyToGpu() {
        uploaded = true;
    }

    @Override
    protected void freeGpuMemory() {
        uploaded = false;
    }
}
