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
import com.hellblazer.meridian.rpc.TransferableBuffer;

import java.util.Map;

/**
 * Encoded geometry of one fragment of an object. The bytes move to the frontend when the chunk is shipped.
 *
 * @author hal.hildebrand
 */
public class FragmentChunk extends Chunk {
    private final ManifestChunk manifestChunk;
    private final String        fragmentId;
    private byte[]              data;

    FragmentChunk(ManifestChunk manifestChunk, String fragmentId) {
        this.manifestChunk = manifestChunk;
        this.fragmentId = fragmentId;
    }

    public ManifestChunk getManifestChunk() {
        return manifestChunk;
    }

    public String getFragmentId() {
        return fragmentId;
    }

    public byte[] getData() {
        return data;
    }

    void setData(byte[] data) {
        this.data = data;
    }

    @Override
    protected void downloadSucceeded() {
        setSystemMemoryBytes(data.length);
        setGpuMemoryBytes(data.length);
        super.downloadSucceeded();
    }

    @Override
    protected void freeSystemMemory() {
        data = null;
    }

    @Override
    protected void serialize(ObjectNode message, Map<String, TransferableBuffer> transfers) {
        super.serialize(message, transfers);
        message.put("objectKey", manifestChunk.getKey());
        message.put("fragmentId", fragmentId);
        transfers.put("data", TransferableBuffer.wrap(data));
        data = null;
    }
}
