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
package com.hellblazer.meridian.chunk.backend;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.TransferableBuffer;

import java.util.Map;

/**
 * Chunk whose payload is only a size, accounted as both system and GPU memory.
 */
public class TestChunk extends Chunk {
    long size;
    int  freed;

    @Override
    protected void downloadSucceeded() {
        setSystemMemoryBytes(size);
        setGpuMemoryBytes(size);
        super.downloadSucceeded();
    }

    @Override
    protected void freeSystemMemory() {
        freed++;
    }

    @Override
    protected void serialize(ObjectNode message, Map<String, TransferableBuffer> transfers) {
        super.serialize(message, transfers);
        message.put("size", size);
    }
}
