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
package com.hellblazer.meridian.chunk.frontend;

import com.hellblazer.meridian.chunk.ChunkState;

/**
 * Frontend copy of a chunk sent by the worker. Subclasses hold the payload and upload it in {@link #copyToGpu()}.
 *
 * @author hal.hildebrand
 */
public class FrontendChunk {
    private final FrontendChunkSource source;
    private final String              key;
    private ChunkState                state = ChunkState.SYSTEM_MEMORY;

    public FrontendChunk(FrontendChunkSource source, String key) {
        this.source = source;
        this.key = key;
    }

    public FrontendChunkSource getSource() {
        return source;
    }

    public String getKey() {
        return key;
    }

    public ChunkState getState() {
        return state;
    }

    /**
     * Upload the payload; called when the worker moves the chunk to {@code GPU_MEMORY}.
     */
    protected void copyToGpu() {
    }

    /**
     * Release the uploaded payload, keeping the system memory copy.
     */
    protected void freeGpuMemory() {
    }

    void setState(ChunkState state) {
        this.state = state;
    }

    @Override
    public String toString() {
        return String.format("%s[%s %s]", getClass().getSimpleName(), key, state);
    }
}
