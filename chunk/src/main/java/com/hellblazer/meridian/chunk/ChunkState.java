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
package com.hellblazer.meridian.chunk;

/**
 * Lifecycle state of a chunk. A chunk normally moves from {@link #NEW} towards {@link #GPU_MEMORY}; it only moves
 * back through eviction or invalidation.
 *
 * @author hal.hildebrand
 */
public enum ChunkState {
    /** Uploaded to the frontend's GPU memory. */
    GPU_MEMORY,
    /** Decoded and held by the worker. */
    SYSTEM_MEMORY_WORKER,
    /** Shipped to the frontend but not uploaded. */
    SYSTEM_MEMORY,
    DOWNLOADING,
    QUEUED,
    NEW,
    FAILED,
    /** Dropped by the frontend; only appears in update messages. */
    EXPIRED;

    /**
     * @return true if the chunk's data is held in system memory on either side
     */
    public boolean isInSystemMemory() {
        return this == SYSTEM_MEMORY || this == SYSTEM_MEMORY_WORKER;
    }

    /**
     * @return true if the chunk occupies memory accounted against the system memory capacity
     */
    public boolean occupiesSystemMemory() {
        return this == DOWNLOADING || this == SYSTEM_MEMORY_WORKER || this == SYSTEM_MEMORY || this == GPU_MEMORY;
    }
}
