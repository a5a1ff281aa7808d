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

import com.hellblazer.meridian.rpc.shared.RefCounted;
import com.hellblazer.meridian.rpc.shared.SharedWatchableValue;
import com.hellblazer.meridian.rpc.shared.Signal;

/**
 * Usage of one capacity against limits owned by the frontend. Limits may be lowered below current usage, in which
 * case the available amounts are negative until chunks are evicted.
 *
 * @author hal.hildebrand
 */
public class AvailableCapacity extends RefCounted {
    private final SharedWatchableValue itemLimit;
    private final SharedWatchableValue sizeLimit;
    private final Signal               capacityChanged = new Signal();
    private long                       currentItems;
    private long                       currentSize;

    /**
     * @param itemLimit borrowed; the caller keeps it alive
     * @param sizeLimit borrowed; the caller keeps it alive
     */
    public AvailableCapacity(SharedWatchableValue itemLimit, SharedWatchableValue sizeLimit) {
        this.itemLimit = itemLimit;
        this.sizeLimit = sizeLimit;
        registerDisposer(itemLimit.changed().add(capacityChanged::dispatch));
        registerDisposer(sizeLimit.changed().add(capacityChanged::dispatch));
    }

    /**
     * Record usage; negative amounts return capacity.
     */
    public void adjust(long items, long size) {
        currentItems += items;
        currentSize += size;
    }

    public long getAvailableItems() {
        return saturatedSubtract(itemLimit.longValue(), currentItems);
    }

    public long getAvailableSize() {
        return saturatedSubtract(sizeLimit.longValue(), currentSize);
    }

    public long getCurrentItems() {
        return currentItems;
    }

    public long getCurrentSize() {
        return currentSize;
    }

    public long getItemLimit() {
        return itemLimit.longValue();
    }

    public long getSizeLimit() {
        return sizeLimit.longValue();
    }

    public Signal capacityChanged() {
        return capacityChanged;
    }

    private static long saturatedSubtract(long limit, long used) {
        if (limit == Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return limit - used;
    }

    @Override
    public String toString() {
        return String.format("bytes=%d/%d, items=%d/%d", currentSize, getSizeLimit(), currentItems, getItemLimit());
    }
}
