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
 * Limits of one capacity: how many items and how many bytes it may hold at once.
 *
 * @author hal.hildebrand
 */
public record CapacitySpecification(long itemLimit, long sizeLimit) {

    public static final long UNLIMITED = Long.MAX_VALUE;

    public CapacitySpecification {
        if (itemLimit < 0) {
            throw new IllegalArgumentException("Item limit must be non-negative: " + itemLimit);
        }
        if (sizeLimit < 0) {
            throw new IllegalArgumentException("Size limit must be non-negative: " + sizeLimit);
        }
    }

    public static CapacitySpecification ofItems(long itemLimit) {
        return new CapacitySpecification(itemLimit, UNLIMITED);
    }

    public static CapacitySpecification ofBytes(long sizeLimit) {
        return new CapacitySpecification(UNLIMITED, sizeLimit);
    }

    @Override
    public String toString() {
        return String.format("Capacity[items=%s, bytes=%s]", format(itemLimit), format(sizeLimit));
    }

    private static String format(long limit) {
        return limit == UNLIMITED ? "unlimited" : String.valueOf(limit);
    }
}
