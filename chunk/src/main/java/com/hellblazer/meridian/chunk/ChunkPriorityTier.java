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
 * Coarse urgency class of a chunk. Tier dominates numeric priority; a lower ordinal is more urgent.
 *
 * @author hal.hildebrand
 */
public enum ChunkPriorityTier {
    VISIBLE, PREFETCH,
    /** No longer desired. Ordered by how recently the chunk was last desired. */
    RECENT;

    /**
     * @return true if chunks in this tier are ordered by numeric priority
     */
    public boolean isOrdered() {
        return this != RECENT;
    }

    /**
     * Compare two requests: a lower tier wins, and within a tier a higher priority wins.
     *
     * @return true if (tier, priority) is strictly more urgent than (otherTier, otherPriority)
     */
    public static boolean isMoreUrgent(ChunkPriorityTier tier, double priority, ChunkPriorityTier otherTier,
                                       double otherPriority) {
        return tier.ordinal() < otherTier.ordinal() || (tier == otherTier && priority > otherPriority);
    }
}
