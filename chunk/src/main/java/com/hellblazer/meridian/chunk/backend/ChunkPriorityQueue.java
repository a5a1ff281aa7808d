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

import com.hellblazer.meridian.chunk.ChunkPriorityTier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Chunks of one queue, by tier. The ordered tiers are sorted by priority; {@code RECENT} keeps the order in which
 * chunks entered it, oldest first.
 * <p>
 * A chunk's tier and priority must not change while it is in the queue.
 *
 * @author hal.hildebrand
 */
class ChunkPriorityQueue {
    private static final Comparator<Chunk> BY_PRIORITY = Comparator.comparingDouble(Chunk::getPriority)
                                                                   .thenComparingLong(c -> c.sequence);

    private final Map<ChunkPriorityTier, TreeSet<Chunk>> ordered = new EnumMap<>(ChunkPriorityTier.class);
    private final LinkedHashSet<Chunk>                   recent  = new LinkedHashSet<>();
    private final String                                 name;

    ChunkPriorityQueue(String name) {
        this.name = name;
        for (var tier : ChunkPriorityTier.values()) {
            if (tier.isOrdered()) {
                ordered.put(tier, new TreeSet<>(BY_PRIORITY));
            }
        }
    }

    void add(Chunk chunk) {
        var tier = chunk.getPriorityTier();
        if (tier.isOrdered()) {
            ordered.get(tier).add(chunk);
        } else {
            recent.add(chunk);
        }
    }

    void remove(Chunk chunk) {
        var tier = chunk.getPriorityTier();
        if (tier.isOrdered()) {
            ordered.get(tier).remove(chunk);
        } else {
            recent.remove(chunk);
        }
    }

    boolean contains(Chunk chunk) {
        var tier = chunk.getPriorityTier();
        return tier.isOrdered() ? ordered.get(tier).contains(chunk) : recent.contains(chunk);
    }

    int size() {
        var size = recent.size();
        for (var set : ordered.values()) {
            size += set.size();
        }
        return size;
    }

    /**
     * Promotion order: {@code VISIBLE} by descending priority, then {@code PREFETCH}, then {@code RECENT} from the
     * most recently desired.
     */
    List<Chunk> mostUrgentFirst() {
        var result = new ArrayList<Chunk>(size());
        for (var tier : ChunkPriorityTier.values()) {
            if (tier.isOrdered()) {
                result.addAll(ordered.get(tier).descendingSet());
            }
        }
        var fromRecent = new ArrayList<>(recent);
        for (int i = fromRecent.size() - 1; i >= 0; i--) {
            result.add(fromRecent.get(i));
        }
        return result;
    }

    /**
     * Eviction order: {@code RECENT} from the least recently desired, then {@code PREFETCH} by ascending priority,
     * then {@code VISIBLE}.
     */
    List<Chunk> leastUrgentFirst() {
        var result = new ArrayList<Chunk>(size());
        result.addAll(recent);
        var tiers = ChunkPriorityTier.values();
        for (int i = tiers.length - 1; i >= 0; i--) {
            if (tiers[i].isOrdered()) {
                result.addAll(ordered.get(tiers[i]));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return String.format("ChunkPriorityQueue[%s size=%d]", name, size());
    }
}
