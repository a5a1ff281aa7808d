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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.Payloads;

/**
 * How many of the chunks a layer asked for in the last recompute are ready, per ordered tier. A chunk copied to the
 * frontend is ready once it is in GPU memory; a chunk kept on the worker once it is downloaded.
 *
 * @author hal.hildebrand
 */
public record LayerChunkProgress(int numVisibleChunksNeeded, int numVisibleChunksAvailable,
                                 int numPrefetchChunksNeeded, int numPrefetchChunksAvailable) {

    public static final LayerChunkProgress EMPTY = new LayerChunkProgress(0, 0, 0, 0);

    public static LayerChunkProgress fromJson(JsonNode json) {
        return new LayerChunkProgress((int) Payloads.requireLong(json, "numVisibleChunksNeeded"),
                                      (int) Payloads.requireLong(json, "numVisibleChunksAvailable"),
                                      (int) Payloads.requireLong(json, "numPrefetchChunksNeeded"),
                                      (int) Payloads.requireLong(json, "numPrefetchChunksAvailable"));
    }

    /**
     * @return the fraction of visible chunks that are ready, 1 when none are needed
     */
    public double visibleFraction() {
        return numVisibleChunksNeeded == 0 ? 1.0 : (double) numVisibleChunksAvailable / numVisibleChunksNeeded;
    }

    public boolean isVisibleComplete() {
        return numVisibleChunksAvailable >= numVisibleChunksNeeded;
    }

    public ObjectNode toJson() {
        var json = Payloads.object();
        json.put("numVisibleChunksNeeded", numVisibleChunksNeeded);
        json.put("numVisibleChunksAvailable", numVisibleChunksAvailable);
        json.put("numPrefetchChunksNeeded", numPrefetchChunksNeeded);
        json.put("numPrefetchChunksAvailable", numPrefetchChunksAvailable);
        return json;
    }
}
