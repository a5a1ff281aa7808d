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
package com.hellblazer.meridian.rpc.shared;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.Payloads;

/**
 * A cross-boundary reference to a counterpart: the object id and the generation the owner issued with it.
 *
 * @author hal.hildebrand
 */
public record SharedObjectRef(long id, long generation) {

    public static SharedObjectRef fromJson(JsonNode json) {
        return new SharedObjectRef(Payloads.requireLong(json, "id"), Payloads.requireLong(json, "gen"));
    }

    public ObjectNode toJson() {
        var json = Payloads.object();
        json.put("id", id);
        json.put("gen", generation);
        return json;
    }
}
