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
package com.hellblazer.meridian.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Map;

/**
 * Result of a promise handler: a JSON value plus the buffers to transfer back with it.
 *
 * @author hal.hildebrand
 */
public record RpcValue(JsonNode value, Map<String, TransferableBuffer> transfers) {

    public static final RpcValue EMPTY = new RpcValue(NullNode.getInstance(), Map.of());

    public RpcValue {
        value = value == null ? NullNode.getInstance() : value;
        transfers = transfers == null ? Map.of() : Map.copyOf(transfers);
    }

    public static RpcValue of(JsonNode value) {
        return new RpcValue(value, Map.of());
    }
}
