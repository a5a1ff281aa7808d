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

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A structured message: the handler key, the handler-specific fields, and any buffers moved along with it.
 *
 * @param functionName the registered handler that receives this message
 * @param payload      handler-specific fields
 * @param transfers    buffers transferred with the message, by name
 * @author hal.hildebrand
 */
public record Message(String functionName, ObjectNode payload, Map<String, TransferableBuffer> transfers) {

    public Message {
        if (functionName == null) {
            throw new IllegalArgumentException("Function name cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        transfers = transfers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(transfers));
    }

    public Message(String functionName, ObjectNode payload) {
        this(functionName, payload, Map.of());
    }

    /**
     * @return a copy of this message whose buffers have been moved out of this one
     */
    public Message transfer() {
        if (transfers.isEmpty()) {
            return this;
        }
        var moved = new LinkedHashMap<String, TransferableBuffer>();
        transfers.forEach((name, buffer) -> moved.put(name, buffer.transfer()));
        return new Message(functionName, payload, moved);
    }

    /**
     * @throws ProtocolViolationException if no buffer of that name was transferred
     */
    public TransferableBuffer requireTransfer(String name) {
        var buffer = transfers.get(name);
        if (buffer == null) {
            throw new ProtocolViolationException(
            String.format("Message %s is missing transferred buffer '%s'", functionName, name));
        }
        return buffer;
    }

    @Override
    public String toString() {
        return String.format("Message[%s %s, transfers=%s]", functionName, payload, transfers.keySet());
    }
}
