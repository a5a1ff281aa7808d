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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Construction and validated access of message payloads.
 * <p>
 * Handlers read fields through the {@code require*} methods so that a malformed message fails as a
 * {@link ProtocolViolationException} at the boundary rather than as a null pointer somewhere downstream.
 *
 * @author hal.hildebrand
 */
public final class Payloads {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Payloads() {
    }

    public static ObjectNode object() {
        return MAPPER.createObjectNode();
    }

    public static ArrayNode array() {
        return MAPPER.createArrayNode();
    }

    public static JsonNode require(JsonNode payload, String field) {
        var value = payload.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new ProtocolViolationException(String.format("Missing field '%s' in %s", field, payload));
        }
        return value;
    }

    public static long requireLong(JsonNode payload, String field) {
        var value = require(payload, field);
        if (!value.canConvertToLong() || !value.isIntegralNumber()) {
            throw new ProtocolViolationException(
            String.format("Field '%s' must be an integer but was %s", field, value));
        }
        return value.longValue();
    }

    public static String requireText(JsonNode payload, String field) {
        var value = require(payload, field);
        if (!value.isTextual()) {
            throw new ProtocolViolationException(String.format("Field '%s' must be text but was %s", field, value));
        }
        return value.textValue();
    }

    public static ObjectNode requireObject(JsonNode payload, String field) {
        var value = require(payload, field);
        if (!value.isObject()) {
            throw new ProtocolViolationException(
            String.format("Field '%s' must be an object but was %s", field, value));
        }
        return (ObjectNode) value;
    }

    public static ArrayNode requireArray(JsonNode payload, String field) {
        var value = require(payload, field);
        if (!value.isArray()) {
            throw new ProtocolViolationException(String.format("Field '%s' must be an array but was %s", field, value));
        }
        return (ArrayNode) value;
    }

    public static <E extends Enum<E>> E requireEnum(JsonNode payload, String field, Class<E> type) {
        var text = requireText(payload, field);
        try {
            return Enum.valueOf(type, text);
        } catch (IllegalArgumentException e) {
            throw new ProtocolViolationException(
            String.format("Field '%s' is not a valid %s: %s", field, type.getSimpleName(), text), e);
        }
    }

    public static boolean has(JsonNode payload, String field) {
        var value = payload.get(field);
        return value != null && !value.isNull() && !value.isMissingNode();
    }
}
