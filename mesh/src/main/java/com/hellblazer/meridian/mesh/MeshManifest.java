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
package com.hellblazer.meridian.mesh;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * The fragments making up one mesh object, decoded from {@code {"fragments": ["f1", ...]}}.
 *
 * @author hal.hildebrand
 */
public record MeshManifest(List<String> fragments) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public MeshManifest {
        fragments = List.copyOf(fragments);
    }

    /**
     * @throws IOException              if the document is not JSON
     * @throws IllegalArgumentException if it is JSON but not a manifest
     */
    public static MeshManifest parse(InputStream is) throws IOException {
        return fromJson(MAPPER.readTree(is));
    }

    public static MeshManifest parse(byte[] bytes) throws IOException {
        return fromJson(MAPPER.readTree(bytes));
    }

    public static MeshManifest fromJson(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException("Mesh manifest must be a JSON object");
        }
        var list = json.get("fragments");
        if (list == null || !list.isArray()) {
            throw new IllegalArgumentException("Mesh manifest has no fragment list: " + json);
        }
        var fragments = new ArrayList<String>(list.size());
        for (var fragment : list) {
            if (!fragment.isTextual() || fragment.textValue().isEmpty()) {
                throw new IllegalArgumentException("Invalid fragment id in mesh manifest: " + fragment);
            }
            fragments.add(fragment.textValue());
        }
        return new MeshManifest(fragments);
    }
}
