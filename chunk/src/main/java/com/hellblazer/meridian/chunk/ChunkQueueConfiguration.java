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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Capacity limits of a chunk queue manager: GPU memory, system memory and concurrent downloads.
 * <p>
 * Configurations are built with {@link #builder()}, taken from a preset, or read from JSON:
 *
 * <pre>
 * {
 *   "gpuMemory":    { "sizeLimit": 1000000000 },
 *   "systemMemory": { "sizeLimit": 2000000000 },
 *   "download":     { "itemLimit": 32 }
 * }
 * </pre>
 * <p>
 * A capacity missing from the document keeps its default. Within a capacity, a missing limit or the string
 * {@code "unlimited"} means no limit.
 *
 * @author hal.hildebrand
 */
public class ChunkQueueConfiguration {
    public static final String DEFAULT_RESOURCE = "/meridian-chunk-queue.json";

    private static final Logger       log    = LoggerFactory.getLogger(ChunkQueueConfiguration.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final CapacitySpecification DEFAULT_GPU_MEMORY    = CapacitySpecification.ofBytes(1_000_000_000L);
    private static final CapacitySpecification DEFAULT_SYSTEM_MEMORY = CapacitySpecification.ofBytes(2_000_000_000L);
    private static final CapacitySpecification DEFAULT_DOWNLOAD      = CapacitySpecification.ofItems(32);

    private final CapacitySpecification gpuMemory;
    private final CapacitySpecification systemMemory;
    private final CapacitySpecification download;

    private ChunkQueueConfiguration(Builder builder) {
        this.gpuMemory = builder.gpuMemory;
        this.systemMemory = builder.systemMemory;
        this.download = builder.download;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 1 GB of GPU memory, 2 GB of system memory, 32 concurrent downloads.
     */
    public static ChunkQueueConfiguration defaultConfig() {
        return builder().build();
    }

    /**
     * Small limits for constrained environments: 64 MB GPU, 128 MB system memory, 4 concurrent downloads.
     */
    public static ChunkQueueConfiguration minimalConfig() {
        return builder().withGpuMemory(CapacitySpecification.ofBytes(64L << 20))
                        .withSystemMemory(CapacitySpecification.ofBytes(128L << 20))
                        .withDownload(CapacitySpecification.ofItems(4))
                        .build();
    }

    /**
     * Read a configuration from a JSON document.
     *
     * @throws IllegalArgumentException if the document is malformed or a limit is invalid
     */
    public static ChunkQueueConfiguration load(InputStream is) {
        JsonNode root;
        try {
            root = MAPPER.readTree(is);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable chunk queue configuration: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Chunk queue configuration must be a JSON object");
        }
        var builder = builder();
        if (root.has("gpuMemory")) {
            builder.withGpuMemory(parseCapacity("gpuMemory", root.get("gpuMemory")));
        }
        if (root.has("systemMemory")) {
            builder.withSystemMemory(parseCapacity("systemMemory", root.get("systemMemory")));
        }
        if (root.has("download")) {
            builder.withDownload(parseCapacity("download", root.get("download")));
        }
        return builder.build();
    }

    /**
     * Read a configuration from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist or is malformed
     */
    public static ChunkQueueConfiguration fromResource(String resourcePath) {
        try (var is = ChunkQueueConfiguration.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IllegalArgumentException("Configuration resource not found: " + resourcePath);
            }
            var config = load(is);
            log.debug("Loaded chunk queue configuration from {}: {}", resourcePath, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close configuration resource " + resourcePath, e);
        }
    }

    private static CapacitySpecification parseCapacity(String name, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException(String.format("Capacity '%s' must be an object", name));
        }
        return new CapacitySpecification(parseLimit(name, node.get("itemLimit")),
                                         parseLimit(name, node.get("sizeLimit")));
    }

    private static long parseLimit(String name, JsonNode node) {
        if (node == null || node.isNull() || (node.isTextual() && "unlimited".equals(node.asText()))) {
            return CapacitySpecification.UNLIMITED;
        }
        if (!node.isIntegralNumber()) {
            throw new IllegalArgumentException(String.format("Capacity '%s' has a non-integer limit: %s", name, node));
        }
        return node.asLong();
    }

    private static void putCapacity(ObjectNode root, String name, CapacitySpecification capacity) {
        var node = root.putObject(name);
        if (capacity.itemLimit() != CapacitySpecification.UNLIMITED) {
            node.put("itemLimit", capacity.itemLimit());
        }
        if (capacity.sizeLimit() != CapacitySpecification.UNLIMITED) {
            node.put("sizeLimit", capacity.sizeLimit());
        }
    }

    public CapacitySpecification getGpuMemory() {
        return gpuMemory;
    }

    public CapacitySpecification getSystemMemory() {
        return systemMemory;
    }

    public CapacitySpecification getDownload() {
        return download;
    }

    public ObjectNode toJson() {
        var root = MAPPER.createObjectNode();
        putCapacity(root, "gpuMemory", gpuMemory);
        putCapacity(root, "systemMemory", systemMemory);
        putCapacity(root, "download", download);
        return root;
    }

    public Builder toBuilder() {
        return builder().withGpuMemory(gpuMemory).withSystemMemory(systemMemory).withDownload(download);
    }

    public static class Builder {
        private CapacitySpecification gpuMemory    = DEFAULT_GPU_MEMORY;
        private CapacitySpecification systemMemory = DEFAULT_SYSTEM_MEMORY;
        private CapacitySpecification download     = DEFAULT_DOWNLOAD;

        private Builder() {
        }

        public Builder withGpuMemory(CapacitySpecification capacity) {
            this.gpuMemory = require(capacity, "GPU memory");
            return this;
        }

        public Builder withSystemMemory(CapacitySpecification capacity) {
            this.systemMemory = require(capacity, "System memory");
            return this;
        }

        /**
         * @throws IllegalArgumentException if the capacity admits no download at all
         */
        public Builder withDownload(CapacitySpecification capacity) {
            require(capacity, "Download");
            if (capacity.itemLimit() == 0) {
                throw new IllegalArgumentException("Download capacity must allow at least one download");
            }
            this.download = capacity;
            return this;
        }

        public ChunkQueueConfiguration build() {
            return new ChunkQueueConfiguration(this);
        }

        private static CapacitySpecification require(CapacitySpecification capacity, String name) {
            if (capacity == null) {
                throw new IllegalArgumentException(name + " capacity cannot be null");
            }
            return capacity;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChunkQueueConfiguration)) {
            return false;
        }
        var other = (ChunkQueueConfiguration) o;
        return gpuMemory.equals(other.gpuMemory) && systemMemory.equals(other.systemMemory) && download.equals(
        other.download);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gpuMemory, systemMemory, download);
    }

    @Override
    public String toString() {
        return String.format("ChunkQueueConfiguration[gpu=%s, system=%s, download=%s]", gpuMemory, systemMemory,
                             download);
    }
}
