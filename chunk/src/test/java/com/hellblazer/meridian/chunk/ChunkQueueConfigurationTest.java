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

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class ChunkQueueConfigurationTest {

    private static ChunkQueueConfiguration load(String json) {
        return ChunkQueueConfiguration.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testDefaults() {
        var config = ChunkQueueConfiguration.defaultConfig();
        assertEquals(CapacitySpecification.ofBytes(1_000_000_000L), config.getGpuMemory());
        assertEquals(CapacitySpecification.ofBytes(2_000_000_000L), config.getSystemMemory());
        assertEquals(CapacitySpecification.ofItems(32), config.getDownload());
    }

    @Test
    void testShippedResourceMatchesDefaults() {
        assertEquals(ChunkQueueConfiguration.defaultConfig(),
                     ChunkQueueConfiguration.fromResource(ChunkQueueConfiguration.DEFAULT_RESOURCE));
    }

    @Test
    void testMinimal() {
        var config = ChunkQueueConfiguration.minimalConfig();
        assertEquals(64L << 20, config.getGpuMemory().sizeLimit());
        assertEquals(CapacitySpecification.UNLIMITED, config.getGpuMemory().itemLimit());
        assertEquals(4, config.getDownload().itemLimit());
    }

    @Test
    void testFromResource() {
        var config = ChunkQueueConfiguration.fromResource("/chunk-queue-small.json");
        assertEquals(CapacitySpecification.ofBytes(1048576), config.getGpuMemory());
        assertEquals(CapacitySpecification.ofItems(64), config.getSystemMemory());
        assertEquals(CapacitySpecification.ofItems(2), config.getDownload());
    }

    @Test
    void testMissingCapacityKeepsDefault() {
        var config = load("{\"download\": {\"itemLimit\": 8}}");
        assertEquals(ChunkQueueConfiguration.defaultConfig().getGpuMemory(), config.getGpuMemory());
        assertEquals(CapacitySpecification.ofItems(8), config.getDownload());
    }

    @Test
    void testJsonRoundTrip() {
        var config = ChunkQueueConfiguration.minimalConfig().toBuilder()
                                            .withDownload(new CapacitySpecification(3, 1 << 20))
                                            .build();
        assertEquals(config, load(config.toJson().toString()));
    }

    @Test
    void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> load("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"gpuMemory\": "));
        assertThrows(IllegalArgumentException.class, () -> load("{\"gpuMemory\": 5}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"gpuMemory\": {\"sizeLimit\": 1.5}}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"gpuMemory\": {\"sizeLimit\": -1}}"));
        assertThrows(IllegalArgumentException.class, () -> load("{\"download\": {\"itemLimit\": 0}}"));
        assertThrows(IllegalArgumentException.class, () -> ChunkQueueConfiguration.fromResource("/missing.json"));
        assertThrows(IllegalArgumentException.class, () -> ChunkQueueConfiguration.builder().withGpuMemory(null));
    }
}
