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

import com.hellblazer.meridian.chunk.CapacitySpecification;
import com.hellblazer.meridian.chunk.ChunkPriorityTier;
import com.hellblazer.meridian.chunk.ChunkState;
import com.hellblazer.meridian.chunk.frontend.TestFrontendChunkSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hellblazer.meridian.chunk.ChunkPriorityTier.PREFETCH;
import static com.hellblazer.meridian.chunk.ChunkPriorityTier.VISIBLE;
import static org.junit.jupiter.api.Assertions.*;

public class ChunkQueueManagerTest {

    private ChunkTestHarness        harness;
    private TestFrontendChunkSource frontendSource;
    private TestChunkSource         source;

    private void setUp(long systemMemoryBytes, long downloads) {
        harness = new ChunkTestHarness(ChunkTestHarness.configuration(systemMemoryBytes, downloads));
        frontendSource = harness.addSource("test");
        source = harness.backendSource(frontendSource);
    }

    @Test
    void testVisibleChunksReachTheFrontend() {
        setUp(1 << 20, 4);
        var a = source.chunk("a");
        var b = source.chunk("b");
        harness.desire(a, VISIBLE, 10);
        harness.desire(b, VISIBLE, 5);
        harness.recompute();

        assertEquals(ChunkState.GPU_MEMORY, a.getState());
        assertEquals(ChunkState.GPU_MEMORY, b.getState());
        assertEquals(List.of("a", "b"), source.downloads);
        assertEquals(2, frontendSource.getChunkCount());
        assertEquals(ChunkState.GPU_MEMORY, frontendSource.chunk("a").getState());
        assertEquals(1, frontendSource.chunk("a").uploads);
        assertEquals(100, frontendSource.chunk("b").size);
        assertEquals(200, harness.queueManager.getSystemMemoryCapacity().getCurrentSize());
        assertEquals(200, harness.queueManager.getGpuMemoryCapacity().getCurrentSize());
        assertEquals(0, harness.queueManager.getDownloadCapacity().getCurrentItems());
        assertTrue(harness.queueManager.gpuMemoryChanged().getDispatchCount() > 0);
    }

    @Test
    void testBackendOnlyChunksStayOnTheWorker() {
        setUp(1 << 20, 4);
        var a = source.chunk("a");
        a.setBackendOnly(true);
        harness.desire(a, VISIBLE, 1);
        harness.recompute();

        assertEquals(ChunkState.SYSTEM_MEMORY_WORKER, a.getState());
        assertEquals(0, frontendSource.getChunkCount());
    }

    @Test
    void testMemoryLimitEvictsLeastRecentlyDesired() {
        setUp(400, 4);
        var r1 = source.chunk("r1");
        var r2 = source.chunk("r2");
        harness.desire(r1, VISIBLE, 1);
        harness.desire(r2, VISIBLE, 1);
        harness.recompute();
        assertEquals(ChunkState.GPU_MEMORY, r2.getState());

        harness.forgetAll();
        var x = source.chunk("x");
        var y = source.chunk("y");
        var z = source.chunk("z");
        harness.desire(x, VISIBLE, 3);
        harness.desire(y, VISIBLE, 2);
        harness.desire(z, VISIBLE, 1);
        harness.recompute();

        assertNull(source.getChunk("r1"), "Least recently desired chunk evicted");
        assertSame(r2, source.getChunk("r2"));
        assertEquals(ChunkPriorityTier.RECENT, r2.getPriorityTier());
        assertEquals(ChunkState.GPU_MEMORY, r2.getState());
        for (var chunk : List.of(x, y, z)) {
            assertEquals(ChunkState.GPU_MEMORY, chunk.getState());
        }
        assertEquals(400, harness.queueManager.getSystemMemoryCapacity().getCurrentSize());
        assertNull(frontendSource.getChunk("r1"));
        assertNotNull(frontendSource.getChunk("r2"));
    }

    @Test
    void testVisibleChunksAreNeverEvictedToFitTheLimit() {
        setUp(250, 4);
        var r1 = source.chunk("r1");
        var r2 = source.chunk("r2");
        harness.desire(r1, VISIBLE, 1);
        harness.desire(r2, VISIBLE, 1);
        harness.recompute();

        harness.forgetAll();
        var desired = List.of(source.chunk("x"), source.chunk("y"), source.chunk("z"));
        desired.forEach(chunk -> harness.desire(chunk, VISIBLE, 1));
        harness.recompute();

        assertNull(source.getChunk("r1"));
        assertNull(source.getChunk("r2"));
        for (var chunk : desired) {
            assertEquals(ChunkState.GPU_MEMORY, chunk.getState());
        }
        assertEquals(300, harness.queueManager.getSystemMemoryCapacity().getCurrentSize());
        assertEquals(-50, harness.queueManager.getSystemMemoryCapacity().getAvailableSize());
    }

    @Test
    void testPinnedChunksAreNeverEvicted() {
        setUp(400, 4);
        var r1 = source.chunk("r1");
        var r2 = source.chunk("r2");
        harness.desire(r1, VISIBLE, 1);
        harness.desire(r2, VISIBLE, 1);
        harness.recompute();
        r1.pin();

        harness.forgetAll();
        List.of(source.chunk("x"), source.chunk("y"), source.chunk("z"))
            .forEach(chunk -> harness.desire(chunk, VISIBLE, 1));
        harness.recompute();

        assertSame(r1, source.getChunk("r1"));
        assertEquals(ChunkState.GPU_MEMORY, r1.getState());
        assertNull(source.getChunk("r2"));

        r1.unpin();
        assertFalse(r1.isPinned());
        assertThrows(IllegalStateException.class, r1::unpin);
    }

    @Test
    void testMoreUrgentRequestEvictsDownload() {
        setUp(1 << 20, 1);
        source.autoComplete = false;
        var a = source.chunk("a");
        harness.desire(a, PREFETCH, 1);
        harness.recompute();
        assertEquals(ChunkState.DOWNLOADING, a.getState());
        assertEquals(1, harness.queueManager.getDownloadCapacity().getCurrentItems());

        var b = source.chunk("b");
        harness.desire(b, VISIBLE, 1);
        harness.recompute();

        assertEquals(ChunkState.QUEUED, a.getState());
        assertEquals(ChunkState.DOWNLOADING, b.getState());
        assertEquals(List.of("a"), source.canceled);

        // The canceled download completing late changes nothing
        source.complete("a");
        harness.drain();
        assertEquals(ChunkState.QUEUED, a.getState());

        source.complete("b");
        harness.drain();
        assertEquals(ChunkState.GPU_MEMORY, b.getState());
        assertEquals(ChunkState.DOWNLOADING, a.getState());
        assertEquals(List.of("a", "b", "a"), source.downloads);
    }

    @Test
    void testLessUrgentRequestWaits() {
        setUp(1 << 20, 1);
        source.autoComplete = false;
        var a = source.chunk("a");
        var b = source.chunk("b");
        harness.desire(a, VISIBLE, 1);
        harness.desire(b, PREFETCH, 100);
        harness.recompute();

        assertEquals(ChunkState.DOWNLOADING, a.getState());
        assertEquals(ChunkState.QUEUED, b.getState());
        assertTrue(source.canceled.isEmpty());
        assertEquals(1, harness.queueManager.getNumQueued());
    }

    @Test
    void testGpuPromotionEvictsLessUrgentGpuChunk() {
        harness = new ChunkTestHarness(
        ChunkTestHarness.configuration(1 << 20, 4).toBuilder()
                        .withGpuMemory(CapacitySpecification.ofBytes(250))
                        .build());
        frontendSource = harness.addSource("test");
        source = harness.backendSource(frontendSource);
        var a = source.chunk("a");
        var b = source.chunk("b");
        var c = source.chunk("c");
        harness.desire(a, VISIBLE, 3);
        harness.desire(b, VISIBLE, 2);
        harness.desire(c, VISIBLE, 1);
        harness.recompute();

        assertEquals(ChunkState.GPU_MEMORY, a.getState());
        assertEquals(ChunkState.GPU_MEMORY, b.getState());
        assertEquals(ChunkState.SYSTEM_MEMORY_WORKER, c.getState());

        harness.desire(c, VISIBLE, 10);
        harness.recompute();

        assertEquals(ChunkState.GPU_MEMORY, a.getState());
        assertEquals(ChunkState.SYSTEM_MEMORY, b.getState());
        assertEquals(ChunkState.GPU_MEMORY, c.getState());
        var frontendB = frontendSource.chunk("b");
        assertEquals(ChunkState.SYSTEM_MEMORY, frontendB.getState());
        assertEquals(1, frontendB.frees);
        assertEquals(200, harness.queueManager.getGpuMemoryCapacity().getCurrentSize());
    }

    @Test
    void testLoweringTheLimitReschedules() {
        setUp(1 << 20, 4);
        var r = source.chunk("r");
        harness.desire(r, VISIBLE, 1);
        harness.recompute();
        harness.forgetAll();
        harness.recompute();
        assertEquals(ChunkPriorityTier.RECENT, r.getPriorityTier());
        assertSame(r, source.getChunk("r"));

        harness.frontendQueueManager.getSystemMemorySizeLimit().setValue(50);
        harness.drain();

        assertNull(source.getChunk("r"));
        assertEquals(0, harness.queueManager.getSystemMemoryCapacity().getCurrentSize());
        assertEquals(0, frontendSource.getChunkCount());
    }

    @Test
    void testInvalidateRefetches() {
        setUp(1 << 20, 4);
        var a = source.chunk("a");
        harness.desire(a, VISIBLE, 1);
        harness.recompute();
        var before = frontendSource.chunk("a");

        frontendSource.invalidateCache();
        harness.drain();

        assertEquals(List.of("a", "a"), source.downloads);
        assertEquals(ChunkState.GPU_MEMORY, a.getState());
        assertNotSame(before, frontendSource.chunk("a"));
        assertEquals(1, before.frees);
        assertEquals(100, harness.queueManager.getSystemMemoryCapacity().getCurrentSize());
    }

    @Test
    void testStatistics() throws Exception {
        setUp(1 << 20, 4);
        harness.desire(source.chunk("a"), VISIBLE, 1);
        harness.desire(source.chunk("b"), PREFETCH, 1);
        harness.recompute();

        var future = harness.frontendQueueManager.getStatistics();
        harness.drain();
        assertTrue(future.isDone());
        var statistics = future.get().get(frontendSource);
        assertNotNull(statistics);
        assertEquals(1, statistics.getChunkCount(ChunkState.GPU_MEMORY, VISIBLE));
        assertEquals(1, statistics.getChunkCount(ChunkState.GPU_MEMORY, PREFETCH));
        assertEquals(200, statistics.getTotalSystemMemoryBytes());
        assertEquals(2, statistics.getDownloadCount());
        assertEquals(0, statistics.getFailureCount());
    }

    @Test
    void testDisposingTheManagersReleasesEverything() {
        setUp(1 << 20, 4);
        harness.desire(source.chunk("a"), VISIBLE, 1);
        harness.recompute();
        var sourceId = frontendSource.getRpcId();

        frontendSource.release();
        harness.frontendChunkManager.release();
        harness.drain();

        assertTrue(source.isDisposed());
        assertFalse(harness.backend.has(sourceId));
        assertTrue(harness.queueManager.getSources().isEmpty());
        assertEquals(0, harness.queueManager.getSystemMemoryCapacity().getCurrentSize());
        assertEquals(0, harness.queueManager.getGpuMemoryCapacity().getCurrentSize());
        assertFalse(harness.queueManager.isDisposed());

        harness.frontendQueueManager.release();
        harness.drain();
        assertTrue(harness.queueManager.isDisposed());
        assertEquals(0, harness.frontend.getObjectCount());
        assertEquals(0, harness.backend.getObjectCount());
    }
}
