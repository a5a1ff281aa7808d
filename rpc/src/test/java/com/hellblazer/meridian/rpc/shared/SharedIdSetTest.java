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

import com.hellblazer.meridian.rpc.RpcTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SharedIdSetTest {

    private RpcTestHarness harness;
    private SharedIdSet    owner;
    private SharedIdSet    mirror;

    @BeforeEach
    void setUp() {
        harness = new RpcTestHarness();
        owner = SharedIdSet.makeOwner(harness.frontend, List.of(1L, 2L));
        harness.drain();
        mirror = harness.backend.get(owner.getRpcId(), SharedIdSet.class);
    }

    @Test
    void testInitialContents() {
        assertEquals(List.of(1L, 2L), mirror.values());
    }

    @Test
    void testUpdatesMirrored() {
        var changes = new AtomicInteger();
        mirror.changed().add(changes::incrementAndGet);

        owner.add(-5L);
        owner.remove(1L);
        harness.drain();
        assertTrue(mirror.contains(-5L));
        assertFalse(mirror.contains(1L));
        assertEquals(2, mirror.size());
        assertEquals(2, changes.get());

        owner.clear();
        harness.drain();
        assertTrue(mirror.isEmpty());
        assertEquals(3, changes.get());
    }

    @Test
    void testRedundantMutationsNotSent() {
        owner.add(1L);
        owner.remove(42L);
        harness.drain();
        assertEquals(0, harness.frontend.getStatistics().getSent(SharedIdSet.UPDATE_ID));
    }

    @Test
    void testMirrorIsReadOnly() {
        assertThrows(IllegalStateException.class, () -> mirror.add(3L));
        assertThrows(IllegalStateException.class, mirror::clear);
    }
}
