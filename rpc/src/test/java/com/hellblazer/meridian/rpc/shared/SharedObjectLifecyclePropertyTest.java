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
import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives owners and counterparts through random interleavings of the two message directions and checks that every
 * object is torn down on both sides once all holders let go.
 */
public class SharedObjectLifecyclePropertyTest {

    /**
     * Step codes: 0 runs a frontend task, 1 runs a worker task, 2 sends a new reference, 3 releases an owner, 4
     * releases a held counterpart reference.
     */
    @Property(tries = 300)
    @Label("Every created object is disposed once all references are released")
    void noLeaksUnderRandomInterleaving(@ForAll @IntRange(min = 1, max = 5) int objectCount,
                                        @ForAll @Size(max = 60) List<@IntRange(min = 0, max = 4) Integer> steps,
                                        @ForAll @Size(max = 60) List<@IntRange(min = 0, max = 99) Integer> targets) {
        var harness = new RpcTestHarness();
        TestSharedObject.HELD.clear();
        var owners = new ArrayList<TestSharedObject>();
        for (int i = 0; i < objectCount; i++) {
            owners.add(TestSharedObject.makeOwner(harness.frontend));
        }
        var released = new boolean[objectCount];

        for (int i = 0; i < steps.size(); i++) {
            var target = targets.isEmpty() ? 0 : targets.get(i % targets.size());
            var owner = owners.get(target % objectCount);
            switch (steps.get(i)) {
                case 0 -> harness.frontendLoop.runOne();
                case 1 -> harness.backendLoop.runOne();
                case 2 -> {
                    if (!owner.isDisposed()) {
                        owner.sendRef();
                    }
                }
                case 3 -> {
                    if (!released[target % objectCount]) {
                        released[target % objectCount] = true;
                        owner.release();
                    }
                }
                default -> {
                    if (!TestSharedObject.HELD.isEmpty()) {
                        TestSharedObject.HELD.remove(target % TestSharedObject.HELD.size()).release();
                    }
                }
            }
        }

        for (int i = 0; i < objectCount; i++) {
            if (!released[i]) {
                owners.get(i).release();
            }
        }
        do {
            harness.drain();
            while (!TestSharedObject.HELD.isEmpty()) {
                TestSharedObject.HELD.remove(0).release();
            }
        } while (harness.drain() > 0);

        var frontendStats = harness.frontend.getStatistics();
        assertEquals(objectCount, frontendStats.getSent(SharedObjectProtocol.NEW_ID));
        assertEquals(objectCount, frontendStats.getSent(SharedObjectProtocol.DISPOSE_ID));
        assertEquals(0, harness.frontend.getObjectCount());
        assertEquals(0, harness.backend.getObjectCount());
        owners.forEach(owner -> assertTrue(owner.isDisposed()));
    }
}
