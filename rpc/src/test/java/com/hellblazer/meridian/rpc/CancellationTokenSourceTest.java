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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

public class CancellationTokenSourceTest {

    @Test
    void testHandlersRunOnceInOrder() {
        var source = new CancellationTokenSource();
        List<String> calls = new ArrayList<>();
        source.add(() -> calls.add("first"));
        source.add(() -> calls.add("second"));
        source.cancel();
        source.cancel();
        assertEquals(List.of("first", "second"), calls);
        assertTrue(source.isCanceled());
        assertThrows(CancellationException.class, source::throwIfCanceled);
    }

    @Test
    void testClosedRegistrationNotRun() {
        var source = new CancellationTokenSource();
        List<String> calls = new ArrayList<>();
        var registration = source.add(() -> calls.add("removed"));
        registration.close();
        source.cancel();
        assertTrue(calls.isEmpty());
    }

    @Test
    void testAddAfterCancelRunsImmediately() {
        var source = new CancellationTokenSource();
        source.cancel();
        List<String> calls = new ArrayList<>();
        source.add(() -> calls.add("late"));
        assertEquals(List.of("late"), calls);
        assertFalse(CancellationToken.UNCANCELABLE.isCanceled());
    }
}
