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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class SingleThreadEventLoopTest {

    private SingleThreadEventLoop loop;

    @BeforeEach
    void setUp() {
        loop = new SingleThreadEventLoop("worker-test");
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void testTasksRunOnLoopThread() throws InterruptedException {
        var inLoop = new AtomicBoolean();
        var done = new CountDownLatch(1);
        loop.execute(() -> {
            inLoop.set(loop.inEventLoop());
            done.countDown();
        });
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertTrue(inLoop.get());
        assertFalse(loop.inEventLoop());
    }

    @Test
    void testFailingTaskRecordedAndLoopContinues() throws InterruptedException {
        var done = new CountDownLatch(1);
        loop.execute(() -> {
            throw new IllegalStateException("task failure");
        });
        loop.execute(done::countDown);
        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, loop.getFailure());
        assertFalse(loop.isShutdown());
    }

    @Test
    void testProtocolViolationAbortsLoop() throws InterruptedException {
        var ran = new AtomicBoolean();
        loop.execute(() -> {
            throw new ProtocolViolationException("broken peer");
        });
        for (int i = 0; i < 50 && !loop.isShutdown(); i++) {
            Thread.sleep(20);
        }
        assertTrue(loop.isShutdown());
        assertInstanceOf(ProtocolViolationException.class, loop.getFailure());
        loop.execute(() -> ran.set(true));
        Thread.sleep(50);
        assertFalse(ran.get());
    }
}
