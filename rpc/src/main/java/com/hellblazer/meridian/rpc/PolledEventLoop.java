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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Event loop drained explicitly by its owner, typically the render thread once per frame.
 * <p>
 * Tasks may be posted from any thread; they only run inside {@link #runOne()} or {@link #runPending()}. Exceptions
 * thrown by a task propagate to the caller of those methods. Since nothing runs unless asked to, two polled loops
 * joined by a channel also make a deterministic harness in which the interleaving of the two directions is chosen
 * by the caller.
 *
 * @author hal.hildebrand
 */
public class PolledEventLoop implements EventLoop {

    private final String         name;
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private volatile Thread      drainingThread;

    public PolledEventLoop(String name) {
        this.name = name;
    }

    /**
     * Drain the given loops round-robin until all of them are empty.
     *
     * @return the total number of tasks run
     */
    public static int drainAll(PolledEventLoop... loops) {
        var total = 0;
        var ran = true;
        while (ran) {
            ran = false;
            for (var loop : loops) {
                if (loop.runOne()) {
                    total++;
                    ran = true;
                }
            }
        }
        return total;
    }

    @Override
    public void execute(Runnable task) {
        synchronized (tasks) {
            tasks.addLast(task);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == drainingThread;
    }

    /**
     * @return the number of tasks waiting to run
     */
    public int pendingCount() {
        synchronized (tasks) {
            return tasks.size();
        }
    }

    /**
     * Run the oldest pending task, if any.
     *
     * @return true if a task ran
     */
    public boolean runOne() {
        Runnable task;
        synchronized (tasks) {
            task = tasks.pollFirst();
        }
        if (task == null) {
            return false;
        }
        var previous = drainingThread;
        drainingThread = Thread.currentThread();
        try {
            task.run();
        } finally {
            drainingThread = previous;
        }
        return true;
    }

    /**
     * Run tasks until the queue is empty, including tasks posted by the tasks being run.
     *
     * @return the number of tasks run
     */
    public int runPending() {
        var count = 0;
        while (runOne()) {
            count++;
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("PolledEventLoop[%s, pending=%d]", name, pendingCount());
    }
}
