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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Event loop backed by a dedicated daemon thread. This is how a worker side runs.
 * <p>
 * A task that throws is logged and its failure recorded. A {@link ProtocolViolationException} additionally aborts the
 * loop: no further tasks run, since the object tables of both sides can no longer be trusted.
 *
 * @author hal.hildebrand
 */
public class SingleThreadEventLoop implements EventLoop, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final String                     name;
    private final ExecutorService            executor;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private volatile Thread                  thread;

    public SingleThreadEventLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(() -> runTask(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop {} is shut down, dropping task", name);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    /**
     * @return the first failure raised by a task, or null
     */
    public Throwable getFailure() {
        return failure.get();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runTask(Runnable task) {
        try {
            task.run();
        } catch (ProtocolViolationException e) {
            log.error("Protocol violation on {}, aborting event loop", name, e);
            failure.compareAndSet(null, e);
            executor.shutdownNow();
        } catch (RuntimeException e) {
            log.error("Task failed on {}", name, e);
            failure.compareAndSet(null, e);
        }
    }

    @Override
    public String toString() {
        return String.format("SingleThreadEventLoop[%s]", name);
    }
}
