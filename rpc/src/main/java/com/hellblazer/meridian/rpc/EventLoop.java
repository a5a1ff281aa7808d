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

import java.util.concurrent.Executor;

/**
 * One side of a message channel: a single-threaded, FIFO task executor.
 * <p>
 * Every task submitted through {@link #execute(Runnable)} runs to completion before the next one starts, so state
 * confined to a side (its object table, its chunk maps) is never mutated concurrently. Tasks may be submitted from
 * any thread.
 *
 * @author hal.hildebrand
 */
public interface EventLoop extends Executor {

    /**
     * @return the name of this loop, used for thread names and diagnostics
     */
    String getName();

    /**
     * @return true if the calling thread is currently running a task of this loop
     */
    boolean inEventLoop();
}
