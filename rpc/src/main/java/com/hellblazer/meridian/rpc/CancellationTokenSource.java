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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A cancellation token that is canceled by calling {@link #cancel()}. Handlers run on the canceling thread, in
 * registration order, exactly once.
 *
 * @author hal.hildebrand
 */
public class CancellationTokenSource implements CancellationToken {
    private static final Logger log = LoggerFactory.getLogger(CancellationTokenSource.class);

    private final Set<Runnable> handlers = new LinkedHashSet<>();
    private boolean             canceled;

    public void cancel() {
        ArrayList<Runnable> toRun;
        synchronized (this) {
            if (canceled) {
                return;
            }
            canceled = true;
            toRun = new ArrayList<>(handlers);
            handlers.clear();
        }
        for (var handler : toRun) {
            try {
                handler.run();
            } catch (RuntimeException e) {
                log.warn("Cancellation handler failed", e);
            }
        }
    }

    @Override
    public synchronized boolean isCanceled() {
        return canceled;
    }

    @Override
    public Registration add(Runnable handler) {
        synchronized (this) {
            if (!canceled) {
                // Wrapped so that registering the same runnable twice yields two registrations
                Runnable entry = handler::run;
                handlers.add(entry);
                return () -> {
                    synchronized (CancellationTokenSource.this) {
                        handlers.remove(entry);
                    }
                };
            }
        }
        handler.run();
        return Registration.NONE;
    }

    @Override
    public String toString() {
        return String.format("CancellationTokenSource[canceled=%s]", isCanceled());
    }
}
