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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Local reference counting with disposers that run when the object is torn down.
 * <p>
 * Not thread safe: an instance belongs to one event loop.
 *
 * @author hal.hildebrand
 */
public abstract class RefCounted {
    private static final Logger log = LoggerFactory.getLogger(RefCounted.class);

    private final List<AutoCloseable> disposers = new ArrayList<>();
    private int                       refCount;
    private boolean                   disposed;

    protected RefCounted(int initialRefCount) {
        if (initialRefCount < 0) {
            throw new IllegalArgumentException("Initial reference count cannot be negative");
        }
        this.refCount = initialRefCount;
    }

    protected RefCounted() {
        this(1);
    }

    public final int getRefCount() {
        return refCount;
    }

    public final boolean isDisposed() {
        return disposed;
    }

    public void addRef() {
        if (disposed) {
            throw new IllegalStateException("Cannot add a reference to disposed " + this);
        }
        refCount++;
    }

    /**
     * @throws IllegalStateException if there is no reference to release
     */
    public void release() {
        if (refCount <= 0) {
            throw new IllegalStateException("Reference count of " + this + " would drop below zero");
        }
        if (--refCount == 0) {
            refCountReachedZero();
        }
    }

    /**
     * Tie a resource to this object's lifetime. Disposers run in reverse registration order.
     */
    public void registerDisposer(AutoCloseable disposer) {
        if (disposed) {
            throw new IllegalStateException("Cannot register a disposer on disposed " + this);
        }
        disposers.add(disposer);
    }

    protected void refCountReachedZero() {
        dispose();
    }

    /**
     * Run the disposers, then {@link #disposed()}. Only the first call has an effect.
     */
    protected final void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        for (int i = disposers.size() - 1; i >= 0; i--) {
            try {
                disposers.get(i).close();
            } catch (Exception e) {
                log.warn("Disposer of {} failed", this, e);
            }
        }
        disposers.clear();
        disposed();
    }

    /**
     * Hook run once after the disposers.
     */
    protected void disposed() {
    }
}
