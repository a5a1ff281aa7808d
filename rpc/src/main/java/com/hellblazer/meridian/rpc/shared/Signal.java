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

import com.hellblazer.meridian.rpc.ProtocolViolationException;
import com.hellblazer.meridian.rpc.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A list of callbacks fired together. Failing callbacks are logged and do not stop the others, except for protocol
 * violations, which propagate.
 *
 * @author hal.hildebrand
 */
public class Signal {
    private static final Logger log = LoggerFactory.getLogger(Signal.class);

    private final List<Runnable> handlers = new CopyOnWriteArrayList<>();
    private long                 dispatchCount;

    public Registration add(Runnable handler) {
        Runnable entry = handler::run;
        handlers.add(entry);
        return () -> handlers.remove(entry);
    }

    public void dispatch() {
        dispatchCount++;
        for (var handler : handlers) {
            try {
                handler.run();
            } catch (ProtocolViolationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Signal handler failed", e);
            }
        }
    }

    public long getDispatchCount() {
        return dispatchCount;
    }

    public int size() {
        return handlers.size();
    }
}
