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

import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;

/**
 * Message handlers of the shared object lifecycle and of the built-in shared object types.
 *
 * @author hal.hildebrand
 */
public final class SharedObjectProtocol {
    public static final String NEW_ID                    = "SharedObject.new";
    public static final String DISPOSE_ID                = "SharedObject.dispose";
    public static final String REF_COUNT_REACHED_ZERO_ID = "SharedObject.refCountReachedZero";

    private static boolean registered;

    private SharedObjectProtocol() {
    }

    /**
     * Install the handlers and types. Safe to call more than once.
     */
    public static synchronized void register() {
        if (registered) {
            return;
        }
        RpcEndpoint.registerHandler(NEW_ID, SharedObjectProtocol::handleNew);
        RpcEndpoint.registerHandler(DISPOSE_ID, SharedObjectProtocol::handleDispose);
        RpcEndpoint.registerHandler(REF_COUNT_REACHED_ZERO_ID, SharedObjectProtocol::handleRefCountReachedZero);
        RpcEndpoint.registerHandler(SharedWatchableValue.CHANGED_ID, SharedWatchableValue::handleChanged);
        RpcEndpoint.registerHandler(SharedIdSet.UPDATE_ID, SharedIdSet::handleUpdate);
        SharedObjectRegistry.register(SharedWatchableValue.TYPE_ID, SharedWatchableValue::new);
        SharedObjectRegistry.register(SharedIdSet.TYPE_ID, SharedIdSet::new);
        registered = true;
    }

    private static void handleNew(RpcEndpoint rpc, Message message) {
        var options = message.payload();
        SharedObjectRegistry.create(Payloads.requireText(options, "type"), rpc, options);
    }

    private static void handleDispose(RpcEndpoint rpc, Message message) {
        var id = Payloads.requireLong(message.payload(), "id");
        rpc.get(id, SharedObject.class).counterpartDisposed();
    }

    private static void handleRefCountReachedZero(RpcEndpoint rpc, Message message) {
        var payload = message.payload();
        var id = Payloads.requireLong(payload, "id");
        var generation = Payloads.requireLong(payload, "gen");
        rpc.get(id, SharedObject.class).counterpartRefCountReachedZero(generation);
    }
}
