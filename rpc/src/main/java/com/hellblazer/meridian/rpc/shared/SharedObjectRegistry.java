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

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.ProtocolViolationException;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide table from shared object type id to counterpart factory.
 *
 * @author hal.hildebrand
 */
public final class SharedObjectRegistry {

    private static final Map<String, SharedObjectFactory> FACTORIES = new ConcurrentHashMap<>();

    private SharedObjectRegistry() {
    }

    /**
     * @throws IllegalStateException if a different factory is already registered for the type
     */
    public static void register(String typeId, SharedObjectFactory factory) {
        var existing = FACTORIES.putIfAbsent(typeId, factory);
        if (existing != null && existing != factory) {
            throw new IllegalStateException("A different factory is already registered for " + typeId);
        }
    }

    public static boolean isRegistered(String typeId) {
        return FACTORIES.containsKey(typeId);
    }

    public static Set<String> registeredTypes() {
        return Set.copyOf(FACTORIES.keySet());
    }

    static SharedObject create(String typeId, RpcEndpoint rpc, ObjectNode options) {
        var factory = FACTORIES.get(typeId);
        if (factory == null) {
            throw new ProtocolViolationException("Unknown shared object type: " + typeId);
        }
        return factory.create(rpc, options);
    }
}
