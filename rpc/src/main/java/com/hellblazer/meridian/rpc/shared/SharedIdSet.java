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
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.ProtocolViolationException;
import com.hellblazer.meridian.rpc.RpcEndpoint;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A set of 64-bit ids owned on one side and mirrored read-only on the other.
 *
 * @author hal.hildebrand
 */
public class SharedIdSet extends SharedObject {
    public static final String TYPE_ID   = "SharedIdSet";
    public static final String UPDATE_ID = "SharedIdSet.update";

    private final Set<Long> ids     = new LinkedHashSet<>();
    private final Signal    changed = new Signal();

    public SharedIdSet() {
    }

    SharedIdSet(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        if (Payloads.has(options, "values")) {
            Payloads.requireArray(options, "values").forEach(v -> ids.add(v.asLong()));
        }
    }

    public static SharedIdSet makeOwner(RpcEndpoint rpc, Collection<Long> initial) {
        var owner = new SharedIdSet();
        owner.ids.addAll(initial);
        var options = Payloads.object();
        var values = options.putArray("values");
        initial.forEach(values::add);
        owner.initializeCounterpart(rpc, options);
        return owner;
    }

    static void handleUpdate(RpcEndpoint rpc, Message message) {
        var payload = message.payload();
        var set = rpc.get(Payloads.requireLong(payload, "id"), SharedIdSet.class);
        var op = Payloads.requireText(payload, "op");
        switch (op) {
            case "add":
                Payloads.requireArray(payload, "values").forEach(v -> set.ids.add(v.asLong()));
                break;
            case "remove":
                Payloads.requireArray(payload, "values").forEach(v -> set.ids.remove(v.asLong()));
                break;
            case "clear":
                set.ids.clear();
                break;
            default:
                throw new ProtocolViolationException("Unknown id set operation: " + op);
        }
        set.changed.dispatch();
    }

    @Override
    public String getRpcTypeId() {
        return TYPE_ID;
    }

    public Signal changed() {
        return changed;
    }

    public boolean contains(long id) {
        return ids.contains(id);
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public List<Long> values() {
        return List.copyOf(ids);
    }

    public void add(long id) {
        addAll(List.of(id));
    }

    public void addAll(Collection<Long> values) {
        checkOwner();
        var added = values.stream().filter(ids::add).toList();
        if (!added.isEmpty()) {
            update("add", added);
        }
    }

    public void remove(long id) {
        checkOwner();
        if (ids.remove(id)) {
            update("remove", List.of(id));
        }
    }

    public void clear() {
        checkOwner();
        if (!ids.isEmpty()) {
            ids.clear();
            update("clear", List.of());
        }
    }

    private void checkOwner() {
        if (!isOwner()) {
            throw new IllegalStateException("The mirror of an id set is read only");
        }
    }

    private void update(String op, List<Long> values) {
        changed.dispatch();
        if (!isShared() || isDisposed()) {
            return;
        }
        var payload = Payloads.object();
        payload.put("id", getRpcId());
        payload.put("op", op);
        var array = payload.putArray("values");
        values.forEach(array::add);
        getRpc().invoke(UPDATE_ID, payload);
    }
}
