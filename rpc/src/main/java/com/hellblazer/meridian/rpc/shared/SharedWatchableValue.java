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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.Message;
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A JSON value mirrored on both sides of a channel. Either side may set it; the change is applied locally, signalled,
 * and forwarded to the other side, which applies it without echoing. Concurrent sets on the two sides race and the
 * last one delivered on each side wins there.
 *
 * @author hal.hildebrand
 */
public class SharedWatchableValue extends SharedObject {
    public static final String TYPE_ID    = "SharedWatchableValue";
    public static final String CHANGED_ID = "SharedWatchableValue.changed";

    private static final Logger log = LoggerFactory.getLogger(SharedWatchableValue.class);

    private final Signal changed = new Signal();
    private JsonNode     value;

    public SharedWatchableValue(JsonNode initialValue) {
        this.value = initialValue;
    }

    SharedWatchableValue(RpcEndpoint rpc, ObjectNode options) {
        super(rpc, options);
        this.value = Payloads.require(options, "value");
    }

    public static SharedWatchableValue makeOwner(RpcEndpoint rpc, JsonNode initialValue) {
        var owner = new SharedWatchableValue(initialValue);
        var options = Payloads.object();
        options.set("value", initialValue);
        owner.initializeCounterpart(rpc, options);
        return owner;
    }

    public static SharedWatchableValue makeOwner(RpcEndpoint rpc, long initialValue) {
        return makeOwner(rpc, LongNode.valueOf(initialValue));
    }

    static void handleChanged(RpcEndpoint rpc, Message message) {
        var payload = message.payload();
        var id = Payloads.requireLong(payload, "id");
        if (!rpc.has(id)) {
            // The other side was disposed while the change was in flight
            log.debug("Dropping change for disposed value {}", id);
            return;
        }
        rpc.get(id, SharedWatchableValue.class).apply(Payloads.require(payload, "value"));
    }

    @Override
    public String getRpcTypeId() {
        return TYPE_ID;
    }

    public Signal changed() {
        return changed;
    }

    public JsonNode getValue() {
        return value;
    }

    public long longValue() {
        return value.asLong();
    }

    public void setValue(JsonNode newValue) {
        if (value.equals(newValue)) {
            return;
        }
        apply(newValue);
        if (isShared() && !isDisposed()) {
            var payload = Payloads.object();
            payload.put("id", getRpcId());
            payload.set("value", newValue);
            getRpc().invoke(CHANGED_ID, payload);
        }
    }

    public void setValue(long newValue) {
        setValue(LongNode.valueOf(newValue));
    }

    private void apply(JsonNode newValue) {
        if (value.equals(newValue)) {
            return;
        }
        value = newValue;
        changed.dispatch();
    }
}
