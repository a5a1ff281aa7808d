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
import com.hellblazer.meridian.rpc.Payloads;
import com.hellblazer.meridian.rpc.ProtocolViolationException;
import com.hellblazer.meridian.rpc.RpcEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A reference-counted object that exists as an owner on one side of a channel and as a counterpart on the other.
 * <p>
 * The owner is created locally with one reference and, once {@link #initializeCounterpart} is called, has a
 * counterpart constructed on the peer. The counterpart starts with no local references; holders on its side obtain
 * it through {@link RpcEndpoint#getRef}, which carries the generation the owner issued with
 * {@link #addCounterpartRef()}.
 * <p>
 * When the counterpart's count reaches zero it reports the generation of the last reference it received. The owner
 * tears both instances down only once its own count is zero and the last reported generation equals the last one it
 * issued, so a reference that is still in flight keeps the pair alive.
 *
 * @author hal.hildebrand
 */
public abstract class SharedObject extends RefCounted {
    private static final Logger log = LoggerFactory.getLogger(SharedObject.class);

    public enum Role {
        OWNER, COUNTERPART
    }

    private final Role    role;
    private RpcEndpoint   rpc;
    private long          rpcId;
    private boolean       shared;
    private long          referencedGeneration;
    private long          unreferencedGeneration;

    /**
     * Create an owner with one local reference.
     */
    protected SharedObject() {
        super(1);
        this.role = Role.OWNER;
    }

    /**
     * Create a counterpart from the options its owner sent, registering it under the owner's id.
     */
    protected SharedObject(RpcEndpoint rpc, ObjectNode options) {
        super(0);
        this.role = Role.COUNTERPART;
        this.rpc = rpc;
        this.rpcId = Payloads.requireLong(options, "id");
        if (rpc.has(rpcId)) {
            throw new ProtocolViolationException("Object id " + rpcId + " is already in use");
        }
        this.shared = true;
        rpc.set(rpcId, this);
    }

    /**
     * @return the registry key under which the counterpart of this object is constructed
     */
    public abstract String getRpcTypeId();

    /**
     * Allocate an id for this owner and have the peer construct its counterpart.
     *
     * @param options type-specific fields passed to the counterpart's constructor
     */
    public void initializeCounterpart(RpcEndpoint rpc, ObjectNode options) {
        if (role != Role.OWNER) {
            throw new IllegalStateException("Only an owner can initialize a counterpart");
        }
        if (shared) {
            throw new IllegalStateException(this + " already has a counterpart");
        }
        this.rpc = rpc;
        this.rpcId = rpc.newId();
        this.shared = true;
        rpc.set(rpcId, this);
        options.put("id", rpcId);
        options.put("type", getRpcTypeId());
        rpc.invoke(SharedObjectProtocol.NEW_ID, options);
    }

    /**
     * Issue a reference to the counterpart for transmission to the peer.
     */
    public SharedObjectRef addCounterpartRef() {
        if (role != Role.OWNER || !shared) {
            throw new IllegalStateException(this + " is not an owner with a counterpart");
        }
        if (isDisposed()) {
            throw new IllegalStateException("Cannot reference disposed " + this);
        }
        return new SharedObjectRef(rpcId, ++referencedGeneration);
    }

    /**
     * Record the generation of a reference received from the owner.
     */
    public void referencedAt(long generation) {
        if (role != Role.COUNTERPART) {
            throw new IllegalStateException("Only a counterpart receives references");
        }
        referencedGeneration = generation;
    }

    public Role getRole() {
        return role;
    }

    public boolean isOwner() {
        return role == Role.OWNER;
    }

    public RpcEndpoint getRpc() {
        return rpc;
    }

    public long getRpcId() {
        if (!shared) {
            throw new IllegalStateException(this + " has no id");
        }
        return rpcId;
    }

    public boolean isShared() {
        return shared;
    }

    public long getReferencedGeneration() {
        return referencedGeneration;
    }

    public long getUnreferencedGeneration() {
        return unreferencedGeneration;
    }

    @Override
    protected void refCountReachedZero() {
        if (role == Role.COUNTERPART) {
            var payload = Payloads.object();
            payload.put("id", rpcId);
            payload.put("gen", referencedGeneration);
            rpc.invoke(SharedObjectProtocol.REF_COUNT_REACHED_ZERO_ID, payload);
            return;
        }
        if (!shared) {
            dispose();
        } else if (referencedGeneration == unreferencedGeneration) {
            ownerDispose();
        }
    }

    /**
     * The counterpart reported that it had no references as of the given generation.
     */
    void counterpartRefCountReachedZero(long generation) {
        unreferencedGeneration = generation;
        if (getRefCount() == 0 && generation == referencedGeneration) {
            ownerDispose();
        } else {
            log.trace("{} still referenced: issued {}, released {}", this, referencedGeneration, generation);
        }
    }

    /**
     * The owner has been disposed.
     */
    void counterpartDisposed() {
        if (getRefCount() != 0) {
            throw new ProtocolViolationException(
            String.format("%s disposed by its owner with %d local references", this, getRefCount()));
        }
        dispose();
        rpc.delete(rpcId);
    }

    private void ownerDispose() {
        dispose();
        rpc.delete(rpcId);
        var payload = Payloads.object();
        payload.put("id", rpcId);
        rpc.invoke(SharedObjectProtocol.DISPOSE_ID, payload);
    }

    @Override
    public String toString() {
        return String.format("%s[%s %s]", getClass().getSimpleName(), role, shared ? String.valueOf(rpcId) : "-");
    }
}
