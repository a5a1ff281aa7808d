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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import com.hellblazer.meridian.rpc.shared.SharedObjectProtocol;
import com.hellblazer.meridian.rpc.shared.SharedObjectRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One side of a message channel: dispatches incoming messages to the process-wide handler table, allocates ids,
 * holds the local object table and tracks promise calls in both directions.
 * <p>
 * Handlers are registered once per process with {@link #registerHandler} or {@link #registerPromiseHandler} and are
 * shared by every endpoint. All handler invocations happen on the endpoint's event loop.
 *
 * @author hal.hildebrand
 */
public class RpcEndpoint {
    public static final String READY_ID            = "rpc.ready";
    public static final String PROMISE_RESPONSE_ID = "rpc.promise.response";
    public static final String PROMISE_CANCEL_ID   = "rpc.promise.cancel";
    public static final String CANCELED            = "CANCELED";

    private static final Logger              log      = LoggerFactory.getLogger(RpcEndpoint.class);
    private static final Map<String, Object> HANDLERS = new ConcurrentHashMap<>();

    static {
        registerHandler(READY_ID, (rpc, message) -> {
        });
        registerHandler(PROMISE_RESPONSE_ID, RpcEndpoint::handlePromiseResponse);
        registerHandler(PROMISE_CANCEL_ID, RpcEndpoint::handlePromiseCancel);
    }

    private final MessagePort                                       port;
    private final EventLoop                                         eventLoop;
    private final Side                                              side;
    private final AtomicLong                                        nextId;
    private final Map<Long, Object>                                 objects        = new ConcurrentHashMap<>();
    private final Map<Long, CompletableFuture<RpcValue>>            pendingCalls   = new ConcurrentHashMap<>();
    private final Map<Long, CancellationTokenSource>                activeRequests = new ConcurrentHashMap<>();
    private final RpcStatistics                                     statistics     = new RpcStatistics();
    private final Object                                            sendLock       = new Object();
    private final List<Message>                                     outbox         = new ArrayList<>();
    private boolean                                                 peerReady;

    /**
     * @param waitForPeer if true, outgoing messages are held until the peer first makes contact
     */
    public RpcEndpoint(MessagePort port, Side side, boolean waitForPeer) {
        SharedObjectProtocol.register();
        this.port = port;
        this.eventLoop = port.getEventLoop();
        this.side = side;
        this.nextId = new AtomicLong(side.firstId());
        this.peerReady = !waitForPeer;
        port.setMessageHandler(this::receive);
    }

    /**
     * Register a fire-and-forget handler. Registering the same handler again is a no-op.
     *
     * @throws IllegalStateException if a different handler is already registered under this name
     */
    public static void registerHandler(String name, RpcHandler handler) {
        register(name, handler);
    }

    /**
     * Register the callee side of a promise RPC.
     *
     * @throws IllegalStateException if a different handler is already registered under this name
     */
    public static void registerPromiseHandler(String name, PromiseRpcHandler handler) {
        register(name, handler);
    }

    public static boolean isRegistered(String name) {
        return HANDLERS.containsKey(name);
    }

    private static void register(String name, Object handler) {
        if (name == null || handler == null) {
            throw new IllegalArgumentException("Handler name and handler cannot be null");
        }
        var existing = HANDLERS.putIfAbsent(name, handler);
        if (existing != null && existing != handler) {
            throw new IllegalStateException("A different handler is already registered for " + name);
        }
    }

    private static void handlePromiseResponse(RpcEndpoint rpc, Message message) {
        var payload = message.payload();
        var id = Payloads.requireLong(payload, "id");
        var future = rpc.pendingCalls.remove(id);
        if (future == null) {
            throw new ProtocolViolationException("Promise response for unknown call id " + id);
        }
        if (Payloads.has(payload, "errorName")) {
            var errorName = Payloads.requireText(payload, "errorName");
            if (CANCELED.equals(errorName)) {
                future.completeExceptionally(new CancellationException("Canceled by remote side"));
            } else {
                future.completeExceptionally(new RpcException(errorName, payload.path("error").asText()));
            }
            return;
        }
        future.complete(new RpcValue(payload.get("value"), message.transfers()));
    }

    private static void handlePromiseCancel(RpcEndpoint rpc, Message message) {
        var id = Payloads.requireLong(message.payload(), "id");
        var token = rpc.activeRequests.get(id);
        if (token == null) {
            log.trace("Ignoring cancel of completed request {}", id);
            return;
        }
        token.cancel();
    }

    private static Throwable unwrap(Throwable error) {
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    private static String errorName(Throwable error) {
        if (error instanceof CancellationException) {
            return CANCELED;
        }
        if (error instanceof RpcException) {
            return ((RpcException) error).getErrorName();
        }
        return error.getClass().getSimpleName();
    }

    /**
     * Announce readiness to the peer. Never held back by the outbox.
     */
    public void signalReady() {
        synchronized (sendLock) {
            send(new Message(READY_ID, Payloads.object()));
        }
    }

    /**
     * Send a fire-and-forget message.
     */
    public void invoke(String name, ObjectNode payload) {
        invoke(name, payload, Map.of());
    }

    public void invoke(String name, ObjectNode payload, Map<String, TransferableBuffer> transfers) {
        var message = new Message(name, payload, transfers);
        synchronized (sendLock) {
            if (!peerReady) {
                outbox.add(message.transfer());
                return;
            }
            send(message);
        }
    }

    public CompletableFuture<RpcValue> promiseInvoke(String name, ObjectNode payload) {
        return promiseInvoke(name, payload, CancellationToken.UNCANCELABLE, Map.of());
    }

    public CompletableFuture<RpcValue> promiseInvoke(String name, ObjectNode payload, CancellationToken token) {
        return promiseInvoke(name, payload, token, Map.of());
    }

    /**
     * Call a promise handler on the peer. The returned future is settled only by the peer's reply: firing the token
     * asks the peer to cancel, and a canceled call completes with {@link CancellationException}.
     */
    public CompletableFuture<RpcValue> promiseInvoke(String name, ObjectNode payload, CancellationToken token,
                                                     Map<String, TransferableBuffer> transfers) {
        var id = newId();
        var future = new CompletableFuture<RpcValue>();
        pendingCalls.put(id, future);
        payload.put("id", id);
        invoke(name, payload, transfers);
        var registration = token.add(() -> eventLoop.execute(() -> {
            if (pendingCalls.containsKey(id)) {
                var cancel = Payloads.object();
                cancel.put("id", id);
                invoke(PROMISE_CANCEL_ID, cancel);
            }
        }));
        future.whenComplete((value, error) -> registration.close());
        return future;
    }

    /**
     * Resolve a cross-boundary reference sent by the owner, record its generation and add a local reference.
     */
    public <T extends SharedObject> T getRef(JsonNode json, Class<T> type) {
        var ref = SharedObjectRef.fromJson(json);
        var object = get(ref.id(), type);
        object.referencedAt(ref.generation());
        object.addRef();
        return object;
    }

    public long newId() {
        return nextId.getAndAdd(side.step());
    }

    public void set(long id, Object value) {
        objects.put(id, value);
    }

    /**
     * @throws ProtocolViolationException if the id does not resolve to an object of the given type
     */
    public <T> T get(long id, Class<T> type) {
        var value = objects.get(id);
        if (value == null) {
            throw new ProtocolViolationException("No object with id " + id);
        }
        if (!type.isInstance(value)) {
            throw new ProtocolViolationException(
            String.format("Object %d is a %s, not a %s", id, value.getClass().getSimpleName(), type.getSimpleName()));
        }
        return type.cast(value);
    }

    public boolean has(long id) {
        return objects.containsKey(id);
    }

    public void delete(long id) {
        objects.remove(id);
    }

    public int getObjectCount() {
        return objects.size();
    }

    public int getPendingCallCount() {
        return pendingCalls.size();
    }

    public EventLoop getEventLoop() {
        return eventLoop;
    }

    public Side getSide() {
        return side;
    }

    public RpcStatistics getStatistics() {
        return statistics;
    }

    public boolean isPeerReady() {
        synchronized (sendLock) {
            return peerReady;
        }
    }

    private void receive(Message message) {
        var name = message.functionName();
        statistics.recordReceived(name);
        log.trace("{} received {}", side, message);
        peerContacted();
        var handler = HANDLERS.get(name);
        if (handler == null) {
            throw new ProtocolViolationException("No handler registered for " + name);
        }
        if (handler instanceof PromiseRpcHandler) {
            handlePromiseRequest((PromiseRpcHandler) handler, message);
        } else {
            ((RpcHandler) handler).handle(this, message);
        }
    }

    private void handlePromiseRequest(PromiseRpcHandler handler, Message request) {
        var id = Payloads.requireLong(request.payload(), "id");
        var token = new CancellationTokenSource();
        activeRequests.put(id, token);
        CompletableFuture<RpcValue> result;
        try {
            result = handler.handle(this, request, token);
            if (result == null) {
                throw new IllegalStateException("Handler for " + request.functionName() + " returned no result");
            }
        } catch (ProtocolViolationException e) {
            activeRequests.remove(id);
            throw e;
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenCompleteAsync((value, error) -> {
            activeRequests.remove(id);
            if (error == null) {
                try {
                    var reply = Payloads.object();
                    reply.put("id", id);
                    var resolved = value == null ? RpcValue.EMPTY : value;
                    reply.set("value", resolved.value());
                    invoke(PROMISE_RESPONSE_ID, reply, resolved.transfers());
                    return;
                } catch (RuntimeException e) {
                    error = e;
                }
            }
            sendErrorReply(id, request.functionName(), unwrap(error));
        }, eventLoop);
    }

    private void sendErrorReply(long id, String functionName, Throwable cause) {
        if (!(cause instanceof CancellationException)) {
            log.warn("Promise handler {} failed: {}", functionName, cause.toString());
        }
        var reply = Payloads.object();
        reply.put("id", id);
        reply.put("error", cause.getMessage() == null ? cause.toString() : cause.getMessage());
        reply.put("errorName", errorName(cause));
        invoke(PROMISE_RESPONSE_ID, reply);
    }

    private void peerContacted() {
        synchronized (sendLock) {
            if (peerReady) {
                return;
            }
            peerReady = true;
            for (var message : outbox) {
                send(message);
            }
            outbox.clear();
        }
    }

    // Caller holds sendLock
    private void send(Message message) {
        log.trace("{} sending {}", side, message);
        port.postMessage(message);
        statistics.recordSent(message.functionName());
    }

    @Override
    public String toString() {
        return String.format("RpcEndpoint[%s on %s]", side, eventLoop.getName());
    }
}
