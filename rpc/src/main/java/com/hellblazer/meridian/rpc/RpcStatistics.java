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

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-function counts of the messages an endpoint sent and received.
 *
 * @author hal.hildebrand
 */
public class RpcStatistics {

    private final Map<String, LongAdder> sent     = new ConcurrentHashMap<>();
    private final Map<String, LongAdder> received = new ConcurrentHashMap<>();

    void recordSent(String functionName) {
        sent.computeIfAbsent(functionName, k -> new LongAdder()).increment();
    }

    void recordReceived(String functionName) {
        received.computeIfAbsent(functionName, k -> new LongAdder()).increment();
    }

    public long getSent(String functionName) {
        var counter = sent.get(functionName);
        return counter == null ? 0 : counter.sum();
    }

    public long getReceived(String functionName) {
        var counter = received.get(functionName);
        return counter == null ? 0 : counter.sum();
    }

    public long getTotalSent() {
        return sent.values().stream().mapToLong(LongAdder::sum).sum();
    }

    public long getTotalReceived() {
        return received.values().stream().mapToLong(LongAdder::sum).sum();
    }

    public Map<String, Long> sentSnapshot() {
        var snapshot = new TreeMap<String, Long>();
        sent.forEach((k, v) -> snapshot.put(k, v.sum()));
        return snapshot;
    }

    @Override
    public String toString() {
        return String.format("RpcStatistics[sent=%d, received=%d]", getTotalSent(), getTotalReceived());
    }
}
