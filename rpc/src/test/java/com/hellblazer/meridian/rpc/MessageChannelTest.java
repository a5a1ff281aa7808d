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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MessageChannelTest {

    private PolledEventLoop loop1;
    private PolledEventLoop loop2;
    private MessageChannel  channel;
    private List<Message>   received;

    @BeforeEach
    void setUp() {
        loop1 = new PolledEventLoop("one");
        loop2 = new PolledEventLoop("two");
        channel = new MessageChannel(loop1, loop2);
        received = new ArrayList<>();
    }

    @Test
    void testTransferDetachesSender() {
        channel.port2().setMessageHandler(received::add);
        var buffer = TransferableBuffer.wrap(new byte[] { 1, 2, 3, 4 });
        channel.port1().postMessage(new Message("data", Payloads.object(), Map.of("bytes", buffer)));

        assertTrue(buffer.isDetached());
        assertThrows(IllegalStateException.class, buffer::buffer);
        assertThrows(IllegalStateException.class, buffer::byteLength);

        loop2.runPending();
        assertEquals(1, received.size());
        var moved = received.get(0).requireTransfer("bytes");
        assertFalse(moved.isDetached());
        assertArrayEquals(new byte[] { 1, 2, 3, 4 }, moved.toByteArray());
        assertThrows(ProtocolViolationException.class, () -> received.get(0).requireTransfer("other"));
    }

    @Test
    void testFifoPerDirection() {
        channel.port2().setMessageHandler(received::add);
        for (int i = 0; i < 100; i++) {
            var payload = Payloads.object();
            payload.put("seq", i);
            channel.port1().postMessage(new Message("seq", payload));
        }
        loop2.runPending();
        assertEquals(100, received.size());
        for (int i = 0; i < 100; i++) {
            assertEquals(i, received.get(i).payload().get("seq").asInt());
        }
        assertEquals(0, loop1.pendingCount());
    }

    @Test
    void testBacklogDeliveredWhenHandlerInstalled() {
        channel.port1().postMessage(new Message("early", Payloads.object()));
        channel.port2().setMessageHandler(received::add);
        channel.port1().postMessage(new Message("late", Payloads.object()));
        loop2.runPending();
        assertEquals(List.of("early", "late"), received.stream().map(Message::functionName).toList());
    }

    @Test
    void testClosedChannel() {
        channel.port2().setMessageHandler(received::add);
        channel.port1().postMessage(new Message("inflight", Payloads.object()));
        channel.close();
        loop2.runPending();
        assertTrue(received.isEmpty());
        assertThrows(IllegalStateException.class,
                     () -> channel.port1().postMessage(new Message("after", Payloads.object())));
    }
}
