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

import java.nio.ByteBuffer;

/**
 * A bulk binary buffer that crosses a message channel by being moved rather than copied.
 * <p>
 * Transferring detaches this handle: the receiving side gets a fresh handle on the same memory and any further read
 * through the sender's handle fails with {@link IllegalStateException}.
 *
 * @author hal.hildebrand
 */
public final class TransferableBuffer {

    private ByteBuffer buffer;

    private TransferableBuffer(ByteBuffer buffer) {
        this.buffer = buffer;
    }

    public static TransferableBuffer wrap(ByteBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("Buffer cannot be null");
        }
        return new TransferableBuffer(buffer);
    }

    public static TransferableBuffer wrap(byte[] bytes) {
        return wrap(ByteBuffer.wrap(bytes));
    }

    /**
     * @return a read-only view of the buffer contents
     * @throws IllegalStateException if the buffer has been transferred
     */
    public ByteBuffer buffer() {
        return attached().asReadOnlyBuffer();
    }

    public int byteLength() {
        return attached().remaining();
    }

    public boolean isDetached() {
        return buffer == null;
    }

    public byte[] toByteArray() {
        var view = attached().duplicate();
        var bytes = new byte[view.remaining()];
        view.get(bytes);
        return bytes;
    }

    /**
     * Move the buffer into a new handle, detaching this one.
     */
    public synchronized TransferableBuffer transfer() {
        var moved = new TransferableBuffer(attached());
        buffer = null;
        return moved;
    }

    private synchronized ByteBuffer attached() {
        if (buffer == null) {
            throw new IllegalStateException("Buffer has been transferred");
        }
        return buffer;
    }

    @Override
    public String toString() {
        return buffer == null ? "TransferableBuffer[detached]"
                              : String.format("TransferableBuffer[%d bytes]", buffer.remaining());
    }
}
