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

/**
 * Failure reported by the remote side of a promise RPC.
 *
 * @author hal.hildebrand
 */
public class RpcException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorName;

    public RpcException(String errorName, String message) {
        super(message);
        this.errorName = errorName;
    }

    /**
     * @return the kind of error raised by the remote handler
     */
    public String getErrorName() {
        return errorName;
    }

    @Override
    public String toString() {
        return String.format("RpcException[%s: %s]", errorName, getMessage());
    }
}
