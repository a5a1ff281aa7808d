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
 * Which side of a channel an endpoint is on. The side fixes the sign of the ids the endpoint allocates, so ids chosen
 * independently by the two sides never collide.
 *
 * @author hal.hildebrand
 */
public enum Side {
    /** The frontend: allocates 0, 1, 2, ... */
    MAIN {
        @Override
        long firstId() {
            return 0;
        }

        @Override
        long step() {
            return 1;
        }
    },
    /** A worker: allocates -1, -2, -3, ... */
    WORKER {
        @Override
        long firstId() {
            return -1;
        }

        @Override
        long step() {
            return -1;
        }
    };

    abstract long firstId();

    abstract long step();
}
