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

import java.util.concurrent.CancellationException;

/**
 * Observes a cancellation request.
 *
 * @author hal.hildebrand
 */
public interface CancellationToken {

    /**
     * A token that is never canceled.
     */
    CancellationToken UNCANCELABLE = new CancellationToken() {
        @Override
        public boolean isCanceled() {
            return false;
        }

        @Override
        public Registration add(Runnable handler) {
            return Registration.NONE;
        }

        @Override
        public String toString() {
            return "CancellationToken[uncancelable]";
        }
    };

    boolean isCanceled();

    /**
     * Run the handler when this token is canceled, immediately if it already has been.
     */
    Registration add(Runnable handler);

    default void throwIfCanceled() {
        if (isCanceled()) {
            throw new CancellationException();
        }
    }
}
