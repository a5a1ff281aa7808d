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
package com.hellblazer.meridian.chunk.frontend;

import com.hellblazer.meridian.chunk.LayerChunkProgress;
import com.hellblazer.meridian.rpc.shared.SharedObject;
import com.hellblazer.meridian.rpc.shared.Signal;

/**
 * Owner of a layer whose worker side requests chunks. Receives the layer's chunk progress after each recompute on the
 * worker.
 *
 * @author hal.hildebrand
 */
public abstract class FrontendChunkRenderLayer extends SharedObject {
    private final Signal       progressChanged = new Signal();
    private LayerChunkProgress progress        = LayerChunkProgress.EMPTY;

    public LayerChunkProgress getProgress() {
        return progress;
    }

    /**
     * Fires when a report from the worker changes {@link #getProgress()}.
     */
    public Signal progressChanged() {
        return progressChanged;
    }

    void setProgress(LayerChunkProgress progress) {
        if (progress.equals(this.progress)) {
            return;
        }
        this.progress = progress;
        progressChanged.dispatch();
    }
}
