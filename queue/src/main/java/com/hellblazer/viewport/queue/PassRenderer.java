/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewport.queue;

/**
 * The image-synthesis collaborator driven by the {@link RenderWorker}.
 * <p>
 * Implementations are slow and are never interrupted mid-call; the worker only checks for newer poses between
 * passes. Quality levels form a bounded ladder {@code 0 .. qualityLevels() - 1}, rendered in increasing order for a
 * given pose.
 *
 * @author hal.hildebrand
 */
public interface PassRenderer {

    /**
     * Render one pass.
     *
     * @param pose         the camera pose to render from
     * @param qualityLevel refinement ordinal, {@code 0 <= qualityLevel < qualityLevels()}
     * @return the rendered image
     * @throws RenderPassException if the pass could not be produced
     */
    ImageBuffer renderPass(CameraPose pose, int qualityLevel);

    /**
     * @return the number of quality levels this renderer offers, at least 1
     */
    int qualityLevels();

    /**
     * Convergence signal: once a pass at this level has completed, no further refinement is worth rendering for
     * the same pose.
     */
    default boolean isConverged(int qualityLevel) {
        return qualityLevel >= qualityLevels() - 1;
    }
}
