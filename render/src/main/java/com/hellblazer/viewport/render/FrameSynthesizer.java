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
package com.hellblazer.viewport.render;

import com.hellblazer.viewport.queue.ImageBuffer;

import javax.vecmath.Matrix4d;

/**
 * Produces pixels for a camera placed in the scene. Implementations may be arbitrarily slow.
 */
public interface FrameSynthesizer {

    /**
     * @param cameraToWorld camera placement, see {@link CameraTransforms#cameraToWorld}
     * @param camera        image size and field of view
     * @return an image of exactly {@code camera.width() x camera.height()} pixels
     */
    ImageBuffer renderAt(Matrix4d cameraToWorld, CameraProfile camera);
}
