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

/**
 * Perspective camera used for one rung of the {@link QualityLadder}.
 *
 * @param width  image width in pixels
 * @param height image height in pixels
 * @param fov    vertical field of view, in degrees
 */
public record CameraProfile(int width, int height, double fov) {

    public CameraProfile {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Camera size must be positive: " + width + "x" + height);
        }
        if (!(fov > 0 && fov < 180)) {
            throw new IllegalArgumentException("Vertical field of view must be in (0, 180) degrees: " + fov);
        }
    }

    /**
     * Focal length in pixels for the vertical field of view, following the three.js perspective camera.
     */
    public double focalLength() {
        return height / (2.0 * Math.tan(Math.toRadians(fov) / 2.0));
    }

    public long pixelCount() {
        return (long) width * height;
    }
}
