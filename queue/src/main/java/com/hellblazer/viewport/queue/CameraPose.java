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

import java.util.Arrays;

/**
 * Immutable camera pose: a position and an Euler rotation (degrees, x/y/z order).
 * <p>
 * Poses are only ever replaced, never mutated. Component arrays are copied on the way in and on the way out.
 *
 * @author hal.hildebrand
 */
public record CameraPose(double[] position, double[] rotation) {

    public CameraPose {
        validate("position", position);
        validate("rotation", rotation);
        position = position.clone();
        rotation = rotation.clone();
    }

    /**
     * Create a validated pose.
     *
     * @param position 3 finite components
     * @param rotation 3 finite Euler angles, in degrees
     * @throws PoseValidationException if either array is missing, not of length 3, or holds a non-finite value
     */
    public static CameraPose of(double[] position, double[] rotation) {
        return new CameraPose(position, rotation);
    }

    private static void validate(String component, double[] values) {
        if (values == null) {
            throw new PoseValidationException(component + " is required");
        }
        if (values.length != 3) {
            throw new PoseValidationException(component + " must have 3 components, got " + values.length);
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new PoseValidationException(
                    String.format("%s[%d] is not a finite number: %s", component, i, values[i]));
            }
        }
    }

    @Override
    public double[] position() {
        return position.clone();
    }

    @Override
    public double[] rotation() {
        return rotation.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CameraPose that)) return false;
        return Arrays.equals(position, that.position) && Arrays.equals(rotation, that.rotation);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(position) + Arrays.hashCode(rotation);
    }

    @Override
    public String toString() {
        return "CameraPose[position=" + Arrays.toString(position) + ", rotation=" + Arrays.toString(rotation) + "]";
    }
}
