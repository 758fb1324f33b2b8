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
 * A consistent (generation, pose) pair read from the {@link PoseStore}.
 *
 * @param generation number of accepted pose updates so far; 0 before the first update
 * @param pose       the latest pose, or {@code null} when generation is 0
 */
public record PoseSnapshot(long generation, CameraPose pose) {

    static final PoseSnapshot INITIAL = new PoseSnapshot(0L, null);

    public boolean hasPose() {
        return pose != null;
    }
}
