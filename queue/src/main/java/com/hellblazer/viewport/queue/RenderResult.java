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
 * The output of one completed render pass, offered to the {@link ResultArbiter}.
 *
 * @param generation   the pose generation the pass was rendered for
 * @param qualityLevel refinement ordinal of the pass
 * @param image        the rendered pixels
 */
public record RenderResult(long generation, int qualityLevel, ImageBuffer image) {

    public RenderResult {
        if (qualityLevel < 0) {
            throw new IllegalArgumentException("Quality level must be non-negative: " + qualityLevel);
        }
        if (image == null) {
            throw new IllegalArgumentException("Render result requires an image");
        }
    }
}
