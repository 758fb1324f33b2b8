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
 * An image handed to a consumer by {@link ProgressiveRenderQueue#getImage()}, tagged with the generation and quality
 * level it was rendered at. Once delivered, the queue keeps no reference to the buffer.
 */
public record DeliveredImage(long generation, int qualityLevel, ImageBuffer image) {
}
