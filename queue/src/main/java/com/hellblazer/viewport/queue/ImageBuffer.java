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
 * Pixel data produced by one render pass: interleaved 8-bit RGB, row-major, top row first.
 * <p>
 * The buffer is handed from renderer to arbiter to consumer without copying; whoever holds the record owns the
 * array and must not write to it.
 *
 * @param width  image width in pixels
 * @param height image height in pixels
 * @param rgb    {@code width * height * 3} bytes
 */
public record ImageBuffer(int width, int height, byte[] rgb) {

    public ImageBuffer {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (rgb == null || rgb.length != width * height * 3) {
            throw new IllegalArgumentException(
                "Expected " + (width * height * 3) + " RGB bytes, got " + (rgb == null ? "null" : rgb.length));
        }
    }

    /**
     * Allocate a black image of the given size.
     */
    public static ImageBuffer blank(int width, int height) {
        return new ImageBuffer(width, height, new byte[width * height * 3]);
    }

    /**
     * Packed {@code 0xRRGGBB} value of the pixel at (x, y).
     */
    public int rgbAt(int x, int y) {
        var i = (y * width + x) * 3;
        return (rgb[i] & 0xFF) << 16 | (rgb[i + 1] & 0xFF) << 8 | (rgb[i + 2] & 0xFF);
    }

    @Override
    public String toString() {
        return "ImageBuffer[" + width + "x" + height + "]";
    }
}
