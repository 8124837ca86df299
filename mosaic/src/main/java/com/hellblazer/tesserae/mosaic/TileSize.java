/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tesserae.
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
package com.hellblazer.tesserae.mosaic;

import com.hellblazer.tesserae.mosaic.MosaicException.InvalidDimensionsException;

/**
 * Pixel dimensions every tile is normalized to.
 *
 * @param width  tile width in pixels
 * @param height tile height in pixels
 */
public record TileSize(int width, int height) {

    public TileSize {
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionsException("Tile size must be positive: " + width + "x" + height);
        }
    }

    /**
     * Parse {@code "<W>x<H>"} or {@code "<W>,<H>"}.
     *
     * @throws IllegalArgumentException if the text is not two integers
     * @throws InvalidDimensionsException if either integer is not positive
     */
    public static TileSize parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Tile size cannot be null");
        }
        String[] parts = text.trim().split("\\s*[xX,]\\s*");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid tile size format '" + text + "'. Use: <width>x<height>");
        }
        try {
            return new TileSize(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid tile size '" + text + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
