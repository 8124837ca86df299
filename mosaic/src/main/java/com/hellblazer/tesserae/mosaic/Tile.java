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

import com.hellblazer.tesserae.mosaic.image.Color;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;

/**
 * A catalog entry: the tile image at the catalog's tile size and its average color.
 *
 * @param index        stable position in the catalog
 * @param image        tile pixels
 * @param averageColor mean of each channel over the tile
 */
public record Tile(int index, PixelBuffer image, Color averageColor) {

    public Tile {
        if (index < 0) {
            throw new IllegalArgumentException("Tile index must be non-negative");
        }
        if (image == null || averageColor == null) {
            throw new IllegalArgumentException("Tile image and color cannot be null");
        }
    }
}
