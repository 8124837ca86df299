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

import com.hellblazer.tesserae.mosaic.image.PixelBuffer;

/**
 * A finished mosaic: the output image and the catalog index placed in every cell.
 *
 * @author hal.hildebrand
 */
public final class Mosaic {

    private final Grid        grid;
    private final PixelBuffer image;
    private final int[]       placements;

    Mosaic(Grid grid, PixelBuffer image, int[] placements) {
        if (placements.length != grid.cellCount()) {
            throw new IllegalArgumentException("Expected " + grid.cellCount() + " placements, got " + placements.length);
        }
        this.grid = grid;
        this.image = image;
        this.placements = placements;
    }

    public Grid grid() {
        return grid;
    }

    public PixelBuffer image() {
        return image;
    }

    public int width() {
        return image.width();
    }

    public int height() {
        return image.height();
    }

    /**
     * @return catalog index of the tile placed in the cell
     */
    public int tileAt(int column, int row) {
        if (column < 0 || column >= grid.columns() || row < 0 || row >= grid.rows()) {
            throw new IllegalArgumentException("Cell (" + column + "," + row + ") is not in the grid");
        }
        return placements[row * grid.columns() + column];
    }

    /**
     * @return catalog indices of every cell in row-major order
     */
    public int[] placements() {
        return placements.clone();
    }

    @Override
    public String toString() {
        return String.format("Mosaic[%dx%d, cells=%dx%d]", image.width(), image.height(), grid.columns(),
                             grid.rows());
    }
}
