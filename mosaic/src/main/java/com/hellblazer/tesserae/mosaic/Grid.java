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
 * Grid of mosaic cells over a target image. Each cell samples a rectangle of the target and receives one tile, placed
 * at tile size in the output.
 *
 * @param targetWidth  target image width in pixels
 * @param targetHeight target image height in pixels
 * @param tileWidth    width of a placed tile in the output
 * @param tileHeight   height of a placed tile in the output
 * @param columns      number of cells horizontally
 * @param rows         number of cells vertically
 * @param cellWidth    nominal width of the target region a cell samples
 * @param cellHeight   nominal height of the target region a cell samples
 *
 * @author hal.hildebrand
 */
public record Grid(int targetWidth, int targetHeight, int tileWidth, int tileHeight, int columns, int rows,
                   int cellWidth, int cellHeight) {

    // Absorbs representation error in products such as 100 * 0.1
    private static final double EPSILON = 1e-9;

    /**
     * Target pixel rectangle sampled by one cell
     */
    public record CellBounds(int x, int y, int width, int height) {
    }

    /**
     * Plan the grid. The tile size scaled by {@code 1 / densityFactor} is the target footprint of a cell, so larger
     * factors yield more, smaller cells.
     *
     * @param targetWidth   target image width
     * @param targetHeight  target image height
     * @param tileSize      size tiles are placed at
     * @param densityFactor positive density multiplier, 1.0 samples one tile-sized region per cell
     * @return the grid
     * @throws InvalidDimensionsException if any dimension or the factor is not positive and finite
     */
    public static Grid plan(int targetWidth, int targetHeight, TileSize tileSize, double densityFactor) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new InvalidDimensionsException(
            "Target dimensions must be positive: " + targetWidth + "x" + targetHeight);
        }
        if (tileSize == null) {
            throw new IllegalArgumentException("Tile size cannot be null");
        }
        if (!(densityFactor > 0) || Double.isInfinite(densityFactor)) {
            throw new InvalidDimensionsException("Density factor must be positive and finite: " + densityFactor);
        }
        int columns = cellCount(targetWidth, tileSize.width(), densityFactor);
        int rows = cellCount(targetHeight, tileSize.height(), densityFactor);
        if ((long) columns * tileSize.width() > Integer.MAX_VALUE
        || (long) rows * tileSize.height() > Integer.MAX_VALUE
        || (long) columns * tileSize.width() * rows * tileSize.height() > Integer.MAX_VALUE) {
            throw new InvalidDimensionsException(
            String.format("Mosaic of %dx%d cells at %s exceeds the maximum image size", columns, rows, tileSize));
        }
        return new Grid(targetWidth, targetHeight, tileSize.width(), tileSize.height(), columns, rows,
                        Math.max(1, targetWidth / columns), Math.max(1, targetHeight / rows));
    }

    // ceil(extent / (tile / factor)), clamped to at least one cell
    private static int cellCount(int extent, int tile, double densityFactor) {
        double cells = Math.ceil((double) extent * densityFactor / tile - EPSILON);
        if (cells > Integer.MAX_VALUE) {
            throw new InvalidDimensionsException(
            String.format("Density factor %s yields too many cells for extent %d", densityFactor, extent));
        }
        return Math.max(1, (int) cells);
    }

    /**
     * Validates the grid invariants.
     */
    public Grid {
        if (targetWidth <= 0 || targetHeight <= 0 || tileWidth <= 0 || tileHeight <= 0) {
            throw new InvalidDimensionsException("Grid dimensions must be positive");
        }
        if (columns < 1 || rows < 1) {
            throw new InvalidDimensionsException("Grid must have at least one column and row");
        }
        if (cellWidth < 1 || cellHeight < 1) {
            throw new InvalidDimensionsException("Cells must be at least one pixel");
        }
    }

    /**
     * The target rectangle sampled by a cell. When the grid is no finer than the target the cells partition it
     * exactly; otherwise neighbouring cells may sample the same single pixel.
     *
     * @param column cell column, 0-based
     * @param row    cell row, 0-based
     */
    public CellBounds cellBounds(int column, int row) {
        if (column < 0 || column >= columns || row < 0 || row >= rows) {
            throw new IllegalArgumentException(
            "Cell coordinates out of bounds: (" + column + "," + row + ") for " + columns + "x" + rows + " grid");
        }
        int x0 = span(column, targetWidth, columns);
        int x1 = span(column + 1, targetWidth, columns);
        int y0 = span(row, targetHeight, rows);
        int y1 = span(row + 1, targetHeight, rows);
        if (x1 <= x0) {
            x0 = Math.min(x0, targetWidth - 1);
            x1 = x0 + 1;
        }
        if (y1 <= y0) {
            y0 = Math.min(y0, targetHeight - 1);
            y1 = y0 + 1;
        }
        return new CellBounds(x0, y0, x1 - x0, y1 - y0);
    }

    private static int span(int index, int extent, int count) {
        return (int) ((long) index * extent / count);
    }

    public int cellCount() {
        return columns * rows;
    }

    public int mosaicWidth() {
        return columns * tileWidth;
    }

    public int mosaicHeight() {
        return rows * tileHeight;
    }

    public TileSize tileSize() {
        return new TileSize(tileWidth, tileHeight);
    }
}
