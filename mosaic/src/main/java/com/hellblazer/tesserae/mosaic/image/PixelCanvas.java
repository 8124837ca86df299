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
package com.hellblazer.tesserae.mosaic.image;

/**
 * Writable output surface. Starts black; images are pasted into it and {@link #finish()} hands the samples over to an
 * immutable {@link PixelBuffer}, after which the canvas rejects further writes.
 * <p>
 * Concurrent pastes are safe as long as they target disjoint regions and are published to the finishing thread by a
 * happens-before edge (e.g. {@code Future.get()}).
 *
 * @author hal.hildebrand
 */
public final class PixelCanvas {

    private final int     width;
    private final int     height;
    private final int[]   rgb;
    private volatile boolean finished = false;

    public PixelCanvas(int width, int height) {
        this.rgb = new int[PixelBuffer.sampleCount(width, height)];
        this.width = width;
        this.height = height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Copy the image into the canvas with its top-left corner at (x, y). The image must fit entirely.
     */
    public void paste(PixelBuffer image, int x, int y) {
        if (finished) {
            throw new IllegalStateException("Canvas is finished");
        }
        if (x < 0 || y < 0 || x + image.width() > width || y + image.height() > height) {
            throw new IllegalArgumentException(
            String.format("%s at (%d,%d) does not fit in %dx%d canvas", image, x, y, width, height));
        }
        var source = image.raw();
        for (int row = 0; row < image.height(); row++) {
            System.arraycopy(source, row * image.width(), rgb, (y + row) * width + x, image.width());
        }
    }

    public boolean isFinished() {
        return finished;
    }

    public PixelBuffer finish() {
        if (finished) {
            throw new IllegalStateException("Canvas is already finished");
        }
        finished = true;
        return new PixelBuffer(width, height, rgb);
    }
}
