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

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable decoded RGB image. Samples are packed 0xRRGGBB in row-major order; alpha is discarded on the way in.
 *
 * @author hal.hildebrand
 */
public final class PixelBuffer {

    private final int   width;
    private final int   height;
    private final int[] rgb;

    // Takes ownership of the sample array
    PixelBuffer(int width, int height, int[] rgb) {
        if (rgb.length != sampleCount(width, height)) {
            throw new IllegalArgumentException(
            "Sample count " + rgb.length + " does not match dimensions " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    /**
     * Create a buffer from packed 0xRRGGBB samples in row-major order. The array is copied.
     */
    public static PixelBuffer of(int width, int height, int[] samples) {
        var copy = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            copy[i] = samples[i] & 0xFFFFFF;
        }
        return new PixelBuffer(width, height, copy);
    }

    public static PixelBuffer filled(int width, int height, Color color) {
        var samples = new int[sampleCount(width, height)];
        Arrays.fill(samples, color.toRgb());
        return new PixelBuffer(width, height, samples);
    }

    /**
     * Convert a decoded AWT image, discarding alpha.
     */
    public static PixelBuffer fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        var samples = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < samples.length; i++) {
            samples[i] &= 0xFFFFFF;
        }
        return new PixelBuffer(w, h, samples);
    }

    /**
     * @return width * height
     * @throws IllegalArgumentException if a dimension is not positive or the product does not fit in an array
     */
    static int sampleCount(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        long count = (long) width * height;
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image too large: " + width + "x" + height);
        }
        return (int) count;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int rgb(int x, int y) {
        checkBounds(x, y);
        return rgb[y * width + x];
    }

    public Color color(int x, int y) {
        return Color.ofRgb(rgb(x, y));
    }

    /**
     * @return a copy of the packed samples
     */
    public int[] samples() {
        return rgb.clone();
    }

    /**
     * Average color of the whole image.
     */
    public Color average() {
        return averageRegion(0, 0, width, height);
    }

    /**
     * Arithmetic mean of each channel over the region, truncated toward zero.
     *
     * @param x      left edge
     * @param y      top edge
     * @param w      region width, positive
     * @param h      region height, positive
     * @return the average color of the region
     */
    public Color averageRegion(int x, int y, int w, int h) {
        if (w <= 0 || h <= 0 || x < 0 || y < 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException(
            String.format("Region (%d,%d %dx%d) is not within %dx%d", x, y, w, h, width, height));
        }
        long r = 0, g = 0, b = 0;
        for (int row = y; row < y + h; row++) {
            int offset = row * width;
            for (int col = x; col < x + w; col++) {
                int sample = rgb[offset + col];
                r += (sample >> 16) & 0xFF;
                g += (sample >> 8) & 0xFF;
                b += sample & 0xFF;
            }
        }
        long count = (long) w * h;
        return new Color((int) (r / count), (int) (g / count), (int) (b / count));
    }

    /**
     * Hard resize to the given dimensions, aspect ratio not preserved. Axes that shrink are area averaged, axes that
     * grow are linearly interpolated. A constant image stays exactly constant.
     */
    public PixelBuffer resize(int newWidth, int newHeight) {
        sampleCount(newWidth, newHeight);
        if (newWidth == width && newHeight == height) {
            return this;
        }
        return Resampler.resample(this, newWidth, newHeight);
    }

    public BufferedImage toImage() {
        var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, rgb, 0, width);
        return image;
    }

    // Direct access for same-package writers and the resampler
    int[] raw() {
        return rgb;
    }

    private void checkBounds(int x, int y) {
        if (x < 0 || y < 0 || x >= width || y >= height) {
            throw new IllegalArgumentException("Pixel (" + x + "," + y + ") is not within " + width + "x" + height);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelBuffer other)) {
            return false;
        }
        return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgb);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }
}
