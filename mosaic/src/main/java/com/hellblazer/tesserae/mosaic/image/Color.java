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

import javax.vecmath.Point3i;

/**
 * An 8-bit per channel RGB color.
 *
 * @param red   red intensity, 0-255
 * @param green green intensity, 0-255
 * @param blue  blue intensity, 0-255
 *
 * @author hal.hildebrand
 */
public record Color(int red, int green, int blue) {

    public static final Color BLACK = new Color(0, 0, 0);

    public Color {
        if (!inRange(red) || !inRange(green) || !inRange(blue)) {
            throw new IllegalArgumentException(
            "Channel intensities must be in [0, 255]: (" + red + ", " + green + ", " + blue + ")");
        }
    }

    /**
     * Unpack a 0xRRGGBB sample. Bits above the blue, green and red bytes are ignored.
     *
     * @param rgb packed sample
     * @return the color
     */
    public static Color ofRgb(int rgb) {
        return new Color((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    private static boolean inRange(int channel) {
        return channel >= 0 && channel <= 255;
    }

    /**
     * Squared Euclidean distance over (R, G, B)
     */
    public long distanceSquared(Color other) {
        long dr = red - other.red;
        long dg = green - other.green;
        long db = blue - other.blue;
        return dr * dr + dg * dg + db * db;
    }

    /**
     * Map this color onto the centre of the {@code step}-wide band each channel falls in. A step of 1 is the identity.
     *
     * @param step band width, at least 1
     * @return the quantized color
     */
    public Color quantize(int step) {
        if (step < 1) {
            throw new IllegalArgumentException("Quantization step must be at least 1: " + step);
        }
        if (step == 1) {
            return this;
        }
        return new Color(band(red, step), band(green, step), band(blue, step));
    }

    private static int band(int channel, int step) {
        return Math.min(255, (channel / step) * step + (step - 1) / 2);
    }

    public Point3i toPoint() {
        return new Point3i(red, green, blue);
    }

    public int toRgb() {
        return (red << 16) | (green << 8) | blue;
    }

    @Override
    public String toString() {
        return String.format("#%02X%02X%02X", red, green, blue);
    }
}
