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
 * Separable two-pass resampling: horizontal then vertical.
 *
 * @author hal.hildebrand
 */
final class Resampler {

    /**
     * Source taps contributing to each destination sample along one axis. Weights of a tap sum to 1.
     */
    private record Kernel(int[][] taps, double[][] weights) {

        static Kernel of(int sourceLength, int targetLength) {
            return targetLength < sourceLength ? box(sourceLength, targetLength) : linear(sourceLength, targetLength);
        }

        // Area average over the source footprint of each destination sample
        private static Kernel box(int sourceLength, int targetLength) {
            var taps = new int[targetLength][];
            var weights = new double[targetLength][];
            double scale = (double) sourceLength / targetLength;
            for (int i = 0; i < targetLength; i++) {
                double start = i * scale;
                double end = Math.min(sourceLength, (i + 1) * scale);
                int first = (int) Math.floor(start);
                int last = Math.min(sourceLength - 1, (int) Math.ceil(end) - 1);
                int count = last - first + 1;
                taps[i] = new int[count];
                weights[i] = new double[count];
                for (int k = 0; k < count; k++) {
                    int j = first + k;
                    taps[i][k] = j;
                    weights[i][k] = (Math.min(j + 1, end) - Math.max(j, start)) / (end - start);
                }
            }
            return new Kernel(taps, weights);
        }

        // Interpolation between the two nearest pixel centres
        private static Kernel linear(int sourceLength, int targetLength) {
            var taps = new int[targetLength][];
            var weights = new double[targetLength][];
            double scale = (double) sourceLength / targetLength;
            for (int i = 0; i < targetLength; i++) {
                double center = Math.max(0.0, Math.min(sourceLength - 1, (i + 0.5) * scale - 0.5));
                int j0 = (int) Math.floor(center);
                int j1 = Math.min(j0 + 1, sourceLength - 1);
                double f = center - j0;
                taps[i] = new int[] { j0, j1 };
                weights[i] = new double[] { 1.0 - f, f };
            }
            return new Kernel(taps, weights);
        }
    }

    private Resampler() {
    }

    static PixelBuffer resample(PixelBuffer source, int targetWidth, int targetHeight) {
        int sw = source.width();
        int sh = source.height();
        var samples = source.raw();

        var horizontal = Kernel.of(sw, targetWidth);
        var vertical = Kernel.of(sh, targetHeight);

        // Pass 1: rows, sw x sh -> targetWidth x sh
        var pass = new double[3][targetWidth * sh];
        for (int y = 0; y < sh; y++) {
            int row = y * sw;
            for (int x = 0; x < targetWidth; x++) {
                double r = 0, g = 0, b = 0;
                var taps = horizontal.taps()[x];
                var weights = horizontal.weights()[x];
                for (int k = 0; k < taps.length; k++) {
                    int sample = samples[row + taps[k]];
                    r += ((sample >> 16) & 0xFF) * weights[k];
                    g += ((sample >> 8) & 0xFF) * weights[k];
                    b += (sample & 0xFF) * weights[k];
                }
                int index = y * targetWidth + x;
                pass[0][index] = r;
                pass[1][index] = g;
                pass[2][index] = b;
            }
        }

        // Pass 2: columns, targetWidth x sh -> targetWidth x targetHeight
        var result = new int[targetWidth * targetHeight];
        for (int y = 0; y < targetHeight; y++) {
            var taps = vertical.taps()[y];
            var weights = vertical.weights()[y];
            for (int x = 0; x < targetWidth; x++) {
                double r = 0, g = 0, b = 0;
                for (int k = 0; k < taps.length; k++) {
                    int index = taps[k] * targetWidth + x;
                    r += pass[0][index] * weights[k];
                    g += pass[1][index] * weights[k];
                    b += pass[2][index] * weights[k];
                }
                result[y * targetWidth + x] = (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
            }
        }
        return new PixelBuffer(targetWidth, targetHeight, result);
    }

    private static int clamp(double channel) {
        return (int) Math.max(0, Math.min(255, Math.round(channel)));
    }
}
