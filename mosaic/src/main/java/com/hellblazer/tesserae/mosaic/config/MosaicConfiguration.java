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
package com.hellblazer.tesserae.mosaic.config;

import com.hellblazer.tesserae.mosaic.TileSize;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Parameters of one mosaic run: input and output locations, tile size, grid density and assembly options.
 *
 * @author hal.hildebrand
 */
public class MosaicConfiguration {

    public static final Path     DEFAULT_TARGET_IMAGE     = Paths.get("base_image.png");
    public static final Path     DEFAULT_TILE_SOURCE      = Paths.get("tiles_archive.zip");
    public static final Path     DEFAULT_OUTPUT_DIRECTORY = Paths.get("mosaic_results");
    public static final TileSize DEFAULT_TILE_SIZE        = new TileSize(50, 50);
    public static final double   DEFAULT_DENSITY_FACTOR   = 7.0;

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path     targetImage;
    private final Path     tileSource;
    private final Path     outputDirectory;
    private final TileSize tileSize;
    private final double   densityFactor;
    private final int      threads;
    private final int      quantization;
    private final boolean  cycling;

    private MosaicConfiguration(Builder builder) {
        this.targetImage = builder.targetImage;
        this.tileSource = builder.tileSource;
        this.outputDirectory = builder.outputDirectory;
        this.tileSize = builder.tileSize;
        this.densityFactor = builder.densityFactor;
        this.threads = builder.threads;
        this.quantization = builder.quantization;
        this.cycling = builder.cycling;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MosaicConfiguration defaultConfig() {
        return builder().build();
    }

    public Path getTargetImage() {
        return targetImage;
    }

    public Path getTileSource() {
        return tileSource;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public TileSize getTileSize() {
        return tileSize;
    }

    public double getDensityFactor() {
        return densityFactor;
    }

    /**
     * @return assembly worker threads
     */
    public int getThreads() {
        return threads;
    }

    /**
     * @return color bucketing band width, 1 groups only identical colors
     */
    public int getQuantization() {
        return quantization;
    }

    /**
     * @return true when repeated matches rotate through equally colored tiles
     */
    public boolean isCycling() {
        return cycling;
    }

    /**
     * Output file name embedding the run time and parameters, e.g.
     * {@code photo_mosaic_cycled_20250101_120000_tile50x50_res7p0.jpg}. Runs without cycling drop the
     * {@code _cycled} marker.
     */
    public String outputFileName(LocalDateTime time) {
        return String.format("photo_mosaic%s_%s_tile%dx%d_res%s.jpg", cycling ? "_cycled" : "",
                             time.format(TIMESTAMP), tileSize.width(), tileSize.height(),
                             Double.toString(densityFactor).replace('.', 'p'));
    }

    public Path outputPath(LocalDateTime time) {
        return outputDirectory.resolve(outputFileName(time));
    }

    /**
     * @return a builder initialized from this configuration
     */
    public Builder toBuilder() {
        return builder().withTargetImage(targetImage)
                        .withTileSource(tileSource)
                        .withOutputDirectory(outputDirectory)
                        .withTileSize(tileSize)
                        .withDensityFactor(densityFactor)
                        .withThreads(threads)
                        .withQuantization(quantization)
                        .withCycling(cycling);
    }

    /**
     * Builder class for MosaicConfiguration
     */
    public static class Builder {
        private Path     targetImage     = DEFAULT_TARGET_IMAGE;
        private Path     tileSource      = DEFAULT_TILE_SOURCE;
        private Path     outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
        private TileSize tileSize        = DEFAULT_TILE_SIZE;
        private double   densityFactor   = DEFAULT_DENSITY_FACTOR;
        private int      threads         = 1;
        private int      quantization    = 1;
        private boolean  cycling         = true;

        private Builder() {
        }

        public Builder withTargetImage(Path path) {
            this.targetImage = requirePath(path, "Target image");
            return this;
        }

        public Builder withTileSource(Path path) {
            this.tileSource = requirePath(path, "Tile source");
            return this;
        }

        public Builder withOutputDirectory(Path path) {
            this.outputDirectory = requirePath(path, "Output directory");
            return this;
        }

        public Builder withTileSize(TileSize size) {
            if (size == null) {
                throw new IllegalArgumentException("Tile size cannot be null");
            }
            this.tileSize = size;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the factor is not positive and finite
         */
        public Builder withDensityFactor(double factor) {
            if (!(factor > 0) || Double.isInfinite(factor)) {
                throw new IllegalArgumentException("Density factor must be positive and finite: " + factor);
            }
            this.densityFactor = factor;
            return this;
        }

        public Builder withThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
            }
            this.threads = threads;
            return this;
        }

        public Builder withQuantization(int step) {
            if (step < 1 || step > 256) {
                throw new IllegalArgumentException("Quantization step must be in [1, 256]: " + step);
            }
            this.quantization = step;
            return this;
        }

        public Builder withCycling(boolean cycling) {
            this.cycling = cycling;
            return this;
        }

        public MosaicConfiguration build() {
            return new MosaicConfiguration(this);
        }

        private static Path requirePath(Path path, String what) {
            if (path == null) {
                throw new IllegalArgumentException(what + " path cannot be null");
            }
            return path;
        }
    }

    @Override
    public String toString() {
        return String.format(
        "MosaicConfiguration[target=%s, tiles=%s, output=%s, tileSize=%s, density=%.2f, threads=%d, quantization=%d, "
        + "cycling=%s]",
        targetImage, tileSource, outputDirectory, tileSize, densityFactor, threads, quantization, cycling);
    }
}
