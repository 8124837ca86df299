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
package com.hellblazer.tesserae.mosaic.app;

import com.hellblazer.tesserae.mosaic.ColorIndex;
import com.hellblazer.tesserae.mosaic.Grid;
import com.hellblazer.tesserae.mosaic.Mosaic;
import com.hellblazer.tesserae.mosaic.MosaicAssembler;
import com.hellblazer.tesserae.mosaic.MosaicException.InvalidSourceException;
import com.hellblazer.tesserae.mosaic.ProgressListener;
import com.hellblazer.tesserae.mosaic.TileCatalog;
import com.hellblazer.tesserae.mosaic.config.MosaicConfiguration;
import com.hellblazer.tesserae.mosaic.io.ImageCodec;
import com.hellblazer.tesserae.mosaic.io.ImageSources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Runs a complete mosaic generation: decode the target, load and index the tiles, plan the grid, assemble and write
 * the result under a timestamped name in the output directory.
 *
 * @author hal.hildebrand
 */
public class MosaicGenerator {
    private static final Logger log = LoggerFactory.getLogger(MosaicGenerator.class);

    private final MosaicConfiguration configuration;
    private final Clock               clock;
    private final ProgressListener    listener;

    public MosaicGenerator(MosaicConfiguration configuration) {
        this(configuration, Clock.systemDefaultZone(), ProgressListener.NONE);
    }

    public MosaicGenerator(MosaicConfiguration configuration, Clock clock, ProgressListener listener) {
        if (configuration == null || clock == null || listener == null) {
            throw new IllegalArgumentException("Configuration, clock and listener are required");
        }
        this.configuration = configuration;
        this.clock = clock;
        this.listener = listener;
    }

    /**
     * Generate the mosaic and write it.
     *
     * @return path of the written image
     * @throws InvalidSourceException if the target image or tile source does not exist
     * @throws IOException            if the target cannot be read or the output cannot be written
     */
    public Path generate() throws IOException {
        var targetPath = configuration.getTargetImage();
        var tileSource = configuration.getTileSource();
        if (!Files.exists(targetPath)) {
            throw new InvalidSourceException("Target image path '" + targetPath + "' does not exist");
        }
        if (!Files.exists(tileSource)) {
            throw new InvalidSourceException("Tile images source path '" + tileSource + "' does not exist");
        }

        Files.createDirectories(configuration.getOutputDirectory());
        var output = configuration.outputPath(LocalDateTime.now(clock));
        log.info("Output will be saved to: {}", output);

        var mosaic = assemble();
        ImageCodec.write(mosaic.image(), output);
        return output;
    }

    /**
     * Build the mosaic without writing it.
     */
    public Mosaic assemble() throws IOException {
        log.info("Loading target image: {}", configuration.getTargetImage());
        var target = ImageCodec.read(configuration.getTargetImage());
        log.info("Target image size: {}x{}", target.width(), target.height());

        var catalog = TileCatalog.build(ImageSources.open(configuration.getTileSource()), configuration.getTileSize());
        var index = ColorIndex.builder().withQuantization(configuration.getQuantization()).build(catalog);
        var grid = Grid.plan(target.width(), target.height(), configuration.getTileSize(),
                             configuration.getDensityFactor());
        log.info("Grid: {}x{} cells, {}x{} target pixels per cell", grid.columns(), grid.rows(), grid.cellWidth(),
                 grid.cellHeight());

        var assembler = new MosaicAssembler(configuration.getThreads(), configuration.isCycling(), listener);
        return assembler.assemble(target, grid, index);
    }

    public MosaicConfiguration getConfiguration() {
        return configuration;
    }
}
