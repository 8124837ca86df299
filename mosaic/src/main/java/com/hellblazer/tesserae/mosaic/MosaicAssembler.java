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
import com.hellblazer.tesserae.mosaic.image.PixelCanvas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles a mosaic from a target image, a grid and a color index.
 * <p>
 * Each cell, in row-major order:
 * <ol>
 * <li>averages the target region the cell covers</li>
 * <li>takes the next tile from the nearest color bucket ({@link ColorIndex#cyclingPick}), or with cycling disabled
 * always that bucket's first tile ({@link ColorIndex#nearestMatch})</li>
 * <li>pastes that tile, at the grid's tile size, into the cell's place in the output</li>
 * </ol>
 * Bucket cursors are rewound at the start of every assembly. With a single thread the output is a deterministic
 * function of the inputs. With more threads, rows are spread over a worker pool; sampling and pasting run in parallel
 * and only the per-bucket cursor advancement is serialized, so which equivalent tile lands in which cell may vary
 * between runs.
 *
 * @author hal.hildebrand
 */
public class MosaicAssembler {
    private static final Logger log = LoggerFactory.getLogger(MosaicAssembler.class);

    /** Cells between progress log lines */
    public static final int PROGRESS_INTERVAL = 100;

    /**
     * State of one assembly pass
     */
    private static final class Pass {
        private final PixelBuffer                target;
        private final Grid                       grid;
        private final ColorIndex                 index;
        private final PixelCanvas                canvas;
        private final int[]                      placements;
        private final Map<Integer, PixelBuffer>  scaledTiles = new ConcurrentHashMap<>();
        private final AtomicInteger              completed   = new AtomicInteger();
        private final ProgressListener           listener;
        private final boolean                    cycling;

        private Pass(PixelBuffer target, Grid grid, ColorIndex index, ProgressListener listener, boolean cycling) {
            this.target = target;
            this.grid = grid;
            this.index = index;
            this.listener = listener;
            this.cycling = cycling;
            this.canvas = new PixelCanvas(grid.mosaicWidth(), grid.mosaicHeight());
            this.placements = new int[grid.cellCount()];
        }

        private void placeRow(int row) {
            for (int column = 0; column < grid.columns(); column++) {
                placeCell(column, row);
            }
        }

        private void placeCell(int column, int row) {
            var bounds = grid.cellBounds(column, row);
            var average = target.averageRegion(bounds.x(), bounds.y(), bounds.width(), bounds.height());
            int selected = cycling ? index.cyclingPick(average) : index.nearestMatch(average);
            placements[row * grid.columns() + column] = selected;
            canvas.paste(tileImage(selected), column * grid.tileWidth(), row * grid.tileHeight());

            int done = completed.incrementAndGet();
            int total = placements.length;
            listener.cellPlaced(done, total);
            if (done % PROGRESS_INTERVAL == 0 || done == total) {
                log.info("Progress: {}/{} cells processed ({}%)", done, total,
                         String.format("%.1f", 100.0 * done / total));
            }
        }

        // Tiles are stored at catalog size; rescale once per tile when the grid places them at another size
        private PixelBuffer tileImage(int catalogIndex) {
            var image = index.catalog().get(catalogIndex).image();
            if (image.width() == grid.tileWidth() && image.height() == grid.tileHeight()) {
                return image;
            }
            return scaledTiles.computeIfAbsent(catalogIndex, i -> image.resize(grid.tileWidth(), grid.tileHeight()));
        }
    }

    private final int              threads;
    private final boolean          cycling;
    private final ProgressListener listener;

    /**
     * Single-threaded cycling assembler without a progress listener.
     */
    public MosaicAssembler() {
        this(1, true, ProgressListener.NONE);
    }

    /**
     * Cycling assembler.
     *
     * @param threads  number of worker threads, at least 1
     * @param listener notified after every placement
     */
    public MosaicAssembler(int threads, ProgressListener listener) {
        this(threads, true, listener);
    }

    /**
     * @param threads  number of worker threads, at least 1
     * @param cycling  rotate through equally colored tiles; when false the nearest bucket's first tile is placed
     * @param listener notified after every placement
     */
    public MosaicAssembler(int threads, boolean cycling, ProgressListener listener) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be at least 1: " + threads);
        }
        if (listener == null) {
            throw new IllegalArgumentException("Progress listener cannot be null");
        }
        this.threads = threads;
        this.cycling = cycling;
        this.listener = listener;
    }

    /**
     * Assemble the mosaic.
     *
     * @param target decoded target image, of the dimensions the grid was planned for
     * @param grid   cell layout
     * @param index  color index over the tile catalog
     * @return the finished mosaic, {@code grid.mosaicWidth()} by {@code grid.mosaicHeight()} pixels
     */
    public Mosaic assemble(PixelBuffer target, Grid grid, ColorIndex index) {
        if (target == null || grid == null || index == null) {
            throw new IllegalArgumentException("Target, grid and index are required");
        }
        if (target.width() != grid.targetWidth() || target.height() != grid.targetHeight()) {
            throw new IllegalArgumentException(
            String.format("Target is %dx%d but the grid was planned for %dx%d", target.width(), target.height(),
                          grid.targetWidth(), grid.targetHeight()));
        }

        index.resetCursors();
        var pass = new Pass(target, grid, index, listener, cycling);
        int workers = Math.min(threads, grid.rows());
        log.info("Assembling {}x{} cells into a {}x{} mosaic with {} worker(s), cycling {}", grid.columns(),
                 grid.rows(), grid.mosaicWidth(), grid.mosaicHeight(), workers, cycling ? "on" : "off");
        long start = System.nanoTime();

        if (workers == 1) {
            for (int row = 0; row < grid.rows(); row++) {
                pass.placeRow(row);
            }
        } else {
            assembleParallel(pass, workers);
        }

        var image = pass.canvas.finish();
        log.info("Mosaic assembly complete in {} ms", (System.nanoTime() - start) / 1_000_000);
        return new Mosaic(grid, image, pass.placements);
    }

    private void assembleParallel(Pass pass, int workers) {
        var counter = new AtomicInteger();
        var executor = Executors.newFixedThreadPool(workers, r -> {
            var thread = new Thread(r, "mosaic-assembler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            var futures = new ArrayList<Future<?>>(pass.grid.rows());
            for (int row = 0; row < pass.grid.rows(); row++) {
                final int r = row;
                futures.add(executor.submit(() -> pass.placeRow(r)));
            }
            for (var future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Mosaic assembly interrupted", e);
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Mosaic assembly failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    public int threads() {
        return threads;
    }

    public boolean isCycling() {
        return cycling;
    }
}
