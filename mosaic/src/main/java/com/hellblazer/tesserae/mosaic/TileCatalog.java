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

import com.hellblazer.tesserae.mosaic.MosaicException.DecodeFailureException;
import com.hellblazer.tesserae.mosaic.MosaicException.EmptyLibraryException;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered, immutable collection of tiles normalized to a single tile size, each with its precomputed average color.
 * <p>
 * Source images are decoded one at a time, hard-resized to the tile size (aspect ratio is not preserved) and averaged.
 * Images that cannot be decoded are skipped with a warning; a catalog with no tiles is never produced.
 *
 * @author hal.hildebrand
 */
public final class TileCatalog implements Iterable<Tile> {
    private static final Logger log = LoggerFactory.getLogger(TileCatalog.class);

    private final TileSize   tileSize;
    private final List<Tile> tiles;

    private TileCatalog(TileSize tileSize, List<Tile> tiles) {
        this.tileSize = tileSize;
        this.tiles = Collections.unmodifiableList(tiles);
    }

    /**
     * Build a catalog from candidate source images.
     *
     * @param images   candidate images, in catalog order
     * @param tileSize size every tile is resized to
     * @return the catalog
     * @throws EmptyLibraryException if no image could be used
     */
    public static TileCatalog build(List<? extends SourceImage> images, TileSize tileSize) {
        if (images == null) {
            throw new IllegalArgumentException("Images cannot be null");
        }
        if (tileSize == null) {
            throw new IllegalArgumentException("Tile size cannot be null");
        }
        var tiles = new ArrayList<Tile>(images.size());
        int rejected = 0;
        for (var source : images) {
            PixelBuffer decoded;
            try {
                decoded = source.decode();
            } catch (DecodeFailureException e) {
                log.warn("Skipping tile image {}: {}", e.getSource(), e.getMessage());
                rejected++;
                continue;
            }
            var resized = decoded.resize(tileSize.width(), tileSize.height());
            tiles.add(new Tile(tiles.size(), resized, resized.average()));
        }
        if (tiles.isEmpty()) {
            throw new EmptyLibraryException(rejected);
        }
        log.info("Loaded {} tile images at {} ({} skipped)", tiles.size(), tileSize, rejected);
        return new TileCatalog(tileSize, tiles);
    }

    /**
     * Build a catalog from decoded images. Null entries count as undecodable.
     */
    public static TileCatalog fromBuffers(List<PixelBuffer> images, TileSize tileSize) {
        if (images == null) {
            throw new IllegalArgumentException("Images cannot be null");
        }
        var sources = new ArrayList<SourceImage>(images.size());
        for (int i = 0; i < images.size(); i++) {
            sources.add(SourceImage.of("image[" + i + "]", images.get(i)));
        }
        return build(sources, tileSize);
    }

    public Tile get(int index) {
        return tiles.get(index);
    }

    public int size() {
        return tiles.size();
    }

    public TileSize tileSize() {
        return tileSize;
    }

    public List<Tile> tiles() {
        return tiles;
    }

    public Stream<Tile> stream() {
        return tiles.stream();
    }

    @Override
    public Iterator<Tile> iterator() {
        return tiles.iterator();
    }

    @Override
    public String toString() {
        return String.format("TileCatalog[tiles=%d, tileSize=%s]", tiles.size(), tileSize);
    }
}
