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

import com.hellblazer.tesserae.common.KdTree;
import com.hellblazer.tesserae.mosaic.image.Color;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Nearest-color lookup over a {@link TileCatalog}, with repetition control.
 * <p>
 * Tiles are grouped into {@link ColorBucket}s by color key: the tile's average color, or that color quantized to a
 * band of the configured width. A balanced k-d tree over the distinct keys answers nearest neighbor queries under
 * squared Euclidean distance. Buckets are numbered in order of their lowest member, and the tree breaks distance ties
 * by that number, so equally near keys resolve to the lowest catalog index.
 * <p>
 * The tree is immutable and shared freely between threads; the only mutable state is the bucket cursors.
 *
 * @author hal.hildebrand
 */
public final class ColorIndex {
    private static final Logger log = LoggerFactory.getLogger(ColorIndex.class);

    /**
     * Builder for ColorIndex
     */
    public static class Builder {
        private int quantization = 1;

        private Builder() {
        }

        /**
         * Group colors whose channels fall into the same {@code step}-wide band. A step of 1 groups only identical
         * colors.
         *
         * @param step band width in channel units
         * @return this builder instance
         * @throws IllegalArgumentException if step is outside [1, 256]
         */
        public Builder withQuantization(int step) {
            if (step < 1 || step > 256) {
                throw new IllegalArgumentException("Quantization step must be in [1, 256]: " + step);
            }
            this.quantization = step;
            return this;
        }

        public ColorIndex build(TileCatalog catalog) {
            if (catalog == null) {
                throw new IllegalArgumentException("Catalog cannot be null");
            }
            return new ColorIndex(catalog, quantization);
        }
    }

    private final TileCatalog       catalog;
    private final int               quantization;
    private final List<ColorBucket> buckets;
    private final ColorBucket[]     bucketByTile;
    private final KdTree            tree;

    private ColorIndex(TileCatalog catalog, int quantization) {
        this.catalog = catalog;
        this.quantization = quantization;

        // Catalog order makes bucket ordinals ascend with each bucket's lowest member
        var grouped = new LinkedHashMap<Color, List<Integer>>();
        for (var tile : catalog) {
            grouped.computeIfAbsent(tile.averageColor().quantize(quantization), k -> new ArrayList<>())
                   .add(tile.index());
        }

        var bucketList = new ArrayList<ColorBucket>(grouped.size());
        var nodes = new ArrayList<KdTree.Node>(grouped.size());
        bucketByTile = new ColorBucket[catalog.size()];
        for (var entry : grouped.entrySet()) {
            var members = entry.getValue().stream().mapToInt(Integer::intValue).toArray();
            var bucket = new ColorBucket(entry.getKey(), members);
            nodes.add(new KdTree.Node(entry.getKey().toPoint(), bucketList.size()));
            bucketList.add(bucket);
            for (int member : members) {
                bucketByTile[member] = bucket;
            }
        }
        this.buckets = Collections.unmodifiableList(bucketList);
        this.tree = new KdTree(nodes);
        log.info("Indexed {} tiles into {} color buckets (quantization {})", catalog.size(), buckets.size(),
                 quantization);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Index the catalog grouping only identical average colors.
     */
    public static ColorIndex build(TileCatalog catalog) {
        return builder().build(catalog);
    }

    /**
     * The catalog index whose color is nearest the query. Pure function of the color.
     *
     * @param color query color
     * @return catalog index in [0, catalog size)
     */
    public int nearestMatch(Color color) {
        return nearestBucket(color).representative();
    }

    /**
     * The bucket whose key is nearest the query color.
     */
    public ColorBucket nearestBucket(Color color) {
        if (color == null) {
            throw new IllegalArgumentException("Color cannot be null");
        }
        return buckets.get(tree.findNearest(color.toPoint()).id());
    }

    /**
     * Resolve the nearest bucket and take its next member, spreading repeated matches over every tile of that color.
     *
     * @param color query color
     * @return catalog index of the selected tile
     */
    public int cyclingPick(Color color) {
        return nearestBucket(color).next();
    }

    /**
     * Rewind every bucket cursor to its first member.
     */
    public void resetCursors() {
        buckets.forEach(ColorBucket::reset);
    }

    public ColorBucket bucketOf(int catalogIndex) {
        if (catalogIndex < 0 || catalogIndex >= bucketByTile.length) {
            throw new IllegalArgumentException(
            "Catalog index " + catalogIndex + " out of range [0, " + bucketByTile.length + ")");
        }
        return bucketByTile[catalogIndex];
    }

    public List<ColorBucket> buckets() {
        return buckets;
    }

    public TileCatalog catalog() {
        return catalog;
    }

    public int quantization() {
        return quantization;
    }

    @Override
    public String toString() {
        return String.format("ColorIndex[tiles=%d, buckets=%d, quantization=%d]", catalog.size(), buckets.size(),
                             quantization);
    }
}
