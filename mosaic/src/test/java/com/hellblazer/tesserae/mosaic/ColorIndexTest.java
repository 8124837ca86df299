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

import com.hellblazer.tesserae.mosaic.image.Color;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ColorIndexTest {

    private static TileCatalog catalogOf(Color... colors) {
        var images = new ArrayList<PixelBuffer>();
        for (var color : colors) {
            images.add(PixelBuffer.filled(2, 2, color));
        }
        return TileCatalog.fromBuffers(images, new TileSize(2, 2));
    }

    @Test
    void testNearestMatchAgreesWithLinearScan() {
        var random = new Random(7);
        var colors = new Color[300];
        for (int i = 0; i < colors.length; i++) {
            // Narrow range to force duplicate colors and distance ties
            colors[i] = new Color(random.nextInt(8) * 32, random.nextInt(8) * 32, random.nextInt(8) * 32);
        }
        var catalog = catalogOf(colors);
        var index = ColorIndex.build(catalog);

        for (int q = 0; q < 500; q++) {
            var query = new Color(random.nextInt(256), random.nextInt(256), random.nextInt(256));
            int expected = 0;
            for (int i = 1; i < colors.length; i++) {
                if (colors[i].distanceSquared(query) < colors[expected].distanceSquared(query)) {
                    expected = i;
                }
            }
            int match = index.nearestMatch(query);
            assertEquals(expected, match, "query " + query);
            assertEquals(match, index.nearestMatch(query));
        }
    }

    @Test
    void testSingleTileAlwaysPicked() {
        var index = ColorIndex.build(catalogOf(new Color(100, 150, 200)));
        var random = new Random(3);
        for (int i = 0; i < 50; i++) {
            var query = new Color(random.nextInt(256), random.nextInt(256), random.nextInt(256));
            assertEquals(0, index.cyclingPick(query));
        }
        assertEquals(1, index.bucketOf(0).size());
    }

    @Test
    void testEquivalentTilesAlternate() {
        var color = new Color(10, 20, 30);
        var index = ColorIndex.build(catalogOf(color, color));
        var query = new Color(12, 18, 33);

        assertEquals(0, index.cyclingPick(query));
        assertEquals(1, index.cyclingPick(query));
        assertEquals(0, index.cyclingPick(query));
        assertEquals(1, index.cyclingPick(query));
        assertEquals(0, index.nearestMatch(query));
    }

    @Test
    void testCyclingIsPerBucket() {
        var red = new Color(255, 0, 0);
        var blue = new Color(0, 0, 255);
        var index = ColorIndex.build(catalogOf(red, blue, red, blue, red));

        assertEquals(3, index.bucketOf(0).size());
        assertSame(index.bucketOf(0), index.bucketOf(4));
        assertEquals(2, index.buckets().size());

        assertEquals(0, index.cyclingPick(red));
        assertEquals(1, index.cyclingPick(blue));
        assertEquals(2, index.cyclingPick(red));
        assertEquals(4, index.cyclingPick(red));
        assertEquals(3, index.cyclingPick(blue));
        assertEquals(0, index.cyclingPick(red));
    }

    @Test
    void testEquidistantColorsResolveToLowestIndex() {
        var index = ColorIndex.build(catalogOf(new Color(20, 0, 0), new Color(0, 0, 0)));
        assertEquals(0, index.nearestMatch(new Color(10, 0, 0)));

        var reversed = ColorIndex.build(catalogOf(new Color(0, 0, 0), new Color(20, 0, 0)));
        assertEquals(0, reversed.nearestMatch(new Color(10, 0, 0)));
    }

    @Test
    void testResetCursors() {
        var color = new Color(1, 1, 1);
        var index = ColorIndex.build(catalogOf(color, color, color));
        index.cyclingPick(color);
        index.cyclingPick(color);
        assertEquals(2, index.bucketOf(0).cursor());

        index.resetCursors();
        assertEquals(0, index.bucketOf(0).cursor());
        assertEquals(0, index.cyclingPick(color));
    }

    @Test
    void testQuantizationGroupsNearColors() {
        var catalog = catalogOf(new Color(16, 16, 16), new Color(18, 20, 22), new Color(200, 200, 200));

        var exact = ColorIndex.build(catalog);
        assertEquals(3, exact.buckets().size());

        var banded = ColorIndex.builder().withQuantization(8).build(catalog);
        assertEquals(2, banded.buckets().size());
        assertSame(banded.bucketOf(0), banded.bucketOf(1));
        assertEquals(0, banded.cyclingPick(new Color(17, 17, 17)));
        assertEquals(1, banded.cyclingPick(new Color(17, 17, 17)));
        assertEquals(2, banded.nearestMatch(new Color(250, 250, 250)));

        assertThrows(IllegalArgumentException.class, () -> ColorIndex.builder().withQuantization(0));
    }

    @Test
    void testConcurrentPicksSpreadEvenly() throws Exception {
        var color = new Color(50, 60, 70);
        var index = ColorIndex.build(catalogOf(color, color, color, color));
        int threads = 8;
        int picksPerThread = 1000;

        var counts = new ConcurrentHashMap<Integer, AtomicInteger>();
        var start = new CountDownLatch(1);
        var executor = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < picksPerThread; i++) {
                        counts.computeIfAbsent(index.cyclingPick(color), k -> new AtomicInteger()).incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(4, counts.size());
        for (var count : counts.values()) {
            assertEquals(threads * picksPerThread / 4, count.get());
        }
        assertEquals(0, index.bucketOf(0).cursor());
    }

    @Test
    void testBucketMembersAscend() {
        var a = new Color(9, 9, 9);
        var index = ColorIndex.build(catalogOf(a, new Color(0, 0, 0), a, a));
        var bucket = index.bucketOf(3);
        assertArrayEquals(new int[] { 0, 2, 3 }, bucket.members());
        assertEquals(0, bucket.representative());
        assertEquals(a, bucket.key());
        assertTrue(bucket.contains(2));
        assertFalse(bucket.contains(1));
        assertThrows(IllegalArgumentException.class, () -> index.bucketOf(4));
    }

    @Test
    void testMatchesAreInRange() {
        var index = ColorIndex.build(catalogOf(new Color(1, 2, 3), new Color(250, 240, 230)));
        for (var query : List.of(Color.BLACK, new Color(255, 255, 255), new Color(128, 128, 128))) {
            int match = index.nearestMatch(query);
            assertTrue(match >= 0 && match < 2);
        }
    }
}
