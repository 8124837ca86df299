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
import com.hellblazer.tesserae.mosaic.MosaicException.InvalidDimensionsException;
import com.hellblazer.tesserae.mosaic.image.Color;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class TileCatalogTest {

    @Test
    void testEmptyLibrary() {
        var e = assertThrows(EmptyLibraryException.class,
                             () -> TileCatalog.fromBuffers(List.of(), new TileSize(10, 10)));
        assertEquals(0, e.getRejected());
    }

    @Test
    void testSingleSolidImage() {
        var fill = new Color(40, 90, 160);
        var catalog = TileCatalog.fromBuffers(List.of(PixelBuffer.filled(2, 2, fill)), new TileSize(2, 2));

        assertEquals(1, catalog.size());
        var tile = catalog.get(0);
        assertEquals(0, tile.index());
        assertEquals(fill, tile.averageColor());
    }

    @Test
    void testTilesAreHardResized() {
        var images = List.of(PixelBuffer.filled(100, 20, new Color(255, 0, 0)),
                             PixelBuffer.filled(3, 9, new Color(0, 255, 0)),
                             PixelBuffer.filled(16, 12, new Color(0, 0, 255)));
        var size = new TileSize(16, 12);
        var catalog = TileCatalog.fromBuffers(images, size);

        assertEquals(3, catalog.size());
        assertEquals(size, catalog.tileSize());
        for (var tile : catalog) {
            assertEquals(16, tile.image().width());
            assertEquals(12, tile.image().height());
        }
        assertEquals(new Color(255, 0, 0), catalog.get(0).averageColor());
        assertEquals(new Color(0, 255, 0), catalog.get(1).averageColor());
        assertEquals(new Color(0, 0, 255), catalog.get(2).averageColor());
    }

    @Test
    void testAverageIsMeanOfPixels() {
        var image = PixelBuffer.of(2, 2, new int[] { 0x0A0000, 0x140000, 0x1E0000, 0x280000 });
        var catalog = TileCatalog.fromBuffers(List.of(image), new TileSize(2, 2));
        // (10 + 20 + 30 + 40) / 4
        assertEquals(new Color(25, 0, 0), catalog.get(0).averageColor());
    }

    @Test
    void testUndecodableImagesAreSkipped() {
        var sources = new ArrayList<SourceImage>();
        sources.add(broken("corrupt.png"));
        sources.add(SourceImage.of("red.png", PixelBuffer.filled(4, 4, new Color(255, 0, 0))));
        sources.add(broken("empty.jpg"));
        sources.add(SourceImage.of("blue.png", PixelBuffer.filled(4, 4, new Color(0, 0, 255))));

        var catalog = TileCatalog.build(sources, new TileSize(4, 4));

        assertEquals(2, catalog.size());
        assertEquals(0, catalog.get(0).index());
        assertEquals(1, catalog.get(1).index());
        assertEquals(new Color(0, 0, 255), catalog.get(1).averageColor());
    }

    @Test
    void testNullBuffersAreSkipped() {
        var catalog = TileCatalog.fromBuffers(Arrays.asList(null, PixelBuffer.filled(1, 1, Color.BLACK)),
                                              new TileSize(3, 3));
        assertEquals(1, catalog.size());
    }

    @Test
    void testOnlyUndecodableImages() {
        var e = assertThrows(EmptyLibraryException.class,
                             () -> TileCatalog.build(List.of(broken("a.png"), broken("b.png")), new TileSize(4, 4)));
        assertEquals(2, e.getRejected());
    }

    @Test
    void testInvalidTileSize() {
        assertThrows(InvalidDimensionsException.class, () -> new TileSize(0, 10));
        assertThrows(InvalidDimensionsException.class, () -> new TileSize(10, -1));
    }

    @Test
    void testTileSizeParsing() {
        assertEquals(new TileSize(50, 40), TileSize.parse("50x40"));
        assertEquals(new TileSize(50, 40), TileSize.parse(" 50 , 40 "));
        assertThrows(IllegalArgumentException.class, () -> TileSize.parse("50"));
        assertThrows(IllegalArgumentException.class, () -> TileSize.parse("axb"));
        assertThrows(InvalidDimensionsException.class, () -> TileSize.parse("0x5"));
    }

    @Test
    void testCatalogIsImmutable() {
        var catalog = TileCatalog.fromBuffers(List.of(PixelBuffer.filled(1, 1, Color.BLACK)), new TileSize(1, 1));
        assertThrows(UnsupportedOperationException.class, () -> catalog.tiles().remove(0));
    }

    private static SourceImage broken(String name) {
        return new SourceImage() {
            @Override
            public PixelBuffer decode() {
                throw new DecodeFailureException(name, "not an image");
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
