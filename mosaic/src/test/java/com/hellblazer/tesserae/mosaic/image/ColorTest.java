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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class ColorTest {

    @Test
    void testPacking() {
        var color = Color.ofRgb(0xFF123456);
        assertEquals(new Color(0x12, 0x34, 0x56), color);
        assertEquals(0x123456, color.toRgb());
        assertEquals("#123456", color.toString());
    }

    @Test
    void testDistance() {
        assertEquals(0, new Color(1, 2, 3).distanceSquared(new Color(1, 2, 3)));
        assertEquals(3 * 255 * 255, Color.BLACK.distanceSquared(new Color(255, 255, 255)));
        assertEquals(1 + 4 + 9, new Color(10, 10, 10).distanceSquared(new Color(11, 8, 13)));
    }

    @Test
    void testQuantize() {
        var color = new Color(17, 0, 255);
        assertSame(color, color.quantize(1));
        assertEquals(new Color(19, 3, 251), color.quantize(8));
        assertEquals(new Color(127, 127, 127), new Color(0, 100, 255).quantize(256));
        assertThrows(IllegalArgumentException.class, () -> color.quantize(0));
    }

    @Test
    void testChannelRange() {
        assertThrows(IllegalArgumentException.class, () -> new Color(256, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Color(0, -1, 0));
    }
}
