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

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catalog indices sharing one color key, with a round-robin cursor. Every {@link #next()} returns the member at the
 * cursor and advances it, wrapping modulo the bucket size. The cursor update is atomic, so concurrent callers observe
 * a single total order of picks and no advancement is lost.
 *
 * @author hal.hildebrand
 */
public final class ColorBucket {

    private final Color         key;
    private final int[]         members;
    private final AtomicInteger cursor = new AtomicInteger();

    ColorBucket(Color key, int[] members) {
        if (members.length == 0) {
            throw new IllegalArgumentException("A color bucket needs at least one member");
        }
        this.key = key;
        this.members = members;
    }

    /**
     * @return the catalog index at the cursor; the cursor moves to the following member
     */
    public int next() {
        return members[cursor.getAndUpdate(c -> (c + 1) % members.length)];
    }

    /**
     * @return the catalog index the next pick will return, without advancing
     */
    public int peek() {
        return members[cursor.get()];
    }

    public int cursor() {
        return cursor.get();
    }

    public void reset() {
        cursor.set(0);
    }

    public Color key() {
        return key;
    }

    /**
     * @return lowest catalog index in the bucket
     */
    public int representative() {
        return members[0];
    }

    /**
     * @return member catalog indices in ascending order
     */
    public int[] members() {
        return members.clone();
    }

    public boolean contains(int catalogIndex) {
        return Arrays.binarySearch(members, catalogIndex) >= 0;
    }

    public int size() {
        return members.length;
    }

    @Override
    public String toString() {
        return String.format("ColorBucket[key=%s, members=%s, cursor=%d]", key, Arrays.toString(members),
                             cursor.get());
    }
}
