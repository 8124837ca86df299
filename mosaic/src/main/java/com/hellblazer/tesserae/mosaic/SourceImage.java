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
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;

/**
 * A named candidate tile image, decoded on demand.
 *
 * @author hal.hildebrand
 */
public interface SourceImage {

    /**
     * Wrap an already decoded image.
     */
    static SourceImage of(String name, PixelBuffer image) {
        return new SourceImage() {
            @Override
            public PixelBuffer decode() {
                if (image == null) {
                    throw new DecodeFailureException(name, "no image data");
                }
                return image;
            }

            @Override
            public String name() {
                return name;
            }
        };
    }

    /**
     * @return the decoded pixels
     * @throws DecodeFailureException if the image is empty or cannot be decoded
     */
    PixelBuffer decode();

    String name();
}
