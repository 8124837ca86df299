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

/**
 * Sealed exception hierarchy for mosaic construction.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link EmptyLibraryException} - no usable tile images remain after filtering</li>
 * <li>{@link InvalidDimensionsException} - non-positive image, tile or density parameters</li>
 * <li>{@link DecodeFailureException} - a single source image could not be decoded</li>
 * <li>{@link InvalidSourceException} - an input path is missing or of an unsupported kind</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class MosaicException extends RuntimeException
    permits MosaicException.EmptyLibraryException,
            MosaicException.InvalidDimensionsException,
            MosaicException.DecodeFailureException,
            MosaicException.InvalidSourceException {

    public MosaicException(String message) {
        super(message);
    }

    public MosaicException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a tile catalog would contain no tiles.
     */
    public static final class EmptyLibraryException extends MosaicException {
        private final int rejected;

        /**
         * @param rejected number of source images that were supplied but unusable
         */
        public EmptyLibraryException(int rejected) {
            super(rejected == 0 ? "No tile images were supplied"
                                : String.format("No valid tile images were loaded (%d rejected)", rejected));
            this.rejected = rejected;
        }

        public int getRejected() {
            return rejected;
        }
    }

    /**
     * Thrown when a size or density parameter is not positive. Nothing is allocated before this is raised.
     */
    public static final class InvalidDimensionsException extends MosaicException {

        public InvalidDimensionsException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when an individual source image cannot be decoded. Recovered by skipping the image.
     */
    public static final class DecodeFailureException extends MosaicException {
        private final String source;

        public DecodeFailureException(String source, String reason) {
            super("Cannot decode " + source + ": " + reason);
            this.source = source;
        }

        public DecodeFailureException(String source, Throwable cause) {
            super("Cannot decode " + source + ": " + cause.getMessage(), cause);
            this.source = source;
        }

        /**
         * @return name of the image that failed
         */
        public String getSource() {
            return source;
        }
    }

    /**
     * Thrown when an input path does not exist or is neither a directory nor a zip archive.
     */
    public static final class InvalidSourceException extends MosaicException {

        public InvalidSourceException(String message) {
            super(message);
        }

        public InvalidSourceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
