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
package com.hellblazer.tesserae.mosaic.io;

import com.hellblazer.tesserae.mosaic.MosaicException.DecodeFailureException;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Image file decoding and encoding through {@link ImageIO}.
 *
 * @author hal.hildebrand
 */
public final class ImageCodec {
    private static final Logger log = LoggerFactory.getLogger(ImageCodec.class);

    private ImageCodec() {
    }

    /**
     * Decode an in-memory image file.
     *
     * @param name  name reported on failure
     * @param bytes encoded image
     * @throws DecodeFailureException if the bytes are empty or no reader understands them
     */
    public static PixelBuffer decode(String name, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new DecodeFailureException(name, "empty file");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new DecodeFailureException(name, e);
        }
        if (image == null) {
            throw new DecodeFailureException(name, "unrecognized image format");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new DecodeFailureException(name, "image has no pixels");
        }
        return PixelBuffer.fromImage(image);
    }

    /**
     * Read and decode an image file.
     *
     * @throws IOException            if the file cannot be read
     * @throws DecodeFailureException if the contents are not a decodable image
     */
    public static PixelBuffer read(Path file) throws IOException {
        return decode(file.toString(), Files.readAllBytes(file));
    }

    /**
     * Encode the image in the format named by the file extension, creating parent directories as needed.
     *
     * @throws IOException if no writer handles the format or the file cannot be written
     */
    public static void write(PixelBuffer image, Path file) throws IOException {
        var format = formatOf(file);
        var parent = file.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.info("Created output directory: {}", parent);
        }
        if (!ImageIO.write(image.toImage(), format, file.toFile())) {
            throw new IOException("No image writer for format '" + format + "'");
        }
        log.info("Wrote {}x{} {} image to {}", image.width(), image.height(), format, file);
    }

    static String formatOf(Path file) {
        var name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            throw new IllegalArgumentException("Cannot determine image format of " + file);
        }
        var extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return switch (extension) {
        case "jpeg" -> "jpg";
        case "tif" -> "tiff";
        default -> extension;
        };
    }
}
