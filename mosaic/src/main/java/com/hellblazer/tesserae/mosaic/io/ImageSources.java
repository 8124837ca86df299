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
import com.hellblazer.tesserae.mosaic.MosaicException.InvalidSourceException;
import com.hellblazer.tesserae.mosaic.SourceImage;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Enumerates candidate tile images from a directory or a zip archive.
 * <p>
 * Only files with an image extension are considered; zip entries under {@code __MACOSX} are ignored. Directory
 * entries are listed in file name order, zip entries in archive order. Decoding is deferred to
 * {@link SourceImage#decode()}, so unreadable files surface as {@link DecodeFailureException} and can be skipped by
 * the catalog.
 *
 * @author hal.hildebrand
 */
public final class ImageSources {
    private static final Logger log = LoggerFactory.getLogger(ImageSources.class);

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif", "tiff");

    /** Largest uncompressed zip entry buffered for decoding */
    public static final int MAX_ENTRY_BYTES = 64 * 1024 * 1024;

    private static final String MAC_METADATA = "__MACOSX";

    private ImageSources() {
    }

    /**
     * Open a directory or zip archive of tile images.
     *
     * @throws InvalidSourceException if the path is neither
     */
    public static List<SourceImage> open(Path source) {
        if (Files.isDirectory(source)) {
            return directory(source);
        }
        if (isZipFile(source)) {
            return zip(source);
        }
        throw new InvalidSourceException(
        "Invalid tile source '" + source + "'. Must be a directory or a zip file.");
    }

    public static List<SourceImage> directory(Path directory) {
        log.info("Loading tiles from directory: {}", directory);
        try (var files = Files.list(directory)) {
            var images = files.filter(Files::isRegularFile)
                              .filter(f -> isImageName(f.getFileName().toString()))
                              .sorted(Comparator.comparing(f -> f.getFileName().toString()))
                              .map(ImageSources::fileSource)
                              .collect(Collectors.toList());
            log.debug("Found {} candidate images in {}", images.size(), directory);
            return images;
        } catch (IOException e) {
            throw new InvalidSourceException("Cannot list tile directory " + directory, e);
        }
    }

    /**
     * Read every image entry of the archive into memory. The archive is closed before returning. Entries larger than
     * {@link #MAX_ENTRY_BYTES} are skipped.
     */
    public static List<SourceImage> zip(Path archive) {
        return zip(archive, MAX_ENTRY_BYTES);
    }

    static List<SourceImage> zip(Path archive, int maxEntryBytes) {
        log.info("Loading tiles from zip file: {}", archive);
        var images = new ArrayList<SourceImage>();
        try (var zip = new ZipFile(archive.toFile())) {
            var entries = zip.entries();
            while (entries.hasMoreElements()) {
                var entry = entries.nextElement();
                var name = entry.getName();
                if (entry.isDirectory() || name.startsWith(MAC_METADATA) || !isImageName(name)) {
                    continue;
                }
                if (entry.getSize() > maxEntryBytes) {
                    log.warn("Skipping zip entry {}: {} bytes exceeds the {} byte limit", name, entry.getSize(),
                             maxEntryBytes);
                    continue;
                }
                try (var in = zip.getInputStream(entry)) {
                    // Declared sizes can lie; read one byte past the limit to detect oversized content
                    var bytes = in.readNBytes(maxEntryBytes + 1);
                    if (bytes.length > maxEntryBytes) {
                        log.warn("Skipping zip entry {}: content exceeds the {} byte limit", name, maxEntryBytes);
                        continue;
                    }
                    images.add(bytesSource(name, bytes));
                } catch (IOException e) {
                    log.warn("Skipping zip entry {}: {}", name, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new InvalidSourceException("Cannot read tile archive " + archive, e);
        }
        log.debug("Found {} candidate images in {}", images.size(), archive);
        return images;
    }

    public static boolean isImageName(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 && IMAGE_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    static boolean isZipFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return false;
        }
        try (var zip = new ZipFile(path.toFile())) {
            return true;
        } catch (ZipException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    private static SourceImage fileSource(Path file) {
        return new SourceImage() {
            @Override
            public PixelBuffer decode() {
                try {
                    return ImageCodec.read(file);
                } catch (IOException e) {
                    throw new DecodeFailureException(file.toString(), e);
                }
            }

            @Override
            public String name() {
                return file.toString();
            }
        };
    }

    private static SourceImage bytesSource(String name, byte[] bytes) {
        return new SourceImage() {
            @Override
            public PixelBuffer decode() {
                return ImageCodec.decode(name, bytes);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }
}
