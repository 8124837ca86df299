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
package com.hellblazer.tesserae.mosaic.app;

import com.hellblazer.tesserae.mosaic.MosaicException.InvalidDimensionsException;
import com.hellblazer.tesserae.mosaic.TileSize;
import com.hellblazer.tesserae.mosaic.config.MosaicConfiguration;
import com.hellblazer.tesserae.mosaic.config.MosaicConfigurationLoader;
import com.hellblazer.tesserae.mosaic.image.Color;
import com.hellblazer.tesserae.mosaic.image.PixelBuffer;
import com.hellblazer.tesserae.mosaic.io.ImageCodec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class MosaicCommandLineTest {

    private final MosaicConfigurationLoader loader = new MosaicConfigurationLoader();

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @TempDir
    Path tempDir;

    private int run(String... args) {
        return MosaicCommandLine.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                                     new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void testOptionsOverrideConfigFile() throws IOException {
        var configFile = tempDir.resolve("settings.json");
        Files.writeString(configFile, "{\"paths\": {\"targetImage\": \"from-file.png\", \"tileSource\": \"lib\"},"
                                      + " \"parameters\": {\"tileSize\": \"20x20\", \"threads\": 3}}");

        var config = MosaicCommandLine.parseArguments(
        new String[] { "generate", "--config", configFile.toString(), "--target", "cli.png", "--tile-size", "16x9",
                       "--density", "3.5", "--quantization", "16", "--output", "out" }, loader);

        assertEquals(Paths.get("cli.png"), config.getTargetImage());
        assertEquals(Paths.get("lib"), config.getTileSource());
        assertEquals(Paths.get("out"), config.getOutputDirectory());
        assertEquals(new TileSize(16, 9), config.getTileSize());
        assertEquals(3.5, config.getDensityFactor());
        assertEquals(3, config.getThreads());
        assertEquals(16, config.getQuantization());
        assertTrue(config.isCycling());
    }

    @Test
    void testNoCycleFlag() {
        var config = MosaicCommandLine.parseArguments(
        new String[] { "generate", "--config", tempDir.resolve("none.json").toString(), "--no-cycle", "--threads",
                       "2" }, loader);
        assertFalse(config.isCycling());
        assertEquals(2, config.getThreads());
        assertTrue(config.outputFileName(LocalDateTime.of(2025, 1, 1, 0, 0)).startsWith("photo_mosaic_2025"));
    }

    @Test
    void testMissingConfigFileUsesDefaults() {
        var config = MosaicCommandLine.parseArguments(
        new String[] { "generate", "--config", tempDir.resolve("none.json").toString(), "--threads", "2" }, loader);
        assertEquals(MosaicConfiguration.DEFAULT_TARGET_IMAGE, config.getTargetImage());
        assertEquals(MosaicConfiguration.DEFAULT_TILE_SIZE, config.getTileSize());
        assertEquals(2, config.getThreads());
    }

    @Test
    void testInvalidOptions() {
        var missing = tempDir.resolve("none.json").toString();
        assertThrows(IllegalArgumentException.class,
                     () -> MosaicCommandLine.parseArguments(new String[] { "generate", "--config", missing,
                                                                           "--bogus" }, loader));
        assertThrows(IllegalArgumentException.class,
                     () -> MosaicCommandLine.parseArguments(new String[] { "generate", "--config", missing,
                                                                           "--density" }, loader));
        assertThrows(IllegalArgumentException.class,
                     () -> MosaicCommandLine.parseArguments(new String[] { "generate", "--config", missing,
                                                                           "--threads", "many" }, loader));
        assertThrows(InvalidDimensionsException.class,
                     () -> MosaicCommandLine.parseArguments(new String[] { "generate", "--config", missing,
                                                                           "--tile-size", "0x10" }, loader));
    }

    @Test
    void testHelpAndUsage() {
        assertEquals(0, run("help"));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("--tile-size"));
        assertEquals(1, run());
        assertEquals(1, run("paint"));
    }

    @Test
    void testUnknownOptionReportsError() {
        assertEquals(1, run("generate", "--config", tempDir.resolve("none.json").toString(), "--frobnicate"));
        var errors = err.toString(StandardCharsets.UTF_8);
        assertTrue(errors.contains("Unknown generate option: --frobnicate"));
        assertTrue(errors.contains("Usage:"));
    }

    @Test
    void testMissingTargetFails() {
        assertEquals(1, run("generate", "--config", tempDir.resolve("none.json").toString(), "--target",
                            tempDir.resolve("absent.png").toString(), "--tiles", tempDir.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("does not exist"));
    }

    @Test
    void testGenerate() throws IOException {
        var target = tempDir.resolve("target.png");
        ImageCodec.write(PixelBuffer.filled(30, 20, new Color(200, 40, 40)), target);
        var tiles = Files.createDirectories(tempDir.resolve("tiles"));
        ImageCodec.write(PixelBuffer.filled(4, 4, new Color(210, 30, 30)), tiles.resolve("red.png"));
        ImageCodec.write(PixelBuffer.filled(4, 4, new Color(10, 10, 10)), tiles.resolve("black.png"));
        var results = tempDir.resolve("results");

        assertEquals(0, run("generate", "--config", tempDir.resolve("none.json").toString(), "--target",
                            target.toString(), "--tiles", tiles.toString(), "--output", results.toString(),
                            "--tile-size", "5x5", "--density", "1"), err.toString(StandardCharsets.UTF_8));

        try (var files = Files.list(results)) {
            var names = files.map(f -> f.getFileName().toString()).collect(Collectors.toList());
            assertEquals(1, names.size());
            assertTrue(names.get(0).matches("photo_mosaic_cycled_\\d{8}_\\d{6}_tile5x5_res1p0\\.jpg"), names.get(0));
        }
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("Total execution time"));
    }
}
