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

import com.hellblazer.tesserae.mosaic.MosaicException;
import com.hellblazer.tesserae.mosaic.TileSize;
import com.hellblazer.tesserae.mosaic.config.MosaicConfiguration;
import com.hellblazer.tesserae.mosaic.config.MosaicConfigurationLoader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Mosaic command line.
 * <p>
 * Usage:
 *
 * <pre>
 *   java MosaicCommandLine generate [options]
 *   java MosaicCommandLine help
 * </pre>
 *
 * The configuration file ({@value MosaicConfigurationLoader#DEFAULT_CONFIG_FILE} unless {@code --config} is given) is
 * loaded first; options override its values.
 */
public class MosaicCommandLine {

    public enum Mode {
        GENERATE("generate", "Generate a photo mosaic from a target image and a tile library"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public String getCommand() { return command; }
        public String getDescription() { return description; }

        public static Mode fromString(String command) {
            for (Mode mode : values()) {
                if (mode.command.equals(command)) {
                    return mode;
                }
            }
            return null;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 1;
        }
        Mode mode = Mode.fromString(args[0]);
        if (mode == null || mode == Mode.HELP) {
            printUsage(out);
            return mode == Mode.HELP ? 0 : 1;
        }

        long start = System.nanoTime();
        try {
            var configuration = parseArguments(args, new MosaicConfigurationLoader());
            out.println("Tesserae Mosaic");
            out.println("Mode: " + mode.getDescription());
            out.println("Config: " + configuration);
            out.println();

            var output = new MosaicGenerator(configuration).generate();
            out.println("Mosaic written to " + output);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            printUsage(err);
            return 1;
        } catch (MosaicException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("I/O failure: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            err.println("Execution failed: " + e.getMessage());
            e.printStackTrace(err);
            return 1;
        }
        out.printf("%nTotal execution time: %.2f seconds.%n", (System.nanoTime() - start) / 1e9);
        return 0;
    }

    /**
     * Load the configuration named by {@code --config} (or the default file) and apply the remaining options.
     */
    static MosaicConfiguration parseArguments(String[] args, MosaicConfigurationLoader loader) {
        Path configFile = Paths.get(MosaicConfigurationLoader.DEFAULT_CONFIG_FILE);
        for (int i = 1; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                configFile = Paths.get(getArgValue(args, ++i));
            }
        }

        var builder = loader.load(configFile).toBuilder();
        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                    i++;
                    break;
                case "--target":
                    builder.withTargetImage(Paths.get(getArgValue(args, ++i)));
                    break;
                case "--tiles":
                    builder.withTileSource(Paths.get(getArgValue(args, ++i)));
                    break;
                case "--output":
                    builder.withOutputDirectory(Paths.get(getArgValue(args, ++i)));
                    break;
                case "--tile-size":
                    builder.withTileSize(TileSize.parse(getArgValue(args, ++i)));
                    break;
                case "--density":
                    builder.withDensityFactor(Double.parseDouble(getArgValue(args, ++i)));
                    break;
                case "--threads":
                    builder.withThreads(Integer.parseInt(getArgValue(args, ++i)));
                    break;
                case "--quantization":
                    builder.withQuantization(Integer.parseInt(getArgValue(args, ++i)));
                    break;
                case "--no-cycle":
                    builder.withCycling(false);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown generate option: " + args[i]);
            }
        }
        return builder.build();
    }

    private static String getArgValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for argument: " + args[index - 1]);
        }
        return args[index];
    }

    private static void printUsage(PrintStream out) {
        out.println("Tesserae Mosaic");
        out.println("Usage: java MosaicCommandLine <mode> [options]");
        out.println();
        out.println("Modes:");

        for (Mode mode : Mode.values()) {
            if (mode != Mode.HELP) {
                out.printf("  %-12s %s%n", mode.getCommand(), mode.getDescription());
            }
        }

        out.println();
        out.println("generate [options]");
        out.println("  --config <file>       JSON configuration (default: " + MosaicConfigurationLoader.DEFAULT_CONFIG_FILE
                    + ")");
        out.println("  --target <file>       Target image");
        out.println("  --tiles <dir|zip>     Tile image directory or zip archive");
        out.println("  --output <dir>        Output directory");
        out.println("  --tile-size <W>x<H>   Tile size (default: " + MosaicConfiguration.DEFAULT_TILE_SIZE + ")");
        out.println("  --density <f>         Grid density factor (default: " + MosaicConfiguration.DEFAULT_DENSITY_FACTOR
                    + ")");
        out.println("  --threads <n>         Assembly threads (default: 1)");
        out.println("  --quantization <n>    Color bucket band width (default: 1, exact colors)");
        out.println("  --no-cycle            Always place the nearest tile instead of rotating through matches");
    }
}
