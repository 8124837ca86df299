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
package com.hellblazer.tesserae.mosaic.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.tesserae.mosaic.TileSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads a {@link MosaicConfiguration} from JSON.
 * <p>
 * Layout:
 *
 * <pre>
 * {
 *   "paths": {
 *     "targetImage": "base_image.png",
 *     "tileSource": "tiles_archive.zip",
 *     "outputDirectory": "mosaic_results"
 *   },
 *   "parameters": {
 *     "tileSize": "50x50",
 *     "densityFactor": 7.0,
 *     "threads": 1,
 *     "quantization": 1,
 *     "cycling": true
 *   }
 * }
 * </pre>
 *
 * A missing file or unparseable document yields the defaults. A missing value keeps its default; an invalid value,
 * including a fractional thread count or quantization step, is logged and replaced by its default.
 *
 * @author hal.hildebrand
 */
public class MosaicConfigurationLoader {
    private static final Logger log = LoggerFactory.getLogger(MosaicConfigurationLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "mosaic-config.json";

    private final ObjectMapper objectMapper;

    public MosaicConfigurationLoader() {
        this(new ObjectMapper());
    }

    public MosaicConfigurationLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Load the configuration file, falling back to defaults when it is absent or malformed.
     *
     * @param file JSON configuration file
     * @return the configuration
     */
    public MosaicConfiguration load(Path file) {
        if (!Files.exists(file)) {
            log.warn("Configuration file '{}' not found. Using default settings.", file);
            return MosaicConfiguration.defaultConfig();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            log.error("Error parsing configuration file '{}': {}. Using default settings.", file,
                      e.getOriginalMessage());
            return MosaicConfiguration.defaultConfig();
        } catch (IOException e) {
            log.error("Error reading configuration file '{}': {}. Using default settings.", file, e.getMessage());
            return MosaicConfiguration.defaultConfig();
        }
        log.info("Loaded configuration from '{}'", file);
        return fromJson(root);
    }

    /**
     * Apply a parsed JSON document onto the defaults.
     */
    public MosaicConfiguration fromJson(JsonNode root) {
        var builder = MosaicConfiguration.builder();
        if (root == null || !root.isObject()) {
            log.warn("Configuration is not a JSON object. Using default settings.");
            return builder.build();
        }

        var paths = root.path("paths");
        apply(paths, "targetImage", JsonNode::asText, text -> builder.withTargetImage(Paths.get(text)));
        apply(paths, "tileSource", JsonNode::asText, text -> builder.withTileSource(Paths.get(text)));
        apply(paths, "outputDirectory", JsonNode::asText, text -> builder.withOutputDirectory(Paths.get(text)));

        var parameters = root.path("parameters");
        apply(parameters, "tileSize", MosaicConfigurationLoader::tileSize, builder::withTileSize);
        apply(parameters, "densityFactor", MosaicConfigurationLoader::number, builder::withDensityFactor);
        apply(parameters, "threads", MosaicConfigurationLoader::integer, builder::withThreads);
        apply(parameters, "quantization", MosaicConfigurationLoader::integer, builder::withQuantization);
        apply(parameters, "cycling", MosaicConfigurationLoader::flag, builder::withCycling);

        var configuration = builder.build();
        log.debug("Configuration: {}", configuration);
        return configuration;
    }

    // Tile size is either "WxH" / "W,H" text or {"width": W, "height": H}
    private static TileSize tileSize(JsonNode node) {
        if (node.isObject()) {
            return new TileSize(integer(node.path("width")), integer(node.path("height")));
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("expected \"<width>x<height>\" but found " + node.getNodeType());
        }
        return TileSize.parse(node.asText());
    }

    private static Double number(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            return Double.parseDouble(node.asText().trim());
        }
        throw new IllegalArgumentException("expected a number but found " + node.getNodeType());
    }

    private static Integer integer(JsonNode node) {
        if (node.isNumber()) {
            if (!node.canConvertToExactIntegral() || !node.canConvertToInt()) {
                throw new IllegalArgumentException("expected an integer but found " + node.asText());
            }
            return node.asInt();
        }
        if (node.isTextual()) {
            return Integer.parseInt(node.asText().trim());
        }
        throw new IllegalArgumentException("expected an integer but found " + node.getNodeType());
    }

    private static Boolean flag(JsonNode node) {
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            var text = node.asText().trim();
            if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        throw new IllegalArgumentException("expected true or false but found " + node);
    }

    private static <T> void apply(JsonNode section, String field, Function<JsonNode, T> parser,
                                  Consumer<T> setter) {
        var node = section.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return;
        }
        try {
            setter.accept(parser.apply(node));
        } catch (RuntimeException e) {
            log.error("Error parsing {} '{}': {}. Using default.", field, node, e.getMessage());
        }
    }
}
