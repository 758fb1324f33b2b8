/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.viewport.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered camera profiles, one per quality level. Level 0 is the cheapest pass; each following level is rendered
 * at a higher resolution.
 * <p>
 * Ladders are loaded from a JSON array:
 * <pre>
 * [
 *   { "width": 64,   "height": 36,  "fov": 35.98 },
 *   { "width": 1280, "height": 720, "fov": 35.98 }
 * ]
 * </pre>
 *
 * @author hal.hildebrand
 */
public record QualityLadder(List<CameraProfile> profiles) {

    private static final Logger log = LoggerFactory.getLogger(QualityLadder.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Vertical FOV matching a 60 degree horizontal FOV at 16:9, the default viewport camera.
     */
    public static final double DEFAULT_FOV = 35.98339777135764;

    public QualityLadder {
        if (profiles == null || profiles.isEmpty()) {
            throw new IllegalArgumentException("Quality ladder requires at least one camera profile");
        }
        profiles = List.copyOf(profiles);
    }

    /**
     * Five levels from 0.05x to full 1280x720 resolution.
     */
    public static QualityLadder defaultLadder() {
        return new QualityLadder(List.of(
            new CameraProfile(64, 36, DEFAULT_FOV),
            new CameraProfile(128, 72, DEFAULT_FOV),
            new CameraProfile(320, 180, DEFAULT_FOV),
            new CameraProfile(640, 360, DEFAULT_FOV),
            new CameraProfile(1280, 720, DEFAULT_FOV)
        ));
    }

    /**
     * Load a ladder from a JSON file.
     *
     * @param file the ladder file, or null for {@link #defaultLadder()}
     * @throws IOException if the file cannot be read or does not describe a valid ladder
     */
    public static QualityLadder load(Path file) throws IOException {
        if (file == null) {
            return defaultLadder();
        }
        try (var is = Files.newInputStream(file)) {
            var ladder = parse(is);
            log.info("Loaded quality ladder from {}: {} levels", file, ladder.size());
            return ladder;
        }
    }

    /**
     * Parse a ladder from a JSON stream.
     */
    public static QualityLadder parse(InputStream is) throws IOException {
        var root = objectMapper.readTree(is);
        if (root == null || !root.isArray()) {
            throw new IOException("Quality ladder must be a JSON array of camera profiles");
        }

        var profiles = new ArrayList<CameraProfile>();
        var index = 0;
        for (var node : root) {
            try {
                profiles.add(new CameraProfile(
                    requireInt(node, "width", index),
                    requireInt(node, "height", index),
                    requireDouble(node, "fov", index)
                ));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid camera profile " + index + ": " + e.getMessage(), e);
            }
            index++;
        }
        if (profiles.isEmpty()) {
            throw new IOException("Quality ladder is empty");
        }
        return new QualityLadder(profiles);
    }

    private static int requireInt(JsonNode node, String field, int index) throws IOException {
        var value = node.get(field);
        if (value == null || !value.canConvertToInt()) {
            throw new IOException("Camera profile " + index + " is missing integer '" + field + "'");
        }
        return value.asInt();
    }

    private static double requireDouble(JsonNode node, String field, int index) throws IOException {
        var value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new IOException("Camera profile " + index + " is missing numeric '" + field + "'");
        }
        return value.asDouble();
    }

    public CameraProfile profile(int qualityLevel) {
        return profiles.get(qualityLevel);
    }

    public int size() {
        return profiles.size();
    }
}
