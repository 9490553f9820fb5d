/************************************************************************
 Copyright 2018 eBay Inc.
 Author/Developer: Brendan McCarthy

 Licensed under the Apache License, Version 2.0 (the "License");
 you may not use this file except in compliance with the License.
 You may obtain a copy of the License at

 https://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing, software
 distributed under the License is distributed on an "AS IS" BASIS,
 WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 See the License for the specific language governing permissions and
 limitations under the License.
 **************************************************************************/
package com.ebay.bascomflow.obs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the fields needed for gating and result tables from the JSON artifacts written by collaborators.
 *
 * @author Brendan McCarthy
 */
public final class ObsJson {
    private static final ObjectMapper M = new ObjectMapper();

    /**
     * Dipoles per tile, used to turn a dead dipole count into a fraction.
     */
    public static final int DIPOLES_PER_TILE = 16;

    private ObsJson() {
    }

    private static JsonNode read(Path file) throws IOException {
        JsonNode root = M.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object in " + file);
        }
        return root;
    }

    private static JsonNode require(JsonNode root, String field, Path file) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IOException(file + " lacks field " + field);
        }
        return node;
    }

    /**
     * Reads observation metadata. Expected fields are {@code ew_pointing}, {@code dataquality},
     * {@code tiles}, {@code bad_tiles} (array of tile names) and {@code dead_dipoles}.
     *
     * @param obsid observation
     * @param file  metadata JSON
     * @return metadata
     * @throws IOException if the file is unreadable or lacks a field
     */
    public static ObsMeta readMetadata(String obsid, Path file) throws IOException {
        JsonNode root = read(file);
        int pointing = require(root, "ew_pointing", file).asInt();
        int dataQuality = require(root, "dataquality", file).asInt();
        int tiles = require(root, "tiles", file).asInt();
        if (tiles <= 0) {
            throw new IOException(file + " has no tiles");
        }
        JsonNode badTiles = require(root, "bad_tiles", file);
        int dead = require(root, "dead_dipoles", file).asInt();
        double badFraction = badTiles.size() / (double) tiles;
        double deadFraction = dead / (double) (tiles * DIPOLES_PER_TILE);
        return new ObsMeta(obsid, file, pointing, dataQuality, badFraction, deadFraction);
    }

    /**
     * @param file occupancy JSON written by preprocessing
     * @return value of its {@code total_occupancy} field
     * @throws IOException if the file is unreadable or lacks the field
     */
    public static double readOccupancy(Path file) throws IOException {
        JsonNode node = require(read(file), "total_occupancy", file);
        if (!node.isNumber()) {
            throw new IOException(file + " has non-numeric total_occupancy " + node);
        }
        return node.asDouble();
    }

    /**
     * Reads named metrics from a QA report. A missing metric is returned as null, a numeric array as a list
     * of doubles, and anything non-numeric as NaN.
     *
     * @param file  QA JSON
     * @param names metrics to read
     * @return values by name, in the order of names
     * @throws IOException if the file is unreadable
     */
    public static Map<String, Object> readMetrics(Path file, List<String> names) throws IOException {
        JsonNode root = read(file);
        Map<String, Object> result = new LinkedHashMap<>();
        for (String next : names) {
            JsonNode node = root.get(next);
            if (node == null || node.isNull()) {
                result.put(next, null);
            } else if (node.isArray()) {
                List<Double> values = new ArrayList<>(node.size());
                for (JsonNode element : node) {
                    values.add(toDouble(element));
                }
                result.put(next, values);
            } else {
                result.put(next, toDouble(node));
            }
        }
        return result;
    }

    private static double toDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
