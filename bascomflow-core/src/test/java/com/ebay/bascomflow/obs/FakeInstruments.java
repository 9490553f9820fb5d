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

import com.ebay.bascomflow.core.Collaborator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stands in for the radio-astronomy tools, writing the artifacts each stage declares. Per-observation
 * behavior (pointing, occupancy, scripted exit codes) is configurable.
 *
 * @author Brendan McCarthy
 */
class FakeInstruments implements CollaboratorFactory {
    private final Map<String, Integer> pointings = new HashMap<>();
    private final Map<String, Double> occupancies = new HashMap<>();
    private final Map<String, int[]> exits = new HashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    final AtomicInteger invocations = new AtomicInteger(0);

    FakeInstruments pointing(String obsid, int pointing) {
        pointings.put(obsid, pointing);
        return this;
    }

    FakeInstruments occupancy(String obsid, double occupancy) {
        occupancies.put(obsid, occupancy);
        return this;
    }

    /**
     * Scripts the exit codes of one stage for one observation, the last code repeating.
     */
    FakeInstruments exits(String stage, String obsid, int... codes) {
        exits.put(stage + "/" + obsid, codes);
        return this;
    }

    int callsOf(String stage) {
        int total = 0;
        for (Map.Entry<String, AtomicInteger> next : calls.entrySet()) {
            if (next.getKey().startsWith(stage + "/")) {
                total += next.getValue().get();
            }
        }
        return total;
    }

    @Override
    public Collaborator create(String stage, Map<String, String> values) {
        return context -> {
            invocations.incrementAndGet();
            String obsid = values.get("obsid");
            String task = stage + "/" + obsid + "/" + values.get("variant");
            int call = calls.computeIfAbsent(task, k -> new AtomicInteger(0)).getAndIncrement();
            int[] codes = exits.get(stage + "/" + obsid);
            if (codes != null) {
                int code = codes[Math.min(call, codes.length - 1)];
                if (code != 0) {
                    return code;
                }
            }
            write(stage, obsid, values, Paths.get(values.get("dir")));
            return 0;
        };
    }

    private void write(String stage, String obsid, Map<String, String> values, Path dir) throws IOException {
        String variant = values.get("variant");
        switch (stage) {
            case ObsStages.METADATA:
                write(dir.resolve(ObsStages.metadataFile(obsid)), "{\"ew_pointing\": " + pointings.getOrDefault(obsid, 0)
                        + ", \"dataquality\": 0, \"tiles\": 128, \"bad_tiles\": [\"Tile011\"], \"dead_dipoles\": 16}");
                break;
            case ObsStages.DOWNLOAD:
                write(dir.resolve(ObsStages.RAW_DIR).resolve(obsid + "_01.fits"), "raw");
                break;
            case ObsStages.PREPROCESS:
                write(dir.resolve(ObsStages.measurementSet(obsid)).resolve("table.dat"), values.get("input"));
                write(dir.resolve(ObsStages.occupancyFile(obsid)),
                        "{\"total_occupancy\": " + occupancies.getOrDefault(obsid, 0.1) + "}");
                break;
            case ObsStages.CALIBRATE:
                for (String next : values.get("variants").split(",")) {
                    write(dir.resolve(CalSolution.fileName(obsid, next)), "solution " + next);
                }
                break;
            case ObsStages.APPLY:
                write(dir.resolve(ObsStages.calibratedSet(obsid, variant)).resolve("table.dat"), values.get("solution"));
                break;
            case ObsStages.CALQA:
                write(dir.resolve(ObsStages.calQaFile(obsid, variant)),
                        "{\"rms\": 0.5, \"unused_tiles\": [3, 17], \"convergence\": \"diverged\"}");
                break;
            case ObsStages.IMGQA:
                write(dir.resolve(ObsStages.imgQaFile(obsid, variant)), "{\"rms_all\": 1.5, \"pks_flux\": 12.25}");
                break;
            default:
                throw new IOException("Unknown stage " + stage);
        }
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }
}
