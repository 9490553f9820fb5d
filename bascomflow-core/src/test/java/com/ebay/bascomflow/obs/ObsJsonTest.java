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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.*;

/**
 * Tests reading the JSON artifacts of the observation tools.
 *
 * @author Brendan McCarthy
 */
public class ObsJsonTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private Path file(String json) throws IOException {
        Path path = folder.newFile().toPath();
        Files.write(path, json.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    @Test
    public void readsMetadataFractions() throws IOException {
        Path path = file("{\"ew_pointing\": -1, \"dataquality\": 1, \"tiles\": 128,"
                + " \"bad_tiles\": [\"Tile011\", \"Tile012\", \"Tile051\", \"Tile104\"], \"dead_dipoles\": 64}");
        ObsMeta meta = ObsJson.readMetadata("1061316296", path);
        assertEquals("1061316296", meta.getObsid());
        assertEquals(-1, meta.getPointing());
        assertEquals(1, meta.getDataQuality());
        assertEquals(0.03125, meta.getBadTileFraction(), 1e-12);
        assertEquals(0.03125, meta.getDeadDipoleFraction(), 1e-12);
        assertEquals(path, meta.getFile());
    }

    @Test
    public void missingMetadataFieldIsNamed() throws IOException {
        Path path = file("{\"ew_pointing\": 0, \"dataquality\": 1, \"tiles\": 128, \"bad_tiles\": []}");
        try {
            ObsJson.readMetadata("1", path);
            fail("Expected IOException");
        } catch (IOException e) {
            assertThat(e.getMessage(), containsString("lacks field dead_dipoles"));
        }
    }

    @Test(expected = IOException.class)
    public void notAnObject() throws IOException {
        ObsJson.readOccupancy(file("[0.1]"));
    }

    @Test
    public void readsMetrics() throws IOException {
        Path path = file("{\"rms\": 0.5, \"unused_tiles\": [3, \"x\"], \"convergence\": \"1e-6\", \"extra\": 1}");
        Map<String, Object> metrics = ObsJson.readMetrics(path, Arrays.asList("rms", "unused_tiles", "convergence", "absent"));

        assertEquals(Arrays.asList("rms", "unused_tiles", "convergence", "absent"), Arrays.asList(metrics.keySet().toArray()));
        assertEquals(0.5, (Double) metrics.get("rms"), 0);
        List<?> tiles = (List<?>) metrics.get("unused_tiles");
        assertEquals(3.0, (Double) tiles.get(0), 0);
        assertTrue(Double.isNaN((Double) tiles.get(1)));
        assertEquals(1e-6, (Double) metrics.get("convergence"), 0);
        assertNull(metrics.get("absent"));
    }
}
