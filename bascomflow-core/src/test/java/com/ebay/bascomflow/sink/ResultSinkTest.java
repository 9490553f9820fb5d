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
package com.ebay.bascomflow.sink;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

/**
 * Tests that finished tables are sorted, deduplicated and independent of arrival order.
 *
 * @author Brendan McCarthy
 */
public class ResultSinkTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private ResultSink sink;

    @Before
    public void before() throws IOException {
        sink = new ResultSink(folder.newFolder("results").toPath().resolve("tables"));
    }

    private static List<String> lines(SinkArtifact artifact) throws IOException {
        return Files.readAllLines(artifact.getPath(), StandardCharsets.UTF_8);
    }

    private static Map<String, Object> row(Object... pairs) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Test
    public void rowsAreSortedByKey() throws IOException {
        sink.table("cal_qa", 2, "obsid", "variant", "rms");
        sink.record("cal_qa", row("obsid", "B", "variant", "v1", "rms", 2.0));
        sink.record("cal_qa", row("obsid", "A", "variant", "v2", "rms", 1.5));
        sink.record("cal_qa", row("obsid", "A", "variant", "v1", "rms", 1.0));
        sink.record("cal_qa", row("obsid", "C", "variant", "v1", "rms", 3.0));

        List<SinkArtifact> artifacts = sink.finish();
        assertEquals(1, artifacts.size());
        SinkArtifact artifact = artifacts.get(0);
        assertEquals("cal_qa", artifact.getTable());
        assertEquals(4, artifact.getRows());
        assertEquals(sink.getDirectory().resolve("cal_qa.tsv"), artifact.getPath());
        assertEquals(Arrays.asList(
                "obsid\tvariant\trms",
                "A\tv1\t1.0",
                "A\tv2\t1.5",
                "B\tv1\t2.0",
                "C\tv1\t3.0"), lines(artifact));
        assertFalse(Files.exists(sink.getDirectory().resolve("cal_qa.tsv.part")));
    }

    @Test
    public void missingValuesAreMarked() throws IOException {
        sink.table("img_qa", 1, "obsid", "rms_all", "pks_flux", "pks_rms");
        sink.record("img_qa", row("obsid", "A", "rms_all", Double.NaN, "pks_flux", null));

        assertEquals(Arrays.asList("obsid\trms_all\tpks_flux\tpks_rms", "A\tNA\tNA\tNA"), lines(sink.finish().get(0)));
    }

    @Test
    public void listsAreCommaJoined() throws IOException {
        ResultTable table = sink.table("cal_qa", 1, "obsid", "unused_tiles", "note");
        table.record("A", Arrays.asList(3.0, 17.0), "bad\ttab");

        assertEquals("A\t3.0,17.0\tbad tab", lines(sink.finish().get(0)).get(1));
    }

    @Test
    public void duplicateRowsAndKeysAreDropped() throws IOException {
        ResultTable table = sink.table("failures", 1, "entity", "reason");
        table.record("A", "same");
        table.record("A", "same");
        table.record("B", "first");
        table.record("B", "second");

        SinkArtifact artifact = sink.finish().get(0);
        assertEquals(2, artifact.getRows());
        assertEquals(Arrays.asList("entity\treason", "A\tsame", "B\tfirst"), lines(artifact));
    }

    @Test
    public void concurrentArrivalGivesSameFile() throws Exception {
        ResultTable table = sink.table("cal_qa", 1, "obsid", "rms");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 50; i++) {
            String obsid = String.format("%04d", 49 - i);
            double rms = i;
            executor.execute(() -> table.record(obsid, rms));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        List<String> lines = lines(sink.finish().get(0));
        assertEquals(51, lines.size());
        assertEquals("0000\t49.0", lines.get(1));
        assertEquals("0049\t0.0", lines.get(50));
    }

    @Test
    public void emptyTableHasHeaderOnly() throws IOException {
        sink.table("failures", 3, "entity", "stage", "variant", "status");
        SinkArtifact artifact = sink.finish().get(0);
        assertEquals(0, artifact.getRows());
        assertEquals(Collections.singletonList("entity\tstage\tvariant\tstatus"), lines(artifact));
    }

    @Test
    public void redeclaringSameHeaderReturnsSameTable() {
        ResultTable first = sink.table("cal_qa", 1, "obsid", "rms");
        assertSame(first, sink.table("cal_qa", 1, "obsid", "rms"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void redeclaringDifferentHeaderFails() {
        sink.table("cal_qa", 1, "obsid", "rms");
        sink.table("cal_qa", 1, "obsid", "convergence");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownColumnIsRejected() {
        sink.table("cal_qa", 1, "obsid", "rms");
        sink.record("cal_qa", row("obsid", "A", "rsm", 1.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownTableIsRejected() {
        sink.record("nope", row("obsid", "A"));
    }

    @Test
    public void formatHandlesSpecialValues() {
        assertEquals("NA", ResultTable.format(Double.POSITIVE_INFINITY));
        assertEquals("NA", ResultTable.format(null));
        assertEquals("1.0,NA", ResultTable.format(new double[]{1.0, Double.NaN}));
        assertEquals("42", ResultTable.format(42));
    }

    @Test
    public void tablesAreReturnedInDeclarationOrder() throws IOException {
        sink.table("failures", 1, "entity");
        sink.table("cal_qa", 1, "obsid");
        List<SinkArtifact> artifacts = sink.finish();
        assertEquals("failures", artifacts.get(0).getTable());
        assertEquals("cal_qa", artifacts.get(1).getTable());
        Path dir = sink.getDirectory();
        assertTrue(Files.exists(dir.resolve("failures.tsv")));
    }
}
