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

import com.ebay.bascomflow.core.GlobalPipelineConfig;
import com.ebay.bascomflow.core.Outcome;
import com.ebay.bascomflow.flow.CorrelationGap;
import com.ebay.bascomflow.graph.GateDecision;
import com.ebay.bascomflow.graph.LineageFailure;
import com.ebay.bascomflow.graph.RunSummary;
import com.ebay.bascomflow.graph.StageGraph;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.*;

/**
 * Runs the whole observation pipeline against fake instruments.
 *
 * @author Brendan McCarthy
 */
public class ObsPipelineTest {
    private static final String GOOD = "1061316296";
    private static final String OFF_POINTING = "1061316544";
    private static final String HEAVILY_FLAGGED = "1061317000";
    private static final String CORRUPT = "1061318000";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private ObsPipelineConfig config;
    private FakeInstruments instruments;
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());

    @Before
    public void before() {
        GlobalPipelineConfig.getConfig().restoreConfigurationDefaults(null);
        Path root = folder.getRoot().toPath();
        config = ObsPipelineConfig.defaults()
                .withCacheDir(root.resolve("cache"))
                .withResultsDir(root.resolve("results"));
        instruments = new FakeInstruments()
                .pointing(OFF_POINTING, 5)
                .occupancy(HEAVILY_FLAGGED, 0.4)
                .exits(ObsStages.DOWNLOAD, CORRUPT, 99);
    }

    @After
    public void after() {
        GlobalPipelineConfig.getConfig().restoreConfigurationDefaults(null);
    }

    private ObsRunResult run(String... obsids) throws IOException {
        return new ObsPipeline(config, instruments).withSleeper(sleeps::add).run(Arrays.asList(obsids));
    }

    private static List<String> lines(ObsRunResult result, String table) throws IOException {
        return Files.readAllLines(result.getArtifact(table).getPath(), StandardCharsets.UTF_8);
    }

    @Test
    public void onlyAdmittedObservationsReachQa() throws IOException {
        ObsRunResult result = run(CORRUPT, HEAVILY_FLAGGED, GOOD, OFF_POINTING);

        assertEquals(Arrays.asList(
                "obsid\tvariant\tew_pointing\trms\tunused_tiles\tconvergence",
                GOOD + "\t30l_src4k\t0\t0.5\t3.0,17.0\tNA",
                GOOD + "\t30l_src8k\t0\t0.5\t3.0,17.0\tNA"), lines(result, ObsStages.CAL_QA_TABLE));
        assertEquals(Arrays.asList(
                "obsid\tvariant\tew_pointing\trms_all\tpks_flux\tpks_rms",
                GOOD + "\t30l_src4k\t0\t1.5\t12.25\tNA",
                GOOD + "\t30l_src8k\t0\t1.5\t12.25\tNA"), lines(result, ObsStages.IMG_QA_TABLE));

        RunSummary summary = result.getSummary();
        assertTrue(summary.isClean());
        assertTrue(summary.getWarnings().isEmpty());
        assertEquals(1, summary.getStageCount(ObsStages.APPLY).getReached());
        assertEquals(3, summary.getStageCount(ObsStages.DOWNLOAD).getEntered());
        assertEquals(1, instruments.callsOf(ObsStages.CALIBRATE));
        assertEquals(2, instruments.callsOf(ObsStages.APPLY));
    }

    @Test
    public void nonNumericObsidRunsAlongsideOthers() throws IOException {
        String named = "obsA";
        ObsRunResult result = run(GOOD, named);

        assertEquals(Arrays.asList(
                "obsid\tvariant\tew_pointing\trms\tunused_tiles\tconvergence",
                GOOD + "\t30l_src4k\t0\t0.5\t3.0,17.0\tNA",
                GOOD + "\t30l_src8k\t0\t0.5\t3.0,17.0\tNA",
                named + "\t30l_src4k\t0\t0.5\t3.0,17.0\tNA",
                named + "\t30l_src8k\t0\t0.5\t3.0,17.0\tNA"), lines(result, ObsStages.CAL_QA_TABLE));
        assertEquals(5, lines(result, ObsStages.IMG_QA_TABLE).size());
        assertTrue(result.getSummary().isClean());
        assertEquals(2, result.getSummary().getStageCount(ObsStages.APPLY).getReached());
    }

    @Test
    public void gateDecisionsAreRecorded() throws IOException {
        ObsRunResult result = run(GOOD, OFF_POINTING, HEAVILY_FLAGGED);
        RunSummary summary = result.getSummary();

        List<GateDecision> metadata = summary.getDecisions(MetadataGate.NAME);
        assertEquals(3, metadata.size());
        assertEquals(OFF_POINTING, metadata.get(1).getEntity());
        assertEquals(Collections.singletonList("pointing 5 not in [-2, -1, 0, 1, 2]"), metadata.get(1).getReasons());

        List<GateDecision> flags = summary.getDecisions(FlagOccupancyGate.NAME);
        assertEquals(2, flags.size());
        assertFalse(flags.get(1).isPass());
        assertEquals("occupancy 0.4 not below 0.25", flags.get(1).getReasons().get(0));

        List<String> lines = lines(result, MetadataGate.NAME);
        assertEquals("entity\tpass\treasons\tew_pointing\tdataquality\tbad_tile_fraction\tdead_dipole_fraction", lines.get(0));
        assertEquals(GOOD + "\ttrue\t\t0\t0\t0.0078125\t0.0078125", lines.get(1));
        assertThat(lines.get(2), containsString("\tfalse\tpointing 5 not in"));
    }

    @Test
    public void ignorableDownloadFailureIsRecorded() throws IOException {
        ObsRunResult result = run(GOOD, CORRUPT);
        RunSummary summary = result.getSummary();

        assertTrue(summary.isClean());
        assertEquals(1, summary.getFailures().size());
        LineageFailure failure = summary.getFailures().get(0);
        assertEquals(CORRUPT, failure.getEntity());
        assertEquals(ObsStages.DOWNLOAD, failure.getStage());
        assertEquals(Outcome.Status.IGNORED, failure.getStatus());
        assertEquals("checksum mismatch", failure.getReason());
        assertEquals(Arrays.asList(
                "entity\tstage\tvariant\tstatus\tattempts\treason",
                CORRUPT + "\tdownload\tNA\tIGNORED\t1\tchecksum mismatch"), lines(result, StageGraph.FAILURES_TABLE));

        List<CorrelationGap> gaps = summary.getGaps();
        assertEquals(1, gaps.size());
        assertEquals("qa_context", gaps.get(0).getOperation());
        assertEquals(CORRUPT, gaps.get(0).getEntity());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void transientDownloadFailureBacksOff() throws IOException {
        instruments.exits(ObsStages.DOWNLOAD, GOOD, 42, 11, 0);
        ObsRunResult result = run(GOOD);

        assertTrue(result.getSummary().getFailures().isEmpty());
        assertEquals(Arrays.asList(Duration.ofHours(2), Duration.ofHours(4)), sleeps);
        assertEquals(3, instruments.callsOf(ObsStages.DOWNLOAD));
        assertEquals(3, lines(result, ObsStages.CAL_QA_TABLE).size());
        assertThat(result.getStatistics(), containsString(ObsStages.DOWNLOAD));
    }

    @Test
    public void exhaustedDownloadIsFatal() throws IOException {
        config.withDownloadBackoff(2, 2, java.util.concurrent.TimeUnit.MINUTES);
        instruments.exits(ObsStages.DOWNLOAD, GOOD, 75);
        ObsRunResult result = run(GOOD);

        RunSummary summary = result.getSummary();
        assertFalse(summary.isClean());
        assertEquals(2, summary.getFailures().get(0).getAttempts());
        assertEquals(Collections.singletonList(Duration.ofMinutes(2)), sleeps);
        assertEquals(Collections.singletonList("0 of 1 entities reached stage download"), summary.getWarnings());
        assertEquals(1, lines(result, ObsStages.IMG_QA_TABLE).size());
    }

    @Test
    public void rerunIsIdempotent() throws IOException {
        ObsRunResult first = run(GOOD, OFF_POINTING, HEAVILY_FLAGGED, CORRUPT);
        List<String> calQa = lines(first, ObsStages.CAL_QA_TABLE);
        List<String> imgQa = lines(first, ObsStages.IMG_QA_TABLE);
        List<String> gate = lines(first, MetadataGate.NAME);
        int invocations = instruments.invocations.get();

        ObsRunResult second = run(GOOD, OFF_POINTING, HEAVILY_FLAGGED, CORRUPT);

        // Only the ignored download is attempted again, since it never produced its outputs
        assertEquals(invocations + 1, instruments.invocations.get());
        assertEquals(calQa, lines(second, ObsStages.CAL_QA_TABLE));
        assertEquals(imgQa, lines(second, ObsStages.IMG_QA_TABLE));
        assertEquals(gate, lines(second, MetadataGate.NAME));
        assertFalse(Files.exists(config.getResultsDir().resolve("cal_qa.tsv.part")));
    }

    @Test
    public void artifactsLandInCacheLayout() throws IOException {
        run(GOOD);
        Path root = config.getCacheDir().resolve(GOOD);
        assertTrue(Files.isRegularFile(root.resolve("metadata").resolve(GOOD + "_metadata.json")));
        assertTrue(Files.isDirectory(root.resolve("download").resolve("raw")));
        assertTrue(Files.isRegularFile(root.resolve("calibrate").resolve("hyp_soln_" + GOOD + "_30l_src8k.fits")));
        assertTrue(Files.isDirectory(root.resolve("apply").resolve("30l_src4k").resolve(GOOD + "_30l_src4k.ms")));
        assertTrue(Files.isRegularFile(root.resolve("imgqa").resolve("30l_src8k").resolve("imgqa_" + GOOD + "_30l_src8k.json")));
    }

    @Test
    public void singleVariantRun() throws IOException {
        config.withVariants("30l_src4k");
        ObsRunResult result = run(GOOD);
        assertEquals(2, lines(result, ObsStages.CAL_QA_TABLE).size());
        assertEquals(2, lines(result, ObsStages.IMG_QA_TABLE).size());
    }
}
