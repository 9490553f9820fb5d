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
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.*;
import static org.junit.Assume.assumeTrue;

/**
 * Tests the command-line entry point.
 *
 * @author Brendan McCarthy
 */
public class ObsPipelineMainTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private PrintStream out;

    @Before
    public void before() throws UnsupportedEncodingException {
        GlobalPipelineConfig.getConfig().restoreConfigurationDefaults(null);
        out = new PrintStream(bytes, true, StandardCharsets.UTF_8.name());
    }

    @After
    public void after() {
        GlobalPipelineConfig.getConfig().restoreConfigurationDefaults(null);
    }

    private String output() throws UnsupportedEncodingException {
        return bytes.toString(StandardCharsets.UTF_8.name());
    }

    private Path write(String name, String... lines) throws IOException {
        Path file = folder.getRoot().toPath().resolve(name);
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void readsDistinctObsids() throws IOException {
        Path file = write("obsids.txt", "# night 1", "1061316296", "", "  1061316544  ", "1061316296", "1061317000");
        assertEquals(Arrays.asList("1061316296", "1061316544", "1061317000"), ObsPipelineMain.readObsids(file));
    }

    @Test
    public void usage() throws IOException {
        assertEquals(ObsPipelineMain.EXIT_USAGE, ObsPipelineMain.run(new String[0], Collections.emptyMap(), out));
        assertThat(output(), containsString("usage:"));
    }

    @Test
    public void badConfigurationIsUsageError() throws IOException {
        Path obsids = write("obsids.txt", "1061316296");
        Path config = write("bad.properties", "gate.occupancy.max=lots");
        int code = ObsPipelineMain.run(new String[]{obsids.toString(), config.toString()}, Collections.emptyMap(), out);
        assertEquals(ObsPipelineMain.EXIT_USAGE, code);
        assertThat(output(), containsString("ERROR: Invalid value for gate.occupancy.max"));
    }

    @Test
    public void missingObsidsFileIsError() throws IOException {
        Path config = write("ok.properties", "cache.dir=" + folder.getRoot().toPath().resolve("cache"));
        int code = ObsPipelineMain.run(new String[]{folder.getRoot().toPath().resolve("absent.txt").toString(),
                config.toString()}, Collections.emptyMap(), out);
        assertEquals(ObsPipelineMain.EXIT_USAGE, code);
        assertThat(output(), containsString("ERROR:"));
    }

    @Test
    public void unlaunchableToolFailsRun() throws IOException {
        assumeTrue(File.separatorChar == '/');
        Path root = folder.getRoot().toPath();
        Path obsids = write("obsids.txt", "1061316296");
        Path config = write("pipeline.properties",
                "cache.dir=" + root.resolve("cache"),
                "results.dir=" + root.resolve("results"));
        int code = ObsPipelineMain.run(new String[]{obsids.toString(), config.toString()},
                Collections.singletonMap("BASCOMFLOW_COMMAND_METADATA", "/nonexistent/obs-metadata {obsid}"), out);

        assertEquals(ObsPipelineMain.EXIT_FAILURES, code);
        String printed = output();
        assertThat(printed, containsString("failures.tsv"));
        assertThat(printed, containsString("WARNING: 0 of 1 entities reached stage metadata"));
        assertThat(printed, containsString("Fatal"));
        assertTrue(Files.exists(root.resolve("results").resolve("cal_qa.tsv")));
        assertThat(new String(Files.readAllBytes(root.resolve("results").resolve("failures.tsv")), StandardCharsets.UTF_8),
                containsString("launch failed"));
    }
}
