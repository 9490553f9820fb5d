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
package com.ebay.bascomflow.runners;

import com.ebay.bascomflow.core.Collaborator;
import com.ebay.bascomflow.core.DirectoryTaskCache;
import com.ebay.bascomflow.core.Outcome;
import com.ebay.bascomflow.core.ResourcePools;
import com.ebay.bascomflow.core.RetryPolicy;
import com.ebay.bascomflow.core.TaskDefinition;
import com.ebay.bascomflow.core.TaskInterceptor;
import com.ebay.bascomflow.core.TaskKey;
import com.ebay.bascomflow.core.TaskRunner;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Tests statistics collection through a real runner.
 *
 * @author Brendan McCarthy
 */
public class StatTaskInterceptorTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private StatTaskInterceptor stats;
    private TaskRunner runner;

    private final RetryPolicy policy = RetryPolicy.builder()
            .ignore(99, "checksum mismatch")
            .retry(75, "temporary failure")
            .maxAttempts(3)
            .backoff(1, TimeUnit.MILLISECONDS)
            .build();

    @Before
    public void before() throws IOException {
        stats = new StatTaskInterceptor();
        List<TaskInterceptor> interceptors = Arrays.asList(new LogTaskInterceptor(LogTaskLevel.DEBUG), stats);
        runner = new TaskRunner(new DirectoryTaskCache(folder.newFolder("cache").toPath()),
                new ResourcePools(Collections.emptyMap()), policy, duration -> {
        }, interceptors);
    }

    private static Collaborator scripted(int... codes) {
        AtomicInteger calls = new AtomicInteger(0);
        return context -> {
            int code = codes[Math.min(calls.getAndIncrement(), codes.length - 1)];
            if (code == 0) {
                Files.write(context.getDirectory().resolve("out.txt"), "x".getBytes(StandardCharsets.UTF_8));
            }
            return code;
        };
    }

    private Outcome run(String entity, String stage, Collaborator collaborator) {
        return runner.run(TaskDefinition.builder(TaskKey.of(entity, stage))
                .output("out.txt")
                .collaborator(collaborator)
                .build());
    }

    @Test
    public void countsByStageAndResult() {
        run("A", "download", scripted(75, 0));
        run("B", "download", scripted(99));
        run("C", "download", scripted(75));
        run("A", "preprocess", scripted(0));
        run("A", "preprocess", scripted(0));

        StatTaskInterceptor.Report report = stats.collect();
        assertEquals(2, report.getStats().size());
        assertEquals("download", report.getStats().get(0).stage);

        StatTaskInterceptor.Stat download = report.get("download");
        assertEquals(6, download.count);
        assertEquals(1, download.success);
        assertEquals(1, download.ignored);
        assertEquals(3, download.retried);
        assertEquals(1, download.fatal);
        assertEquals(0, download.cached);
        assertTrue(download.min <= download.average);
        assertTrue(download.average <= download.max);

        StatTaskInterceptor.Stat preprocess = report.get("preprocess");
        assertEquals(1, preprocess.count);
        assertEquals(1, preprocess.cached);
        assertNull(report.get("calibrate"));
    }

    @Test
    public void reportIsTabular() {
        run("A", "metadata", scripted(0));
        String report = stats.report();
        String[] lines = report.split("\n");
        assertEquals(5, lines.length);
        assertTrue(lines[1], lines[1].contains("Count"));
        assertTrue(lines[1], lines[1].contains("Stage"));
        assertTrue(lines[3], lines[3].contains("metadata"));
        for (String next : lines) {
            assertEquals(report, lines[0].length(), next.length());
        }
    }

    @Test
    public void emptyReportHasHeaderOnly() {
        assertEquals(0, stats.collect().getStats().size());
        assertEquals(4, stats.report().split("\n").length);
    }
}
