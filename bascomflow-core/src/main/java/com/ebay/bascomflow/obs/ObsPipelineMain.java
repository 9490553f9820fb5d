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

import com.ebay.bascomflow.exceptions.PipelineConfigurationException;
import com.ebay.bascomflow.sink.SinkArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Command-line entry point: {@code ObsPipelineMain <obsids-file> [config.properties]}. Exits with 0 when no
 * lineage failed fatally, 1 when one did, and 2 on bad usage or configuration.
 *
 * @author Brendan McCarthy
 */
public class ObsPipelineMain {
    private static final Logger LOG = LoggerFactory.getLogger(ObsPipelineMain.class);

    static final int EXIT_CLEAN = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out) {
        if (args.length < 1 || args.length > 2) {
            out.println("usage: ObsPipelineMain <obsids-file> [config.properties]");
            return EXIT_USAGE;
        }
        try {
            ObsPipelineConfig config = args.length == 2
                    ? ObsPipelineConfig.load(Paths.get(args[1]), env)
                    : ObsPipelineConfig.fromProperties(new Properties(), env);
            List<String> obsids = readObsids(Paths.get(args[0]));
            ObsRunResult result = new ObsPipeline(config).run(obsids);
            for (SinkArtifact next : result.getArtifacts()) {
                out.println(next);
            }
            out.print(result.getStatistics());
            for (String next : result.getSummary().getWarnings()) {
                out.println("WARNING: " + next);
            }
            return result.getSummary().isClean() ? EXIT_CLEAN : EXIT_FAILURES;
        } catch (PipelineConfigurationException e) {
            LOG.error("Invalid configuration", e);
            out.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            LOG.error("Pipeline run failed", e);
            out.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (RuntimeException e) {
            LOG.error("Pipeline run aborted", e);
            out.println("ERROR: " + e);
            return EXIT_FAILURES;
        }
    }

    /**
     * Reads one observation id per line, skipping blank lines and {@code #} comments. A repeated id is
     * dropped with a warning.
     *
     * @param file list of ids
     * @return distinct ids in file order
     * @throws IOException if the file cannot be read
     */
    static List<String> readObsids(Path file) throws IOException {
        Set<String> obsids = new LinkedHashSet<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String obsid = line.trim();
            if (obsid.isEmpty() || obsid.startsWith("#")) {
                continue;
            }
            if (!obsids.add(obsid)) {
                LOG.warn("Duplicate observation {} in {} ignored", obsid, file);
            }
        }
        return new ArrayList<>(obsids);
    }
}
