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

import com.ebay.bascomflow.graph.RunSummary;
import com.ebay.bascomflow.sink.SinkArtifact;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one observation pipeline run.
 *
 * @author Brendan McCarthy
 */
public final class ObsRunResult {
    private final RunSummary summary;
    private final List<SinkArtifact> artifacts;
    private final String statistics;

    ObsRunResult(RunSummary summary, List<SinkArtifact> artifacts, String statistics) {
        this.summary = summary;
        this.artifacts = Collections.unmodifiableList(artifacts);
        this.statistics = statistics;
    }

    public RunSummary getSummary() {
        return summary;
    }

    public List<SinkArtifact> getArtifacts() {
        return artifacts;
    }

    public SinkArtifact getArtifact(String table) {
        for (SinkArtifact next : artifacts) {
            if (next.getTable().equals(table)) {
                return next;
            }
        }
        return null;
    }

    /**
     * @return per-stage attempt statistics, formatted as a table
     */
    public String getStatistics() {
        return statistics;
    }
}
