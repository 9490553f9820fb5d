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
package com.ebay.bascomflow.graph;

import com.ebay.bascomflow.flow.CorrelationGap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What happened to the batch: which lineages failed, which tuples found no correlation partner, and how
 * many entities entered and got through each stage and gate.
 *
 * @author Brendan McCarthy
 */
public final class RunSummary {
    private final String graphName;
    private final List<LineageFailure> failures;
    private final List<CorrelationGap> gaps;
    private final List<StageCount> stageCounts;
    private final Map<String, List<GateDecision>> decisions;

    RunSummary(String graphName, List<LineageFailure> failures, List<CorrelationGap> gaps,
               List<StageCount> stageCounts, Map<String, List<GateDecision>> decisions) {
        this.graphName = graphName;
        List<LineageFailure> sorted = new ArrayList<>(failures);
        sorted.sort(LineageFailure.ORDER);
        this.failures = Collections.unmodifiableList(sorted);
        this.gaps = Collections.unmodifiableList(new ArrayList<>(gaps));
        this.stageCounts = Collections.unmodifiableList(new ArrayList<>(stageCounts));
        this.decisions = Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
    }

    public String getGraphName() {
        return graphName;
    }

    /**
     * @return failures ordered by entity, stage and variant
     */
    public List<LineageFailure> getFailures() {
        return failures;
    }

    public List<CorrelationGap> getGaps() {
        return gaps;
    }

    /**
     * @return counts in stage declaration order
     */
    public List<StageCount> getStageCounts() {
        return stageCounts;
    }

    public StageCount getStageCount(String stage) {
        for (StageCount next : stageCounts) {
            if (next.getStage().equals(stage)) {
                return next;
            }
        }
        return null;
    }

    /**
     * @param gate name
     * @return decisions of that gate ordered by entity, empty if none
     */
    public List<GateDecision> getDecisions(String gate) {
        List<GateDecision> list = decisions.get(gate);
        return list == null ? Collections.emptyList() : list;
    }

    /**
     * Lists the stages that received entities but let none through, each as a warning message.
     *
     * @return warnings, empty if no stage was degenerate
     */
    public List<String> getWarnings() {
        List<String> warnings = new ArrayList<>();
        for (StageCount next : stageCounts) {
            if (next.isDegenerate()) {
                warnings.add(next.getReached() + " of " + next.getEntered() + " entities reached stage " + next.getStage());
            }
        }
        return warnings;
    }

    /**
     * @return true iff no lineage failed fatally
     */
    public boolean isClean() {
        for (LineageFailure next : failures) {
            if (next.isFatal()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "RunSummary(" + graphName + ", failures=" + failures.size() + ", gaps=" + gaps.size()
                + ", stages=" + stageCounts + ")";
    }

    /**
     * Distinct entities that entered a stage or gate and that came out of it with at least one tuple.
     */
    public static final class StageCount {
        private final String stage;
        private final int entered;
        private final int reached;

        StageCount(String stage, int entered, int reached) {
            this.stage = stage;
            this.entered = entered;
            this.reached = reached;
        }

        public String getStage() {
            return stage;
        }

        public int getEntered() {
            return entered;
        }

        public int getReached() {
            return reached;
        }

        public boolean isDegenerate() {
            return entered > 0 && reached == 0;
        }

        @Override
        public String toString() {
            return stage + "=" + reached + "/" + entered;
        }
    }
}
