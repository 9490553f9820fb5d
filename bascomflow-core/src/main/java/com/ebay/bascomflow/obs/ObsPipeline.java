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

import com.ebay.bascomflow.core.DirectoryTaskCache;
import com.ebay.bascomflow.core.Sleeper;
import com.ebay.bascomflow.flow.CorrelationGaps;
import com.ebay.bascomflow.flow.Correlator;
import com.ebay.bascomflow.flow.Flow;
import com.ebay.bascomflow.graph.RunSummary;
import com.ebay.bascomflow.graph.StageGraph;
import com.ebay.bascomflow.runners.LogTaskInterceptor;
import com.ebay.bascomflow.runners.StatTaskInterceptor;
import com.ebay.bascomflow.sink.ResultSink;
import com.ebay.bascomflow.sink.SinkArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The observation pipeline: metadata, metadata gate, download, preprocessing, flag-occupancy gate, calibration
 * of every variant, then per variant application of the solution, calibration QA and image QA. QA results are
 * labelled with their observation's metadata and written to the {@code cal_qa} and {@code img_qa} tables.
 *
 * @author Brendan McCarthy
 */
public class ObsPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(ObsPipeline.class);

    public static final String GRAPH_NAME = "obs";

    private final ObsPipelineConfig config;
    private final CollaboratorFactory factory;
    private Sleeper sleeper = null;

    public ObsPipeline(ObsPipelineConfig config) {
        this(config, CollaboratorFactory.fromTemplates(config));
    }

    public ObsPipeline(ObsPipelineConfig config, CollaboratorFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    /**
     * Replaces how retry backoff waits are performed, instead of the global default.
     *
     * @param sleeper to use
     * @return this pipeline
     */
    public ObsPipeline withSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
        return this;
    }

    /**
     * Runs every observation as far as it gets and writes the result tables.
     *
     * @param obsids observations, distinct
     * @return summary, tables and statistics
     * @throws IOException if a result table cannot be written
     */
    public ObsRunResult run(Collection<String> obsids) throws IOException {
        LOG.info("Running {} observations with {}", obsids.size(), config);
        DirectoryTaskCache cache = new DirectoryTaskCache(config.getCacheDir());
        ResultSink sink = new ResultSink(config.getResultsDir());
        StageGraph graph = StageGraph.create(GRAPH_NAME, cache, sink);
        config.getPools().forEach(graph::setResourceLimit);
        if (sleeper != null) {
            graph.setSleeper(sleeper);
        }
        StatTaskInterceptor stats = new StatTaskInterceptor();
        graph.firstInterceptWith(new LogTaskInterceptor());
        graph.lastInterceptWith(stats);

        declareQaTable(sink, ObsStages.CAL_QA_TABLE, ObsStages.CAL_QA_METRICS);
        declareQaTable(sink, ObsStages.IMG_QA_TABLE, ObsStages.IMG_QA_METRICS);

        ObsStages stages = new ObsStages(config, factory);
        CorrelationGaps gaps = graph.getGaps();

        Flow<String> observations = graph.source(obsids, obsid -> obsid);
        Flow<ObsMeta> meta = graph.stage(stages.metadata(), observations);
        Flow<ObsMeta> admitted = graph.gate(MetadataGate.of(config), meta);
        Flow<ObsRaw> raw = graph.stage(stages.download(), admitted);
        Flow<ObsVis> vis = graph.stage(stages.preprocess(), raw);
        Flow<ObsVis> flagged = graph.gate(new FlagOccupancyGate(config.getMaxOccupancy()), vis);
        Flow<ObsCal> cal = graph.stage(stages.calibrate(), flagged);

        Flow<CalSolution> solutions = Correlator.transpose("solutions", cal, ObsCal::getSolutions,
                (c, file) -> CalSolution.fromFile(c.getObsid(), file), gaps);
        Flow<CalInput> inputs = Correlator.cross("apply_inputs", flagged, ObsVis::getObsid,
                solutions, CalSolution::getObsid, CalInput::new, gaps);
        Flow<CalVis> calibrated = graph.stage(stages.apply(), inputs);
        Flow<QaResult> calQa = graph.stage(stages.calQa(), solutions);
        Flow<QaResult> imgQa = graph.stage(stages.imgQa(), calibrated);

        Flow<QaResult> qa = Correlator.mix(calQa, imgQa);
        Flow<QaResult> recorded = Correlator.join("qa_context", admitted, ObsMeta::getObsid,
                qa, QaResult::getObsid, (m, q) -> record(sink, m, q), gaps);

        RunSummary summary = graph.await(recorded);
        List<SinkArtifact> artifacts = sink.finish();
        for (SinkArtifact next : artifacts) {
            LOG.info("Result {}", next);
        }
        return new ObsRunResult(summary, artifacts, stats.report());
    }

    private static void declareQaTable(ResultSink sink, String table, List<String> metrics) {
        List<String> header = new ArrayList<>();
        header.add("obsid");
        header.add("variant");
        header.add("ew_pointing");
        header.addAll(metrics);
        sink.table(table, 2, header);
    }

    private static QaResult record(ResultSink sink, ObsMeta meta, QaResult qa) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("obsid", qa.getObsid());
        row.put("variant", qa.getVariant());
        row.put("ew_pointing", meta.getPointing());
        row.putAll(qa.getMetrics());
        sink.record(qa.getTable(), row);
        return qa;
    }
}
