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

import com.ebay.bascomflow.core.ResourcePools;
import com.ebay.bascomflow.graph.Stage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarations of the observation pipeline's stages. Each stage names the artifacts its collaborator must leave
 * in the task directory and reads them back into the next tuple.
 *
 * @author Brendan McCarthy
 */
public class ObsStages {
    public static final String METADATA = "metadata";
    public static final String DOWNLOAD = "download";
    public static final String PREPROCESS = "preprocess";
    public static final String CALIBRATE = "calibrate";
    public static final String APPLY = "apply";
    public static final String CALQA = "calqa";
    public static final String IMGQA = "imgqa";

    public static final String IO_CLASS = "io";
    public static final String COMPUTE_CLASS = "compute";

    public static final String CAL_QA_TABLE = "cal_qa";
    public static final String IMG_QA_TABLE = "img_qa";
    public static final List<String> CAL_QA_METRICS = Collections.unmodifiableList(
            Arrays.asList("rms", "unused_tiles", "convergence"));
    public static final List<String> IMG_QA_METRICS = Collections.unmodifiableList(
            Arrays.asList("rms_all", "pks_flux", "pks_rms"));

    static final String RAW_DIR = "raw";

    private final ObsPipelineConfig config;
    private final CollaboratorFactory factory;

    public ObsStages(ObsPipelineConfig config, CollaboratorFactory factory) {
        this.config = config;
        this.factory = factory;
    }

    static String metadataFile(String obsid) {
        return obsid + "_metadata.json";
    }

    static String measurementSet(String obsid) {
        return obsid + ".ms";
    }

    static String occupancyFile(String obsid) {
        return obsid + "_occupancy.json";
    }

    static String calibratedSet(String obsid, String variant) {
        return obsid + "_" + variant + ".ms";
    }

    static String calQaFile(String obsid, String variant) {
        return "calqa_" + obsid + "_" + variant + ".json";
    }

    static String imgQaFile(String obsid, String variant) {
        return "imgqa_" + obsid + "_" + variant + ".json";
    }

    private Map<String, String> values(String obsid, String variant, Path dir, Path input) {
        Map<String, String> values = new HashMap<>();
        values.put("obsid", obsid);
        values.put("dir", dir.toString());
        values.put("variants", String.join(",", config.getVariants()));
        if (variant != null) {
            values.put("variant", variant);
        }
        if (input != null) {
            values.put("input", input.toString());
        }
        return values;
    }

    public Stage<String, ObsMeta> metadata() {
        return Stage.<String, ObsMeta>named(METADATA)
                .resourceClass(IO_CLASS)
                .entity(obsid -> obsid)
                .outputs(obsid -> Collections.singletonList(metadataFile(obsid)))
                .collaborator((obsid, dir) -> factory.create(METADATA, values(obsid, null, dir, null)))
                .reader((obsid, dir) -> Collections.singletonList(
                        ObsJson.readMetadata(obsid, dir.resolve(metadataFile(obsid)))))
                .build();
    }

    public Stage<ObsMeta, ObsRaw> download() {
        return Stage.<ObsMeta, ObsRaw>named(DOWNLOAD)
                .resourceClass(IO_CLASS)
                .entity(ObsMeta::getObsid)
                .outputs(meta -> Collections.singletonList(RAW_DIR))
                .collaborator((meta, dir) -> factory.create(DOWNLOAD, values(meta.getObsid(), null, dir, null)))
                .retryPolicy(config.getDownloadPolicy())
                .reader((meta, dir) -> Collections.singletonList(new ObsRaw(meta.getObsid(), dir.resolve(RAW_DIR))))
                .build();
    }

    public Stage<ObsRaw, ObsVis> preprocess() {
        return Stage.<ObsRaw, ObsVis>named(PREPROCESS)
                .resourceClass(COMPUTE_CLASS)
                .entity(ObsRaw::getObsid)
                .outputs(raw -> Arrays.asList(measurementSet(raw.getObsid()), occupancyFile(raw.getObsid())))
                .collaborator((raw, dir) -> factory.create(PREPROCESS,
                        values(raw.getObsid(), null, dir, raw.getDirectory())))
                .reader((raw, dir) -> Collections.singletonList(new ObsVis(raw.getObsid(),
                        dir.resolve(measurementSet(raw.getObsid())), dir.resolve(occupancyFile(raw.getObsid())))))
                .build();
    }

    /**
     * Solves every configured variant in one run, which writes one solution file per variant.
     *
     * @return stage
     */
    public Stage<ObsVis, ObsCal> calibrate() {
        return Stage.<ObsVis, ObsCal>named(CALIBRATE)
                .resourceClass(COMPUTE_CLASS)
                .entity(ObsVis::getObsid)
                .outputs(vis -> solutionFiles(vis.getObsid()))
                .collaborator((vis, dir) -> factory.create(CALIBRATE,
                        values(vis.getObsid(), null, dir, vis.getMeasurementSet())))
                .reader((vis, dir) -> {
                    List<Path> paths = new ArrayList<>();
                    for (String next : solutionFiles(vis.getObsid())) {
                        paths.add(dir.resolve(next));
                    }
                    return Collections.singletonList(new ObsCal(vis.getObsid(), paths));
                })
                .build();
    }

    private List<String> solutionFiles(String obsid) {
        List<String> files = new ArrayList<>();
        for (String next : config.getVariants()) {
            files.add(CalSolution.fileName(obsid, next));
        }
        return files;
    }

    public Stage<CalInput, CalVis> apply() {
        return Stage.<CalInput, CalVis>named(APPLY)
                .resourceClass(COMPUTE_CLASS)
                .entity(CalInput::getObsid)
                .variant(CalInput::getVariant)
                .outputs(in -> Collections.singletonList(calibratedSet(in.getObsid(), in.getVariant())))
                .collaborator((in, dir) -> {
                    Map<String, String> values = values(in.getObsid(), in.getVariant(), dir, in.getVis().getMeasurementSet());
                    values.put("solution", in.getSolution().getFile().toString());
                    return factory.create(APPLY, values);
                })
                .reader((in, dir) -> Collections.singletonList(new CalVis(in.getObsid(), in.getVariant(),
                        dir.resolve(calibratedSet(in.getObsid(), in.getVariant())))))
                .build();
    }

    public Stage<CalSolution, QaResult> calQa() {
        return Stage.<CalSolution, QaResult>named(CALQA)
                .resourceClass(ResourcePools.DEFAULT_CLASS)
                .entity(CalSolution::getObsid)
                .variant(CalSolution::getVariant)
                .outputs(sol -> Collections.singletonList(calQaFile(sol.getObsid(), sol.getVariant())))
                .collaborator((sol, dir) -> factory.create(CALQA,
                        values(sol.getObsid(), sol.getVariant(), dir, sol.getFile())))
                .reader((sol, dir) -> Collections.singletonList(new QaResult(CAL_QA_TABLE, sol.getObsid(), sol.getVariant(),
                        ObsJson.readMetrics(dir.resolve(calQaFile(sol.getObsid(), sol.getVariant())), CAL_QA_METRICS))))
                .build();
    }

    public Stage<CalVis, QaResult> imgQa() {
        return Stage.<CalVis, QaResult>named(IMGQA)
                .resourceClass(COMPUTE_CLASS)
                .entity(CalVis::getObsid)
                .variant(CalVis::getVariant)
                .outputs(vis -> Collections.singletonList(imgQaFile(vis.getObsid(), vis.getVariant())))
                .collaborator((vis, dir) -> factory.create(IMGQA,
                        values(vis.getObsid(), vis.getVariant(), dir, vis.getMeasurementSet())))
                .reader((vis, dir) -> Collections.singletonList(new QaResult(IMG_QA_TABLE, vis.getObsid(), vis.getVariant(),
                        ObsJson.readMetrics(dir.resolve(imgQaFile(vis.getObsid(), vis.getVariant())), IMG_QA_METRICS))))
                .build();
    }
}
