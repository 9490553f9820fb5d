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

import com.ebay.bascomflow.graph.Gate;
import com.ebay.bascomflow.graph.GateDecision;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Admits observations whose pointing is allowed and whose metadata quality figures are within limits.
 *
 * @author Brendan McCarthy
 */
public class MetadataGate implements Gate<ObsMeta> {
    public static final String NAME = "metadata_gate";

    private static final List<String> FIELDS = Collections.unmodifiableList(Arrays.asList(
            "ew_pointing", "dataquality", "bad_tile_fraction", "dead_dipole_fraction"));

    private final Set<Integer> pointings;
    private final int maxDataQuality;
    private final double maxBadTiles;
    private final double maxDeadDipoles;

    public MetadataGate(Set<Integer> pointings, int maxDataQuality, double maxBadTiles, double maxDeadDipoles) {
        this.pointings = Collections.unmodifiableSet(new TreeSet<>(pointings));
        this.maxDataQuality = maxDataQuality;
        this.maxBadTiles = maxBadTiles;
        this.maxDeadDipoles = maxDeadDipoles;
    }

    public static MetadataGate of(ObsPipelineConfig config) {
        return new MetadataGate(config.getPointings(), config.getMaxDataQuality(),
                config.getMaxBadTiles(), config.getMaxDeadDipoles());
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getFieldNames() {
        return FIELDS;
    }

    @Override
    public String entityOf(ObsMeta meta) {
        return meta.getObsid();
    }

    @Override
    public GateDecision evaluate(ObsMeta meta) {
        return GateDecision.builder(meta.getObsid())
                .field("ew_pointing", meta.getPointing())
                .field("dataquality", meta.getDataQuality())
                .field("bad_tile_fraction", meta.getBadTileFraction())
                .field("dead_dipole_fraction", meta.getDeadDipoleFraction())
                .require(pointings.contains(meta.getPointing()),
                        "pointing " + meta.getPointing() + " not in " + pointings)
                .require(meta.getDataQuality() <= maxDataQuality,
                        "dataquality " + meta.getDataQuality() + " exceeds " + maxDataQuality)
                .require(meta.getBadTileFraction() <= maxBadTiles,
                        "bad tile fraction " + meta.getBadTileFraction() + " exceeds " + maxBadTiles)
                .require(meta.getDeadDipoleFraction() <= maxDeadDipoles,
                        "dead dipole fraction " + meta.getDeadDipoleFraction() + " exceeds " + maxDeadDipoles)
                .build();
    }
}
