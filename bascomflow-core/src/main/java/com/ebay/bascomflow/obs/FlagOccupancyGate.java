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

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Admits observations whose preprocessing flagged no more than a configured fraction of the data.
 *
 * @author Brendan McCarthy
 */
public class FlagOccupancyGate implements Gate<ObsVis> {
    public static final String NAME = "flag_gate";

    private final double maxOccupancy;

    public FlagOccupancyGate(double maxOccupancy) {
        this.maxOccupancy = maxOccupancy;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<String> getFieldNames() {
        return Collections.singletonList("total_occupancy");
    }

    @Override
    public String entityOf(ObsVis vis) {
        return vis.getObsid();
    }

    @Override
    public GateDecision evaluate(ObsVis vis) throws IOException {
        double occupancy = ObsJson.readOccupancy(vis.getOccupancy());
        return GateDecision.builder(vis.getObsid())
                .field("total_occupancy", occupancy)
                .require(occupancy < maxOccupancy, "occupancy " + occupancy + " not below " + maxOccupancy)
                .build();
    }
}
