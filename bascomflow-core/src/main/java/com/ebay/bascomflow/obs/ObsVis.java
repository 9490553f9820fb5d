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

import java.nio.file.Path;

/**
 * Preprocessed visibilities of one observation together with the flag occupancy its preprocessing measured.
 *
 * @author Brendan McCarthy
 */
public final class ObsVis {
    private final String obsid;
    private final Path measurementSet;
    private final Path occupancy;

    public ObsVis(String obsid, Path measurementSet, Path occupancy) {
        this.obsid = obsid;
        this.measurementSet = measurementSet;
        this.occupancy = occupancy;
    }

    public String getObsid() {
        return obsid;
    }

    public Path getMeasurementSet() {
        return measurementSet;
    }

    /**
     * @return JSON file holding the flag occupancy
     */
    public Path getOccupancy() {
        return occupancy;
    }

    @Override
    public String toString() {
        return "ObsVis(" + obsid + ")";
    }
}
