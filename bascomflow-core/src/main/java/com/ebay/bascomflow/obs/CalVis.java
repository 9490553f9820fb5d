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
 * Calibrated visibilities of one observation and variant.
 *
 * @author Brendan McCarthy
 */
public final class CalVis {
    private final String obsid;
    private final String variant;
    private final Path measurementSet;

    public CalVis(String obsid, String variant, Path measurementSet) {
        this.obsid = obsid;
        this.variant = variant;
        this.measurementSet = measurementSet;
    }

    public String getObsid() {
        return obsid;
    }

    public String getVariant() {
        return variant;
    }

    public Path getMeasurementSet() {
        return measurementSet;
    }

    @Override
    public String toString() {
        return "CalVis(" + obsid + ":" + variant + ")";
    }
}
