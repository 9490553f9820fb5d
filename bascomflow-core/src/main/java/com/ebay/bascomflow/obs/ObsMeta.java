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
 * Metadata of one observation, as needed for gating and for labelling its results.
 *
 * @author Brendan McCarthy
 */
public final class ObsMeta {
    private final String obsid;
    private final Path file;
    private final int pointing;
    private final int dataQuality;
    private final double badTileFraction;
    private final double deadDipoleFraction;

    public ObsMeta(String obsid, Path file, int pointing, int dataQuality, double badTileFraction, double deadDipoleFraction) {
        this.obsid = obsid;
        this.file = file;
        this.pointing = pointing;
        this.dataQuality = dataQuality;
        this.badTileFraction = badTileFraction;
        this.deadDipoleFraction = deadDipoleFraction;
    }

    public String getObsid() {
        return obsid;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @return east-west pointing (grid column) of the observation
     */
    public int getPointing() {
        return pointing;
    }

    public int getDataQuality() {
        return dataQuality;
    }

    public double getBadTileFraction() {
        return badTileFraction;
    }

    public double getDeadDipoleFraction() {
        return deadDipoleFraction;
    }

    @Override
    public String toString() {
        return "ObsMeta(" + obsid + ", pointing=" + pointing + ", dataquality=" + dataQuality + ")";
    }
}
