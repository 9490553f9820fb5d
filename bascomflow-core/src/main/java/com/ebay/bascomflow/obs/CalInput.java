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

/**
 * A calibration solution paired with the visibilities it applies to.
 *
 * @author Brendan McCarthy
 */
public final class CalInput {
    private final ObsVis vis;
    private final CalSolution solution;

    public CalInput(ObsVis vis, CalSolution solution) {
        this.vis = vis;
        this.solution = solution;
    }

    public String getObsid() {
        return vis.getObsid();
    }

    public String getVariant() {
        return solution.getVariant();
    }

    public ObsVis getVis() {
        return vis;
    }

    public CalSolution getSolution() {
        return solution;
    }

    @Override
    public String toString() {
        return "CalInput(" + getObsid() + ":" + getVariant() + ")";
    }
}
