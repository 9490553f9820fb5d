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
import java.util.Collections;
import java.util.List;

/**
 * All calibration solutions of one observation, one file per variant, as written by a single calibration run.
 *
 * @author Brendan McCarthy
 */
public final class ObsCal {
    private final String obsid;
    private final List<Path> solutions;

    public ObsCal(String obsid, List<Path> solutions) {
        this.obsid = obsid;
        this.solutions = Collections.unmodifiableList(solutions);
    }

    public String getObsid() {
        return obsid;
    }

    public List<Path> getSolutions() {
        return solutions;
    }

    @Override
    public String toString() {
        return "ObsCal(" + obsid + ", " + solutions.size() + " solutions)";
    }
}
