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

import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.*;

/**
 * Tests recovering the variant from solution file names.
 *
 * @author Brendan McCarthy
 */
public class CalSolutionTest {

    @Test
    public void variantFollowsObsid() {
        Path file = Paths.get("cache", "1061316296", "calibrate", CalSolution.fileName("1061316296", "30l_src4k"));
        CalSolution solution = CalSolution.fromFile("1061316296", file);
        assertEquals("1061316296", solution.getObsid());
        assertEquals("30l_src4k", solution.getVariant());
        assertEquals(file, solution.getFile());
    }

    @Test
    public void obsidIsMatchedLiterally() {
        for (String obsid : new String[]{"obsA", "obs_1", "a.b+c"}) {
            CalSolution solution = CalSolution.fromFile(obsid, Paths.get(CalSolution.fileName(obsid, "30l_src8k")));
            assertEquals(obsid, solution.getObsid());
            assertEquals("30l_src8k", solution.getVariant());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void otherObservationsFileIsRejected() {
        CalSolution.fromFile("1061316544", Paths.get(CalSolution.fileName("1061316296", "30l_src4k")));
    }
}
