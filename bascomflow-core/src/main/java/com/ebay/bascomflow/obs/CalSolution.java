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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One calibration solution, tagged with the variant it was solved with.
 *
 * @author Brendan McCarthy
 */
public final class CalSolution {
    private static final String PREFIX = "hyp_soln_";
    private static final String SUFFIX = ".fits";

    private final String obsid;
    private final String variant;
    private final Path file;

    public CalSolution(String obsid, String variant, Path file) {
        this.obsid = obsid;
        this.variant = variant;
        this.file = file;
    }

    /**
     * Name of the solution file the calibrator writes for a variant.
     *
     * @param obsid   observation
     * @param variant calibration variant
     * @return file name
     */
    public static String fileName(String obsid, String variant) {
        return PREFIX + obsid + "_" + variant + SUFFIX;
    }

    /**
     * Recovers the variant from the name of one of an observation's solution files. The obsid is matched
     * literally, so it may contain any characters.
     *
     * @param obsid observation the file belongs to
     * @param file  named as by {@link #fileName(String, String)}
     * @return solution
     * @throws IllegalArgumentException if the name does not follow that convention for the obsid
     */
    public static CalSolution fromFile(String obsid, Path file) {
        Pattern pattern = Pattern.compile(Pattern.quote(PREFIX + obsid + "_") + "(.+)" + Pattern.quote(SUFFIX));
        Matcher matcher = pattern.matcher(file.getFileName().toString());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a calibration solution of " + obsid + ": " + file);
        }
        return new CalSolution(obsid, matcher.group(1), file);
    }

    public String getObsid() {
        return obsid;
    }

    public String getVariant() {
        return variant;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public String toString() {
        return "CalSolution(" + obsid + ":" + variant + ")";
    }
}
