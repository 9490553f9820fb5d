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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Quality metrics of one observation and variant, destined for the result table named by its kind.
 *
 * @author Brendan McCarthy
 */
public final class QaResult {
    private final String table;
    private final String obsid;
    private final String variant;
    private final Map<String, Object> metrics;

    public QaResult(String table, String obsid, String variant, Map<String, Object> metrics) {
        this.table = table;
        this.obsid = obsid;
        this.variant = variant;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public String getTable() {
        return table;
    }

    public String getObsid() {
        return obsid;
    }

    public String getVariant() {
        return variant;
    }

    /**
     * @return metric values by name, null where a metric was absent
     */
    public Map<String, Object> getMetrics() {
        return metrics;
    }

    @Override
    public String toString() {
        return "QaResult(" + table + ", " + obsid + ":" + variant + ")";
    }
}
