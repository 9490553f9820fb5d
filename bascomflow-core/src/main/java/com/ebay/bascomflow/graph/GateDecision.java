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
package com.ebay.bascomflow.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A gate's verdict for one entity together with the reasons for any failure and the values it was based on,
 * kept for auditing whether or not the entity passed.
 *
 * @author Brendan McCarthy
 */
public final class GateDecision {
    private final String entity;
    private final List<String> reasons;
    private final Map<String, Object> fields;

    private GateDecision(String entity, List<String> reasons, Map<String, Object> fields) {
        this.entity = entity;
        this.reasons = Collections.unmodifiableList(new ArrayList<>(reasons));
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Builder builder(String entity) {
        return new Builder(entity);
    }

    public String getEntity() {
        return entity;
    }

    public boolean isPass() {
        return reasons.isEmpty();
    }

    /**
     * @return failure reasons, empty iff the entity passed
     */
    public List<String> getReasons() {
        return reasons;
    }

    /**
     * @return values the decision was based on, by field name
     */
    public Map<String, Object> getFields() {
        return fields;
    }

    @Override
    public String toString() {
        return "GateDecision(" + entity + ", " + (isPass() ? "pass" : "fail " + reasons) + ")";
    }

    public static final class Builder {
        private final String entity;
        private final List<String> reasons = new ArrayList<>();
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(String entity) {
            this.entity = entity;
        }

        public Builder field(String name, Object value) {
            fields.put(name, value);
            return this;
        }

        public Builder fail(String reason) {
            reasons.add(reason);
            return this;
        }

        /**
         * Adds a failure reason unless the condition holds.
         *
         * @param condition that passes
         * @param reason    recorded when it does not
         * @return this builder
         */
        public Builder require(boolean condition, String reason) {
            if (!condition) {
                reasons.add(reason);
            }
            return this;
        }

        public GateDecision build() {
            return new GateDecision(entity, reasons, fields);
        }
    }
}
