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
package com.ebay.bascomflow.flow;

import java.util.Objects;

/**
 * A tuple that a join or cross could not pair because the other side had nothing with the same key. The
 * entity simply does not progress past that point; this is not an error.
 *
 * @author Brendan McCarthy
 */
public final class CorrelationGap {

    public enum Side {
        LEFT,
        RIGHT
    }

    private final String operation;
    private final String entity;
    private final Object key;
    private final Side missing;

    CorrelationGap(String operation, String entity, Object key, Side missing) {
        this.operation = operation;
        this.entity = entity;
        this.key = key;
        this.missing = missing;
    }

    /**
     * @return name given to the join or cross
     */
    public String getOperation() {
        return operation;
    }

    public String getEntity() {
        return entity;
    }

    /**
     * @return the correlation key that found no partner
     */
    public Object getKey() {
        return key;
    }

    /**
     * @return the side that had no counterpart
     */
    public Side getMissing() {
        return missing;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrelationGap that = (CorrelationGap) o;
        return operation.equals(that.operation) && entity.equals(that.entity)
                && Objects.equals(key, that.key) && missing == that.missing;
    }

    @Override
    public int hashCode() {
        return Objects.hash(operation, entity, key, missing);
    }

    @Override
    public String toString() {
        return operation + ": " + key + " has no " + missing.name().toLowerCase() + " counterpart";
    }
}
