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

import java.io.IOException;
import java.util.List;

/**
 * A quality filter between stages. Each entity is evaluated, the decision is recorded whether it passes or
 * not, and only passing tuples continue downstream.
 *
 * @param <T> tuple type
 * @author Brendan McCarthy
 */
public interface Gate<T> {

    String getName();

    /**
     * Names the fields that every decision of this gate reports, in column order.
     *
     * @return field names
     */
    List<String> getFieldNames();

    /**
     * Evaluates one tuple. An exception here counts as a failed decision for that tuple only.
     *
     * @param tuple to evaluate
     * @return decision
     * @throws IOException if an artifact needed for the decision cannot be read
     */
    GateDecision evaluate(T tuple) throws IOException;

    /**
     * @param tuple to key
     * @return entity key of tuple
     */
    String entityOf(T tuple);
}
