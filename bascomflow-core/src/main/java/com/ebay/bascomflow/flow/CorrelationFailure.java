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

/**
 * A tuple that a {@link Correlator} operation could not process because a key, element or combining function
 * threw. The tuple is dropped from that operation's output, ending its lineage there.
 *
 * @author Brendan McCarthy
 */
public final class CorrelationFailure {
    private final String operation;
    private final String entity;
    private final String reason;

    CorrelationFailure(String operation, String entity, String reason) {
        this.operation = operation;
        this.entity = entity;
        this.reason = reason;
    }

    public String getOperation() {
        return operation;
    }

    public String getEntity() {
        return entity;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return operation + " failed for " + entity + ": " + reason;
    }
}
