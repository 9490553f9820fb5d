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

import com.ebay.bascomflow.core.Outcome;
import com.ebay.bascomflow.core.TaskKey;

import java.util.Comparator;

/**
 * A (entity, stage, variant) lineage that stopped because its task did not succeed or because stage code
 * failed on one of its tuples.
 *
 * @author Brendan McCarthy
 */
public final class LineageFailure {
    static final Comparator<LineageFailure> ORDER = Comparator.comparing(LineageFailure::getEntity)
            .thenComparing(LineageFailure::getStage)
            .thenComparing(LineageFailure::getVariant, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String entity;
    private final String stage;
    private final String variant;
    private final Outcome.Status status;
    private final int attempts;
    private final String reason;

    LineageFailure(String entity, String stage, String variant, Outcome.Status status, int attempts, String reason) {
        this.entity = entity;
        this.stage = stage;
        this.variant = variant;
        this.status = status;
        this.attempts = attempts;
        this.reason = reason;
    }

    static LineageFailure of(Outcome outcome) {
        TaskKey key = outcome.getKey();
        return new LineageFailure(key.getEntity(), key.getStage(), key.getVariant(),
                outcome.getStatus(), outcome.getAttempts().size(), outcome.getReason());
    }

    public String getEntity() {
        return entity;
    }

    public String getStage() {
        return stage;
    }

    /**
     * @return variant, or null for stages that run once per entity
     */
    public String getVariant() {
        return variant;
    }

    /**
     * @return {@link Outcome.Status#IGNORED} or {@link Outcome.Status#FATAL}
     */
    public Outcome.Status getStatus() {
        return status;
    }

    public boolean isFatal() {
        return status == Outcome.Status.FATAL;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        String v = variant == null ? "" : ":" + variant;
        return "LineageFailure(" + stage + ":" + entity + v + ", " + status + ", attempts=" + attempts + ", " + reason + ")";
    }
}
