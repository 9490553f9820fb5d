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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Collects the correlation gaps reported by {@link Correlator} operations during a run, and passes tuples that
 * an operation failed on to a listener.
 *
 * @author Brendan McCarthy
 */
public class CorrelationGaps {
    private static final Logger LOG = LoggerFactory.getLogger(CorrelationGaps.class);

    private final List<CorrelationGap> gaps = Collections.synchronizedList(new ArrayList<>());
    private final Consumer<CorrelationFailure> onFailure;

    public CorrelationGaps() {
        this(failure -> {
        });
    }

    /**
     * @param onFailure called for every tuple an operation could not process
     */
    public CorrelationGaps(Consumer<CorrelationFailure> onFailure) {
        this.onFailure = onFailure;
    }

    void record(CorrelationGap gap) {
        LOG.warn("Correlation gap for {} in {}", gap.getEntity(), gap);
        gaps.add(gap);
    }

    void failed(String operation, String entity, Throwable cause) {
        CorrelationFailure failure = new CorrelationFailure(operation, entity, String.valueOf(cause));
        LOG.error("{}", failure, cause);
        onFailure.accept(failure);
    }

    /**
     * @return snapshot of gaps ordered by operation, entity and key
     */
    public List<CorrelationGap> getGaps() {
        List<CorrelationGap> copy;
        synchronized (gaps) {
            copy = new ArrayList<>(gaps);
        }
        copy.sort(Comparator.comparing(CorrelationGap::getOperation)
                .thenComparing(CorrelationGap::getEntity)
                .thenComparing(gap -> String.valueOf(gap.getKey())));
        return copy;
    }

    public int size() {
        return gaps.size();
    }
}
