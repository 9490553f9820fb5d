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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A typed stream of immutable tuples divided into lanes, one per originating entity key. Each lane completes
 * independently once every tuple descended from that entity is available for this point of the pipeline, so an
 * entity can progress through later stages while its siblings are still at earlier ones. A lane may complete
 * empty, which means the entity did not reach this point.
 *
 * <p>Flows are immutable; every operation returns a new flow.
 *
 * @param <T> tuple type
 * @author Brendan McCarthy
 */
public final class Flow<T> {
    private final SortedMap<String, CompletableFuture<List<T>>> lanes;

    private Flow(SortedMap<String, CompletableFuture<List<T>>> lanes) {
        this.lanes = Collections.unmodifiableSortedMap(lanes);
    }

    /**
     * Creates a flow from lanes that may still be pending.
     *
     * @param lanes by entity key
     * @param <T>   tuple type
     * @return new flow
     */
    public static <T> Flow<T> fromLanes(Map<String, CompletableFuture<List<T>>> lanes) {
        return new Flow<>(new TreeMap<>(lanes));
    }

    /**
     * Creates a flow with one already-available tuple per entity key.
     *
     * @param keys entity keys, which must be unique
     * @param fn   creates the tuple for a key
     * @param <T>  tuple type
     * @return new flow
     * @throws IllegalArgumentException on a duplicate key
     */
    public static <T> Flow<T> of(Collection<String> keys, Function<String, T> fn) {
        SortedMap<String, CompletableFuture<List<T>>> map = new TreeMap<>();
        for (String next : keys) {
            List<T> lane = Collections.singletonList(fn.apply(next));
            if (map.put(next, CompletableFuture.completedFuture(lane)) != null) {
                throw new IllegalArgumentException("Duplicate entity key " + next);
            }
        }
        return new Flow<>(map);
    }

    /**
     * @return entity keys with a lane in this flow, in sorted order
     */
    public Collection<String> keys() {
        return lanes.keySet();
    }

    public int size() {
        return lanes.size();
    }

    /**
     * Returns the lane for an entity key.
     *
     * @param key entity key
     * @return future list of tuples, an already-empty list if the key has no lane
     */
    public CompletableFuture<List<T>> lane(String key) {
        CompletableFuture<List<T>> lane = lanes.get(key);
        return lane == null ? CompletableFuture.completedFuture(Collections.emptyList()) : lane;
    }

    Map<String, CompletableFuture<List<T>>> lanes() {
        return lanes;
    }

    /**
     * Applies an asynchronous one-to-many function to every tuple. Results within a lane keep the order of the
     * tuples they came from.
     *
     * @param fn  to apply
     * @param <R> result tuple type
     * @return new flow with the same keys
     */
    public <R> Flow<R> flatMapAsync(Function<T, CompletableFuture<List<R>>> fn) {
        SortedMap<String, CompletableFuture<List<R>>> map = new TreeMap<>();
        for (Map.Entry<String, CompletableFuture<List<T>>> next : lanes.entrySet()) {
            map.put(next.getKey(), next.getValue().thenCompose(items -> {
                List<CompletableFuture<List<R>>> parts = new ArrayList<>(items.size());
                for (T item : items) {
                    parts.add(fn.apply(item));
                }
                return concat(parts);
            }));
        }
        return new Flow<>(map);
    }

    /**
     * Applies a synchronous one-to-one function to every tuple.
     *
     * @param fn  to apply
     * @param <R> result tuple type
     * @return new flow with the same keys
     */
    public <R> Flow<R> map(Function<T, R> fn) {
        SortedMap<String, CompletableFuture<List<R>>> map = new TreeMap<>();
        for (Map.Entry<String, CompletableFuture<List<T>>> next : lanes.entrySet()) {
            map.put(next.getKey(), next.getValue().thenApply(items -> {
                List<R> result = new ArrayList<>(items.size());
                for (T item : items) {
                    result.add(fn.apply(item));
                }
                return result;
            }));
        }
        return new Flow<>(map);
    }

    static <R> CompletableFuture<List<R>> concat(List<CompletableFuture<List<R>>> parts) {
        CompletableFuture<?>[] array = parts.toArray(new CompletableFuture<?>[0]);
        return CompletableFuture.allOf(array).thenApply(v -> {
            List<R> result = new ArrayList<>();
            for (CompletableFuture<List<R>> next : parts) {
                result.addAll(next.join());
            }
            return result;
        });
    }

    /**
     * Waits for every lane.
     *
     * @return future of all tuples, in entity key order
     */
    public CompletableFuture<List<T>> collect() {
        return concat(new ArrayList<>(lanes.values()));
    }

    /**
     * Waits for every lane, keeping lanes separate.
     *
     * @return future map from entity key to tuples, sorted by key, including empty lanes
     */
    public CompletableFuture<Map<String, List<T>>> collectByKey() {
        CompletableFuture<?>[] array = lanes.values().toArray(new CompletableFuture<?>[0]);
        return CompletableFuture.allOf(array).thenApply(v -> {
            Map<String, List<T>> result = new LinkedHashMap<>();
            lanes.forEach((key, lane) -> result.put(key, lane.join()));
            return result;
        });
    }

    @Override
    public String toString() {
        return "Flow" + lanes.keySet();
    }
}
