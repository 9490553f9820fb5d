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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Relational operations used to wire stages together. All are pure functions of their input flows: the result
 * depends only on which tuples arrive, never on the order in which lanes complete. Operations work lane by
 * lane, and {@link #join} and {@link #cross} wait for both sides of a lane before producing its output.
 *
 * <p>Keys inside a lane are taken from tuples by explicit key-extraction functions. Emission order within a lane
 * follows the input lists and should not be relied on.
 *
 * <p>A function that throws for one tuple drops only that tuple: the failure is passed to
 * {@link CorrelationGaps} and the rest of the lane, and every other lane, carries on.
 *
 * @author Brendan McCarthy
 */
public final class Correlator {

    private Correlator() {
    }

    /**
     * Inner join. For every entity, pairs each left tuple with each right tuple having an equal key. A tuple with
     * no partner is recorded as a {@link CorrelationGap} and dropped.
     *
     * @param name     of this join, used when recording gaps
     * @param left     flow
     * @param leftKey  extracts the correlation key from a left tuple
     * @param right    flow
     * @param rightKey extracts the correlation key from a right tuple
     * @param combiner creates the output tuple
     * @param gaps     receives unmatched tuples
     * @param <A>      left tuple type
     * @param <B>      right tuple type
     * @param <R>      result tuple type
     * @return joined flow
     */
    public static <A, B, R> Flow<R> join(String name, Flow<A> left, Function<A, ?> leftKey,
                                         Flow<B> right, Function<B, ?> rightKey,
                                         BiFunction<A, B, R> combiner, CorrelationGaps gaps) {
        return correlate(name, left, leftKey, right, rightKey, combiner, gaps, false);
    }

    /**
     * Cartesian product correlated on key: each tuple of a right-hand batch (e.g. several named variants of one
     * entity) is paired with the left tuple carrying the same key. Unlike {@link #join}, output is ordered by the
     * right-hand batch.
     *
     * @param name     of this cross, used when recording gaps
     * @param single   flow holding the per-key record
     * @param singleKey extracts the key from a single tuple
     * @param batch    flow holding the batch
     * @param batchKey extracts the key from a batch tuple
     * @param combiner creates the output tuple
     * @param gaps     receives unmatched tuples
     * @param <A>      single tuple type
     * @param <B>      batch tuple type
     * @param <R>      result tuple type
     * @return crossed flow
     */
    public static <A, B, R> Flow<R> cross(String name, Flow<A> single, Function<A, ?> singleKey,
                                          Flow<B> batch, Function<B, ?> batchKey,
                                          BiFunction<A, B, R> combiner, CorrelationGaps gaps) {
        return correlate(name, single, singleKey, batch, batchKey, combiner, gaps, true);
    }

    private static <A, B, R> Flow<R> correlate(String name, Flow<A> left, Function<A, ?> leftKey,
                                               Flow<B> right, Function<B, ?> rightKey,
                                               BiFunction<A, B, R> combiner, CorrelationGaps gaps,
                                               boolean rightMajor) {
        Set<String> keys = new HashSet<>(left.keys());
        keys.addAll(right.keys());
        SortedMap<String, CompletableFuture<List<R>>> lanes = new TreeMap<>();
        for (String entity : keys) {
            CompletableFuture<List<R>> lane = left.lane(entity).thenCombine(right.lane(entity), (as, bs) ->
                    correlateLane(name, entity, as, leftKey, bs, rightKey, combiner, gaps, rightMajor));
            lanes.put(entity, lane);
        }
        return Flow.fromLanes(lanes);
    }

    private static <A, B, R> List<R> correlateLane(String name, String entity,
                                                   List<A> as, Function<A, ?> leftKey,
                                                   List<B> bs, Function<B, ?> rightKey,
                                                   BiFunction<A, B, R> combiner, CorrelationGaps gaps,
                                                   boolean rightMajor) {
        List<Keyed<A>> keyedAs = keyed(name, entity, as, leftKey, gaps);
        List<Keyed<B>> keyedBs = keyed(name, entity, bs, rightKey, gaps);
        Map<Object, List<A>> leftIndex = index(keyedAs);
        Map<Object, List<B>> rightIndex = index(keyedBs);
        List<R> result = new ArrayList<>();
        if (rightMajor) {
            for (Keyed<B> b : keyedBs) {
                for (A a : leftIndex.getOrDefault(b.key, Collections.emptyList())) {
                    combine(name, entity, a, b.item, combiner, gaps, result);
                }
            }
        } else {
            for (Keyed<A> a : keyedAs) {
                for (B b : rightIndex.getOrDefault(a.key, Collections.emptyList())) {
                    combine(name, entity, a.item, b, combiner, gaps, result);
                }
            }
        }
        for (Object next : leftIndex.keySet()) {
            if (!rightIndex.containsKey(next)) {
                gaps.record(new CorrelationGap(name, entity, next, CorrelationGap.Side.RIGHT));
            }
        }
        for (Object next : rightIndex.keySet()) {
            if (!leftIndex.containsKey(next)) {
                gaps.record(new CorrelationGap(name, entity, next, CorrelationGap.Side.LEFT));
            }
        }
        return result;
    }

    private static <A, B, R> void combine(String name, String entity, A a, B b, BiFunction<A, B, R> combiner,
                                          CorrelationGaps gaps, List<R> result) {
        try {
            result.add(combiner.apply(a, b));
        } catch (RuntimeException e) {
            gaps.failed(name, entity, e);
        }
    }

    private static final class Keyed<T> {
        final T item;
        final Object key;

        Keyed(T item, Object key) {
            this.item = item;
            this.key = key;
        }
    }

    private static <T> List<Keyed<T>> keyed(String name, String entity, List<T> items, Function<T, ?> keyFn,
                                            CorrelationGaps gaps) {
        List<Keyed<T>> result = new ArrayList<>(items.size());
        for (T next : items) {
            try {
                result.add(new Keyed<>(next, keyFn.apply(next)));
            } catch (RuntimeException e) {
                gaps.failed(name, entity, e);
            }
        }
        return result;
    }

    private static <T> Map<Object, List<T>> index(List<Keyed<T>> items) {
        Map<Object, List<T>> map = new LinkedHashMap<>();
        for (Keyed<T> next : items) {
            map.computeIfAbsent(next.key, k -> new ArrayList<>()).add(next.item);
        }
        return map;
    }

    /**
     * Fan-out: expands each tuple holding a parallel list into one tuple per element, each re-tagged with a
     * sub-key derived from the element (typically a variant name taken from the artifact's own name).
     *
     * @param name     of this expansion, used when recording failures
     * @param flow     to expand
     * @param elements extracts the list from a tuple
     * @param retag    creates the output tuple for one element
     * @param gaps     receives tuples that could not be expanded
     * @param <A>      input tuple type
     * @param <E>      element type
     * @param <R>      result tuple type
     * @return expanded flow
     */
    public static <A, E, R> Flow<R> transpose(String name, Flow<A> flow, Function<A, List<E>> elements,
                                              BiFunction<A, E, R> retag, CorrelationGaps gaps) {
        SortedMap<String, CompletableFuture<List<R>>> lanes = new TreeMap<>();
        flow.lanes().forEach((entity, lane) -> lanes.put(entity, lane.thenApply(items -> {
            List<R> result = new ArrayList<>();
            for (A item : items) {
                List<E> list;
                try {
                    list = elements.apply(item);
                } catch (RuntimeException e) {
                    gaps.failed(name, entity, e);
                    continue;
                }
                for (E element : list) {
                    try {
                        result.add(retag.apply(item, element));
                    } catch (RuntimeException e) {
                        gaps.failed(name, entity, e);
                    }
                }
            }
            return result;
        })));
        return Flow.fromLanes(lanes);
    }

    /**
     * Fan-in: union of two same-shaped flows. Every tuple from both sides is kept, including duplicates.
     *
     * @param first  flow
     * @param second flow
     * @param <A>    tuple type
     * @return union
     */
    public static <A> Flow<A> mix(Flow<? extends A> first, Flow<? extends A> second) {
        Set<String> keys = new HashSet<>(first.keys());
        keys.addAll(second.keys());
        SortedMap<String, CompletableFuture<List<A>>> lanes = new TreeMap<>();
        for (String entity : keys) {
            lanes.put(entity, first.lane(entity).thenCombine(second.lane(entity), (as, bs) -> {
                List<A> result = new ArrayList<>(as.size() + bs.size());
                result.addAll(as);
                result.addAll(bs);
                return result;
            }));
        }
        return Flow.fromLanes(lanes);
    }

    /**
     * Keeps the tuples satisfying a predicate. A tuple the predicate throws on is dropped and reported.
     *
     * @param name      of this filter, used when recording failures
     * @param flow      to filter
     * @param predicate to retain by
     * @param gaps      receives tuples the predicate failed on
     * @param <A>       tuple type
     * @return filtered flow, with the same keys
     */
    public static <A> Flow<A> filter(String name, Flow<A> flow, Predicate<A> predicate, CorrelationGaps gaps) {
        SortedMap<String, CompletableFuture<List<A>>> lanes = new TreeMap<>();
        flow.lanes().forEach((entity, lane) -> lanes.put(entity, lane.thenApply(items -> {
            List<A> result = new ArrayList<>(items.size());
            for (A item : items) {
                try {
                    if (predicate.test(item)) {
                        result.add(item);
                    }
                } catch (RuntimeException e) {
                    gaps.failed(name, entity, e);
                }
            }
            return result;
        })));
        return Flow.fromLanes(lanes);
    }
}
