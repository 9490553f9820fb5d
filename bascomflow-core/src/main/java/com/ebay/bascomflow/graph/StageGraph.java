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

import com.ebay.bascomflow.core.CommonConfig;
import com.ebay.bascomflow.core.TaskCache;
import com.ebay.bascomflow.core.TaskRunner;
import com.ebay.bascomflow.flow.CorrelationGaps;
import com.ebay.bascomflow.flow.Flow;
import com.ebay.bascomflow.sink.ResultSink;

import java.util.Collection;
import java.util.function.Function;

/**
 * A StageGraph wires stages, gates and correlator operations into a pipeline over a batch of entities.
 * Declaring a stage starts its tasks as soon as their input tuples arrive, so the whole graph runs as
 * one dataflow: a slow entity never holds up the others, and failures stay within the lineage they occur in.
 *
 * <p>A graph is created with its task cache and, optionally, the sink that receives gate decisions and
 * failures. Configuration is copied from {@link com.ebay.bascomflow.core.GlobalPipelineConfig} on creation
 * and may be changed until the first stage is declared.
 *
 * @author Brendan McCarthy
 */
public interface StageGraph extends CommonConfig {

    /**
     * Name of the result table receiving lineage failures, when the graph has a sink.
     */
    String FAILURES_TABLE = "failures";

    static StageGraph create(String name, TaskCache cache) {
        return create(name, cache, null);
    }

    static StageGraph create(String name, TaskCache cache, ResultSink sink) {
        return create(name, cache, sink, null);
    }

    /**
     * Creates a graph with the given name and argument.
     *
     * @param name  of graph, used in thread names and logging
     * @param cache where task outputs live
     * @param sink  receives gate decisions and failures, may be null
     * @param arg   passed to {@link com.ebay.bascomflow.core.GlobalPipelineConfig.Config#afterDefaultInitialization}
     * @return new graph
     */
    static StageGraph create(String name, TaskCache cache, ResultSink sink, Object arg) {
        return new GraphEngine(name, cache, sink, arg);
    }

    String getName();

    /**
     * Creates the starting flow, one lane per entity.
     *
     * @param entities keys, must be distinct
     * @param fn       creates the initial tuple of an entity
     * @param <T>      tuple type
     * @return flow
     */
    <T> Flow<T> source(Collection<String> entities, Function<String, T> fn);

    /**
     * Runs a stage over every tuple of a flow as it arrives.
     *
     * @param stage to run
     * @param input tuples
     * @param <I>   input tuple type
     * @param <O>   output tuple type
     * @return output tuples of every task that succeeded or was cached
     * @throws com.ebay.bascomflow.exceptions.InvalidStageException if a stage of that name was already declared
     */
    <I, O> Flow<O> stage(Stage<I, O> stage, Flow<I> input);

    /**
     * Evaluates a gate over every tuple of a flow, recording every decision.
     *
     * @param gate  to evaluate
     * @param input tuples
     * @param <T>   tuple type
     * @return tuples that passed
     */
    <T> Flow<T> gate(Gate<T> gate, Flow<T> input);

    /**
     * @return gaps collector to pass to {@link com.ebay.bascomflow.flow.Correlator} operations of this graph
     */
    CorrelationGaps getGaps();

    TaskRunner getTaskRunner();

    /**
     * Waits for the given flows to complete and summarizes the run so far.
     *
     * @param flows terminal flows
     * @return summary
     */
    RunSummary await(Flow<?>... flows);
}
