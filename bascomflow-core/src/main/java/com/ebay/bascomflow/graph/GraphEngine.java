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

import com.ebay.bascomflow.core.GlobalPipelineConfig;
import com.ebay.bascomflow.core.Outcome;
import com.ebay.bascomflow.core.ResourcePools;
import com.ebay.bascomflow.core.RetryPolicy;
import com.ebay.bascomflow.core.Sleeper;
import com.ebay.bascomflow.core.TaskCache;
import com.ebay.bascomflow.core.TaskDefinition;
import com.ebay.bascomflow.core.TaskInterceptor;
import com.ebay.bascomflow.core.TaskKey;
import com.ebay.bascomflow.core.TaskRunner;
import com.ebay.bascomflow.exceptions.InvalidStageException;
import com.ebay.bascomflow.flow.CorrelationFailure;
import com.ebay.bascomflow.flow.CorrelationGaps;
import com.ebay.bascomflow.flow.Flow;
import com.ebay.bascomflow.sink.ResultSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Core implementation of StageGraph, maintains per-stage bookkeeping during execution.
 *
 * @author Brendan McCarthy
 */
public class GraphEngine implements StageGraph {
    private static final Logger LOG = LoggerFactory.getLogger(GraphEngine.class);

    private final String name;
    private final TaskCache cache;
    private final ResultSink sink;
    private final CorrelationGaps gaps = new CorrelationGaps(this::correlationFailed);

    private ExecutorService executorService;
    private volatile RetryPolicy defaultRetryPolicy;
    private volatile Sleeper sleeper;
    private final Map<String, Integer> resourceLimits = new LinkedHashMap<>();
    private final List<TaskInterceptor> interceptors = new CopyOnWriteArrayList<>();
    private TaskRunner runner = null;

    // For generating unique thread names for framework-managed threads
    private static final AtomicInteger engineCounter = new AtomicInteger(0);
    private final int uniqueIndex;
    private final AtomicInteger threadCounter = new AtomicInteger(0);

    private final Map<String, StageCounter> counters = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<LineageFailure> failures = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, List<GateDecision>> decisions = new ConcurrentHashMap<>();

    private static class StageCounter {
        final String stage;
        final Set<String> entered = ConcurrentHashMap.newKeySet();
        final Set<String> reached = ConcurrentHashMap.newKeySet();

        StageCounter(String stage) {
            this.stage = stage;
        }

        RunSummary.StageCount snapshot() {
            return new RunSummary.StageCount(stage, entered.size(), reached.size());
        }
    }

    GraphEngine(String name, TaskCache cache, ResultSink sink, Object arg) {
        this.name = name;
        this.cache = cache;
        this.sink = sink;
        this.uniqueIndex = engineCounter.incrementAndGet();
        GlobalPipelineConfig.Config config = GlobalPipelineConfig.getConfig();
        config.updateConfigurationOn(this, arg);
        if (sink != null) {
            sink.table(FAILURES_TABLE, 3, "entity", "stage", "variant", "status", "attempts", "reason");
        }
    }

    @Override
    public String getName() {
        return name;
    }

    String createThreadName() {
        StringBuilder sb = new StringBuilder();
        sb.append("BF-");
        sb.append(uniqueIndex);
        sb.append('-');
        if (name != null) {
            sb.append(name);
            sb.append('-');
        }
        sb.append(threadCounter.incrementAndGet());
        return sb.toString();
    }

    int getCountOfThreadsSpawned() {
        return threadCounter.get();
    }

    @Override
    public void restoreConfigurationDefaults(Object arg) {
        GlobalPipelineConfig.getConfig().updateConfigurationOn(this, arg);
    }

    @Override
    public ExecutorService getExecutorService() {
        return executorService;
    }

    @Override
    public void setExecutorService(ExecutorService executorService) {
        this.executorService = executorService;
    }

    @Override
    public void restoreDefaultExecutorService() {
        this.executorService = GlobalPipelineConfig.getConfig().getExecutorService();
    }

    @Override
    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    @Override
    public void setDefaultRetryPolicy(RetryPolicy policy) {
        this.defaultRetryPolicy = policy;
    }

    @Override
    public Sleeper getSleeper() {
        return sleeper;
    }

    @Override
    public void setSleeper(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    @Override
    public synchronized Map<String, Integer> getResourceLimits() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(resourceLimits));
    }

    @Override
    public synchronized void setResourceLimit(String resourceClass, int slots) {
        if (runner != null) {
            throw new IllegalStateException("Resource limits of graph " + name + " are fixed once stages are declared");
        }
        if (slots < 1) {
            throw new IllegalArgumentException("Resource class " + resourceClass + " needs at least one slot");
        }
        resourceLimits.put(resourceClass, slots);
    }

    @Override
    public void firstInterceptWith(TaskInterceptor interceptor) {
        interceptors.add(0, interceptor);
    }

    @Override
    public void lastInterceptWith(TaskInterceptor interceptor) {
        interceptors.add(interceptor);
    }

    @Override
    public int getNumberOfInterceptors() {
        return interceptors.size();
    }

    @Override
    public void removeInterceptor(TaskInterceptor interceptor) {
        interceptors.remove(interceptor);
    }

    @Override
    public void removeAllInterceptors() {
        interceptors.clear();
    }

    @Override
    public CorrelationGaps getGaps() {
        return gaps;
    }

    @Override
    public synchronized TaskRunner getTaskRunner() {
        if (runner == null) {
            ResourcePools pools = new ResourcePools(resourceLimits);
            runner = new TaskRunner(cache, pools, defaultRetryPolicy, new GraphSleeper(), () -> interceptors);
        }
        return runner;
    }

    /**
     * Follows whatever sleeper the graph currently has, including its non-blocking delay.
     */
    private class GraphSleeper implements Sleeper {
        @Override
        public void sleep(Duration duration) throws InterruptedException {
            sleeper.sleep(duration);
        }

        @Override
        public CompletableFuture<Void> delay(Duration duration) {
            return sleeper.delay(duration);
        }
    }

    private Executor executor() {
        return runnable -> executorService.execute(() -> {
            Thread thread = Thread.currentThread();
            String was = thread.getName();
            thread.setName(createThreadName());
            try {
                runnable.run();
            } finally {
                thread.setName(was);
            }
        });
    }

    private StageCounter declare(String stage) {
        StageCounter counter = new StageCounter(stage);
        if (counters.putIfAbsent(stage, counter) != null) {
            throw new InvalidStageException("Stage or gate named \"" + stage + "\" already declared in graph " + name);
        }
        return counter;
    }

    @Override
    public <T> Flow<T> source(Collection<String> entities, Function<String, T> fn) {
        LOG.info("Graph {} starting with {} entities", name, entities.size());
        return Flow.of(entities, fn);
    }

    @Override
    public <I, O> Flow<O> stage(Stage<I, O> stage, Flow<I> input) {
        StageCounter counter = declare(stage.getName());
        TaskRunner taskRunner = getTaskRunner();
        RetryPolicy policy = defaultRetryPolicy;
        Executor executor = executor();
        LOG.debug("Declared stage {} in graph {}", stage.getName(), name);
        return input.flatMapAsync(item -> CompletableFuture
                .supplyAsync(() -> define(stage, item, policy, counter), executor)
                .thenCompose(definition -> {
                    if (definition == null) {
                        return CompletableFuture.completedFuture(Collections.<O>emptyList());
                    }
                    return taskRunner.submit(definition, executor).handleAsync(
                            (outcome, error) -> complete(stage, item, definition.getKey(), outcome, error, counter), executor);
                }));
    }

    private <I, O> TaskDefinition define(Stage<I, O> stage, I item, RetryPolicy policy, StageCounter counter) {
        TaskKey key = null;
        try {
            key = stage.keyOf(item);
            counter.entered.add(key.getEntity());
            return stage.define(item, cache.directoryOf(key), policy);
        } catch (RuntimeException e) {
            stageError(stage, item, key, e);
            return null;
        }
    }

    private <I, O> List<O> complete(Stage<I, O> stage, I item, TaskKey key, Outcome outcome, Throwable error,
                                    StageCounter counter) {
        if (error != null) {
            stageError(stage, item, key, error instanceof CompletionException ? error.getCause() : error);
            return Collections.emptyList();
        }
        if (!outcome.isSuccess()) {
            fail(LineageFailure.of(outcome));
            return Collections.emptyList();
        }
        try {
            List<O> result = stage.read(item, cache.directoryOf(key));
            counter.reached.add(key.getEntity());
            return result;
        } catch (IOException | RuntimeException e) {
            stageError(stage, item, key, e);
            return Collections.emptyList();
        }
    }

    private void stageError(Stage<?, ?> stage, Object item, TaskKey key, Throwable e) {
        LOG.error("Stage {} failed on {}", stage.getName(), key == null ? item : key, e);
        String entity = key == null ? String.valueOf(item) : key.getEntity();
        String variant = key == null ? null : key.getVariant();
        fail(new LineageFailure(entity, stage.getName(), variant, Outcome.Status.FATAL, 0, "stage error: " + e));
    }

    private void correlationFailed(CorrelationFailure failure) {
        fail(new LineageFailure(failure.getEntity(), failure.getOperation(), null, Outcome.Status.FATAL, 0,
                "correlation error: " + failure.getReason()));
    }

    private void fail(LineageFailure failure) {
        failures.add(failure);
        if (sink != null) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("entity", failure.getEntity());
            row.put("stage", failure.getStage());
            row.put("variant", failure.getVariant());
            row.put("status", failure.getStatus());
            row.put("attempts", failure.getAttempts());
            row.put("reason", failure.getReason());
            sink.record(FAILURES_TABLE, row);
        }
    }

    @Override
    public <T> Flow<T> gate(Gate<T> gate, Flow<T> input) {
        StageCounter counter = declare(gate.getName());
        List<String> fieldNames = new ArrayList<>(gate.getFieldNames());
        if (sink != null) {
            List<String> header = new ArrayList<>();
            header.add("entity");
            header.add("pass");
            header.add("reasons");
            header.addAll(fieldNames);
            sink.table(gate.getName(), 1, header);
        }
        Executor executor = executor();
        return input.flatMapAsync(item -> CompletableFuture.supplyAsync(
                () -> evaluate(gate, fieldNames, item, counter), executor));
    }

    private <T> List<T> evaluate(Gate<T> gate, List<String> fieldNames, T item, StageCounter counter) {
        String entity = String.valueOf(item);
        GateDecision decision;
        try {
            entity = gate.entityOf(item);
            counter.entered.add(entity);
            decision = gate.evaluate(item);
        } catch (IOException | RuntimeException e) {
            LOG.error("Gate {} could not evaluate {}", gate.getName(), entity, e);
            decision = GateDecision.builder(entity).fail("evaluation error: " + e.getMessage()).build();
        }
        decisions.computeIfAbsent(gate.getName(), k -> Collections.synchronizedList(new ArrayList<>())).add(decision);
        if (sink != null) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("entity", decision.getEntity());
            row.put("pass", decision.isPass());
            row.put("reasons", String.join("; ", decision.getReasons()));
            for (String next : fieldNames) {
                row.put(next, decision.getFields().get(next));
            }
            sink.record(gate.getName(), row);
        }
        if (decision.isPass()) {
            counter.reached.add(entity);
            return Collections.singletonList(item);
        }
        LOG.info("Gate {} rejected {}: {}", gate.getName(), entity, decision.getReasons());
        return Collections.emptyList();
    }

    @Override
    public RunSummary await(Flow<?>... flows) {
        CompletableFuture<?>[] array = new CompletableFuture[flows.length];
        for (int i = 0; i < flows.length; i++) {
            array[i] = flows[i].collect();
        }
        try {
            CompletableFuture.allOf(array).join();
        } catch (CompletionException e) {
            // Strip away the CompletionException since that is just an internal artifact from the join above
            Throwable t = e.getCause();
            if (t instanceof RuntimeException) {
                throw (RuntimeException) t;
            } else {
                throw new RuntimeException("Execution exception", t);
            }
        }
        return summarize();
    }

    private RunSummary summarize() {
        List<RunSummary.StageCount> counts = new ArrayList<>();
        synchronized (counters) {
            for (StageCounter next : counters.values()) {
                counts.add(next.snapshot());
            }
        }
        Map<String, List<GateDecision>> sorted = new LinkedHashMap<>();
        decisions.forEach((gate, list) -> {
            List<GateDecision> copy;
            synchronized (list) {
                copy = new ArrayList<>(list);
            }
            copy.sort(Comparator.comparing(GateDecision::getEntity));
            sorted.put(gate, Collections.unmodifiableList(copy));
        });
        List<LineageFailure> failed;
        synchronized (failures) {
            failed = new ArrayList<>(failures);
        }
        RunSummary summary = new RunSummary(name, failed, gaps.getGaps(), counts, sorted);
        for (String next : summary.getWarnings()) {
            LOG.warn("{}: {}", name, next);
        }
        LOG.info("Graph {} finished: {}", name, summary);
        return summary;
    }

    @Override
    public String toString() {
        return "GraphEngine(" + name + ")";
    }
}
