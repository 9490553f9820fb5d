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
package com.ebay.bascomflow.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs tasks: checks the {@link TaskCache}, invokes the collaborator, classifies each exit through the task's
 * {@link RetryPolicy} and backs off between attempts. Distinct tasks may run in parallel, bounded by
 * {@link ResourcePools}; a second request for a task already in flight waits for and shares the first one's
 * outcome instead of running it again.
 *
 * <p>Failures are returned as {@link Outcome}s rather than thrown so that one bad task never disturbs the
 * tasks of other entities.
 *
 * @author Brendan McCarthy
 */
public class TaskRunner {
    private static final Logger LOG = LoggerFactory.getLogger(TaskRunner.class);

    static final String OUTPUTS_MISSING = "declared outputs missing";
    static final String INTERRUPTED = "interrupted";

    private final TaskCache cache;
    private final ResourcePools pools;
    private final RetryPolicy defaultPolicy;
    private final Sleeper sleeper;
    private final Supplier<List<TaskInterceptor>> interceptors;

    private final ConcurrentMap<TaskKey, CompletableFuture<Outcome>> inFlight = new ConcurrentHashMap<>();

    public TaskRunner(TaskCache cache, ResourcePools pools, RetryPolicy defaultPolicy, Sleeper sleeper,
                      List<TaskInterceptor> interceptors) {
        this(cache, pools, defaultPolicy, sleeper, snapshotOf(interceptors));
    }

    public TaskRunner(TaskCache cache, ResourcePools pools, RetryPolicy defaultPolicy, Sleeper sleeper,
                      Supplier<List<TaskInterceptor>> interceptors) {
        this.cache = cache;
        this.pools = pools;
        this.defaultPolicy = defaultPolicy;
        this.sleeper = sleeper;
        this.interceptors = interceptors;
    }

    private static Supplier<List<TaskInterceptor>> snapshotOf(List<TaskInterceptor> interceptors) {
        List<TaskInterceptor> copy = Collections.unmodifiableList(new ArrayList<>(interceptors));
        return () -> copy;
    }

    public TaskCache getCache() {
        return cache;
    }

    /**
     * Runs a task and waits for its outcome. If the same task is already running, waits for that execution
     * instead. Cache checks and locking happen in the calling thread, attempts in the thread of their resource
     * class.
     *
     * @param definition of task
     * @return outcome, never null
     */
    public Outcome run(TaskDefinition definition) {
        try {
            return submit(definition, Runnable::run).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Starts a task without blocking on its attempts. Attempts of a limited resource class run on that class's
     * own executor and all others on the given one, and backoff between attempts is scheduled through the
     * {@link Sleeper} rather than waited out in a thread. If the same task is already in flight, its future is
     * returned instead.
     *
     * @param definition of task
     * @param executor   for attempts of unlimited resource classes
     * @return future outcome
     */
    public CompletableFuture<Outcome> submit(TaskDefinition definition, Executor executor) {
        TaskKey key = definition.getKey();
        CompletableFuture<Outcome> mine = new CompletableFuture<>();
        CompletableFuture<Outcome> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            LOG.debug("{} already in flight, awaiting its outcome", key);
            return existing;
        }
        CompletableFuture<Outcome> work;
        try {
            work = execute(definition, executor);
        } catch (RuntimeException | Error e) {
            work = new CompletableFuture<>();
            work.completeExceptionally(e);
        }
        work.whenComplete((outcome, error) -> {
            if (error == null) {
                mine.complete(outcome);
            } else {
                mine.completeExceptionally(error instanceof CompletionException ? error.getCause() : error);
            }
            inFlight.remove(key, mine);
        });
        return mine;
    }

    private CompletableFuture<Outcome> execute(TaskDefinition definition, Executor executor) {
        TaskKey key = definition.getKey();
        List<String> outputs = definition.getOutputs();
        if (!cache.shouldRun(key, outputs)) {
            return CompletableFuture.completedFuture(cacheHit(key));
        }
        TaskCache.TaskLock lock;
        try {
            lock = cache.lock(key);
        } catch (InterruptedIOException e) {
            Thread.currentThread().interrupt();
            return CompletableFuture.completedFuture(Outcome.fatal(key, INTERRUPTED, Collections.emptyList()));
        } catch (IOException e) {
            LOG.error("Cannot prepare task directory for {}", key, e);
            return CompletableFuture.completedFuture(
                    Outcome.fatal(key, "task directory unavailable: " + e.getMessage(), Collections.emptyList()));
        }
        CompletableFuture<Outcome> outcome;
        try {
            // Another process may have finished it while we waited for the lock
            if (!cache.shouldRun(key, outputs)) {
                outcome = CompletableFuture.completedFuture(cacheHit(key));
            } else {
                RetryPolicy policy = definition.getRetryPolicy() == null ? defaultPolicy : definition.getRetryPolicy();
                Executor slots = pools.executorFor(definition.getResourceClass(), executor);
                outcome = attempt(definition, policy, cache.directoryOf(key), slots, 1, new ArrayList<>());
            }
        } catch (RuntimeException | Error e) {
            release(key, lock);
            throw e;
        }
        return outcome.whenComplete((o, e) -> release(key, lock));
    }

    private static void release(TaskKey key, TaskCache.TaskLock lock) {
        try {
            lock.close();
        } catch (IOException e) {
            LOG.warn("Failed to release lock for {}", key, e);
        }
    }

    private Outcome cacheHit(TaskKey key) {
        LOG.debug("{} cached, skipping", key);
        for (TaskInterceptor next : interceptors.get()) {
            next.onCacheHit(key);
        }
        return Outcome.cached(key);
    }

    private CompletableFuture<Outcome> attempt(TaskDefinition definition, RetryPolicy policy, Path dir,
                                               Executor slots, int attempt, List<TaskAttempt> history) {
        TaskKey key = definition.getKey();
        return CompletableFuture.supplyAsync(() -> {
            try {
                return attemptOnce(definition, policy, dir, attempt);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("{} interrupted during attempt {}", key, attempt);
                return null;
            }
        }, slots).thenCompose(result -> {
            if (result == null) {
                return CompletableFuture.completedFuture(Outcome.fatal(key, INTERRUPTED, history));
            }
            history.add(result);
            appendToLog(dir, result);
            switch (result.getResult()) {
                case SUCCESS:
                    LOG.debug("{} succeeded on attempt {}", key, attempt);
                    return CompletableFuture.completedFuture(Outcome.success(key, history));
                case IGNORABLE_FAILURE:
                    LOG.warn("{} failed with exit {} ({}), ignoring", key, result.getExitCode(), result.getReason());
                    return CompletableFuture.completedFuture(Outcome.ignored(key, result.getReason(), history));
                case FATAL_FAILURE:
                    LOG.error("{} failed after {} attempt(s): {}", key, attempt, result.getReason());
                    return CompletableFuture.completedFuture(Outcome.fatal(key, result.getReason(), history));
                default:
                    Duration wait = policy.backoff(attempt);
                    LOG.info("{} failed with exit {} ({}), retrying in {}", key, result.getExitCode(), result.getReason(), wait);
                    return sleeper.delay(wait).handle((done, error) -> error).thenCompose(error -> {
                        if (error != null) {
                            LOG.warn("{} interrupted during backoff", key);
                            return CompletableFuture.completedFuture(Outcome.fatal(key, INTERRUPTED, history));
                        }
                        return attempt(definition, policy, dir, slots, attempt + 1, history);
                    });
            }
        });
    }

    private TaskAttempt attemptOnce(TaskDefinition definition, RetryPolicy policy, Path dir, int attempt) throws InterruptedException {
        CoreAttempt core = new CoreAttempt(definition, dir, attempt);
        List<PlaceHolderAttempt> chain = new ArrayList<>();
        AttemptRun top = core;
        List<TaskInterceptor> list = interceptors.get();
        for (int i = list.size() - 1; i >= 0; i--) {
            PlaceHolderAttempt next = new PlaceHolderAttempt(list.get(i), top);
            chain.add(next);
            top = next;
        }
        int exitCode;
        String launchFailure = null;
        try {
            exitCode = top.run();
        } catch (IOException e) {
            exitCode = -1;
            launchFailure = "launch failed: " + e.getMessage();
        } finally {
            core.end();
        }
        TaskAttempt result = classify(definition, policy, attempt, exitCode, launchFailure, core.getEndedAt() - core.getStartedAt());
        for (int i = chain.size() - 1; i >= 0; i--) {
            chain.get(i).complete(result);
        }
        return result;
    }

    private TaskAttempt classify(TaskDefinition definition, RetryPolicy policy, int attempt, int exitCode,
                                 String launchFailure, long durationMs) {
        TaskKey key = definition.getKey();
        if (launchFailure != null) {
            return new TaskAttempt(key, attempt, exitCode, durationMs, TaskAttempt.Result.FATAL_FAILURE, launchFailure);
        }
        String reason;
        if (exitCode == 0) {
            if (!cache.shouldRun(key, definition.getOutputs())) {
                return new TaskAttempt(key, attempt, 0, durationMs, TaskAttempt.Result.SUCCESS, null);
            }
            reason = OUTPUTS_MISSING;
        } else {
            RetryPolicy.Classification classification = policy.classify(exitCode);
            if (!classification.getDisposition().isRetryable()) {
                return new TaskAttempt(key, attempt, exitCode, durationMs, TaskAttempt.Result.IGNORABLE_FAILURE, classification.getReason());
            }
            reason = classification.getReason();
        }
        TaskAttempt.Result result = attempt >= policy.getMaxAttempts()
                ? TaskAttempt.Result.FATAL_FAILURE : TaskAttempt.Result.RETRYABLE_FAILURE;
        return new TaskAttempt(key, attempt, exitCode, durationMs, result, reason);
    }

    private static void appendToLog(Path dir, TaskAttempt attempt) {
        String line = attempt.format() + System.lineSeparator();
        try {
            Files.write(dir.resolve(TaskContext.LOG_FILE), line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            LOG.warn("Could not append to task log in {}", dir, e);
        }
    }

    /**
     * Innermost link of the interceptor chain, which actually invokes the collaborator.
     */
    private class CoreAttempt implements AttemptRun {
        private final TaskDefinition definition;
        private final TaskContext context;
        private long startedAt = 0;
        private long endedAt = 0;

        CoreAttempt(TaskDefinition definition, Path dir, int attempt) {
            this.definition = definition;
            this.context = new TaskContext(definition.getKey(), dir, attempt);
        }

        @Override
        public TaskKey getKey() {
            return definition.getKey();
        }

        @Override
        public int getAttempt() {
            return context.getAttempt();
        }

        @Override
        public String getResourceClass() {
            return definition.getResourceClass();
        }

        @Override
        public Path getDirectory() {
            return context.getDirectory();
        }

        @Override
        public long getStartedAt() {
            return startedAt;
        }

        @Override
        public long getEndedAt() {
            return endedAt;
        }

        void end() {
            if (startedAt == 0) {
                startedAt = System.currentTimeMillis();
            }
            if (endedAt == 0) {
                endedAt = System.currentTimeMillis();
            }
        }

        @Override
        public int run() throws IOException, InterruptedException {
            startedAt = System.currentTimeMillis();
            try {
                return definition.getCollaborator().invoke(context);
            } finally {
                endedAt = System.currentTimeMillis();
            }
        }

        @Override
        public String toString() {
            return "Attempt(" + context.getKey() + ", " + context.getAttempt() + ")";
        }
    }
}
