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

import com.ebay.bascomflow.exceptions.FatalTaskException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Tests caching, retry, deduplication and resource limits of the task runner.
 *
 * @author Brendan McCarthy
 */
@SuppressFBWarnings("UMAC_UNCALLABLE_METHOD_OF_ANONYMOUS_CLASS")
public class TaskRunnerTest {
    private static final String OUT = "out.txt";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    private DirectoryTaskCache cache;
    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());

    private final RetryPolicy downloadPolicy = RetryPolicy.builder()
            .ignore(99, "checksum mismatch")
            .retry(75, "temporary failure")
            .maxAttempts(5)
            .backoff(2, TimeUnit.SECONDS)
            .build();

    @Before
    public void before() throws IOException {
        cache = new DirectoryTaskCache(folder.newFolder("cache").toPath());
    }

    private TaskRunner runner(List<TaskInterceptor> interceptors) {
        return runner(Collections.emptyMap(), interceptors);
    }

    private TaskRunner runner(java.util.Map<String, Integer> limits, List<TaskInterceptor> interceptors) {
        return new TaskRunner(cache, new ResourcePools(limits), RetryPolicy.once(), sleeps::add, interceptors);
    }

    private static void writeOutput(TaskContext context) throws IOException {
        Files.write(context.getDirectory().resolve(OUT), "done".getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the scripted exit codes in turn, writing the output whenever it returns zero.
     */
    private static class Scripted implements Collaborator {
        private final int[] codes;
        final AtomicInteger calls = new AtomicInteger(0);

        Scripted(int... codes) {
            this.codes = codes;
        }

        @Override
        public int invoke(TaskContext context) throws IOException {
            int pos = calls.getAndIncrement();
            int code = codes[Math.min(pos, codes.length - 1)];
            if (code == 0) {
                writeOutput(context);
            }
            return code;
        }
    }

    private TaskDefinition task(String entity, Collaborator collaborator, RetryPolicy policy) {
        return TaskDefinition.builder(TaskKey.of(entity, "download"))
                .output(OUT)
                .collaborator(collaborator)
                .retryPolicy(policy)
                .build();
    }

    @Test
    public void succeedsFirstTime() throws IOException {
        Scripted collaborator = new Scripted(0);
        Outcome outcome = runner(Collections.emptyList()).run(task("A", collaborator, downloadPolicy));
        assertEquals(Outcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(1, outcome.getAttempts().size());
        assertTrue(sleeps.isEmpty());

        Path log = cache.directoryOf(outcome.getKey()).resolve(TaskContext.LOG_FILE);
        List<String> lines = Files.readAllLines(log, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0), lines.get(0).startsWith("attempt=1 exit=0"));
    }

    @Test
    public void cachedTaskMakesNoAttempts() throws IOException {
        TaskKey key = TaskKey.of("A", "download");
        Files.write(cache.prepare(key).resolve(OUT), "old".getBytes(StandardCharsets.UTF_8));
        List<TaskKey> hits = new ArrayList<>();
        TaskInterceptor recorder = new PassThrough() {
            @Override
            public void onCacheHit(TaskKey hit) {
                hits.add(hit);
            }
        };
        Scripted collaborator = new Scripted(0);
        Outcome outcome = runner(Collections.singletonList(recorder)).run(task("A", collaborator, downloadPolicy));

        assertEquals(Outcome.Status.CACHED, outcome.getStatus());
        assertTrue(outcome.isSuccess());
        assertEquals(0, collaborator.calls.get());
        assertEquals(Collections.singletonList(key), hits);
    }

    @Test
    public void retriesWithExponentialBackoff() {
        Scripted collaborator = new Scripted(75, 75, 75, 0);
        Outcome outcome = runner(Collections.emptyList()).run(task("A", collaborator, downloadPolicy));

        assertEquals(Outcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(4, outcome.getAttempts().size());
        assertEquals(Arrays.asList(Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8)), sleeps);
        assertEquals(TaskAttempt.Result.RETRYABLE_FAILURE, outcome.getAttempts().get(0).getResult());
        assertEquals("temporary failure", outcome.getAttempts().get(0).getReason());
    }

    @Test
    public void ignorableExitStopsImmediately() {
        Scripted collaborator = new Scripted(99);
        Outcome outcome = runner(Collections.emptyList()).run(task("A", collaborator, downloadPolicy));

        assertEquals(Outcome.Status.IGNORED, outcome.getStatus());
        assertEquals("checksum mismatch", outcome.getReason());
        assertEquals(1, outcome.getAttempts().size());
        assertTrue(sleeps.isEmpty());
        assertSame(outcome, outcome.orThrow());
    }

    @Test
    public void exhaustedBudgetIsFatal() {
        Scripted collaborator = new Scripted(75);
        Outcome outcome = runner(Collections.emptyList()).run(task("A", collaborator, downloadPolicy.withMaxAttempts(3)));

        assertEquals(Outcome.Status.FATAL, outcome.getStatus());
        assertEquals(3, collaborator.calls.get());
        assertEquals(Arrays.asList(Duration.ofSeconds(2), Duration.ofSeconds(4)), sleeps);
        assertEquals(TaskAttempt.Result.FATAL_FAILURE, outcome.getAttempts().get(2).getResult());
        try {
            outcome.orThrow();
            fail("Expected FatalTaskException");
        } catch (FatalTaskException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("temporary failure"));
        }
    }

    @Test
    public void unknownCodeIsRetriedAsUnknown() {
        Scripted collaborator = new Scripted(3, 0);
        Outcome outcome = runner(Collections.emptyList()).run(task("A", collaborator, downloadPolicy));

        assertEquals(Outcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(RetryPolicy.UNKNOWN_REASON, outcome.getAttempts().get(0).getReason());
        assertEquals(1, sleeps.size());
    }

    @Test
    public void defaultPolicyMakesOneAttempt() {
        Scripted collaborator = new Scripted(1);
        Outcome outcome = runner(Collections.emptyList()).run(task("A", collaborator, null));

        assertEquals(Outcome.Status.FATAL, outcome.getStatus());
        assertEquals(1, collaborator.calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void zeroExitWithoutOutputsIsRetried() {
        AtomicInteger calls = new AtomicInteger(0);
        Collaborator lazy = context -> {
            if (calls.incrementAndGet() > 1) {
                writeOutput(context);
            }
            return 0;
        };
        Outcome outcome = runner(Collections.emptyList()).run(task("A", lazy, downloadPolicy));

        assertEquals(Outcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(2, outcome.getAttempts().size());
        assertEquals(TaskRunner.OUTPUTS_MISSING, outcome.getAttempts().get(0).getReason());
    }

    @Test
    public void launchFailureIsFatal() {
        Collaborator broken = context -> {
            throw new IOException("no such program");
        };
        Outcome outcome = runner(Collections.emptyList()).run(task("A", broken, downloadPolicy));

        assertEquals(Outcome.Status.FATAL, outcome.getStatus());
        assertEquals("launch failed: no such program", outcome.getReason());
        assertEquals(-1, outcome.getAttempts().get(0).getExitCode());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    public void concurrentRequestsShareOneExecution() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger(0);
        Collaborator slow = context -> {
            calls.incrementAndGet();
            started.countDown();
            proceed.await();
            writeOutput(context);
            return 0;
        };
        TaskRunner runner = runner(Collections.emptyList());
        TaskDefinition definition = task("A", slow, downloadPolicy);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            CompletableFuture<Outcome> first = runner.submit(definition, executor);
            assertTrue(started.await(5, TimeUnit.SECONDS));
            CompletableFuture<Outcome> second = runner.submit(definition, executor);
            Thread.sleep(50);
            proceed.countDown();

            assertTrue(first.get(5, TimeUnit.SECONDS).isSuccess());
            assertTrue(second.get(5, TimeUnit.SECONDS).isSuccess());
            assertEquals(1, calls.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void resourceClassLimitsConcurrency() throws Exception {
        AtomicInteger active = new AtomicInteger(0);
        AtomicInteger maxActive = new AtomicInteger(0);
        Collaborator tracked = context -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            active.decrementAndGet();
            writeOutput(context);
            return 0;
        };
        TaskRunner runner = runner(Collections.singletonMap("compute", 1), Collections.emptyList());
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<CompletableFuture<Outcome>> futures = new ArrayList<>();
            for (String entity : Arrays.asList("A", "B", "C", "D")) {
                TaskDefinition definition = TaskDefinition.builder(TaskKey.of(entity, "preprocess"))
                        .output(OUT)
                        .collaborator(tracked)
                        .resourceClass("compute")
                        .build();
                futures.add(runner.submit(definition, executor));
            }
            for (CompletableFuture<Outcome> next : futures) {
                assertTrue(next.get(5, TimeUnit.SECONDS).isSuccess());
            }
            assertEquals(1, maxActive.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void limitedClassWaitsOutsideSharedExecutor() throws Exception {
        CountDownLatch lightRan = new CountDownLatch(1);
        Collaborator heavy = context -> {
            if (!lightRan.await(5, TimeUnit.SECONDS)) {
                return 3;
            }
            writeOutput(context);
            return 0;
        };
        Collaborator light = context -> {
            writeOutput(context);
            lightRan.countDown();
            return 0;
        };
        TaskRunner runner = runner(Collections.singletonMap("accelerator", 1), Collections.emptyList());
        ExecutorService shared = Executors.newFixedThreadPool(1);
        try {
            List<CompletableFuture<Outcome>> futures = new ArrayList<>();
            for (String entity : Arrays.asList("A", "B")) {
                futures.add(runner.submit(TaskDefinition.builder(TaskKey.of(entity, "calibrate"))
                        .output(OUT)
                        .collaborator(heavy)
                        .resourceClass("accelerator")
                        .build(), shared));
            }
            futures.add(runner.submit(TaskDefinition.builder(TaskKey.of("C", "download"))
                    .output(OUT)
                    .collaborator(light)
                    .build(), shared));

            assertTrue(lightRan.await(5, TimeUnit.SECONDS));
            for (CompletableFuture<Outcome> next : futures) {
                assertEquals(Outcome.Status.SUCCESS, next.get(10, TimeUnit.SECONDS).getStatus());
            }
        } finally {
            shared.shutdownNow();
        }
    }

    @Test
    public void backoffIsScheduledWithoutBlocking() throws Exception {
        CompletableFuture<Void> backoff = new CompletableFuture<>();
        List<Duration> requested = Collections.synchronizedList(new ArrayList<>());
        Sleeper deferred = new Sleeper() {
            @Override
            public void sleep(Duration duration) {
                throw new AssertionError("Backoff should not block a thread");
            }

            @Override
            public CompletableFuture<Void> delay(Duration duration) {
                requested.add(duration);
                return backoff;
            }
        };
        Scripted collaborator = new Scripted(75, 0);
        TaskRunner runner = new TaskRunner(cache, new ResourcePools(Collections.emptyMap()), RetryPolicy.once(),
                deferred, Collections.emptyList());

        CompletableFuture<Outcome> future = runner.submit(task("A", collaborator, downloadPolicy), Runnable::run);
        assertFalse(future.isDone());
        assertEquals(Collections.singletonList(Duration.ofSeconds(2)), requested);
        assertEquals(1, collaborator.calls.get());

        backoff.complete(null);
        Outcome outcome = future.get(5, TimeUnit.SECONDS);
        assertEquals(Outcome.Status.SUCCESS, outcome.getStatus());
        assertEquals(2, outcome.getAttempts().size());
    }

    @Test
    public void scheduledSleeperReturnsImmediately() throws Exception {
        long start = System.nanoTime();
        CompletableFuture<Void> delay = Sleeper.SCHEDULED.delay(Duration.ofMillis(200));
        assertFalse(delay.isDone());
        delay.get(5, TimeUnit.SECONDS);
        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 200);
    }

    private static class PassThrough implements TaskInterceptor {
        @Override
        public Object before(AttemptRun run) {
            return null;
        }

        @Override
        public int executeAttempt(AttemptRun run, Object fromBefore) throws IOException, InterruptedException {
            return run.run();
        }

        @Override
        public void onComplete(AttemptRun run, Object fromBefore, TaskAttempt attempt) {
        }
    }

    private static class Recording implements TaskInterceptor {
        private final String name;
        private final List<String> events;

        Recording(String name, List<String> events) {
            this.name = name;
            this.events = events;
        }

        @Override
        public Object before(AttemptRun run) {
            return name;
        }

        @Override
        public int executeAttempt(AttemptRun run, Object fromBefore) throws IOException, InterruptedException {
            events.add("exec " + fromBefore);
            try {
                return run.run();
            } finally {
                events.add("exit " + fromBefore);
            }
        }

        @Override
        public void onComplete(AttemptRun run, Object fromBefore, TaskAttempt attempt) {
            events.add("complete " + fromBefore + " " + attempt.getResult());
        }
    }

    @Test
    public void interceptorsWrapInOrder() {
        List<String> events = new ArrayList<>();
        List<TaskInterceptor> interceptors = Arrays.asList(new Recording("first", events), new Recording("second", events));
        Outcome outcome = runner(interceptors).run(task("A", new Scripted(0), downloadPolicy));

        assertTrue(outcome.isSuccess());
        assertEquals(Arrays.asList(
                "exec first", "exec second", "exit second", "exit first",
                "complete first SUCCESS", "complete second SUCCESS"), events);
    }
}
