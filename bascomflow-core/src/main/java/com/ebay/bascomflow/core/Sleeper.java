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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Performs the backoff wait between task attempts. Replaceable so that tests can record durations rather
 * than actually wait.
 *
 * <p>The runner only calls {@link #delay(Duration)}, which by default performs {@link #sleep(Duration)} in the
 * calling thread. {@link #SCHEDULED} overrides it so that no thread is held while a task waits to retry.
 *
 * @author Brendan McCarthy
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SCHEDULED = new Sleeper() {
        @Override
        public void sleep(Duration duration) throws InterruptedException {
            Thread.sleep(duration.toMillis());
        }

        @Override
        public CompletableFuture<Void> delay(Duration duration) {
            return CompletableFuture.runAsync(() -> {
            }, CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS));
        }

        @Override
        public String toString() {
            return "Sleeper.SCHEDULED";
        }
    };

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Returns a future that completes once the duration has passed.
     *
     * @param duration to wait
     * @return future completing after the wait, or exceptionally with InterruptedException
     */
    default CompletableFuture<Void> delay(Duration duration) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            sleep(duration);
            future.complete(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.completeExceptionally(e);
        }
        return future;
    }
}
