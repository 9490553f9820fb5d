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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of collaborators running at once for each resource class, e.g. a few slots for heavy
 * compute tasks sharing an accelerator and more for lightweight I/O tasks. Each limited class has its own
 * executor with one thread per slot, so attempts waiting for a slot sit in that executor's queue rather than
 * holding threads of the graph's shared executor. Classes without a configured limit run on the executor
 * supplied by the caller.
 *
 * @author Brendan McCarthy
 */
public class ResourcePools {
    private static final Logger LOG = LoggerFactory.getLogger(ResourcePools.class);

    public static final String DEFAULT_CLASS = "default";

    static final long IDLE_SECONDS = 30;

    private final Map<String, ThreadPoolExecutor> pools = new LinkedHashMap<>();
    private final Map<String, Integer> limits;

    public ResourcePools(Map<String, Integer> limits) {
        for (Map.Entry<String, Integer> next : limits.entrySet()) {
            int slots = next.getValue();
            if (slots < 1) {
                throw new IllegalArgumentException("Pool " + next.getKey() + " needs at least one slot: " + slots);
            }
            ThreadPoolExecutor pool = new ThreadPoolExecutor(slots, slots, IDLE_SECONDS, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(), threadsFor(next.getKey()));
            pool.allowCoreThreadTimeOut(true);
            pools.put(next.getKey(), pool);
        }
        this.limits = Collections.unmodifiableMap(new LinkedHashMap<>(limits));
    }

    private static ThreadFactory threadsFor(String resourceClass) {
        AtomicInteger count = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "BF-" + resourceClass + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public Map<String, Integer> getLimits() {
        return limits;
    }

    /**
     * Selects where attempts of a resource class run.
     *
     * @param resourceClass of the task
     * @param unbounded     executor for classes without a limit
     * @return executor running at most as many attempts at once as the class has slots
     */
    public Executor executorFor(String resourceClass, Executor unbounded) {
        ThreadPoolExecutor pool = pools.get(resourceClass);
        if (pool == null) {
            return unbounded;
        }
        return runnable -> {
            if (pool.getActiveCount() >= pool.getMaximumPoolSize()) {
                LOG.debug("Queueing for a {} slot", resourceClass);
            }
            pool.execute(runnable);
        };
    }

    @Override
    public String toString() {
        return "ResourcePools" + limits;
    }
}
