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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Maintains configuration settings that will be applied to new graphs.
 *
 * @author Brendan McCarthy
 */
public class GlobalPipelineConfig {
    public final static int DEFAULT_FIXED_THREADPOOL_SIZE = 20;
    private static final ExecutorService DEFAULT_EXECUTOR_SERVICE = Executors.newFixedThreadPool(DEFAULT_FIXED_THREADPOOL_SIZE);

    private static final Config DEFAULT_CONFIG = new Config() {
        public void afterDefaultInitialization(CommonConfig graph, Object arg) {
        }
    };

    private static Config globalConfig = DEFAULT_CONFIG;

    /**
     * Default implementation maintains values that are transferred to a graph on demand.
     */
    public abstract static class Config implements CommonConfig {
        protected ExecutorService executorService;
        protected RetryPolicy defaultRetryPolicy;
        protected Sleeper sleeper;
        protected final Map<String, Integer> resourceLimits = new LinkedHashMap<>();
        protected final List<TaskInterceptor> first = new ArrayList<>();
        protected final List<TaskInterceptor> last = new ArrayList<>();

        protected Config() {
            restoreConfigurationDefaults(null);
        }

        /**
         * Transfers configuration settings to the supplied graph.
         *
         * @param graph to update
         * @param arg   passed from user code, see {@link #afterDefaultInitialization(CommonConfig, Object)}
         */
        final public void updateConfigurationOn(CommonConfig graph, Object arg) {
            graph.setExecutorService(getExecutorService());
            graph.setDefaultRetryPolicy(getDefaultRetryPolicy());
            graph.setSleeper(getSleeper());
            resourceLimits.forEach(graph::setResourceLimit);
            for (TaskInterceptor next : first) {
                graph.firstInterceptWith(next);
            }
            for (TaskInterceptor next : last) {
                graph.lastInterceptWith(next);
            }
            afterDefaultInitialization(graph, arg);
        }

        /**
         * Subclasses can override to provide custom logic for {@link #updateConfigurationOn(CommonConfig, Object)}.
         * The arg parameter is what is passed on graph creation, without modification. It is intended to allow
         * different settings for different graphs, if desired.
         *
         * @param graph to update
         * @param arg   passed from user code
         */
        abstract public void afterDefaultInitialization(CommonConfig graph, Object arg);

        @Override
        public final void restoreConfigurationDefaults(Object arg) {
            globalConfig = DEFAULT_CONFIG;
            restoreDefaultExecutorService();
            setDefaultRetryPolicy(RetryPolicy.once());
            setSleeper(Sleeper.SCHEDULED);
            resourceLimits.clear();
            removeAllInterceptors();
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
            this.executorService = DEFAULT_EXECUTOR_SERVICE;
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
        public Map<String, Integer> getResourceLimits() {
            return Collections.unmodifiableMap(resourceLimits);
        }

        @Override
        public void setResourceLimit(String resourceClass, int slots) {
            if (slots < 1) {
                throw new IllegalArgumentException("Resource class " + resourceClass + " needs at least one slot");
            }
            resourceLimits.put(resourceClass, slots);
        }

        @Override
        public void firstInterceptWith(TaskInterceptor interceptor) {
            first.add(interceptor);
        }

        @Override
        public void lastInterceptWith(TaskInterceptor interceptor) {
            last.add(interceptor);
        }

        @Override
        public int getNumberOfInterceptors() {
            return first.size() + last.size();
        }

        @Override
        public void removeInterceptor(TaskInterceptor interceptor) {
            first.remove(interceptor);
            last.remove(interceptor);
        }

        @Override
        public void removeAllInterceptors() {
            first.clear();
            last.clear();
        }
    }

    public static Config getConfig() {
        return globalConfig;
    }

    public static void setConfig(Config config) {
        globalConfig = config;
    }
}
