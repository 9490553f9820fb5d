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

import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Configuration settings. {@link GlobalPipelineConfig} and every StageGraph both implement this interface,
 * allowing these values to be set at either level. On its creation, a graph's values are set from the current
 * global settings.
 *
 * @author Brendan McCarthy
 */
public interface CommonConfig {

    /**
     * Restore default settings. Applied on GlobalPipelineConfig, sets default values. Applied on a graph,
     * sets values from current GlobalPipelineConfig.
     *
     * @param arg passed through to {@link GlobalPipelineConfig.Config#afterDefaultInitialization}
     */
    void restoreConfigurationDefaults(Object arg);

    ExecutorService getExecutorService();

    /**
     * Resets the service used for running tasks. Global default is
     * Executors.newFixedThreadPool({@link GlobalPipelineConfig#DEFAULT_FIXED_THREADPOOL_SIZE}).
     *
     * @param executorService to set as new default
     */
    void setExecutorService(ExecutorService executorService);

    void restoreDefaultExecutorService();

    /**
     * Gets the policy applied to tasks that do not declare their own. The global default makes a single
     * attempt, so any non-zero exit is fatal.
     *
     * @return current default policy
     */
    RetryPolicy getDefaultRetryPolicy();

    void setDefaultRetryPolicy(RetryPolicy policy);

    Sleeper getSleeper();

    /**
     * Replaces how backoff waits are performed, mainly for testing.
     *
     * @param sleeper to use
     */
    void setSleeper(Sleeper sleeper);

    /**
     * Returns the number of concurrently running collaborators allowed per resource class.
     *
     * @return unmodifiable limits, classes not present are unbounded
     */
    Map<String, Integer> getResourceLimits();

    /**
     * Limits the number of collaborators of a resource class that may run at once.
     *
     * @param resourceClass to limit
     * @param slots         at least one
     */
    void setResourceLimit(String resourceClass, int slots);

    /**
     * Adds a TaskInterceptor that will be processed before any existing TaskInterceptor.
     *
     * @param interceptor to add
     */
    void firstInterceptWith(TaskInterceptor interceptor);

    /**
     * Adds a TaskInterceptor that will be processed after any existing TaskInterceptor.
     *
     * @param interceptor to add
     */
    void lastInterceptWith(TaskInterceptor interceptor);

    int getNumberOfInterceptors();

    /**
     * Removes the given TaskInterceptor from the current list, if it is there. It will exit silently if not there.
     *
     * @param interceptor to remove
     */
    void removeInterceptor(TaskInterceptor interceptor);

    void removeAllInterceptors();
}
