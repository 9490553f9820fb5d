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

import java.io.IOException;

/**
 * Task execution hook points. Implementations can be added for all graphs through
 * {@link GlobalPipelineConfig} or locally to an individual graph. Several built-in versions are available in
 * the runners package.
 *
 * @author Brendan McCarthy
 */
public interface TaskInterceptor {

    /**
     * Called before {@link #executeAttempt(AttemptRun, Object)}. The returned object is passed to
     * executeAttempt and onComplete and is otherwise not read or modified by the framework.
     *
     * @param run that will also be passed to executeAttempt
     * @return a possibly-null object to pass to executeAttempt
     */
    Object before(AttemptRun run);

    /**
     * Attempt invocation. An implementation should invoke {@link AttemptRun#run()} to continue, typically by
     * surrounding the call:
     * <pre>
     *     public int executeAttempt(AttemptRun run, Object fromBefore) throws IOException, InterruptedException {
     *         LOG.info("STARTED " + run.getKey());
     *         try {
     *             return run.run();
     *         } finally {
     *             LOG.info("ENDED " + run.getKey());
     *         }
     *     }
     * </pre>
     *
     * @param run        to execute
     * @param fromBefore value returned from {@link #before(AttemptRun)}
     * @return exit status
     * @throws IOException          if the collaborator could not be launched
     * @throws InterruptedException if interrupted while waiting
     */
    int executeAttempt(AttemptRun run, Object fromBefore) throws IOException, InterruptedException;

    /**
     * Called once the attempt has been classified.
     *
     * @param run        that was executed
     * @param fromBefore value returned from {@link #before(AttemptRun)}
     * @param attempt    classified result
     */
    void onComplete(AttemptRun run, Object fromBefore, TaskAttempt attempt);

    /**
     * Called instead of the other hooks when a task is skipped because its outputs are already cached.
     *
     * @param key of skipped task
     */
    default void onCacheHit(TaskKey key) {
    }
}
