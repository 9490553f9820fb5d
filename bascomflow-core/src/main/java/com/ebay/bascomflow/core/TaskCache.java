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
import java.nio.file.Path;
import java.util.List;

/**
 * Persistent record of completed work. A task is skipped iff every output it declares is already present;
 * the declared outputs should be the most downstream artifacts a task produces, not intermediate files, so
 * that a half-finished task is never mistaken for a finished one.
 *
 * @author Brendan McCarthy
 */
public interface TaskCache {

    /**
     * Decides whether a task must be executed. Has no side effects.
     *
     * @param key             of task
     * @param declaredOutputs artifact names relative to the task directory
     * @return false iff every declared output exists and is non-empty
     */
    boolean shouldRun(TaskKey key, List<String> declaredOutputs);

    /**
     * Returns the directory holding a task's outputs, whether or not it exists yet.
     *
     * @param key of task
     * @return task directory
     */
    Path directoryOf(TaskKey key);

    /**
     * Creates the task directory if needed.
     *
     * @param key of task
     * @return task directory
     * @throws IOException if the directory cannot be created
     */
    Path prepare(TaskKey key) throws IOException;

    /**
     * Acquires exclusive write access to a task directory, blocking until it is available. This excludes
     * other threads and other processes using the same cache location.
     *
     * @param key of task
     * @return lock to close when the task is finished
     * @throws IOException if the lock cannot be obtained
     */
    TaskLock lock(TaskKey key) throws IOException;

    /**
     * Exclusive hold on one task directory.
     */
    interface TaskLock extends AutoCloseable {
        @Override
        void close() throws IOException;
    }
}
