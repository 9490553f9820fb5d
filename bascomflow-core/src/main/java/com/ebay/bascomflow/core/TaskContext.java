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

import java.nio.file.Path;

/**
 * What a {@link Collaborator} is told about the attempt it is executing.
 *
 * @author Brendan McCarthy
 */
public final class TaskContext {
    public static final String STDOUT_FILE = "task.out";
    public static final String STDERR_FILE = "task.err";
    public static final String LOG_FILE = "task.log";

    private final TaskKey key;
    private final Path directory;
    private final int attempt;

    TaskContext(TaskKey key, Path directory, int attempt) {
        this.key = key;
        this.directory = directory;
        this.attempt = attempt;
    }

    public TaskKey getKey() {
        return key;
    }

    /**
     * The task's cache directory, which exists before the collaborator is invoked and where all declared
     * outputs are expected to land.
     *
     * @return task directory
     */
    public Path getDirectory() {
        return directory;
    }

    /**
     * @return attempt ordinal, starting at 1
     */
    public int getAttempt() {
        return attempt;
    }

    public Path getStdout() {
        return directory.resolve(STDOUT_FILE);
    }

    public Path getStderr() {
        return directory.resolve(STDERR_FILE);
    }

    @Override
    public String toString() {
        return "TaskContext(" + key + ", attempt=" + attempt + ")";
    }
}
