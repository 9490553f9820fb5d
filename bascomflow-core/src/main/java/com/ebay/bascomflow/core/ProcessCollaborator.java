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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a fixed argument list as a child process in the task directory, appending its stdout and stderr to
 * {@link TaskContext#STDOUT_FILE} and {@link TaskContext#STDERR_FILE} so they survive every outcome.
 *
 * @author Brendan McCarthy
 */
public class ProcessCollaborator implements Collaborator {
    private static final Logger LOG = LoggerFactory.getLogger(ProcessCollaborator.class);

    private final List<String> command;
    private final Map<String, String> environment;

    public ProcessCollaborator(List<String> command) {
        this(command, Collections.emptyMap());
    }

    public ProcessCollaborator(List<String> command, Map<String, String> environment) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Empty command");
        }
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    public List<String> getCommand() {
        return command;
    }

    @Override
    public int invoke(TaskContext context) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(context.getDirectory().toFile())
                .redirectOutput(ProcessBuilder.Redirect.appendTo(context.getStdout().toFile()))
                .redirectError(ProcessBuilder.Redirect.appendTo(context.getStderr().toFile()));
        pb.environment().putAll(environment);
        LOG.debug("Launching {} for {}", command, context);
        Process process = pb.start();
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    @Override
    public String toString() {
        return String.join(" ", command);
    }
}
