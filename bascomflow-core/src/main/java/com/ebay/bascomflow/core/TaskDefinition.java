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
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything {@link TaskRunner} needs to run one task: its key, the outputs that make up its cache predicate,
 * the collaborator to invoke, the resource class it draws a slot from and an optional retry policy overriding
 * the runner's default.
 *
 * @author Brendan McCarthy
 */
public final class TaskDefinition {
    private final TaskKey key;
    private final List<String> outputs;
    private final Collaborator collaborator;
    private final String resourceClass;
    private final RetryPolicy retryPolicy;

    private TaskDefinition(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key");
        this.collaborator = Objects.requireNonNull(builder.collaborator, "collaborator");
        if (builder.outputs.isEmpty()) {
            throw new IllegalArgumentException("Task " + key + " declares no outputs");
        }
        this.outputs = Collections.unmodifiableList(new ArrayList<>(builder.outputs));
        this.resourceClass = builder.resourceClass;
        this.retryPolicy = builder.retryPolicy;
    }

    public static Builder builder(TaskKey key) {
        return new Builder(key);
    }

    public TaskKey getKey() {
        return key;
    }

    public List<String> getOutputs() {
        return outputs;
    }

    public Collaborator getCollaborator() {
        return collaborator;
    }

    public String getResourceClass() {
        return resourceClass;
    }

    /**
     * @return possibly null policy, in which case the runner's default applies
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    @Override
    public String toString() {
        return "TaskDefinition(" + key + ", " + outputs + ", " + resourceClass + ")";
    }

    public static final class Builder {
        private final TaskKey key;
        private final List<String> outputs = new ArrayList<>();
        private Collaborator collaborator;
        private String resourceClass = ResourcePools.DEFAULT_CLASS;
        private RetryPolicy retryPolicy;

        private Builder(TaskKey key) {
            this.key = key;
        }

        public Builder output(String output) {
            outputs.add(output);
            return this;
        }

        public Builder outputs(Collection<String> outputs) {
            this.outputs.addAll(outputs);
            return this;
        }

        public Builder collaborator(Collaborator collaborator) {
            this.collaborator = collaborator;
            return this;
        }

        public Builder command(List<String> command) {
            return collaborator(new ProcessCollaborator(command));
        }

        public Builder resourceClass(String resourceClass) {
            this.resourceClass = Objects.requireNonNull(resourceClass, "resourceClass");
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public TaskDefinition build() {
            return new TaskDefinition(this);
        }
    }
}
