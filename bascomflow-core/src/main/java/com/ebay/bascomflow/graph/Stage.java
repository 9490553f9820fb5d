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
package com.ebay.bascomflow.graph;

import com.ebay.bascomflow.core.Collaborator;
import com.ebay.bascomflow.core.ResourcePools;
import com.ebay.bascomflow.core.RetryPolicy;
import com.ebay.bascomflow.core.TaskDefinition;
import com.ebay.bascomflow.core.TaskKey;
import com.ebay.bascomflow.exceptions.InvalidStageException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Declares one pipeline step: how an input tuple maps to a task (key, declared outputs, collaborator) and how
 * the task's outputs are read back into output tuples. A stage never names other stages; it is connected to
 * the rest of the graph only through the flows passed to {@link StageGraph#stage(Stage, com.ebay.bascomflow.flow.Flow)}.
 *
 * @param <I> input tuple type
 * @param <O> output tuple type
 * @author Brendan McCarthy
 */
public final class Stage<I, O> {

    /**
     * Reads a finished task's outputs into output tuples.
     */
    @FunctionalInterface
    public interface OutputReader<I, O> {
        List<O> read(I input, Path taskDirectory) throws IOException;
    }

    private final String name;
    private final String resourceClass;
    private final Function<I, String> entity;
    private final Function<I, String> variant;
    private final Function<I, List<String>> outputs;
    private final BiFunction<I, Path, Collaborator> collaborator;
    private final RetryPolicy retryPolicy;
    private final OutputReader<I, O> reader;

    private Stage(Builder<I, O> builder) {
        this.name = builder.name;
        this.resourceClass = builder.resourceClass;
        this.entity = require(builder.entity, "entity");
        this.variant = builder.variant;
        this.outputs = require(builder.outputs, "outputs");
        this.collaborator = require(builder.collaborator, "collaborator");
        this.retryPolicy = builder.retryPolicy;
        this.reader = require(builder.reader, "reader");
    }

    private <X> X require(X value, String what) {
        if (value == null) {
            throw new InvalidStageException("Stage " + name + " has no " + what);
        }
        return value;
    }

    public static <I, O> Builder<I, O> named(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return name;
    }

    public String getResourceClass() {
        return resourceClass;
    }

    String entityOf(I input) {
        return entity.apply(input);
    }

    TaskKey keyOf(I input) {
        String v = variant == null ? null : variant.apply(input);
        return TaskKey.of(entityOf(input), name, v);
    }

    /**
     * Builds the task for one input tuple.
     *
     * @param input         tuple
     * @param taskDirectory where the task's outputs will land
     * @param defaultPolicy applied when this stage has none of its own
     * @return task definition
     */
    TaskDefinition define(I input, Path taskDirectory, RetryPolicy defaultPolicy) {
        return TaskDefinition.builder(keyOf(input))
                .outputs(outputs.apply(input))
                .collaborator(collaborator.apply(input, taskDirectory))
                .resourceClass(resourceClass)
                .retryPolicy(retryPolicy == null ? defaultPolicy : retryPolicy)
                .build();
    }

    List<O> read(I input, Path taskDirectory) throws IOException {
        return reader.read(input, taskDirectory);
    }

    @Override
    public String toString() {
        return "Stage(" + name + ")";
    }

    public static final class Builder<I, O> {
        private final String name;
        private String resourceClass = ResourcePools.DEFAULT_CLASS;
        private Function<I, String> entity;
        private Function<I, String> variant;
        private Function<I, List<String>> outputs;
        private BiFunction<I, Path, Collaborator> collaborator;
        private RetryPolicy retryPolicy;
        private OutputReader<I, O> reader;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder<I, O> resourceClass(String resourceClass) {
            this.resourceClass = resourceClass;
            return this;
        }

        /**
         * @param entity extracts the entity key from an input tuple
         * @return this builder
         */
        public Builder<I, O> entity(Function<I, String> entity) {
            this.entity = entity;
            return this;
        }

        /**
         * For stages running once per variant.
         *
         * @param variant extracts the variant name from an input tuple
         * @return this builder
         */
        public Builder<I, O> variant(Function<I, String> variant) {
            this.variant = variant;
            return this;
        }

        /**
         * @param outputs names, relative to the task directory, of the most downstream artifacts the task writes
         * @return this builder
         */
        public Builder<I, O> outputs(Function<I, List<String>> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder<I, O> collaborator(BiFunction<I, Path, Collaborator> collaborator) {
            this.collaborator = collaborator;
            return this;
        }

        public Builder<I, O> retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder<I, O> reader(OutputReader<I, O> reader) {
            this.reader = reader;
            return this;
        }

        public Stage<I, O> build() {
            return new Stage<>(this);
        }
    }
}
