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
import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of one task: the (entity, stage, optional variant) triple. At most one execution may be in flight
 * for any given key, and the key determines the task's directory in the {@link TaskCache}.
 *
 * @author Brendan McCarthy
 */
public final class TaskKey implements Comparable<TaskKey> {
    private static final Comparator<TaskKey> ORDER = Comparator
            .comparing(TaskKey::getEntity)
            .thenComparing(TaskKey::getStage)
            .thenComparing(k -> k.variant == null ? "" : k.variant);

    private final String entity;
    private final String stage;
    private final String variant;

    private TaskKey(String entity, String stage, String variant) {
        this.entity = requireSegment(entity, "entity");
        this.stage = requireSegment(stage, "stage");
        this.variant = variant == null ? null : requireSegment(variant, "variant");
    }

    public static TaskKey of(String entity, String stage) {
        return new TaskKey(entity, stage, null);
    }

    public static TaskKey of(String entity, String stage, String variant) {
        return new TaskKey(entity, stage, variant);
    }

    private static String requireSegment(String value, String what) {
        Objects.requireNonNull(value, what);
        if (value.isEmpty() || value.contains("/") || value.contains("\\") || value.equals(".") || value.equals("..")) {
            throw new IllegalArgumentException("Invalid " + what + " \"" + value + "\"");
        }
        return value;
    }

    public String getEntity() {
        return entity;
    }

    public String getStage() {
        return stage;
    }

    /**
     * Returns the variant name if this task was fanned out from its entity.
     *
     * @return possibly null variant
     */
    public String getVariant() {
        return variant;
    }

    /**
     * Directory of this task relative to a cache root: entity/stage or entity/stage/variant.
     *
     * @return relative path
     */
    public Path relativePath() {
        Path path = Path.of(entity, stage);
        return variant == null ? path : path.resolve(variant);
    }

    @Override
    public int compareTo(TaskKey that) {
        return ORDER.compare(this, that);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskKey that = (TaskKey) o;
        return entity.equals(that.entity) && stage.equals(that.stage) && Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entity, stage, variant);
    }

    @Override
    public String toString() {
        return variant == null ? stage + ':' + entity : stage + ':' + entity + ':' + variant;
    }
}
