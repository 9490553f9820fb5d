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

import com.ebay.bascomflow.exceptions.FatalTaskException;

import java.util.Collections;
import java.util.List;

/**
 * Final result of running one task, including the history of attempts that produced it.
 *
 * @author Brendan McCarthy
 */
public final class Outcome {

    public enum Status {
        /**
         * Skipped because its outputs were already present.
         */
        CACHED,
        SUCCESS,
        /**
         * Terminal but not fatal to the run; this entity simply produces no output for the stage.
         */
        IGNORED,
        /**
         * Retry budget exhausted or the collaborator could not be run at all.
         */
        FATAL;

        public boolean isSuccess() {
            return this == CACHED || this == SUCCESS;
        }
    }

    private final TaskKey key;
    private final Status status;
    private final String reason;
    private final List<TaskAttempt> attempts;

    private Outcome(TaskKey key, Status status, String reason, List<TaskAttempt> attempts) {
        this.key = key;
        this.status = status;
        this.reason = reason;
        this.attempts = Collections.unmodifiableList(attempts);
    }

    static Outcome cached(TaskKey key) {
        return new Outcome(key, Status.CACHED, null, Collections.emptyList());
    }

    static Outcome success(TaskKey key, List<TaskAttempt> attempts) {
        return new Outcome(key, Status.SUCCESS, null, attempts);
    }

    static Outcome ignored(TaskKey key, String reason, List<TaskAttempt> attempts) {
        return new Outcome(key, Status.IGNORED, reason, attempts);
    }

    static Outcome fatal(TaskKey key, String reason, List<TaskAttempt> attempts) {
        return new Outcome(key, Status.FATAL, reason, attempts);
    }

    public TaskKey getKey() {
        return key;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status.isSuccess();
    }

    /**
     * @return failure reason, null for successful outcomes
     */
    public String getReason() {
        return reason;
    }

    public List<TaskAttempt> getAttempts() {
        return attempts;
    }

    /**
     * For callers that treat a fatal outcome as a hard error.
     *
     * @return this outcome if not fatal
     * @throws FatalTaskException if fatal
     */
    public Outcome orThrow() {
        if (status == Status.FATAL) {
            throw new FatalTaskException(key, reason, attempts.size());
        }
        return this;
    }

    @Override
    public String toString() {
        String s = "Outcome(" + key + ", " + status;
        if (reason != null) {
            s += ", " + reason;
        }
        return s + ", attempts=" + attempts.size() + ")";
    }
}
