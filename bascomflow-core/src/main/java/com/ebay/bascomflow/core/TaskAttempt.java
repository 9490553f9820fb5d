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

/**
 * One invocation of a task's collaborator.
 *
 * @author Brendan McCarthy
 */
public final class TaskAttempt {

    public enum Result {
        SUCCESS,
        IGNORABLE_FAILURE,
        RETRYABLE_FAILURE,
        FATAL_FAILURE
    }

    private final TaskKey key;
    private final int number;
    private final int exitCode;
    private final long durationMs;
    private final Result result;
    private final String reason;

    TaskAttempt(TaskKey key, int number, int exitCode, long durationMs, Result result, String reason) {
        this.key = key;
        this.number = number;
        this.exitCode = exitCode;
        this.durationMs = durationMs;
        this.result = result;
        this.reason = reason;
    }

    public TaskKey getKey() {
        return key;
    }

    public int getNumber() {
        return number;
    }

    public int getExitCode() {
        return exitCode;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Result getResult() {
        return result;
    }

    /**
     * @return failure reason, null on success
     */
    public String getReason() {
        return reason;
    }

    /**
     * Line written to the task log.
     *
     * @return formatted attempt
     */
    String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("attempt=").append(number)
                .append(" exit=").append(exitCode)
                .append(" duration=").append(durationMs).append("ms")
                .append(" result=").append(result);
        if (reason != null) {
            sb.append(" reason=").append(reason);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TaskAttempt(" + key + ", " + format() + ")";
    }
}
