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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Exit-code classification and backoff schedule for the attempts of a single task. Each external collaborator
 * can have its own table, since exit-code conventions differ from tool to tool. Both {@link #classify(int)} and
 * {@link #backoff(int)} are pure; the attempt counter is owned by {@link TaskRunner}.
 *
 * <p>Exit codes listed as {@link Disposition#IGNORE} end the task without failing the run. Codes listed as
 * {@link Disposition#RETRY}, and any code not in the table ({@link Disposition#UNKNOWN}), are retried after
 * {@code base^attempt} time units until {@link #getMaxAttempts()} attempts have been made.
 *
 * @author Brendan McCarthy
 */
public final class RetryPolicy {
    public static final String UNKNOWN_REASON = "unknown";

    public enum Disposition {
        IGNORE,
        RETRY,
        UNKNOWN;

        public boolean isRetryable() {
            return this != IGNORE;
        }
    }

    /**
     * Result of classifying an exit code.
     */
    public static final class Classification {
        private final Disposition disposition;
        private final String reason;

        Classification(Disposition disposition, String reason) {
            this.disposition = disposition;
            this.reason = reason;
        }

        public Disposition getDisposition() {
            return disposition;
        }

        public String getReason() {
            return reason;
        }

        @Override
        public String toString() {
            return disposition + "(" + reason + ")";
        }
    }

    private final Map<Integer, Classification> table;
    private final int maxAttempts;
    private final double base;
    private final TimeUnit unit;

    private RetryPolicy(Builder builder) {
        this.table = Collections.unmodifiableMap(new LinkedHashMap<>(builder.table));
        this.maxAttempts = builder.maxAttempts;
        this.base = builder.base;
        this.unit = builder.unit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A policy with an empty table that makes exactly one attempt, so every non-zero exit is fatal.
     *
     * @return single-attempt policy
     */
    public static RetryPolicy once() {
        return builder().maxAttempts(1).build();
    }

    /**
     * Classifies a non-zero exit code.
     *
     * @param exitCode from the collaborator
     * @return classification, {@link Disposition#UNKNOWN} with reason "unknown" for codes not in the table
     */
    public Classification classify(int exitCode) {
        Classification classification = table.get(exitCode);
        return classification == null ? new Classification(Disposition.UNKNOWN, UNKNOWN_REASON) : classification;
    }

    /**
     * Returns how long to wait after the given failed attempt, {@code base^attempt} units.
     *
     * @param attempt ordinal of the attempt that just failed, starting at 1
     * @return backoff duration
     */
    public Duration backoff(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be >= 1: " + attempt);
        }
        double units = Math.pow(base, attempt);
        double millis = units * unit.toMillis(1);
        if (millis >= Long.MAX_VALUE) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public double getBase() {
        return base;
    }

    public TimeUnit getUnit() {
        return unit;
    }

    /**
     * Returns a copy of this policy with a different attempt budget.
     *
     * @param maxAttempts new budget
     * @return new policy
     */
    public RetryPolicy withMaxAttempts(int maxAttempts) {
        Builder builder = new Builder();
        builder.table.putAll(table);
        return builder.backoff(base, unit).maxAttempts(maxAttempts).build();
    }

    @Override
    public String toString() {
        return "RetryPolicy(" + table.size() + " codes, max=" + maxAttempts + ", backoff=" + base + "^n " + unit + ")";
    }

    public static final class Builder {
        private final Map<Integer, Classification> table = new LinkedHashMap<>();
        private int maxAttempts = 1;
        private double base = 2;
        private TimeUnit unit = TimeUnit.SECONDS;

        private Builder() {
        }

        public Builder ignore(int exitCode, String reason) {
            return put(exitCode, Disposition.IGNORE, reason);
        }

        public Builder retry(int exitCode, String reason) {
            return put(exitCode, Disposition.RETRY, reason);
        }

        private Builder put(int exitCode, Disposition disposition, String reason) {
            if (exitCode == 0) {
                throw new IllegalArgumentException("Exit code 0 is success and cannot be classified");
            }
            table.put(exitCode, new Classification(disposition, reason));
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoff(double base, TimeUnit unit) {
            if (base < 1) {
                throw new IllegalArgumentException("Backoff base must be >= 1: " + base);
            }
            this.base = base;
            this.unit = unit;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
