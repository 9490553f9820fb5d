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
package com.ebay.bascomflow.runners;

import com.ebay.bascomflow.core.AttemptRun;
import com.ebay.bascomflow.core.TaskAttempt;
import com.ebay.bascomflow.core.TaskInterceptor;
import com.ebay.bascomflow.core.TaskKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Logs the start and end of every attempt, and every cache hit, at a configurable level. Failed attempts are
 * always logged at WARN.
 *
 * @author Brendan McCarthy
 */
public class LogTaskInterceptor implements TaskInterceptor {
    private static final Logger LOG = LoggerFactory.getLogger(LogTaskInterceptor.class);

    private final LogTaskLevel level;

    public LogTaskInterceptor() {
        this(LogTaskLevel.INFO);
    }

    public LogTaskInterceptor(LogTaskLevel level) {
        this.level = level;
    }

    public LogTaskLevel getLevel() {
        return level;
    }

    @Override
    public Object before(AttemptRun run) {
        return null;
    }

    @Override
    public int executeAttempt(AttemptRun run, Object fromBefore) throws IOException, InterruptedException {
        if (level.isEnabled(LOG)) {
            level.write(LOG, "STARTED {} attempt {} in {}", run.getKey(), run.getAttempt(), run.getDirectory());
        }
        return run.run();
    }

    @Override
    public void onComplete(AttemptRun run, Object fromBefore, TaskAttempt attempt) {
        if (attempt.getResult() == TaskAttempt.Result.SUCCESS) {
            if (level.isEnabled(LOG)) {
                level.write(LOG, "ENDED {} attempt {} in {}ms", run.getKey(), run.getAttempt(), attempt.getDurationMs());
            }
        } else {
            LOG.warn("ENDED {} attempt {} in {}ms with exit {}: {} ({})", run.getKey(), run.getAttempt(),
                    attempt.getDurationMs(), attempt.getExitCode(), attempt.getResult(), attempt.getReason());
        }
    }

    @Override
    public void onCacheHit(TaskKey key) {
        if (level.isEnabled(LOG)) {
            level.write(LOG, "CACHED {}", key);
        }
    }
}
