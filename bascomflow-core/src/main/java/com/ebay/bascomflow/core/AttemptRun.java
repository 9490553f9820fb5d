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

/**
 * One task attempt as exposed to {@link TaskInterceptor}s.
 *
 * @author Brendan McCarthy
 */
public interface AttemptRun {

    TaskKey getKey();

    /**
     * @return attempt ordinal, starting at 1
     */
    int getAttempt();

    String getResourceClass();

    Path getDirectory();

    /**
     * Returns the time at which the collaborator was started.
     *
     * @return start time in ms or 0 if not started
     */
    long getStartedAt();

    /**
     * Returns the time at which the collaborator exited.
     *
     * @return end time in ms or 0 if not ended
     */
    long getEndedAt();

    /**
     * Continues the attempt, either through the next interceptor or by invoking the collaborator.
     *
     * @return exit status
     * @throws IOException          if the collaborator could not be launched
     * @throws InterruptedException if interrupted while waiting
     */
    int run() throws IOException, InterruptedException;
}
