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

/**
 * An external tool invoked once per task attempt. The engine only observes the returned exit status and
 * whatever the tool leaves in the task directory.
 *
 * @author Brendan McCarthy
 */
@FunctionalInterface
public interface Collaborator {

    /**
     * Runs the tool to completion.
     *
     * @param context of the attempt
     * @return exit status, zero for success
     * @throws IOException if the tool could not be launched
     * @throws InterruptedException if interrupted while waiting for the tool
     */
    int invoke(TaskContext context) throws IOException, InterruptedException;
}
