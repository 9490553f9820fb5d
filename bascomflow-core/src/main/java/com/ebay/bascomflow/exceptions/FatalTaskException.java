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
package com.ebay.bascomflow.exceptions;

import com.ebay.bascomflow.core.TaskKey;

/**
 * Raised when a caller asks for a fatal task outcome to be treated as a hard error. The engine itself records
 * fatal outcomes against their lineage rather than throwing.
 *
 * @author Brendan McCarthy
 */
public class FatalTaskException extends RuntimeException {
    private final TaskKey key;
    private final int attempts;

    public FatalTaskException(TaskKey key, String reason, int attempts) {
        super("Task " + key + " failed after " + attempts + " attempt(s): " + reason);
        this.key = key;
        this.attempts = attempts;
    }

    public TaskKey getKey() {
        return key;
    }

    public int getAttempts() {
        return attempts;
    }
}
