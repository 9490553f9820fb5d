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
 * Maintains TaskInterceptors in a linked list, rather than requiring interceptors themselves to maintain
 * that list.
 *
 * @author Brendan McCarthy
 */
class PlaceHolderAttempt implements AttemptRun {
    final TaskInterceptor interceptor;
    final Object fromBefore;
    private final AttemptRun under;

    PlaceHolderAttempt(TaskInterceptor interceptor, AttemptRun under) {
        this.interceptor = interceptor;
        this.under = under;
        this.fromBefore = interceptor.before(under);
    }

    @Override
    public String toString() {
        return "PAttempt(" + under + ")";
    }

    @Override
    public TaskKey getKey() {
        return under.getKey();
    }

    @Override
    public int getAttempt() {
        return under.getAttempt();
    }

    @Override
    public String getResourceClass() {
        return under.getResourceClass();
    }

    @Override
    public Path getDirectory() {
        return under.getDirectory();
    }

    @Override
    public long getStartedAt() {
        return under.getStartedAt();
    }

    @Override
    public long getEndedAt() {
        return under.getEndedAt();
    }

    @Override
    public int run() throws IOException, InterruptedException {
        return interceptor.executeAttempt(under, fromBefore);
    }

    void complete(TaskAttempt attempt) {
        interceptor.onComplete(under, fromBefore, attempt);
    }
}
