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
package com.ebay.bascomflow.sink;

import java.nio.file.Path;

/**
 * A finished result table, as reported to the operator.
 *
 * @author Brendan McCarthy
 */
public final class SinkArtifact {
    private final String table;
    private final Path path;
    private final int rows;

    SinkArtifact(String table, Path path, int rows) {
        this.table = table;
        this.path = path;
        this.rows = rows;
    }

    public String getTable() {
        return table;
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return data rows, excluding the header
     */
    public int getRows() {
        return rows;
    }

    @Override
    public String toString() {
        return "(" + path + ", " + rows + ")";
    }
}
