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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates per-entity result rows into named tables under a results directory. Each table is written once,
 * on {@link #finish()}, as a tab-delimited file sorted by its key columns, so the same set of rows always
 * produces the same file.
 *
 * @author Brendan McCarthy
 */
public class ResultSink {
    private static final Logger LOG = LoggerFactory.getLogger(ResultSink.class);

    private final Path directory;
    private final Map<String, ResultTable> tables = new LinkedHashMap<>();

    public ResultSink(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Declares a table, or returns the already-declared table of that name if its header matches.
     *
     * @param name       table name, also the file name without extension
     * @param keyColumns number of leading columns that identify a row
     * @param header     column names
     * @return table
     */
    public synchronized ResultTable table(String name, int keyColumns, List<String> header) {
        ResultTable table = tables.get(name);
        if (table != null) {
            if (!table.getHeader().equals(header)) {
                throw new IllegalArgumentException("Table " + name + " already declared with header " + table.getHeader());
            }
            return table;
        }
        try {
            Files.createDirectories(directory);
            table = new ResultTable(directory, name, keyColumns, header);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create table " + name + " in " + directory, e);
        }
        tables.put(name, table);
        LOG.debug("Declared table {} {}", name, header);
        return table;
    }

    public ResultTable table(String name, int keyColumns, String... header) {
        return table(name, keyColumns, Arrays.asList(header));
    }

    /**
     * Appends a row to a declared table.
     *
     * @param table  name
     * @param fields by column name
     */
    public void record(String table, Map<String, ?> fields) {
        ResultTable target;
        synchronized (this) {
            target = tables.get(table);
        }
        if (target == null) {
            throw new IllegalArgumentException("No table " + table);
        }
        target.record(fields);
    }

    /**
     * Writes every declared table.
     *
     * @return artifacts in declaration order
     * @throws IOException if a table cannot be written
     */
    public synchronized List<SinkArtifact> finish() throws IOException {
        List<SinkArtifact> artifacts = new ArrayList<>();
        for (ResultTable next : tables.values()) {
            artifacts.add(next.finish());
        }
        return artifacts;
    }
}
