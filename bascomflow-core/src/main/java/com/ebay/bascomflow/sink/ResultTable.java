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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * One tab-delimited table with a fixed header. Rows are appended to a spool file as they arrive and are only
 * sorted and deduplicated when the table is finished, so the final file does not depend on arrival order.
 *
 * @author Brendan McCarthy
 */
public class ResultTable {
    private static final Logger LOG = LoggerFactory.getLogger(ResultTable.class);

    /**
     * Written in place of null, NaN and infinite values.
     */
    public static final String MISSING = "NA";

    static final String SPOOL_SUFFIX = ".tsv.part";
    static final String SUFFIX = ".tsv";

    private final String name;
    private final List<String> header;
    private final int keyColumns;
    private final Path spool;
    private final Path target;
    private BufferedWriter writer;
    private int recorded = 0;

    ResultTable(Path directory, String name, int keyColumns, List<String> header) throws IOException {
        if (header.isEmpty()) {
            throw new IllegalArgumentException("Table " + name + " has no columns");
        }
        if (keyColumns < 1 || keyColumns > header.size()) {
            throw new IllegalArgumentException("Table " + name + " key columns out of range: " + keyColumns);
        }
        if (new LinkedHashSet<>(header).size() != header.size()) {
            throw new IllegalArgumentException("Table " + name + " has duplicate columns: " + header);
        }
        this.name = name;
        this.header = Collections.unmodifiableList(new ArrayList<>(header));
        this.keyColumns = keyColumns;
        this.spool = directory.resolve(name + SPOOL_SUFFIX);
        this.target = directory.resolve(name + SUFFIX);
        this.writer = Files.newBufferedWriter(spool, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    public String getName() {
        return name;
    }

    public List<String> getHeader() {
        return header;
    }

    /**
     * Appends a row given by column name. Columns not supplied are written as {@link #MISSING}.
     *
     * @param fields by column name
     * @throws IllegalArgumentException if a field is not a column of this table
     */
    public void record(Map<String, ?> fields) {
        for (String next : fields.keySet()) {
            if (!header.contains(next)) {
                throw new IllegalArgumentException("Table " + name + " has no column " + next);
            }
        }
        StringJoiner joiner = new StringJoiner("\t");
        for (String column : header) {
            joiner.add(format(fields.get(column)));
        }
        append(joiner.toString());
    }

    /**
     * Appends a row given in header order.
     *
     * @param values one per column
     */
    public void record(Object... values) {
        if (values.length != header.size()) {
            throw new IllegalArgumentException("Table " + name + " expects " + header.size() + " values, got " + values.length);
        }
        StringJoiner joiner = new StringJoiner("\t");
        for (Object next : values) {
            joiner.add(format(next));
        }
        append(joiner.toString());
    }

    private synchronized void append(String line) {
        if (writer == null) {
            throw new IllegalStateException("Table " + name + " already finished");
        }
        try {
            writer.write(line);
            writer.newLine();
            writer.flush();
            recorded++;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append to " + spool, e);
        }
    }

    static String format(Object value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? MISSING : value.toString();
        }
        if (value instanceof Collection) {
            StringJoiner joiner = new StringJoiner(",");
            for (Object next : (Collection<?>) value) {
                joiner.add(format(next));
            }
            return joiner.toString();
        }
        if (value.getClass().isArray()) {
            StringJoiner joiner = new StringJoiner(",");
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                joiner.add(format(Array.get(value, i)));
            }
            return joiner.toString();
        }
        return value.toString().replace('\t', ' ').replace('\n', ' ').replace('\r', ' ');
    }

    private int compareKeys(String[] a, String[] b) {
        for (int i = 0; i < keyColumns; i++) {
            int c = a[i].compareTo(b[i]);
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    /**
     * Writes the final sorted file and removes the spool.
     *
     * @return artifact
     * @throws IOException if the table cannot be written
     */
    synchronized SinkArtifact finish() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
        List<String[]> rows = new ArrayList<>();
        for (String next : new LinkedHashSet<>(Files.readAllLines(spool, StandardCharsets.UTF_8))) {
            rows.add(next.split("\t", -1));
        }
        Comparator<String[]> byKey = this::compareKeys;
        rows.sort(byKey.thenComparing(row -> String.join("\t", row)));

        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(String.join("\t", header));
        String[] previous = null;
        int dropped = 0;
        for (String[] next : rows) {
            if (previous != null && compareKeys(previous, next) == 0) {
                dropped++;
                continue;
            }
            lines.add(String.join("\t", next));
            previous = next;
        }
        if (dropped > 0) {
            LOG.warn("Table {} dropped {} row(s) with duplicate keys", name, dropped);
        }
        Files.write(target, lines, StandardCharsets.UTF_8);
        Files.delete(spool);
        int count = lines.size() - 1;
        LOG.info("Wrote {} with {} row(s) from {} recorded", target, count, recorded);
        return new SinkArtifact(name, target, count);
    }
}
