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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Collects per-stage attempt statistics: how many attempts were made, how they were classified, how many tasks
 * were skipped as cached, and how long the attempts took.
 *
 * @author Brendan McCarthy
 */
public class StatTaskInterceptor implements TaskInterceptor {
    private final Map<String, InternalStat> map = new TreeMap<>();

    private static class InternalStat {
        private int count = 0;
        private int cached = 0;
        private final int[] results = new int[TaskAttempt.Result.values().length];
        private long maxExecTime = 0;
        private long minExecTime = Long.MAX_VALUE;
        private long execTotal = 0;

        void add(TaskAttempt attempt) {
            count++;
            results[attempt.getResult().ordinal()]++;
            long duration = attempt.getDurationMs();
            execTotal += duration;
            minExecTime = Math.min(minExecTime, duration);
            maxExecTime = Math.max(maxExecTime, duration);
        }

        double avg() {
            return count == 0 ? 0 : execTotal / (double) count;
        }
    }

    private InternalStat statFor(String stage) {
        return map.computeIfAbsent(stage, k -> new InternalStat());
    }

    @Override
    public Object before(AttemptRun run) {
        return null;
    }

    @Override
    public int executeAttempt(AttemptRun run, Object fromBefore) throws IOException, InterruptedException {
        return run.run();
    }

    @Override
    public synchronized void onComplete(AttemptRun run, Object fromBefore, TaskAttempt attempt) {
        statFor(run.getKey().getStage()).add(attempt);
    }

    @Override
    public synchronized void onCacheHit(TaskKey key) {
        statFor(key.getStage()).cached++;
    }

    public static class Stat {
        public String stage;
        public long count;
        public long cached;
        public long success;
        public long ignored;
        public long retried;
        public long fatal;
        public long average;
        public long min;
        public long max;
    }

    public static class Report {
        Stat[] stats;

        public List<Stat> getStats() {
            return Arrays.asList(stats);
        }

        /**
         * @param stage name
         * @return stat for stage, or null if no task of that stage was seen
         */
        public Stat get(String stage) {
            for (Stat next : stats) {
                if (next.stage.equals(stage)) {
                    return next;
                }
            }
            return null;
        }
    }

    /**
     * Returns a summarized execution data snapshot, ordered by stage name.
     *
     * @return data
     */
    public synchronized Report collect() {
        Report report = new Report();
        report.stats = new Stat[map.size()];
        int pos = 0;
        for (Map.Entry<String, InternalStat> next : map.entrySet()) {
            Stat stat = report.stats[pos++] = new Stat();
            InternalStat internalStat = next.getValue();
            stat.stage = next.getKey();
            stat.count = internalStat.count;
            stat.cached = internalStat.cached;
            stat.success = internalStat.results[TaskAttempt.Result.SUCCESS.ordinal()];
            stat.ignored = internalStat.results[TaskAttempt.Result.IGNORABLE_FAILURE.ordinal()];
            stat.retried = internalStat.results[TaskAttempt.Result.RETRYABLE_FAILURE.ordinal()];
            stat.fatal = internalStat.results[TaskAttempt.Result.FATAL_FAILURE.ordinal()];
            stat.average = Math.round(internalStat.avg());
            stat.min = internalStat.count == 0 ? 0 : internalStat.minExecTime;
            stat.max = internalStat.maxExecTime;
        }
        return report;
    }

    private static void fill(PrintStream ps, char c, int count) {
        for (int i = 0; i < count; i++) {
            ps.print(c);
        }
    }

    /**
     * A table column.
     */
    private static class Col {
        final String hdr;
        final Function<Stat, String> fn;
        int maxWidth;

        Col(String hdr, Function<Stat, String> fn) {
            this.hdr = hdr;
            this.fn = fn;
            maxWidth = hdr.length();
        }

        static Col ofLong(String hdr, Function<Stat, Long> fn) {
            return new Col(hdr, stat -> String.valueOf(fn.apply(stat)));
        }

        void widen(Stat stat) {
            maxWidth = Math.max(maxWidth, fn.apply(stat).length());
        }

        void hdr(PrintStream ps) {
            int fill = Math.max(0, maxWidth - hdr.length());
            int before = fill / 2;
            int after = fill - before;
            fill(ps, ' ', before + 1);
            ps.print(hdr);
            fill(ps, ' ', after + 1);
            ps.print('|');
        }

        void sep(PrintStream ps, char c) {
            fill(ps, '-', maxWidth + 2);
            ps.print(c);
        }

        void cell(PrintStream ps, Stat stat) {
            String value = fn.apply(stat);
            ps.print(' ');
            ps.print(value);
            fill(ps, ' ', 1 + maxWidth - value.length());
            ps.print('|');
        }
    }

    private void row(PrintStream ps, List<Col> cols, char div, Consumer<Col> fn) {
        ps.print(div);
        cols.forEach(fn);
        ps.print('\n');
    }

    /**
     * Prints a tabular-formatted summary of statistics to the given PrintStream.
     *
     * @param ps to print to
     */
    public void report(PrintStream ps) {
        Report report = collect();

        List<Col> cols = Arrays.asList(
                Col.ofLong("Count", stat -> stat.count),
                Col.ofLong("Cached", stat -> stat.cached),
                Col.ofLong("Success", stat -> stat.success),
                Col.ofLong("Ignored", stat -> stat.ignored),
                Col.ofLong("Retried", stat -> stat.retried),
                Col.ofLong("Fatal", stat -> stat.fatal),
                Col.ofLong("Avg", stat -> stat.average),
                Col.ofLong("Min", stat -> stat.min),
                Col.ofLong("Max", stat -> stat.max),
                new Col("Stage", stat -> stat.stage)
        );

        for (Stat next : report.stats) {
            cols.forEach(col -> col.widen(next));
        }

        row(ps, cols, '-', col -> col.sep(ps, '-'));
        row(ps, cols, '|', col -> col.hdr(ps));
        row(ps, cols, '|', col -> col.sep(ps, '|'));

        for (Stat next : report.stats) {
            row(ps, cols, '|', col -> col.cell(ps, next));
        }

        row(ps, cols, '-', col -> col.sep(ps, '-'));
    }

    /**
     * Returns a table-formatted summary as a string.
     *
     * @return table summary
     */
    public String report() {
        final String ENC = StandardCharsets.UTF_8.name();
        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            PrintStream ps = new PrintStream(baos, true, ENC);
            report(ps);
            ps.flush();
            return baos.toString(ENC);
        } catch (UnsupportedEncodingException e) {
            throw new RuntimeException("Bad encoding", e);
        }
    }
}
