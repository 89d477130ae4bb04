/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.qqpbench.bench;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered results of a benchmark run, one entry per attempted variant. The runner appends entries as
 * variants finish and seals the table before handing it out; a sealed table is read-only.
 */
public class ComparisonTable {
    private final List<BenchResult> entries = new ArrayList<>();
    private boolean sealed;

    ComparisonTable() {
    }

    public static ComparisonTable of(List<BenchResult> results) {
        var table = new ComparisonTable();
        results.forEach(table::add);
        table.seal();
        return table;
    }

    void add(BenchResult result) {
        if (sealed) {
            throw new IllegalStateException("ComparisonTable is sealed");
        }
        entries.add(result);
    }

    void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * @return entries in the order the variants were run
     */
    public List<BenchResult> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<BenchResult> successful() {
        return entries.stream().filter(BenchResult::isSuccess).collect(Collectors.toList());
    }

    public long failedCount() {
        return entries.stream().filter(r -> !r.isSuccess()).count();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String toString() {
        return "ComparisonTable" + entries;
    }
}
