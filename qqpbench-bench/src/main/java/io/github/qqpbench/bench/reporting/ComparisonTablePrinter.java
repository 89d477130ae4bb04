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

package io.github.qqpbench.bench.reporting;

import io.github.qqpbench.bench.BenchResult;
import io.github.qqpbench.bench.ComparisonTable;
import io.github.qqpbench.evaluate.Metrics;

import java.io.PrintStream;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Prints a benchmark's configuration and its comparison table as fixed-width text.
 */
public class ComparisonTablePrinter {
    private static final String HEADER_FORMAT = "%-12s %-10s %-10s %-10s %-10s %-10s %-14s";
    private static final String ROW_FORMAT = "%-12s %-10.4f %-10.4f %-10.4f %-10.4f %-10.4f %-14.3f%n";

    private final PrintStream out;

    public ComparisonTablePrinter(PrintStream out) {
        this.out = out;
    }

    public void printConfig(Map<String, ?> params) {
        out.println();
        out.println("Configuration:");
        params.forEach((name, value) -> out.printf(Locale.US, "  %-20s: %s%n", name, value));
    }

    public void print(ComparisonTable table) {
        out.println();
        if (table.isEmpty()) {
            out.println("No results.");
            return;
        }
        String headerLine = String.format(Locale.US, HEADER_FORMAT,
                                          "Model", "Accuracy", "Precision", "Recall", "F1", "AUC", "Train Time (s)");
        out.println(headerLine);
        out.println(String.join("", Collections.nCopies(headerLine.length(), "-")));

        boolean placeholderLabels = false;
        for (BenchResult result : table.getEntries()) {
            if (!result.isSuccess()) {
                out.printf(Locale.US, "%-12s FAILED: %s%n", result.model, result.error);
                continue;
            }
            Metrics m = result.metrics;
            out.printf(Locale.US, ROW_FORMAT, result.model, m.getAccuracy(), m.getPrecision(), m.getRecall(),
                       m.getF1(), m.getAuc(), m.getTrainingTimeSeconds());
            placeholderLabels |= !result.labelsAuthoritative;
        }
        if (placeholderLabels) {
            out.println();
            out.println("WARNING: evaluation labels are placeholders; the metrics above are not meaningful.");
        }
    }
}
