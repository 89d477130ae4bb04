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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.qqpbench.bench.BenchResult;
import io.github.qqpbench.bench.ComparisonTable;
import io.github.qqpbench.evaluate.Metrics;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

/**
 * Receives the comparison table once every variant has run.
 *
 * <pre>{@code
 * // print to stdout and write results/qqp.csv and results/qqp.json
 * ResultHandler handler = ResultHandler.combining(
 *     ResultHandler.consoleOnly(),
 *     ResultHandler.toFiles("results/qqp")
 * );
 * }</pre>
 */
@FunctionalInterface
public interface ResultHandler {
    /**
     * @throws IOException if writing output fails
     */
    void handleResults(ComparisonTable table) throws IOException;

    static ResultHandler consoleOnly() {
        return console(System.out);
    }

    static ResultHandler console(PrintStream out) {
        return table -> new ComparisonTablePrinter(out).print(table);
    }

    /**
     * Writes {@code outputBasePath.csv} with one row per variant and {@code outputBasePath.json} with
     * the full results.
     */
    static ResultHandler toFiles(String outputBasePath) {
        return new FileOutputHandler(outputBasePath);
    }

    /**
     * Invokes the handlers in order. If one throws, the rest are skipped.
     */
    static ResultHandler combining(ResultHandler... handlers) {
        return table -> {
            for (ResultHandler handler : handlers) {
                handler.handleResults(table);
            }
        };
    }

    class FileOutputHandler implements ResultHandler {
        private static final Logger logger = LoggerFactory.getLogger(FileOutputHandler.class);

        static final String[] CSV_HEADER = {
                "Model", "Status", "Accuracy", "Precision", "Recall", "F1", "AUC", "Training Time",
                "Labels Authoritative", "Error"
        };

        private final String outputBasePath;

        public FileOutputHandler(String outputBasePath) {
            this.outputBasePath = outputBasePath;
        }

        @Override
        public void handleResults(ComparisonTable table) throws IOException {
            if (table.isEmpty()) {
                logger.warn("No results to write");
                return;
            }
            File detailsFile = new File(outputBasePath + ".json");
            File csvFile = new File(outputBasePath + ".csv");
            File parent = detailsFile.getAbsoluteFile().getParentFile();
            if (parent != null) {
                Files.createDirectories(parent.toPath());
            }

            new ObjectMapper().writerWithDefaultPrettyPrinter().writeValue(detailsFile, table.getEntries());
            logger.info("Detailed results written to {}", detailsFile.getAbsolutePath());

            writeCsv(table, csvFile);
            logger.info("Summary results written to {}", csvFile.getAbsolutePath());
        }

        private void writeCsv(ComparisonTable table, File csvFile) throws IOException {
            CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
            try (Writer writer = Files.newBufferedWriter(csvFile.toPath(), StandardCharsets.UTF_8);
                 CSVPrinter printer = new CSVPrinter(writer, format)) {
                for (BenchResult result : table.getEntries()) {
                    printer.printRecord(row(result));
                }
            }
        }

        private static List<Object> row(BenchResult result) {
            List<Object> values = new ArrayList<>();
            values.add(result.model);
            values.add(result.status);
            Metrics m = result.metrics;
            if (m != null) {
                values.add(m.getAccuracy());
                values.add(m.getPrecision());
                values.add(m.getRecall());
                values.add(m.getF1());
                values.add(m.getAuc());
                values.add(m.getTrainingTimeSeconds());
            } else {
                for (int i = 0; i < 6; i++) {
                    values.add(null);
                }
            }
            values.add(result.labelsAuthoritative);
            values.add(result.error);
            return values;
        }
    }
}
