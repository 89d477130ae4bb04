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

import io.github.qqpbench.bench.reporting.ResultHandler;
import io.github.qqpbench.data.DatasetLoader;
import io.github.qqpbench.data.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Orchestrates a full benchmark: load both datasets, summarize them, run every configured variant and
 * hand the comparison to a {@link ResultHandler}.
 *
 * <pre>{@code
 * ComparisonTable table = new QqpBench.Builder()
 *     .withConfig(config)
 *     .withResultHandler(ResultHandler.toFiles("results/qqp"))
 *     .build()
 *     .execute();
 * }</pre>
 */
public class QqpBench {
    private static final Logger logger = LoggerFactory.getLogger(QqpBench.class);

    private final BenchConfig config;
    private final DatasetLoader loader;
    private final ResultHandler resultHandler;

    private QqpBench(Builder builder) {
        this.config = builder.config;
        this.loader = builder.loader;
        this.resultHandler = builder.resultHandler;
    }

    public BenchConfig getConfig() {
        return config;
    }

    /**
     * @return the sealed comparison of all variants, including failed ones
     * @throws IOException if the result handler cannot write its output
     */
    public ComparisonTable execute() throws IOException {
        LoadResult training = loader.load(config.getTrainingSource(), false);
        LoadResult evaluation = loader.load(config.getEvaluationSource(), !config.isEvaluationLabeled());
        DatasetSummary.log("training", training);
        DatasetSummary.log("evaluation", evaluation);

        ComparisonTable table = new BenchmarkRunner(config).run(training.getDataset(), evaluation.getDataset());
        resultHandler.handleResults(table);
        logger.info("Benchmark execution complete");
        return table;
    }

    public static class Builder {
        private BenchConfig config = new BenchConfig.Builder().build();
        private DatasetLoader loader = new DatasetLoader();
        private ResultHandler resultHandler = ResultHandler.consoleOnly();

        public Builder withConfig(BenchConfig config) {
            this.config = config;
            return this;
        }

        public Builder withLoader(DatasetLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder withResultHandler(ResultHandler handler) {
            this.resultHandler = handler;
            return this;
        }

        public QqpBench build() {
            return new QqpBench(this);
        }
    }
}
