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

import io.github.qqpbench.classify.LogisticRegressionModel;
import io.github.qqpbench.classify.LogisticRegressionTrainer;
import io.github.qqpbench.data.Dataset;
import io.github.qqpbench.evaluate.Evaluator;
import io.github.qqpbench.evaluate.Metrics;
import io.github.qqpbench.vectorize.TextVectorizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs each configured {@link ModelVariant} against the same training and evaluation datasets and
 * collects a {@link ComparisonTable}. Variants run sequentially; one variant failing does not stop
 * the others.
 */
public class BenchmarkRunner {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkRunner.class);

    private final BenchConfig config;
    private final VariantExecutor executor;

    public BenchmarkRunner(BenchConfig config) {
        this.config = config;
        this.executor = this::runVariant;
    }

    BenchmarkRunner(BenchConfig config, VariantExecutor executor) {
        this.config = config;
        this.executor = executor;
    }

    public ComparisonTable run(Dataset training, Dataset evaluation) {
        return run(training, evaluation, config.getVariants());
    }

    public ComparisonTable run(Dataset training, Dataset evaluation, List<ModelVariant> variants) {
        var table = new ComparisonTable();
        for (ModelVariant variant : variants) {
            logger.info("Running variant {}", variant.getDisplayName());
            try {
                Metrics metrics = executor.execute(variant, training, evaluation);
                table.add(BenchResult.success(variant, metrics, evaluation.areLabelsAuthoritative()));
                logger.info("Variant {} finished: {}", variant.getDisplayName(), metrics);
            } catch (RuntimeException e) {
                logger.error("Variant {} failed", variant.getDisplayName(), e);
                table.add(BenchResult.failure(variant, e));
            }
        }
        table.seal();
        logger.info("Benchmark complete: {} succeeded, {} failed", table.successful().size(), table.failedCount());
        return table;
    }

    /**
     * Fits the variant's vectorizer and classifier on the training set only, then scores the
     * evaluation set. Training time covers vectorizer fitting, training-set vectorization and the
     * classifier fit.
     */
    Metrics runVariant(ModelVariant variant, Dataset training, Dataset evaluation) {
        long start = System.nanoTime();

        logger.debug("{}: {}", variant, VariantState.LOAD_FEATURES);
        TextVectorizer vectorizer = variant.fitVectorizer(training.texts(), config);
        List<float[]> trainFeatures = vectorizer.vectorizeAll(training.texts());

        logger.debug("{}: {}", variant, VariantState.TRAIN);
        LogisticRegressionModel model = new LogisticRegressionTrainer(config.getClassifier())
                .fit(variant.getDisplayName(), trainFeatures, training.labels());
        double trainingSeconds = (System.nanoTime() - start) / 1e9;
        logger.info("{} trained in {} s ({} optimizer iterations)",
                    variant.getDisplayName(), String.format("%.3f", trainingSeconds), model.getIterations());

        logger.debug("{}: {}", variant, VariantState.EVALUATE);
        List<float[]> evalFeatures = vectorizer.vectorizeAll(evaluation.texts());
        Metrics metrics = Evaluator.evaluate(model, evalFeatures, evaluation.labels());

        logger.debug("{}: {}", variant, VariantState.RECORD);
        return metrics.withModelName(variant.getDisplayName()).withTrainingTime(trainingSeconds);
    }
}
