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

import io.github.qqpbench.bench.reporting.ComparisonTablePrinter;
import io.github.qqpbench.bench.reporting.ResultHandler;
import io.github.qqpbench.bench.yaml.RunConfig;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;
import java.util.concurrent.Callable;

/**
 * Command-line entry point. Options override the values of the YAML run file, which in turn override
 * the built-in defaults.
 *
 * <pre>
 * # both variants on the default dev split
 * java -jar qqpbench.jar
 *
 * # FastText only, trained on the full training split, reports under results/
 * java -jar qqpbench.jar --data-file glue/QQP/train.tsv --variants FASTTEXT_LINEAR -o results/qqp
 * </pre>
 */
@CommandLine.Command(
        name = "qqpbench",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Benchmarks duplicate-question classifiers on QQP-style data"
)
public class QqpBenchCLI implements Callable<Integer> {
    @CommandLine.Option(names = {"-c", "--config"}, description = "YAML run file (default: built-in default.yml)")
    String configFile;

    @CommandLine.Option(names = "--data-file", description = "Training source")
    String dataFile;

    @CommandLine.Option(names = "--test-file", description = "Evaluation source")
    String testFile;

    @CommandLine.Option(names = "--fasttext-epochs", description = "Embedding training epochs")
    Integer fasttextEpochs;

    @CommandLine.Option(names = "--dimension", description = "Embedding dimension")
    Integer dimension;

    @CommandLine.Option(names = "--max-iter", description = "Classifier iteration cap")
    Integer maxIterations;

    @CommandLine.Option(names = "--variants", split = ",", description = "Variants to run, e.g. FASTTEXT_LINEAR,TFIDF_LINEAR")
    List<String> variants;

    @CommandLine.Option(names = "--eval-unlabeled", description = "Load the evaluation source with placeholder labels")
    boolean evalUnlabeled;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Base path for .csv and .json reports")
    String outputPath;

    BenchConfig buildConfig() throws IOException {
        RunConfig rc = configFile == null ? RunConfig.loadDefault() : RunConfig.load(configFile);
        BenchConfig.Builder builder = BenchConfig.fromRunConfig(rc).toBuilder();
        BenchConfig base = builder.build();

        if (dataFile != null) {
            builder.withTrainingSource(dataFile);
        }
        if (testFile != null) {
            builder.withEvaluationSource(testFile);
        }
        if (fasttextEpochs != null || dimension != null) {
            var embedding = base.getEmbedding().toBuilder();
            if (fasttextEpochs != null) {
                embedding.withEpochs(fasttextEpochs);
            }
            if (dimension != null) {
                embedding.withDimension(dimension);
            }
            builder.withEmbedding(embedding.build());
        }
        if (maxIterations != null) {
            builder.withClassifier(base.getClassifier().withMaxIterations(maxIterations));
        }
        if (variants != null) {
            builder.withVariants(variants.stream().map(ModelVariant::parse).collect(Collectors.toList()));
        }
        if (evalUnlabeled) {
            builder.withEvaluationLabeled(false);
        }
        if (outputPath != null) {
            builder.withOutputBasePath(outputPath);
        }
        return builder.build();
    }

    /**
     * @return 0 if at least one variant succeeded, 1 otherwise
     */
    @Override
    public Integer call() throws IOException {
        BenchConfig config = buildConfig();
        new ComparisonTablePrinter(System.out).printConfig(config.describe());

        ResultHandler handler = config.getOutputBasePath() == null
                                ? ResultHandler.consoleOnly()
                                : ResultHandler.combining(ResultHandler.consoleOnly(),
                                                          ResultHandler.toFiles(config.getOutputBasePath()));
        ComparisonTable table = new QqpBench.Builder()
                .withConfig(config)
                .withResultHandler(handler)
                .build()
                .execute();
        return table.successful().isEmpty() ? 1 : 0;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new QqpBenchCLI()).execute(args);
        System.exit(exitCode);
    }
}
