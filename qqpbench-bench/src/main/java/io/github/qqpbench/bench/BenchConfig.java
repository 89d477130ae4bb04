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

import io.github.qqpbench.bench.yaml.RunConfig;
import io.github.qqpbench.classify.ClassifierParameters;
import io.github.qqpbench.vectorize.EmbeddingParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable configuration of one benchmark run: where the data comes from, which variants to run and
 * the settings of every vectorizer and the classifier.
 * <p>
 * Build it programmatically with {@link Builder}, or from a YAML {@link RunConfig} with
 * {@link #fromRunConfig(RunConfig)}.
 *
 * <pre>{@code
 * BenchConfig config = BenchConfig.fromRunConfig(RunConfig.loadDefault())
 *     .toBuilder()
 *     .withTrainingSource("glue/QQP/train.tsv")
 *     .withVariants(List.of(ModelVariant.FASTTEXT_LINEAR))
 *     .build();
 * }</pre>
 */
public class BenchConfig {
    private final String trainingSource;
    private final String evaluationSource;
    private final boolean evaluationLabeled;
    private final List<ModelVariant> variants;
    private final EmbeddingParameters embedding;
    private final int tfidfNumFeatures;
    private final int tfidfMinDocFreq;
    private final ClassifierParameters classifier;
    private final String outputBasePath;

    private BenchConfig(Builder builder) {
        this.trainingSource = builder.trainingSource;
        this.evaluationSource = builder.evaluationSource;
        this.evaluationLabeled = builder.evaluationLabeled;
        this.variants = Collections.unmodifiableList(new ArrayList<>(builder.variants));
        this.embedding = builder.embedding;
        this.tfidfNumFeatures = builder.tfidfNumFeatures;
        this.tfidfMinDocFreq = builder.tfidfMinDocFreq;
        this.classifier = builder.classifier;
        this.outputBasePath = builder.outputBasePath;
    }

    public static BenchConfig fromRunConfig(RunConfig rc) {
        var embedding = rc.embedding == null ? new RunConfig.Embedding() : rc.embedding;
        var tfidf = rc.tfidf == null ? new RunConfig.Tfidf() : rc.tfidf;
        var classifier = rc.classifier == null ? new RunConfig.Classifier() : rc.classifier;

        var builder = new Builder()
                .withEvaluationLabeled(rc.evaluationLabeled)
                .withEmbedding(EmbeddingParameters.builder()
                                       .withDimension(embedding.dimension)
                                       .withWindow(embedding.window)
                                       .withMinCount(embedding.minCount)
                                       .withEpochs(embedding.epochs)
                                       .withNegative(embedding.negative)
                                       .withLearningRate((float) embedding.learningRate)
                                       .withCharNgrams(embedding.minN, embedding.maxN)
                                       .withBuckets(embedding.buckets)
                                       .withSeed(embedding.seed)
                                       .build())
                .withTfidf(tfidf.numFeatures, tfidf.minDocFreq)
                .withClassifier(new ClassifierParameters(classifier.maxIterations,
                                                         classifier.regularization,
                                                         classifier.tolerance));
        if (rc.trainingSource != null) {
            builder.withTrainingSource(rc.trainingSource);
        }
        if (rc.evaluationSource != null) {
            builder.withEvaluationSource(rc.evaluationSource);
        }
        if (rc.variants != null) {
            builder.withVariants(rc.variants.stream().map(ModelVariant::parse).collect(Collectors.toList()));
        }
        if (rc.output != null) {
            builder.withOutputBasePath(rc.output.basePath);
        }
        return builder.build();
    }

    public String getTrainingSource() { return trainingSource; }

    public String getEvaluationSource() { return evaluationSource; }

    /**
     * @return false if the evaluation source is loaded with placeholder labels
     */
    public boolean isEvaluationLabeled() { return evaluationLabeled; }

    public List<ModelVariant> getVariants() { return variants; }

    public EmbeddingParameters getEmbedding() { return embedding; }

    public int getTfidfNumFeatures() { return tfidfNumFeatures; }

    public int getTfidfMinDocFreq() { return tfidfMinDocFreq; }

    public ClassifierParameters getClassifier() { return classifier; }

    /**
     * @return base path for file reports, or null for console output only
     */
    public String getOutputBasePath() { return outputBasePath; }

    /**
     * @return the settings worth printing before a run, in display order
     */
    public Map<String, Object> describe() {
        var params = new LinkedHashMap<String, Object>();
        params.put("trainingSource", trainingSource);
        params.put("evaluationSource", evaluationSource);
        params.put("evaluationLabeled", evaluationLabeled);
        params.put("variants", variants);
        params.put("embedding", embedding);
        params.put("tfidfNumFeatures", tfidfNumFeatures);
        params.put("tfidfMinDocFreq", tfidfMinDocFreq);
        params.put("classifier", classifier);
        params.put("output", outputBasePath == null ? "(console only)" : outputBasePath);
        return params;
    }

    public Builder toBuilder() {
        return new Builder()
                .withTrainingSource(trainingSource)
                .withEvaluationSource(evaluationSource)
                .withEvaluationLabeled(evaluationLabeled)
                .withVariants(variants)
                .withEmbedding(embedding)
                .withTfidf(tfidfNumFeatures, tfidfMinDocFreq)
                .withClassifier(classifier)
                .withOutputBasePath(outputBasePath);
    }

    public static class Builder {
        private String trainingSource = "glue/QQP/dev.tsv";
        private String evaluationSource = "glue/QQP/dev.tsv";
        private boolean evaluationLabeled = true;
        private List<ModelVariant> variants = List.of(ModelVariant.values());
        private EmbeddingParameters embedding = EmbeddingParameters.defaults();
        private int tfidfNumFeatures = 1024;
        private int tfidfMinDocFreq = 0;
        private ClassifierParameters classifier = ClassifierParameters.defaults();
        private String outputBasePath;

        public Builder withTrainingSource(String trainingSource) {
            this.trainingSource = trainingSource;
            return this;
        }

        public Builder withEvaluationSource(String evaluationSource) {
            this.evaluationSource = evaluationSource;
            return this;
        }

        public Builder withEvaluationLabeled(boolean evaluationLabeled) {
            this.evaluationLabeled = evaluationLabeled;
            return this;
        }

        public Builder withVariants(List<ModelVariant> variants) {
            this.variants = variants;
            return this;
        }

        public Builder withEmbedding(EmbeddingParameters embedding) {
            this.embedding = embedding;
            return this;
        }

        public Builder withTfidf(int numFeatures, int minDocFreq) {
            this.tfidfNumFeatures = numFeatures;
            this.tfidfMinDocFreq = minDocFreq;
            return this;
        }

        public Builder withClassifier(ClassifierParameters classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder withOutputBasePath(String outputBasePath) {
            this.outputBasePath = outputBasePath;
            return this;
        }

        public BenchConfig build() {
            if (trainingSource == null || evaluationSource == null) {
                throw new IllegalArgumentException("training and evaluation sources are required");
            }
            if (variants == null || variants.isEmpty()) {
                throw new IllegalArgumentException("at least one model variant is required");
            }
            if (tfidfNumFeatures <= 0) {
                throw new IllegalArgumentException("tfidf numFeatures must be positive: " + tfidfNumFeatures);
            }
            return new BenchConfig(this);
        }
    }
}
