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

package io.github.qqpbench.vectorize;

/**
 * Hyperparameters for {@link FastTextTrainer}. Defaults follow the skip-gram FastText setup the benchmark
 * has always used: 100 dimensions, window 5, min count 1, 3 epochs.
 */
public final class EmbeddingParameters {
    private final int dimension;
    private final int window;
    private final int minCount;
    private final int epochs;
    private final int negative;
    private final float learningRate;
    private final int minN;
    private final int maxN;
    private final int buckets;
    private final long seed;

    private EmbeddingParameters(Builder builder) {
        this.dimension = builder.dimension;
        this.window = builder.window;
        this.minCount = builder.minCount;
        this.epochs = builder.epochs;
        this.negative = builder.negative;
        this.learningRate = builder.learningRate;
        this.minN = builder.minN;
        this.maxN = builder.maxN;
        this.buckets = builder.buckets;
        this.seed = builder.seed;
    }

    public static EmbeddingParameters defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getDimension() { return dimension; }

    public int getWindow() { return window; }

    public int getMinCount() { return minCount; }

    public int getEpochs() { return epochs; }

    public int getNegative() { return negative; }

    public float getLearningRate() { return learningRate; }

    public int getMinN() { return minN; }

    public int getMaxN() { return maxN; }

    public int getBuckets() { return buckets; }

    public long getSeed() { return seed; }

    /**
     * @return true if words are also represented by their character n-grams
     */
    public boolean usesSubwords() {
        return buckets > 0 && maxN >= minN && minN > 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .withDimension(dimension)
                .withWindow(window)
                .withMinCount(minCount)
                .withEpochs(epochs)
                .withNegative(negative)
                .withLearningRate(learningRate)
                .withCharNgrams(minN, maxN)
                .withBuckets(buckets)
                .withSeed(seed);
    }

    @Override
    public String toString() {
        return "EmbeddingParameters{dimension=" + dimension + ", window=" + window + ", minCount=" + minCount
               + ", epochs=" + epochs + ", negative=" + negative + ", learningRate=" + learningRate
               + ", minN=" + minN + ", maxN=" + maxN + ", buckets=" + buckets + ", seed=" + seed + "}";
    }

    public static class Builder {
        private int dimension = 100;
        private int window = 5;
        private int minCount = 1;
        private int epochs = 3;
        private int negative = 5;
        private float learningRate = 0.025f;
        private int minN = 3;
        private int maxN = 6;
        private int buckets = 100_000;
        private long seed = 1;

        public Builder withDimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder withWindow(int window) {
            this.window = window;
            return this;
        }

        public Builder withMinCount(int minCount) {
            this.minCount = minCount;
            return this;
        }

        public Builder withEpochs(int epochs) {
            this.epochs = epochs;
            return this;
        }

        public Builder withNegative(int negative) {
            this.negative = negative;
            return this;
        }

        public Builder withLearningRate(float learningRate) {
            this.learningRate = learningRate;
            return this;
        }

        /**
         * Character n-gram lengths; set {@code maxN < minN} to train whole-word vectors only.
         */
        public Builder withCharNgrams(int minN, int maxN) {
            this.minN = minN;
            this.maxN = maxN;
            return this;
        }

        public Builder withBuckets(int buckets) {
            this.buckets = buckets;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public EmbeddingParameters build() {
            if (dimension <= 0) {
                throw new IllegalArgumentException("dimension must be positive: " + dimension);
            }
            if (window <= 0) {
                throw new IllegalArgumentException("window must be positive: " + window);
            }
            if (minCount <= 0) {
                throw new IllegalArgumentException("minCount must be positive: " + minCount);
            }
            if (epochs <= 0) {
                throw new IllegalArgumentException("epochs must be positive: " + epochs);
            }
            if (negative <= 0) {
                throw new IllegalArgumentException("negative must be positive: " + negative);
            }
            if (!(learningRate > 0)) {
                throw new IllegalArgumentException("learningRate must be positive: " + learningRate);
            }
            if (buckets < 0) {
                throw new IllegalArgumentException("buckets must not be negative: " + buckets);
            }
            return new EmbeddingParameters(this);
        }
    }
}
