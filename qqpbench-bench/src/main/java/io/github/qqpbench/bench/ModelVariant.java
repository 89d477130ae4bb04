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

import io.github.qqpbench.vectorize.FastTextTrainer;
import io.github.qqpbench.vectorize.HashingTfIdfVectorizer;
import io.github.qqpbench.vectorize.TextVectorizer;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * The (vectorizer, classifier) pairings a benchmark can evaluate. Every variant feeds its vectors to
 * logistic regression; they differ in how text becomes a vector.
 */
public enum ModelVariant {
    /** Mean of FastText skip-gram word embeddings trained on the training texts. */
    FASTTEXT_LINEAR("FastText") {
        @Override
        public TextVectorizer fitVectorizer(List<String> trainingTexts, BenchConfig config) {
            return FastTextTrainer.train(trainingTexts, config.getEmbedding());
        }
    },
    /** Hashed term frequencies weighted by IDF fitted on the training texts. */
    TFIDF_LINEAR("TF-IDF") {
        @Override
        public TextVectorizer fitVectorizer(List<String> trainingTexts, BenchConfig config) {
            return HashingTfIdfVectorizer.fit(trainingTexts, config.getTfidfNumFeatures(), config.getTfidfMinDocFreq());
        }
    };

    private final String displayName;

    ModelVariant(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Builds this variant's vectorizer from training texts only.
     */
    public abstract TextVectorizer fitVectorizer(List<String> trainingTexts, BenchConfig config);

    /**
     * Accepts the enum name or the display name, case-insensitively, with '-' and '_' interchangeable.
     */
    public static ModelVariant parse(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ModelVariant variant : values()) {
            if (variant.name().equals(normalized)
                || variant.displayName.toUpperCase(Locale.ROOT).replace('-', '_').equals(normalized)) {
                return variant;
            }
        }
        throw new IllegalArgumentException("Invalid model variant '" + name + "', expected one of "
                                           + Arrays.toString(values()));
    }
}
