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

import io.github.qqpbench.text.Tokenizer;
import io.github.qqpbench.util.VectorUtil;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable token-to-vector mapping produced by {@link FastTextTrainer}.
 * <p>
 * A text is vectorized as the element-wise mean of the vectors of its in-vocabulary tokens.
 * Out-of-vocabulary tokens are ignored; a text with no in-vocabulary token maps to the zero vector.
 */
public final class EmbeddingModel implements TextVectorizer {
    private final int dimension;
    private final Map<String, Integer> vocabulary;
    private final float[][] vectors;

    /**
     * @param words   vocabulary, in the order of {@code vectors}
     * @param vectors one vector of length {@code dimension} per word; the model takes ownership
     */
    EmbeddingModel(int dimension, List<String> words, float[][] vectors) {
        if (words.size() != vectors.length) {
            throw new IllegalArgumentException(words.size() + " words but " + vectors.length + " vectors");
        }
        var index = new LinkedHashMap<String, Integer>();
        for (int i = 0; i < words.size(); i++) {
            if (vectors[i].length != dimension) {
                throw new IllegalArgumentException("vector for '" + words.get(i) + "' has dimension "
                                                   + vectors[i].length + ", expected " + dimension);
            }
            index.put(words.get(i), i);
        }
        this.dimension = dimension;
        this.vocabulary = Collections.unmodifiableMap(index);
        this.vectors = vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    public Set<String> vocabulary() {
        return vocabulary.keySet();
    }

    public int vocabularySize() {
        return vocabulary.size();
    }

    public boolean contains(String word) {
        return vocabulary.containsKey(word);
    }

    /**
     * @return a copy of the word's vector, or empty if the word is not in the vocabulary
     */
    public Optional<float[]> vectorFor(String word) {
        Integer i = vocabulary.get(word);
        return i == null ? Optional.empty() : Optional.of(vectors[i].clone());
    }

    @Override
    public float[] vectorize(String text) {
        float[] sum = new float[dimension];
        int found = 0;
        for (String token : Tokenizer.tokenize(text)) {
            Integer i = vocabulary.get(token);
            if (i != null) {
                VectorUtil.addInPlace(sum, vectors[i]);
                found++;
            }
        }
        if (found > 1) {
            VectorUtil.scaleInPlace(sum, 1f / found);
        }
        return sum;
    }

    @Override
    public String toString() {
        return "EmbeddingModel{dimension=" + dimension + ", vocabulary=" + vocabulary.size() + "}";
    }
}
