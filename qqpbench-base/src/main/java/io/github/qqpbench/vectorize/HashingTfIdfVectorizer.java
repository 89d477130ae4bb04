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

import io.github.qqpbench.exceptions.InvalidInputException;
import io.github.qqpbench.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;

/**
 * Hashed term frequencies weighted by inverse document frequency.
 * <p>
 * Terms are mapped to {@code numFeatures} buckets by hash code; the IDF of each bucket is
 * {@code ln((m + 1) / (df + 1))} over the {@code m} fitting documents, and buckets seen in fewer than
 * {@code minDocFreq} documents get weight zero.
 */
public final class HashingTfIdfVectorizer implements TextVectorizer {
    private static final Logger logger = LoggerFactory.getLogger(HashingTfIdfVectorizer.class);

    private final int numFeatures;
    private final float[] idf;

    private HashingTfIdfVectorizer(int numFeatures, float[] idf) {
        this.numFeatures = numFeatures;
        this.idf = idf;
    }

    /**
     * Fits document frequencies on the given texts, which must be training texts only.
     */
    public static HashingTfIdfVectorizer fit(List<String> trainingTexts, int numFeatures, int minDocFreq) {
        if (numFeatures <= 0) {
            throw new InvalidInputException("numFeatures must be positive: " + numFeatures);
        }
        if (trainingTexts.isEmpty()) {
            throw new InvalidInputException("cannot fit document frequencies on an empty corpus");
        }
        long[] docFreq = new long[numFeatures];
        var seen = new HashSet<Integer>();
        for (String text : trainingTexts) {
            seen.clear();
            for (String term : Tokenizer.tokenize(text)) {
                seen.add(indexOf(term, numFeatures));
            }
            for (int bucket : seen) {
                docFreq[bucket]++;
            }
        }

        long m = trainingTexts.size();
        float[] idf = new float[numFeatures];
        int used = 0;
        for (int i = 0; i < numFeatures; i++) {
            if (docFreq[i] >= minDocFreq) {
                idf[i] = (float) Math.log((m + 1.0) / (docFreq[i] + 1.0));
            }
            if (docFreq[i] > 0) {
                used++;
            }
        }
        logger.info("fitted idf over {} documents, {} of {} hash buckets in use", m, used, numFeatures);
        return new HashingTfIdfVectorizer(numFeatures, idf);
    }

    static int indexOf(String term, int numFeatures) {
        return Math.floorMod(term.hashCode(), numFeatures);
    }

    @Override
    public int dimension() {
        return numFeatures;
    }

    @Override
    public float[] vectorize(String text) {
        float[] v = new float[numFeatures];
        for (String term : Tokenizer.tokenize(text)) {
            v[indexOf(term, numFeatures)] += 1f;
        }
        for (int i = 0; i < numFeatures; i++) {
            v[i] *= idf[i];
        }
        return v;
    }

    @Override
    public String toString() {
        return "HashingTfIdfVectorizer{numFeatures=" + numFeatures + "}";
    }
}
