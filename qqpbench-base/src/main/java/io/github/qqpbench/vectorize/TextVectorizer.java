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

import java.util.ArrayList;
import java.util.List;

/**
 * Maps text to a fixed-dimension feature vector. Implementations are immutable once built, so a single
 * instance can vectorize both the training and the evaluation records of a run.
 */
public interface TextVectorizer {
    /**
     * @return the length of every vector returned by {@link #vectorize(String)}
     */
    int dimension();

    /**
     * @return a new array of length {@link #dimension()}; never null
     */
    float[] vectorize(String text);

    default List<float[]> vectorizeAll(List<String> texts) {
        var vectors = new ArrayList<float[]>(texts.size());
        for (String text : texts) {
            vectors.add(vectorize(text));
        }
        return vectors;
    }
}
