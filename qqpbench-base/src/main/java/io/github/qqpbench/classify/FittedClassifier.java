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

package io.github.qqpbench.classify;

/**
 * A trained binary classifier over dense feature vectors. Implementations are immutable.
 */
public interface FittedClassifier {
    /**
     * @return the name metrics computed for this classifier are tagged with
     */
    String getName();

    /**
     * @return the feature dimension this classifier was trained on
     */
    int dimension();

    /**
     * @return the raw decision value; positive values predict the duplicate class
     */
    double decisionFunction(float[] features);

    /**
     * @return the estimated probability of the duplicate class
     */
    double probability(float[] features);

    /**
     * @return 1.0 if {@link #decisionFunction(float[])} is positive, 0.0 otherwise
     */
    default double predict(float[] features) {
        return decisionFunction(features) > 0 ? 1.0 : 0.0;
    }
}
