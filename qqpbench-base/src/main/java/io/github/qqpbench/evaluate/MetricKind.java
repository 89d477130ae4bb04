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

package io.github.qqpbench.evaluate;

/**
 * The metrics {@link Evaluator} can compute. Precision, recall and F1 are averaged over classes weighted by
 * each class's frequency in the true labels.
 */
public enum MetricKind {
    ACCURACY("Accuracy"),
    WEIGHTED_PRECISION("Precision"),
    WEIGHTED_RECALL("Recall"),
    WEIGHTED_F1("F1"),
    /** Area under the ROC curve of the positive-class probabilities; NaN when only one class is present. */
    AUC("AUC");

    private final String displayName;

    MetricKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
