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

import io.github.qqpbench.data.Dataset;
import io.github.qqpbench.evaluate.Metrics;

/**
 * Trains and evaluates one model variant.
 */
@FunctionalInterface
public interface VariantExecutor {
    /**
     * @throws RuntimeException if the variant cannot be trained or evaluated; the runner records the
     *                          failure and moves on to the next variant
     */
    Metrics execute(ModelVariant variant, Dataset training, Dataset evaluation);
}
