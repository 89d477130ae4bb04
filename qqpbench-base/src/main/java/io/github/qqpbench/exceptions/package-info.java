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

/**
 * Exception types raised by the qqpbench pipeline.
 *
 * <h2>Exception Types</h2>
 * <ul>
 *   <li>{@link io.github.qqpbench.exceptions.SourceUnavailableException} - a dataset locator could not
 *       be opened. Checked; the dataset loader recovers from it by substituting the built-in sample.</li>
 *   <li>{@link io.github.qqpbench.exceptions.ParseFailureException} - a dataset source was opened but
 *       does not have the expected shape. Checked; recovered the same way.</li>
 *   <li>{@link io.github.qqpbench.exceptions.EmptyDatasetException} - a readable source produced no valid
 *       records after filtering. Unchecked and never recovered, so a misconfigured filter is visible.</li>
 *   <li>{@link io.github.qqpbench.exceptions.InvalidInputException} - a trainer or evaluator was handed
 *       inconsistent or empty inputs. Unchecked; the benchmark runner records the variant as failed
 *       and continues with the next one.</li>
 * </ul>
 */
package io.github.qqpbench.exceptions;
