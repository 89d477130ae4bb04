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

import io.github.qqpbench.evaluate.Metrics;

/**
 * Outcome of one model variant in a benchmark run. Fields are public and final so
 * {@link io.github.qqpbench.bench.reporting.ResultHandler} implementations can serialize them with Jackson as-is
 * while a sealed {@link ComparisonTable} stays read-only.
 */
public final class BenchResult {
    public enum Status {
        SUCCESS,
        FAILED
    }

    /** Display name of the model, e.g. "FastText". */
    public final String model;

    public final ModelVariant variant;

    public final Status status;

    /** Null unless {@link #status} is SUCCESS. */
    public final Metrics metrics;

    /** False when the evaluation set carried placeholder labels, so metrics are not meaningful. */
    public final boolean labelsAuthoritative;

    /** Failure description, null on success. */
    public final String error;

    private BenchResult(String model, ModelVariant variant, Status status, Metrics metrics,
                        boolean labelsAuthoritative, String error) {
        this.model = model;
        this.variant = variant;
        this.status = status;
        this.metrics = metrics;
        this.labelsAuthoritative = labelsAuthoritative;
        this.error = error;
    }

    public static BenchResult success(ModelVariant variant, Metrics metrics, boolean labelsAuthoritative) {
        return new BenchResult(metrics.getModelName(), variant, Status.SUCCESS, metrics, labelsAuthoritative, null);
    }

    public static BenchResult failure(ModelVariant variant, Throwable cause) {
        String error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new BenchResult(variant.getDisplayName(), variant, Status.FAILED, null, false, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @Override
    public String toString() {
        return isSuccess()
               ? "BenchResult{" + model + ", " + metrics + '}'
               : "BenchResult{" + model + ", FAILED: " + error + '}';
    }
}
