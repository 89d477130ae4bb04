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
 * Settings for {@link LogisticRegressionTrainer}.
 */
public final class ClassifierParameters {
    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final double DEFAULT_REGULARIZATION = 1.0;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final int maxIterations;
    private final double regularization;
    private final double tolerance;

    /**
     * @param maxIterations  optimizer iteration cap
     * @param regularization inverse L2 strength C; larger values regularize less
     * @param tolerance      relative change of the objective below which the fit counts as converged
     */
    public ClassifierParameters(int maxIterations, double regularization, double tolerance) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (!(regularization > 0)) {
            throw new IllegalArgumentException("regularization must be positive: " + regularization);
        }
        if (!(tolerance >= 0)) {
            throw new IllegalArgumentException("tolerance must not be negative: " + tolerance);
        }
        this.maxIterations = maxIterations;
        this.regularization = regularization;
        this.tolerance = tolerance;
    }

    public static ClassifierParameters defaults() {
        return new ClassifierParameters(DEFAULT_MAX_ITERATIONS, DEFAULT_REGULARIZATION, DEFAULT_TOLERANCE);
    }

    public ClassifierParameters withMaxIterations(int maxIterations) {
        return new ClassifierParameters(maxIterations, regularization, tolerance);
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public double getRegularization() {
        return regularization;
    }

    public double getTolerance() {
        return tolerance;
    }

    @Override
    public String toString() {
        return "ClassifierParameters{maxIterations=" + maxIterations + ", C=" + regularization
               + ", tolerance=" + tolerance + "}";
    }
}
