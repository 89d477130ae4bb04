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

import io.github.qqpbench.exceptions.InvalidInputException;
import io.github.qqpbench.util.VectorUtil;

/**
 * A fitted binary logistic regression: {@code p(duplicate | x) = sigmoid(w . x + b)}.
 */
public final class LogisticRegressionModel implements FittedClassifier {
    private final String name;
    private final double[] weights;
    private final double intercept;
    private final int iterations;
    private final boolean converged;

    LogisticRegressionModel(String name, double[] weights, double intercept, int iterations, boolean converged) {
        this.name = name;
        this.weights = weights;
        this.intercept = intercept;
        this.iterations = iterations;
        this.converged = converged;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int dimension() {
        return weights.length;
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double getIntercept() {
        return intercept;
    }

    /**
     * @return optimizer iterations used by the fit
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * @return false if the fit stopped at the iteration cap
     */
    public boolean isConverged() {
        return converged;
    }

    @Override
    public double decisionFunction(float[] features) {
        if (features.length != weights.length) {
            throw new InvalidInputException("expected " + weights.length + " features, got " + features.length);
        }
        double z = intercept;
        for (int i = 0; i < weights.length; i++) {
            z += weights[i] * features[i];
        }
        return z;
    }

    @Override
    public double probability(float[] features) {
        return VectorUtil.sigmoid(decisionFunction(features));
    }

    @Override
    public String toString() {
        return "LogisticRegressionModel{name='" + name + "', dimension=" + weights.length
               + ", iterations=" + iterations + ", converged=" + converged + "}";
    }
}
