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

import io.github.qqpbench.data.Record;
import io.github.qqpbench.exceptions.InvalidInputException;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.analysis.MultivariateVectorFunction;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

import static io.github.qqpbench.util.VectorUtil.sigmoid;

/**
 * Fits L2-regularized binary logistic regression.
 * <p>
 * Minimizes {@code 0.5 * |w|^2 + C * sum(logloss)} with an unpenalized intercept using Polak-Ribiere
 * conjugate gradients. The fit stops when the relative change of the objective falls below the
 * tolerance or when the iteration cap is reached, whichever comes first; hitting the cap is logged
 * and the current solution is kept.
 */
public class LogisticRegressionTrainer {
    private static final Logger logger = LoggerFactory.getLogger(LogisticRegressionTrainer.class);

    public static final String DEFAULT_NAME = "LogisticRegression";

    private final ClassifierParameters params;

    public LogisticRegressionTrainer(ClassifierParameters params) {
        this.params = params;
    }

    public LogisticRegressionModel fit(List<float[]> features, double[] labels) {
        return fit(DEFAULT_NAME, features, labels);
    }

    /**
     * @param modelName name the fitted model reports
     * @param features  one vector per example, all of the same dimension
     * @param labels    0.0 or 1.0 per example, both classes present
     * @throws InvalidInputException if the inputs are empty, of different lengths, of mixed dimension,
     *                               not binary, or contain a single class
     */
    public LogisticRegressionModel fit(String modelName, List<float[]> features, double[] labels) {
        validate(features, labels);
        int n = features.size();
        int dim = features.get(0).length;
        double c = params.getRegularization();
        logger.debug("fitting {} on {} examples of dimension {} with {}", modelName, n, dim, params);

        MultivariateFunction objective = point -> {
            double loss = 0;
            for (int i = 0; i < dim; i++) {
                loss += 0.5 * point[i] * point[i];
            }
            for (int r = 0; r < n; r++) {
                double z = score(point, features.get(r), dim);
                // log(1 + exp(-y'z)) with y' in {-1, 1}
                loss += c * softplus(labels[r] == Record.DUPLICATE ? -z : z);
            }
            return loss;
        };
        MultivariateVectorFunction gradient = point -> {
            double[] g = new double[dim + 1];
            System.arraycopy(point, 0, g, 0, dim);
            for (int r = 0; r < n; r++) {
                float[] x = features.get(r);
                double err = c * (sigmoid(score(point, x, dim)) - labels[r]);
                for (int i = 0; i < dim; i++) {
                    g[i] += err * x[i];
                }
                g[dim] += err;
            }
            return g;
        };

        int maxIterations = params.getMaxIterations();
        double tolerance = params.getTolerance();
        var optimizer = new NonLinearConjugateGradientOptimizer(
                NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
                new SimpleValueChecker(tolerance, tolerance, maxIterations));
        PointValuePair optimum = optimizer.optimize(
                new ObjectiveFunction(objective),
                new ObjectiveFunctionGradient(gradient),
                GoalType.MINIMIZE,
                new InitialGuess(new double[dim + 1]),
                MaxEval.unlimited(),
                MaxIter.unlimited());

        int iterations = optimizer.getIterations();
        boolean converged = iterations < maxIterations;
        if (!converged) {
            logger.warn("{} did not converge within {} iterations, using the last solution (objective {})",
                        modelName, maxIterations, optimum.getValue());
        }
        double[] solution = optimum.getPoint();
        logger.debug("{} fitted after {} iterations, objective {}", modelName, iterations, optimum.getValue());
        return new LogisticRegressionModel(modelName, Arrays.copyOf(solution, dim), solution[dim], iterations, converged);
    }

    private static void validate(List<float[]> features, double[] labels) {
        if (features.isEmpty() || labels.length == 0) {
            throw new InvalidInputException("cannot fit on an empty training set");
        }
        if (features.size() != labels.length) {
            throw new InvalidInputException(features.size() + " feature vectors but " + labels.length + " labels");
        }
        int dim = features.get(0).length;
        if (dim == 0) {
            throw new InvalidInputException("feature vectors are empty");
        }
        boolean seenNegative = false;
        boolean seenPositive = false;
        for (int i = 0; i < labels.length; i++) {
            if (features.get(i).length != dim) {
                throw new InvalidInputException("feature vector " + i + " has dimension " + features.get(i).length
                                                + ", expected " + dim);
            }
            if (labels[i] == Record.DUPLICATE) {
                seenPositive = true;
            } else if (labels[i] == Record.NOT_DUPLICATE) {
                seenNegative = true;
            } else {
                throw new InvalidInputException("label " + i + " is " + labels[i] + ", expected 0.0 or 1.0");
            }
        }
        if (!seenNegative || !seenPositive) {
            throw new InvalidInputException("training labels contain a single class, need both 0.0 and 1.0");
        }
    }

    private static double score(double[] point, float[] x, int dim) {
        double z = point[dim];
        for (int i = 0; i < dim; i++) {
            z += point[i] * x[i];
        }
        return z;
    }

    private static double softplus(double z) {
        return z > 0 ? z + Math.log1p(Math.exp(-z)) : Math.log1p(Math.exp(z));
    }
}
