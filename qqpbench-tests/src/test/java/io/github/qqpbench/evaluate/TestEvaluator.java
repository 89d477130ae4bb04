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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.qqpbench.classify.FittedClassifier;
import io.github.qqpbench.exceptions.InvalidInputException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestEvaluator extends RandomizedTest {
    private static final double DELTA = 1e-9;

    /** Predicts duplicate when the first feature is positive. */
    private static final FittedClassifier SIGN_OF_FIRST = new FittedClassifier() {
        @Override
        public String getName() {
            return "sign";
        }

        @Override
        public int dimension() {
            return 1;
        }

        @Override
        public double decisionFunction(float[] features) {
            return features[0];
        }

        @Override
        public double probability(float[] features) {
            return 1 / (1 + Math.exp(-features[0]));
        }
    };

    @Test
    public void testMixedPredictions() {
        double[] labels = {1, 1, 1, 0, 0};
        double[] predictions = {1, 1, 0, 0, 1};

        assertEquals(0.6, Evaluator.compute(MetricKind.ACCURACY, labels, predictions, predictions), DELTA);
        // class 0: p = r = 1/2 with support 2, class 1: p = r = 2/3 with support 3
        assertEquals(0.6, Evaluator.compute(MetricKind.WEIGHTED_PRECISION, labels, predictions, predictions), DELTA);
        assertEquals(0.6, Evaluator.compute(MetricKind.WEIGHTED_RECALL, labels, predictions, predictions), DELTA);
        assertEquals(0.6, Evaluator.compute(MetricKind.WEIGHTED_F1, labels, predictions, predictions), DELTA);
    }

    @Test
    public void testClassNeverPredictedHasZeroPrecision() {
        double[] labels = {1, 1, 1, 1, 0, 0};
        double[] predictions = {1, 1, 1, 1, 1, 1};

        assertEquals(4.0 / 6, Evaluator.compute(MetricKind.ACCURACY, labels, predictions, predictions), DELTA);
        assertEquals(4 * (4.0 / 6) / 6, Evaluator.compute(MetricKind.WEIGHTED_PRECISION, labels, predictions, predictions), DELTA);
        assertEquals(4.0 / 6, Evaluator.compute(MetricKind.WEIGHTED_RECALL, labels, predictions, predictions), DELTA);
        assertEquals(4 * 0.8 / 6, Evaluator.compute(MetricKind.WEIGHTED_F1, labels, predictions, predictions), DELTA);
    }

    @Test
    public void testPerfectPredictions() {
        int n = randomIntBetween(2, 100);
        double[] labels = new double[n];
        for (int i = 0; i < n; i++) {
            labels[i] = randomBoolean() ? 1 : 0;
        }
        for (MetricKind kind : new MetricKind[]{MetricKind.ACCURACY, MetricKind.WEIGHTED_PRECISION,
                                                MetricKind.WEIGHTED_RECALL, MetricKind.WEIGHTED_F1}) {
            assertEquals(kind.toString(), 1.0, Evaluator.compute(kind, labels, labels, labels), DELTA);
        }
    }

    @Test
    public void testAuc() {
        double[] labels = {0, 0, 1, 1};
        double[] scores = {0.1, 0.4, 0.35, 0.8};
        assertEquals(0.75, Evaluator.compute(MetricKind.AUC, labels, labels, scores), DELTA);

        // ties share their rank
        assertEquals(0.5, Evaluator.compute(MetricKind.AUC, new double[]{0, 1}, new double[]{0, 0}, new double[]{0.5, 0.5}), DELTA);

        // undefined with a single class
        assertTrue(Double.isNaN(Evaluator.compute(MetricKind.AUC, new double[]{1, 1}, new double[]{1, 1}, new double[]{0.2, 0.9})));
    }

    @Test
    public void testEvaluateClassifier() {
        List<float[]> x = List.of(new float[]{2f}, new float[]{-1f}, new float[]{0.5f}, new float[]{-3f});
        double[] y = {1, 0, 0, 0};

        Metrics metrics = Evaluator.evaluate(SIGN_OF_FIRST, x, y);
        assertEquals("sign", metrics.getModelName());
        assertEquals(0.75, metrics.getAccuracy(), DELTA);
        assertEquals(1.0, metrics.getAuc(), DELTA);
        assertEquals(0.0, metrics.getTrainingTimeSeconds(), 0.0);
        assertEquals(metrics.getF1(), metrics.get(MetricKind.WEIGHTED_F1), 0.0);
        assertEquals(MetricKind.values().length, metrics.asMap().size());
    }

    @Test
    public void testEvaluateDoesNotMutateInputs() {
        var x = new ArrayList<float[]>();
        x.add(new float[]{1f});
        x.add(new float[]{-1f});
        double[] y = {1, 0};
        Evaluator.evaluate(SIGN_OF_FIRST, x, y);
        assertEquals(1f, x.get(0)[0], 0f);
        assertEquals(0.0, y[1], 0.0);
    }

    @Test
    public void testInvalidInput() {
        assertThrows(InvalidInputException.class, () -> Evaluator.evaluate(SIGN_OF_FIRST, List.of(), new double[0]));
        assertThrows(InvalidInputException.class,
                     () -> Evaluator.evaluate(SIGN_OF_FIRST, List.of(new float[]{1f}), new double[]{1, 0}));
        assertThrows(InvalidInputException.class,
                     () -> Evaluator.evaluate(SIGN_OF_FIRST, List.of(new float[]{1f, 2f}), new double[]{1}));
    }

    @Test
    public void testNegativeTrainingTimeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Metrics("m", 1, 1, 1, 1, 1, -0.5));
    }
}
