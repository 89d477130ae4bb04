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

import io.github.qqpbench.classify.FittedClassifier;
import io.github.qqpbench.exceptions.InvalidInputException;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

/**
 * Scores a fitted classifier against held-out vectors. All methods are pure: neither the classifier nor
 * the inputs are modified, and the metric to compute is a parameter rather than evaluator state.
 */
public final class Evaluator {
    private Evaluator() {
    }

    /**
     * @return all {@link MetricKind}s for the classifier's predictions, tagged with its name and a training time of 0
     * @throws InvalidInputException if the inputs are empty, of different lengths, or of the wrong dimension
     */
    public static Metrics evaluate(FittedClassifier classifier, List<float[]> features, double[] labels) {
        if (features.isEmpty()) {
            throw new InvalidInputException("cannot evaluate on an empty test set");
        }
        if (features.size() != labels.length) {
            throw new InvalidInputException(features.size() + " feature vectors but " + labels.length + " labels");
        }
        double[] predictions = new double[labels.length];
        double[] scores = new double[labels.length];
        for (int i = 0; i < labels.length; i++) {
            float[] x = features.get(i);
            if (x.length != classifier.dimension()) {
                throw new InvalidInputException("test vector " + i + " has dimension " + x.length
                                                + ", classifier expects " + classifier.dimension());
            }
            predictions[i] = classifier.predict(x);
            scores[i] = classifier.probability(x);
        }
        return new Metrics(classifier.getName(),
                           compute(MetricKind.ACCURACY, labels, predictions, scores),
                           compute(MetricKind.WEIGHTED_PRECISION, labels, predictions, scores),
                           compute(MetricKind.WEIGHTED_RECALL, labels, predictions, scores),
                           compute(MetricKind.WEIGHTED_F1, labels, predictions, scores),
                           compute(MetricKind.AUC, labels, predictions, scores),
                           0.0);
    }

    /**
     * @param scores positive-class probabilities; only read for {@link MetricKind#AUC}
     */
    public static double compute(MetricKind kind, double[] labels, double[] predictions, double[] scores) {
        if (labels.length == 0) {
            throw new InvalidInputException("cannot compute " + kind + " over zero examples");
        }
        if (labels.length != predictions.length) {
            throw new InvalidInputException(labels.length + " labels but " + predictions.length + " predictions");
        }
        switch (kind) {
            case ACCURACY:
                return accuracy(labels, predictions);
            case WEIGHTED_PRECISION:
            case WEIGHTED_RECALL:
            case WEIGHTED_F1:
                return weighted(kind, labels, predictions);
            case AUC:
                if (scores.length != labels.length) {
                    throw new InvalidInputException(labels.length + " labels but " + scores.length + " scores");
                }
                return auc(labels, scores);
            default:
                throw new IllegalArgumentException("unknown metric " + kind);
        }
    }

    static double accuracy(double[] labels, double[] predictions) {
        int correct = 0;
        for (int i = 0; i < labels.length; i++) {
            if (labels[i] == predictions[i]) {
                correct++;
            }
        }
        return (double) correct / labels.length;
    }

    /**
     * Per-class precision, recall or F1 averaged with weights equal to each class's support in {@code labels}.
     * A class with no predictions has precision 0; a class never present has weight 0.
     */
    static double weighted(MetricKind kind, double[] labels, double[] predictions) {
        var classes = new TreeSet<Double>();
        for (int i = 0; i < labels.length; i++) {
            classes.add(labels[i]);
            classes.add(predictions[i]);
        }
        double sum = 0;
        for (double c : classes) {
            long tp = 0, fp = 0, fn = 0;
            for (int i = 0; i < labels.length; i++) {
                boolean actual = labels[i] == c;
                boolean predicted = predictions[i] == c;
                if (actual && predicted) {
                    tp++;
                } else if (predicted) {
                    fp++;
                } else if (actual) {
                    fn++;
                }
            }
            long support = tp + fn;
            if (support == 0) {
                continue;
            }
            double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
            double recall = (double) tp / support;
            double value;
            switch (kind) {
                case WEIGHTED_PRECISION:
                    value = precision;
                    break;
                case WEIGHTED_RECALL:
                    value = recall;
                    break;
                default:
                    value = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
            }
            sum += support * value;
        }
        return sum / labels.length;
    }

    /**
     * Rank-based (Mann-Whitney) area under the ROC curve; tied scores share their average rank.
     */
    static double auc(double[] labels, double[] scores) {
        int n = labels.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(scores[a], scores[b]));

        double positiveRankSum = 0;
        long positives = 0;
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && scores[order[j + 1]] == scores[order[i]]) {
                j++;
            }
            double averageRank = (i + j) / 2.0 + 1;
            for (int k = i; k <= j; k++) {
                if (labels[order[k]] == 1.0) {
                    positiveRankSum += averageRank;
                    positives++;
                }
            }
            i = j + 1;
        }
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return Double.NaN;
        }
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }
}
