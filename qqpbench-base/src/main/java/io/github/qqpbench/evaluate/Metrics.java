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

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Evaluation scores of one model, plus the wall-clock seconds its training took.
 */
public final class Metrics {
    private final String modelName;
    private final double accuracy;
    private final double precision;
    private final double recall;
    private final double f1;
    private final double auc;
    private final double trainingTimeSeconds;

    public Metrics(String modelName, double accuracy, double precision, double recall, double f1, double auc,
                   double trainingTimeSeconds) {
        if (trainingTimeSeconds < 0) {
            throw new IllegalArgumentException("training time must not be negative: " + trainingTimeSeconds);
        }
        this.modelName = modelName;
        this.accuracy = accuracy;
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
        this.auc = auc;
        this.trainingTimeSeconds = trainingTimeSeconds;
    }

    public Metrics withTrainingTime(double seconds) {
        return new Metrics(modelName, accuracy, precision, recall, f1, auc, seconds);
    }

    public Metrics withModelName(String name) {
        return new Metrics(name, accuracy, precision, recall, f1, auc, trainingTimeSeconds);
    }

    public String getModelName() {
        return modelName;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getPrecision() {
        return precision;
    }

    public double getRecall() {
        return recall;
    }

    public double getF1() {
        return f1;
    }

    public double getAuc() {
        return auc;
    }

    public double getTrainingTimeSeconds() {
        return trainingTimeSeconds;
    }

    public double get(MetricKind kind) {
        switch (kind) {
            case ACCURACY: return accuracy;
            case WEIGHTED_PRECISION: return precision;
            case WEIGHTED_RECALL: return recall;
            case WEIGHTED_F1: return f1;
            case AUC: return auc;
            default: throw new IllegalArgumentException("unknown metric " + kind);
        }
    }

    public Map<MetricKind, Double> asMap() {
        var map = new EnumMap<MetricKind, Double>(MetricKind.class);
        for (MetricKind kind : MetricKind.values()) {
            map.put(kind, get(kind));
        }
        return map;
    }

    @Override
    public String toString() {
        return String.format(Locale.US,
                "%s - AUC: %.4f, Accuracy: %.4f, Precision: %.4f, Recall: %.4f, F1: %.4f, Training time: %.2fs",
                modelName, auc, accuracy, precision, recall, f1, trainingTimeSeconds);
    }
}
