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

package io.github.qqpbench.util;

/**
 * Small dense-vector helpers shared by the vectorizers and the classifier.
 */
public final class VectorUtil {
    private VectorUtil() {
    }

    /** a += b */
    public static void addInPlace(float[] a, float[] b) {
        assert a.length == b.length : "dimension mismatch " + a.length + " != " + b.length;
        for (int i = 0; i < a.length; i++) {
            a[i] += b[i];
        }
    }

    public static void scaleInPlace(float[] a, float scale) {
        for (int i = 0; i < a.length; i++) {
            a[i] *= scale;
        }
    }

    /**
     * Logistic function, clamped so that very large magnitudes do not overflow.
     */
    public static double sigmoid(double x) {
        if (x >= 30) {
            return 1.0;
        }
        if (x <= -30) {
            return 0.0;
        }
        return 1.0 / (1.0 + Math.exp(-x));
    }
}
