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

package io.github.qqpbench.vectorize;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.BeforeClass;
import org.junit.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestEmbeddingModel extends RandomizedTest {
    private static EmbeddingModel model;

    @BeforeClass
    public static void trainModel() {
        var params = EmbeddingParameters.builder().withDimension(6).withEpochs(3).withBuckets(500).build();
        model = FastTextTrainer.train(List.of("red apple", "green apple", "red car", "blue car"), params);
    }

    @Test
    public void testVectorizeIsDeterministic() {
        assertArrayEquals(model.vectorize("red apple"), model.vectorize("red apple"), 0f);
    }

    @Test
    public void testSingleWordIsItsOwnVector() {
        assertArrayEquals(model.vectorFor("apple").orElseThrow(), model.vectorize("Apple"), 0f);
    }

    @Test
    public void testTextVectorIsMeanOfWordVectors() {
        float[] red = model.vectorFor("red").orElseThrow();
        float[] car = model.vectorFor("car").orElseThrow();
        float[] v = model.vectorize("red car");
        for (int d = 0; d < v.length; d++) {
            assertEquals((red[d] + car[d]) / 2, v[d], 1e-6f);
        }
    }

    @Test
    public void testUnknownAndEmptyTextIsZeroVector() {
        float[] zero = new float[model.dimension()];
        assertArrayEquals(zero, model.vectorize(""), 0f);
        assertArrayEquals(zero, model.vectorize("purple bicycle"), 0f);
    }

    @Test
    public void testUnseenTokensAreIgnored() {
        // words never seen in training contribute nothing
        assertArrayEquals(model.vectorize("green apple"), model.vectorize("green zebra apple unicorn"), 0f);
        assertFalse(model.contains("zebra"));
        assertTrue(model.vectorFor("zebra").isEmpty());
    }

    @Test
    public void testVectorizingNewTextLeavesModelUnchanged() {
        var vocabulary = new HashSet<>(model.vocabulary());
        float[] before = model.vectorFor("red").orElseThrow();

        model.vectorizeAll(List.of("red zebra", "unicorn apple red", "violet"));

        assertEquals(vocabulary, model.vocabulary());
        assertArrayEquals(before, model.vectorFor("red").orElseThrow(), 0f);
    }

    @Test
    public void testVectorForReturnsCopy() {
        float[] v = model.vectorFor("blue").orElseThrow();
        v[0] += 42f;
        assertFalse(v[0] == model.vectorFor("blue").orElseThrow()[0]);
    }

    @Test
    public void testVectorizeAll() {
        var vectors = model.vectorizeAll(List.of("red", "blue car", ""));
        assertEquals(3, vectors.size());
        for (float[] v : vectors) {
            assertEquals(model.dimension(), v.length);
        }
    }
}
