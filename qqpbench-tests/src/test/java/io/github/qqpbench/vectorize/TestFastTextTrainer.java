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
import io.github.qqpbench.exceptions.InvalidInputException;
import org.junit.Test;

import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestFastTextTrainer extends RandomizedTest {
    private static final List<String> CORPUS = List.of(
            "how do i learn java",
            "how do i learn python",
            "what is the capital of france",
            "what is the capital of germany",
            "how can i lose weight fast",
            "what are ways to lose weight");

    private static EmbeddingParameters small() {
        return EmbeddingParameters.builder().withDimension(8).withEpochs(2).withBuckets(1000).build();
    }

    @Test
    public void testVocabularyHoldsEveryTrainingToken() {
        var params = EmbeddingParameters.builder().withDimension(4).withMinCount(1).build();
        EmbeddingModel model = FastTextTrainer.train(List.of("a b", "c d"), params);

        assertEquals(Set.of("a", "b", "c", "d"), model.vocabulary());
        assertEquals(4, model.vocabularySize());
        assertEquals(4, model.dimension());
        assertEquals(4, model.vectorFor("a").orElseThrow().length);
    }

    @Test
    public void testMinCountPrunesRareTokens() {
        var params = small().toBuilder().withMinCount(2).build();
        EmbeddingModel model = FastTextTrainer.train(CORPUS, params);

        assertTrue(model.contains("how"));
        assertTrue(model.contains("capital"));
        assertFalse(model.contains("java"));
        assertFalse(model.contains("germany"));
    }

    @Test
    public void testSameSeedSameVectors() {
        long seed = randomLong();
        var params = small().toBuilder().withSeed(seed).build();
        EmbeddingModel first = FastTextTrainer.train(CORPUS, params);
        EmbeddingModel second = FastTextTrainer.train(CORPUS, params);

        for (String word : first.vocabulary()) {
            assertArrayEquals(first.vectorFor(word).orElseThrow(), second.vectorFor(word).orElseThrow(), 0f);
        }
    }

    @Test
    public void testWorksWithoutSubwords() {
        var params = small().toBuilder().withCharNgrams(0, 0).build();
        assertFalse(params.usesSubwords());
        EmbeddingModel model = FastTextTrainer.train(CORPUS, params);
        assertEquals(8, model.vectorize("learn java").length);
    }

    @Test
    public void testEmptyCorpusIsRejected() {
        assertThrows(InvalidInputException.class, () -> FastTextTrainer.train(List.of(), small()));
        assertThrows(InvalidInputException.class, () -> FastTextTrainer.train(List.of("", "  "), small()));
    }

    @Test
    public void testCharNgramsIncludeWordBoundaries() {
        assertEquals(List.of("<a", "ab", "b>", "<ab", "ab>"), FastTextTrainer.charNgrams("ab", 2, 3));
    }

    @Test
    public void testFnv1a() {
        // reference values of 32-bit FNV-1a
        assertEquals(0x811C9DC5, FastTextTrainer.fnv1a(""));
        assertEquals(0xE40C292C, FastTextTrainer.fnv1a("a"));
        assertEquals(0xBF9CF968, FastTextTrainer.fnv1a("foobar"));
    }

    @Test
    public void testInvalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EmbeddingParameters.builder().withDimension(0).build());
        assertThrows(IllegalArgumentException.class, () -> EmbeddingParameters.builder().withEpochs(0).build());
    }
}
