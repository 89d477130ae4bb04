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

package io.github.qqpbench.text;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class TestTokenizer extends RandomizedTest {
    @Test
    public void testLowerCasesAndSplitsOnWhitespace() {
        assertEquals(List.of("how", "do", "i", "learn", "java?"), Tokenizer.tokenize("How  do\tI learn\nJava?"));
    }

    @Test
    public void testBlankAndNullGiveNoTokens() {
        assertTrue(Tokenizer.tokenize("").isEmpty());
        assertTrue(Tokenizer.tokenize("   \t ").isEmpty());
        assertTrue(Tokenizer.tokenize(null).isEmpty());
    }

    @Test
    public void testLeadingWhitespaceProducesNoEmptyToken() {
        assertEquals(List.of("a", "b"), Tokenizer.tokenize("  a b  "));
    }

    @Test
    public void testTokenizeAllKeepsOrder() {
        var sentences = Tokenizer.tokenizeAll(List.of("A b", "", "C"));
        assertEquals(3, sentences.size());
        assertEquals(List.of("a", "b"), sentences.get(0));
        assertTrue(sentences.get(1).isEmpty());
        assertEquals(List.of("c"), sentences.get(2));
    }
}
