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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lower-cases and splits on whitespace. No stemming and no stop word removal.
 */
public final class Tokenizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        var tokens = new ArrayList<String>();
        if (text == null) {
            return tokens;
        }
        for (String token : WHITESPACE.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static List<List<String>> tokenizeAll(List<String> texts) {
        var sentences = new ArrayList<List<String>>(texts.size());
        for (String text : texts) {
            sentences.add(tokenize(text));
        }
        return sentences;
    }
}
