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

import io.github.qqpbench.exceptions.InvalidInputException;
import io.github.qqpbench.text.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static io.github.qqpbench.util.VectorUtil.sigmoid;

/**
 * Trains skip-gram word embeddings with negative sampling, where each word is represented by its own
 * vector plus the vectors of its character n-grams (the FastText model).
 * <p>
 * Training is single threaded and driven by one seeded {@link Random}, so the same corpus and parameters
 * always produce the same {@link EmbeddingModel}. Only the texts passed to {@link #train(List)} are
 * observed; evaluation text must never be handed to this class.
 */
public class FastTextTrainer {
    private static final Logger logger = LoggerFactory.getLogger(FastTextTrainer.class);

    private static final double UNIGRAM_POWER = 0.75;
    private static final float MIN_LEARNING_RATE_RATIO = 1e-4f;

    private final EmbeddingParameters params;

    public FastTextTrainer(EmbeddingParameters params) {
        this.params = params;
    }

    public static EmbeddingModel train(List<String> trainingTexts, EmbeddingParameters params) {
        return new FastTextTrainer(params).train(trainingTexts);
    }

    /**
     * @throws InvalidInputException if the corpus is empty or no token occurs at least {@code minCount} times
     */
    public EmbeddingModel train(List<String> trainingTexts) {
        if (trainingTexts.isEmpty()) {
            throw new InvalidInputException("cannot train embeddings on an empty corpus");
        }
        long start = System.nanoTime();
        int dim = params.getDimension();

        List<List<String>> sentences = Tokenizer.tokenizeAll(trainingTexts);
        Vocabulary vocab = Vocabulary.build(sentences, params.getMinCount());
        if (vocab.size() == 0) {
            throw new InvalidInputException("no token occurs at least " + params.getMinCount()
                                            + " times in " + trainingTexts.size() + " training texts");
        }
        logger.debug("vocabulary of {} words built from {} texts", vocab.size(), trainingTexts.size());

        int[][] corpus = encode(sentences, vocab);
        int[][] wordRows = new int[vocab.size()][];
        int inputRows = assignInputRows(vocab, wordRows);

        var random = new Random(params.getSeed());
        float[] input = new float[inputRows * dim];
        for (int i = 0; i < input.length; i++) {
            input[i] = (random.nextFloat() - 0.5f) / dim;
        }
        float[] output = new float[vocab.size() * dim];
        double[] noise = noiseDistribution(vocab);

        long tokensPerEpoch = 0;
        for (int[] sentence : corpus) {
            tokensPerEpoch += sentence.length;
        }
        double totalTokens = Math.max(1, tokensPerEpoch * (long) params.getEpochs());
        float lr0 = params.getLearningRate();
        long processed = 0;

        float[] hidden = new float[dim];
        float[] grad = new float[dim];
        for (int epoch = 0; epoch < params.getEpochs(); epoch++) {
            float lr = lr0;
            for (int[] sentence : corpus) {
                for (int i = 0; i < sentence.length; i++) {
                    lr = Math.max(lr0 * (float) (1.0 - processed / totalTokens), lr0 * MIN_LEARNING_RATE_RATIO);
                    processed++;

                    int[] rows = wordRows[sentence[i]];
                    average(input, rows, dim, hidden);
                    Arrays.fill(grad, 0f);

                    int reduced = 1 + random.nextInt(params.getWindow());
                    int from = Math.max(0, i - reduced);
                    int to = Math.min(sentence.length - 1, i + reduced);
                    for (int j = from; j <= to; j++) {
                        if (j == i) {
                            continue;
                        }
                        int context = sentence[j];
                        update(output, dim, hidden, grad, context, 1.0, lr);
                        for (int n = 0; n < params.getNegative(); n++) {
                            int target = sample(noise, random);
                            if (target != context) {
                                update(output, dim, hidden, grad, target, 0.0, lr);
                            }
                        }
                    }
                    for (int row : rows) {
                        int offset = row * dim;
                        for (int d = 0; d < dim; d++) {
                            input[offset + d] += grad[d];
                        }
                    }
                }
            }
            logger.trace("embedding epoch {}/{} done, learning rate {}", epoch + 1, params.getEpochs(), lr);
        }

        float[][] vectors = new float[vocab.size()][dim];
        for (int w = 0; w < vocab.size(); w++) {
            average(input, wordRows[w], dim, vectors[w]);
        }
        logger.info("trained {}-dimensional embeddings for {} words over {} epochs in {} ms",
                    dim, vocab.size(), params.getEpochs(), (System.nanoTime() - start) / 1_000_000);
        return new EmbeddingModel(dim, vocab.words, vectors);
    }

    private static int[][] encode(List<List<String>> sentences, Vocabulary vocab) {
        int[][] corpus = new int[sentences.size()][];
        for (int s = 0; s < sentences.size(); s++) {
            corpus[s] = sentences.get(s).stream()
                    .filter(vocab.index::containsKey)
                    .mapToInt(vocab.index::get)
                    .toArray();
        }
        return corpus;
    }

    /**
     * Fills {@code wordRows} with the input-matrix rows making up each word: its own row first, then one
     * row per distinct n-gram bucket. Only buckets that some vocabulary word uses get a row.
     *
     * @return the number of input rows
     */
    private int assignInputRows(Vocabulary vocab, int[][] wordRows) {
        var bucketRows = new HashMap<Integer, Integer>();
        int next = vocab.size();
        for (int w = 0; w < vocab.size(); w++) {
            var rows = new LinkedHashSet<Integer>();
            rows.add(w);
            if (params.usesSubwords()) {
                for (String ngram : charNgrams(vocab.words.get(w), params.getMinN(), params.getMaxN())) {
                    int bucket = Integer.remainderUnsigned(fnv1a(ngram), params.getBuckets());
                    Integer row = bucketRows.get(bucket);
                    if (row == null) {
                        row = next++;
                        bucketRows.put(bucket, row);
                    }
                    rows.add(row);
                }
            }
            wordRows[w] = rows.stream().mapToInt(Integer::intValue).toArray();
        }
        return next;
    }

    static List<String> charNgrams(String word, int minN, int maxN) {
        String bounded = "<" + word + ">";
        var ngrams = new ArrayList<String>();
        for (int n = minN; n <= maxN; n++) {
            for (int start = 0; start + n <= bounded.length(); start++) {
                ngrams.add(bounded.substring(start, start + n));
            }
        }
        return ngrams;
    }

    /** 32-bit FNV-1a */
    static int fnv1a(String s) {
        int hash = 0x811C9DC5;
        for (int i = 0; i < s.length(); i++) {
            hash ^= s.charAt(i);
            hash *= 0x01000193;
        }
        return hash;
    }

    private static double[] noiseDistribution(Vocabulary vocab) {
        double[] cumulative = new double[vocab.size()];
        double sum = 0;
        for (int w = 0; w < vocab.size(); w++) {
            sum += Math.pow(vocab.counts[w], UNIGRAM_POWER);
            cumulative[w] = sum;
        }
        return cumulative;
    }

    private static int sample(double[] cumulative, Random random) {
        double r = random.nextDouble() * cumulative[cumulative.length - 1];
        int idx = Arrays.binarySearch(cumulative, r);
        if (idx < 0) {
            idx = -idx - 1;
        }
        return Math.min(idx, cumulative.length - 1);
    }

    private static void average(float[] matrix, int[] rows, int dim, float[] out) {
        Arrays.fill(out, 0f);
        for (int row : rows) {
            int offset = row * dim;
            for (int d = 0; d < dim; d++) {
                out[d] += matrix[offset + d];
            }
        }
        float scale = 1f / rows.length;
        for (int d = 0; d < dim; d++) {
            out[d] *= scale;
        }
    }

    private static void update(float[] output, int dim, float[] hidden, float[] grad, int target, double label, float lr) {
        int offset = target * dim;
        double score = 0;
        for (int d = 0; d < dim; d++) {
            score += hidden[d] * output[offset + d];
        }
        float g = (float) (lr * (label - sigmoid(score)));
        for (int d = 0; d < dim; d++) {
            grad[d] += g * output[offset + d];
            output[offset + d] += g * hidden[d];
        }
    }

    /**
     * Words that occur at least {@code minCount} times, most frequent first; ties keep first-seen order.
     */
    private static final class Vocabulary {
        final List<String> words;
        final long[] counts;
        final Map<String, Integer> index;

        private Vocabulary(List<String> words, long[] counts) {
            this.words = words;
            this.counts = counts;
            this.index = new HashMap<>();
            for (int i = 0; i < words.size(); i++) {
                index.put(words.get(i), i);
            }
        }

        static Vocabulary build(List<List<String>> sentences, int minCount) {
            var counts = new LinkedHashMap<String, Long>();
            for (List<String> sentence : sentences) {
                for (String token : sentence) {
                    counts.merge(token, 1L, Long::sum);
                }
            }
            var kept = new ArrayList<Map.Entry<String, Long>>();
            for (var entry : counts.entrySet()) {
                if (entry.getValue() >= minCount) {
                    kept.add(entry);
                }
            }
            kept.sort(Map.Entry.comparingByValue(Comparator.reverseOrder()));

            var words = new ArrayList<String>(kept.size());
            long[] keptCounts = new long[kept.size()];
            for (int i = 0; i < kept.size(); i++) {
                words.add(kept.get(i).getKey());
                keptCounts[i] = kept.get(i).getValue();
            }
            return new Vocabulary(words, keptCounts);
        }

        int size() {
            return words.size();
        }
    }
}
