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

package io.github.qqpbench.bench;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class QqpBenchCLITest extends RandomizedTest {
    private Path testDirectory;

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    private static QqpBenchCLI parse(String... args) {
        var cli = new QqpBenchCLI();
        new CommandLine(cli).parseArgs(args);
        return cli;
    }

    @Test
    public void testNoArgumentsUsesDefaults() throws IOException {
        BenchConfig config = parse().buildConfig();
        assertEquals("glue/QQP/dev.tsv", config.getTrainingSource());
        assertEquals(3, config.getEmbedding().getEpochs());
        assertTrue(config.isEvaluationLabeled());
        assertNull(config.getOutputBasePath());
    }

    @Test
    public void testOptionsOverrideRunFile() throws IOException {
        Path runFile = Files.writeString(testDirectory.resolve("run.yml"),
                                         "trainingSource: from-yaml.tsv\nembedding:\n  window: 7\n",
                                         StandardCharsets.UTF_8);
        BenchConfig config = parse("-c", runFile.toString(),
                                   "--data-file", "train.tsv",
                                   "--test-file", "test.tsv",
                                   "--fasttext-epochs", "5",
                                   "--dimension", "32",
                                   "--max-iter", "7",
                                   "--variants", "tfidf_linear,FastText",
                                   "--eval-unlabeled",
                                   "-o", "out/qqp").buildConfig();

        assertEquals("train.tsv", config.getTrainingSource());
        assertEquals("test.tsv", config.getEvaluationSource());
        assertEquals(5, config.getEmbedding().getEpochs());
        assertEquals(32, config.getEmbedding().getDimension());
        assertEquals(7, config.getEmbedding().getWindow());
        assertEquals(7, config.getClassifier().getMaxIterations());
        assertEquals(List.of(ModelVariant.TFIDF_LINEAR, ModelVariant.FASTTEXT_LINEAR), config.getVariants());
        assertFalse(config.isEvaluationLabeled());
        assertEquals("out/qqp", config.getOutputBasePath());
    }

    @Test
    public void testUnknownVariantIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("--variants", "bert").buildConfig());
    }

    @Test
    public void testRunsOnFallbackAndWritesReports() {
        String base = testDirectory.resolve("reports/qqp").toString();
        int exitCode = new CommandLine(new QqpBenchCLI()).execute(
                "--data-file", testDirectory.resolve("missing-train.tsv").toString(),
                "--test-file", testDirectory.resolve("missing-dev.tsv").toString(),
                "--dimension", "8",
                "--fasttext-epochs", "1",
                "-o", base);

        assertEquals(0, exitCode);
        assertTrue(Files.exists(Path.of(base + ".csv")));
        assertTrue(Files.exists(Path.of(base + ".json")));
    }
}
