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

package io.github.qqpbench.data;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import io.github.qqpbench.TestUtil;
import io.github.qqpbench.exceptions.EmptyDatasetException;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestDatasetLoader extends RandomizedTest {
    private Path testDirectory;
    private final DatasetLoader loader = new DatasetLoader();

    @Before
    public void setup() throws IOException {
        testDirectory = Files.createTempDirectory(this.getClass().getSimpleName());
    }

    @After
    public void tearDown() {
        TestUtil.deleteQuietly(testDirectory);
    }

    @Test
    public void testTrainingSetJoinsQuestionsAndKeepsLabels() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "train.tsv", TestUtil.QQP_HEADER,
                                      TestUtil.qqpRow(0, "How do I learn Java?", "What is the best way to learn Java?", "1"),
                                      TestUtil.qqpRow(1, "Why is the sky blue?", "How tall is Everest?", "0"));
        LoadResult result = loader.load(file.toString(), false);

        assertFalse(result.isFallback());
        assertEquals(Provenance.REAL, result.getProvenance());
        Dataset dataset = result.getDataset();
        assertTrue(dataset.areLabelsAuthoritative());
        assertEquals(2, dataset.count());
        assertEquals(new Record("How do I learn Java? [SEP] What is the best way to learn Java?", 1.0),
                     dataset.getRecords().get(0));
        assertEquals(0.0, dataset.getRecords().get(1).getLabel(), 0.0);
    }

    @Test
    public void testQuestionTextIsKeptVerbatim() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "padded.tsv", "question1\tquestion2\tis_duplicate",
                                      " What is X? \t  How? \t1",
                                      "   \tonly\t0");
        Dataset dataset = loader.load(file.toString(), false).getDataset();

        assertEquals(List.of(" What is X? " + DatasetLoader.SEPARATOR + "  How? ",
                             "   " + DatasetLoader.SEPARATOR + "only"),
                     dataset.texts());
    }

    @Test
    public void testMalformedLocatorFallsBack() {
        assertFallback(loader.load("train\u0000.tsv", false));
    }

    @Test
    public void testRowsWithMissingOrInvalidLabelsAreDropped() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "train.tsv", TestUtil.QQP_HEADER,
                                      TestUtil.qqpRow(0, "a", "b", "1"),
                                      TestUtil.qqpRow(1, "c", "d", ""),
                                      TestUtil.qqpRow(2, "e", "f", "2"),
                                      TestUtil.qqpRow(3, "g", "h", "maybe"),
                                      TestUtil.qqpRow(4, "i", "j", "0"));
        Dataset dataset = loader.load(file.toString(), false).getDataset();

        assertEquals(2, dataset.count());
        assertEquals(Map.of(0.0, 1L, 1.0, 1L), dataset.labelCounts());
        for (Record record : dataset.getRecords()) {
            assertTrue(record.isValid());
        }
    }

    @Test
    public void testMissingQuestionIsTolerated() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "train.tsv", "question1\tquestion2\tis_duplicate",
                                      "only first\t\t1",
                                      "\tonly second\t0",
                                      "\t\t1");
        Dataset dataset = loader.load(file.toString(), false).getDataset();

        assertEquals(List.of("only first", "only second"), dataset.texts());
    }

    @Test
    public void testEvaluationSetGetsPlaceholderLabels() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "test.tsv", "id\tquestion1\tquestion2",
                                      "0\tIs this a test?\tIs this real?",
                                      "1\tWhat time is it?\tWhat is the time?");
        LoadResult result = loader.load(file.toString(), true);

        assertFalse(result.isFallback());
        Dataset dataset = result.getDataset();
        assertFalse(dataset.areLabelsAuthoritative());
        assertEquals(2, dataset.count());
        for (Record record : dataset.getRecords()) {
            assertEquals(Record.NOT_DUPLICATE, record.getLabel(), 0.0);
        }
    }

    @Test
    public void testUnavailableSourceFallsBack() {
        LoadResult result = loader.load(testDirectory.resolve("missing.tsv").toString(), false);
        assertFallback(result);
        assertTrue(result.getFallbackReason().contains("no such file"));
    }

    @Test
    public void testMissingColumnsFallBack() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "bad.tsv", "foo\tbar", "1\t2");
        assertFallback(loader.load(file.toString(), randomBoolean()));
    }

    @Test
    public void testTrainingSetWithoutLabelColumnFallsBack() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "unlabeled.tsv", "question1\tquestion2", "a\tb");
        assertFallback(loader.load(file.toString(), false));
    }

    @Test
    public void testNoValidRecordsIsEmptyDataset() throws Exception {
        Path file = TestUtil.writeTsv(testDirectory, "invalid.tsv", TestUtil.QQP_HEADER,
                                      TestUtil.qqpRow(0, "a", "b", "7"),
                                      TestUtil.qqpRow(1, "c", "d", "-1"));
        var e = assertThrows(EmptyDatasetException.class, () -> loader.load(file.toString(), false));
        assertEquals(2, e.getRowsRead());
    }

    @Test
    public void testFallbackDatasetSpansBothLabels() {
        Dataset fallback = DatasetLoader.fallbackDataset();
        assertEquals(3, fallback.count());
        assertEquals(Map.of(0.0, 1L, 1.0, 2L), fallback.labelCounts());
        assertTrue(fallback.areLabelsAuthoritative());
        for (Record record : fallback.getRecords()) {
            assertTrue(record.getText().contains(DatasetLoader.SEPARATOR));
        }
    }

    @Test
    public void testLargeRandomFileKeepsEveryValidRow() throws Exception {
        int n = randomIntBetween(10, 200);
        var rows = new ArrayList<String>();
        int valid = 0;
        for (int i = 0; i < n; i++) {
            String label = randomFrom(new String[]{"0", "1", "", "x"});
            if (label.equals("0") || label.equals("1")) {
                valid++;
            }
            rows.add(TestUtil.qqpRow(i, "question " + i, "other " + i, label));
        }
        Path file = TestUtil.writeTsv(testDirectory, "random.tsv", TestUtil.QQP_HEADER, rows.toArray(new String[0]));
        if (valid == 0) {
            assertThrows(EmptyDatasetException.class, () -> loader.load(file.toString(), false));
        } else {
            assertEquals(valid, loader.load(file.toString(), false).getDataset().count());
        }
    }

    private static void assertFallback(LoadResult result) {
        assertTrue(result.isFallback());
        assertEquals(Provenance.FALLBACK, result.getProvenance());
        assertEquals(DatasetLoader.fallbackDataset().getRecords(), result.getDataset().getRecords());
    }
}
