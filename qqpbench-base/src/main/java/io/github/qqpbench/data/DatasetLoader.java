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

import io.github.qqpbench.data.table.Row;
import io.github.qqpbench.data.table.Table;
import io.github.qqpbench.data.table.TsvReader;
import io.github.qqpbench.exceptions.EmptyDatasetException;
import io.github.qqpbench.exceptions.ParseFailureException;
import io.github.qqpbench.exceptions.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads question-pair datasets from tab-separated sources.
 * <p>
 * The loader fails closed: when the source cannot be opened or parsed it substitutes a small built-in
 * sample and reports {@link Provenance#FALLBACK} on the returned {@link LoadResult}, so the rest of the
 * pipeline can still run. Benchmark numbers produced from a fallback dataset say nothing about the
 * requested data; callers that care must check {@link LoadResult#isFallback()}.
 * <p>
 * A source that is readable but yields no valid records is not recovered; it raises
 * {@link EmptyDatasetException} so that a misconfigured filter is noticed.
 */
public class DatasetLoader {
    private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);

    /** Marks log events reporting rows dropped for null or invalid labels. */
    public static final Marker LABEL_DISTRIBUTION = MarkerFactory.getMarker("LABEL_DISTRIBUTION");

    public static final String SEPARATOR = " [SEP] ";
    public static final String QUESTION1 = "question1";
    public static final String QUESTION2 = "question2";
    public static final String IS_DUPLICATE = "is_duplicate";
    public static final String TEXT = "text";
    public static final String LABEL = "label";

    public static final String FALLBACK_NAME = "builtin-sample";

    private static final List<Record> FALLBACK_RECORDS = List.of(
            new Record("How do I improve my English?" + SEPARATOR + "What are some ways to improve my English?", Record.DUPLICATE),
            new Record("What is the capital of France?" + SEPARATOR + "What is the population of Germany?", Record.NOT_DUPLICATE),
            new Record("How to lose weight fast?" + SEPARATOR + "What are some effective ways to lose weight quickly?", Record.DUPLICATE));

    private final TsvReader reader;

    public DatasetLoader() {
        this(new TsvReader());
    }

    public DatasetLoader(TsvReader reader) {
        this.reader = reader;
    }

    /**
     * Loads the dataset at {@code locator}.
     *
     * @param locator         path or {@code file:} URI of a tab-separated file with a header row
     * @param isEvaluationSet if true, every record gets the placeholder label 0.0 and the dataset is marked
     *                        as not having authoritative labels; if false, labels are read from
     *                        {@code is_duplicate} and rows without a 0/1 label are dropped
     * @return the dataset, tagged with its provenance
     * @throws EmptyDatasetException if the source was read but no valid record remains
     */
    public LoadResult load(String locator, boolean isEvaluationSet) {
        logger.info("loading dataset [{}] as {} set", locator, isEvaluationSet ? "evaluation" : "training");
        try {
            Table table = reader.read(locator);
            Dataset dataset = toDataset(locator, table, isEvaluationSet);
            logger.info("dataset [{}] loaded with {} records", locator, dataset.count());
            return LoadResult.real(dataset, locator);
        } catch (SourceUnavailableException | ParseFailureException e) {
            logger.warn("Unable to load dataset [{}]: {}. Substituting the built-in {}-record sample; "
                        + "results will not reflect the requested data.", locator, e.getMessage(), FALLBACK_RECORDS.size());
            return LoadResult.fallback(fallbackDataset(), locator, e.getMessage());
        }
    }

    /**
     * @return the fixed sample substituted for unreadable sources, spanning both labels
     */
    public static Dataset fallbackDataset() {
        return new Dataset(FALLBACK_NAME, FALLBACK_RECORDS);
    }

    static Dataset toDataset(String locator, Table table, boolean isEvaluationSet) throws ParseFailureException {
        if (!table.hasColumn(QUESTION1) || !table.hasColumn(QUESTION2)) {
            throw new ParseFailureException("expected columns " + QUESTION1 + " and " + QUESTION2
                                            + " in " + locator + ", found " + table.columns());
        }
        long rowsRead = table.count();

        if (isEvaluationSet) {
            table = table.withColumn(LABEL, row -> Record.NOT_DUPLICATE);
        } else if (table.hasColumn(IS_DUPLICATE)) {
            table = table.withColumn(LABEL, row -> row.getDouble(IS_DUPLICATE))
                    .filter(row -> row.get(LABEL) != null)
                    .filter(row -> Record.isValidLabel(row.getDouble(LABEL)));
            long kept = table.count();
            if (kept < rowsRead) {
                logger.warn(LABEL_DISTRIBUTION, "dropped {} of {} rows from [{}] with null or invalid labels, {} remain",
                            rowsRead - kept, rowsRead, locator, kept);
            }
        } else {
            throw new ParseFailureException("training source " + locator + " has no " + IS_DUPLICATE + " column");
        }

        List<Record> records = table
                .withColumn(TEXT, row -> joinQuestions(row.getString(QUESTION1), row.getString(QUESTION2)))
                .select(TEXT, LABEL)
                .filter(row -> row.get(TEXT) != null)
                .collect()
                .stream()
                .map(DatasetLoader::toRecord)
                .collect(Collectors.toList());

        if (records.isEmpty()) {
            throw new EmptyDatasetException(locator, rowsRead);
        }
        return new Dataset(locator, records, !isEvaluationSet);
    }

    /**
     * Joins the non-null questions with {@link #SEPARATOR}.
     *
     * @return the joined text, or null if both questions are absent
     */
    static String joinQuestions(String question1, String question2) {
        if (question1 == null && question2 == null) {
            return null;
        }
        if (question1 == null) {
            return question2;
        }
        if (question2 == null) {
            return question1;
        }
        return question1 + SEPARATOR + question2;
    }

    private static Record toRecord(Row row) {
        return new Record(row.getString(TEXT), row.getDouble(LABEL));
    }
}
