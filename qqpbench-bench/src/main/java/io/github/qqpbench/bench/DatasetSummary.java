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

import io.github.qqpbench.data.Dataset;
import io.github.qqpbench.data.DatasetLoader;
import io.github.qqpbench.data.LoadResult;
import io.github.qqpbench.data.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Logs what was loaded before any model is trained: sizes, provenance, label distribution and a
 * short preview.
 */
final class DatasetSummary {
    private static final Logger logger = LoggerFactory.getLogger(DatasetSummary.class);

    static final int PREVIEW_ROWS = 5;

    private DatasetSummary() {
    }

    static void log(String role, LoadResult result) {
        Dataset dataset = result.getDataset();
        if (result.isFallback()) {
            logger.warn("{} set [{}] is the built-in sample ({}); metrics will not reflect the requested data",
                        role, result.getLocator(), result.getFallbackReason());
        }
        logger.info("{} set: {} records from {}", role, dataset.count(), dataset.getName());

        if (!dataset.areLabelsAuthoritative()) {
            logger.warn("{} set carries placeholder labels; accuracy and related metrics are not meaningful", role);
        } else {
            Map<Double, Long> counts = dataset.labelCounts();
            logger.info("{} label distribution: {}", role, counts);
            long valid = dataset.withValidRecordsOnly().count();
            if (valid < dataset.count()) {
                logger.warn(DatasetLoader.LABEL_DISTRIBUTION, "{} set still holds {} records with invalid labels",
                            role, dataset.count() - valid);
            }
        }

        List<Record> records = dataset.getRecords();
        for (int i = 0; i < Math.min(PREVIEW_ROWS, records.size()); i++) {
            logger.info("  {} [{}] {}", role, i, records.get(i));
        }
    }
}
