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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * An immutable collection of {@link Record}s.
 * <p>
 * {@code labelsAuthoritative} is false for evaluation sets whose labels are placeholders,
 * in which case metrics computed against them only demonstrate that the pipeline runs.
 */
public final class Dataset {
    private final String name;
    private final List<Record> records;
    private final boolean labelsAuthoritative;

    public Dataset(String name, List<Record> records, boolean labelsAuthoritative) {
        this.name = name;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.labelsAuthoritative = labelsAuthoritative;
    }

    public Dataset(String name, List<Record> records) {
        this(name, records, true);
    }

    public String getName() {
        return name;
    }

    public List<Record> getRecords() {
        return records;
    }

    public long count() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public boolean areLabelsAuthoritative() {
        return labelsAuthoritative;
    }

    public List<String> texts() {
        return records.stream().map(Record::getText).collect(Collectors.toList());
    }

    public double[] labels() {
        return records.stream().mapToDouble(Record::getLabel).toArray();
    }

    /**
     * @return record count per label, in ascending label order
     */
    public Map<Double, Long> labelCounts() {
        return records.stream()
                .collect(Collectors.groupingBy(Record::getLabel, TreeMap::new, Collectors.counting()));
    }

    /**
     * @return a copy of this dataset without the records that violate the record invariant
     */
    public Dataset withValidRecordsOnly() {
        var valid = records.stream().filter(Record::isValid).collect(Collectors.toList());
        if (valid.size() == records.size()) {
            return this;
        }
        return new Dataset(name, valid, labelsAuthoritative);
    }

    @Override
    public String toString() {
        return "Dataset{name='" + name + "', count=" + records.size()
               + ", labelsAuthoritative=" + labelsAuthoritative + "}";
    }
}
