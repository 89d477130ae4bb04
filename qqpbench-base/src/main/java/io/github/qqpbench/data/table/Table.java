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

package io.github.qqpbench.data.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An immutable in-memory table with named columns. Every transformation returns a new table.
 */
public final class Table {
    private final List<String> columns;
    private final List<Row> rows;

    Table(List<String> columns, List<Row> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(rows);
    }

    public static Table of(List<String> columns, List<? extends Map<String, ?>> rows) {
        var built = new ArrayList<Row>(rows.size());
        for (var row : rows) {
            var values = new LinkedHashMap<String, Object>();
            for (String column : columns) {
                values.put(column, row.get(column));
            }
            built.add(new Row(values));
        }
        return new Table(columns, built);
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Table filter(Predicate<Row> predicate) {
        return new Table(columns, rows.stream().filter(predicate).collect(Collectors.toList()));
    }

    /**
     * Adds a column computed from each row, or replaces it if a column of that name already exists.
     */
    public Table withColumn(String column, Function<Row, ?> expression) {
        var newColumns = new ArrayList<>(columns);
        if (!newColumns.contains(column)) {
            newColumns.add(column);
        }
        var newRows = rows.stream()
                .map(row -> row.with(column, expression.apply(row)))
                .collect(Collectors.toList());
        return new Table(newColumns, newRows);
    }

    public Table select(String... selected) {
        for (String column : selected) {
            if (!hasColumn(column)) {
                throw new IllegalArgumentException("No column named '" + column + "', available: " + columns);
            }
        }
        var newRows = new ArrayList<Row>(rows.size());
        for (Row row : rows) {
            var values = new LinkedHashMap<String, Object>();
            for (String column : selected) {
                values.put(column, row.asMap().get(column));
            }
            newRows.add(new Row(values));
        }
        return new Table(List.of(selected), newRows);
    }

    public long count() {
        return rows.size();
    }

    public List<Row> collect() {
        return rows;
    }

    @Override
    public String toString() {
        return "Table{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
