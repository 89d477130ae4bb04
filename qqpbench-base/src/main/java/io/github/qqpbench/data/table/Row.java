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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a {@link Table}. Absent and empty cells are both represented as null.
 */
public final class Row {
    private final Map<String, Object> values;

    Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    /**
     * @return the cell as a double, or null if it is absent or not a number
     */
    public Double getDouble(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return castToDouble(value.toString());
    }

    Row with(String column, Object value) {
        var copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new Row(copy);
    }

    Map<String, Object> asMap() {
        return values;
    }

    /**
     * Lenient string to double cast: surrounding whitespace is ignored and anything unparseable becomes null.
     */
    public static Double castToDouble(String s) {
        if (s == null) {
            return null;
        }
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
