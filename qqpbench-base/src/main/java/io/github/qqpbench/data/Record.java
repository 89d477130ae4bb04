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

import java.util.Objects;

/**
 * A normalized question pair: both questions joined into one text, plus the duplicate label.
 */
public final class Record {
    public static final double NOT_DUPLICATE = 0.0;
    public static final double DUPLICATE = 1.0;

    private final String text;
    private final double label;

    public Record(String text, double label) {
        this.text = Objects.requireNonNull(text, "text");
        this.label = label;
    }

    public String getText() {
        return text;
    }

    public double getLabel() {
        return label;
    }

    /**
     * @return true if the text is non-empty and the label is exactly 0.0 or 1.0
     */
    public boolean isValid() {
        return !text.isEmpty() && isValidLabel(label);
    }

    public static boolean isValidLabel(double label) {
        return label == NOT_DUPLICATE || label == DUPLICATE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Record)) {
            return false;
        }
        Record other = (Record) o;
        return Double.compare(label, other.label) == 0 && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, label);
    }

    @Override
    public String toString() {
        return "Record{text='" + text + "', label=" + label + "}";
    }
}
