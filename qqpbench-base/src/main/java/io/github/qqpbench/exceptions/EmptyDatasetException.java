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

package io.github.qqpbench.exceptions;

/**
 * Thrown when a source was read successfully but no valid record survived filtering.
 */
public class EmptyDatasetException extends RuntimeException {
    private final String locator;
    private final long rowsRead;

    public EmptyDatasetException(String locator, long rowsRead) {
        super("no valid records remain after filtering " + rowsRead + " rows from " + locator
              + ", check the input file and the label filter");
        this.locator = locator;
        this.rowsRead = rowsRead;
    }

    public String getLocator() {
        return locator;
    }

    public long getRowsRead() {
        return rowsRead;
    }
}
