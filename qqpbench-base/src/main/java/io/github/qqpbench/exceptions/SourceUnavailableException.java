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

import java.io.IOException;

/**
 * Thrown when a dataset locator cannot be opened, either because the file is missing
 * or because its scheme is not one the reader understands.
 */
public class SourceUnavailableException extends IOException {
    private final String locator;

    public SourceUnavailableException(String locator, String message) {
        super(message + ": " + locator);
        this.locator = locator;
    }

    public SourceUnavailableException(String locator, Throwable cause) {
        super("source unavailable: " + locator, cause);
        this.locator = locator;
    }

    public String getLocator() {
        return locator;
    }
}
