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
 * The outcome of {@link DatasetLoader#load(String, boolean)}: the dataset plus a tag saying whether it
 * came from the requested source or from the built-in sample. Callers that need strict-failure
 * semantics check {@link #isFallback()} instead of waiting for an exception.
 */
public final class LoadResult {
    private final Dataset dataset;
    private final Provenance provenance;
    private final String locator;
    private final String fallbackReason;

    private LoadResult(Dataset dataset, Provenance provenance, String locator, String fallbackReason) {
        this.dataset = Objects.requireNonNull(dataset, "dataset");
        this.provenance = provenance;
        this.locator = locator;
        this.fallbackReason = fallbackReason;
    }

    public static LoadResult real(Dataset dataset, String locator) {
        return new LoadResult(dataset, Provenance.REAL, locator, null);
    }

    public static LoadResult fallback(Dataset dataset, String locator, String reason) {
        return new LoadResult(dataset, Provenance.FALLBACK, locator, reason);
    }

    public Dataset getDataset() {
        return dataset;
    }

    public Provenance getProvenance() {
        return provenance;
    }

    public boolean isFallback() {
        return provenance == Provenance.FALLBACK;
    }

    public String getLocator() {
        return locator;
    }

    /**
     * @return the error that caused the fallback, or null for a real load
     */
    public String getFallbackReason() {
        return fallbackReason;
    }

    @Override
    public String toString() {
        return "LoadResult{" + provenance + ", locator='" + locator + "', " + dataset + "}";
    }
}
