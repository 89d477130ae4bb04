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

import io.github.qqpbench.exceptions.ParseFailureException;
import io.github.qqpbench.exceptions.SourceUnavailableException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Reads tab-separated files with a header row into a {@link Table}.
 * <p>
 * Cells are taken literally: there is no quote character, since question text routinely contains
 * unbalanced quotes. Empty cells and cells missing from short rows read as null.
 * Locators are plain paths or {@code file:} URIs; files ending in {@code .gz} are decompressed.
 */
public class TsvReader {
    private static final Logger logger = LoggerFactory.getLogger(TsvReader.class);

    private static final CSVFormat FORMAT = CSVFormat.TDF.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setQuote(null)
            .setIgnoreSurroundingSpaces(false)
            .setTrim(false)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    public Table read(String locator) throws SourceUnavailableException, ParseFailureException {
        Path path = resolve(locator);
        logger.debug("reading tsv [{}]", path);

        try (Reader reader = open(path);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> header = parser.getHeaderNames();
            if (header.isEmpty()) {
                throw new ParseFailureException("no header row in " + locator);
            }
            var rows = new ArrayList<Row>();
            for (CSVRecord record : parser) {
                var values = new LinkedHashMap<String, Object>();
                for (String column : header) {
                    String cell = record.isSet(column) ? record.get(column) : null;
                    values.put(column, cell == null || cell.isEmpty() ? null : cell);
                }
                rows.add(new Row(values));
            }
            logger.debug("read {} rows with columns {} from [{}]", rows.size(), header, locator);
            return new Table(header, rows);
        } catch (UncheckedIOException | IllegalStateException | IllegalArgumentException e) {
            throw new ParseFailureException("malformed tsv in " + locator + ": " + e.getMessage(), e);
        } catch (ParseFailureException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceUnavailableException(locator, e);
        }
    }

    static Path resolve(String locator) throws SourceUnavailableException {
        if (locator == null || locator.isBlank()) {
            throw new SourceUnavailableException(String.valueOf(locator), "empty locator");
        }
        Path path;
        int colon = locator.indexOf(':');
        // a single letter before the colon is a windows drive, not a scheme
        if (colon > 1) {
            String scheme = locator.substring(0, colon);
            if (!scheme.equalsIgnoreCase("file")) {
                throw new SourceUnavailableException(locator, "unsupported scheme '" + scheme + "'");
            }
            try {
                path = Paths.get(URI.create(locator));
            } catch (IllegalArgumentException e) {
                throw new SourceUnavailableException(locator, e);
            }
        } else {
            try {
                path = Paths.get(locator);
            } catch (InvalidPathException e) {
                throw new SourceUnavailableException(locator, e);
            }
        }
        if (!Files.isRegularFile(path)) {
            throw new SourceUnavailableException(locator, "no such file");
        }
        return path;
    }

    private static Reader open(Path path) throws IOException {
        InputStream in = Files.newInputStream(path);
        if (path.getFileName().toString().endsWith(".gz")) {
            try {
                in = new GZIPInputStream(in);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }
}
