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

package io.github.qqpbench.bench.yaml;

import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * YAML shape of a benchmark run file. Absent keys keep the defaults below.
 */
public class RunConfig {
    /** Classpath resource holding the default run file. */
    public static final String DEFAULT_RESOURCE = "/default.yml";

    public String trainingSource;
    public String evaluationSource;
    /** If false the evaluation source is loaded with placeholder labels. */
    public boolean evaluationLabeled = true;
    public List<String> variants;

    public Embedding embedding = new Embedding();
    public Tfidf tfidf = new Tfidf();
    public Classifier classifier = new Classifier();
    public Output output = new Output();

    public static RunConfig loadDefault() {
        try (InputStream in = RunConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing classpath resource " + DEFAULT_RESOURCE);
            }
            return new Yaml().loadAs(in, RunConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RunConfig load(String configName) throws FileNotFoundException {
        File configFile = new File(configName);
        if (!configFile.exists()) {
            throw new FileNotFoundException(configFile.getAbsolutePath());
        }
        try (InputStream inputStream = new FileInputStream(configFile)) {
            RunConfig config = new Yaml().loadAs(inputStream, RunConfig.class);
            // an empty file parses to null
            return config == null ? new RunConfig() : config;
        } catch (FileNotFoundException e) {
            throw e;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static class Embedding {
        public int dimension = 100;
        public int window = 5;
        public int minCount = 1;
        public int epochs = 3;
        public int negative = 5;
        public double learningRate = 0.025;
        public int minN = 3;
        public int maxN = 6;
        public int buckets = 100_000;
        public long seed = 1;
    }

    public static class Tfidf {
        public int numFeatures = 1024;
        public int minDocFreq = 0;
    }

    public static class Classifier {
        public int maxIterations = 100;
        public double regularization = 1.0;
        public double tolerance = 1e-6;
    }

    public static class Output {
        /** Base path for the .csv and .json reports; no files are written when null. */
        public String basePath;
    }
}
