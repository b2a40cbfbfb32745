package io.nosqlbench.layoutprep.embeddings;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.layoutprep.text.TextNormalizer;
import io.nosqlbench.layoutprep.util.CompressedFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/// A pretrained word vector table in the GloVe text format, one `token v1 .. vN` line per
/// token. The first line fixes `N` for the whole file.
///
/// Tokens are normalized on load, so lookups by any casing of a token find the same vector.
/// When two lines normalize to the same token, the later line wins. The table is read on first
/// use.
public class PretrainedVectors {
  private final static Logger logger = LogManager.getLogger(PretrainedVectors.class);

  private final Path path;
  private Map<String, float[]> vectors;
  private int dimensions;
  private float standardDeviation;

  /// @param path
  ///     the (usually gzip compressed) vector file
  public PretrainedVectors(Path path) {
    this.path = path;
  }

  /// @return the vector file
  public Path path() {
    return path;
  }

  /// @return the file name of the vector file, which identifies it in cache keys
  public String identity() {
    return path.getFileName().toString();
  }

  /// @return the number of values per vector
  public int dimensions() {
    ensureLoaded();
    return dimensions;
  }

  /// @return the population standard deviation over every loaded value
  public float standardDeviation() {
    ensureLoaded();
    return standardDeviation;
  }

  /// @return number of distinct normalized tokens
  public int size() {
    ensureLoaded();
    return vectors.size();
  }

  /// @param token
  ///     any token text
  /// @return the pretrained vector of its normalized form
  public Optional<float[]> vector(String token) {
    ensureLoaded();
    return Optional.ofNullable(vectors.get(TextNormalizer.normalize(token)));
  }

  private void ensureLoaded() {
    if (vectors != null) {
      return;
    }
    try {
      load();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  private void load() throws IOException {
    logger.info("loading pretrained vectors from {}", path);
    Map<String, float[]> loading = new HashMap<>();
    int width = -1;
    double sum = 0.0d;
    double sumOfSquares = 0.0d;
    long count = 0;

    try (BufferedReader reader = CompressedFiles.openReader(path)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isEmpty()) {
          continue;
        }
        String[] fields = line.split(" ");
        if (width < 0) {
          width = fields.length - 1;
        }
        String word = TextNormalizer.normalize(fields[0]);
        if (fields.length - 1 != width || width < 1) {
          logger.error("Error while loading line for '{}' at {}:{}", word, path, lineNumber);
          throw new IOException(
              "expected " + width + " values for '" + word + "' at " + path + ":" + lineNumber
              + " but found " + (fields.length - 1));
        }
        float[] vector = new float[width];
        try {
          for (int i = 0; i < width; i++) {
            vector[i] = Float.parseFloat(fields[i + 1]);
          }
        } catch (NumberFormatException e) {
          logger.error("Error while loading line for '{}' at {}:{}", word, path, lineNumber);
          throw new IOException("malformed value for '" + word + "' at " + path + ":" + lineNumber,
              e);
        }
        for (float v : vector) {
          sum += v;
          sumOfSquares += (double) v * v;
        }
        count += width;
        loading.put(word, vector);
      }
    }
    if (loading.isEmpty()) {
      throw new IOException("no vectors in " + path);
    }

    double mean = sum / count;
    this.standardDeviation = (float) Math.sqrt(Math.max(0.0d, sumOfSquares / count - mean * mean));
    this.dimensions = width;
    this.vectors = loading;
    logger.info("loaded {} pretrained vectors with {} dimensions", loading.size(), width);
  }
}
