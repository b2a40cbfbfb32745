package io.nosqlbench.layoutprep.stats;

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

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import io.nosqlbench.layoutprep.util.CompressedFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// The precomputed corpus statistics file, as read from disk.
///
/// The file is a (usually gzip compressed) JSON object:
/// ```json
/// {"tokens": {"the": 1200, "The": 300},
///  "fonts": {"Times-Roman": 900},
///  "font_sizes": {"10.0": 500, "12.0": 20},
///  "space_widths": {"2.5": 300}}
/// ```
/// Token keys are raw, not normalized. Unknown top level keys are ignored.
/// @param tokens
///     raw token counts in file order
/// @param fonts
///     font name counts
/// @param fontSizes
///     font size histogram
/// @param spaceWidths
///     font space width histogram
public record TokenStatisticsFile(
    Map<String, Long> tokens,
    Map<String, Long> fonts,
    Map<Float, Long> fontSizes,
    Map<Float, Long> spaceWidths
)
{
  private final static Logger logger = LogManager.getLogger(TokenStatisticsFile.class);

  /// the file name inside a corpus directory
  public static final String FILE_NAME = "all.tokenstats3.gz";

  /// @param path
  ///     the statistics file
  /// @return its contents
  /// @throws IOException
  ///     if the file cannot be read or is not a statistics object
  public static TokenStatisticsFile load(Path path) throws IOException {
    logger.info("loading token statistics from {}", path);
    try (Reader reader = CompressedFiles.openReader(path)) {
      return read(reader);
    } catch (IllegalStateException | NumberFormatException e) {
      throw new IOException("malformed token statistics in " + path + ": " + e.getMessage(), e);
    }
  }

  /// @param reader
  ///     JSON text of a statistics object
  /// @return its contents
  /// @throws IOException
  ///     if the text cannot be read
  public static TokenStatisticsFile read(Reader reader) throws IOException {
    Map<String, Long> tokens = new LinkedHashMap<>();
    Map<String, Long> fonts = new LinkedHashMap<>();
    Map<Float, Long> fontSizes = new LinkedHashMap<>();
    Map<Float, Long> spaceWidths = new LinkedHashMap<>();

    JsonReader json = new JsonReader(reader);
    json.beginObject();
    while (json.hasNext()) {
      String key = json.nextName();
      switch (key) {
        case "tokens" -> readCounts(json, tokens);
        case "fonts" -> readCounts(json, fonts);
        case "font_sizes" -> readHistogram(json, fontSizes);
        case "space_widths" -> readHistogram(json, spaceWidths);
        default -> {
          logger.debug("ignoring token statistics key {}", key);
          json.skipValue();
        }
      }
    }
    json.endObject();
    return new TokenStatisticsFile(tokens, fonts, fontSizes, spaceWidths);
  }

  private static void readCounts(JsonReader json, Map<String, Long> into) throws IOException {
    json.beginObject();
    while (json.hasNext()) {
      String name = json.nextName();
      into.merge(name, readCount(json), Long::sum);
    }
    json.endObject();
  }

  private static void readHistogram(JsonReader json, Map<Float, Long> into) throws IOException {
    json.beginObject();
    while (json.hasNext()) {
      float value = Float.parseFloat(json.nextName());
      into.merge(value, readCount(json), Long::sum);
    }
    json.endObject();
  }

  private static long readCount(JsonReader json) throws IOException {
    if (json.peek() != JsonToken.NUMBER) {
      throw new IllegalStateException("expected a count but found " + json.peek() + " at "
                                      + json.getPath());
    }
    return (long) json.nextDouble();
  }
}
