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

import io.nosqlbench.layoutprep.text.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/// Corpus wide token frequencies and font metric distributions.
///
/// Nothing is read until the first query. The statistics are read-only afterwards and may be
/// shared, but the first use is not synchronized; callers querying from several threads must
/// make the first call themselves before fanning out.
public class CorpusStatistics {
  private final static Logger logger = LogManager.getLogger(CorpusStatistics.class);

  private final Supplier<TokenStatisticsFile> source;
  private Loaded loaded;

  private record Loaded(
      List<Map.Entry<String, Long>> tokensByFrequency,
      PercentileFunction fontSizes,
      PercentileFunction spaceWidths
  )
  {
  }

  private CorpusStatistics(Supplier<TokenStatisticsFile> source) {
    this.source = source;
  }

  /// @param path
  ///     the statistics file, loaded on first use
  /// @return lazily loading statistics
  public static CorpusStatistics fromFile(Path path) {
    return new CorpusStatistics(() -> {
      try {
        return TokenStatisticsFile.load(path);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    });
  }

  /// @param contents
  ///     statistics already in memory
  /// @return statistics over them
  public static CorpusStatistics of(TokenStatisticsFile contents) {
    return new CorpusStatistics(() -> contents);
  }

  private Loaded loaded() {
    if (loaded == null) {
      TokenStatisticsFile contents = source.get();

      Map<String, Long> normalized = new LinkedHashMap<>();
      contents.tokens().forEach((token, count) ->
          normalized.merge(TextNormalizer.normalize(token), count, Long::sum));
      List<Map.Entry<String, Long>> byFrequency = new ArrayList<>(normalized.entrySet());
      // List.sort is stable, so equal counts keep first seen order
      byFrequency.sort(Comparator.comparing(Map.Entry<String, Long>::getValue).reversed());

      loaded = new Loaded(
          List.copyOf(byFrequency),
          PercentileFunction.fromCounts(contents.fontSizes()),
          PercentileFunction.fromCounts(contents.spaceWidths())
      );
      logger.info(
          "loaded {} normalized tokens, {} font sizes, {} space widths",
          byFrequency.size(),
          loaded.fontSizes().size(),
          loaded.spaceWidths().size()
      );
    }
    return loaded;
  }

  /// @param fontSize
  ///     a font size
  /// @return its corpus percentile
  public float fontSizePercentile(float fontSize) {
    return loaded().fontSizes().percentile(fontSize);
  }

  /// @param fontSizes
  ///     font sizes
  /// @return their corpus percentiles
  public float[] fontSizePercentiles(float[] fontSizes) {
    return loaded().fontSizes().percentiles(fontSizes);
  }

  /// @param spaceWidth
  ///     a font space width
  /// @return its corpus percentile
  public float spaceWidthPercentile(float spaceWidth) {
    return loaded().spaceWidths().percentile(spaceWidth);
  }

  /// @param spaceWidths
  ///     font space widths
  /// @return their corpus percentiles
  public float[] spaceWidthPercentiles(float[] spaceWidths) {
    return loaded().spaceWidths().percentiles(spaceWidths);
  }

  /// @param minimumFrequency
  ///     the smallest corpus count to include
  /// @return normalized tokens with at least that count, most frequent first
  public List<String> tokensWithMinimumFrequency(int minimumFrequency) {
    List<String> tokens = new ArrayList<>();
    for (Map.Entry<String, Long> entry : loaded().tokensByFrequency()) {
      if (entry.getValue() < minimumFrequency) {
        break;
      }
      tokens.add(entry.getKey());
    }
    return tokens;
  }

  /// @return the number of distinct normalized tokens
  public int vocabularySize() {
    return loaded().tokensByFrequency().size();
  }
}
