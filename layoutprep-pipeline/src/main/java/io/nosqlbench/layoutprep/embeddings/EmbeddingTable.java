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

import io.nosqlbench.layoutprep.stats.CorpusStatistics;
import io.nosqlbench.layoutprep.text.StableHash;
import io.nosqlbench.layoutprep.text.TextNormalizer;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// The starting embedding matrix of the classifier and the token to row index mapping that
/// goes with it.
///
/// The vocabulary is every corpus token with at least the minimum frequency, numbered from 2
/// in descending frequency order. Index 1 is the out-of-vocabulary token and index 0 is the
/// all zero padding row, never returned by a lookup.
///
/// Each row is one marker value followed by the vector. Tokens with a pretrained vector get
/// marker `+0.5` and that vector. Other tokens get a vector drawn from `N(0, stddev)` of the
/// pretrained table, seeded by the stable hash of the normalized token, and marker `-0.5`, so
/// the same token always gets the same row in any process.
///
/// Built on first use; see [CorpusStatistics] for the threading caveat.
public class EmbeddingTable {
  private final static Logger logger = LogManager.getLogger(EmbeddingTable.class);

  /// the out-of-vocabulary token; it contains spaces, so no tokenizer ever produces it
  public static final String OOV_TOKEN = " ⚠ OOV ⚠ ";
  /// index of the out-of-vocabulary row
  public static final int OOV_INDEX = 1;
  /// index of the padding row
  public static final int PADDING_INDEX = 0;
  /// marker value of rows backed by a pretrained vector
  public static final float PRETRAINED_MARKER = 0.5f;
  /// marker value of rows drawn at random
  public static final float RANDOM_MARKER = -0.5f;

  private final CorpusStatistics statistics;
  private final PretrainedVectors pretrained;
  private final int minimumTokenFrequency;

  private Map<String, Integer> tokenToIndex;
  private float[][] matrix;

  /// @param statistics
  ///     the corpus statistics providing the vocabulary
  /// @param pretrained
  ///     the pretrained vectors
  /// @param minimumTokenFrequency
  ///     the smallest corpus count for a token to get its own row
  public EmbeddingTable(
      CorpusStatistics statistics,
      PretrainedVectors pretrained,
      int minimumTokenFrequency
  )
  {
    this.statistics = statistics;
    this.pretrained = pretrained;
    this.minimumTokenFrequency = minimumTokenFrequency;
  }

  private void ensureLoaded() {
    if (tokenToIndex != null) {
      return;
    }

    Map<String, Integer> indices = new LinkedHashMap<>();
    List<String> vocabulary = statistics.tokensWithMinimumFrequency(minimumTokenFrequency);
    for (int i = 0; i < vocabulary.size(); i++) {
      indices.put(vocabulary.get(i), i + 2);
    }
    indices.put(OOV_TOKEN, OOV_INDEX);

    Set<Integer> distinct = new HashSet<>(indices.values());
    if (distinct.size() != indices.size()) {
      throw new IllegalStateException("duplicate vocabulary indices");
    }
    if (distinct.contains(PADDING_INDEX)) {
      throw new IllegalStateException("the padding index was assigned to a token");
    }

    float[][] rows = new float[indices.size() + 1][];
    rows[PADDING_INDEX] = new float[pretrained.dimensions() + 1];
    int fromPretrained = 0;
    for (Map.Entry<String, Integer> entry : indices.entrySet()) {
      float[] row = vectorOrRandom(entry.getKey());
      rows[entry.getValue()] = row;
      if (entry.getValue() >= 2 && row[0] > 0) {
        fromPretrained++;
      }
    }

    int vocabularyRows = rows.length - 2;
    logger.info(String.format(
        "%d words in vocab, %d of them from pretrained vectors (%.2f%%)",
        vocabularyRows,
        fromPretrained,
        vocabularyRows == 0 ? 0.0d : (100.0d * fromPretrained) / vocabularyRows
    ));

    this.matrix = rows;
    this.tokenToIndex = indices;
  }

  /// @param token
  ///     any token text
  /// @return the marker and vector for the token, pretrained if available, seeded random
  ///     otherwise
  public float[] vectorOrRandom(String token) {
    Optional<float[]> vector = pretrained.vector(token);
    int dimensions = pretrained.dimensions();
    float[] row = new float[dimensions + 1];
    if (vector.isPresent()) {
      row[0] = PRETRAINED_MARKER;
      System.arraycopy(vector.get(), 0, row, 1, dimensions);
      return row;
    }
    UniformRandomProvider rng =
        RandomSource.XO_SHI_RO_256_PP.create((long) StableHash.seedFor(TextNormalizer.normalize(token)));
    ContinuousSampler normal = ZigguratSampler.NormalizedGaussian.of(rng);
    float stddev = pretrained.standardDeviation();
    for (int i = 0; i < row.length; i++) {
      row[i] = (float) (normal.sample() * stddev);
    }
    row[0] = RANDOM_MARKER;
    return row;
  }

  /// @param token
  ///     any token text
  /// @return the row index of its normalized form, [#OOV_INDEX] when not in the vocabulary;
  ///     never [#PADDING_INDEX]
  public int indexForToken(String token) {
    ensureLoaded();
    int index = tokenToIndex.getOrDefault(TextNormalizer.normalize(token), OOV_INDEX);
    if (index == PADDING_INDEX) {
      throw new IllegalStateException("padding index returned for token '" + token + "'");
    }
    return index;
  }

  /// @param token
  ///     any token text
  /// @return a copy of the row for the token
  public float[] vectorForToken(String token) {
    return vector(indexForToken(token));
  }

  /// @param index
  ///     a row index
  /// @return a copy of the row
  public float[] vector(int index) {
    ensureLoaded();
    return matrix[index].clone();
  }

  /// @return values per row, one more than the pretrained dimensions
  public int dimensions() {
    ensureLoaded();
    return matrix[0].length;
  }

  /// @return number of rows excluding the padding row
  public int vocabularySize() {
    ensureLoaded();
    return matrix.length - 1;
  }

  /// @return a copy of the whole matrix, padding row first
  public float[][] matrix() {
    ensureLoaded();
    float[][] copy = new float[matrix.length][];
    for (int i = 0; i < matrix.length; i++) {
      copy[i] = matrix[i].clone();
    }
    return copy;
  }
}
