package io.nosqlbench.layoutprep.documents;


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

import io.nosqlbench.layoutprep.artifacts.Artifact;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.PageEntry;
import io.nosqlbench.layoutprep.schema.TokenLabel;

/// One page of a featurized document. Every accessor reads the page's slice of a column from
/// the open artifact when called; nothing is cached.
public class Page {

  private final Artifact artifact;
  private final int pageNumber;
  private final PageEntry entry;

  Page(Artifact artifact, int pageNumber, PageEntry entry) {
    this.artifact = artifact;
    this.pageNumber = pageNumber;
    this.entry = entry;
  }

  /// @return page number within the document, from 0
  public int pageNumber() {
    return pageNumber;
  }

  public float width() {
    return entry.width();
  }

  public float height() {
    return entry.height();
  }

  /// @return number of tokens on the page
  public int tokenCount() {
    return entry.tokenCount();
  }

  /// @return raw token texts
  public String[] tokens() {
    return artifact.strings(ArtifactDataset.token_text, entry.firstToken(), entry.tokenCount());
  }

  /// @return raw font names
  public String[] fonts() {
    return artifact.strings(ArtifactDataset.token_font, entry.firstToken(), entry.tokenCount());
  }

  /// @return embedding table index of each token
  public int[] tokenHashes() {
    return hashedColumn(0);
  }

  /// @return font hash bucket of each token
  public int[] fontHashes() {
    return hashedColumn(1);
  }

  /// @return left, right, top, bottom, font size and space width of each token
  public float[][] numericFeatures() {
    return artifact.floats(
        ArtifactDataset.token_numeric_features, entry.firstToken(), entry.tokenCount());
  }

  /// @return scaled features of each token, see [io.nosqlbench.layoutprep.schema.ScaledFeature]
  public float[][] scaledNumericFeatures() {
    return artifact.floats(
        ArtifactDataset.token_scaled_numeric_features, entry.firstToken(), entry.tokenCount());
  }

  /// @return label code of each token
  public byte[] labels() {
    return artifact.bytes(ArtifactDataset.token_labels, entry.firstToken(), entry.tokenCount());
  }

  /// @return label of each token
  public TokenLabel[] tokenLabels() {
    byte[] codes = labels();
    TokenLabel[] labels = new TokenLabel[codes.length];
    for (int i = 0; i < codes.length; i++) {
      labels[i] = TokenLabel.fromCode(codes[i]);
    }
    return labels;
  }

  private int[] hashedColumn(int column) {
    int[][] rows = artifact.intRows(
        ArtifactDataset.token_hashed_text_features, entry.firstToken(), entry.tokenCount());
    int[] values = new int[rows.length];
    for (int i = 0; i < rows.length; i++) {
      values[i] = rows[i][column];
    }
    return values;
  }

  @Override
  public String toString() {
    return "Page{" + pageNumber + ", " + entry.tokenCount() + " tokens}";
  }
}
