package io.nosqlbench.layoutprep.schema;

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

/// The named columns of the layoutprep artifacts.
///
/// The enum constant name is the dataset name inside the HDF5 file. Document directory columns
/// have one row per document, author or page; token columns have one row per token and are
/// addressed through the page entries of the directory.
public enum ArtifactDataset {
  /// document id, the doc path from the content hash on
  doc_id(ColumnType.STRING, 1),
  /// 40 hex character content hash
  doc_sha(ColumnType.STRING, 1),
  /// ordinal of the document's first page entry
  doc_first_page(ColumnType.INT, 1),
  /// number of page entries of the document
  doc_page_count(ColumnType.INT, 1),
  /// gold title, empty before labeling
  gold_title(ColumnType.STRING, 1),
  /// ordinal of the document's first author entry
  doc_first_author(ColumnType.INT, 1),
  /// number of author entries of the document
  doc_author_count(ColumnType.INT, 1),
  /// author given names
  author_given_names(ColumnType.STRING, 1),
  /// author surnames
  author_surnames(ColumnType.STRING, 1),
  /// page width and height
  page_dimensions(ColumnType.FLOAT, 2),
  /// ordinal of the page's first token row
  page_first_token(ColumnType.INT, 1),
  /// number of token rows of the page
  page_token_count(ColumnType.INT, 1),

  /// raw token text
  token_text(ColumnType.STRING, 1),
  /// raw font name
  token_font(ColumnType.STRING, 1),
  /// left, right, top, bottom, font size, font space width
  token_numeric_features(ColumnType.FLOAT, 6),
  /// [TokenLabel] codes
  token_labels(ColumnType.BYTE, 1),
  /// vocabulary index and font hash
  token_hashed_text_features(ColumnType.INT, 2),
  /// [ScaledFeature] values shifted into [-0.5, 0.5]
  token_scaled_numeric_features(ColumnType.FLOAT, ScaledFeature.values().length);

  private final ColumnType type;
  private final int width;

  ArtifactDataset(ColumnType type, int width) {
    this.type = type;
    this.width = width;
  }

  /// @return the storage type
  public ColumnType type() {
    return type;
  }

  /// @return values per row
  public int width() {
    return width;
  }
}
