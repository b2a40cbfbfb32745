package io.nosqlbench.layoutprep.artifacts;

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

/// The pipeline stage that produced an artifact, with the format version its file name carries
public enum ArtifactKind {
  /// raw tokens parsed from the corpus dump
  UNLABELED_TOKENS("unlabeled-tokens", 3),
  /// accepted documents with weak-supervision labels
  LABELED_TOKENS("labeled-tokens", 12),
  /// labeled documents with model input features
  FEATURIZED_TOKENS("featurized-tokens", 12);

  private final String stem;
  private final int formatVersion;

  ArtifactKind(String stem, int formatVersion) {
    this.stem = stem;
    this.formatVersion = formatVersion;
  }

  /// @return the file name stem, like `labeled-tokens`
  public String stem() {
    return stem;
  }

  /// @return the format version written into file names and attributes
  public int formatVersion() {
    return formatVersion;
  }

  /// @return the file name for an artifact without a configuration key
  public String fileName() {
    return stem + "-v" + formatVersion + ".h5";
  }

  /// @param configKey
  ///     hex digest of the configuration the artifact was built with
  /// @return the file name for an artifact keyed by configuration
  public String fileName(String configKey) {
    return stem + "-" + configKey + "-v" + formatVersion + ".h5";
  }
}
