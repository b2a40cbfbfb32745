package io.nosqlbench.layoutprep.features;


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

import io.nosqlbench.layoutprep.config.ModelSettings;
import io.nosqlbench.layoutprep.text.StableHash;

import java.nio.file.Path;

/// The cache key of a featurized artifact.
///
/// Every setting that changes featurized values is part of the key: the page limit, the font
/// hash size, the minimum token frequency and the file name of the pretrained vectors.
public class FeaturizationKey {

  private FeaturizationKey() {
  }

  /// @param settings
  ///     the model settings
  /// @return eight lowercase hex characters
  public static String of(ModelSettings settings) {
    Path vectors = Path.of(settings.getPretrainedVectors()).getFileName();
    return StableHash.hex(
        settings.getMaxPageNumber() + "|"
        + settings.getFontHashSize() + "|"
        + settings.getMinimumTokenFrequency() + "|"
        + (vectors == null ? "" : vectors.toString())
    );
  }
}
