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

/// Columns of `token_scaled_numeric_features`, in storage order
public enum ScaledFeature {
  LEFT,
  RIGHT,
  TOP,
  BOTTOM,
  FONT_SIZE_CORPUS_PERCENTILE,
  SPACE_WIDTH_CORPUS_PERCENTILE,
  FONT_SIZE_DOCUMENT_PERCENTILE,
  SPACE_WIDTH_DOCUMENT_PERCENTILE,
  FIRST_CHAR_UPPER,
  SECOND_CHAR_UPPER,
  UPPER_FRACTION,
  FIRST_CHAR_LOWER,
  SECOND_CHAR_LOWER,
  LOWER_FRACTION,
  DIGIT_FRACTION,
  IN_TITLE_BOX,
  IN_AUTHOR_BOX;

  /// the shift applied to every stored value
  public static final float CENTERING_SHIFT = -0.5f;
}
