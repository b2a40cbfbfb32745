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

/// Character class features of a token's raw text, each in [0, 1]: first character upper,
/// second character upper, fraction of upper case, first character lower, second character
/// lower, fraction of lower case and fraction of digits. Empty text has all zeros.
public class CapitalizationFeatures {

  /// number of values produced
  public static final int COUNT = 7;

  private CapitalizationFeatures() {
  }

  /// @param token
  ///     raw token text
  /// @return the seven features in order
  public static float[] of(String token) {
    float[] features = new float[COUNT];
    int[] codePoints = token.codePoints().toArray();
    if (codePoints.length == 0) {
      return features;
    }
    int upper = 0;
    int lower = 0;
    int digits = 0;
    for (int cp : codePoints) {
      if (Character.isUpperCase(cp)) {
        upper++;
      } else if (Character.isLowerCase(cp)) {
        lower++;
      }
      if (Character.isDigit(cp)) {
        digits++;
      }
    }
    float length = codePoints.length;
    features[0] = Character.isUpperCase(codePoints[0]) ? 1.0f : 0.0f;
    features[1] = codePoints.length > 1 && Character.isUpperCase(codePoints[1]) ? 1.0f : 0.0f;
    features[2] = upper / length;
    features[3] = Character.isLowerCase(codePoints[0]) ? 1.0f : 0.0f;
    features[4] = codePoints.length > 1 && Character.isLowerCase(codePoints[1]) ? 1.0f : 0.0f;
    features[5] = lower / length;
    features[6] = digits / length;
    return features;
  }
}
