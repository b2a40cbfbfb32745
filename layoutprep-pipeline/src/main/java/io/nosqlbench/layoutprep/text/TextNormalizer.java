package io.nosqlbench.layoutprep.text;

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

import java.text.Normalizer;
import java.util.Locale;

/// The one text normalization used for every comparison, lookup and hash of token text:
/// root locale lower casing followed by Unicode NFKC.
public class TextNormalizer {

  private TextNormalizer() {
  }

  /// @param text
  ///     raw text
  /// @return the normalized text
  public static String normalize(String text) {
    return Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFKC);
  }
}
