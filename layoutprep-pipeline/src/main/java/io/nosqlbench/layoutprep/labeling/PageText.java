package io.nosqlbench.layoutprep.labeling;


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

import io.nosqlbench.layoutprep.text.FuzzyMatcher;
import io.nosqlbench.layoutprep.text.SubstringMatch;
import io.nosqlbench.layoutprep.text.TextNormalizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// The searchable text of one page: normalized token texts joined by single spaces, with the
/// offset of every token start so character spans can be mapped back to token spans.
public class PageText {

  private final int page;
  private final String[] rawTokens;
  private final float[] fontSizes;
  private final String text;
  private final int[] tokenAtOffset;

  /// @param page
  ///     page number within the document
  /// @param rawTokens
  ///     token texts in page order
  /// @param fontSizes
  ///     font size of each token
  public PageText(int page, String[] rawTokens, float[] fontSizes) {
    if (rawTokens.length != fontSizes.length) {
      throw new IllegalArgumentException(
          rawTokens.length + " tokens but " + fontSizes.length + " font sizes");
    }
    this.page = page;
    this.rawTokens = rawTokens;
    this.fontSizes = fontSizes;

    StringBuilder sb = new StringBuilder();
    int[] starts = new int[rawTokens.length];
    for (int i = 0; i < rawTokens.length; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      starts[i] = sb.length();
      sb.append(TextNormalizer.normalize(rawTokens[i]));
    }
    this.text = sb.toString();
    this.tokenAtOffset = new int[text.length() + 1];
    Arrays.fill(tokenAtOffset, -1);
    for (int i = 0; i < starts.length; i++) {
      tokenAtOffset[starts[i]] = i;
    }
  }

  /// @return the page number within the document
  public int page() {
    return page;
  }

  /// @return the normalized page string
  public String text() {
    return text;
  }

  /// @return number of tokens on the page
  public int tokenCount() {
    return rawTokens.length;
  }

  /// Find every acceptable occurrence of a gold string on this page.
  /// @param query
  ///     the gold string, normalized before matching
  /// @return matches in scan order, each snapped to whole tokens
  public List<FuzzyMatch> find(String query) {
    List<FuzzyMatch> found = new ArrayList<>();
    for (SubstringMatch match : FuzzyMatcher.scan(TextNormalizer.normalize(query), text)) {
      int first = firstTokenAtOrBefore(match.start());
      int onePastLast = firstTokenAtOrAfter(match.end());
      if (first >= onePastLast) {
        continue;
      }
      found.add(new FuzzyMatch(
          page,
          first,
          onePastLast,
          match.cost(),
          String.join(" ", Arrays.copyOfRange(rawTokens, first, onePastLast)),
          averageFontSize(first, onePastLast)
      ));
    }
    return found;
  }

  private int firstTokenAtOrBefore(int offset) {
    for (int i = Math.min(offset, text.length() - 1); i >= 0; i--) {
      if (tokenAtOffset[i] >= 0) {
        return tokenAtOffset[i];
      }
    }
    return 0;
  }

  private int firstTokenAtOrAfter(int offset) {
    for (int i = offset; i < text.length(); i++) {
      if (tokenAtOffset[i] >= 0) {
        return tokenAtOffset[i];
      }
    }
    return rawTokens.length;
  }

  private float averageFontSize(int first, int onePastLast) {
    double sum = 0.0d;
    for (int i = first; i < onePastLast; i++) {
      sum += fontSizes[i];
    }
    return (float) (sum / (onePastLast - first));
  }
}
