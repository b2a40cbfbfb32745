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

/// A gold string found on a page
/// @param page
///     page number within the document
/// @param firstToken
///     first matched token of the page
/// @param onePastLastToken
///     one past the last matched token of the page
/// @param cost
///     edit distance of the match
/// @param matchedText
///     the raw texts of the matched tokens joined by single spaces
/// @param averageFontSize
///     mean font size of the matched tokens
public record FuzzyMatch(
    int page,
    int firstToken,
    int onePastLastToken,
    int cost,
    String matchedText,
    float averageFontSize
)
{
  /// @return the matched text length in code points
  public int matchedTextLength() {
    return matchedText.codePointCount(0, matchedText.length());
  }
}
