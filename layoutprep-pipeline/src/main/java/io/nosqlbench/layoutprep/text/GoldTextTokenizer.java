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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Splits reference metadata strings the same way the corpus dump splits page text into tokens,
/// so gold strings and page strings line up for matching.
///
/// Every non-word character and every run of digits is a piece of its own, the text between
/// them is another piece, and whitespace-only pieces are dropped.
public class GoldTextTokenizer {

  private static final Pattern SPLIT = Pattern.compile("\\W|\\d+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern NON_SPACE = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern LEADING_PERIODS = Pattern.compile("^\\.+");
  private static final Pattern TRAILING_PERIODS = Pattern.compile("\\.+$");

  private GoldTextTokenizer() {
  }

  /// @param text
  ///     text to split
  /// @return the non-blank pieces in order
  public static List<String> tokenize(String text) {
    List<String> pieces = new ArrayList<>();
    Matcher matcher = SPLIT.matcher(text);
    int last = 0;
    while (matcher.find()) {
      addPiece(pieces, text.substring(last, matcher.start()));
      addPiece(pieces, matcher.group());
      last = matcher.end();
    }
    addPiece(pieces, text.substring(last));
    return pieces;
  }

  /// @param text
  ///     text to split
  /// @return the pieces joined with single spaces
  public static String tokenizeAndJoin(String text) {
    return String.join(" ", tokenize(text));
  }

  /// @param text
  ///     a token
  /// @return true if the token consists only of word characters
  public static boolean isWord(String text) {
    return WORD.matcher(text).matches();
  }

  /// @param text
  ///     text to trim
  /// @return the text without leading and trailing periods and surrounding whitespace
  public static String trimPunctuation(String text) {
    String trimmed = LEADING_PERIODS.matcher(text).replaceFirst("");
    trimmed = TRAILING_PERIODS.matcher(trimmed).replaceFirst("");
    return trimmed.strip();
  }

  private static void addPiece(List<String> pieces, String piece) {
    if (NON_SPACE.matcher(piece).matches()) {
      pieces.add(piece);
    }
  }
}
