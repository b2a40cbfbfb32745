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
import java.util.Optional;

/// Approximate substring search with unit cost insertions, deletions and substitutions.
///
/// The search fills the Sellers edit distance table column by column over the text: row 0 is
/// free everywhere, so a match may start at any text offset, and every column's last row is a
/// candidate match ending there. Each cell also carries the text offset its alignment started
/// at. The best match has the lowest cost and, among equal costs, the earliest end.
///
/// Equal cost transitions prefer the diagonal, then skipping a query character, then skipping
/// a text character.
public class FuzzyMatcher {

  private FuzzyMatcher() {
  }

  /// find the cheapest non-empty occurrence of the query in the text
  /// @param query
  ///     the string to look for
  /// @param text
  ///     the string to search
  /// @return the best match, empty for an empty query or text
  public static Optional<SubstringMatch> bestMatch(String query, String text) {
    int m = query.length();
    int n = text.length();
    if (m == 0 || n == 0) {
      return Optional.empty();
    }

    int[] prevCost = new int[m + 1];
    int[] prevStart = new int[m + 1];
    int[] cost = new int[m + 1];
    int[] start = new int[m + 1];
    for (int i = 0; i <= m; i++) {
      prevCost[i] = i;
      prevStart[i] = 0;
    }

    SubstringMatch best = null;
    for (int j = 1; j <= n; j++) {
      char t = text.charAt(j - 1);
      cost[0] = 0;
      start[0] = j;
      for (int i = 1; i <= m; i++) {
        int diagonal = prevCost[i - 1] + (query.charAt(i - 1) == t ? 0 : 1);
        int skipQuery = cost[i - 1] + 1;
        int skipText = prevCost[i] + 1;
        if (diagonal <= skipQuery && diagonal <= skipText) {
          cost[i] = diagonal;
          start[i] = prevStart[i - 1];
        } else if (skipQuery <= skipText) {
          cost[i] = skipQuery;
          start[i] = start[i - 1];
        } else {
          cost[i] = skipText;
          start[i] = prevStart[i];
        }
      }
      if (start[m] < j && (best == null || cost[m] < best.cost())) {
        best = new SubstringMatch(start[m], j, cost[m]);
      }
      int[] swap = prevCost;
      prevCost = cost;
      cost = swap;
      swap = prevStart;
      prevStart = start;
      start = swap;
    }
    return Optional.ofNullable(best);
  }

  /// the largest cost at which a query still counts as found, a fifth of its non-space length
  /// @param query
  ///     the normalized query
  /// @return the cost budget
  public static int budgetFor(String query) {
    int spaces = 0;
    for (int i = 0; i < query.length(); i++) {
      if (query.charAt(i) == ' ') {
        spaces++;
      }
    }
    return (query.length() - spaces) / 5;
  }

  /// Scan the text left to right for successive occurrences of the query. Each search resumes
  /// after the previous match's end and the scan stops at the first best match over budget,
  /// since costs never improve as the remaining text shrinks.
  /// @param query
  ///     the normalized query
  /// @param text
  ///     the normalized text
  /// @return the matches within budget, in text order, with absolute offsets
  public static List<SubstringMatch> scan(String query, String text) {
    List<SubstringMatch> matches = new ArrayList<>();
    int budget = budgetFor(query);
    int offset = 0;
    while (offset < text.length()) {
      Optional<SubstringMatch> found = bestMatch(query, text.substring(offset));
      if (found.isEmpty() || found.get().cost() > budget) {
        break;
      }
      SubstringMatch match = found.get();
      matches.add(new SubstringMatch(match.start() + offset, match.end() + offset, match.cost()));
      offset += Math.max(1, match.end());
    }
    return matches;
  }
}
