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

import io.nosqlbench.layoutprep.schema.GoldAuthor;
import io.nosqlbench.layoutprep.text.GoldTextTokenizer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/// The spellings under which an author name may appear on a title page.
///
/// For given names `Jane Ann` and surname `Doe`: `Jane Ann Doe`, `J A Doe`, `J . A . Doe`,
/// `JA Doe`, `Doe , Jane Ann`, `J Doe` and `J . Doe`. Only the surname when there are no given
/// names.
public class AuthorVariants {

  private AuthorVariants() {
  }

  /// @param author
  ///     a gold author with tokenized names
  /// @return the distinct variants in a fixed order
  public static List<String> of(GoldAuthor author) {
    String given = author.givenNames();
    String surname = author.surname();
    if (given.isEmpty()) {
      return List.of(surname);
    }
    String first = given.substring(0, given.offsetByCodePoints(0, 1));
    Set<String> variants = new LinkedHashSet<>();
    variants.add(given + " " + surname);
    variants.add(initials(given, " ") + " " + surname);
    variants.add(initials(given, " . ") + " . " + surname);
    variants.add(initials(given, "") + " " + surname);
    variants.add(surname + " , " + given);
    variants.add(first + " " + surname);
    variants.add(first + " . " + surname);
    return List.copyOf(variants);
  }

  static String initials(String names, String separator) {
    return GoldTextTokenizer.tokenize(names).stream()
        .filter(GoldTextTokenizer::isWord)
        .map(piece -> piece.substring(0, piece.offsetByCodePoints(0, 1)))
        .collect(Collectors.joining(separator));
  }
}
