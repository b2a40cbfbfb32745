package io.nosqlbench.layoutprep.tokens;


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

import java.util.List;

/// One line of the corpus token dump, as parsed by Gson
/// @param docId
///     the raw document id path
/// @param pages
///     pages in document order
public record RawDocument(String docId, List<RawPage> pages) {

  /// A page of the dump
  /// @param width
  ///     page width
  /// @param height
  ///     page height
  /// @param tokens
  ///     tokens in source order, absent for pages without text
  public record RawPage(float width, float height, List<RawToken> tokens) {
  }

  /// A token of the dump
  public record RawToken(
      String text,
      String font,
      float left,
      float right,
      float top,
      float bottom,
      float fontSize,
      float fontSpaceWidth
  )
  {
  }
}
