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

import java.util.List;

/// One document of the document directory
/// @param docId
///     document id from the content hash on
/// @param docSha
///     40 hex character content hash
/// @param goldTitle
///     gold title, empty until labeled
/// @param authors
///     gold authors in reference order, empty until labeled
/// @param pages
///     page boundaries in page order
public record DocumentEntry(
    String docId,
    String docSha,
    String goldTitle,
    List<GoldAuthor> authors,
    List<PageEntry> pages
)
{
  /// @return total token rows of all pages
  public int tokenCount() {
    int count = 0;
    for (PageEntry page : pages) {
      count += page.tokenCount();
    }
    return count;
  }
}
