package io.nosqlbench.layoutprep.documents;


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

import java.util.List;

/// One featurized document
/// @param docId
///     document id
/// @param docSha
///     content hash
/// @param goldTitle
///     gold title with leading and trailing periods removed
/// @param goldAuthors
///     gold authors in reference order
/// @param pages
///     pages in order
public record Document(
    String docId,
    String docSha,
    String goldTitle,
    List<GoldAuthor> goldAuthors,
    List<Page> pages
)
{
  @Override
  public String toString() {
    return "Document{" + docId + "}";
  }
}
