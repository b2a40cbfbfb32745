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

/// Page boundary record of the document directory
/// @param width
///     page width
/// @param height
///     page height
/// @param firstToken
///     ordinal of the first token row of the page
/// @param tokenCount
///     number of token rows of the page
public record PageEntry(float width, float height, int firstToken, int tokenCount) {

  /// @param newFirstToken
  ///     the first token row in another artifact
  /// @return this page relocated to another token range start
  public PageEntry relocate(int newFirstToken) {
    return new PageEntry(width, height, newFirstToken, tokenCount);
  }
}
