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

/// An approximate occurrence of a query inside a text
/// @param start
///     first matched character offset in the text
/// @param end
///     one past the last matched character offset
/// @param cost
///     edit distance between the query and `text[start, end)`
public record SubstringMatch(int start, int end, int cost) {
}
