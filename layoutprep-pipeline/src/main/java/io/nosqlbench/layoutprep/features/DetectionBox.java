package io.nosqlbench.layoutprep.features;


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

/// A region found on a page image by the external layout detector
/// @param label
///     region class, `title` or `author` are used
/// @param left
///     left edge
/// @param top
///     top edge
/// @param right
///     right edge
/// @param bottom
///     bottom edge
/// @param confidence
///     detector confidence, not used by features
public record DetectionBox(
    String label,
    float left,
    float top,
    float right,
    float bottom,
    float confidence
)
{
  public static final String TITLE = "title";
  public static final String AUTHOR = "author";

  public boolean isTitle() {
    return TITLE.equals(label);
  }

  public boolean isAuthor() {
    return AUTHOR.equals(label);
  }
}
