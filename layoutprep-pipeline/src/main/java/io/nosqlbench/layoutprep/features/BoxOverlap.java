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

import java.util.List;

/// Overlap of token boxes with detected regions.
///
/// Overlap is the area of the intersection divided by the area of the token box, so a token
/// fully inside a region scores 1 no matter how large the region is. Boxes are
/// `(left, top, right, bottom)`.
public class BoxOverlap {

  /// overlap a token must exceed to be flagged
  public static final float THRESHOLD = 0.1f;

  private BoxOverlap() {
  }

  /// @return intersection area over the area of the first box, 0 for a first box without area
  public static float overFirst(
      float aLeft, float aTop, float aRight, float aBottom,
      float bLeft, float bTop, float bRight, float bBottom
  )
  {
    float area = (aRight - aLeft) * (aBottom - aTop);
    if (area == 0.0f) {
      return 0.0f;
    }
    float height = Math.min(aBottom, bBottom) - Math.max(aTop, bTop);
    float width = Math.min(aRight, bRight) - Math.max(aLeft, bLeft);
    if (height < 0.0f || width < 0.0f) {
      return 0.0f;
    }
    return (height * width) / area;
  }

  /// @param left
  ///     token left
  /// @param top
  ///     token top
  /// @param right
  ///     token right
  /// @param bottom
  ///     token bottom
  /// @param boxes
  ///     the detections of the token's page
  /// @return `{title flag, author flag}`, each 0 or 1 and never both 1
  public static float[] flags(float left, float top, float right, float bottom, List<DetectionBox> boxes) {
    float bestTitle = 0.0f;
    float bestAuthor = 0.0f;
    for (DetectionBox box : boxes) {
      if (!box.isTitle() && !box.isAuthor()) {
        continue;
      }
      float overlap =
          overFirst(left, top, right, bottom, box.left(), box.top(), box.right(), box.bottom());
      if (box.isTitle()) {
        bestTitle = Math.max(bestTitle, overlap);
      } else {
        bestAuthor = Math.max(bestAuthor, overlap);
      }
    }
    return new float[]{
        bestTitle > THRESHOLD && bestTitle >= bestAuthor ? 1.0f : 0.0f,
        bestAuthor > THRESHOLD && bestAuthor > bestTitle ? 1.0f : 0.0f
    };
  }
}
