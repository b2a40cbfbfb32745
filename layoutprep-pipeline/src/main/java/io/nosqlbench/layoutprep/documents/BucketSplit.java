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

import io.nosqlbench.layoutprep.config.CorpusLayout;

import java.util.ArrayList;
import java.util.List;

/// The fixed train/test split of the 256 bucket directories
public enum BucketSplit {
  /// buckets `00` through `ef`
  TRAIN(0x00, 0xef),
  /// buckets `f0` through `ff`
  TEST(0xf0, 0xff);

  private final int first;
  private final int last;

  BucketSplit(int first, int last) {
    this.first = first;
    this.last = last;
  }

  /// @return first bucket number, inclusive
  public int first() {
    return first;
  }

  /// @return last bucket number, inclusive
  public int last() {
    return last;
  }

  /// @return the bucket directory names of the split, in order
  public List<String> bucketNames() {
    return bucketNames(first, last);
  }

  /// @param first
  ///     first bucket number, inclusive
  /// @param last
  ///     last bucket number, inclusive
  /// @return the two hex digit names of the range
  public static List<String> bucketNames(int first, int last) {
    if (first < 0 || last > 0xff || first > last) {
      throw new IllegalArgumentException(
          "bucket range [" + first + ", " + last + "] is not within [0, 255]");
    }
    List<String> names = new ArrayList<>(last - first + 1);
    for (int b = first; b <= last; b++) {
      names.add(CorpusLayout.bucketName(b));
    }
    return names;
  }

  /// @param bucket
  ///     a bucket number
  /// @return the split containing it
  public static BucketSplit of(int bucket) {
    for (BucketSplit split : values()) {
      if (bucket >= split.first && bucket <= split.last) {
        return split;
      }
    }
    throw new IllegalArgumentException("bucket " + bucket + " is not within [0, 255]");
  }
}
