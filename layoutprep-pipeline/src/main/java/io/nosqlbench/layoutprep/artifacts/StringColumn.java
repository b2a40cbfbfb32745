package io.nosqlbench.layoutprep.artifacts;

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

import io.jhdf.api.WritableGroup;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/// A column of variable length strings.
///
/// Strings are kept as one UTF-8 byte heap (`<name>_utf8`) and an offset table
/// (`<name>_offsets`, `rows + 1` entries) so that row `i` spans
/// `heap[offsets[i] .. offsets[i+1])`. A heap with no bytes writes no `_utf8` dataset.
public class StringColumn extends Column {

  /// suffix of the byte heap dataset
  public static final String HEAP_SUFFIX = "_utf8";
  /// suffix of the offset table dataset
  public static final String OFFSETS_SUFFIX = "_offsets";

  private byte[] heap = new byte[INITIAL_CAPACITY * 8];
  private int heapSize;
  private int[] offsets = new int[INITIAL_CAPACITY + 1];

  /// create a string column
  /// @param name
  ///     the base dataset name
  public StringColumn(String name) {
    super(name, 1);
  }

  /// append one string
  /// @param value
  ///     the string to append; must not contain NUL characters
  public void append(String value) {
    if (value.indexOf('\0') >= 0) {
      throw new ArtifactBuildException("NUL character in value for column " + name());
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (heapSize + bytes.length > heap.length) {
      heap = Arrays.copyOf(heap, grow(heap.length, heapSize + bytes.length));
    }
    System.arraycopy(bytes, 0, heap, heapSize, bytes.length);
    heapSize += bytes.length;
    if (rows + 2 > offsets.length) {
      offsets = Arrays.copyOf(offsets, grow(offsets.length, rows + 2));
    }
    rows++;
    offsets[rows] = heapSize;
  }

  /// @param row
  ///     row ordinal
  /// @return the string at that row
  public String get(int row) {
    return new String(heap, offsets[row], offsets[row + 1] - offsets[row], StandardCharsets.UTF_8);
  }

  @Override
  protected void writeDatasets(WritableGroup group) {
    group.putDataset(name() + OFFSETS_SUFFIX, Arrays.copyOf(offsets, rows + 1));
    if (heapSize > 0) {
      group.putDataset(name() + HEAP_SUFFIX, Arrays.copyOf(heap, heapSize));
    }
  }
}
