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

import java.util.Arrays;

/// A column of fixed-width float rows, stored as a `float[rows][width]` dataset.
public class FloatColumn extends Column {

  private float[] values;

  /// create a float column
  /// @param name
  ///     the dataset name
  /// @param width
  ///     values per row
  public FloatColumn(String name, int width) {
    super(name, width);
    this.values = new float[INITIAL_CAPACITY * width];
  }

  /// append one row
  /// @param row
  ///     exactly [#width()] values
  public void append(float... row) {
    if (row.length != width()) {
      throw new IllegalArgumentException(
          "row of width " + row.length + " appended to " + name() + " of width " + width());
    }
    int start = rows * width();
    if (start + row.length > values.length) {
      values = Arrays.copyOf(values, grow(values.length, start + row.length));
    }
    System.arraycopy(row, 0, values, start, row.length);
    rows++;
  }

  /// @param row
  ///     row ordinal
  /// @return a copy of the row
  public float[] row(int row) {
    int start = row * width();
    return Arrays.copyOfRange(values, start, start + width());
  }

  @Override
  protected void writeDatasets(WritableGroup group) {
    float[][] matrix = new float[rows][];
    for (int i = 0; i < rows; i++) {
      matrix[i] = row(i);
    }
    group.putDataset(name(), matrix);
  }
}
