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

/// A column of int rows. Width 1 columns are stored as `int[rows]`, wider columns as
/// `int[rows][width]`.
public class IntColumn extends Column {

  private int[] values;

  /// create an int column
  /// @param name
  ///     the dataset name
  /// @param width
  ///     values per row
  public IntColumn(String name, int width) {
    super(name, width);
    this.values = new int[INITIAL_CAPACITY * width];
  }

  /// append one row
  /// @param row
  ///     exactly [#width()] values
  public void append(int... row) {
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
  /// @return the first value of the row
  public int get(int row) {
    return values[row * width()];
  }

  @Override
  protected void writeDatasets(WritableGroup group) {
    if (width() == 1) {
      group.putDataset(name(), Arrays.copyOf(values, rows));
      return;
    }
    int[][] matrix = new int[rows][];
    for (int i = 0; i < rows; i++) {
      matrix[i] = Arrays.copyOfRange(values, i * width(), (i + 1) * width());
    }
    group.putDataset(name(), matrix);
  }
}
