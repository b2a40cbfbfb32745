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

/// A column of single bytes per row, stored as `byte[rows]`.
public class ByteColumn extends Column {

  private byte[] values = new byte[INITIAL_CAPACITY];

  /// create a byte column
  /// @param name
  ///     the dataset name
  public ByteColumn(String name) {
    super(name, 1);
  }

  /// append a run of rows
  /// @param run
  ///     the values to append
  public void appendAll(byte[] run) {
    if (rows + run.length > values.length) {
      values = Arrays.copyOf(values, grow(values.length, rows + run.length));
    }
    System.arraycopy(run, 0, values, rows, run.length);
    rows += run.length;
  }

  @Override
  protected void writeDatasets(WritableGroup group) {
    group.putDataset(name(), Arrays.copyOf(values, rows));
  }
}
