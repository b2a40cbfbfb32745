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

/// An append-only, typed column held in memory while an artifact is being built.
///
/// Every column knows its name, its row width and how many rows were appended. When the
/// owning [ArtifactWriter] finishes, each column writes its datasets into the HDF5 root group
/// together with the `<name>.rows` and `<name>.width` attributes. Columns with zero rows
/// write only those attributes.
public abstract class Column {

  /// suffix of the root attribute holding a column's row count
  public static final String ROWS_SUFFIX = ".rows";
  /// suffix of the root attribute holding a column's row width
  public static final String WIDTH_SUFFIX = ".width";

  /// initial row capacity of every column arena
  protected static final int INITIAL_CAPACITY = 1024;

  private final String name;
  private final int width;
  /// number of rows appended so far
  protected int rows;

  /// create a column
  /// @param name
  ///     the dataset name of the column
  /// @param width
  ///     the number of values per row, at least 1
  protected Column(String name, int width) {
    if (width < 1) {
      throw new IllegalArgumentException("column " + name + " must have width >= 1, not " + width);
    }
    this.name = name;
    this.width = width;
  }

  /// @return the dataset name of this column
  public String name() {
    return name;
  }

  /// @return the number of values per row
  public int width() {
    return width;
  }

  /// @return the number of rows appended so far
  public int rows() {
    return rows;
  }

  /// write this column into the given group
  /// @param group
  ///     the HDF5 group to hold the column datasets and attributes
  public void writeTo(WritableGroup group) {
    group.putAttribute(name + ROWS_SUFFIX, rows);
    group.putAttribute(name + WIDTH_SUFFIX, width);
    if (rows > 0) {
      writeDatasets(group);
    }
  }

  /// write the datasets of a non-empty column
  /// @param group
  ///     the HDF5 group to hold the datasets
  protected abstract void writeDatasets(WritableGroup group);

  /// grow a capacity until it can hold the required size
  /// @param current
  ///     current capacity
  /// @param required
  ///     required capacity
  /// @return the new capacity
  protected static int grow(int current, int required) {
    long next = Math.max((long) current * 2, required);
    if (next > Integer.MAX_VALUE - 8) {
      throw new ArtifactBuildException("column exceeds the maximum array size: " + required);
    }
    return (int) next;
  }
}
