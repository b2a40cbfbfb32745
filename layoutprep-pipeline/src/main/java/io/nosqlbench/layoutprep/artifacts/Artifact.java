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

import io.jhdf.HdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.ColumnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/// A read-only handle on a finalized artifact.
///
/// Column reads go straight to the open HDF5 file, either whole or as a row slice. When the
/// artifact names a `linked_source`, that sibling artifact is opened alongside and any column
/// not stored here is read from it. The handle, and so every slice source derived from it,
/// stays valid until [#close()].
///
/// ### Data type semantics
///
/// Width 1 int and byte columns read as flat arrays, float and wider int columns as one array
/// per row. String columns are decoded from their UTF-8 heap.
public class Artifact implements AutoCloseable {
  private final static Logger logger = LogManager.getLogger(Artifact.class);

  private final Path path;
  private final HdfFile hdfFile;
  private final ArtifactAttributes attributes;
  private final Artifact linked;

  private Artifact(Path path, HdfFile hdfFile, ArtifactAttributes attributes, Artifact linked) {
    this.path = path;
    this.hdfFile = hdfFile;
    this.attributes = attributes;
    this.linked = linked;
  }

  /// open an artifact and, if it has one, its linked source
  /// @param path
  ///     the finalized artifact file
  /// @return the open artifact
  public static Artifact open(Path path) {
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("no artifact at " + path);
    }
    HdfFile hdfFile = new HdfFile(path);
    try {
      ArtifactAttributes attributes = ArtifactAttributes.fromGroup(hdfFile);
      Artifact linked = null;
      if (attributes.linked_source().isPresent()) {
        Path linkedPath = path.resolveSibling(attributes.linked_source().get());
        logger.debug("{} links columns from {}", path, linkedPath);
        linked = open(linkedPath);
      }
      return new Artifact(path, hdfFile, attributes, linked);
    } catch (RuntimeException e) {
      hdfFile.close();
      throw e;
    }
  }

  /// @return the file this artifact was opened from
  public Path path() {
    return path;
  }

  /// @return the root attributes
  public ArtifactAttributes attributes() {
    return attributes;
  }

  /// @return the linked source artifact, if any
  public Optional<Artifact> linked() {
    return Optional.ofNullable(linked);
  }

  /// @param dataset
  ///     a column
  /// @return true if the column is stored here or in the linked source
  public boolean hasColumn(ArtifactDataset dataset) {
    return hdfFile.getAttribute(dataset.name() + Column.ROWS_SUFFIX) != null
           || (linked != null && linked.hasColumn(dataset));
  }

  /// @param dataset
  ///     a column
  /// @return true if the column is stored in this file rather than a linked source
  public boolean storesColumn(ArtifactDataset dataset) {
    return hdfFile.getAttribute(dataset.name() + Column.ROWS_SUFFIX) != null;
  }

  /// @param dataset
  ///     a column
  /// @return its number of rows
  public int rows(ArtifactDataset dataset) {
    Artifact owner = owner(dataset);
    Attribute rows = owner.hdfFile.getAttribute(dataset.name() + Column.ROWS_SUFFIX);
    return ArtifactAttributes.intValue(rows.getData());
  }

  /// @param dataset
  ///     a string column
  /// @return all of its values
  public String[] strings(ArtifactDataset dataset) {
    return strings(dataset, 0, rows(dataset));
  }

  /// @param dataset
  ///     a string column
  /// @param start
  ///     first row
  /// @param count
  ///     number of rows
  /// @return the values of the row range
  public String[] strings(ArtifactDataset dataset, int start, int count) {
    Artifact owner = checkedOwner(dataset, ColumnType.STRING, start, count);
    if (count == 0) {
      return new String[0];
    }
    int[] offsets = (int[]) owner.dataset(dataset.name() + StringColumn.OFFSETS_SUFFIX)
        .getData(new long[]{start}, new int[]{count + 1});
    int heapStart = offsets[0];
    int heapLength = offsets[count] - heapStart;
    byte[] heap = new byte[0];
    if (heapLength > 0) {
      heap = (byte[]) owner.dataset(dataset.name() + StringColumn.HEAP_SUFFIX)
          .getData(new long[]{heapStart}, new int[]{heapLength});
    }
    String[] values = new String[count];
    for (int i = 0; i < count; i++) {
      values[i] = new String(
          heap,
          offsets[i] - heapStart,
          offsets[i + 1] - offsets[i],
          StandardCharsets.UTF_8
      );
    }
    return values;
  }

  /// @param dataset
  ///     a width 1 int column
  /// @return all of its values
  public int[] ints(ArtifactDataset dataset) {
    return ints(dataset, 0, rows(dataset));
  }

  /// @param dataset
  ///     a width 1 int column
  /// @param start
  ///     first row
  /// @param count
  ///     number of rows
  /// @return the values of the row range
  public int[] ints(ArtifactDataset dataset, int start, int count) {
    Artifact owner = checkedOwner(dataset, ColumnType.INT, start, count);
    if (dataset.width() != 1) {
      throw new IllegalArgumentException(dataset + " has width " + dataset.width());
    }
    if (count == 0) {
      return new int[0];
    }
    return (int[]) owner.dataset(dataset.name()).getData(new long[]{start}, new int[]{count});
  }

  /// @param dataset
  ///     a wide int column
  /// @param start
  ///     first row
  /// @param count
  ///     number of rows
  /// @return the rows of the range
  public int[][] intRows(ArtifactDataset dataset, int start, int count) {
    Artifact owner = checkedOwner(dataset, ColumnType.INT, start, count);
    if (dataset.width() == 1) {
      throw new IllegalArgumentException(dataset + " is a flat column");
    }
    if (count == 0) {
      return new int[0][];
    }
    return (int[][]) owner.dataset(dataset.name())
        .getData(new long[]{start, 0}, new int[]{count, dataset.width()});
  }

  /// @param dataset
  ///     a float column
  /// @return all of its rows
  public float[][] floats(ArtifactDataset dataset) {
    return floats(dataset, 0, rows(dataset));
  }

  /// @param dataset
  ///     a float column
  /// @param start
  ///     first row
  /// @param count
  ///     number of rows
  /// @return the rows of the range
  public float[][] floats(ArtifactDataset dataset, int start, int count) {
    Artifact owner = checkedOwner(dataset, ColumnType.FLOAT, start, count);
    if (count == 0) {
      return new float[0][];
    }
    return (float[][]) owner.dataset(dataset.name())
        .getData(new long[]{start, 0}, new int[]{count, dataset.width()});
  }

  /// @param dataset
  ///     a byte column
  /// @param start
  ///     first row
  /// @param count
  ///     number of rows
  /// @return the values of the row range
  public byte[] bytes(ArtifactDataset dataset, int start, int count) {
    Artifact owner = checkedOwner(dataset, ColumnType.BYTE, start, count);
    if (count == 0) {
      return new byte[0];
    }
    return (byte[]) owner.dataset(dataset.name()).getData(new long[]{start}, new int[]{count});
  }

  private Artifact checkedOwner(ArtifactDataset dataset, ColumnType type, int start, int count) {
    if (dataset.type() != type) {
      throw new IllegalArgumentException(dataset + " is a " + dataset.type() + " column");
    }
    Artifact owner = owner(dataset);
    int rows = owner.rows(dataset);
    if (start < 0 || count < 0 || start + count > rows) {
      throw new IndexOutOfBoundsException(
          "rows [" + start + "," + (start + count) + ") outside " + dataset + " with " + rows
          + " rows");
    }
    return owner;
  }

  private Artifact owner(ArtifactDataset dataset) {
    if (storesColumn(dataset)) {
      return this;
    }
    if (linked != null) {
      return linked.owner(dataset);
    }
    throw new IllegalArgumentException("no column " + dataset + " in " + path);
  }

  private Dataset dataset(String name) {
    Dataset dataset = hdfFile.getDatasetByPath(name);
    if (dataset == null) {
      throw new IllegalStateException("dataset " + name + " missing from " + path);
    }
    return dataset;
  }

  @Override
  public void close() {
    try {
      hdfFile.close();
    } finally {
      if (linked != null) {
        linked.close();
      }
    }
  }

  @Override
  public String toString() {
    return "Artifact{" + path + ", " + attributes.artifact_kind() + "}";
  }
}
