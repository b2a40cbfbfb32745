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
import io.jhdf.WritableHdfFile;
import io.jhdf.api.WritableNode;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.ColumnType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/// Collects the columns of one artifact in memory and writes them as a single HDF5 file.
///
/// The writer targets whatever path it is given, normally the temporary path handed out by
/// [ArtifactBuilds#ensure(Path, ArtifactBuild)]. Nothing touches the disk until
/// [#finish(ArtifactAttributes)].
public class ArtifactWriter {
  private final static Logger logger = LogManager.getLogger(ArtifactWriter.class);

  private final Path path;
  private final Map<ArtifactDataset, Column> columns = new LinkedHashMap<>();

  /// create a writer
  /// @param path
  ///     the file to write when finished
  public ArtifactWriter(Path path) {
    this.path = path;
  }

  /// @param dataset
  ///     a string dataset
  /// @return the column for it, created on first use
  public StringColumn strings(ArtifactDataset dataset) {
    return (StringColumn) column(dataset, ColumnType.STRING);
  }

  /// @param dataset
  ///     a float dataset
  /// @return the column for it, created on first use
  public FloatColumn floats(ArtifactDataset dataset) {
    return (FloatColumn) column(dataset, ColumnType.FLOAT);
  }

  /// @param dataset
  ///     an int dataset
  /// @return the column for it, created on first use
  public IntColumn ints(ArtifactDataset dataset) {
    return (IntColumn) column(dataset, ColumnType.INT);
  }

  /// @param dataset
  ///     a byte dataset
  /// @return the column for it, created on first use
  public ByteColumn bytes(ArtifactDataset dataset) {
    return (ByteColumn) column(dataset, ColumnType.BYTE);
  }

  private Column column(ArtifactDataset dataset, ColumnType expected) {
    if (dataset.type() != expected) {
      throw new IllegalArgumentException(
          "dataset " + dataset + " is of type " + dataset.type() + ", not " + expected);
    }
    return columns.computeIfAbsent(dataset, d -> switch (d.type()) {
      case STRING -> new StringColumn(d.name());
      case FLOAT -> new FloatColumn(d.name(), d.width());
      case INT -> new IntColumn(d.name(), d.width());
      case BYTE -> new ByteColumn(d.name());
    });
  }

  /// write all columns and the root attributes to the target path
  /// @param attributes
  ///     the root group attributes
  public void finish(ArtifactAttributes attributes) {
    try (WritableHdfFile writable = HdfFile.write(path)) {
      for (Column column : columns.values()) {
        logger.debug("writing column {} with {} rows", column.name(), column.rows());
        column.writeTo(writable);
      }
      writeAttributes(writable, attributes);
    } catch (ArtifactBuildException e) {
      throw e;
    } catch (Exception e) {
      throw new ArtifactBuildException("unable to write artifact " + path, e);
    }
  }

  private <T extends Record> void writeAttributes(WritableNode wnode, T attrs) {
    try {
      RecordComponent[] comps = attrs.getClass().getRecordComponents();
      for (RecordComponent comp : comps) {
        String fieldname = comp.getName();
        Method accessor = comp.getAccessor();
        Object value = accessor.invoke(attrs);

        if (value instanceof Optional<?> o) {
          if (o.isPresent()) {
            value = o.get();
          } else {
            continue;
          }
        }
        if (value instanceof Enum<?> e) {
          value = e.name();
        }
        if (value == null) {
          throw new ArtifactBuildException(
              "attribute value for required attribute " + fieldname + " was null");
        }
        wnode.putAttribute(fieldname, value);
      }
    } catch (ArtifactBuildException e) {
      throw e;
    } catch (Exception e) {
      throw new ArtifactBuildException("unable to write attributes " + attrs, e);
    }
  }
}
