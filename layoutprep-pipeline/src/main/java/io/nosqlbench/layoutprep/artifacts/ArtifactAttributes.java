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

import io.jhdf.api.Attribute;
import io.jhdf.api.Group;

import java.lang.reflect.Array;
import java.util.Optional;

/// Root group attributes every artifact carries
/// @param artifact_kind
///     the stage which produced the artifact
/// @param format_version
///     the stage format version, also part of the file name
/// @param schema_version
///     the version of the document directory schema
/// @param document_count
///     number of documents in the directory
/// @param token_count
///     number of token rows
/// @param linked_source
///     file name of a sibling artifact whose columns are re-exposed by this one
public record ArtifactAttributes(
    ArtifactKind artifact_kind,
    int format_version,
    int schema_version,
    int document_count,
    int token_count,
    Optional<String> linked_source
)
{
  /// the document directory schema version written by this code
  public static final int SCHEMA_VERSION = 1;

  /// create attributes for a stage at the current schema version
  /// @param kind
  ///     the producing stage
  /// @param documents
  ///     number of documents
  /// @param tokens
  ///     number of token rows
  /// @param linkedSource
  ///     optional sibling artifact name
  /// @return the attributes
  public static ArtifactAttributes of(
      ArtifactKind kind,
      int documents,
      int tokens,
      Optional<String> linkedSource
  )
  {
    return new ArtifactAttributes(
        kind,
        kind.formatVersion(),
        SCHEMA_VERSION,
        documents,
        tokens,
        linkedSource
    );
  }

  /// read the attributes from an artifact root group
  /// @param group
  ///     the root group
  /// @return the attributes
  public static ArtifactAttributes fromGroup(Group group) {
    return new ArtifactAttributes(
        ArtifactKind.valueOf(requiredString(group, "artifact_kind")),
        requiredInt(group, "format_version"),
        requiredInt(group, "schema_version"),
        requiredInt(group, "document_count"),
        requiredInt(group, "token_count"),
        Optional.ofNullable(group.getAttribute("linked_source")).map(Attribute::getData)
            .map(String::valueOf)
    );
  }

  private static String requiredString(Group group, String name) {
    Attribute attribute = group.getAttribute(name);
    if (attribute == null) {
      throw new IllegalStateException("artifact is missing the '" + name + "' attribute");
    }
    return String.valueOf(attribute.getData());
  }

  private static int requiredInt(Group group, String name) {
    Attribute attribute = group.getAttribute(name);
    if (attribute == null) {
      throw new IllegalStateException("artifact is missing the '" + name + "' attribute");
    }
    return intValue(attribute.getData());
  }

  /// @param data
  ///     attribute data, either a scalar number or a one element array
  /// @return the int value
  static int intValue(Object data) {
    if (data != null && data.getClass().isArray()) {
      data = Array.get(data, 0);
    }
    return ((Number) data).intValue();
  }
}
