package io.nosqlbench.layoutprep.tokens;


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

import io.nosqlbench.layoutprep.artifacts.ArtifactBuildException;

import java.util.Arrays;
import java.util.regex.Pattern;

/// The stored identity of a document: its id from the content hash path element on, and that
/// hash.
/// @param docId
///     the id, like `<sha>/paper.pdf`
/// @param docSha
///     40 lowercase hex characters
public record DocIdentity(String docId, String docSha) {

  private static final Pattern SHA1 = Pattern.compile("^[0-9a-f]{40}$");

  /// @param rawDocId
  ///     the `/` separated id from the corpus dump
  /// @return the identity starting at the first path element which is a content hash
  /// @throws ArtifactBuildException
  ///     if no element is a content hash
  public static DocIdentity parse(String rawDocId) {
    String[] elements = rawDocId.split("/", -1);
    for (int i = 0; i < elements.length; i++) {
      if (SHA1.matcher(elements[i]).matches()) {
        String id = String.join("/", Arrays.copyOfRange(elements, i, elements.length));
        return new DocIdentity(id, elements[i]);
      }
    }
    throw new ArtifactBuildException("document id '" + rawDocId + "' has no content hash element");
  }
}
