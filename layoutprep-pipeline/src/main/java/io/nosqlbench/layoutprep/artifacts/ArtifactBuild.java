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

import java.nio.file.Path;

/// The body of a stage build, writing a complete artifact to the given target
@FunctionalInterface
public interface ArtifactBuild {

  /// build the artifact
  /// @param target
  ///     the temporary file to write
  /// @throws Exception
  ///     if the build fails for any reason
  void build(Path target) throws Exception;
}
