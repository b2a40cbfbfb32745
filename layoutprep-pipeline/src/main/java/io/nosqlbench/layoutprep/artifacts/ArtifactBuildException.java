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

/// Signals that an artifact build failed as a whole. The temporary output has already been
/// removed when this is thrown, so nothing exists under the final artifact name.
public class ArtifactBuildException extends RuntimeException {

  /// create an exception with a message
  /// @param message
  ///     the failure description
  public ArtifactBuildException(String message) {
    super(message);
  }

  /// create an exception wrapping a cause
  /// @param message
  ///     the failure description
  /// @param cause
  ///     the underlying failure
  public ArtifactBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
