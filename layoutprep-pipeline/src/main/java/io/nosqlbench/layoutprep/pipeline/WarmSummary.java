package io.nosqlbench.layoutprep.pipeline;


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

/// What warming one bucket produced
/// @param bucket
///     bucket name
/// @param featurizedArtifact
///     the featurized artifact of the bucket
/// @param documents
///     documents in the featurized artifact
/// @param tokens
///     tokens in the featurized artifact
/// @param builtStages
///     number of stages that had to be built rather than reused
public record WarmSummary(
    String bucket,
    Path featurizedArtifact,
    int documents,
    int tokens,
    int builtStages
)
{
  /// @return the one line form printed by the command line
  public String summaryLine() {
    return String.format(
        "%s: %d documents, %d tokens, %d of 3 stages built, %s",
        bucket,
        documents,
        tokens,
        builtStages,
        featurizedArtifact.getFileName()
    );
  }
}
