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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// The build discipline shared by every stage.
///
/// An existing final artifact is reused as is. Otherwise the build writes into
/// `<final>.<pid>.temp`, which is atomically moved to the final path on success and deleted on
/// failure. A file under the final name is therefore either absent or complete. Concurrent
/// builders of the same artifact are not coordinated; the last move wins.
public class ArtifactBuilds {
  private final static Logger logger = LogManager.getLogger(ArtifactBuilds.class);

  private ArtifactBuilds() {
  }

  /// make sure a finalized artifact exists at the given path
  /// @param finalPath
  ///     the final artifact path
  /// @param build
  ///     the build to run when the artifact does not exist yet
  /// @return true if the artifact was built, false if an existing one was reused
  /// @throws ArtifactBuildException
  ///     if the build failed, after the temporary file was removed
  public static boolean ensure(Path finalPath, ArtifactBuild build) {
    if (Files.exists(finalPath)) {
      logger.debug("reusing {}", finalPath);
      return false;
    }
    Path tempFile = tempPathFor(finalPath);
    try {
      Path parent = finalPath.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.deleteIfExists(tempFile);
      logger.info("building {}", finalPath);
      build.build(tempFile);
      if (!Files.exists(tempFile)) {
        throw new ArtifactBuildException("build for " + finalPath + " wrote no output");
      }
      Files.move(
          tempFile,
          finalPath,
          StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE
      );
      logger.info("finished {}", finalPath);
      return true;
    } catch (Exception e) {
      rmTempFile(tempFile, e);
      if (e instanceof ArtifactBuildException abe) {
        throw abe;
      }
      throw new ArtifactBuildException("unable to build " + finalPath, e);
    }
  }

  /// @param finalPath
  ///     a final artifact path
  /// @return the process unique temporary path used while building it
  public static Path tempPathFor(Path finalPath) {
    return finalPath.resolveSibling(
        finalPath.getFileName() + "." + ProcessHandle.current().pid() + ".temp");
  }

  private static void rmTempFile(Path tempFile, Exception failure) {
    try {
      Files.deleteIfExists(tempFile);
    } catch (IOException e) {
      failure.addSuppressed(e);
      logger.warn("unable to remove temporary file {}: {}", tempFile, e.getMessage());
    }
  }
}
