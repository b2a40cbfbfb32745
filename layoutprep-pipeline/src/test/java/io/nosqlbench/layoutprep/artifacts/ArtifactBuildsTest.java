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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ArtifactBuildsTest {

  @TempDir
  Path tempDir;

  @Test
  public void testBuildMovesTheTempFileIntoPlace() {
    Path target = tempDir.resolve("sub/artifact.h5");
    AtomicInteger builds = new AtomicInteger();
    boolean built = ArtifactBuilds.ensure(target, temp -> {
      assertThat(temp).isEqualTo(ArtifactBuilds.tempPathFor(target));
      Files.writeString(temp, "content");
      builds.incrementAndGet();
    });
    assertThat(built).isTrue();
    assertThat(target).hasContent("content");
    assertThat(ArtifactBuilds.tempPathFor(target)).doesNotExist();

    boolean rebuilt = ArtifactBuilds.ensure(target, temp -> builds.incrementAndGet());
    assertThat(rebuilt).isFalse();
    assertThat(builds).hasValue(1);
  }

  @Test
  public void testFailedBuildLeavesNothingBehind() throws IOException {
    Path target = tempDir.resolve("artifact.h5");
    assertThatThrownBy(() -> ArtifactBuilds.ensure(target, temp -> {
      Files.writeString(temp, "partial");
      throw new IOException("disk on fire");
    }))
        .isInstanceOf(ArtifactBuildException.class)
        .hasRootCauseMessage("disk on fire");
    assertThat(target).doesNotExist();
    try (var files = Files.list(tempDir)) {
      assertThat(files).isEmpty();
    }
  }

  @Test
  public void testBuildExceptionsPassThroughUnwrapped() {
    Path target = tempDir.resolve("artifact.h5");
    ArtifactBuildException failure = new ArtifactBuildException("bad input");
    assertThatThrownBy(() -> ArtifactBuilds.ensure(target, temp -> {
      throw failure;
    })).isSameAs(failure);
  }

  @Test
  public void testBuildWithoutOutputFails() {
    Path target = tempDir.resolve("artifact.h5");
    assertThatThrownBy(() -> ArtifactBuilds.ensure(target, temp -> {
    }))
        .isInstanceOf(ArtifactBuildException.class)
        .hasMessageContaining("wrote no output");
    assertThat(target).doesNotExist();
  }
}
