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



import io.nosqlbench.layoutprep.CorpusFixture;
import io.nosqlbench.layoutprep.artifacts.Artifact;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.config.ModelSettings;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DataPrepPipelineTest {

  @TempDir
  Path tempDir;

  private CorpusFixture fixture;
  private ModelSettings settings;

  @BeforeEach
  public void writeCorpus() throws IOException {
    fixture = new CorpusFixture(tempDir).writeStandardCorpus();
    settings = new ModelSettings();
    settings.setPretrainedVectors(fixture.vectorsPath().toString());
  }

  @Test
  public void testWarmBuildsOnceThenReuses() {
    DataPrepPipeline pipeline =
        new DataPrepPipeline(fixture.layout(), settings);
    WarmSummary first = pipeline.warm(CorpusFixture.BUCKET);
    assertThat(first.bucket()).isEqualTo(CorpusFixture.BUCKET);
    assertThat(first.documents()).isEqualTo(1);
    assertThat(first.tokens()).isEqualTo(17);
    assertThat(first.builtStages()).isEqualTo(3);
    assertThat(first.featurizedArtifact()).exists();
    assertThat(first.summaryLine()).isEqualTo(
        "00: 1 documents, 17 tokens, 3 of 3 stages built, "
        + first.featurizedArtifact().getFileName());

    WarmSummary second =
        new DataPrepPipeline(fixture.layout(), settings)
            .warm(CorpusFixture.BUCKET);
    assertThat(second.builtStages()).isZero();
    assertThat(second.featurizedArtifact()).isEqualTo(first.featurizedArtifact());
  }

  @Test
  public void testChangedSettingsRebuildOnlyFeatures() {
    new DataPrepPipeline(fixture.layout(), settings)
        .warm(CorpusFixture.BUCKET);
    settings.setFontHashSize(64);
    WarmSummary summary = new DataPrepPipeline(fixture.layout(), settings)
        .warm(CorpusFixture.BUCKET);
    assertThat(summary.builtStages()).isEqualTo(1);
  }

  @Test
  public void testUnknownBucketIsRejected() {
    DataPrepPipeline pipeline =
        new DataPrepPipeline(fixture.layout(), settings);
    assertThatThrownBy(() -> pipeline.warm("7f"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("7f");
  }

  @Test
  public void testInvalidSettingsAreRejected() {
    settings.setFontHashSize(0);
    assertThatThrownBy(
        () -> new DataPrepPipeline(fixture.layout(), settings))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("font_hash_size");
  }

  @Test
  public void testOtherVectorsBuildAnotherFeaturizedArtifact() throws IOException {
    WarmSummary first = new DataPrepPipeline(fixture.layout(), settings)
        .warm(CorpusFixture.BUCKET);

    Path otherVectors = tempDir.resolve("other.2d.txt.gz");
    CorpusFixture.writeGzip(otherVectors, "the 0.1 0.2\nDeep 0.5 -0.5\n");
    settings.setPretrainedVectors(otherVectors.toString());
    DataPrepPipeline pipeline = new DataPrepPipeline(fixture.layout(), settings);
    WarmSummary second = pipeline.warm(CorpusFixture.BUCKET);

    assertThat(pipeline.embeddings().dimensions()).isEqualTo(3);
    assertThat(second.builtStages()).isEqualTo(1);
    assertThat(second.featurizedArtifact()).isNotEqualTo(first.featurizedArtifact());
    assertThat(first.featurizedArtifact()).exists();
  }

  @Test
  public void testLaterSettingsChangesDoNotReachThePipeline() {
    DataPrepPipeline pipeline = new DataPrepPipeline(fixture.layout(), settings);
    Path expected = pipeline.featureEngineer(CorpusFixture.BUCKET).artifactPath();

    settings.setFontHashSize(64);
    settings.setPretrainedVectors(tempDir.resolve("absent.txt.gz").toString());

    assertThat(pipeline.settings().getFontHashSize())
        .isEqualTo(ModelSettings.DEFAULT_FONT_HASH_SIZE);
    assertThat(pipeline.warm(CorpusFixture.BUCKET).featurizedArtifact()).isEqualTo(expected);
  }

  @Test
  public void testRebuildFromScratchIsRowIdentical() throws IOException {
    Path featurized = new DataPrepPipeline(fixture.layout(), settings)
        .warm(CorpusFixture.BUCKET).featurizedArtifact();
    Map<ArtifactDataset, String> before = columns(featurized);
    assertThat(before).containsKeys(
        ArtifactDataset.doc_id,
        ArtifactDataset.author_surnames,
        ArtifactDataset.page_first_token,
        ArtifactDataset.token_labels,
        ArtifactDataset.token_hashed_text_features,
        ArtifactDataset.token_scaled_numeric_features
    );

    BucketLayout bucket = fixture.bucket(CorpusFixture.BUCKET);
    Files.delete(featurized);
    Files.delete(bucket.labeledArtifact());
    Files.delete(bucket.unlabeledArtifact());

    WarmSummary rebuilt = new DataPrepPipeline(fixture.layout(), settings)
        .warm(CorpusFixture.BUCKET);
    assertThat(rebuilt.builtStages()).isEqualTo(3);
    assertThat(rebuilt.featurizedArtifact()).isEqualTo(featurized);
    assertThat(columns(featurized)).isEqualTo(before);
  }

  private static Map<ArtifactDataset, String> columns(Path path) {
    Map<ArtifactDataset, String> columns = new LinkedHashMap<>();
    try (Artifact artifact = Artifact.open(path)) {
      for (ArtifactDataset dataset : ArtifactDataset.values()) {
        if (!artifact.hasColumn(dataset)) {
          continue;
        }
        int rows = artifact.rows(dataset);
        String values;
        switch (dataset.type()) {
          case STRING:
            values = Arrays.toString(artifact.strings(dataset));
            break;
          case INT:
            values = dataset.width() == 1
                ? Arrays.toString(artifact.ints(dataset))
                : Arrays.deepToString(artifact.intRows(dataset, 0, rows));
            break;
          case FLOAT:
            values = Arrays.deepToString(artifact.floats(dataset));
            break;
          default:
            values = Arrays.toString(artifact.bytes(dataset, 0, rows));
            break;
        }
        columns.put(dataset, values);
      }
    }
    return columns;
  }
}
