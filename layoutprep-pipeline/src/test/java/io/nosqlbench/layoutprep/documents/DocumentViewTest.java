package io.nosqlbench.layoutprep.documents;


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
import io.nosqlbench.layoutprep.config.ModelSettings;
import io.nosqlbench.layoutprep.pipeline.DataPrepPipeline;
import io.nosqlbench.layoutprep.schema.GoldAuthor;
import io.nosqlbench.layoutprep.schema.ScaledFeature;
import io.nosqlbench.layoutprep.schema.TokenLabel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static io.nosqlbench.layoutprep.CorpusFixture.document;
import static io.nosqlbench.layoutprep.CorpusFixture.rawDocId;
import static io.nosqlbench.layoutprep.CorpusFixture.titlePage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DocumentViewTest {

  @TempDir
  Path tempDir;

  private CorpusFixture fixture;
  private DataPrepPipeline pipeline;

  @BeforeEach
  public void writeCorpus() throws IOException {
    fixture = new CorpusFixture(tempDir).writeStandardCorpus();
    ModelSettings settings = new ModelSettings();
    settings.setPretrainedVectors(fixture.vectorsPath().toString());
    pipeline = new DataPrepPipeline(fixture.layout(), settings);
  }

  @Test
  public void testDocumentsExposeEveryColumn() {
    try (DocumentView view = pipeline.documents(CorpusFixture.BUCKET)) {
      assertThat(view.size()).isEqualTo(1);
      Document document = view.documents().get(0);
      assertThat(document.docId()).isEqualTo(CorpusFixture.docId(1));
      assertThat(document.docSha()).isEqualTo(CorpusFixture.sha(1));
      assertThat(document.goldTitle()).isEqualTo(CorpusFixture.TITLE);
      assertThat(document.goldAuthors()).containsExactly(new GoldAuthor("John", "Smith"));
      assertThat(document.pages()).hasSize(2);

      Page first = document.pages().get(0);
      assertThat(first.pageNumber()).isZero();
      assertThat(first.width()).isEqualTo(612.0f);
      assertThat(first.height()).isEqualTo(792.0f);
      assertThat(first.tokenCount()).isEqualTo(11);
      assertThat(first.tokens()).startsWith("Deep", "Learning", "for", "NLP", "John", "Smith");
      assertThat(first.fonts()).startsWith("Times-Bold");
      assertThat(first.tokenHashes()).startsWith(4, 5, 3, 8, 7, 9);
      assertThat(first.fontHashes()).hasSize(11);
      assertThat(first.numericFeatures()[0]).containsExactly(50.0f, 90.0f, 60.0f, 80.0f, 20.0f,
          5.0f);
      assertThat(first.scaledNumericFeatures()).hasNumberOfRows(11);
      assertThat(first.scaledNumericFeatures()[0]).hasSize(ScaledFeature.values().length);
      assertThat(first.labels()).containsExactly(1, 1, 1, 1, 2, 2, 0, 0, 0, 0, 0);
      assertThat(first.tokenLabels()[5]).isEqualTo(TokenLabel.AUTHOR);

      Page second = document.pages().get(1);
      assertThat(second.pageNumber()).isEqualTo(1);
      assertThat(second.tokens()).containsExactly("Results", "show", "that", "deep", "networks",
          "work");
      assertThat(second.tokenLabels()).containsOnly(TokenLabel.NONE);
    }
  }

  @Test
  public void testOnlyFeaturizedArtifactsOpen() {
    pipeline.warm(CorpusFixture.BUCKET);
    Path labeled = fixture.bucket(CorpusFixture.BUCKET).labeledArtifact();
    assertThatThrownBy(() -> DocumentView.open(labeled))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("LABELED_TOKENS");
  }

  @Test
  public void testRangeViewWalksBucketsInOrder() throws IOException {
    fixture.writeTokens("01", List.of(document(rawDocId(6),
        titlePage("Sparse Attention Models", "Ann Lee"))));
    fixture.writeNxml("01", CorpusFixture.docId(6), "Sparse Attention Models",
        new String[][]{{"Ann", "Lee"}});

    List<String> shas = new ArrayList<>();
    try (BucketRangeView view = pipeline.documents(List.of("01", "00"))) {
      assertThat(view.buckets()).containsExactly("01", "00");
      for (Document document : view) {
        shas.add(document.docSha());
        assertThat(document.pages().get(0).tokens()).isNotEmpty();
      }
    }
    assertThat(shas).containsExactly(CorpusFixture.sha(6), CorpusFixture.sha(1));
  }

  @Test
  public void testInterleavedIteratorsKeepTheirOwnBuckets() throws IOException {
    fixture.writeTokens("01", List.of(document(rawDocId(6),
        titlePage("Sparse Attention Models", "Ann Lee"))));
    fixture.writeNxml("01", CorpusFixture.docId(6), "Sparse Attention Models",
        new String[][]{{"Ann", "Lee"}});

    BucketRangeView view = pipeline.documents(List.of("01", "00"));
    try (view) {
      Iterator<Document> first = view.iterator();
      Iterator<Document> second = view.iterator();
      Document fromFirst = first.next();
      Document fromSecond = second.next();
      assertThat(view.openBuckets()).isEqualTo(2);
      assertThat(fromFirst.pages().get(0).tokens()).isNotEmpty();
      assertThat(fromSecond.docSha()).isEqualTo(CorpusFixture.sha(6));

      assertThat(first.next().docSha()).isEqualTo(CorpusFixture.sha(1));
      assertThat(first.hasNext()).isFalse();
      assertThat(view.openBuckets()).isEqualTo(1);
      assertThat(fromSecond.pages().get(0).tokens()).isNotEmpty();
    }
    assertThat(view.openBuckets()).isZero();
  }

  @Test
  public void testSplits() {
    assertThat(BucketSplit.TRAIN.bucketNames()).hasSize(240).startsWith("00").endsWith("ef");
    assertThat(BucketSplit.TEST.bucketNames()).hasSize(16).startsWith("f0").endsWith("ff");
    assertThat(BucketSplit.of(0xef)).isEqualTo(BucketSplit.TRAIN);
    assertThat(BucketSplit.of(0xf0)).isEqualTo(BucketSplit.TEST);
    assertThat(BucketSplit.bucketNames(0x0a, 0x0c)).containsExactly("0a", "0b", "0c");
    assertThatThrownBy(() -> BucketSplit.of(256)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BucketSplit.bucketNames(3, 2))
        .isInstanceOf(IllegalArgumentException.class);
    try (BucketRangeView view = pipeline.documents(BucketSplit.TEST)) {
      assertThat(view.buckets()).hasSize(16);
    }
  }
}
