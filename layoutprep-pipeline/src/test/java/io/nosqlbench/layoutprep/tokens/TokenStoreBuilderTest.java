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

import com.google.gson.JsonObject;
import io.nosqlbench.layoutprep.CorpusFixture;
import io.nosqlbench.layoutprep.artifacts.Artifact;
import io.nosqlbench.layoutprep.artifacts.ArtifactBuildException;
import io.nosqlbench.layoutprep.artifacts.ArtifactBuilds;
import io.nosqlbench.layoutprep.artifacts.ArtifactKind;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.DocumentDirectory;
import io.nosqlbench.layoutprep.schema.DocumentEntry;
import io.nosqlbench.layoutprep.schema.PageEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static io.nosqlbench.layoutprep.CorpusFixture.bodyPage;
import static io.nosqlbench.layoutprep.CorpusFixture.document;
import static io.nosqlbench.layoutprep.CorpusFixture.rawDocId;
import static io.nosqlbench.layoutprep.CorpusFixture.sha;
import static io.nosqlbench.layoutprep.CorpusFixture.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TokenStoreBuilderTest {

  @TempDir
  Path tempDir;

  @Test
  public void testDocumentsPagesAndTokensAreStored() throws IOException {
    CorpusFixture fixture = new CorpusFixture(tempDir).writeStandardCorpus();
    BucketLayout bucket = fixture.bucket(CorpusFixture.BUCKET);
    Path path = new TokenStoreBuilder(bucket).ensure();
    assertThat(path).isEqualTo(bucket.unlabeledArtifact()).exists();

    try (Artifact artifact = Artifact.open(path)) {
      assertThat(artifact.attributes().artifact_kind()).isEqualTo(ArtifactKind.UNLABELED_TOKENS);
      List<DocumentEntry> documents = DocumentDirectory.read(artifact);
      assertThat(documents).hasSize(5);
      DocumentEntry first = documents.get(0);
      assertThat(first.docId()).isEqualTo(CorpusFixture.docId(1));
      assertThat(first.docSha()).isEqualTo(sha(1));
      assertThat(first.goldTitle()).isEmpty();
      assertThat(first.pages()).hasSize(2);

      PageEntry titlePage = first.pages().get(0);
      assertThat(titlePage.width()).isEqualTo(612.0f);
      assertThat(titlePage.firstToken()).isZero();
      assertThat(titlePage.tokenCount()).isEqualTo(11);
      assertThat(artifact.strings(ArtifactDataset.token_text, 0, 6))
          .containsExactly("Deep", "Learning", "for", "NLP", "John", "Smith");
      assertThat(artifact.strings(ArtifactDataset.token_font, 0, 1))
          .containsExactly("Times-Bold");
      assertThat(artifact.floats(ArtifactDataset.token_numeric_features, 0, 1)[0])
          .containsExactly(50.0f, 90.0f, 60.0f, 80.0f, 20.0f, 5.0f);
      assertThat(first.pages().get(1).firstToken()).isEqualTo(11);
    }
  }

  @Test
  public void testOnlyTheFirstPagesAreKept() throws IOException {
    CorpusFixture fixture = new CorpusFixture(tempDir);
    fixture.writeTokens("01", List.of(document(rawDocId(7),
        bodyPage("one"), bodyPage("two"), bodyPage("three"), bodyPage("four"), bodyPage("five"))));
    try (Artifact artifact = Artifact.open(new TokenStoreBuilder(fixture.bucket("01")).ensure())) {
      DocumentEntry entry = DocumentDirectory.read(artifact).get(0);
      assertThat(entry.pages()).hasSize(TokenStoreBuilder.MAX_PAGE_COUNT);
      assertThat(artifact.strings(ArtifactDataset.token_text))
          .containsExactly("one", "two", "three");
    }
  }

  @Test
  public void testNulCharactersAreReplaced() throws IOException {
    CorpusFixture fixture = new CorpusFixture(tempDir);
    JsonObject page = CorpusFixture.page(100.0f, 100.0f,
        token("a\u0000b", "Font\u0000X", 1.0f, 1.0f, 10.0f));
    fixture.writeTokens("01", List.of(document(rawDocId(7), page)));
    try (Artifact artifact = Artifact.open(new TokenStoreBuilder(fixture.bucket("01")).ensure())) {
      assertThat(artifact.strings(ArtifactDataset.token_text)).containsExactly("a\uFFFDb");
      assertThat(artifact.strings(ArtifactDataset.token_font)).containsExactly("Font\uFFFDX");
    }
    assertThat(TokenStoreBuilder.sanitize("plain")).isEqualTo("plain");
  }

  @Test
  public void testMalformedLinesAreSkipped() throws IOException {
    CorpusFixture fixture = new CorpusFixture(tempDir);
    String good = document(rawDocId(7), bodyPage("kept")).toString();
    String noDocId = "{\"pages\": []}";
    String incomplete = "{\"docId\": \"" + rawDocId(8) + "\", \"pages\": [{\"width\": 1,"
                        + " \"height\": 1, \"tokens\": [{\"left\": 1}]}]}";
    fixture.writeTokenLines("01", String.join("\n",
        "{not json", "", noDocId, incomplete, good, ""));
    try (Artifact artifact = Artifact.open(new TokenStoreBuilder(fixture.bucket("01")).ensure())) {
      assertThat(DocumentDirectory.read(artifact)).extracting(DocumentEntry::docSha)
          .containsExactly(sha(7));
      assertThat(artifact.attributes().token_count()).isEqualTo(1);
    }
  }

  @Test
  public void testDocumentWithoutContentHashAbortsTheBuild() throws IOException {
    CorpusFixture fixture = new CorpusFixture(tempDir);
    fixture.writeTokens("01", List.of(
        document(rawDocId(7), bodyPage("fine")),
        document("pdfs/not-a-hash/paper.pdf", bodyPage("broken"))));
    BucketLayout bucket = fixture.bucket("01");
    assertThatThrownBy(() -> new TokenStoreBuilder(bucket).ensure())
        .isInstanceOf(ArtifactBuildException.class)
        .hasMessageContaining("not-a-hash");
    assertThat(bucket.unlabeledArtifact()).doesNotExist();
    assertThat(ArtifactBuilds.tempPathFor(bucket.unlabeledArtifact())).doesNotExist();
  }

  @Test
  public void testDocIdStartsAtTheContentHash() {
    DocIdentity identity = DocIdentity.parse("s3/bucket/" + sha(3) + "/x/y.pdf");
    assertThat(identity.docSha()).isEqualTo(sha(3));
    assertThat(identity.docId()).isEqualTo(sha(3) + "/x/y.pdf");
  }
}
