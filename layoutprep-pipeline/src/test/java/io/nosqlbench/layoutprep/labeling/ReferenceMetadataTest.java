package io.nosqlbench.layoutprep.labeling;


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



import io.nosqlbench.layoutprep.schema.GoldAuthor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReferenceMetadataTest {

  @TempDir
  Path tempDir;

  private static String article(String articleMeta) {
    return """
        <?xml version="1.0" encoding="UTF-8"?>
        <article><front><article-meta>%s</article-meta></front></article>
        """.formatted(articleMeta);
  }

  private static String author(String given, String surname) {
    return "<contrib contrib-type=\"author\"><name><surname>" + surname
           + "</surname><given-names>" + given + "</given-names></name></contrib>";
  }

  private static RejectionReason rejection(String xml) {
    try {
      ReferenceMetadata.parse(xml, "doc");
    } catch (DocumentRejectedException e) {
      return e.reason();
    }
    throw new AssertionError("document was not rejected");
  }

  @Test
  public void testTitleAndAuthorsAreTokenized() throws DocumentRejectedException {
    ReferenceMetadata metadata = ReferenceMetadata.parse(article(
        "<title-group><article-title>On <italic>E. coli</italic> Growth.</article-title>"
        + "</title-group><contrib-group>" + author("Jean-Paul", "Sartre")
        + author("Ann", "O'Neil")
        + "<contrib contrib-type=\"editor\"><name><surname>Ed</surname></name></contrib>"
        + "</contrib-group>"), "doc");
    assertThat(metadata.goldTitle()).isEqualTo("On E . coli Growth");
    assertThat(metadata.authors()).containsExactly(
        new GoldAuthor("Jean - Paul", "Sartre"),
        new GoldAuthor("Ann", "O ' Neil"));
  }

  @Test
  public void testTitleChecks() {
    String authors = "<contrib-group>" + author("Bo", "Chen") + "</contrib-group>";
    assertThat(rejection(article(authors))).isEqualTo(RejectionReason.TITLE_COUNT);
    assertThat(rejection(article(
        "<title-group><article-title>One title</article-title>"
        + "<article-title>Two titles</article-title></title-group>" + authors)))
        .isEqualTo(RejectionReason.TITLE_COUNT);
    assertThat(rejection(article(
        "<title-group><article-title>AI.</article-title></title-group>" + authors)))
        .isEqualTo(RejectionReason.SHORT_TITLE);
  }

  @Test
  public void testAuthorChecks() {
    String title = "<title-group><article-title>A Proper Title</article-title></title-group>";
    assertThat(rejection(article(title + "<contrib-group><contrib contrib-type=\"editor\">"
                                 + "<name><surname>Ed</surname></name></contrib></contrib-group>")))
        .isEqualTo(RejectionReason.NO_AUTHORS);
    assertThat(rejection(article(title + "<contrib-group>" + author("Bo", "Chen")
                                 + "<contrib contrib-type=\"author\"><name><given-names>Nobody"
                                 + "</given-names></name></contrib></contrib-group>")))
        .isEqualTo(RejectionReason.AUTHOR_COUNT_MISMATCH);
  }

  @Test
  public void testMissingAndUndecodableFiles() throws IOException {
    assertThatThrownBy(() -> ReferenceMetadata.read(tempDir.resolve("absent.nxml"), "doc"))
        .isInstanceOfSatisfying(DocumentRejectedException.class,
            e -> assertThat(e.reason()).isEqualTo(RejectionReason.MISSING_METADATA));

    Path latin1 = tempDir.resolve("latin1.nxml");
    Files.write(latin1, new byte[]{'<', 'a', '>', (byte) 0xe9, '<', '/', 'a', '>'});
    assertThatThrownBy(() -> ReferenceMetadata.read(latin1, "doc"))
        .isInstanceOfSatisfying(DocumentRejectedException.class,
            e -> assertThat(e.reason()).isEqualTo(RejectionReason.UNDECODABLE_METADATA));
  }
}
