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

import io.nosqlbench.layoutprep.artifacts.Artifact;
import io.nosqlbench.layoutprep.artifacts.ArtifactKind;
import io.nosqlbench.layoutprep.schema.DocumentDirectory;
import io.nosqlbench.layoutprep.schema.DocumentEntry;
import io.nosqlbench.layoutprep.text.GoldTextTokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/// The documents of one featurized artifact.
///
/// The view keeps the artifact, and the labeled artifact it links to, open until closed.
/// Documents and pages read their token data through those open handles, so they must not be
/// used after the view is closed.
/// ```java
/// try (DocumentView view = DocumentView.open(path)) {
///   for (Document document : view) {
///     ...
///   }
/// }
/// ```
public class DocumentView implements AutoCloseable, Iterable<Document> {
  private final static Logger logger = LogManager.getLogger(DocumentView.class);

  private final Artifact artifact;
  private final List<Document> documents;

  private DocumentView(Artifact artifact, List<Document> documents) {
    this.artifact = artifact;
    this.documents = documents;
  }

  /// @param featurizedArtifact
  ///     a featurized artifact
  /// @return a view over its documents
  public static DocumentView open(Path featurizedArtifact) {
    Artifact artifact = Artifact.open(featurizedArtifact);
    try {
      if (artifact.attributes().artifact_kind() != ArtifactKind.FEATURIZED_TOKENS) {
        throw new IllegalArgumentException(
            featurizedArtifact + " holds " + artifact.attributes().artifact_kind()
            + ", not featurized tokens");
      }
      List<Document> documents = new ArrayList<>();
      for (DocumentEntry entry : DocumentDirectory.read(artifact)) {
        List<Page> pages = new ArrayList<>(entry.pages().size());
        for (int p = 0; p < entry.pages().size(); p++) {
          pages.add(new Page(artifact, p, entry.pages().get(p)));
        }
        documents.add(new Document(
            entry.docId(),
            entry.docSha(),
            GoldTextTokenizer.trimPunctuation(entry.goldTitle()),
            entry.authors(),
            List.copyOf(pages)
        ));
      }
      logger.debug("opened {} documents from {}", documents.size(), featurizedArtifact);
      return new DocumentView(artifact, List.copyOf(documents));
    } catch (RuntimeException e) {
      artifact.close();
      throw e;
    }
  }

  /// @return the documents in storage order
  public List<Document> documents() {
    return documents;
  }

  /// @return number of documents
  public int size() {
    return documents.size();
  }

  /// @return the featurized artifact path
  public Path path() {
    return artifact.path();
  }

  @Override
  public Iterator<Document> iterator() {
    return documents.iterator();
  }

  @Override
  public void close() {
    artifact.close();
  }
}
