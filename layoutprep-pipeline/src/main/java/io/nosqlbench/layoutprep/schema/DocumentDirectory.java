package io.nosqlbench.layoutprep.schema;

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
import io.nosqlbench.layoutprep.artifacts.ArtifactAttributes;
import io.nosqlbench.layoutprep.artifacts.ArtifactWriter;
import io.nosqlbench.layoutprep.artifacts.FloatColumn;
import io.nosqlbench.layoutprep.artifacts.IntColumn;
import io.nosqlbench.layoutprep.artifacts.StringColumn;

import java.util.ArrayList;
import java.util.List;

/// The versioned document directory stored with every artifact: one row per document, author
/// and page, with offsets tying them together and page boundaries pointing into the token
/// columns.
public class DocumentDirectory {

  private final StringColumn docIds;
  private final StringColumn docShas;
  private final IntColumn firstPages;
  private final IntColumn pageCounts;
  private final StringColumn goldTitles;
  private final IntColumn firstAuthors;
  private final IntColumn authorCounts;
  private final StringColumn givenNames;
  private final StringColumn surnames;
  private final FloatColumn pageDimensions;
  private final IntColumn pageFirstTokens;
  private final IntColumn pageTokenCounts;
  private int documents;

  private DocumentDirectory(ArtifactWriter writer) {
    this.docIds = writer.strings(ArtifactDataset.doc_id);
    this.docShas = writer.strings(ArtifactDataset.doc_sha);
    this.firstPages = writer.ints(ArtifactDataset.doc_first_page);
    this.pageCounts = writer.ints(ArtifactDataset.doc_page_count);
    this.goldTitles = writer.strings(ArtifactDataset.gold_title);
    this.firstAuthors = writer.ints(ArtifactDataset.doc_first_author);
    this.authorCounts = writer.ints(ArtifactDataset.doc_author_count);
    this.givenNames = writer.strings(ArtifactDataset.author_given_names);
    this.surnames = writer.strings(ArtifactDataset.author_surnames);
    this.pageDimensions = writer.floats(ArtifactDataset.page_dimensions);
    this.pageFirstTokens = writer.ints(ArtifactDataset.page_first_token);
    this.pageTokenCounts = writer.ints(ArtifactDataset.page_token_count);
  }

  /// start a directory in the given artifact
  /// @param writer
  ///     the artifact being built
  /// @return an appender for document entries
  public static DocumentDirectory create(ArtifactWriter writer) {
    return new DocumentDirectory(writer);
  }

  /// append one document
  /// @param entry
  ///     the document, with page boundaries already pointing into this artifact's token rows
  public void append(DocumentEntry entry) {
    docIds.append(entry.docId());
    docShas.append(entry.docSha());
    goldTitles.append(entry.goldTitle());
    firstPages.append(pageFirstTokens.rows());
    pageCounts.append(entry.pages().size());
    firstAuthors.append(surnames.rows());
    authorCounts.append(entry.authors().size());
    for (GoldAuthor author : entry.authors()) {
      givenNames.append(author.givenNames());
      surnames.append(author.surname());
    }
    for (PageEntry page : entry.pages()) {
      pageDimensions.append(page.width(), page.height());
      pageFirstTokens.append(page.firstToken());
      pageTokenCounts.append(page.tokenCount());
    }
    documents++;
  }

  /// @return number of documents appended
  public int documents() {
    return documents;
  }

  /// read the whole directory of an artifact
  /// @param artifact
  ///     an open artifact
  /// @return the documents in storage order
  public static List<DocumentEntry> read(Artifact artifact) {
    int schemaVersion = artifact.attributes().schema_version();
    if (schemaVersion != ArtifactAttributes.SCHEMA_VERSION) {
      throw new IllegalStateException(
          "unsupported document directory schema version " + schemaVersion + " in "
          + artifact.path());
    }
    String[] ids = artifact.strings(ArtifactDataset.doc_id);
    String[] shas = artifact.strings(ArtifactDataset.doc_sha);
    String[] titles = artifact.strings(ArtifactDataset.gold_title);
    int[] firstPages = artifact.ints(ArtifactDataset.doc_first_page);
    int[] pageCounts = artifact.ints(ArtifactDataset.doc_page_count);
    int[] firstAuthors = artifact.ints(ArtifactDataset.doc_first_author);
    int[] authorCounts = artifact.ints(ArtifactDataset.doc_author_count);
    String[] givenNames = artifact.strings(ArtifactDataset.author_given_names);
    String[] surnames = artifact.strings(ArtifactDataset.author_surnames);
    float[][] dimensions = artifact.floats(ArtifactDataset.page_dimensions);
    int[] firstTokens = artifact.ints(ArtifactDataset.page_first_token);
    int[] tokenCounts = artifact.ints(ArtifactDataset.page_token_count);

    List<DocumentEntry> entries = new ArrayList<>(ids.length);
    for (int d = 0; d < ids.length; d++) {
      List<GoldAuthor> authors = new ArrayList<>(authorCounts[d]);
      for (int a = firstAuthors[d]; a < firstAuthors[d] + authorCounts[d]; a++) {
        authors.add(new GoldAuthor(givenNames[a], surnames[a]));
      }
      List<PageEntry> pages = new ArrayList<>(pageCounts[d]);
      for (int p = firstPages[d]; p < firstPages[d] + pageCounts[d]; p++) {
        pages.add(new PageEntry(dimensions[p][0], dimensions[p][1], firstTokens[p], tokenCounts[p]));
      }
      entries.add(new DocumentEntry(ids[d], shas[d], titles[d], List.copyOf(authors),
          List.copyOf(pages)));
    }
    return entries;
  }
}
