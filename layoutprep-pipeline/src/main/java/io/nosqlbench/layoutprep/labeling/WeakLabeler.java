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

import io.nosqlbench.layoutprep.artifacts.Artifact;
import io.nosqlbench.layoutprep.artifacts.ArtifactAttributes;
import io.nosqlbench.layoutprep.artifacts.ArtifactBuilds;
import io.nosqlbench.layoutprep.artifacts.ArtifactKind;
import io.nosqlbench.layoutprep.artifacts.ArtifactWriter;
import io.nosqlbench.layoutprep.artifacts.ByteColumn;
import io.nosqlbench.layoutprep.artifacts.FloatColumn;
import io.nosqlbench.layoutprep.artifacts.StringColumn;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.DocumentDirectory;
import io.nosqlbench.layoutprep.schema.DocumentEntry;
import io.nosqlbench.layoutprep.schema.PageEntry;
import io.nosqlbench.layoutprep.schema.TokenLabel;
import io.nosqlbench.layoutprep.tokens.TokenStoreBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/// Builds the labeled tokens artifact of a bucket by weak supervision.
///
/// For every document of the unlabeled artifact, the gold title and authors are read from its
/// reference metadata and searched for on each page with the fuzzy matcher. A document is kept
/// only when the title and every author were found; all authors must be found on one common
/// page, the smallest such page is used. Kept documents are copied with one [TokenLabel] per
/// token. Where a title match and an author match overlap, the author label wins.
public class WeakLabeler {
  private final static Logger logger = LogManager.getLogger(WeakLabeler.class);

  /// cheapest first, then larger font, then earlier
  static final Comparator<FuzzyMatch> TITLE_ORDER =
      Comparator.comparingInt(FuzzyMatch::cost)
          .thenComparing(FuzzyMatch::averageFontSize, Comparator.reverseOrder())
          .thenComparingInt(FuzzyMatch::firstToken);

  /// cheapest first, then longer text, then larger font, then earlier
  static final Comparator<FuzzyMatch> AUTHOR_ORDER =
      Comparator.comparingInt(FuzzyMatch::cost)
          .thenComparing(FuzzyMatch::matchedTextLength, Comparator.reverseOrder())
          .thenComparing(FuzzyMatch::averageFontSize, Comparator.reverseOrder())
          .thenComparingInt(FuzzyMatch::firstToken);

  private final BucketLayout bucket;
  private final TokenStoreBuilder tokenStore;

  /// @param bucket
  ///     the bucket to label
  /// @param tokenStore
  ///     the builder of the unlabeled artifact this stage reads
  public WeakLabeler(BucketLayout bucket, TokenStoreBuilder tokenStore) {
    this.bucket = bucket;
    this.tokenStore = tokenStore;
  }

  /// make sure the labeled artifact of the bucket exists, building the unlabeled one first if
  /// needed
  /// @return its path
  public Path ensure() {
    Path target = bucket.labeledArtifact();
    ArtifactBuilds.ensure(target, temp -> build(tokenStore.ensure(), temp));
    return target;
  }

  /// label the documents of an unlabeled artifact
  /// @param unlabeledPath
  ///     the unlabeled artifact
  /// @param target
  ///     the file to write
  /// @throws IOException
  ///     if reference metadata cannot be read for reasons other than a missing file
  public void build(Path unlabeledPath, Path target) throws IOException {
    ArtifactWriter writer = new ArtifactWriter(target);
    DocumentDirectory directory = DocumentDirectory.create(writer);
    StringColumn texts = writer.strings(ArtifactDataset.token_text);
    StringColumn fonts = writer.strings(ArtifactDataset.token_font);
    FloatColumn numeric = writer.floats(ArtifactDataset.token_numeric_features);
    ByteColumn labels = writer.bytes(ArtifactDataset.token_labels);

    Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
    int total = 0;
    try (Artifact unlabeled = Artifact.open(unlabeledPath)) {
      for (DocumentEntry document : DocumentDirectory.read(unlabeled)) {
        total++;
        logger.debug("Labeling {}", document.docId());
        try {
          ReferenceMetadata gold =
              ReferenceMetadata.read(bucket.referenceMetadataFor(document.docId()), document.docId());
          List<PageTokens> pages = readPages(unlabeled, document);
          DocumentMatches matches = locate(document, gold, pages);

          List<PageEntry> relocated = new ArrayList<>(pages.size());
          for (PageTokens page : pages) {
            relocated.add(page.entry().relocate(texts.rows()));
            for (int i = 0; i < page.texts().length; i++) {
              texts.append(page.texts()[i]);
              fonts.append(page.fonts()[i]);
              numeric.append(page.numeric()[i]);
            }
            labels.appendAll(matches.labelsFor(page.pageText().page(), page.texts().length,
                document.docId()));
          }
          directory.append(new DocumentEntry(
              document.docId(),
              document.docSha(),
              gold.goldTitle(),
              gold.authors(),
              relocated
          ));
        } catch (DocumentRejectedException e) {
          logger.warn(e.getMessage());
          rejections.merge(e.reason(), 1, Integer::sum);
        }
      }
    }

    logger.info(
        "labeled {} of {} documents with {} tokens in bucket {}",
        directory.documents(),
        total,
        texts.rows(),
        bucket.name()
    );
    rejections.forEach((reason, count) ->
        logger.info("  rejected {}: {}", count, reason.description()));
    writer.finish(ArtifactAttributes.of(
        ArtifactKind.LABELED_TOKENS,
        directory.documents(),
        texts.rows(),
        Optional.empty()
    ));
  }

  private List<PageTokens> readPages(Artifact unlabeled, DocumentEntry document) {
    List<PageTokens> pages = new ArrayList<>(document.pages().size());
    for (int p = 0; p < document.pages().size(); p++) {
      PageEntry entry = document.pages().get(p);
      String[] pageTexts =
          unlabeled.strings(ArtifactDataset.token_text, entry.firstToken(), entry.tokenCount());
      String[] pageFonts =
          unlabeled.strings(ArtifactDataset.token_font, entry.firstToken(), entry.tokenCount());
      float[][] pageNumeric =
          unlabeled.floats(ArtifactDataset.token_numeric_features, entry.firstToken(),
              entry.tokenCount());
      float[] fontSizes = new float[pageNumeric.length];
      for (int i = 0; i < pageNumeric.length; i++) {
        fontSizes[i] = pageNumeric[i][4];
      }
      pages.add(new PageTokens(entry, pageTexts, pageFonts, pageNumeric,
          new PageText(p, pageTexts, fontSizes)));
    }
    return pages;
  }

  /// find the title and author matches of one document
  /// @param document
  ///     the document being labeled
  /// @param gold
  ///     its reference metadata
  /// @param pages
  ///     its pages
  /// @return the chosen matches
  /// @throws DocumentRejectedException
  ///     if the authors share no page or the title is not found
  static DocumentMatches locate(DocumentEntry document, ReferenceMetadata gold, List<PageTokens> pages)
      throws DocumentRejectedException
  {
    FuzzyMatch title = null;
    List<List<FuzzyMatch>> authorMatches = new ArrayList<>();
    for (int a = 0; a < gold.authors().size(); a++) {
      authorMatches.add(new ArrayList<>());
    }

    for (PageTokens page : pages) {
      List<FuzzyMatch> titleMatches = page.pageText().find(gold.goldTitle());
      if (!titleMatches.isEmpty()) {
        FuzzyMatch best = Collections.min(titleMatches, TITLE_ORDER);
        if (title == null || best.cost() < title.cost()) {
          title = best;
        }
      }
      for (int a = 0; a < gold.authors().size(); a++) {
        for (String variant : AuthorVariants.of(gold.authors().get(a))) {
          authorMatches.get(a).addAll(page.pageText().find(variant));
        }
      }
    }

    TreeSet<Integer> commonPages = pagesOf(authorMatches.get(0));
    for (List<FuzzyMatch> matches : authorMatches.subList(1, authorMatches.size())) {
      commonPages.retainAll(pagesOf(matches));
    }
    if (commonPages.isEmpty()) {
      throw new DocumentRejectedException(
          RejectionReason.NO_COMMON_AUTHOR_PAGE,
          "Could not find all authors on one page in " + document.docId() + "; skipping doc");
    }
    int authorPage = commonPages.first();
    List<FuzzyMatch> authors = new ArrayList<>(authorMatches.size());
    for (List<FuzzyMatch> matches : authorMatches) {
      List<FuzzyMatch> onPage = matches.stream()
          .filter(m -> m.page() == authorPage)
          .collect(Collectors.toList());
      authors.add(Collections.min(onPage, AUTHOR_ORDER));
    }

    if (title == null) {
      throw new DocumentRejectedException(
          RejectionReason.TITLE_NOT_FOUND,
          "Could not find title '" + gold.goldTitle() + "' in " + document.docId()
          + "; skipping doc");
    }
    return new DocumentMatches(title, List.copyOf(authors));
  }

  private static TreeSet<Integer> pagesOf(List<FuzzyMatch> matches) {
    TreeSet<Integer> pages = new TreeSet<>();
    for (FuzzyMatch match : matches) {
      pages.add(match.page());
    }
    return pages;
  }

  /// The tokens of one unlabeled page
  record PageTokens(
      PageEntry entry,
      String[] texts,
      String[] fonts,
      float[][] numeric,
      PageText pageText
  )
  {
  }

  /// The title match and one match per gold author, in gold author order
  /// @param title
  ///     the title match
  /// @param authors
  ///     the author matches, all on the same page
  record DocumentMatches(FuzzyMatch title, List<FuzzyMatch> authors) {

    /// @param page
    ///     a page number
    /// @param tokenCount
    ///     tokens on the page
    /// @param docId
    ///     the document, for messages
    /// @return the label codes of the page's tokens
    byte[] labelsFor(int page, int tokenCount, String docId) {
      TokenLabel[] labels = new TokenLabel[tokenCount];
      Arrays.fill(labels, TokenLabel.NONE);
      boolean overlap = false;
      if (title.page() == page) {
        overlap = apply(labels, title, TokenLabel.TITLE);
      }
      for (FuzzyMatch author : authors) {
        if (author.page() == page) {
          overlap |= apply(labels, author, TokenLabel.AUTHOR);
        }
      }
      if (overlap) {
        logger.warn("title and author labels overlap on page {} of {}", page, docId);
      }
      byte[] codes = new byte[tokenCount];
      for (int i = 0; i < tokenCount; i++) {
        codes[i] = labels[i].code();
      }
      return codes;
    }

    private static boolean apply(TokenLabel[] labels, FuzzyMatch match, TokenLabel label) {
      boolean overlap = false;
      for (int i = match.firstToken(); i < match.onePastLastToken(); i++) {
        if (labels[i] != TokenLabel.NONE && labels[i] != label) {
          overlap = true;
        }
        labels[i] = labels[i].merge(label);
      }
      return overlap;
    }
  }
}
