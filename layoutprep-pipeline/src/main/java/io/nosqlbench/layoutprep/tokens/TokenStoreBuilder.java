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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.nosqlbench.layoutprep.artifacts.ArtifactAttributes;
import io.nosqlbench.layoutprep.artifacts.ArtifactBuilds;
import io.nosqlbench.layoutprep.artifacts.ArtifactKind;
import io.nosqlbench.layoutprep.artifacts.ArtifactWriter;
import io.nosqlbench.layoutprep.artifacts.FloatColumn;
import io.nosqlbench.layoutprep.artifacts.StringColumn;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.DocumentDirectory;
import io.nosqlbench.layoutprep.schema.DocumentEntry;
import io.nosqlbench.layoutprep.schema.PageEntry;
import io.nosqlbench.layoutprep.util.CompressedFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Builds the unlabeled tokens artifact of a bucket from its line delimited token dump.
///
/// Each dump line is one document. Documents keep their source order, pages are capped at
/// [#MAX_PAGE_COUNT] and tokens keep their source order inside each page. Lines which are not
/// valid documents are logged and skipped. A document id without a content hash element fails
/// the whole build.
public class TokenStoreBuilder {
  private final static Logger logger = LogManager.getLogger(TokenStoreBuilder.class);

  /// pages kept per document
  public static final int MAX_PAGE_COUNT = 3;

  private static final Gson GSON = new Gson();

  private final BucketLayout bucket;

  /// @param bucket
  ///     the bucket to build for
  public TokenStoreBuilder(BucketLayout bucket) {
    this.bucket = bucket;
  }

  /// make sure the unlabeled artifact of the bucket exists
  /// @return its path
  public Path ensure() {
    Path target = bucket.unlabeledArtifact();
    ArtifactBuilds.ensure(target, this::build);
    return target;
  }

  /// parse the token dump into an artifact at the given path
  /// @param target
  ///     the file to write
  /// @throws IOException
  ///     if the dump cannot be read
  public void build(Path target) throws IOException {
    ArtifactWriter writer = new ArtifactWriter(target);
    DocumentDirectory directory = DocumentDirectory.create(writer);
    StringColumn texts = writer.strings(ArtifactDataset.token_text);
    StringColumn fonts = writer.strings(ArtifactDataset.token_font);
    FloatColumn numeric = writer.floats(ArtifactDataset.token_numeric_features);

    Path source = bucket.tokensFile();
    int skipped = 0;
    try (BufferedReader reader = CompressedFiles.openReader(source)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        Optional<RawDocument> parsed = parse(line, source, lineNumber);
        if (parsed.isEmpty()) {
          skipped++;
          continue;
        }
        RawDocument document = parsed.get();
        DocIdentity identity = DocIdentity.parse(document.docId());

        List<RawDocument.RawPage> rawPages =
            document.pages() == null ? List.of() : document.pages();
        int pageCount = Math.min(MAX_PAGE_COUNT, rawPages.size());
        List<PageEntry> pages = new ArrayList<>(pageCount);
        for (RawDocument.RawPage page : rawPages.subList(0, pageCount)) {
          int firstToken = texts.rows();
          List<RawDocument.RawToken> tokens = page.tokens() == null ? List.of() : page.tokens();
          for (RawDocument.RawToken token : tokens) {
            texts.append(sanitize(token.text()));
            fonts.append(sanitize(token.font()));
            numeric.append(
                token.left(),
                token.right(),
                token.top(),
                token.bottom(),
                token.fontSize(),
                token.fontSpaceWidth()
            );
          }
          pages.add(new PageEntry(page.width(), page.height(), firstToken, tokens.size()));
        }
        directory.append(
            new DocumentEntry(identity.docId(), identity.docSha(), "", List.of(), pages));
        logger.debug("read {} with {} pages", identity.docId(), pages.size());
      }
    }

    logger.info(
        "read {} documents with {} tokens from {}, skipped {} lines",
        directory.documents(),
        texts.rows(),
        source,
        skipped
    );
    writer.finish(ArtifactAttributes.of(
        ArtifactKind.UNLABELED_TOKENS,
        directory.documents(),
        texts.rows(),
        Optional.empty()
    ));
  }

  private Optional<RawDocument> parse(String line, Path source, int lineNumber) {
    RawDocument document;
    try {
      document = GSON.fromJson(line, RawDocument.class);
    } catch (JsonParseException e) {
      logger.warn("skipping malformed line {}:{}: {}", source, lineNumber, e.getMessage());
      return Optional.empty();
    }
    if (document == null || document.docId() == null) {
      logger.warn("skipping line {}:{} without a docId", source, lineNumber);
      return Optional.empty();
    }
    if (document.pages() != null) {
      for (RawDocument.RawPage page : document.pages()) {
        if (page == null) {
          logger.warn("skipping line {}:{} with a null page", source, lineNumber);
          return Optional.empty();
        }
        if (page.tokens() == null) {
          continue;
        }
        for (RawDocument.RawToken token : page.tokens()) {
          if (token == null || token.text() == null || token.font() == null) {
            logger.warn("skipping line {}:{} with an incomplete token", source, lineNumber);
            return Optional.empty();
          }
        }
      }
    }
    return Optional.of(document);
  }

  static String sanitize(String text) {
    return text.replace('\0', '\uFFFD');
  }
}
