package io.nosqlbench.layoutprep.features;


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
import io.nosqlbench.layoutprep.artifacts.FloatColumn;
import io.nosqlbench.layoutprep.artifacts.IntColumn;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.config.ModelSettings;
import io.nosqlbench.layoutprep.embeddings.EmbeddingTable;
import io.nosqlbench.layoutprep.labeling.WeakLabeler;
import io.nosqlbench.layoutprep.schema.ArtifactDataset;
import io.nosqlbench.layoutprep.schema.DocumentDirectory;
import io.nosqlbench.layoutprep.schema.DocumentEntry;
import io.nosqlbench.layoutprep.schema.PageEntry;
import io.nosqlbench.layoutprep.schema.ScaledFeature;
import io.nosqlbench.layoutprep.stats.CorpusStatistics;
import io.nosqlbench.layoutprep.stats.PercentileFunction;
import io.nosqlbench.layoutprep.text.StableHash;
import io.nosqlbench.layoutprep.text.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Builds the featurized tokens artifact of a bucket from its labeled artifact.
///
/// The featurized artifact stores only the two feature columns. Its document directory and raw
/// token columns are those of the labeled artifact, re-exposed through `linked_source`, since
/// featurization neither adds nor removes pages or tokens.
///
/// Hashed text features are the embedding table index of the token text and a font bucket in
/// `[1, font_hash_size]`. Scaled numeric features follow [ScaledFeature]: each is computed in
/// [0, 1] and then shifted by [ScaledFeature#CENTERING_SHIFT].
public class FeatureEngineer {
  private final static Logger logger = LogManager.getLogger(FeatureEngineer.class);

  private static final int FEATURES = ScaledFeature.values().length;

  private final BucketLayout bucket;
  private final WeakLabeler labeler;
  private final CorpusStatistics statistics;
  private final EmbeddingTable embeddings;
  private final ModelSettings settings;

  /// @param bucket
  ///     the bucket to featurize
  /// @param labeler
  ///     the builder of the labeled artifact this stage reads
  /// @param statistics
  ///     corpus statistics for corpus percentiles
  /// @param embeddings
  ///     the embedding table for token indices
  /// @param settings
  ///     font hash size and cache key inputs
  public FeatureEngineer(
      BucketLayout bucket,
      WeakLabeler labeler,
      CorpusStatistics statistics,
      EmbeddingTable embeddings,
      ModelSettings settings
  )
  {
    this.bucket = bucket;
    this.labeler = labeler;
    this.statistics = statistics;
    this.embeddings = embeddings;
    this.settings = settings;
  }

  /// @return the path of the featurized artifact for the current settings
  public Path artifactPath() {
    return bucket.featurizedArtifact(FeaturizationKey.of(settings));
  }

  /// make sure the featurized artifact of the bucket exists, building earlier stages as needed
  /// @return its path
  public Path ensure() {
    Path target = artifactPath();
    ArtifactBuilds.ensure(target, temp -> build(labeler.ensure(), temp));
    return target;
  }

  /// compute the features of a labeled artifact
  /// @param labeledPath
  ///     the labeled artifact, which must be a sibling of the target
  /// @param target
  ///     the file to write
  /// @throws IOException
  ///     if the layout detections cannot be read
  public void build(Path labeledPath, Path target) throws IOException {
    LayoutDetections detections = LayoutDetections.load(bucket.visionFile());
    ArtifactWriter writer = new ArtifactWriter(target);
    IntColumn hashed = writer.ints(ArtifactDataset.token_hashed_text_features);
    FloatColumn scaled = writer.floats(ArtifactDataset.token_scaled_numeric_features);

    int documentCount;
    int tokenCount;
    try (Artifact labeled = Artifact.open(labeledPath)) {
      List<DocumentEntry> documents = DocumentDirectory.read(labeled);
      documentCount = documents.size();
      tokenCount = labeled.rows(ArtifactDataset.token_text);

      String[] texts = labeled.strings(ArtifactDataset.token_text);
      String[] fonts = labeled.strings(ArtifactDataset.token_font);
      Map<String, Integer> fontHashes = new HashMap<>();
      for (int t = 0; t < tokenCount; t++) {
        hashed.append(
            embeddings.indexForToken(texts[t]),
            fontHashes.computeIfAbsent(fonts[t], this::fontHash)
        );
      }

      float[][] features = new float[tokenCount][FEATURES];
      for (int t = 0; t < tokenCount; t++) {
        float[] capitalization = CapitalizationFeatures.of(texts[t]);
        System.arraycopy(capitalization, 0, features[t], ScaledFeature.FIRST_CHAR_UPPER.ordinal(),
            capitalization.length);
      }
      for (DocumentEntry document : documents) {
        logger.debug("featurizing {}", document.docId());
        featurizeDocument(labeled, document, detections, features);
      }
      for (float[] row : features) {
        for (int f = 0; f < row.length; f++) {
          row[f] += ScaledFeature.CENTERING_SHIFT;
        }
        scaled.append(row);
      }
    }

    logger.info(
        "featurized {} documents with {} tokens in bucket {}",
        documentCount,
        tokenCount,
        bucket.name()
    );
    writer.finish(ArtifactAttributes.of(
        ArtifactKind.FEATURIZED_TOKENS,
        documentCount,
        tokenCount,
        Optional.of(labeledPath.getFileName().toString())
    ));
  }

  private void featurizeDocument(
      Artifact labeled,
      DocumentEntry document,
      LayoutDetections detections,
      float[][] features
  )
  {
    int pageCount = document.pages().size();
    float[][][] numericByPage = new float[pageCount][][];
    int documentTokens = 0;
    for (int p = 0; p < pageCount; p++) {
      PageEntry page = document.pages().get(p);
      numericByPage[p] = labeled.floats(
          ArtifactDataset.token_numeric_features, page.firstToken(), page.tokenCount());
      documentTokens += page.tokenCount();
    }

    PercentileFunction documentFontSizes = null;
    PercentileFunction documentSpaceWidths = null;
    if (documentTokens > 0) {
      float[] fontSizes = new float[documentTokens];
      float[] spaceWidths = new float[documentTokens];
      int i = 0;
      for (float[][] pageNumeric : numericByPage) {
        for (float[] token : pageNumeric) {
          fontSizes[i] = token[4];
          spaceWidths[i] = token[5];
          i++;
        }
      }
      documentFontSizes = PercentileFunction.fromValues(fontSizes);
      documentSpaceWidths = PercentileFunction.fromValues(spaceWidths);
    }

    for (int p = 0; p < pageCount; p++) {
      PageEntry page = document.pages().get(p);
      List<DetectionBox> boxes = detections.boxesFor(document.docSha(), p);
      float[][] pageNumeric = numericByPage[p];
      for (int i = 0; i < pageNumeric.length; i++) {
        float[] token = pageNumeric[i];
        float[] row = features[page.firstToken() + i];
        float left = token[0];
        float right = token[1];
        float top = token[2];
        float bottom = token[3];

        row[ScaledFeature.LEFT.ordinal()] = scaleTo(left, page.width());
        row[ScaledFeature.RIGHT.ordinal()] = scaleTo(right, page.width());
        row[ScaledFeature.TOP.ordinal()] = scaleTo(top, page.height());
        row[ScaledFeature.BOTTOM.ordinal()] = scaleTo(bottom, page.height());
        row[ScaledFeature.FONT_SIZE_CORPUS_PERCENTILE.ordinal()] =
            statistics.fontSizePercentile(token[4]);
        row[ScaledFeature.SPACE_WIDTH_CORPUS_PERCENTILE.ordinal()] =
            statistics.spaceWidthPercentile(token[5]);
        row[ScaledFeature.FONT_SIZE_DOCUMENT_PERCENTILE.ordinal()] =
            documentFontSizes.percentile(token[4]);
        row[ScaledFeature.SPACE_WIDTH_DOCUMENT_PERCENTILE.ordinal()] =
            documentSpaceWidths.percentile(token[5]);

        float[] flags = BoxOverlap.flags(left, top, right, bottom, boxes);
        row[ScaledFeature.IN_TITLE_BOX.ordinal()] = flags[0];
        row[ScaledFeature.IN_AUTHOR_BOX.ordinal()] = flags[1];
      }
    }
  }

  /// @param font
  ///     a raw font name
  /// @return its hash bucket in `[1, font_hash_size]`
  int fontHash(String font) {
    long hash = StableHash.unsignedMurmur3(TextNormalizer.normalize(font));
    return (int) (hash % settings.getFontHashSize()) + 1;
  }

  /// @param coordinate
  ///     a page coordinate
  /// @param extent
  ///     page width or height
  /// @return the coordinate as a fraction of the extent, clamped to [0, 1], 0 for pages without
  ///     extent
  static float scaleTo(float coordinate, float extent) {
    if (!(extent > 0.0f)) {
      return 0.0f;
    }
    float scaled = coordinate / extent;
    if (Float.isNaN(scaled)) {
      return 0.0f;
    }
    return Math.max(0.0f, Math.min(1.0f, scaled));
  }
}
