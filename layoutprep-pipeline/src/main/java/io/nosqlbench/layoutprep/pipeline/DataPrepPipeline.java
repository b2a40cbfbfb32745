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

import io.nosqlbench.layoutprep.artifacts.Artifact;
import io.nosqlbench.layoutprep.artifacts.ArtifactAttributes;
import io.nosqlbench.layoutprep.config.BucketLayout;
import io.nosqlbench.layoutprep.config.CorpusLayout;
import io.nosqlbench.layoutprep.config.ModelSettings;
import io.nosqlbench.layoutprep.documents.BucketRangeView;
import io.nosqlbench.layoutprep.documents.BucketSplit;
import io.nosqlbench.layoutprep.documents.DocumentView;
import io.nosqlbench.layoutprep.embeddings.EmbeddingTable;
import io.nosqlbench.layoutprep.embeddings.PretrainedVectors;
import io.nosqlbench.layoutprep.features.FeatureEngineer;
import io.nosqlbench.layoutprep.labeling.WeakLabeler;
import io.nosqlbench.layoutprep.stats.CorpusStatistics;
import io.nosqlbench.layoutprep.tokens.TokenStoreBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/// Runs the three stages over the buckets of one corpus.
///
/// The pipeline owns the corpus statistics and the embedding table and hands them to every
/// stage it creates, so they are loaded at most once per pipeline and only when a stage needs
/// them. Stages are chained: asking for a bucket's featurized artifact builds the labeled and
/// unlabeled artifacts first when they are missing, and reuses them when they exist.
public class DataPrepPipeline {
  private final static Logger logger = LogManager.getLogger(DataPrepPipeline.class);

  private final CorpusLayout corpus;
  private final ModelSettings settings;
  private final CorpusStatistics statistics;
  private final EmbeddingTable embeddings;

  /// The settings are copied, so later changes to the given instance do not reach this
  /// pipeline. The embedding table loads the pretrained vectors the settings name, which keeps
  /// the featurized artifact key and the vectors in use in step.
  /// @param corpus
  ///     the corpus directory layout
  /// @param settings
  ///     model settings
  public DataPrepPipeline(CorpusLayout corpus, ModelSettings settings) {
    this.corpus = corpus;
    this.settings = ModelSettings.fromJson(settings.validate().toJson());
    this.statistics = CorpusStatistics.fromFile(corpus.statisticsFile());
    this.embeddings = new EmbeddingTable(
        statistics,
        new PretrainedVectors(Path.of(this.settings.getPretrainedVectors())),
        this.settings.getMinimumTokenFrequency()
    );
  }

  /// @return the shared corpus statistics
  public CorpusStatistics statistics() {
    return statistics;
  }

  /// @return the shared embedding table
  public EmbeddingTable embeddings() {
    return embeddings;
  }

  /// @return the settings
  public ModelSettings settings() {
    return settings;
  }

  /// @param bucket
  ///     a bucket name
  /// @return the token store builder of that bucket
  public TokenStoreBuilder tokenStore(String bucket) {
    return new TokenStoreBuilder(bucketLayout(bucket));
  }

  /// @param bucket
  ///     a bucket name
  /// @return the labeler of that bucket
  public WeakLabeler labeler(String bucket) {
    return new WeakLabeler(bucketLayout(bucket), tokenStore(bucket));
  }

  /// @param bucket
  ///     a bucket name
  /// @return the feature engineer of that bucket
  public FeatureEngineer featureEngineer(String bucket) {
    return new FeatureEngineer(bucketLayout(bucket), labeler(bucket), statistics, embeddings,
        settings);
  }

  /// @param bucket
  ///     a bucket name
  /// @return the featurized artifact of the bucket, built with its predecessors as needed
  public Path featurizedArtifact(String bucket) {
    return featureEngineer(bucket).ensure();
  }

  /// build all three artifacts of a bucket that do not exist yet
  /// @param bucket
  ///     a bucket name
  /// @return what the bucket holds now
  public WarmSummary warm(String bucket) {
    BucketLayout layout = bucketLayout(bucket);
    FeatureEngineer features = featureEngineer(bucket);
    int built = 0;
    built += missing(layout.unlabeledArtifact());
    built += missing(layout.labeledArtifact());
    built += missing(features.artifactPath());
    Path featurized = features.ensure();
    try (Artifact artifact = Artifact.open(featurized)) {
      ArtifactAttributes attributes = artifact.attributes();
      WarmSummary summary = new WarmSummary(
          bucket,
          featurized,
          attributes.document_count(),
          attributes.token_count(),
          built
      );
      logger.info(summary.summaryLine());
      return summary;
    }
  }

  /// @param bucket
  ///     a bucket name
  /// @return an open view over the bucket's documents
  public DocumentView documents(String bucket) {
    return DocumentView.open(featurizedArtifact(bucket));
  }

  /// @param split
  ///     the train or test split
  /// @return a view over every bucket of the split
  public BucketRangeView documents(BucketSplit split) {
    return documents(split.bucketNames());
  }

  /// @param buckets
  ///     bucket names
  /// @return a view over the buckets in the given order
  public BucketRangeView documents(List<String> buckets) {
    return new BucketRangeView(buckets, this::featurizedArtifact);
  }

  private BucketLayout bucketLayout(String bucket) {
    BucketLayout layout = corpus.bucket(bucket);
    if (!Files.isDirectory(layout.directory())) {
      throw new IllegalArgumentException("no bucket directory " + layout.directory());
    }
    return layout;
  }

  private static int missing(Path artifact) {
    return Files.exists(artifact) ? 0 : 1;
  }
}
