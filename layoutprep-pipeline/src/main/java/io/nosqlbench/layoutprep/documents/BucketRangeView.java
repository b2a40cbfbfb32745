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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Function;

/// The documents of several buckets, one bucket at a time.
///
/// Each iterator opens a bucket's [DocumentView] when it reaches the bucket and closes it when
/// it moves past it, so a document is only usable until its iterator leaves its bucket.
/// Iterators are independent of each other. Closing this view closes the bucket views its
/// iterators still hold open.
public class BucketRangeView implements AutoCloseable, Iterable<Document> {
  private final static Logger logger = LogManager.getLogger(BucketRangeView.class);

  private final List<String> buckets;
  private final Function<String, Path> featurizedArtifactFor;
  private final Set<DocumentView> open = new LinkedHashSet<>();

  /// @param buckets
  ///     bucket names in iteration order
  /// @param featurizedArtifactFor
  ///     produces the featurized artifact of a bucket, building it if needed
  public BucketRangeView(List<String> buckets, Function<String, Path> featurizedArtifactFor) {
    this.buckets = List.copyOf(buckets);
    this.featurizedArtifactFor = featurizedArtifactFor;
  }

  /// @return the buckets of this view
  public List<String> buckets() {
    return buckets;
  }

  @Override
  public Iterator<Document> iterator() {
    return new Iterator<>() {
      private int nextBucket = 0;
      private DocumentView current;
      private Iterator<Document> inBucket = List.<Document>of().iterator();

      @Override
      public boolean hasNext() {
        while (!inBucket.hasNext()) {
          closeCurrent();
          if (nextBucket >= buckets.size()) {
            return false;
          }
          String bucket = buckets.get(nextBucket++);
          logger.debug("opening documents of bucket {}", bucket);
          current = DocumentView.open(featurizedArtifactFor.apply(bucket));
          open.add(current);
          inBucket = current.iterator();
        }
        return true;
      }

      @Override
      public Document next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return inBucket.next();
      }

      private void closeCurrent() {
        if (current != null) {
          open.remove(current);
          current.close();
          current = null;
        }
      }
    };
  }

  /// @return the number of bucket views currently open
  public int openBuckets() {
    return open.size();
  }

  @Override
  public void close() {
    List<DocumentView> views = List.copyOf(open);
    open.clear();
    for (DocumentView view : views) {
      view.close();
    }
  }
}
