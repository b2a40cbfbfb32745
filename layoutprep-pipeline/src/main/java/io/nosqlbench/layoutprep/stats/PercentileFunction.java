package io.nosqlbench.layoutprep.stats;

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

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/// Maps a measurement to its fractional rank within a histogram.
///
/// The cumulative histogram has a 0 prepended and the bucket values have negative infinity
/// prepended. A query finds the first bucket whose value is at least the queried value, clipped
/// to the real buckets, and returns the mean of the cumulative fraction through that bucket and
/// the one before it. A value that dominates the histogram therefore lands in the middle of its
/// rank band instead of at 1.0.
public class PercentileFunction {

  private final float[] cumulativeValues;
  private final double[] cumulativeFractions;

  private PercentileFunction(float[] sortedValues, double[] counts) {
    if (sortedValues.length == 0) {
      throw new IllegalArgumentException("a percentile function needs at least one value");
    }
    this.cumulativeValues = new float[sortedValues.length + 1];
    this.cumulativeFractions = new double[sortedValues.length + 1];
    cumulativeValues[0] = Float.NEGATIVE_INFINITY;
    double total = 0.0d;
    for (int i = 0; i < sortedValues.length; i++) {
      if (i > 0 && sortedValues[i] < sortedValues[i - 1]) {
        throw new IllegalArgumentException("histogram values must be sorted");
      }
      total += counts[i];
      cumulativeValues[i + 1] = sortedValues[i];
      cumulativeFractions[i + 1] = total;
    }
    if (total <= 0.0d) {
      throw new IllegalArgumentException("histogram counts must add up to more than 0");
    }
    for (int i = 1; i < cumulativeFractions.length; i++) {
      cumulativeFractions[i] /= total;
    }
  }

  /// @param counts
  ///     histogram of value to count
  /// @return the percentile function of the histogram
  public static PercentileFunction fromCounts(Map<Float, ? extends Number> counts) {
    TreeMap<Float, Number> sorted = new TreeMap<>();
    counts.forEach(sorted::put);
    float[] values = new float[sorted.size()];
    double[] weights = new double[sorted.size()];
    int i = 0;
    for (Map.Entry<Float, Number> entry : sorted.entrySet()) {
      values[i] = entry.getKey();
      weights[i] = entry.getValue().doubleValue();
      i++;
    }
    return new PercentileFunction(values, weights);
  }

  /// @param samples
  ///     raw measurements, in any order
  /// @return the percentile function of their histogram
  public static PercentileFunction fromValues(float[] samples) {
    float[] sorted = Arrays.copyOf(samples, samples.length);
    Arrays.sort(sorted);
    float[] values = new float[sorted.length];
    double[] counts = new double[sorted.length];
    int distinct = 0;
    for (int i = 0; i < sorted.length; i++) {
      if (distinct > 0 && Float.compare(values[distinct - 1], sorted[i]) == 0) {
        counts[distinct - 1]++;
      } else {
        values[distinct] = sorted[i];
        counts[distinct] = 1;
        distinct++;
      }
    }
    return new PercentileFunction(
        Arrays.copyOf(values, distinct),
        Arrays.copyOf(counts, distinct)
    );
  }

  /// @param value
  ///     a measurement
  /// @return its percentile in [0, 1]
  public float percentile(float value) {
    int index = searchLeft(value);
    index = Math.max(1, Math.min(index, cumulativeValues.length - 1));
    return (float) ((cumulativeFractions[index] + cumulativeFractions[index - 1]) / 2.0d);
  }

  /// @param values
  ///     measurements
  /// @return their percentiles, in the same order
  public float[] percentiles(float[] values) {
    float[] result = new float[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = percentile(values[i]);
    }
    return result;
  }

  /// @return the number of distinct histogram values
  public int size() {
    return cumulativeValues.length - 1;
  }

  private int searchLeft(float value) {
    int low = 0;
    int high = cumulativeValues.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (cumulativeValues[mid] < value) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
}
