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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class PercentileFunctionTest {

  private final PercentileFunction fontSizes =
      PercentileFunction.fromCounts(Map.of(20.0f, 5L, 10.0f, 500L, 12.0f, 50L));

  @Test
  public void testDominantValueSitsInTheMiddleOfItsBand() {
    assertThat(fontSizes.percentile(10.0f)).isCloseTo(250.0f / 555.0f, within(1e-6f));
  }

  @Test
  public void testValuesBetweenBucketsUseTheNextBucket() {
    assertThat(fontSizes.percentile(11.0f)).isCloseTo((500.0f + 550.0f) / 2.0f / 555.0f,
        within(1e-6f));
    assertThat(fontSizes.percentile(12.0f)).isEqualTo(fontSizes.percentile(11.0f));
  }

  @Test
  public void testOutOfRangeValuesClipToTheEnds() {
    assertThat(fontSizes.percentile(1.0f)).isEqualTo(fontSizes.percentile(10.0f));
    assertThat(fontSizes.percentile(100.0f)).isCloseTo((550.0f / 555.0f + 1.0f) / 2.0f,
        within(1e-6f));
    assertThat(fontSizes.percentile(100.0f)).isLessThan(1.0f);
  }

  @Test
  public void testPercentilesAreMonotonic() {
    float[] values = {1.0f, 10.0f, 10.5f, 12.0f, 15.0f, 20.0f, 40.0f};
    float[] percentiles = fontSizes.percentiles(values);
    for (int i = 0; i < percentiles.length; i++) {
      assertThat(percentiles[i]).isBetween(0.0f, 1.0f);
      if (i > 0) {
        assertThat(percentiles[i]).isGreaterThanOrEqualTo(percentiles[i - 1]);
      }
    }
  }

  @Test
  public void testFromValuesCountsDuplicates() {
    PercentileFunction f = PercentileFunction.fromValues(new float[]{3.0f, 1.0f, 2.0f, 2.0f});
    assertThat(f.size()).isEqualTo(3);
    assertThat(f.percentile(1.0f)).isCloseTo(0.125f, within(1e-6f));
    assertThat(f.percentile(2.0f)).isCloseTo(0.5f, within(1e-6f));
    assertThat(f.percentile(3.0f)).isCloseTo(0.875f, within(1e-6f));
  }

  @Test
  public void testEmptyHistogramIsRejected() {
    assertThatThrownBy(() -> PercentileFunction.fromValues(new float[0]))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PercentileFunction.fromCounts(Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
