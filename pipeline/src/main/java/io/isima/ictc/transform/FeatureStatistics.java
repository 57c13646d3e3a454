/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.ictc.transform;

import java.util.Arrays;
import org.apache.commons.math3.stat.descriptive.moment.Skewness;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/** Order statistics and moments over feature columns. */
final class FeatureStatistics {

  private FeatureStatistics() {}

  /** Returns the values that are not NaN. */
  static double[] nonMissing(double[] values) {
    return Arrays.stream(values).filter(value -> !Double.isNaN(value)).toArray();
  }

  /**
   * Quantile with linear interpolation between closest ranks.
   *
   * @param values values without NaN, at least one
   * @param percent percentile in (0, 100]
   * @return the quantile
   */
  static double quantile(double[] values, double percent) {
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percent);
  }

  static double median(double[] values) {
    return quantile(values, 50.0);
  }

  /**
   * Bias-corrected sample skewness.
   *
   * @param values values without NaN
   * @return the skewness, 0 for constant values, NaN for fewer than three values
   */
  static double skewness(double[] values) {
    return new Skewness().evaluate(values);
  }
}
