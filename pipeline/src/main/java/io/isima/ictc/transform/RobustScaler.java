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

import java.util.LinkedHashMap;

/**
 * Scales features by their interquartile range over the training split, optionally centering
 * them on the median.
 */
public class RobustScaler implements FeatureTransform<FittedRobustScaler> {

  private final boolean centering;

  public RobustScaler(boolean centering) {
    this.centering = centering;
  }

  @Override
  public FittedRobustScaler fit(FeatureMatrix train) {
    final var centers = new LinkedHashMap<String, Double>();
    final var scales = new LinkedHashMap<String, Double>();
    for (int i = 0; i < train.getFeatureCount(); ++i) {
      final var name = train.getFeatureNames().get(i);
      final var values = FeatureStatistics.nonMissing(train.getColumn(i));
      if (values.length == 0) {
        centers.put(name, 0.0);
        scales.put(name, 0.0);
        continue;
      }
      final double q1 = FeatureStatistics.quantile(values, 25.0);
      final double q3 = FeatureStatistics.quantile(values, 75.0);
      centers.put(name, centering ? FeatureStatistics.median(values) : 0.0);
      scales.put(name, q3 - q1);
    }
    return new FittedRobustScaler(centering, centers, scales);
  }
}
