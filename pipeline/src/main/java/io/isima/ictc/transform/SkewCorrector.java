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
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks features whose skewness over the training split exceeds a threshold. Negatively skewed
 * features are never marked.
 *
 * <p>Marked features are transformed by {@code log(1 + max(x, 0))}. Negative values are clamped to
 * zero first, which loses information for features with meaningful negative values.
 */
public class SkewCorrector implements FeatureTransform<FittedSkewCorrector> {
  private static final Logger logger = LoggerFactory.getLogger(SkewCorrector.class);

  public static final double DEFAULT_THRESHOLD = 0.75;

  private final double threshold;

  public SkewCorrector(double threshold) {
    this.threshold = threshold;
  }

  public SkewCorrector() {
    this(DEFAULT_THRESHOLD);
  }

  @Override
  public FittedSkewCorrector fit(FeatureMatrix train) {
    final var skewness = new LinkedHashMap<String, Double>();
    final var marked = new LinkedHashMap<String, Boolean>();
    for (int i = 0; i < train.getFeatureCount(); ++i) {
      final var name = train.getFeatureNames().get(i);
      final var values = FeatureStatistics.nonMissing(train.getColumn(i));
      final double skew = FeatureStatistics.skewness(values);
      // NaN never exceeds the threshold
      final boolean skewed = skew > threshold;
      skewness.put(name, skew);
      marked.put(name, skewed);
      if (skewed) {
        final long negatives = Arrays.stream(values).filter(v -> v < 0).count();
        if (negatives > 0) {
          logger.warn(
              "{}: skewness={}, {} negative value(s) will be clamped to 0 before log1p",
              name,
              skew,
              negatives);
        }
      }
    }
    logger.debug("Skewed features: {}", marked);
    return new FittedSkewCorrector(threshold, skewness, marked);
  }
}
