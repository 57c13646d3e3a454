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

import io.isima.ictc.errors.exception.EmptyColumnException;
import java.util.LinkedHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Replaces missing values by the median of the feature over the training split. */
public class MedianImputer implements FeatureTransform<FittedMedianImputer> {
  private static final Logger logger = LoggerFactory.getLogger(MedianImputer.class);

  static final String STAGE = "imputation";

  @Override
  public FittedMedianImputer fit(FeatureMatrix train) throws EmptyColumnException {
    final var medians = new LinkedHashMap<String, Double>();
    for (int i = 0; i < train.getFeatureCount(); ++i) {
      final var name = train.getFeatureNames().get(i);
      final var present = FeatureStatistics.nonMissing(train.getColumn(i));
      if (present.length == 0) {
        throw new EmptyColumnException(name, STAGE);
      }
      medians.put(name, FeatureStatistics.median(present));
      if (present.length < train.getRowCount()) {
        logger.debug(
            "{}: {} missing value(s), median={}",
            name,
            train.getRowCount() - present.length,
            medians.get(name));
      }
    }
    return new FittedMedianImputer(medians);
  }
}
