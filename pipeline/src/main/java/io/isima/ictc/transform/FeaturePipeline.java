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
import io.isima.ictc.errors.exception.IctcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The ordered feature transform stages: column filter, median imputation, skew correction and
 * robust scaling.
 *
 * <p>Each stage is fitted on the output of the previous stage applied to the training split.
 */
public class FeaturePipeline {
  private static final Logger logger = LoggerFactory.getLogger(FeaturePipeline.class);

  private final double skewThreshold;
  private final boolean centering;

  public FeaturePipeline(double skewThreshold, boolean centering) {
    this.skewThreshold = skewThreshold;
    this.centering = centering;
  }

  /**
   * Fits all stages on the training split.
   *
   * @param train the training split, after column filtering
   * @return the fitted pipeline
   * @throws EmptyColumnException when a feature has no value in the training split
   * @throws IctcException when a stage cannot be fitted
   */
  public FittedFeaturePipeline fit(FeatureMatrix train) throws IctcException {
    final var imputer = new MedianImputer().fit(train);
    final var imputed = imputer.apply(train);
    final var skewCorrector = new SkewCorrector(skewThreshold).fit(imputed);
    final var corrected = skewCorrector.apply(imputed);
    final var scaler = new RobustScaler(centering).fit(corrected);
    logger.info(
        "Fitted feature pipeline on {} rows: features={}, skewed={}",
        train.getRowCount(),
        train.getFeatureCount(),
        skewCorrector.getMarkedFeatures().size());
    return new FittedFeaturePipeline(train.getFeatureNames(), imputer, skewCorrector, scaler);
  }
}
