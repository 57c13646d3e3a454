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
package io.isima.ictc.train.xgboost;

import io.isima.ictc.errors.ModelError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.train.EnsembleModel;
import io.isima.ictc.train.SplitStatistics;
import io.isima.ictc.transform.FeatureMatrix;
import java.util.ArrayList;
import java.util.List;
import ml.dmlc.xgboost4j.java.Booster;
import ml.dmlc.xgboost4j.java.XGBoostError;

/** A loaded XGBoost ensemble. */
class XgboostEnsembleModel implements EnsembleModel {
  private final Booster booster;
  private final List<String> featureNames;
  private final int numClasses;

  XgboostEnsembleModel(Booster booster, List<String> featureNames, int numClasses) {
    this.booster = booster;
    this.featureNames = List.copyOf(featureNames);
    this.numClasses = numClasses;
  }

  @Override
  public double[][] predictProbabilities(FeatureMatrix matrix) throws IctcException {
    if (!matrix.getFeatureNames().equals(featureNames)) {
      throw new IctcException(
          ModelError.ENGINE_FAILURE,
          String.format("features %s differ from %s", matrix.getFeatureNames(), featureNames));
    }
    try {
      final var dmatrix = XgboostBackend.toDMatrix(matrix);
      try {
        final var predictions = XgboostBackend.toDoubles(booster.predict(dmatrix));
        if (predictions.length > 0 && predictions[0].length != numClasses) {
          throw new IctcException(
              ModelError.ENGINE_FAILURE,
              String.format("expected %d classes, got %d", numClasses, predictions[0].length));
        }
        return predictions;
      } finally {
        dmatrix.dispose();
      }
    } catch (XGBoostError e) {
      throw new IctcException(ModelError.ENGINE_FAILURE, "predicting", e);
    }
  }

  @Override
  public List<SplitStatistics> splitStatistics() throws IctcException {
    final var names = featureNames.toArray(new String[0]);
    try {
      // features never used in a split are absent from both maps
      final var totalGain = booster.getScore(names, "total_gain");
      final var splitCounts = booster.getFeatureScore(names);
      final var result = new ArrayList<SplitStatistics>(names.length);
      for (String name : names) {
        final Double gain = totalGain.get(name);
        final Integer splits = splitCounts.get(name);
        result.add(
            new SplitStatistics(
                name, gain == null ? 0.0 : gain, splits == null ? 0 : splits));
      }
      return result;
    } catch (XGBoostError e) {
      throw new IctcException(ModelError.ENGINE_FAILURE, "reading feature scores", e);
    }
  }

  @Override
  public void close() {
    booster.dispose();
  }
}
