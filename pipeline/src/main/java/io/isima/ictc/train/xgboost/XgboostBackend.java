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
import io.isima.ictc.train.BoosterParameters;
import io.isima.ictc.train.BoostingBackend;
import io.isima.ictc.train.BoostingEngine;
import io.isima.ictc.train.EnsembleModel;
import io.isima.ictc.transform.FeatureMatrix;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import ml.dmlc.xgboost4j.java.Booster;
import ml.dmlc.xgboost4j.java.DMatrix;
import ml.dmlc.xgboost4j.java.XGBoost;
import ml.dmlc.xgboost4j.java.XGBoostError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boosting backend on XGBoost.
 *
 * <p>Trees are grown leaf-wise with the histogram method so that {@code max_leaves} bounds tree
 * size, and the objective is {@code multi:softprob}. A fixed seed with the histogram method keeps
 * the result independent of the thread count.
 */
public class XgboostBackend implements BoostingBackend {
  private static final Logger logger = LoggerFactory.getLogger(XgboostBackend.class);

  public static final String NAME = "xgboost";

  @Override
  public String getName() {
    return NAME;
  }

  /**
   * Tells whether the native library can be loaded on this platform.
   *
   * @return true if a matrix can be created
   */
  public static boolean isAvailable() {
    try {
      final var probe = new DMatrix(new float[] {0.0f}, 1, 1, Float.NaN);
      probe.dispose();
      return true;
    } catch (XGBoostError | LinkageError e) {
      logger.warn("XGBoost native library is not available: {}", e.toString());
      return false;
    }
  }

  @Override
  public BoostingEngine start(
      FeatureMatrix train, FeatureMatrix validation, int numClasses, BoosterParameters parameters)
      throws IctcException {
    DMatrix trainMatrix = null;
    DMatrix validationMatrix = null;
    try {
      trainMatrix = toDMatrix(train);
      validationMatrix = toDMatrix(validation);
      final Booster booster =
          XGBoost.train(
              trainMatrix, buildParams(numClasses, parameters), 0, new HashMap<>(), null, null);
      return new XgboostEngine(booster, trainMatrix, validationMatrix, numClasses);
    } catch (XGBoostError e) {
      if (trainMatrix != null) {
        trainMatrix.dispose();
      }
      if (validationMatrix != null) {
        validationMatrix.dispose();
      }
      throw new IctcException(ModelError.ENGINE_FAILURE, "starting booster", e);
    }
  }

  @Override
  public EnsembleModel load(byte[] blob, List<String> featureNames, int numClasses)
      throws IctcException {
    try {
      final var booster = XGBoost.loadModel(new ByteArrayInputStream(blob));
      return new XgboostEnsembleModel(booster, featureNames, numClasses);
    } catch (XGBoostError | IOException e) {
      throw new IctcException(ModelError.ENGINE_FAILURE, "loading booster", e);
    }
  }

  static Map<String, Object> buildParams(int numClasses, BoosterParameters parameters) {
    final var params = new HashMap<String, Object>();
    params.put("objective", "multi:softprob");
    params.put("num_class", numClasses);
    params.put("eval_metric", "mlogloss");
    params.put("eta", parameters.getLearningRate());
    params.put("tree_method", "hist");
    params.put("grow_policy", "lossguide");
    params.put("max_depth", 0);
    params.put("max_leaves", parameters.getMaxLeaves());
    params.put("colsample_bytree", parameters.getFeatureFraction());
    params.put("subsample", parameters.getBaggingFraction());
    params.put("seed", parameters.getSeed());
    params.put("verbosity", 0);
    if (parameters.getNumThreads() > 0) {
      params.put("nthread", parameters.getNumThreads());
    }
    return params;
  }

  static DMatrix toDMatrix(FeatureMatrix matrix) throws XGBoostError {
    final var dmatrix =
        new DMatrix(
            matrix.toRowMajorFloats(), matrix.getRowCount(), matrix.getFeatureCount(), Float.NaN);
    final var labels = matrix.getLabels();
    final var floatLabels = new float[labels.length];
    for (int i = 0; i < labels.length; ++i) {
      floatLabels[i] = labels[i];
    }
    dmatrix.setLabel(floatLabels);
    return dmatrix;
  }

  static double[][] toDoubles(float[][] predictions) {
    final var result = new double[predictions.length][];
    for (int i = 0; i < predictions.length; ++i) {
      result[i] = new double[predictions[i].length];
      for (int j = 0; j < predictions[i].length; ++j) {
        result[i][j] = predictions[i][j];
      }
    }
    return result;
  }
}
