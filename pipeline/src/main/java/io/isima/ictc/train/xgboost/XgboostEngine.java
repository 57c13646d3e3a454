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
import io.isima.ictc.train.BoostingEngine;
import ml.dmlc.xgboost4j.java.Booster;
import ml.dmlc.xgboost4j.java.DMatrix;
import ml.dmlc.xgboost4j.java.XGBoostError;

/** One XGBoost training session; the booster is updated in place one round at a time. */
class XgboostEngine implements BoostingEngine {
  private final Booster booster;
  private final DMatrix train;
  private final DMatrix validation;
  private final int numClasses;

  XgboostEngine(Booster booster, DMatrix train, DMatrix validation, int numClasses) {
    this.booster = booster;
    this.train = train;
    this.validation = validation;
    this.numClasses = numClasses;
  }

  @Override
  public void boostRound(int round) throws IctcException {
    try {
      // XGBoost counts iterations from 0
      booster.update(train, round - 1);
    } catch (XGBoostError e) {
      throw new IctcException(ModelError.ENGINE_FAILURE, "round " + round, e);
    }
  }

  @Override
  public double[][] predictTraining() throws IctcException {
    return predict(train);
  }

  @Override
  public double[][] predictValidation() throws IctcException {
    return predict(validation);
  }

  private double[][] predict(DMatrix matrix) throws IctcException {
    try {
      final var predictions = XgboostBackend.toDoubles(booster.predict(matrix));
      if (predictions.length > 0 && predictions[0].length != numClasses) {
        throw new IctcException(
            ModelError.ENGINE_FAILURE,
            String.format("expected %d classes, got %d", numClasses, predictions[0].length));
      }
      return predictions;
    } catch (XGBoostError e) {
      throw new IctcException(ModelError.ENGINE_FAILURE, "predicting", e);
    }
  }

  @Override
  public byte[] snapshot() throws IctcException {
    try {
      return booster.toByteArray();
    } catch (XGBoostError e) {
      throw new IctcException(ModelError.ENGINE_FAILURE, "serializing booster", e);
    }
  }

  @Override
  public void close() {
    booster.dispose();
    train.dispose();
    validation.dispose();
  }
}
