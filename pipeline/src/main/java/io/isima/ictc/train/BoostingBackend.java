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
package io.isima.ictc.train;

import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.transform.FeatureMatrix;
import java.util.List;

/** A gradient-boosted tree library. */
public interface BoostingBackend {

  /** Name recorded in model metadata. */
  String getName();

  /**
   * Starts a boosting session.
   *
   * @param train transformed training split
   * @param validation transformed validation split
   * @param numClasses number of classes
   * @param parameters hyperparameters
   * @return the engine; the caller closes it
   * @throws IctcException when the library cannot start
   */
  BoostingEngine start(
      FeatureMatrix train, FeatureMatrix validation, int numClasses, BoosterParameters parameters)
      throws IctcException;

  /**
   * Loads an ensemble blob.
   *
   * @param blob blob produced by {@link BoostingEngine#snapshot()}
   * @param featureNames feature names in column order
   * @param numClasses number of classes
   * @return the model; the caller closes it
   * @throws IctcException when the blob cannot be loaded
   */
  EnsembleModel load(byte[] blob, List<String> featureNames, int numClasses)
      throws IctcException;
}
