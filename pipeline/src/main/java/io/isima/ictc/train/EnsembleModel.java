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

/** A loaded ensemble that predicts and reports its split statistics. */
public interface EnsembleModel extends AutoCloseable {

  /**
   * Predicts class probabilities.
   *
   * @param matrix transformed features
   * @return probabilities, one row per sample and one column per class
   * @throws IctcException when the library fails
   */
  double[][] predictProbabilities(FeatureMatrix matrix) throws IctcException;

  /**
   * Returns the split statistics of every feature, including features never used in a split.
   *
   * @return statistics in feature order
   * @throws IctcException when the library fails
   */
  List<SplitStatistics> splitStatistics() throws IctcException;

  @Override
  void close();
}
