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

/**
 * A boosting session over fixed training and validation data.
 *
 * <p>The engine adds trees one round at a time; the trainer decides when to stop.
 */
public interface BoostingEngine extends AutoCloseable {

  /**
   * Adds the trees of one boosting round.
   *
   * @param round 1-based round number
   * @throws IctcException when the library fails
   */
  void boostRound(int round) throws IctcException;

  /** Class probabilities of the training rows, one row per sample. */
  double[][] predictTraining() throws IctcException;

  /** Class probabilities of the validation rows, one row per sample. */
  double[][] predictValidation() throws IctcException;

  /**
   * Serializes the ensemble as of the last completed round.
   *
   * @return the ensemble blob, loadable by the backend that created this engine
   * @throws IctcException when the library fails
   */
  byte[] snapshot() throws IctcException;

  @Override
  void close();
}
