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

import io.isima.ictc.errors.exception.IctcException;

/**
 * A stateful transform stage.
 *
 * <p>{@link #fit} learns parameters from the training split only. The returned {@link
 * FittedTransform} applies those parameters to any split and never changes them.
 *
 * @param <T> type of the fitted transform
 */
public interface FeatureTransform<T extends FittedTransform> {

  /**
   * Learns the parameters of the stage.
   *
   * @param train the training split
   * @return the fitted stage
   * @throws IctcException when the parameters cannot be learned from the split
   */
  T fit(FeatureMatrix train) throws IctcException;
}
