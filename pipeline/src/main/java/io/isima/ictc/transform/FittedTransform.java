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

/** A transform stage with learned parameters. */
public interface FittedTransform {

  /**
   * Applies the stage.
   *
   * @param matrix a matrix with every feature the stage was fitted on
   * @return the transformed matrix; the input is not modified
   */
  FeatureMatrix apply(FeatureMatrix matrix);
}
