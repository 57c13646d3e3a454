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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Total gain and number of splits of a feature over all trees of an ensemble. */
@Getter
@ToString
@EqualsAndHashCode
public final class SplitStatistics {
  private final String featureName;
  private final double gain;
  private final int splits;

  public SplitStatistics(String featureName, double gain, int splits) {
    this.featureName = featureName;
    this.gain = gain;
    this.splits = splits;
  }
}
