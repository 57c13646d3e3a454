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
package io.isima.ictc.evaluate;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Importance of one feature in the ensemble; higher means more used. */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"rank", "feature", "gain", "gainShare", "splits"})
public final class FeatureImportance {
  @JsonProperty("rank")
  private final int rank;

  @JsonProperty("feature")
  private final String feature;

  /** Total gain of the splits on this feature. */
  @JsonProperty("gain")
  private final double gain;

  /** Gain relative to the total gain of all features. */
  @JsonProperty("gainShare")
  private final double gainShare;

  @JsonProperty("splits")
  private final int splits;

  public FeatureImportance(int rank, String feature, double gain, double gainShare, int splits) {
    this.rank = rank;
    this.feature = feature;
    this.gain = gain;
    this.gainShare = gainShare;
    this.splits = splits;
  }
}
