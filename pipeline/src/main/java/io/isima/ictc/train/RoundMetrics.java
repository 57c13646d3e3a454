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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Metrics measured after one boosting round. */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"round", "trainingLoss", "validationLoss", "validationAccuracy"})
public final class RoundMetrics {
  @JsonProperty("round")
  private final int round;

  @JsonProperty("trainingLoss")
  private final double trainingLoss;

  @JsonProperty("validationLoss")
  private final double validationLoss;

  @JsonProperty("validationAccuracy")
  private final double validationAccuracy;

  @JsonCreator
  public RoundMetrics(
      @JsonProperty("round") int round,
      @JsonProperty("trainingLoss") double trainingLoss,
      @JsonProperty("validationLoss") double validationLoss,
      @JsonProperty("validationAccuracy") double validationAccuracy) {
    this.round = round;
    this.trainingLoss = trainingLoss;
    this.validationLoss = validationLoss;
    this.validationAccuracy = validationAccuracy;
  }

  @JsonIgnore
  public boolean isFinite() {
    return Double.isFinite(trainingLoss) && Double.isFinite(validationLoss);
  }
}
