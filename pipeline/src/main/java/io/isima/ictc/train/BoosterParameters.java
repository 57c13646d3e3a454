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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.isima.ictc.errors.exception.InvalidConfigurationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Hyperparameters of the gradient-boosted tree ensemble. */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({
  "learningRate",
  "maxLeaves",
  "featureFraction",
  "baggingFraction",
  "patience",
  "maxRounds",
  "seed",
  "numThreads"
})
public class BoosterParameters {
  /** Shrinkage applied to each new tree. */
  @JsonProperty("learningRate")
  private double learningRate = 0.05;

  /** Maximum number of leaves per tree. */
  @JsonProperty("maxLeaves")
  private int maxLeaves = 31;

  /** Fraction of features sampled for each tree. */
  @JsonProperty("featureFraction")
  private double featureFraction = 0.8;

  /** Fraction of rows sampled for each round. */
  @JsonProperty("baggingFraction")
  private double baggingFraction = 0.8;

  /** Rounds without validation improvement before training stops. */
  @JsonProperty("patience")
  private int patience = 50;

  @JsonProperty("maxRounds")
  private int maxRounds = 1000;

  @JsonProperty("seed")
  private int seed = 42;

  /** Threads used by the boosting library; 0 lets the library decide. */
  @JsonProperty("numThreads")
  private int numThreads = 0;

  /**
   * Checks that the parameters are within their valid ranges.
   *
   * @throws InvalidConfigurationException when a parameter is out of range
   */
  public void validate() throws InvalidConfigurationException {
    if (!(learningRate > 0 && learningRate <= 1)) {
      throw new InvalidConfigurationException("learningRate must be in (0, 1]: " + learningRate);
    }
    if (maxLeaves < 2) {
      throw new InvalidConfigurationException("maxLeaves must be at least 2: " + maxLeaves);
    }
    if (!(featureFraction > 0 && featureFraction <= 1)) {
      throw new InvalidConfigurationException(
          "featureFraction must be in (0, 1]: " + featureFraction);
    }
    if (!(baggingFraction > 0 && baggingFraction <= 1)) {
      throw new InvalidConfigurationException(
          "baggingFraction must be in (0, 1]: " + baggingFraction);
    }
    if (patience < 1) {
      throw new InvalidConfigurationException("patience must be positive: " + patience);
    }
    if (maxRounds < 1) {
      throw new InvalidConfigurationException("maxRounds must be positive: " + maxRounds);
    }
    if (numThreads < 0) {
      throw new InvalidConfigurationException("numThreads must not be negative: " + numThreads);
    }
  }
}
