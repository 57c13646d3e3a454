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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.models.LabelSet;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * An immutable trained ensemble: the opaque blob of the boosting library and its metadata.
 *
 * <p>The blob holds the ensemble as of {@link #getBestRound()}, which may be earlier than the last
 * round trained.
 */
@Getter
@ToString(exclude = "blob")
@JsonPropertyOrder({
  "backend",
  "labelSet",
  "featureNames",
  "parameters",
  "bestRound",
  "roundsTrained",
  "bestValidationLoss",
  "history"
})
public final class TrainedEnsemble {
  @JsonIgnore private final byte[] blob;

  @JsonProperty("backend")
  private final String backend;

  @JsonProperty("labelSet")
  private final LabelSet labelSet;

  @JsonProperty("featureNames")
  private final List<String> featureNames;

  @JsonProperty("parameters")
  private final BoosterParameters parameters;

  @JsonProperty("bestRound")
  private final int bestRound;

  @JsonProperty("roundsTrained")
  private final int roundsTrained;

  @JsonProperty("bestValidationLoss")
  private final double bestValidationLoss;

  @JsonProperty("history")
  private final List<RoundMetrics> history;

  public TrainedEnsemble(
      byte[] blob,
      String backend,
      LabelSet labelSet,
      List<String> featureNames,
      BoosterParameters parameters,
      int bestRound,
      int roundsTrained,
      double bestValidationLoss,
      List<RoundMetrics> history) {
    this.blob = blob.clone();
    this.backend = backend;
    this.labelSet = labelSet;
    this.featureNames = ImmutableList.copyOf(featureNames);
    this.parameters = parameters;
    this.bestRound = bestRound;
    this.roundsTrained = roundsTrained;
    this.bestValidationLoss = bestValidationLoss;
    this.history = ImmutableList.copyOf(history);
  }

  public byte[] getBlob() {
    return blob.clone();
  }

  /**
   * Loads the ensemble for prediction.
   *
   * @param backend the backend that trained it
   * @return the model; the caller closes it
   * @throws IctcException when the blob cannot be loaded
   */
  public EnsembleModel open(BoostingBackend backend) throws IctcException {
    return backend.load(blob, featureNames, labelSet.size());
  }
}
