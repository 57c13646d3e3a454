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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.isima.ictc.dataset.DataTable;
import io.isima.ictc.models.LabelSet;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Fitted transform state of all stages.
 *
 * <p>The state is serialized as the transform artifact of a trained model and can be read back to
 * transform new data identically.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"featureNames", "imputer", "skewCorrector", "scaler"})
public final class FittedFeaturePipeline implements FittedTransform {
  @JsonProperty("featureNames")
  private final List<String> featureNames;

  @JsonProperty("imputer")
  private final FittedMedianImputer imputer;

  @JsonProperty("skewCorrector")
  private final FittedSkewCorrector skewCorrector;

  @JsonProperty("scaler")
  private final FittedRobustScaler scaler;

  @JsonCreator
  public FittedFeaturePipeline(
      @JsonProperty("featureNames") List<String> featureNames,
      @JsonProperty("imputer") FittedMedianImputer imputer,
      @JsonProperty("skewCorrector") FittedSkewCorrector skewCorrector,
      @JsonProperty("scaler") FittedRobustScaler scaler) {
    this.featureNames = ImmutableList.copyOf(featureNames);
    this.imputer = imputer;
    this.skewCorrector = skewCorrector;
    this.scaler = scaler;
  }

  @Override
  public FeatureMatrix apply(FeatureMatrix matrix) {
    Preconditions.checkArgument(
        matrix.getFeatureNames().equals(featureNames),
        "features %s differ from the fitted features %s",
        matrix.getFeatureNames(),
        featureNames);
    return scaler.apply(skewCorrector.apply(imputer.apply(matrix)));
  }

  /**
   * Filters columns of a table and applies all stages.
   *
   * @param table a split of the merged dataset
   * @param labelSet label set used to encode labels
   * @return the transformed matrix
   */
  public FeatureMatrix transform(DataTable table, LabelSet labelSet) {
    return apply(new ColumnFilter().apply(table, labelSet));
  }
}
