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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Skewness decisions learned from the training split. */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"threshold", "skewness", "marked"})
public final class FittedSkewCorrector implements FittedTransform {
  @JsonProperty("threshold")
  private final double threshold;

  /** Measured skewness per feature; NaN when it could not be measured. */
  @JsonProperty("skewness")
  private final Map<String, Double> skewness;

  @JsonProperty("marked")
  private final Map<String, Boolean> marked;

  @JsonCreator
  public FittedSkewCorrector(
      @JsonProperty("threshold") double threshold,
      @JsonProperty("skewness") Map<String, Double> skewness,
      @JsonProperty("marked") Map<String, Boolean> marked) {
    this.threshold = threshold;
    this.skewness = ImmutableMap.copyOf(skewness);
    this.marked = ImmutableMap.copyOf(marked);
  }

  @JsonIgnore
  public List<String> getMarkedFeatures() {
    return marked.entrySet().stream()
        .filter(Map.Entry::getValue)
        .map(Map.Entry::getKey)
        .collect(Collectors.toUnmodifiableList());
  }

  public boolean isMarked(String featureName) {
    return Boolean.TRUE.equals(marked.get(featureName));
  }

  @Override
  public FeatureMatrix apply(FeatureMatrix matrix) {
    final var columns = new double[matrix.getFeatureCount()][];
    for (int i = 0; i < columns.length; ++i) {
      final var name = matrix.getFeatureNames().get(i);
      Preconditions.checkArgument(marked.containsKey(name), "feature %s was not fitted", name);
      final var values = matrix.getColumn(i);
      if (isMarked(name)) {
        for (int row = 0; row < values.length; ++row) {
          values[row] = correct(values[row]);
        }
      }
      columns[i] = values;
    }
    return matrix.withColumns(columns);
  }

  static double correct(double value) {
    if (Double.isNaN(value)) {
      return value;
    }
    return Math.log1p(Math.max(value, 0.0));
  }
}
