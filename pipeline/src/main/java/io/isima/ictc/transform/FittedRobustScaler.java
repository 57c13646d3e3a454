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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-feature center and scale learned from the training split.
 *
 * <p>A feature with scale 0 is mapped to 0 on every row.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"centering", "centers", "scales"})
public final class FittedRobustScaler implements FittedTransform {
  @JsonProperty("centering")
  private final boolean centering;

  @JsonProperty("centers")
  private final Map<String, Double> centers;

  @JsonProperty("scales")
  private final Map<String, Double> scales;

  @JsonCreator
  public FittedRobustScaler(
      @JsonProperty("centering") boolean centering,
      @JsonProperty("centers") Map<String, Double> centers,
      @JsonProperty("scales") Map<String, Double> scales) {
    this.centering = centering;
    this.centers = ImmutableMap.copyOf(centers);
    this.scales = ImmutableMap.copyOf(scales);
  }

  @Override
  public FeatureMatrix apply(FeatureMatrix matrix) {
    final var columns = new double[matrix.getFeatureCount()][];
    for (int i = 0; i < columns.length; ++i) {
      final var name = matrix.getFeatureNames().get(i);
      final Double center = centers.get(name);
      final Double scale = scales.get(name);
      Preconditions.checkArgument(
          center != null && scale != null, "feature %s was not fitted", name);
      final var values = matrix.getColumn(i);
      for (int row = 0; row < values.length; ++row) {
        values[row] = scale(values[row], center, scale);
      }
      columns[i] = values;
    }
    return matrix.withColumns(columns);
  }

  static double scale(double value, double center, double scale) {
    if (scale == 0.0) {
      return 0.0;
    }
    return (value - center) / scale;
  }
}
