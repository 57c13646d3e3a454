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
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Per-feature medians learned from the training split. */
@Getter
@ToString
@EqualsAndHashCode
public final class FittedMedianImputer implements FittedTransform {
  @JsonProperty("medians")
  private final Map<String, Double> medians;

  @JsonCreator
  public FittedMedianImputer(@JsonProperty("medians") Map<String, Double> medians) {
    this.medians = ImmutableMap.copyOf(medians);
  }

  @Override
  public FeatureMatrix apply(FeatureMatrix matrix) {
    final var columns = new double[matrix.getFeatureCount()][];
    for (int i = 0; i < columns.length; ++i) {
      final var name = matrix.getFeatureNames().get(i);
      final Double median = medians.get(name);
      Preconditions.checkArgument(median != null, "feature %s was not fitted", name);
      final var values = matrix.getColumn(i);
      for (int row = 0; row < values.length; ++row) {
        if (Double.isNaN(values[row])) {
          values[row] = median;
        }
      }
      columns[i] = values;
    }
    return matrix.withColumns(columns);
  }
}
