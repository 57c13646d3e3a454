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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.isima.ictc.models.TimeWindow;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Evaluation of a trained ensemble on the test split.
 *
 * <p>The confusion matrix is indexed by true class, then predicted class, both in label set order.
 */
@Getter
@ToString
@JsonPropertyOrder({
  "window",
  "labels",
  "metrics",
  "classes",
  "confusionMatrix",
  "featureImportance"
})
public final class EvaluationReport {
  public static final String ACCURACY = "accuracy";
  public static final String MACRO_PRECISION = "macro_precision";
  public static final String MACRO_RECALL = "macro_recall";
  public static final String MACRO_F1 = "macro_f1";
  public static final String WEIGHTED_F1 = "weighted_f1";
  public static final String LOG_LOSS = "log_loss";
  public static final String SAMPLES = "samples";

  @JsonProperty("window")
  private final TimeWindow window;

  @JsonProperty("labels")
  private final List<String> labels;

  @JsonProperty("metrics")
  private final Map<String, Double> metrics;

  @JsonProperty("classes")
  private final List<ClassMetrics> classes;

  @JsonProperty("confusionMatrix")
  private final int[][] confusionMatrix;

  @JsonProperty("featureImportance")
  private final List<FeatureImportance> featureImportance;

  public EvaluationReport(
      TimeWindow window,
      List<String> labels,
      Map<String, Double> metrics,
      List<ClassMetrics> classes,
      int[][] confusionMatrix,
      List<FeatureImportance> featureImportance) {
    this.window = window;
    this.labels = ImmutableList.copyOf(labels);
    this.metrics = ImmutableMap.copyOf(metrics);
    this.classes = ImmutableList.copyOf(classes);
    this.confusionMatrix = new int[confusionMatrix.length][];
    for (int i = 0; i < confusionMatrix.length; ++i) {
      this.confusionMatrix[i] = confusionMatrix[i].clone();
    }
    this.featureImportance = ImmutableList.copyOf(featureImportance);
  }

  public int[][] getConfusionMatrix() {
    return Arrays.stream(confusionMatrix).map(int[]::clone).toArray(int[][]::new);
  }

  @JsonIgnore
  public double getAccuracy() {
    return metrics.get(ACCURACY);
  }

  @JsonIgnore
  public double getMacroF1() {
    return metrics.get(MACRO_F1);
  }

  /**
   * Returns the metrics of a class.
   *
   * @param label class label
   * @return the metrics
   * @throws IllegalArgumentException when the label is not in the report
   */
  public ClassMetrics getClassMetrics(String label) {
    return classes.stream()
        .filter(metrics -> metrics.getLabel().equals(label))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown label: " + label));
  }
}
