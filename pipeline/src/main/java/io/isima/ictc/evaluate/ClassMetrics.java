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

/** Precision, recall, F1 and support of one class. */
@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"label", "precision", "recall", "f1", "support"})
public final class ClassMetrics {
  @JsonProperty("label")
  private final String label;

  @JsonProperty("precision")
  private final double precision;

  @JsonProperty("recall")
  private final double recall;

  @JsonProperty("f1")
  private final double f1;

  @JsonProperty("support")
  private final int support;

  public ClassMetrics(String label, double precision, double recall, double f1, int support) {
    this.label = label;
    this.precision = precision;
    this.recall = recall;
    this.f1 = f1;
    this.support = support;
  }
}
