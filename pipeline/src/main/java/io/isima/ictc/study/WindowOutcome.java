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
package io.isima.ictc.study;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.isima.ictc.models.TimeWindow;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Outcome of the pipeline for one time window. */
@Getter
@Setter
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "window",
  "status",
  "rows",
  "trainRows",
  "validationRows",
  "testRows",
  "bestRound",
  "roundsTrained",
  "accuracy",
  "macroF1",
  "errorCode",
  "message"
})
public class WindowOutcome {
  @JsonProperty("window")
  private final TimeWindow window;

  @JsonProperty("status")
  private WindowStatus status;

  @JsonProperty("rows")
  private Integer rows;

  @JsonProperty("trainRows")
  private Integer trainRows;

  @JsonProperty("validationRows")
  private Integer validationRows;

  @JsonProperty("testRows")
  private Integer testRows;

  @JsonProperty("bestRound")
  private Integer bestRound;

  @JsonProperty("roundsTrained")
  private Integer roundsTrained;

  @JsonProperty("accuracy")
  private Double accuracy;

  @JsonProperty("macroF1")
  private Double macroF1;

  @JsonProperty("errorCode")
  private String errorCode;

  @JsonProperty("message")
  private String message;

  public WindowOutcome(TimeWindow window) {
    this.window = window;
  }
}
