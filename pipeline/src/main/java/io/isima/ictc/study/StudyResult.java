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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.isima.ictc.models.LabelSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/** Summary of a study: extraction outcome and per-window results. */
@Getter
@Setter
@ToString
@JsonPropertyOrder({"labelSet", "extractedArchives", "failedArchives", "windows"})
public class StudyResult {
  @JsonProperty("labelSet")
  private LabelSet labelSet;

  @JsonProperty("extractedArchives")
  private int extractedArchives;

  /** Failed archive name to error message. */
  @JsonProperty("failedArchives")
  private Map<String, String> failedArchives = new LinkedHashMap<>();

  @JsonProperty("windows")
  private List<WindowOutcome> windows = new ArrayList<>();

  @JsonIgnore
  public boolean isAllCompleted() {
    return failedArchives.isEmpty()
        && windows.stream().allMatch(outcome -> outcome.getStatus() == WindowStatus.COMPLETED);
  }
}
