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
package io.isima.ictc.dataset;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.ToString;

/** A table that contributed rows to a merged dataset. */
@Getter
@ToString
@JsonPropertyOrder({"name", "label", "rows"})
public final class SourceTable {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("label")
  private final String label;

  @JsonProperty("rows")
  private final int rows;

  public SourceTable(String name, String label, int rows) {
    this.name = name;
    this.label = label;
    this.rows = rows;
  }
}
