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
package io.isima.ictc.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@EqualsAndHashCode
@JsonPropertyOrder({"name", "type"})
public final class ColumnSpec {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("type")
  private final ColumnType type;

  @JsonCreator
  public ColumnSpec(@JsonProperty("name") String name, @JsonProperty("type") ColumnType type) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Column name must not be blank");
    }
    this.name = name;
    this.type = Objects.requireNonNull(type, "'type' must not be null");
  }
}
