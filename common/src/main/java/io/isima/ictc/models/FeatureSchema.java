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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Explicit declaration of the columns of the sample tables.
 *
 * <p>The schema is declared once when a dataset is loaded and every table is validated against it,
 * so that column types never drift silently between time windows. The label column is declared
 * separately and is never a feature.
 */
@Getter
@ToString(exclude = "byName")
@EqualsAndHashCode(exclude = "byName")
@JsonPropertyOrder({"labelColumn", "columns"})
public final class FeatureSchema {
  @JsonProperty("labelColumn")
  private final String labelColumn;

  @JsonProperty("columns")
  private final List<ColumnSpec> columns;

  @JsonIgnore @Getter(AccessLevel.NONE) private final Map<String, ColumnSpec> byName;

  @JsonCreator
  public FeatureSchema(
      @JsonProperty("labelColumn") String labelColumn,
      @JsonProperty("columns") List<ColumnSpec> columns) {
    if (labelColumn == null || labelColumn.isBlank()) {
      throw new IllegalArgumentException("Label column must not be blank");
    }
    if (columns == null) {
      throw new IllegalArgumentException("Columns must be set");
    }
    final var map = new LinkedHashMap<String, ColumnSpec>();
    for (var column : columns) {
      if (column.getName().equals(labelColumn)) {
        throw new IllegalArgumentException(
            "Label column must not be declared as a feature column: " + labelColumn);
      }
      if (map.put(column.getName(), column) != null) {
        throw new IllegalArgumentException("Duplicate column: " + column.getName());
      }
    }
    this.labelColumn = labelColumn;
    this.columns = ImmutableList.copyOf(columns);
    this.byName = map;
  }

  @JsonIgnore
  public List<String> getColumnNames() {
    return columns.stream().map(ColumnSpec::getName).collect(Collectors.toUnmodifiableList());
  }

  @JsonIgnore
  public List<String> getNumericColumnNames() {
    return columns.stream()
        .filter(column -> column.getType() == ColumnType.NUMERIC)
        .map(ColumnSpec::getName)
        .collect(Collectors.toUnmodifiableList());
  }

  public boolean isDeclared(String columnName) {
    return byName.containsKey(columnName);
  }

  /**
   * Returns the declared type of the column.
   *
   * @param columnName the column name
   * @return the type, or null if the column is not declared
   */
  public ColumnType typeOf(String columnName) {
    final var spec = byName.get(columnName);
    return spec != null ? spec.getType() : null;
  }
}
