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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.isima.ictc.models.ColumnType;
import io.isima.ictc.models.FeatureSchema;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable column-oriented labeled table.
 *
 * <p>Numeric columns hold {@code NaN} where a value is missing; categorical columns hold null.
 * Every row carries its label and its {@link RowId}. Accessors return copies.
 */
public final class DataTable {
  private final FeatureSchema schema;
  private final Map<String, double[]> numericColumns;
  private final Map<String, String[]> categoricalColumns;
  private final String[] labels;
  private final List<RowId> rowIds;

  public DataTable(
      FeatureSchema schema,
      Map<String, double[]> numericColumns,
      Map<String, String[]> categoricalColumns,
      String[] labels,
      List<RowId> rowIds) {
    Preconditions.checkArgument(labels.length == rowIds.size(), "labels and row IDs differ");
    for (var column : schema.getColumns()) {
      final int length =
          column.getType() == ColumnType.NUMERIC
              ? numericColumns.get(column.getName()).length
              : categoricalColumns.get(column.getName()).length;
      Preconditions.checkArgument(
          length == labels.length, "column %s has %s rows", column.getName(), length);
    }
    this.schema = schema;
    this.numericColumns = numericColumns;
    this.categoricalColumns = categoricalColumns;
    this.labels = labels;
    this.rowIds = ImmutableList.copyOf(rowIds);
  }

  public FeatureSchema getSchema() {
    return schema;
  }

  public int getRowCount() {
    return labels.length;
  }

  public double[] getNumericColumn(String name) {
    final var column = numericColumns.get(name);
    Preconditions.checkArgument(column != null, "no numeric column %s", name);
    return column.clone();
  }

  public String[] getCategoricalColumn(String name) {
    final var column = categoricalColumns.get(name);
    Preconditions.checkArgument(column != null, "no categorical column %s", name);
    return column.clone();
  }

  public String[] getLabels() {
    return labels.clone();
  }

  public String getLabel(int row) {
    return labels[row];
  }

  public List<RowId> getRowIds() {
    return rowIds;
  }

  /**
   * Builds a table out of a subset of rows.
   *
   * @param rows row indexes in the order to take them
   * @return the new table
   */
  public DataTable select(int[] rows) {
    final var numeric = new HashMap<String, double[]>();
    for (var entry : numericColumns.entrySet()) {
      final var source = entry.getValue();
      final var target = new double[rows.length];
      for (int i = 0; i < rows.length; ++i) {
        target[i] = source[rows[i]];
      }
      numeric.put(entry.getKey(), target);
    }
    final var categorical = new HashMap<String, String[]>();
    for (var entry : categoricalColumns.entrySet()) {
      final var source = entry.getValue();
      final var target = new String[rows.length];
      for (int i = 0; i < rows.length; ++i) {
        target[i] = source[rows[i]];
      }
      categorical.put(entry.getKey(), target);
    }
    final var selectedLabels = new String[rows.length];
    final var selectedIds = new ArrayList<RowId>(rows.length);
    for (int i = 0; i < rows.length; ++i) {
      selectedLabels[i] = labels[rows[i]];
      selectedIds.add(rowIds.get(rows[i]));
    }
    return new DataTable(schema, numeric, categorical, selectedLabels, selectedIds);
  }

  @Override
  public String toString() {
    return String.format("DataTable{rows=%d, columns=%s}", labels.length, schema.getColumnNames());
  }
}
