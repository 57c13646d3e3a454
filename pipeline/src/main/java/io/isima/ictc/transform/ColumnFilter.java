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

import io.isima.ictc.dataset.DataTable;
import io.isima.ictc.models.LabelSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the numeric columns of a table as features and encodes its labels.
 *
 * <p>Column types come from the declared feature schema, so the result does not depend on the
 * values of the split. The filter has no fitted state.
 */
public class ColumnFilter {
  private static final Logger logger = LoggerFactory.getLogger(ColumnFilter.class);

  /**
   * Applies the filter.
   *
   * @param table the table
   * @param labelSet label set used to encode labels
   * @return the feature matrix of the numeric columns
   */
  public FeatureMatrix apply(DataTable table, LabelSet labelSet) {
    final var names = table.getSchema().getNumericColumnNames();
    final var columns = new double[names.size()][];
    for (int i = 0; i < names.size(); ++i) {
      columns[i] = table.getNumericColumn(names.get(i));
    }
    final var labels = new int[table.getRowCount()];
    for (int row = 0; row < labels.length; ++row) {
      labels[row] = labelSet.indexOf(table.getLabel(row));
    }
    if (names.size() < table.getSchema().getColumns().size()) {
      logger.debug(
          "Dropped {} non-numeric column(s)",
          table.getSchema().getColumns().size() - names.size());
    }
    return new FeatureMatrix(names, columns, labels, table.getRowIds());
  }
}
