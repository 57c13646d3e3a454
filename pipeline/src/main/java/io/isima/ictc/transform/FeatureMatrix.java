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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.isima.ictc.dataset.RowId;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Numeric feature values of a split together with the encoded class labels.
 *
 * <p>Values are stored column by column; a missing value is {@code NaN}. Instances are immutable:
 * transforms return new matrices and accessors return copies.
 */
public final class FeatureMatrix {
  private final List<String> featureNames;
  private final double[][] columns;
  private final int[] labels;
  private final List<RowId> rowIds;
  private final Map<String, Integer> positions;

  /**
   * Constructor.
   *
   * @param featureNames feature names, one per column
   * @param columns column values; the arrays are owned by the matrix afterwards
   * @param labels class index per row
   * @param rowIds row identity per row
   */
  public FeatureMatrix(
      List<String> featureNames, double[][] columns, int[] labels, List<RowId> rowIds) {
    Preconditions.checkArgument(featureNames.size() == columns.length, "feature count mismatch");
    Preconditions.checkArgument(labels.length == rowIds.size(), "row count mismatch");
    for (int i = 0; i < columns.length; ++i) {
      Preconditions.checkArgument(
          columns[i].length == labels.length, "column %s has wrong length", featureNames.get(i));
    }
    this.featureNames = ImmutableList.copyOf(featureNames);
    this.columns = columns;
    this.labels = labels;
    this.rowIds = ImmutableList.copyOf(rowIds);
    this.positions = new HashMap<>();
    for (int i = 0; i < featureNames.size(); ++i) {
      positions.put(featureNames.get(i), i);
    }
  }

  public List<String> getFeatureNames() {
    return featureNames;
  }

  public int getRowCount() {
    return labels.length;
  }

  public int getFeatureCount() {
    return columns.length;
  }

  public double[] getColumn(int index) {
    return columns[index].clone();
  }

  public double[] getColumn(String featureName) {
    return getColumn(indexOf(featureName));
  }

  public double get(int row, int column) {
    return columns[column][row];
  }

  public int indexOf(String featureName) {
    final Integer index = positions.get(featureName);
    Preconditions.checkArgument(index != null, "unknown feature %s", featureName);
    return index;
  }

  public int[] getLabels() {
    return labels.clone();
  }

  public int getLabel(int row) {
    return labels[row];
  }

  public List<RowId> getRowIds() {
    return rowIds;
  }

  /**
   * Builds a matrix with the same rows and features but different values.
   *
   * @param newColumns the new column values
   * @return the new matrix
   */
  public FeatureMatrix withColumns(double[][] newColumns) {
    return new FeatureMatrix(featureNames, newColumns, labels, rowIds);
  }

  /** Returns the values row by row as floats, the layout the boosting library takes. */
  public float[] toRowMajorFloats() {
    final int rows = getRowCount();
    final int width = columns.length;
    final var data = new float[rows * width];
    for (int column = 0; column < width; ++column) {
      final var values = columns[column];
      for (int row = 0; row < rows; ++row) {
        data[row * width + column] = (float) values[row];
      }
    }
    return data;
  }

  @Override
  public String toString() {
    return String.format("FeatureMatrix{rows=%d, features=%s}", getRowCount(), featureNames);
  }
}
