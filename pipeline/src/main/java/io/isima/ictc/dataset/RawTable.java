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

import com.google.common.collect.ImmutableList;
import io.isima.ictc.models.TimeWindow;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;

/** One sample table as read from its CSV file, before schema resolution. */
@Getter
public final class RawTable {
  private final String name;
  private final String label;
  private final TimeWindow window;
  private final List<String> header;
  private final List<String[]> rows;

  @Getter(AccessLevel.NONE)
  private final Map<String, Integer> positions;

  public RawTable(
      String name, String label, TimeWindow window, List<String> header, List<String[]> rows) {
    this.name = name;
    this.label = label;
    this.window = window;
    this.header = ImmutableList.copyOf(header);
    this.rows = rows;
    this.positions = new HashMap<>();
    for (int i = 0; i < header.size(); ++i) {
      positions.put(header.get(i), i);
    }
  }

  public int getRowCount() {
    return rows.size();
  }

  public boolean hasColumn(String column) {
    return positions.containsKey(column);
  }

  /**
   * Returns the cell of a column in a row.
   *
   * @param row row index
   * @param column column name
   * @return the cell, or null if the table has no such column
   */
  public String cell(int row, String column) {
    final Integer position = positions.get(column);
    return position == null ? null : rows.get(row)[position];
  }
}
