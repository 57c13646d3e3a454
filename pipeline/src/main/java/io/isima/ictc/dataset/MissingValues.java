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

import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/** Recognizes missing-value markers in table cells. */
public final class MissingValues {

  private static final Set<String> MARKERS = Set.of("", "nan", "na", "n/a", "null");

  private static final Set<String> NON_FINITE =
      Set.of("inf", "+inf", "-inf", "infinity", "+infinity", "-infinity");

  private MissingValues() {}

  /**
   * Tells whether a cell is a missing-value marker.
   *
   * @param cell the cell text, may be null
   * @return true for null, empty, NaN, nan, NA, N/A, null and non-finite number literals
   */
  public static boolean isMissing(String cell) {
    if (StringUtils.isBlank(cell)) {
      return true;
    }
    final var normalized = cell.trim().toLowerCase();
    return MARKERS.contains(normalized) || NON_FINITE.contains(normalized);
  }

  /**
   * Parses a numeric cell.
   *
   * @param cell the cell text
   * @return the value, or NaN when the cell is missing or not finite
   * @throws NumberFormatException when the cell is neither missing nor a number
   */
  public static double parseNumeric(String cell) {
    if (isMissing(cell)) {
      return Double.NaN;
    }
    final double value = Double.parseDouble(cell.trim());
    return Double.isFinite(value) ? value : Double.NaN;
  }

  /**
   * Tells whether a cell can be read as a numeric value, missing included.
   *
   * @param cell the cell text
   * @return true if {@link #parseNumeric(String)} accepts it
   */
  public static boolean isNumeric(String cell) {
    try {
      parseNumeric(cell);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }
}
