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

import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Identity of a row: the table it was read from and its index within that table. */
@Getter
@EqualsAndHashCode
public final class RowId {
  private final String sourceTable;
  private final int index;

  public RowId(String sourceTable, int index) {
    this.sourceTable = sourceTable;
    this.index = index;
  }

  @Override
  public String toString() {
    return sourceTable + "#" + index;
  }
}
