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

import lombok.Getter;
import lombok.ToString;

/** Disjoint train, validation and test partitions of a merged table. */
@Getter
@ToString
public final class DatasetSplits {
  private final DataTable train;
  private final DataTable validation;
  private final DataTable test;

  public DatasetSplits(DataTable train, DataTable validation, DataTable test) {
    this.train = train;
    this.validation = validation;
    this.test = test;
  }
}
