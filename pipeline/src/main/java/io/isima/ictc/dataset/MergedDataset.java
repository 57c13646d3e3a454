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
import io.isima.ictc.models.FeatureSchema;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.models.TimeWindow;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Benign and attack tables of one time window, concatenated into one labeled table. */
@Getter
@ToString
public final class MergedDataset {
  private final TimeWindow window;
  private final FeatureSchema schema;
  private final LabelSet labelSet;
  private final DataTable table;
  private final List<SourceTable> sources;

  public MergedDataset(
      TimeWindow window,
      FeatureSchema schema,
      LabelSet labelSet,
      DataTable table,
      List<SourceTable> sources) {
    this.window = window;
    this.schema = schema;
    this.labelSet = labelSet;
    this.table = table;
    this.sources = ImmutableList.copyOf(sources);
  }
}
