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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a table into train, validation and test partitions, stratified by label.
 *
 * <p>Rows of each label are shuffled with a seeded generator and cut by the configured fractions,
 * so every label is represented in every partition in proportion. A label with at least three rows
 * gets at least one row in each partition. Within a partition rows keep their original order.
 */
public class DatasetSplitter {
  private static final Logger logger = LoggerFactory.getLogger(DatasetSplitter.class);

  private final double trainFraction;
  private final double validationFraction;
  private final long seed;

  public DatasetSplitter(double trainFraction, double validationFraction, long seed) {
    Preconditions.checkArgument(
        trainFraction > 0 && validationFraction > 0 && trainFraction + validationFraction < 1.0,
        "invalid split fractions: train=%s, validation=%s",
        trainFraction,
        validationFraction);
    this.trainFraction = trainFraction;
    this.validationFraction = validationFraction;
    this.seed = seed;
  }

  /**
   * Splits a table.
   *
   * @param table the table
   * @return the partitions
   */
  public DatasetSplits split(DataTable table) {
    final var byLabel = new TreeMap<String, List<Integer>>();
    for (int row = 0; row < table.getRowCount(); ++row) {
      byLabel.computeIfAbsent(table.getLabel(row), key -> new ArrayList<>()).add(row);
    }

    final var random = new Random(seed);
    final var train = new ArrayList<Integer>();
    final var validation = new ArrayList<Integer>();
    final var test = new ArrayList<Integer>();
    for (var entry : byLabel.entrySet()) {
      final var rows = entry.getValue();
      Collections.shuffle(rows, random);
      final int[] counts = partitionSizes(rows.size());
      train.addAll(rows.subList(0, counts[0]));
      validation.addAll(rows.subList(counts[0], counts[0] + counts[1]));
      test.addAll(rows.subList(counts[0] + counts[1], rows.size()));
      logger.debug(
          "label={}, train={}, validation={}, test={}",
          entry.getKey(),
          counts[0],
          counts[1],
          counts[2]);
    }
    return new DatasetSplits(
        table.select(toSortedArray(train)),
        table.select(toSortedArray(validation)),
        table.select(toSortedArray(test)));
  }

  int[] partitionSizes(int total) {
    int train = (int) Math.round(total * trainFraction);
    int validation = (int) Math.round(total * validationFraction);
    if (total >= 3) {
      train = Math.max(train, 1);
      validation = Math.max(validation, 1);
      while (train + validation > total - 1) {
        if (train > validation) {
          --train;
        } else {
          --validation;
        }
      }
    } else {
      train = Math.min(Math.max(train, 1), total);
      validation = Math.min(validation, total - train);
    }
    return new int[] {train, validation, total - train - validation};
  }

  private static int[] toSortedArray(List<Integer> rows) {
    return rows.stream().mapToInt(Integer::intValue).sorted().toArray();
  }
}
