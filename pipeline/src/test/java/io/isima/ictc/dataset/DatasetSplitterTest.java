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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.ictc.testutils.TestTables;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import org.junit.Test;

public class DatasetSplitterTest {

  private static DataTable table(int benign, int dos, int mitm) {
    final int total = benign + dos + mitm;
    final var labels = new String[total];
    final var ids = new double[total];
    for (int i = 0; i < total; ++i) {
      labels[i] = i < benign ? "benign" : i < benign + dos ? "dos" : "mitm";
      ids[i] = i;
    }
    final var columns = new LinkedHashMap<String, double[]>();
    columns.put("id", ids);
    return TestTables.numericTable(labels, columns);
  }

  private static long count(DataTable table, String label) {
    return Arrays.stream(table.getLabels()).filter(label::equals).count();
  }

  @Test
  public void testStratifiedProportions() {
    final var splits = new DatasetSplitter(0.70, 0.15, 42).split(table(100, 20, 40));

    assertEquals(70, count(splits.getTrain(), "benign"));
    assertEquals(15, count(splits.getValidation(), "benign"));
    assertEquals(15, count(splits.getTest(), "benign"));
    assertEquals(14, count(splits.getTrain(), "dos"));
    assertEquals(3, count(splits.getValidation(), "dos"));
    assertEquals(3, count(splits.getTest(), "dos"));
    assertEquals(28, count(splits.getTrain(), "mitm"));
    assertEquals(6, count(splits.getValidation(), "mitm"));
    assertEquals(6, count(splits.getTest(), "mitm"));
  }

  @Test
  public void testPartitionsAreDisjointAndComplete() {
    final var table = table(37, 11, 5);
    final var splits = new DatasetSplitter(0.70, 0.15, 7).split(table);

    final var seen = new HashSet<RowId>();
    for (var part : new DataTable[] {splits.getTrain(), splits.getValidation(), splits.getTest()}) {
      for (var id : part.getRowIds()) {
        assertTrue("duplicate " + id, seen.add(id));
      }
      // rows keep their original order
      final var order = part.getNumericColumn("id");
      for (int i = 1; i < order.length; ++i) {
        assertTrue(order[i - 1] < order[i]);
      }
    }
    assertEquals(new HashSet<>(table.getRowIds()), seen);
  }

  @Test
  public void testDeterministic() {
    final var table = table(50, 30, 20);
    final var first = new DatasetSplitter(0.70, 0.15, 42).split(table);
    final var second = new DatasetSplitter(0.70, 0.15, 42).split(table);
    final var other = new DatasetSplitter(0.70, 0.15, 43).split(table);

    assertThat(second.getTrain().getRowIds(), is(first.getTrain().getRowIds()));
    assertThat(second.getTest().getRowIds(), is(first.getTest().getRowIds()));
    assertNotEquals(
        new HashSet<>(first.getTrain().getRowIds()), new HashSet<>(other.getTrain().getRowIds()));
  }

  @Test
  public void testSmallClasses() {
    final var splitter = new DatasetSplitter(0.70, 0.15, 42);
    assertArrayEquals(new int[] {1, 0, 0}, splitter.partitionSizes(1));
    assertArrayEquals(new int[] {1, 0, 1}, splitter.partitionSizes(2));
    assertArrayEquals(new int[] {1, 1, 1}, splitter.partitionSizes(3));
    assertArrayEquals(new int[] {7, 2, 1}, splitter.partitionSizes(10));

    final var splits = splitter.split(table(10, 3, 1));
    assertEquals(1, count(splits.getValidation(), "dos"));
    assertEquals(1, count(splits.getTest(), "dos"));
    assertEquals(1, count(splits.getTrain(), "mitm"));
  }

  @Test
  public void testInvalidFractions() {
    assertThrows(IllegalArgumentException.class, () -> new DatasetSplitter(0.9, 0.1, 1));
    assertThrows(IllegalArgumentException.class, () -> new DatasetSplitter(0.0, 0.1, 1));
  }
}
