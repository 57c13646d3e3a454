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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.ictc.dataset.DataTable;
import io.isima.ictc.dataset.DatasetSplitter;
import io.isima.ictc.dataset.RowId;
import io.isima.ictc.models.ColumnSpec;
import io.isima.ictc.models.ColumnType;
import io.isima.ictc.models.FeatureSchema;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.testutils.TestTables;
import io.isima.ictc.utils.IctcObjectMapperProvider;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class FeaturePipelineTest {
  private static final LabelSet LABELS = LabelSet.of("benign", List.of("benign", "dos"));

  private static FeaturePipeline pipeline() {
    return new FeaturePipeline(SkewCorrector.DEFAULT_THRESHOLD, true);
  }

  @Test
  public void testStagesInOrder() throws Exception {
    final var train = TestTables.matrix("bytes", 1, 2, Double.NaN, 1000);
    final var fitted = pipeline().fit(train);

    // impute with 2, then log1p, then scale by the quartiles of the corrected training values
    final double a = Math.log1p(1);
    final double b = Math.log1p(2);
    final double d = Math.log1p(1000);
    final double q1 = a + 0.75 * (b - a);
    final double q3 = b + 0.25 * (d - b);
    final double iqr = q3 - q1;

    assertEquals(2.0, fitted.getImputer().getMedians().get("bytes"), 0.0);
    assertTrue(fitted.getSkewCorrector().isMarked("bytes"));
    assertEquals(b, fitted.getScaler().getCenters().get("bytes"), 1e-12);
    assertEquals(iqr, fitted.getScaler().getScales().get("bytes"), 1e-12);
    assertArrayEquals(
        new double[] {(a - b) / iqr, 0.0, 0.0, (d - b) / iqr},
        fitted.apply(train).getColumn("bytes"),
        1e-12);

    final var test = TestTables.matrix("bytes", Double.NaN, 0, -3);
    assertArrayEquals(
        new double[] {0.0, -b / iqr, -b / iqr}, fitted.apply(test).getColumn("bytes"), 1e-12);
  }

  @Test
  public void testNoLeakageFromOtherSplits() throws Exception {
    final int rows = 40;
    final var labels = new String[rows];
    final var base = new double[rows];
    final var altered = new double[rows];
    for (int i = 0; i < rows; ++i) {
      labels[i] = i % 4 == 0 ? "dos" : "benign";
      base[i] = i % 7 == 0 ? Double.NaN : i * i;
      altered[i] = base[i];
    }
    final var splitter = new DatasetSplitter(0.70, 0.15, 42);
    final var reference = splitter.split(table(labels, base));
    final var trainRows = new ArrayList<RowId>(reference.getTrain().getRowIds());
    for (int i = 0; i < rows; ++i) {
      if (!trainRows.contains(new RowId("test", i))) {
        altered[i] = 1.0e9 + i;
      }
    }
    final var changed = splitter.split(table(labels, altered));
    assertThat(changed.getTrain().getRowIds(), is(reference.getTrain().getRowIds()));

    final var mapper = IctcObjectMapperProvider.get();
    final var first =
        pipeline().fit(new ColumnFilter().apply(reference.getTrain(), LABELS));
    final var second = pipeline().fit(new ColumnFilter().apply(changed.getTrain(), LABELS));
    assertArrayEquals(mapper.writeValueAsBytes(first), mapper.writeValueAsBytes(second));
  }

  @Test
  public void testStateRoundTrip() throws Exception {
    final var columns = new LinkedHashMap<String, double[]>();
    columns.put("pkt_count", new double[] {1, 2, 2, 3, 1000, Double.NaN});
    columns.put("mean_iat", new double[] {0.1, 0.2, 0.3, 0.4, 0.5, 0.6});
    final var train = TestTables.matrix(columns);
    final var fitted = pipeline().fit(train);

    final var mapper = IctcObjectMapperProvider.get();
    final var json = mapper.writeValueAsString(fitted);
    final var restored = mapper.readValue(json, FittedFeaturePipeline.class);
    assertThat(restored, is(fitted));
    assertThat(restored.getFeatureNames(), contains("pkt_count", "mean_iat"));
    assertArrayEquals(
        fitted.apply(train).getColumn("pkt_count"),
        restored.apply(train).getColumn("pkt_count"),
        0.0);
  }

  @Test
  public void testTransformDropsCategoricalColumns() throws Exception {
    final var schema =
        new FeatureSchema(
            "label",
            List.of(
                new ColumnSpec("bytes", ColumnType.NUMERIC),
                new ColumnSpec("protocol", ColumnType.CATEGORICAL)));
    final var table =
        new DataTable(
            schema,
            Map.of("bytes", new double[] {1, 2, 3, 4}),
            Map.of("protocol", new String[] {"tcp", "udp", null, "tcp"}),
            new String[] {"benign", "dos", "benign", "dos"},
            List.of(
                new RowId("t", 0), new RowId("t", 1), new RowId("t", 2), new RowId("t", 3)));
    final var filtered = new ColumnFilter().apply(table, LABELS);
    assertThat(filtered.getFeatureNames(), contains("bytes"));
    assertArrayEquals(new int[] {0, 1, 0, 1}, filtered.getLabels());

    final var fitted = pipeline().fit(filtered);
    final var transformed = fitted.transform(table, LABELS);
    assertThat(transformed.getFeatureNames(), contains("bytes"));
    assertThat(transformed.getRowIds(), is(table.getRowIds()));
  }

  @Test
  public void testFeatureNamesMustMatch() throws Exception {
    final var fitted = pipeline().fit(TestTables.matrix("bytes", 1, 2, 3));
    assertThrows(
        IllegalArgumentException.class, () -> fitted.apply(TestTables.matrix("pkts", 1, 2, 3)));
  }

  private static DataTable table(String[] labels, double[] values) {
    final var columns = new LinkedHashMap<String, double[]>();
    columns.put("bytes", values);
    return TestTables.numericTable(labels, columns);
  }
}
