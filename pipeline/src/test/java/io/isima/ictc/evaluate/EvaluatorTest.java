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
package io.isima.ictc.evaluate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import io.isima.ictc.errors.ModelError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.models.TimeWindow;
import io.isima.ictc.testutils.ScriptedBackend;
import io.isima.ictc.testutils.TestTables;
import io.isima.ictc.train.BoosterParameters;
import io.isima.ictc.train.SplitStatistics;
import io.isima.ictc.train.TrainedEnsemble;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.Test;

public class EvaluatorTest {
  private static final LabelSet LABELS = LabelSet.of("benign", List.of("benign", "dos", "mitm"));
  private static final TimeWindow WINDOW = TimeWindow.of(2);

  private static double[][] predicting(int... predicted) {
    final var probabilities = new double[predicted.length][3];
    for (int i = 0; i < predicted.length; ++i) {
      for (int c = 0; c < 3; ++c) {
        probabilities[i][c] = c == predicted[i] ? 0.8 : 0.1;
      }
    }
    return probabilities;
  }

  @Test
  public void testMetrics() {
    final var labels = new int[] {0, 0, 0, 1, 1, 2};
    final var report =
        Evaluator.buildReport(WINDOW, LABELS, predicting(0, 0, 1, 1, 1, 0), labels, List.of());

    assertArrayEquals(
        new int[][] {{2, 1, 0}, {0, 2, 0}, {1, 0, 0}}, report.getConfusionMatrix());
    assertEquals(4.0 / 6, report.getAccuracy(), 1e-12);

    final var benign = report.getClassMetrics("benign");
    assertEquals(2.0 / 3, benign.getPrecision(), 1e-12);
    assertEquals(2.0 / 3, benign.getRecall(), 1e-12);
    assertEquals(3, benign.getSupport());
    final var dos = report.getClassMetrics("dos");
    assertEquals(2.0 / 3, dos.getPrecision(), 1e-12);
    assertEquals(1.0, dos.getRecall(), 1e-12);
    assertEquals(0.8, dos.getF1(), 1e-12);
    // never predicted
    final var mitm = report.getClassMetrics("mitm");
    assertEquals(0.0, mitm.getPrecision(), 0.0);
    assertEquals(0.0, mitm.getF1(), 0.0);
    assertEquals(1, mitm.getSupport());

    assertEquals((2.0 / 3 + 0.8) / 3, report.getMacroF1(), 1e-12);
    assertEquals(0.6, report.getMetrics().get(EvaluationReport.WEIGHTED_F1), 1e-12);
    assertEquals(
        -(4 * Math.log(0.8) + 2 * Math.log(0.1)) / 6,
        report.getMetrics().get(EvaluationReport.LOG_LOSS),
        1e-12);
    assertEquals(6.0, report.getMetrics().get(EvaluationReport.SAMPLES), 0.0);
    assertThat(report.getLabels(), contains("benign", "dos", "mitm"));
    assertThrows(IllegalArgumentException.class, () -> report.getClassMetrics("scan"));
  }

  @Test
  public void testImportanceRanking() {
    final var ranking =
        Evaluator.rankImportance(
            List.of(
                new SplitStatistics("b", 5.0, 2),
                new SplitStatistics("d", 0.0, 0),
                new SplitStatistics("a", 5.0, 2),
                new SplitStatistics("c", 5.0, 3)));

    assertThat(
        ranking.stream().map(FeatureImportance::getFeature).collect(Collectors.toList()),
        contains("c", "a", "b", "d"));
    assertEquals(1, ranking.get(0).getRank());
    assertEquals(4, ranking.get(3).getRank());
    assertEquals(1.0 / 3, ranking.get(0).getGainShare(), 1e-12);
    assertEquals(0.0, ranking.get(3).getGainShare(), 0.0);
  }

  @Test
  public void testNoGainAtAll() {
    final var ranking =
        Evaluator.rankImportance(
            List.of(new SplitStatistics("x", 0.0, 0), new SplitStatistics("y", 0.0, 0)));
    assertEquals(0.0, ranking.get(0).getGainShare(), 0.0);
    assertEquals("x", ranking.get(0).getFeature());
  }

  @Test
  public void testEvaluate() throws Exception {
    final var columns = new LinkedHashMap<String, double[]>();
    columns.put("pkt_count", new double[] {1, 2, 3, 4});
    columns.put("mean_iat", new double[] {4, 3, 2, 1});
    final var test = TestTables.matrix(columns, new int[] {0, 1, 2, 0});
    final var ensemble =
        new TrainedEnsemble(
            "round=3".getBytes(StandardCharsets.UTF_8),
            "scripted",
            LABELS,
            List.of("pkt_count", "mean_iat"),
            new BoosterParameters(),
            3,
            8,
            0.1,
            List.of());

    final var backend = ScriptedBackend.improvingUntil(1);
    final var report = new Evaluator(backend).evaluate(WINDOW, ensemble, test);
    assertEquals(WINDOW, report.getWindow());
    assertEquals(1.0, report.getAccuracy(), 0.0);
    assertEquals(1.0, report.getMacroF1(), 1e-12);
    assertThat(
        report.getFeatureImportance().stream()
            .map(FeatureImportance::getFeature)
            .collect(Collectors.toList()),
        contains("mean_iat", "pkt_count"));

    final var empty = new LinkedHashMap<String, double[]>();
    empty.put("pkt_count", new double[0]);
    empty.put("mean_iat", new double[0]);
    final var emptyTest = TestTables.matrix(empty, new int[0]);
    final var evaluator = new Evaluator(backend);
    final IctcException e =
        assertThrows(IctcException.class, () -> evaluator.evaluate(WINDOW, ensemble, emptyTest));
    assertThat(e.getInfo(), is(ModelError.EMPTY_SPLIT));
  }
}
