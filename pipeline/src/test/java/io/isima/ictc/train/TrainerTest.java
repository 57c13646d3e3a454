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
package io.isima.ictc.train;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import io.isima.ictc.errors.ModelError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.errors.exception.InvalidConfigurationException;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.testutils.ScriptedBackend;
import io.isima.ictc.testutils.TestTables;
import io.isima.ictc.transform.FeatureMatrix;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class TrainerTest {
  private static final LabelSet LABELS = LabelSet.of("benign", List.of("benign", "dos", "mitm"));

  private FeatureMatrix train;
  private FeatureMatrix validation;
  private BoosterParameters parameters;

  private static FeatureMatrix matrix(int[] labels) {
    final var columns = new LinkedHashMap<String, double[]>();
    final var values = new double[labels.length];
    for (int i = 0; i < values.length; ++i) {
      values[i] = i;
    }
    columns.put("pkt_count", values);
    return TestTables.matrix(columns, labels);
  }

  @Before
  public void setUp() {
    train = matrix(new int[] {0, 0, 1, 1, 2, 2});
    validation = matrix(new int[] {0, 1, 2});
    parameters = new BoosterParameters();
    parameters.setPatience(5);
    parameters.setMaxRounds(100);
  }

  @Test
  public void testEarlyStopping() throws Exception {
    final var backend = ScriptedBackend.improvingUntil(7);
    final var ensemble = new Trainer(backend).train(train, validation, LABELS, parameters);

    assertEquals(7, ensemble.getBestRound());
    assertEquals(7 + 5, ensemble.getRoundsTrained());
    assertEquals(12, ensemble.getHistory().size());
    assertEquals(7, ScriptedBackend.roundOf(ensemble.getBlob()));
    assertEquals(-Math.log(0.9), ensemble.getBestValidationLoss(), 1e-12);
    assertEquals("scripted", ensemble.getBackend());
    assertThat(ensemble.getFeatureNames(), contains("pkt_count"));
    assertThat(ensemble.getLabelSet(), is(LABELS));
    assertEquals(1, backend.getClosedEngines());

    final var best = ensemble.getHistory().get(6);
    assertEquals(7, best.getRound());
    assertEquals(1.0, best.getValidationAccuracy(), 0.0);
    assertEquals(-Math.log(0.9), best.getTrainingLoss(), 1e-12);
  }

  @Test
  public void testEqualLossIsNotAnImprovement() throws Exception {
    final var backend = new ScriptedBackend(new double[] {0.9}, new double[] {0.6, 0.7, 0.7});
    final var ensemble = new Trainer(backend).train(train, validation, LABELS, parameters);
    assertEquals(2, ensemble.getBestRound());
    assertEquals(2 + 5, ensemble.getRoundsTrained());
  }

  @Test
  public void testRoundLimit() throws Exception {
    parameters.setMaxRounds(4);
    final var backend = ScriptedBackend.improvingUntil(10);
    final var ensemble = new Trainer(backend).train(train, validation, LABELS, parameters);
    assertEquals(4, ensemble.getBestRound());
    assertEquals(4, ensemble.getRoundsTrained());
  }

  @Test
  public void testDivergenceKeepsBestEnsemble() throws Exception {
    final var backend =
        new ScriptedBackend(new double[] {0.9}, new double[] {0.5, 0.6, 0.55, Double.NaN});
    final var e =
        assertThrows(
            TrainingDivergedException.class,
            () -> new Trainer(backend).train(train, validation, LABELS, parameters));
    assertThat(e.getInfo(), is(ModelError.TRAINING_DIVERGED));
    assertEquals(4, e.getRound());
    assertEquals(3, e.getLastValidRound());
    assertTrue(e.hasRecoverableEnsemble());
    assertEquals(2, e.getBestEnsemble().getBestRound());
    assertEquals(2, ScriptedBackend.roundOf(e.getBestEnsemble().getBlob()));
    assertEquals(1, backend.getClosedEngines());
  }

  @Test
  public void testDivergenceAtFirstRound() {
    final var backend = new ScriptedBackend(new double[] {Double.NaN}, new double[] {0.5});
    final var e =
        assertThrows(
            TrainingDivergedException.class,
            () -> new Trainer(backend).train(train, validation, LABELS, parameters));
    assertEquals(1, e.getRound());
    assertEquals(0, e.getLastValidRound());
    assertFalse(e.hasRecoverableEnsemble());
    assertNull(e.getBestEnsemble());
  }

  @Test
  public void testEmptySplits() {
    final var trainer = new Trainer(ScriptedBackend.improvingUntil(1));
    final var empty = matrix(new int[0]);
    final IctcException noTrain =
        assertThrows(
            IctcException.class, () -> trainer.train(empty, validation, LABELS, parameters));
    assertThat(noTrain.getInfo(), is(ModelError.EMPTY_SPLIT));
    final IctcException noValidation =
        assertThrows(IctcException.class, () -> trainer.train(train, empty, LABELS, parameters));
    assertThat(noValidation.getInfo(), is(ModelError.EMPTY_SPLIT));
  }

  @Test
  public void testInvalidParameters() {
    parameters.setLearningRate(0.0);
    final var trainer = new Trainer(ScriptedBackend.improvingUntil(1));
    assertThrows(
        InvalidConfigurationException.class,
        () -> trainer.train(train, validation, LABELS, parameters));
  }
}
