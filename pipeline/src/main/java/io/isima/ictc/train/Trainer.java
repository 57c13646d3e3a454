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

import io.isima.ictc.errors.GenericError;
import io.isima.ictc.errors.ModelError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.transform.FeatureMatrix;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trains a multiclass gradient-boosted tree ensemble with early stopping.
 *
 * <p>After every round the trainer measures the multiclass log-loss of the training and
 * validation splits and the validation accuracy. Training stops when the validation loss has not
 * improved for {@code patience} rounds or the round limit is reached; the ensemble of the best
 * round is kept. Class imbalance is left to the objective.
 */
public class Trainer {
  private static final Logger logger = LoggerFactory.getLogger(Trainer.class);

  private final BoostingBackend backend;

  public Trainer(BoostingBackend backend) {
    this.backend = backend;
  }

  public BoostingBackend getBackend() {
    return backend;
  }

  /**
   * Trains an ensemble.
   *
   * @param train transformed training split
   * @param validation transformed validation split
   * @param labelSet the label set
   * @param parameters hyperparameters
   * @return the ensemble of the best round
   * @throws TrainingDivergedException when a loss becomes non-finite
   * @throws IctcException when a split is empty, the thread is interrupted or the library fails
   */
  public TrainedEnsemble train(
      FeatureMatrix train,
      FeatureMatrix validation,
      LabelSet labelSet,
      BoosterParameters parameters)
      throws IctcException {
    parameters.validate();
    if (train.getRowCount() == 0) {
      throw new IctcException(ModelError.EMPTY_SPLIT, "training split");
    }
    if (validation.getRowCount() == 0) {
      throw new IctcException(ModelError.EMPTY_SPLIT, "validation split");
    }
    final int[] trainLabels = train.getLabels();
    final int[] validationLabels = validation.getLabels();
    final var history = new ArrayList<RoundMetrics>();

    byte[] bestBlob = null;
    int bestRound = 0;
    double bestLoss = Double.POSITIVE_INFINITY;
    int lastValidRound = 0;
    logger.info(
        "Training with {}: train={}, validation={}, classes={}, params={}",
        backend.getName(),
        train.getRowCount(),
        validation.getRowCount(),
        labelSet.size(),
        parameters);
    try (var engine = backend.start(train, validation, labelSet.size(), parameters)) {
      for (int round = 1; round <= parameters.getMaxRounds(); ++round) {
        if (Thread.currentThread().isInterrupted()) {
          throw new IctcException(GenericError.OPERATION_CANCELED, "training interrupted");
        }
        engine.boostRound(round);
        final var trainingLoss = MultiClassLoss.logLoss(engine.predictTraining(), trainLabels);
        final var validationProbabilities = engine.predictValidation();
        final var metrics =
            new RoundMetrics(
                round,
                trainingLoss,
                MultiClassLoss.logLoss(validationProbabilities, validationLabels),
                MultiClassLoss.accuracy(validationProbabilities, validationLabels));
        history.add(metrics);
        logger.debug(
            "[{}] train-mlogloss={} valid-mlogloss={} valid-accuracy={}",
            round,
            metrics.getTrainingLoss(),
            metrics.getValidationLoss(),
            metrics.getValidationAccuracy());

        if (!metrics.isFinite()) {
          final var recovered =
              bestBlob == null
                  ? null
                  : build(bestBlob, labelSet, train, parameters, bestRound, bestLoss, history);
          logger.error(
              "Training diverged at round {}; best round {} is {}",
              round,
              bestRound,
              recovered == null ? "not available" : "retained");
          throw new TrainingDivergedException(
              round,
              lastValidRound,
              recovered,
              String.format(
                  "trainingLoss=%s, validationLoss=%s",
                  metrics.getTrainingLoss(), metrics.getValidationLoss()));
        }
        lastValidRound = round;

        if (metrics.getValidationLoss() < bestLoss) {
          bestLoss = metrics.getValidationLoss();
          bestRound = round;
          bestBlob = engine.snapshot();
        } else if (round - bestRound >= parameters.getPatience()) {
          logger.info(
              "Early stopping at round {}: no improvement since round {}", round, bestRound);
          break;
        }
      }
    }
    final var ensemble =
        build(bestBlob, labelSet, train, parameters, bestRound, bestLoss, history);
    logger.info(
        "Training done: bestRound={}, roundsTrained={}, bestValidationLoss={}",
        bestRound,
        history.size(),
        bestLoss);
    return ensemble;
  }

  private TrainedEnsemble build(
      byte[] blob,
      LabelSet labelSet,
      FeatureMatrix train,
      BoosterParameters parameters,
      int bestRound,
      double bestLoss,
      List<RoundMetrics> history) {
    return new TrainedEnsemble(
        blob,
        backend.getName(),
        labelSet,
        train.getFeatureNames(),
        parameters,
        bestRound,
        history.size(),
        bestLoss,
        history);
  }
}
