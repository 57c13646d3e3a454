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

import io.isima.ictc.errors.ModelError;
import io.isima.ictc.errors.exception.IctcException;
import io.isima.ictc.models.LabelSet;
import io.isima.ictc.models.TimeWindow;
import io.isima.ictc.train.BoostingBackend;
import io.isima.ictc.train.MultiClassLoss;
import io.isima.ictc.train.SplitStatistics;
import io.isima.ictc.train.TrainedEnsemble;
import io.isima.ictc.transform.FeatureMatrix;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a trained ensemble on a held-out split.
 *
 * <p>The predicted class of a sample is the class of highest probability. Precision, recall and F1
 * of a class with no predicted or no true samples are 0.
 */
public class Evaluator {
  private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

  private final BoostingBackend backend;

  public Evaluator(BoostingBackend backend) {
    this.backend = backend;
  }

  /**
   * Evaluates an ensemble.
   *
   * @param window time window of the data
   * @param ensemble the trained ensemble
   * @param test transformed test split
   * @return the report
   * @throws IctcException when the split is empty or the ensemble cannot be used
   */
  public EvaluationReport evaluate(TimeWindow window, TrainedEnsemble ensemble, FeatureMatrix test)
      throws IctcException {
    if (test.getRowCount() == 0) {
      throw new IctcException(ModelError.EMPTY_SPLIT, "test split");
    }
    try (var model = ensemble.open(backend)) {
      final var probabilities = model.predictProbabilities(test);
      final var report =
          buildReport(
              window,
              ensemble.getLabelSet(),
              probabilities,
              test.getLabels(),
              model.splitStatistics());
      logger.info(
          "Evaluated window {} on {} rows: accuracy={}, macroF1={}",
          window,
          test.getRowCount(),
          report.getAccuracy(),
          report.getMacroF1());
      return report;
    }
  }

  /**
   * Builds a report out of predictions.
   *
   * @param window time window of the data
   * @param labelSet label set
   * @param probabilities predicted probabilities per sample
   * @param labels true class per sample
   * @param statistics split statistics of the ensemble
   * @return the report
   */
  public static EvaluationReport buildReport(
      TimeWindow window,
      LabelSet labelSet,
      double[][] probabilities,
      int[] labels,
      List<SplitStatistics> statistics) {
    final int numClasses = labelSet.size();
    final var confusion = new int[numClasses][numClasses];
    for (int i = 0; i < labels.length; ++i) {
      ++confusion[labels[i]][MultiClassLoss.argmax(probabilities[i])];
    }

    final var classes = new ArrayList<ClassMetrics>(numClasses);
    int correct = 0;
    double precisionSum = 0;
    double recallSum = 0;
    double f1Sum = 0;
    double weightedF1Sum = 0;
    for (int c = 0; c < numClasses; ++c) {
      int predicted = 0;
      int support = 0;
      for (int k = 0; k < numClasses; ++k) {
        predicted += confusion[k][c];
        support += confusion[c][k];
      }
      final int truePositives = confusion[c][c];
      correct += truePositives;
      final double precision = ratio(truePositives, predicted);
      final double recall = ratio(truePositives, support);
      final double f1 =
          precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
      classes.add(new ClassMetrics(labelSet.labelAt(c), precision, recall, f1, support));
      precisionSum += precision;
      recallSum += recall;
      f1Sum += f1;
      weightedF1Sum += f1 * support;
    }

    final var metrics = new LinkedHashMap<String, Double>();
    metrics.put(EvaluationReport.ACCURACY, ratio(correct, labels.length));
    metrics.put(EvaluationReport.MACRO_PRECISION, precisionSum / numClasses);
    metrics.put(EvaluationReport.MACRO_RECALL, recallSum / numClasses);
    metrics.put(EvaluationReport.MACRO_F1, f1Sum / numClasses);
    metrics.put(
        EvaluationReport.WEIGHTED_F1, labels.length == 0 ? 0.0 : weightedF1Sum / labels.length);
    metrics.put(EvaluationReport.LOG_LOSS, MultiClassLoss.logLoss(probabilities, labels));
    metrics.put(EvaluationReport.SAMPLES, (double) labels.length);

    return new EvaluationReport(
        window, labelSet.getLabels(), metrics, classes, confusion, rankImportance(statistics));
  }

  /**
   * Ranks features by total gain, then split count, then name.
   *
   * @param statistics split statistics of every feature
   * @return the ranking, most important first
   */
  public static List<FeatureImportance> rankImportance(List<SplitStatistics> statistics) {
    final var sorted = new ArrayList<>(statistics);
    sorted.sort(
        Comparator.comparingDouble(SplitStatistics::getGain)
            .reversed()
            .thenComparing(Comparator.comparingInt(SplitStatistics::getSplits).reversed())
            .thenComparing(SplitStatistics::getFeatureName));
    double totalGain = 0;
    for (var entry : sorted) {
      totalGain += entry.getGain();
    }
    final var ranking = new ArrayList<FeatureImportance>(sorted.size());
    for (int i = 0; i < sorted.size(); ++i) {
      final var entry = sorted.get(i);
      final double share = totalGain > 0 ? entry.getGain() / totalGain : 0.0;
      ranking.add(
          new FeatureImportance(
              i + 1, entry.getFeatureName(), entry.getGain(), share, entry.getSplits()));
    }
    return ranking;
  }

  private static double ratio(int numerator, int denominator) {
    return denominator == 0 ? 0.0 : (double) numerator / denominator;
  }
}
