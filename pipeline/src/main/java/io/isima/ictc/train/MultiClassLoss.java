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

/** Multiclass log-loss and accuracy over predicted class probabilities. */
public final class MultiClassLoss {

  static final double EPSILON = 1e-15;

  private MultiClassLoss() {}

  /**
   * Mean negative log-likelihood of the true classes.
   *
   * <p>Probabilities are clipped to [1e-15, 1 - 1e-15]. A row with a non-finite probability makes
   * the loss NaN.
   *
   * @param probabilities predicted probabilities, one row per sample
   * @param labels true class per sample
   * @return the loss
   */
  public static double logLoss(double[][] probabilities, int[] labels) {
    if (probabilities.length != labels.length) {
      throw new IllegalArgumentException(
          String.format("%d predictions for %d labels", probabilities.length, labels.length));
    }
    if (labels.length == 0) {
      return Double.NaN;
    }
    double sum = 0.0;
    for (int i = 0; i < labels.length; ++i) {
      for (double p : probabilities[i]) {
        if (!Double.isFinite(p)) {
          return Double.NaN;
        }
      }
      final double p = Math.min(Math.max(probabilities[i][labels[i]], EPSILON), 1.0 - EPSILON);
      sum -= Math.log(p);
    }
    return sum / labels.length;
  }

  /**
   * Index of the largest probability; the lowest index wins ties.
   *
   * @param probabilities probabilities of one sample
   * @return the predicted class
   */
  public static int argmax(double[] probabilities) {
    int best = 0;
    for (int i = 1; i < probabilities.length; ++i) {
      if (probabilities[i] > probabilities[best]) {
        best = i;
      }
    }
    return best;
  }

  public static double accuracy(double[][] probabilities, int[] labels) {
    if (labels.length == 0) {
      return Double.NaN;
    }
    int correct = 0;
    for (int i = 0; i < labels.length; ++i) {
      if (argmax(probabilities[i]) == labels[i]) {
        ++correct;
      }
    }
    return (double) correct / labels.length;
  }
}
