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

import io.isima.ictc.errors.ModelError;
import io.isima.ictc.errors.exception.IctcException;
import lombok.Getter;

/**
 * Thrown when the training or validation loss becomes non-finite.
 *
 * <p>The best ensemble found before the divergence is kept and can still be written out; it is
 * null when no round completed with a finite loss.
 */
@Getter
public class TrainingDivergedException extends IctcException {

  private static final long serialVersionUID = -3329084461877313251L;

  private final int round;
  private final int lastValidRound;
  private final transient TrainedEnsemble bestEnsemble;

  public TrainingDivergedException(
      int round, int lastValidRound, TrainedEnsemble bestEnsemble, String detail) {
    super(
        ModelError.TRAINING_DIVERGED,
        String.format("round=%d; lastValidRound=%d; %s", round, lastValidRound, detail));
    this.round = round;
    this.lastValidRound = lastValidRound;
    this.bestEnsemble = bestEnsemble;
    setContext(round);
  }

  public boolean hasRecoverableEnsemble() {
    return bestEnsemble != null;
  }
}
