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
package io.isima.ictc.errors;

/** Errors raised while fitting feature transforms, training and evaluating the classifier. */
public enum ModelError implements IctcError {
  EMPTY_COLUMN("MODEL00", "Feature has no values in the training split"),
  TRAINING_DIVERGED("MODEL01", "Training loss became non-finite"),
  ENGINE_FAILURE("MODEL02", "Boosting engine failure"),
  EMPTY_SPLIT("MODEL03", "Data split has no rows"),
  ;

  private final String errorCode;
  private final String message;

  private ModelError(String errorCode, String message) {
    this.errorCode = errorCode;
    this.message = message;
  }

  @Override
  public String getErrorCode() {
    return errorCode;
  }

  @Override
  public String getErrorMessage() {
    return message;
  }
}
