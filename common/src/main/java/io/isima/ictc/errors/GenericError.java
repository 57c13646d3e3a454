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

public enum GenericError implements IctcError {
  APPLICATION_ERROR("GENERIC00", "Generic pipeline error"),
  INVALID_CONFIGURATION("GENERIC01", "Invalid configuration"),
  OPERATION_CANCELED("GENERIC02", "Operation canceled"),
  IO_ERROR("GENERIC03", "I/O error"),
  ;

  private final String errorCode;
  private final String message;

  private GenericError(String errorCode, String message) {
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
