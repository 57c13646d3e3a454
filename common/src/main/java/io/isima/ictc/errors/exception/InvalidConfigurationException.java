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
package io.isima.ictc.errors.exception;

import io.isima.ictc.errors.GenericError;

public class InvalidConfigurationException extends IctcException {

  private static final long serialVersionUID = -1309841585301467812L;

  public InvalidConfigurationException(String additionalMessage) {
    super(GenericError.INVALID_CONFIGURATION, additionalMessage);
  }

  public InvalidConfigurationException(String message, Throwable t) {
    super(GenericError.INVALID_CONFIGURATION, message, t);
  }
}
