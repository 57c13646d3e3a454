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

import io.isima.ictc.errors.IngestError;
import io.isima.ictc.models.TimeWindow;
import lombok.Getter;

/** Thrown when a time window lacks the benign table or every attack table. */
public class DatasetIncompleteException extends IctcException {

  private static final long serialVersionUID = 3420978211187524005L;

  @Getter private final TimeWindow window;

  public DatasetIncompleteException(TimeWindow window, String detail) {
    super(IngestError.DATASET_INCOMPLETE, String.format("window=%s; %s", window, detail));
    this.window = window;
    setContext(window);
  }
}
