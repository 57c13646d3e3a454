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
import lombok.Getter;

/**
 * Thrown when an archive cannot be verified against its expected checksum.
 *
 * <p>An integrity failure is fatal. It halts the pipeline before any archive is extracted.
 */
public class IntegrityException extends IctcException {

  private static final long serialVersionUID = 6931582052717163389L;

  @Getter private final String archiveName;

  public IntegrityException(IngestError info, String archiveName, String detail) {
    super(info, String.format("archive=%s; %s", archiveName, detail));
    this.archiveName = archiveName;
    setContext(archiveName);
  }

  public IntegrityException(IngestError info, String archiveName, Throwable t) {
    super(info, String.format("archive=%s; %s", archiveName, t.getMessage()), t);
    this.archiveName = archiveName;
    setContext(archiveName);
  }
}
