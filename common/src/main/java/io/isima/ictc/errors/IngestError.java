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

/** Errors raised while verifying, extracting and loading the sample archives. */
public enum IngestError implements IctcError {
  CHECKSUM_MISMATCH("INGEST00", "Archive checksum does not match the expected value"),
  CHECKSUM_MISSING("INGEST01", "No checksum entry found for archive"),
  CHECKSUM_MALFORMED("INGEST02", "Checksum entry is not a SHA-256 hex digest"),
  ARCHIVE_UNREADABLE("INGEST03", "Archive cannot be read"),
  CORRUPT_ARCHIVE("INGEST04", "Archive payload is corrupt"),
  PATH_TRAVERSAL("INGEST05", "Archive entry escapes the destination directory"),
  CONFLICTING_TARGET("INGEST06", "Extraction target exists with different content"),
  DATASET_INCOMPLETE("INGEST07", "Dataset is incomplete for the requested time window"),
  CSV_SYNTAX_ERROR("INGEST08", "CSV syntax error"),
  UNDECLARED_COLUMN("INGEST09", "Column is not declared in the feature schema"),
  LABEL_SET_MISMATCH("INGEST0a", "Label sets differ between time windows of one study"),
  INVALID_SCHEMA("INGEST0b", "Invalid feature schema"),
  ;

  private final String errorCode;
  private final String message;

  private IngestError(String errorCode, String message) {
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
