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
package io.isima.ictc.extract;

import com.google.common.collect.ImmutableList;
import java.nio.file.Path;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/** Outcome of extracting one archive. */
@Getter
@ToString
public final class ExtractionResult {
  private final String archiveName;
  private final PayloadKind payloadKind;

  /** Files newly written to the destination. */
  private final List<Path> publishedFiles;

  /** Files that already existed with identical content. */
  private final List<Path> unchangedFiles;

  public ExtractionResult(
      String archiveName,
      PayloadKind payloadKind,
      List<Path> publishedFiles,
      List<Path> unchangedFiles) {
    this.archiveName = archiveName;
    this.payloadKind = payloadKind;
    this.publishedFiles = ImmutableList.copyOf(publishedFiles);
    this.unchangedFiles = ImmutableList.copyOf(unchangedFiles);
  }

  public List<Path> getAllFiles() {
    return ImmutableList.<Path>builder().addAll(publishedFiles).addAll(unchangedFiles).build();
  }

  /** True when the archive had been extracted before and nothing was written. */
  public boolean isNoOp() {
    return publishedFiles.isEmpty();
  }
}
