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
package io.isima.ictc.integrity;

import com.google.common.hash.HashCode;
import java.nio.file.Path;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An archive whose SHA-256 digest matched its expected value.
 *
 * <p>Only {@link ArchiveVerifier} creates instances, so an archive can reach the extractor only
 * after it has been verified.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class VerifiedArchive {
  private final Path path;
  private final HashCode digest;

  VerifiedArchive(Path path, HashCode digest) {
    this.path = path;
    this.digest = digest;
  }

  public String getName() {
    return path.getFileName().toString();
  }
}
