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
package io.isima.ictc.dataset;

import io.isima.ictc.models.TimeWindow;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Class label and time window encoded in a sample table file name.
 *
 * <p>Table files are named {@code <class>[_samples]_<N>sec.csv}, e.g. {@code
 * benign_samples_3sec.csv} or {@code modbus_flood_2sec.csv}. A raw xz payload may be decompressed
 * without the {@code .csv} extension, so the extension is optional. Labels are lower-cased.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SampleFileName {
  private static final Pattern PATTERN =
      Pattern.compile(
          "^(?<label>[A-Za-z0-9][A-Za-z0-9_-]*?)(?:_samples)?_(?<seconds>\\d+)sec(?:\\.csv)?$");

  private final String fileName;
  private final String label;
  private final TimeWindow window;

  private SampleFileName(String fileName, String label, TimeWindow window) {
    this.fileName = fileName;
    this.label = label;
    this.window = window;
  }

  /**
   * Parses a file name.
   *
   * @param fileName file name without directory
   * @return the parsed name, or empty if the name does not denote a sample table of a supported
   *     time window
   */
  public static Optional<SampleFileName> parse(String fileName) {
    final var matcher = PATTERN.matcher(fileName);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    final int seconds;
    try {
      seconds = Integer.parseInt(matcher.group("seconds"));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
    if (seconds < TimeWindow.MIN_SECONDS || seconds > TimeWindow.MAX_SECONDS) {
      return Optional.empty();
    }
    return Optional.of(
        new SampleFileName(
            fileName, matcher.group("label").toLowerCase(), TimeWindow.of(seconds)));
  }
}
