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
package io.isima.ictc.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;

/**
 * Aggregation interval over which raw packet-level events are summarized into one feature row.
 *
 * <p>The dataset is published for windows of 1 to 10 seconds. File names carry the window as a
 * {@code <N>sec} token, e.g. {@code benign_samples_3sec.tar.xz}.
 */
@EqualsAndHashCode
public final class TimeWindow implements Comparable<TimeWindow> {
  public static final int MIN_SECONDS = 1;
  public static final int MAX_SECONDS = 10;

  private static final Pattern TEXT_PATTERN = Pattern.compile("^(\\d+)\\s*(sec|s)?$");

  private final int seconds;

  private TimeWindow(int seconds) {
    this.seconds = seconds;
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static TimeWindow of(int seconds) {
    if (seconds < MIN_SECONDS || seconds > MAX_SECONDS) {
      throw new IllegalArgumentException(
          String.format(
              "Time window must be between %d and %d seconds: %d",
              MIN_SECONDS, MAX_SECONDS, seconds));
    }
    return new TimeWindow(seconds);
  }

  /**
   * Parses a window written as a plain number or with a unit suffix, e.g. "3", "3sec" or "3s".
   *
   * @param src the source text
   * @return the time window
   * @throws IllegalArgumentException when the text is not a window within the allowed range
   */
  public static TimeWindow parse(String src) {
    if (src == null) {
      throw new IllegalArgumentException("Time window must not be null");
    }
    final var matcher = TEXT_PATTERN.matcher(src.trim().toLowerCase());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid time window syntax: " + src);
    }
    return of(Integer.parseInt(matcher.group(1)));
  }

  @JsonValue
  public int getSeconds() {
    return seconds;
  }

  /** The token used in file names, e.g. "3sec". */
  public String getSuffix() {
    return seconds + "sec";
  }

  @Override
  public int compareTo(TimeWindow other) {
    return Integer.compare(seconds, other.seconds);
  }

  @Override
  public String toString() {
    return getSuffix();
  }
}
