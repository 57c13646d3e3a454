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

import io.isima.ictc.errors.exception.ExtractionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of extracting a set of archives.
 *
 * <p>A failed archive does not stop the others; its exception is kept here by archive name.
 */
public class ExtractionReport {
  private final List<ExtractionResult> results = new ArrayList<>();
  private final Map<String, ExtractionException> failures = new LinkedHashMap<>();

  void addResult(ExtractionResult result) {
    results.add(result);
  }

  void addFailure(ExtractionException failure) {
    failures.put(failure.getArchiveName(), failure);
  }

  /**
   * Adds results and failures of another report into this one.
   *
   * @param other the other report
   * @return this report
   */
  public ExtractionReport merge(ExtractionReport other) {
    results.addAll(other.results);
    failures.putAll(other.failures);
    return this;
  }

  public List<ExtractionResult> getResults() {
    return Collections.unmodifiableList(results);
  }

  public Map<String, ExtractionException> getFailures() {
    return Collections.unmodifiableMap(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }

  @Override
  public String toString() {
    return String.format("{extracted=%d, failed=%s}", results.size(), failures.keySet());
  }
}
