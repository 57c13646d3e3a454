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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The fixed set of class labels of a dataset version.
 *
 * <p>The benign label always takes index 0 and the attack labels follow in lexicographic order, so
 * that two label sets built from the same labels always encode classes identically.
 */
@Getter
@ToString(exclude = "indexes")
@EqualsAndHashCode(exclude = "indexes")
@JsonPropertyOrder({"benignLabel", "labels"})
public final class LabelSet {
  @JsonProperty("benignLabel")
  private final String benignLabel;

  @JsonProperty("labels")
  private final List<String> labels;

  @JsonIgnore @Getter(AccessLevel.NONE) private final Map<String, Integer> indexes;

  @JsonCreator
  public LabelSet(
      @JsonProperty("benignLabel") String benignLabel,
      @JsonProperty("labels") List<String> labels) {
    if (benignLabel == null || labels == null || labels.isEmpty()) {
      throw new IllegalArgumentException("Benign label and labels must be set");
    }
    if (!labels.get(0).equals(benignLabel)) {
      throw new IllegalArgumentException("The first label must be the benign label " + benignLabel);
    }
    final var map = new HashMap<String, Integer>();
    for (int i = 0; i < labels.size(); ++i) {
      if (map.put(labels.get(i), i) != null) {
        throw new IllegalArgumentException("Duplicate label: " + labels.get(i));
      }
    }
    this.benignLabel = benignLabel;
    this.labels = ImmutableList.copyOf(labels);
    this.indexes = map;
  }

  /**
   * Builds a label set out of observed labels.
   *
   * @param benignLabel the benign label, that must be one of the observed labels
   * @param observed observed labels, duplicates allowed
   * @return the label set
   */
  public static LabelSet of(String benignLabel, Collection<String> observed) {
    final var attacks = new TreeSet<>(observed);
    if (!attacks.remove(benignLabel)) {
      throw new IllegalArgumentException("Benign label is not observed: " + benignLabel);
    }
    final var builder = ImmutableList.<String>builder().add(benignLabel).addAll(attacks);
    return new LabelSet(benignLabel, builder.build());
  }

  @JsonIgnore
  public int size() {
    return labels.size();
  }

  @JsonIgnore
  public List<String> getAttackLabels() {
    return labels.subList(1, labels.size());
  }

  public boolean contains(String label) {
    return indexes.containsKey(label);
  }

  public int indexOf(String label) {
    final Integer index = indexes.get(label);
    if (index == null) {
      throw new IllegalArgumentException("Unknown label: " + label);
    }
    return index;
  }

  public String labelAt(int index) {
    return labels.get(index);
  }
}
