/*
 * This file is part of OpenTSDB.
 * Copyright (C) 2021  Yahoo.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.opentsdb.procession.api;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The structured identity of a metric: a name plus a set of labels.
 *
 * <p>Labels keep the order they were supplied in, that order is what gets persisted. Equality
 * and hashing treat the labels as an unordered set so {@code a=1,b=2} and {@code b=2,a=1} name
 * the same metric.
 */
public final class MetricKey {

  private final String name;
  private final ImmutableList<Label> labels;
  private final ImmutableSet<Label> labelSet;
  private final int hash;

  private MetricKey(final String name, final ImmutableList<Label> labels) {
    this.name = checkNotNull(name, "metric name");
    this.labels = labels;
    this.labelSet = ImmutableSet.copyOf(labels);
    this.hash = 31 * name.hashCode() + labelSet.hashCode();
  }

  public static MetricKey of(final String name) {
    return new MetricKey(name, ImmutableList.of());
  }

  public static MetricKey of(final String name, final List<Label> labels) {
    return new MetricKey(name, ImmutableList.copyOf(labels));
  }

  public static MetricKey of(final String name, final Label... labels) {
    return new MetricKey(name, ImmutableList.copyOf(labels));
  }

  /**
   * Builds a key from alternating label names and values, {@code of("requests", "method",
   * "GET", "status", "200")}.
   */
  public static MetricKey of(final String name, final String... tags) {
    checkArgument(tags.length % 2 == 0, "odd number of label strings: %s", Arrays.toString(tags));
    ImmutableList.Builder<Label> builder = ImmutableList.builder();
    for (int i = 0; i < tags.length; i += 2) {
      builder.add(new Label(tags[i], tags[i + 1]));
    }
    return new MetricKey(name, builder.build());
  }

  public static MetricKey of(final String name, final Map<String, String> tags) {
    ImmutableList.Builder<Label> builder = ImmutableList.builder();
    tags.forEach((k, v) -> builder.add(new Label(k, v)));
    return new MetricKey(name, builder.build());
  }

  public String getName() {
    return name;
  }

  /** @return the labels in the order they were supplied. */
  public List<Label> getLabels() {
    return labels;
  }

  public int labelCount() {
    return labels.size();
  }

  /** Order independent comparison of the label pairs against an arbitrary list. */
  public boolean hasSameLabels(final List<Label> other) {
    return labelSet.equals(ImmutableSet.copyOf(other));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricKey)) {
      return false;
    }
    MetricKey other = (MetricKey) o;
    return hash == other.hash && name.equals(other.name) && labelSet.equals(other.labelSet);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return labels.isEmpty() ? name : name + labels;
  }
}
