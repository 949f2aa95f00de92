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

package net.opentsdb.procession.iter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.ImmutableList;
import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.Entry;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A self describing event that owns its strings: absolute time, entry, metric name and labels.
 * This is the flattened interchange form, one of these per line in a JSON lines file.
 */
@JsonPropertyOrder({"when", "event", "key", "labels"})
public final class Metric {

  private final Instant when;
  private final Entry event;
  private final String key;
  private final List<Label> labels;

  @JsonCreator
  public Metric(
      @JsonProperty(value = "when", required = true) final Instant when,
      @JsonProperty(value = "event", required = true) final Entry event,
      @JsonProperty(value = "key", required = true) final String key,
      @JsonProperty("labels") final List<Label> labels) {
    this.when = checkNotNull(when, "when").truncatedTo(ChronoUnit.MILLIS);
    this.event = checkNotNull(event, "event");
    this.key = checkNotNull(key, "key");
    this.labels = labels == null ? ImmutableList.of() : ImmutableList.copyOf(labels);
  }

  @JsonProperty("when")
  public Instant getWhen() {
    return when;
  }

  @JsonProperty("event")
  public Entry getEvent() {
    return event;
  }

  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("labels")
  public List<Label> getLabels() {
    return labels;
  }

  public MetricKey toKey() {
    return MetricKey.of(key, labels);
  }

  /** Same time, entry, name and label set (in any order) as the borrowed event. */
  public boolean isEquivalentTo(final MetricRef other) {
    return other != null
        && when.equals(other.getWhen())
        && event.equals(other.getEvent())
        && key.equals(other.getMetricKey().getName())
        && other.getMetricKey().hasSameLabels(labels);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Metric)) {
      return false;
    }
    Metric other = (Metric) o;
    return when.equals(other.when)
        && event.equals(other.event)
        && key.equals(other.key)
        && toKey().equals(other.toKey());
  }

  @Override
  public int hashCode() {
    return Objects.hash(when, event, toKey());
  }

  @Override
  public String toString() {
    return "Metric{" + when + " " + key + labels + " " + event + "}";
  }
}
