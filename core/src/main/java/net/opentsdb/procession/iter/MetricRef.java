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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.Entry;

import java.time.Instant;
import java.util.List;

/**
 * A self describing event borrowing its {@link MetricKey} from the procession's label table.
 * Serializes to the same shape as {@link Metric}.
 */
@JsonPropertyOrder({"when", "event", "key", "labels"})
public final class MetricRef {

  private final Instant when;
  private final Entry event;
  private final MetricKey key;

  public MetricRef(final Instant when, final Entry event, final MetricKey key) {
    this.when = when;
    this.event = event;
    this.key = key;
  }

  @JsonProperty("when")
  public Instant getWhen() {
    return when;
  }

  @JsonProperty("event")
  public Entry getEvent() {
    return event;
  }

  @JsonIgnore
  public MetricKey getMetricKey() {
    return key;
  }

  @JsonProperty("key")
  String getName() {
    return key.getName();
  }

  @JsonProperty("labels")
  List<Label> getLabels() {
    return key.getLabels();
  }

  /** Clones the strings out. */
  public Metric toMetric() {
    return new Metric(when, event, key.getName(), key.getLabels());
  }

  public boolean isEquivalentTo(final Metric other) {
    return other != null && other.isEquivalentTo(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricRef)) {
      return false;
    }
    MetricRef other = (MetricRef) o;
    return when.equals(other.when) && event.equals(other.event) && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return (when.hashCode() * 31 + event.hashCode()) * 31 + key.hashCode();
  }

  @Override
  public String toString() {
    return "MetricRef{" + when + " " + key + " " + event + "}";
  }
}
