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

package net.opentsdb.procession.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Persisted row of a {@link LabelSet}: the key's name, its labels in order and the id it was
 * assigned. The table is written as a list of these rather than as a map so a reload reproduces
 * the exact id assignment.
 */
@JsonPropertyOrder({"key_name", "labels", "value"})
public final class LabelEntry {

  private final MetricKey key;
  private final int id;

  public LabelEntry(final MetricKey key, final int id) {
    checkArgument(id >= 0 && id <= LabelSet.OVERFLOW_ID, "label id %s outside u16 range", id);
    this.key = checkNotNull(key, "key");
    this.id = id;
  }

  @JsonCreator
  static LabelEntry fromJson(
      @JsonProperty(value = "key_name", required = true) final String name,
      @JsonProperty(value = "labels", required = true) final List<Label> labels,
      @JsonProperty(value = "value", required = true) final int id) {
    checkNotNull(name, "key_name missing from label set entry");
    checkNotNull(labels, "labels missing from label set entry");
    return new LabelEntry(MetricKey.of(name, labels), id);
  }

  @JsonIgnore
  public MetricKey getKey() {
    return key;
  }

  @JsonProperty("key_name")
  public String getName() {
    return key.getName();
  }

  @JsonProperty("labels")
  public List<Label> getLabels() {
    return key.getLabels();
  }

  @JsonProperty("value")
  public int getId() {
    return id;
  }
}
