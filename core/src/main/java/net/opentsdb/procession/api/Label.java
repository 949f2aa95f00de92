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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single label name/value pair attached to a {@link MetricKey}. Serialized as a two element
 * array, {@code ["name", "value"]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"key", "value"})
public final class Label {

  private final String key;
  private final String value;

  @JsonCreator
  public Label(@JsonProperty("key") final String key, @JsonProperty("value") final String value) {
    this.key = checkNotNull(key, "label key");
    this.value = checkNotNull(value, "label value");
  }

  public static Label of(final String key, final String value) {
    return new Label(key, value);
  }

  @JsonProperty("key")
  public String getKey() {
    return key;
  }

  @JsonProperty("value")
  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Label)) {
      return false;
    }
    Label label = (Label) o;
    return key.equals(label.key) && value.equals(label.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return key + "=" + value;
  }
}
