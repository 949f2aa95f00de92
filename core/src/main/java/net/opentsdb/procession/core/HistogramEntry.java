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
import com.fasterxml.jackson.annotation.JsonProperty;

/** One independent histogram sample. */
public final class HistogramEntry extends Entry {

  private final float value;

  @JsonCreator
  public HistogramEntry(@JsonProperty(value = "value", required = true) final float value) {
    this.value = value;
  }

  @Override
  public Kind getKind() {
    return Kind.HISTOGRAM;
  }

  @JsonProperty("value")
  public float getValue() {
    return value;
  }

  @Override
  public Op op() {
    return Op.SET;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  int bits() {
    return Float.floatToIntBits(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HistogramEntry)) {
      return false;
    }
    return Float.floatToIntBits(value) == Float.floatToIntBits(((HistogramEntry) o).value);
  }

  @Override
  public int hashCode() {
    return Float.floatToIntBits(value);
  }

  @Override
  public String toString() {
    return "Histogram{" + value + "}";
  }
}
