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
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import static com.google.common.base.Preconditions.checkNotNull;

@JsonPropertyOrder({"value", "op"})
public final class GaugeEntry extends Entry {

  private final float value;
  private final Op op;

  @JsonCreator
  public GaugeEntry(
      @JsonProperty(value = "value", required = true) final float value,
      @JsonProperty(value = "op", required = true) final Op op) {
    this.value = value;
    this.op = checkNotNull(op, "op");
  }

  @Override
  public Kind getKind() {
    return Kind.GAUGE;
  }

  @JsonProperty("value")
  public float getValue() {
    return value;
  }

  @JsonProperty("op")
  public Op getOp() {
    return op;
  }

  @Override
  public Op op() {
    return op;
  }

  @Override
  public double doubleValue() {
    return value;
  }

  @Override
  int bits() {
    return Float.floatToIntBits(value);
  }

  // compared on canonical bits so NaN equals NaN
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof GaugeEntry)) {
      return false;
    }
    GaugeEntry that = (GaugeEntry) o;
    return Float.floatToIntBits(value) == Float.floatToIntBits(that.value) && op == that.op;
  }

  @Override
  public int hashCode() {
    return 31 * Float.floatToIntBits(value) + op.hashCode();
  }

  @Override
  public String toString() {
    return "Gauge{" + op + " " + value + "}";
  }
}
