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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/** A counter write holding an unsigned 32 bit value. Only {@link Op#ADD} and {@link Op#SET}. */
@JsonPropertyOrder({"value", "op"})
public final class CounterEntry extends Entry {

  public static final long MAX_VALUE = 0xFFFF_FFFFL;

  private final int value;
  private final Op op;

  @JsonCreator
  public CounterEntry(
      @JsonProperty(value = "value", required = true) final long value,
      @JsonProperty(value = "op", required = true) final Op op) {
    checkArgument(value >= 0 && value <= MAX_VALUE, "counter value %s outside u32 range", value);
    checkNotNull(op, "op");
    checkArgument(op != Op.SUB, "counters can't be decremented");
    this.value = (int) value;
    this.op = op;
  }

  @Override
  public Kind getKind() {
    return Kind.COUNTER;
  }

  @JsonProperty("value")
  public long getValue() {
    return Integer.toUnsignedLong(value);
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
    return getValue();
  }

  @Override
  int bits() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CounterEntry)) {
      return false;
    }
    CounterEntry that = (CounterEntry) o;
    return value == that.value && op == that.op;
  }

  @Override
  public int hashCode() {
    return 31 * value + op.hashCode();
  }

  @Override
  public String toString() {
    return "Counter{" + op + " " + getValue() + "}";
  }
}
