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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The typed value of one recorded write. Serialized with an {@code "event"} tag naming the kind,
 * e.g. {@code {"event":"Gauge","value":1.5,"op":"Set"}}.
 *
 * <p>In memory an entry is stored as a one byte tag plus 32 value bits; see {@link #tag()} and
 * {@link #bits()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
  @JsonSubTypes.Type(value = CounterEntry.class, name = "Counter"),
  @JsonSubTypes.Type(value = GaugeEntry.class, name = "Gauge"),
  @JsonSubTypes.Type(value = HistogramEntry.class, name = "Histogram")
})
public abstract class Entry {

  public enum Kind {
    COUNTER,
    GAUGE,
    HISTOGRAM
  }

  private static final Kind[] KINDS = Kind.values();
  private static final int OP_BITS = 2;
  private static final int OP_MASK = (1 << OP_BITS) - 1;

  Entry() {}

  public static CounterEntry counter(final long value, final Op op) {
    return new CounterEntry(value, op);
  }

  public static GaugeEntry gauge(final float value, final Op op) {
    return new GaugeEntry(value, op);
  }

  public static HistogramEntry histogram(final float value) {
    return new HistogramEntry(value);
  }

  @JsonIgnore
  public abstract Kind getKind();

  /** The value widened to a double, for consumers that aggregate across kinds. */
  public abstract double doubleValue();

  /** @return the operation, histograms always report {@link Op#SET} as they carry none. */
  @JsonIgnore
  public abstract Op op();

  /** The raw 32 bits of the stored value. */
  abstract int bits();

  /** Kind and op squeezed into a single byte. */
  byte tag() {
    return (byte) ((getKind().ordinal() << OP_BITS) | op().ordinal());
  }

  static Entry decode(final byte tag, final int bits) {
    Kind kind = KINDS[tag >>> OP_BITS];
    switch (kind) {
      case COUNTER:
        return new CounterEntry(Integer.toUnsignedLong(bits), Op.fromOrdinal(tag & OP_MASK));
      case GAUGE:
        return new GaugeEntry(Float.intBitsToFloat(bits), Op.fromOrdinal(tag & OP_MASK));
      case HISTOGRAM:
        return new HistogramEntry(Float.intBitsToFloat(bits));
      default:
        throw new IllegalStateException("Unknown entry kind " + kind);
    }
  }
}
