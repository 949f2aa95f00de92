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

/**
 * One recorded write in its compact form: the entry, a millisecond offset from the owning
 * {@link Chunk}'s reference time and the id of the label in the owning {@link Procession}'s
 * {@link LabelSet}.
 *
 * <p>Inside a chunk an event occupies a single long and a tag byte:
 *
 * <pre>
 *   | value bits (32) | ms (16) | label (16) |   + tag byte (kind, op)
 * </pre>
 */
@JsonPropertyOrder({"entry", "ms", "label"})
public final class Event {

  public static final int MAX_MS = 0xFFFF;
  public static final int MAX_LABEL = 0xFFFF;

  private static final int MS_SHIFT = 16;
  private static final long SHORT_MASK = 0xFFFFL;
  private static final int VALUE_SHIFT = 32;

  private final Entry entry;
  private final int ms;
  private final int label;

  @JsonCreator
  public Event(
      @JsonProperty(value = "entry", required = true) final Entry entry,
      @JsonProperty(value = "ms", required = true) final int ms,
      @JsonProperty(value = "label", required = true) final int label) {
    this.entry = checkNotNull(entry, "entry");
    checkArgument(ms >= 0 && ms <= MAX_MS, "ms %s outside [0, %s]", ms, MAX_MS);
    checkArgument(label >= 0 && label <= MAX_LABEL, "label %s outside [0, %s]", label, MAX_LABEL);
    this.ms = ms;
    this.label = label;
  }

  @JsonProperty("entry")
  public Entry getEntry() {
    return entry;
  }

  @JsonProperty("ms")
  public int getMs() {
    return ms;
  }

  @JsonProperty("label")
  public int getLabel() {
    return label;
  }

  long pack() {
    return ((long) entry.bits() << VALUE_SHIFT) | ((long) ms << MS_SHIFT) | label;
  }

  byte tag() {
    return entry.tag();
  }

  static Event unpack(final byte tag, final long word) {
    Entry entry = Entry.decode(tag, (int) (word >>> VALUE_SHIFT));
    return new Event(entry, (int) ((word >>> MS_SHIFT) & SHORT_MASK), (int) (word & SHORT_MASK));
  }

  static int labelOf(final long word) {
    return (int) (word & SHORT_MASK);
  }

  static int msOf(final long word) {
    return (int) ((word >>> MS_SHIFT) & SHORT_MASK);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Event)) {
      return false;
    }
    Event event = (Event) o;
    return ms == event.ms && label == event.label && entry.equals(event.entry);
  }

  @Override
  public int hashCode() {
    return (entry.hashCode() * 31 + ms) * 31 + label;
  }

  @Override
  public String toString() {
    return "Event{" + entry + ", ms=" + ms + ", label=" + label + "}";
  }
}
