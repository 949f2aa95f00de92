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

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * All the events recorded within 65,535 ms of a reference time. Events are append only and are
 * kept packed in parallel primitive arrays, see {@link Event} for the layout.
 */
@JsonPropertyOrder({"reference_time", "events"})
public final class Chunk {

  public static final int DEFAULT_CAPACITY = 256;

  // object header + reference time + two array headers + size
  private static final int OVERHEAD_BYTES = 16 + 24 + 2 * 16 + Integer.BYTES;
  private static final int EVENT_BYTES = Long.BYTES + Byte.BYTES;

  private final Instant referenceTime;
  private long[] words;
  private byte[] tags;
  private int size;

  public Chunk(final Instant referenceTime) {
    this(referenceTime, DEFAULT_CAPACITY);
  }

  public Chunk(final Instant referenceTime, final int initialCapacity) {
    checkArgument(initialCapacity > 0, "initial capacity must be positive: %s", initialCapacity);
    this.referenceTime = checkNotNull(referenceTime, "reference time").truncatedTo(ChronoUnit.MILLIS);
    this.words = new long[initialCapacity];
    this.tags = new byte[initialCapacity];
  }

  @JsonCreator
  static Chunk fromJson(
      @JsonProperty(value = "reference_time", required = true) final Instant referenceTime,
      @JsonProperty(value = "events", required = true) final List<Event> events) {
    Chunk chunk = new Chunk(referenceTime, Math.max(events.size(), 1));
    for (Event event : events) {
      chunk.append(event);
    }
    return chunk;
  }

  /**
   * Appends the event. The event only becomes visible once both the packed word and the tag have
   * been written.
   */
  public void append(final Event event) {
    if (size == words.length) {
      int newCapacity = words.length * 2;
      words = Arrays.copyOf(words, newCapacity);
      tags = Arrays.copyOf(tags, newCapacity);
    }
    words[size] = event.pack();
    tags[size] = event.tag();
    size++;
  }

  @JsonProperty("reference_time")
  public Instant getReferenceTime() {
    return referenceTime;
  }

  @JsonProperty("events")
  public List<Event> getEvents() {
    return new AbstractList<Event>() {
      @Override
      public Event get(int index) {
        return Chunk.this.get(index);
      }

      @Override
      public int size() {
        return size;
      }
    };
  }

  public Event get(final int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
    }
    return Event.unpack(tags[index], words[index]);
  }

  /** Absolute time of the event at {@code index}, reference time plus its offset. */
  public Instant timeOf(final int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
    }
    return referenceTime.plusMillis(Event.msOf(words[index]));
  }

  public int labelOf(final int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("Index: " + index + ", Size: " + size);
    }
    return Event.labelOf(words[index]);
  }

  public int size() {
    return size;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return size == 0;
  }

  /** Rough size in bytes, grows with every appended event. */
  public long memorySize() {
    return OVERHEAD_BYTES + (long) size * EVENT_BYTES;
  }

  Chunk copy() {
    Chunk copy = new Chunk(referenceTime, Math.max(size, 1));
    System.arraycopy(words, 0, copy.words, 0, size);
    System.arraycopy(tags, 0, copy.tags, 0, size);
    copy.size = size;
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Chunk)) {
      return false;
    }
    Chunk other = (Chunk) o;
    if (size != other.size || !referenceTime.equals(other.referenceTime)) {
      return false;
    }
    for (int i = 0; i < size; i++) {
      if (words[i] != other.words[i] || tags[i] != other.tags[i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = referenceTime.hashCode();
    for (int i = 0; i < size; i++) {
      result = 31 * result + Long.hashCode(words[i]);
      result = 31 * result + tags[i];
    }
    return result;
  }

  @Override
  public String toString() {
    return "Chunk{referenceTime=" + referenceTime + ", events=" + size + "}";
  }
}
