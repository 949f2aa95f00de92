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
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.annotations.VisibleForTesting;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.iter.Metric;
import net.opentsdb.procession.iter.MetricIterator;
import net.opentsdb.procession.iter.MetricRef;
import net.opentsdb.procession.iter.MetricRefIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An append only time series of metric events: a chronological list of {@link Chunk}s plus the
 * {@link LabelSet} their events refer to.
 *
 * <p>One full timestamp is stored per chunk, every event carries only a 16 bit millisecond offset
 * from it. A new chunk is started by the first insert and whenever an insert lands more than
 * {@link #MAX_CHUNK_SPAN_MS} after the current chunk's reference time. An insert exactly
 * {@link #MAX_CHUNK_SPAN_MS} later still belongs to the current chunk.
 *
 * <p>Not thread safe. Share it through a {@code ProcessionRecorder}.
 */
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
@JsonPropertyOrder({"chunks", "labels"})
public final class Procession implements Iterable<MetricRef> {

  private static final Logger LOGGER = LoggerFactory.getLogger(Procession.class);

  public static final int MAX_CHUNK_SPAN_MS = Event.MAX_MS;

  // object header, list and clock references, config
  private static final int OVERHEAD_BYTES = 16 + 3 * 8 + 40;
  private static final int CHUNK_REFERENCE_BYTES = 8;

  private final List<Chunk> chunks;
  private final LabelSet labels;
  private final Clock clock;
  private final ProcessionConfig config;

  public Procession() {
    this(Clock.systemUTC(), new ProcessionConfig());
  }

  public Procession(final Clock clock) {
    this(clock, new ProcessionConfig());
  }

  public Procession(final Clock clock, final ProcessionConfig config) {
    this(new ArrayList<>(), new LabelSet(), clock, config);
  }

  public Procession(final List<Chunk> chunks, final LabelSet labels) {
    this(new ArrayList<>(chunks), labels, Clock.systemUTC(), new ProcessionConfig());
  }

  private Procession(
      final List<Chunk> chunks,
      final LabelSet labels,
      final Clock clock,
      final ProcessionConfig config) {
    this.chunks = chunks;
    this.labels = checkNotNull(labels, "labels");
    this.clock = checkNotNull(clock, "clock");
    this.config = checkNotNull(config, "config");
    checkArgument(config.initialChunkCapacity > 0, "initialChunkCapacity must be positive");
    for (int i = 1; i < chunks.size(); i++) {
      Instant previous = chunks.get(i - 1).getReferenceTime();
      Instant current = chunks.get(i).getReferenceTime();
      checkArgument(
          !current.isBefore(previous),
          "chunk %s reference time %s precedes chunk %s at %s",
          i,
          current,
          i - 1,
          previous);
    }
  }

  @JsonCreator
  static Procession fromJson(
      @JsonProperty(value = "chunks", required = true) final List<Chunk> chunks,
      @JsonProperty(value = "labels", required = true) final LabelSet labels) {
    checkNotNull(chunks, "chunks");
    for (Chunk chunk : chunks) {
      checkNotNull(chunk, "null chunk");
    }
    return new Procession(chunks, labels);
  }

  /**
   * Builds a procession from flattened events. Every event is placed by its own timestamp, so a
   * procession that is iterated and rebuilt comes back with the same chunks.
   */
  public static Procession fromMetrics(final Iterable<Metric> metrics) {
    return fromMetrics(metrics.iterator());
  }

  public static Procession fromMetrics(final Iterator<Metric> metrics) {
    Procession procession = new Procession();
    while (metrics.hasNext()) {
      Metric metric = metrics.next();
      int label = procession.intern(metric.toKey());
      procession.insertAt(metric.getWhen(), metric.getEvent(), label);
    }
    return procession;
  }

  /** Same as {@link #fromMetrics(Iterable)} without cloning the keys. */
  public static Procession fromMetricRefs(final Iterable<MetricRef> metrics) {
    Procession procession = new Procession();
    for (MetricRef metric : metrics) {
      int label = procession.intern(metric.getMetricKey());
      procession.insertAt(metric.getWhen(), metric.getEvent(), label);
    }
    return procession;
  }

  /** Interns the key in the label table. */
  public int intern(final MetricKey key) {
    return labels.intern(key);
  }

  /** Appends the entry stamped with the current time. */
  public void insert(final Entry entry, final int label) {
    insertAt(clock.instant(), entry, label);
  }

  /** Appends the entry stamped with {@code when}, rolling over to a new chunk when needed. */
  public void insertAt(final Instant when, final Entry entry, final int label) {
    checkNotNull(entry, "entry");
    Instant at = when.truncatedTo(ChronoUnit.MILLIS);
    Chunk chunk = chunkFor(at);
    long elapsed = Duration.between(chunk.getReferenceTime(), at).toMillis();
    if (elapsed < 0) {
      LOGGER.warn(
          "Event at {} precedes chunk reference time {}, recording it at offset 0",
          at,
          chunk.getReferenceTime());
      elapsed = 0;
    }
    chunk.append(new Event(entry, (int) elapsed, label));
  }

  /**
   * Returns the chunk an event at {@code at} belongs in, appending a new one whose reference
   * time is {@code at} when there is none or the last one can't reach it.
   */
  @VisibleForTesting
  Chunk chunkFor(final Instant at) {
    if (!chunks.isEmpty()) {
      Chunk last = chunks.get(chunks.size() - 1);
      if (Duration.between(last.getReferenceTime(), at).toMillis() <= MAX_CHUNK_SPAN_MS) {
        return last;
      }
    }
    Chunk chunk = new Chunk(at, config.initialChunkCapacity);
    chunks.add(chunk);
    LOGGER.debug("Started chunk {} at {}", chunks.size(), at);
    return chunk;
  }

  @JsonProperty("chunks")
  public List<Chunk> getChunks() {
    return Collections.unmodifiableList(chunks);
  }

  @JsonProperty("labels")
  public LabelSet getLabels() {
    return labels;
  }

  @JsonIgnore
  public Clock getClock() {
    return clock;
  }

  public long eventCount() {
    long count = 0;
    for (Chunk chunk : chunks) {
      count += chunk.size();
    }
    return count;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return chunks.isEmpty();
  }

  /**
   * A best effort estimate of the bytes held. Strings shared between label entries are counted
   * once. Grows with every insert.
   */
  public long memorySize() {
    long bytes = OVERHEAD_BYTES + labels.memorySize();
    for (Chunk chunk : chunks) {
      bytes += CHUNK_REFERENCE_BYTES + chunk.memorySize();
    }
    return bytes;
  }

  /** Walks every event in append order, sharing keys with the label table. */
  @Override
  public MetricRefIterator iterator() {
    return new MetricRefIterator(this);
  }

  /** Walks every event in append order, copying keys out so the results outlive this. */
  public MetricIterator ownedIterator() {
    return new MetricIterator(this);
  }

  /** Deep copy sharing nothing mutable with this instance. */
  public Procession copy() {
    List<Chunk> copies = new ArrayList<>(chunks.size());
    for (Chunk chunk : chunks) {
      copies.add(chunk.copy());
    }
    return new Procession(copies, labels.copy(), clock, config);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Procession)) {
      return false;
    }
    Procession other = (Procession) o;
    return chunks.equals(other.chunks) && labels.equals(other.labels);
  }

  @Override
  public int hashCode() {
    return 31 * chunks.hashCode() + labels.hashCode();
  }

  @Override
  public String toString() {
    return "Procession{chunks=" + chunks.size() + ", labels=" + labels.size() + "}";
  }
}
