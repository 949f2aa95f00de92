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

package net.opentsdb.procession.recorder;

import net.opentsdb.procession.api.Counter;
import net.opentsdb.procession.api.Gauge;
import net.opentsdb.procession.api.Histogram;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.api.Recorder;
import net.opentsdb.procession.codec.ProcessionCodec;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.LabelSet;
import net.opentsdb.procession.core.Procession;
import net.opentsdb.procession.core.ProcessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A {@link Recorder} that appends every write to one shared {@link Procession}.
 *
 * <p>A single lock guards the procession. Registration holds it while interning the key, each
 * write holds it for one insert and readers hold it for their whole read. Writes from different
 * threads land in lock acquisition order, writes through one handle on one thread keep program
 * order.
 *
 * <p>Nothing here throws into instrumented code. A failure inside a locked section releases the
 * lock and is logged, the recorder keeps working for every other caller.
 */
public class ProcessionRecorder implements Recorder {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessionRecorder.class);

  private final Procession procession;
  private final ReentrantLock lock;
  private final ProcessionCodec codec;

  public ProcessionRecorder() {
    this(new ProcessionConfig());
  }

  public ProcessionRecorder(final ProcessionConfig config) {
    this(new Procession(Clock.systemUTC(), config), config);
  }

  public ProcessionRecorder(final Procession procession, final ProcessionConfig config) {
    this.procession = checkNotNull(procession, "procession");
    this.lock = new ReentrantLock(config.fairLock);
    this.codec = new ProcessionCodec(config);
  }

  @Override
  public void describeCounter(String name, String unit, String description) {
    LOGGER.debug("Ignoring description of counter {}: {} ({})", name, description, unit);
  }

  @Override
  public void describeGauge(String name, String unit, String description) {
    LOGGER.debug("Ignoring description of gauge {}: {} ({})", name, description, unit);
  }

  @Override
  public void describeHistogram(String name, String unit, String description) {
    LOGGER.debug("Ignoring description of histogram {}: {} ({})", name, description, unit);
  }

  @Override
  public Counter registerCounter(final MetricKey key) {
    return new ProcessionCounter(intern(key), this);
  }

  @Override
  public Gauge registerGauge(final MetricKey key) {
    return new ProcessionGauge(intern(key), this);
  }

  @Override
  public Histogram registerHistogram(final MetricKey key) {
    return new ProcessionHistogram(intern(key), this);
  }

  private int intern(final MetricKey key) {
    lock.lock();
    try {
      return procession.intern(key);
    } catch (RuntimeException e) {
      LOGGER.error("Failed to intern {}, writes will share id {}", key, LabelSet.OVERFLOW_ID, e);
      return LabelSet.OVERFLOW_ID;
    } finally {
      lock.unlock();
    }
  }

  /** Appends one entry. Called by the handles. */
  void insert(final Entry entry, final int label) {
    lock.lock();
    try {
      procession.insert(entry, label);
    } catch (RuntimeException e) {
      LOGGER.error("Failed to record {} for label {}", entry, label, e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Runs {@code reader} against the live procession while holding the lock. The procession must
   * not escape the function.
   */
  public <T> T read(final Function<Procession, T> reader) {
    lock.lock();
    try {
      return reader.apply(procession);
    } finally {
      lock.unlock();
    }
  }

  /** A consistent, independent copy of everything recorded so far. */
  public Procession snapshot() {
    return read(Procession::copy);
  }

  public long memorySize() {
    return read(Procession::memorySize);
  }

  public long eventCount() {
    return read(Procession::eventCount);
  }

  /** Serializes the canonical JSON form while holding the lock. */
  public void writeTo(final OutputStream out) throws IOException {
    lock.lock();
    try {
      codec.writeProcession(procession, out);
    } finally {
      lock.unlock();
    }
  }
}
