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
import net.opentsdb.procession.core.CounterEntry;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.Op;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counter handle bound to one label id. Values are stored as u32, anything wider is dropped with
 * a warning and the handle stays usable.
 */
final class ProcessionCounter implements Counter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessionCounter.class);

  private final int label;
  private final ProcessionRecorder recorder;

  ProcessionCounter(final int label, final ProcessionRecorder recorder) {
    this.label = label;
    this.recorder = recorder;
  }

  @Override
  public void increment(final long value) {
    insert(value, Op.ADD);
  }

  @Override
  public void absolute(final long value) {
    insert(value, Op.SET);
  }

  private void insert(final long value, final Op op) {
    // the value is an unsigned 64 bit quantity
    if (Long.compareUnsigned(value, CounterEntry.MAX_VALUE) > 0) {
      LOGGER.warn(
          "Counter value {} for label {} exceeds u32, skipping event",
          Long.toUnsignedString(value),
          label);
      return;
    }
    recorder.insert(Entry.counter(value, op), label);
  }

  int label() {
    return label;
  }
}
