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

import net.opentsdb.procession.api.Gauge;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.Op;

/** Gauge handle bound to one label id. Values are narrowed to float as is, NaN included. */
final class ProcessionGauge implements Gauge {

  private final int label;
  private final ProcessionRecorder recorder;

  ProcessionGauge(final int label, final ProcessionRecorder recorder) {
    this.label = label;
    this.recorder = recorder;
  }

  @Override
  public void increment(final double value) {
    recorder.insert(Entry.gauge((float) value, Op.ADD), label);
  }

  @Override
  public void decrement(final double value) {
    recorder.insert(Entry.gauge((float) value, Op.SUB), label);
  }

  @Override
  public void set(final double value) {
    recorder.insert(Entry.gauge((float) value, Op.SET), label);
  }

  int label() {
    return label;
  }
}
