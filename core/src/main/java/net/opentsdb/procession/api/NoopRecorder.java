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

package net.opentsdb.procession.api;

/** Discards everything. Useful as a default when no recorder has been wired in. */
public final class NoopRecorder implements Recorder {

  public static final NoopRecorder INSTANCE = new NoopRecorder();

  private static final Counter COUNTER =
      new Counter() {
        @Override
        public void increment(long value) {}

        @Override
        public void absolute(long value) {}
      };

  private static final Gauge GAUGE =
      new Gauge() {
        @Override
        public void increment(double value) {}

        @Override
        public void decrement(double value) {}

        @Override
        public void set(double value) {}
      };

  private static final Histogram HISTOGRAM = value -> {};

  private NoopRecorder() {}

  @Override
  public void describeCounter(String name, String unit, String description) {}

  @Override
  public void describeGauge(String name, String unit, String description) {}

  @Override
  public void describeHistogram(String name, String unit, String description) {}

  @Override
  public Counter registerCounter(MetricKey key) {
    return COUNTER;
  }

  @Override
  public Gauge registerGauge(MetricKey key) {
    return GAUGE;
  }

  @Override
  public Histogram registerHistogram(MetricKey key) {
    return HISTOGRAM;
  }
}
