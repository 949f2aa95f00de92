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

/**
 * The instrumentation registration interface host code talks to. A recorder hands out handles
 * bound to one {@link MetricKey}; the handles are then used for every subsequent write.
 *
 * <p>None of the methods here may throw into instrumented code.
 */
public interface Recorder {

  void describeCounter(String name, String unit, String description);

  void describeGauge(String name, String unit, String description);

  void describeHistogram(String name, String unit, String description);

  Counter registerCounter(MetricKey key);

  Gauge registerGauge(MetricKey key);

  Histogram registerHistogram(MetricKey key);
}
