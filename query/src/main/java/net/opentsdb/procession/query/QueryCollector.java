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

package net.opentsdb.procession.query;

import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.CounterEntry;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.GaugeEntry;
import net.opentsdb.procession.core.HistogramEntry;
import net.opentsdb.procession.core.Op;
import net.opentsdb.procession.iter.MetricRef;
import org.HdrHistogram.DoubleHistogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Aggregates the events of a query per key, keeping keys in first-seen order. */
public class QueryCollector {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueryCollector.class);

  static final int SIGNIFICANT_DIGITS = 3;

  private final Map<MetricKey, Long> counters = new LinkedHashMap<>();
  private final Map<MetricKey, GaugeSummary> gauges = new LinkedHashMap<>();
  private final Map<MetricKey, DoubleHistogram> histograms = new LinkedHashMap<>();
  private long skipped;

  public void track(final MetricRef metric) {
    Entry event = metric.getEvent();
    MetricKey key = metric.getMetricKey();
    switch (event.getKind()) {
      case COUNTER:
        trackCounter(key, (CounterEntry) event);
        break;
      case GAUGE:
        GaugeEntry gauge = (GaugeEntry) event;
        gauges
            .computeIfAbsent(key, k -> new GaugeSummary())
            .track(gauge.getOp(), gauge.getValue());
        break;
      case HISTOGRAM:
        trackHistogram(key, (HistogramEntry) event);
        break;
      default:
        throw new IllegalStateException("Unknown entry kind " + event.getKind());
    }
  }

  private void trackCounter(final MetricKey key, final CounterEntry counter) {
    if (counter.getOp() == Op.SET) {
      counters.put(key, counter.getValue());
    } else {
      counters.merge(key, counter.getValue(), Long::sum);
    }
  }

  private void trackHistogram(final MetricKey key, final HistogramEntry histogram) {
    double value = histogram.getValue();
    // HdrHistogram only covers finite, non-negative values
    if (!(value >= 0) || Double.isInfinite(value)) {
      if (skipped++ == 0) {
        LOGGER.warn(
            "Skipping histogram value {} for {}, only finite values >= 0 are kept", value, key);
      }
      return;
    }
    histograms
        .computeIfAbsent(key, k -> new DoubleHistogram(SIGNIFICANT_DIGITS))
        .recordValue(value);
  }

  public Map<MetricKey, Long> getCounters() {
    return Collections.unmodifiableMap(counters);
  }

  public Map<MetricKey, GaugeSummary> getGauges() {
    return Collections.unmodifiableMap(gauges);
  }

  public Map<MetricKey, DoubleHistogram> getHistograms() {
    return Collections.unmodifiableMap(histograms);
  }

  /** Histogram values that could not be recorded. */
  public long getSkipped() {
    return skipped;
  }
}
