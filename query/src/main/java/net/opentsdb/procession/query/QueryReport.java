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

import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;
import org.HdrHistogram.DoubleHistogram;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;

/** Renders a {@link QueryCollector} as plain text, lines always end with '\n'. */
public class QueryReport {

  static final double[] PERCENTILES = {50.0, 75.0, 90.0, 99.0};

  private final PrintWriter out;

  public QueryReport(final PrintWriter out) {
    this.out = out;
  }

  public void write(final QueryCollector collector) {
    if (!collector.getCounters().isEmpty()) {
      line("-----COUNTERS-----");
      for (Map.Entry<MetricKey, Long> entry : collector.getCounters().entrySet()) {
        writeKey(entry.getKey());
        line(entry.getValue());
        line("-");
      }
    }
    if (!collector.getGauges().isEmpty()) {
      line("-----GAUGES-----");
      for (Map.Entry<MetricKey, GaugeSummary> entry : collector.getGauges().entrySet()) {
        GaugeSummary gauge = entry.getValue();
        writeKey(entry.getKey());
        line(String.format(Locale.ROOT, "   min: %.2f", gauge.getMin()));
        line(String.format(Locale.ROOT, "   max: %.2f", gauge.getMax()));
        line(String.format(Locale.ROOT, "   avg: %.2f", gauge.getAvg()));
        line(String.format(Locale.ROOT, "latest: %.2f", gauge.getLatest()));
        line(" count: " + gauge.getCount());
        line("-");
      }
    }
    if (!collector.getHistograms().isEmpty()) {
      line("-----HISTOS-----");
      for (Map.Entry<MetricKey, DoubleHistogram> entry : collector.getHistograms().entrySet()) {
        DoubleHistogram histogram = entry.getValue();
        writeKey(entry.getKey());
        for (double percentile : PERCENTILES) {
          line(
              String.format(
                  Locale.ROOT,
                  "p%.0f: %.2f",
                  percentile,
                  histogram.getValueAtPercentile(percentile)));
        }
        line(" count: " + histogram.getTotalCount());
        line("-");
      }
    }
    out.flush();
  }

  private void line(final Object text) {
    out.print(text);
    out.print('\n');
  }

  private void writeKey(final MetricKey key) {
    StringBuilder buf = new StringBuilder(key.getName()).append(" {");
    for (Label label : key.getLabels()) {
      buf.append("\n  ").append(label.getKey()).append(" => ").append(label.getValue());
    }
    line(buf.append('}'));
  }
}
