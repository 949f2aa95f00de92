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

import com.google.common.collect.ImmutableList;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.Op;
import net.opentsdb.procession.core.Procession;
import org.HdrHistogram.DoubleHistogram;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class QueryCollectorTest {

  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
  private static final MetricKey GET = MetricKey.of("http_requests", "method", "GET");
  private static final MetricKey POST = MetricKey.of("http_requests", "method", "POST");
  private static final MetricKey MEMORY = MetricKey.of("memory");
  private static final MetricKey LATENCY = MetricKey.of("latency");

  private Procession procession;

  @BeforeEach
  void before() {
    procession = new Procession();
    int get = procession.intern(GET);
    int post = procession.intern(POST);
    int memory = procession.intern(MEMORY);
    int latency = procession.intern(LATENCY);

    procession.insertAt(T0, Entry.counter(1, Op.ADD), get);
    procession.insertAt(T0.plusSeconds(1), Entry.counter(2, Op.ADD), get);
    procession.insertAt(T0.plusSeconds(2), Entry.counter(5, Op.ADD), post);
    procession.insertAt(T0.plusSeconds(3), Entry.counter(10, Op.SET), post);
    procession.insertAt(T0.plusSeconds(4), Entry.counter(4, Op.ADD), post);

    procession.insertAt(T0.plusSeconds(5), Entry.gauge(50, Op.SET), memory);
    procession.insertAt(T0.plusSeconds(6), Entry.gauge(10, Op.ADD), memory);
    procession.insertAt(T0.plusSeconds(7), Entry.gauge(5, Op.SUB), memory);
    procession.insertAt(T0.plusSeconds(8), Entry.gauge(75, Op.SET), memory);

    for (int i = 1; i <= 100; i++) {
      procession.insertAt(T0.plusSeconds(100 + i), Entry.histogram(i), latency);
    }
  }

  @Test
  void testCounters() {
    QueryCollector collector = QueryCommand.query(procession, QueryFilter.all());
    assertEquals(Long.valueOf(3), collector.getCounters().get(GET));
    assertEquals(Long.valueOf(14), collector.getCounters().get(POST));
  }

  @Test
  void testCounterSumsBeyondU32() {
    Procession big = new Procession();
    int label = big.intern(GET);
    big.insertAt(T0, Entry.counter(0xFFFF_FFFFL, Op.ADD), label);
    big.insertAt(T0, Entry.counter(0xFFFF_FFFFL, Op.ADD), label);
    QueryCollector collector = QueryCommand.query(big, QueryFilter.all());
    assertEquals(Long.valueOf(2 * 0xFFFF_FFFFL), collector.getCounters().get(GET));
  }

  @Test
  void testGauges() {
    GaugeSummary memory =
        QueryCommand.query(procession, QueryFilter.all()).getGauges().get(MEMORY);
    assertEquals(4, memory.getCount());
    assertEquals(50, memory.getMin(), 0.0);
    assertEquals(75, memory.getMax(), 0.0);
    assertEquals(75, memory.getLatest(), 0.0);
    assertEquals((50 + 60 + 55 + 75) / 4.0, memory.getAvg(), 1e-9);
  }

  @Test
  void testGaugeMinStartsFromFirstValue() {
    Procession positive = new Procession();
    int label = positive.intern(MEMORY);
    positive.insertAt(T0, Entry.gauge(5, Op.SET), label);
    positive.insertAt(T0, Entry.gauge(7, Op.SET), label);
    GaugeSummary summary =
        QueryCommand.query(positive, QueryFilter.all()).getGauges().get(MEMORY);
    assertEquals(5, summary.getMin(), 0.0);
  }

  @Test
  void testHistograms() {
    DoubleHistogram latency =
        QueryCommand.query(procession, QueryFilter.all()).getHistograms().get(LATENCY);
    assertEquals(100, latency.getTotalCount());
    assertEquals(50, latency.getValueAtPercentile(50), 0.5);
    assertEquals(90, latency.getValueAtPercentile(90), 0.5);
    assertEquals(99, latency.getValueAtPercentile(99), 0.5);
  }

  @Test
  void testNegativeHistogramValuesSkipped() {
    Procession negative = new Procession();
    int label = negative.intern(LATENCY);
    negative.insertAt(T0, Entry.histogram(-1), label);
    negative.insertAt(T0, Entry.histogram(Float.NaN), label);
    negative.insertAt(T0, Entry.histogram(2), label);
    QueryCollector collector = QueryCommand.query(negative, QueryFilter.all());
    assertEquals(2, collector.getSkipped());
    assertEquals(1, collector.getHistograms().get(LATENCY).getTotalCount());
  }

  @Test
  void testKeyFilter() {
    QueryFilter filter =
        new QueryFilter(ImmutableList.of(Pattern.compile("requests")), null, null, null);
    QueryCollector collector = QueryCommand.query(procession, filter);
    assertEquals(2, collector.getCounters().size());
    assertTrue(collector.getGauges().isEmpty());
    assertTrue(collector.getHistograms().isEmpty());
  }

  @Test
  void testEveryKeyPatternMustMatch() {
    QueryFilter filter =
        new QueryFilter(
            ImmutableList.of(Pattern.compile("http"), Pattern.compile("latency")),
            null,
            null,
            null);
    QueryCollector collector = QueryCommand.query(procession, filter);
    assertTrue(collector.getCounters().isEmpty());
    assertTrue(collector.getHistograms().isEmpty());
  }

  @Test
  void testLabelFilter() {
    QueryFilter filter =
        new QueryFilter(null, ImmutableList.of(LabelFilter.parse("method=POST")), null, null);
    QueryCollector collector = QueryCommand.query(procession, filter);
    assertEquals(1, collector.getCounters().size());
    assertEquals(Long.valueOf(14), collector.getCounters().get(POST));
  }

  @Test
  void testTimeWindowIsHalfOpen() {
    QueryFilter filter = new QueryFilter(null, null, T0.plusSeconds(1), T0.plusSeconds(3));
    QueryCollector collector = QueryCommand.query(procession, filter);
    assertEquals(Long.valueOf(2), collector.getCounters().get(GET));
    assertEquals(Long.valueOf(5), collector.getCounters().get(POST));
    assertTrue(collector.getGauges().isEmpty());
  }
}
