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
import net.opentsdb.procession.iter.MetricRef;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Selects the events a query aggregates. An event passes when every key pattern finds a match in
 * its name, every label filter matches one of its labels and its time falls in
 * {@code [start, end)}. Null bounds are open.
 */
public class QueryFilter {

  private final List<Pattern> keys;
  private final List<LabelFilter> labels;
  private final Instant start;
  private final Instant end;

  public QueryFilter(
      final List<Pattern> keys,
      final List<LabelFilter> labels,
      final Instant start,
      final Instant end) {
    this.keys = keys == null ? ImmutableList.of() : ImmutableList.copyOf(keys);
    this.labels = labels == null ? ImmutableList.of() : ImmutableList.copyOf(labels);
    this.start = start;
    this.end = end;
  }

  public static QueryFilter all() {
    return new QueryFilter(null, null, null, null);
  }

  public boolean matches(final MetricRef metric) {
    MetricKey key = metric.getMetricKey();
    for (Pattern pattern : keys) {
      if (!pattern.matcher(key.getName()).find()) {
        return false;
      }
    }
    for (LabelFilter label : labels) {
      if (!label.matches(key)) {
        return false;
      }
    }
    Instant when = metric.getWhen();
    if (start != null && when.isBefore(start)) {
      return false;
    }
    return end == null || when.isBefore(end);
  }
}
