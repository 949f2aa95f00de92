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

package net.opentsdb.procession.iter;

import net.opentsdb.procession.core.Procession;

import java.util.Iterator;

/**
 * Same walk as {@link MetricRefIterator} but every event copies its name and labels out of the
 * procession. Expect an allocation per string per event.
 */
public final class MetricIterator implements Iterator<Metric> {

  private final MetricRefIterator refs;

  public MetricIterator(final Procession procession) {
    this.refs = new MetricRefIterator(procession);
  }

  @Override
  public boolean hasNext() {
    return refs.hasNext();
  }

  @Override
  public Metric next() {
    return refs.next().toMetric();
  }
}
