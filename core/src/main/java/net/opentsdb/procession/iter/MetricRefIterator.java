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

import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.Chunk;
import net.opentsdb.procession.core.LabelSet;
import net.opentsdb.procession.core.Procession;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks a {@link Procession} chunk by chunk, event by event, rebuilding each event's absolute
 * time and resolving its label id back to the key held in the label table. Nothing is copied.
 *
 * <p>An id missing from the table yields {@link #UNKNOWN_KEY} instead of stopping the walk.
 */
public final class MetricRefIterator implements Iterator<MetricRef> {

  /** Stands in for a key whose id can't be resolved. */
  public static final MetricKey UNKNOWN_KEY = MetricKey.of("");

  private final List<Chunk> chunks;
  private final LabelSet labels;
  private int chunkIndex;
  private int eventIndex;

  public MetricRefIterator(final Procession procession) {
    this.chunks = procession.getChunks();
    this.labels = procession.getLabels();
  }

  @Override
  public boolean hasNext() {
    // skip exhausted and empty chunks
    while (chunkIndex < chunks.size() && eventIndex >= chunks.get(chunkIndex).size()) {
      chunkIndex++;
      eventIndex = 0;
    }
    return chunkIndex < chunks.size();
  }

  @Override
  public MetricRef next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    Chunk chunk = chunks.get(chunkIndex);
    int index = eventIndex++;
    MetricKey key = labels.resolve(chunk.labelOf(index));
    return new MetricRef(
        chunk.timeOf(index), chunk.get(index).getEntry(), key == null ? UNKNOWN_KEY : key);
  }
}
