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

package net.opentsdb.procession.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Interning table mapping each distinct {@link MetricKey} to a dense 16 bit id. Ids are handed
 * out in first seen order starting at 0 and are never reused or removed.
 *
 * <p>Once the id space is exhausted every further new key shares {@link #OVERFLOW_ID}. Those keys
 * are not added to the table, so events recorded against them resolve to whichever key owns the
 * last real id. Lossy, but the caller never sees an error.
 *
 * <p>Not thread safe, guarded by the owning recorder.
 */
public final class LabelSet {

  private static final Logger LOGGER = LoggerFactory.getLogger(LabelSet.class);

  public static final int CAPACITY = 1 << 16;
  public static final int OVERFLOW_ID = CAPACITY - 1;

  // per key and per label bookkeeping, excluding the strings
  private static final int KEY_OVERHEAD_BYTES = 48;
  private static final int LABEL_OVERHEAD_BYTES = 24;

  private final Map<MetricKey, Integer> ids;
  private final List<MetricKey> keys; // index is the id, may hold gaps after a reload
  private int count;

  public LabelSet() {
    this.ids = new HashMap<>();
    this.keys = new ArrayList<>();
  }

  /**
   * Rebuilds a table from its persisted entries, keeping every id as given.
   *
   * @throws IllegalArgumentException on a duplicate id or a duplicate key.
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static LabelSet fromEntries(final List<LabelEntry> entries) {
    checkNotNull(entries, "label entries");
    LabelSet set = new LabelSet();
    for (LabelEntry entry : entries) {
      checkNotNull(entry, "null label entry");
      MetricKey key = entry.getKey();
      int id = entry.getId();
      checkArgument(!set.ids.containsKey(key), "duplicate key in label set: %s", key);
      checkArgument(set.resolve(id) == null, "duplicate id in label set: %s", id);
      set.put(key, id);
    }
    return set;
  }

  /** @return the id of the key, empty if it has never been interned. */
  public OptionalInt lookup(final MetricKey key) {
    Integer id = ids.get(key);
    return id == null ? OptionalInt.empty() : OptionalInt.of(id);
  }

  /** Returns the id for the key, assigning the next free one when the key is new. */
  public int intern(final MetricKey key) {
    checkNotNull(key, "key");
    Integer existing = ids.get(key);
    if (existing != null) {
      return existing;
    }
    int id = keys.size();
    if (id > OVERFLOW_ID) {
      LOGGER.warn(
          "Label set is full with {} keys, {} will share id {}", count, key, OVERFLOW_ID);
      return OVERFLOW_ID;
    }
    put(key, id);
    return id;
  }

  /** Reverse lookup, null when nothing was assigned the id. */
  public MetricKey resolve(final int id) {
    if (id < 0 || id >= keys.size()) {
      return null;
    }
    return keys.get(id);
  }

  public int size() {
    return count;
  }

  /** The assigned keys in id order, also the persisted form. */
  @JsonValue
  public List<LabelEntry> entries() {
    List<LabelEntry> entries = new ArrayList<>(count);
    for (int id = 0; id < keys.size(); id++) {
      MetricKey key = keys.get(id);
      if (key != null) {
        entries.add(new LabelEntry(key, id));
      }
    }
    return entries;
  }

  /**
   * Estimated bytes held by the table. A string shared by several keys, such as a common metric
   * name or label value, is only counted the first time it is seen.
   */
  public long memorySize() {
    Set<String> seen = new HashSet<>();
    long bytes = 0;
    for (MetricKey key : ids.keySet()) {
      bytes += KEY_OVERHEAD_BYTES + Short.BYTES + stringBytes(key.getName(), seen);
      for (Label label : key.getLabels()) {
        bytes += LABEL_OVERHEAD_BYTES;
        bytes += stringBytes(label.getKey(), seen);
        bytes += stringBytes(label.getValue(), seen);
      }
    }
    return bytes;
  }

  LabelSet copy() {
    LabelSet copy = new LabelSet();
    copy.ids.putAll(ids);
    copy.keys.addAll(keys);
    copy.count = count;
    return copy;
  }

  private void put(final MetricKey key, final int id) {
    while (keys.size() <= id) {
      keys.add(null);
    }
    keys.set(id, key);
    ids.put(key, id);
    count++;
  }

  private static long stringBytes(final String s, final Set<String> seen) {
    return seen.add(s) ? s.length() : 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LabelSet)) {
      return false;
    }
    return ids.equals(((LabelSet) o).ids);
  }

  @Override
  public int hashCode() {
    return ids.hashCode();
  }

  @Override
  public String toString() {
    return "LabelSet{size=" + count + "}";
  }
}
