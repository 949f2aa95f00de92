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

import com.google.common.collect.ImmutableList;
import net.opentsdb.procession.api.MetricKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LabelSetTest {

  @Test
  void testEmpty() {
    LabelSet labels = new LabelSet();
    assertEquals(0, labels.size());
    assertFalse(labels.lookup(MetricKey.of("nothing")).isPresent());
    assertNull(labels.resolve(0));
  }

  @Test
  void testInternNewKey() {
    LabelSet labels = new LabelSet();
    MetricKey key = MetricKey.of("test_metric");

    assertEquals(0, labels.intern(key));
    assertEquals(1, labels.size());
    assertEquals(OptionalInt.of(0), labels.lookup(key));
    assertSame(key, labels.resolve(0));
  }

  @Test
  void testInternExistingKey() {
    LabelSet labels = new LabelSet();
    MetricKey key = MetricKey.of("test_metric");

    int id1 = labels.intern(key);
    int id2 = labels.intern(MetricKey.of("test_metric"));
    assertEquals(id1, id2);
    assertEquals(1, labels.size());
  }

  @Test
  void testLabelOrderSharesId() {
    LabelSet labels = new LabelSet();
    int id1 = labels.intern(MetricKey.of("metric", "a", "1", "b", "2"));
    int id2 = labels.intern(MetricKey.of("metric", "b", "2", "a", "1"));
    assertEquals(id1, id2);
    assertEquals(1, labels.size());
  }

  @Test
  void testDifferentLabelsGetDifferentIds() {
    LabelSet labels = new LabelSet();
    int id1 = labels.intern(MetricKey.of("http_requests", "method", "GET", "status", "200"));
    int id2 = labels.intern(MetricKey.of("http_requests", "method", "POST", "status", "201"));
    assertNotEquals(id1, id2);
    assertEquals(2, labels.size());
  }

  @Test
  void testIdsAreDenseInFirstSeenOrder() {
    LabelSet labels = new LabelSet();
    for (int i = 0; i < 1000; i++) {
      assertEquals(i, labels.intern(MetricKey.of("metric_" + i, "index", String.valueOf(i))));
      // re-interning an older key never moves the counter
      assertEquals(i / 2, labels.intern(MetricKey.of("metric_" + i / 2, "index", String.valueOf(i / 2))));
    }
    assertEquals(1000, labels.size());
  }

  @Test
  void testEmptyName() {
    LabelSet labels = new LabelSet();
    MetricKey key = MetricKey.of("");
    assertEquals(0, labels.intern(key));
    assertEquals(OptionalInt.of(0), labels.lookup(key));
  }

  @Test
  void testOverflowSharesLastId() {
    LabelSet labels = new LabelSet();
    for (int i = 0; i < LabelSet.CAPACITY; i++) {
      assertEquals(i, labels.intern(MetricKey.of("metric_" + i)));
    }
    assertEquals(LabelSet.CAPACITY, labels.size());

    assertEquals(LabelSet.OVERFLOW_ID, labels.intern(MetricKey.of("")));
    assertEquals(LabelSet.OVERFLOW_ID, labels.intern(MetricKey.of("one_more")));
    assertEquals(LabelSet.CAPACITY, labels.size());
    assertFalse(labels.lookup(MetricKey.of("one_more")).isPresent());

    // the key that legitimately owns the last id keeps it
    assertEquals(MetricKey.of("metric_65535"), labels.resolve(LabelSet.OVERFLOW_ID));
    assertEquals(0, labels.intern(MetricKey.of("metric_0")));
  }

  @Test
  void testEntriesInIdOrder() {
    LabelSet labels = new LabelSet();
    labels.intern(MetricKey.of("b"));
    labels.intern(MetricKey.of("a", "env", "prod"));

    List<LabelEntry> entries = labels.entries();
    assertEquals(2, entries.size());
    assertEquals("b", entries.get(0).getName());
    assertEquals(0, entries.get(0).getId());
    assertEquals("a", entries.get(1).getName());
    assertEquals(1, entries.get(1).getId());
  }

  @Test
  void testFromEntriesKeepsIds() {
    LabelSet labels =
        LabelSet.fromEntries(
            ImmutableList.of(
                new LabelEntry(MetricKey.of("label1", "key", "value"), 1),
                new LabelEntry(MetricKey.of("label2", "key", "value", "other", "value"), 2),
                new LabelEntry(MetricKey.of("label3"), 3)));

    assertEquals(3, labels.size());
    assertNull(labels.resolve(0));
    assertEquals(MetricKey.of("label3"), labels.resolve(3));
    assertEquals(OptionalInt.of(2), labels.lookup(MetricKey.of("label2", "other", "value", "key", "value")));
    // next id continues past the highest loaded one
    assertEquals(4, labels.intern(MetricKey.of("label4")));
  }

  @Test
  void testFromEntriesRejectsDuplicates() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            LabelSet.fromEntries(
                ImmutableList.of(
                    new LabelEntry(MetricKey.of("a"), 0), new LabelEntry(MetricKey.of("b"), 0))));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            LabelSet.fromEntries(
                ImmutableList.of(
                    new LabelEntry(MetricKey.of("a"), 0), new LabelEntry(MetricKey.of("a"), 1))));
  }

  @Test
  void testMemorySizeCountsSharedStringsOnce() {
    MetricKey get = MetricKey.of("http_requests_total", "method", "GET");
    MetricKey post = MetricKey.of("http_requests_total", "method", "POST");

    LabelSet onlyGet = new LabelSet();
    onlyGet.intern(get);
    LabelSet onlyPost = new LabelSet();
    onlyPost.intern(post);
    LabelSet both = new LabelSet();
    both.intern(get);
    both.intern(post);

    long shared = "http_requests_total".length() + "method".length();
    assertEquals(onlyGet.memorySize() + onlyPost.memorySize() - shared, both.memorySize());
    assertTrue(both.memorySize() > onlyGet.memorySize());
  }

  @Test
  void testEquality() {
    LabelSet a = new LabelSet();
    a.intern(MetricKey.of("x", "k", "v"));
    LabelSet b = LabelSet.fromEntries(a.entries());
    assertEquals(a, b);
    b.intern(MetricKey.of("y"));
    assertNotEquals(a, b);
  }
}
