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

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ChunkTest {

  private static final Instant REFERENCE = Instant.parse("2024-01-01T00:00:00Z");

  @Test
  void testReferenceTimeTruncatedToMillis() {
    Chunk chunk = new Chunk(Instant.parse("2024-01-01T00:00:00.123456789Z"));
    assertEquals(Instant.parse("2024-01-01T00:00:00.123Z"), chunk.getReferenceTime());
    assertTrue(chunk.isEmpty());
  }

  @Test
  void testAppendAndGet() {
    Chunk chunk = new Chunk(REFERENCE);
    Event counter = new Event(Entry.counter(42, Op.ADD), 0, 0);
    Event gauge = new Event(Entry.gauge(-1.5f, Op.SUB), 1500, 7);
    Event histogram = new Event(Entry.histogram(0.25f), 65535, 65535);
    chunk.append(counter);
    chunk.append(gauge);
    chunk.append(histogram);

    assertEquals(3, chunk.size());
    assertEquals(counter, chunk.get(0));
    assertEquals(gauge, chunk.get(1));
    assertEquals(histogram, chunk.get(2));
    assertEquals(REFERENCE.plusMillis(1500), chunk.timeOf(1));
    assertEquals(65535, chunk.labelOf(2));
    assertEquals(3, chunk.getEvents().size());
  }

  @Test
  void testGrowsPastInitialCapacity() {
    Chunk chunk = new Chunk(REFERENCE, 2);
    for (int i = 0; i < 100; i++) {
      chunk.append(new Event(Entry.counter(i, Op.SET), i, i % 3));
    }
    assertEquals(100, chunk.size());
    for (int i = 0; i < 100; i++) {
      assertEquals(new Event(Entry.counter(i, Op.SET), i, i % 3), chunk.get(i));
    }
  }

  @Test
  void testCounterKeepsFullUnsignedRange() {
    Chunk chunk = new Chunk(REFERENCE);
    chunk.append(new Event(Entry.counter(CounterEntry.MAX_VALUE, Op.ADD), 0, 0));
    assertEquals(
        CounterEntry.MAX_VALUE, ((CounterEntry) chunk.get(0).getEntry()).getValue());
  }

  @Test
  void testOutOfBounds() {
    Chunk chunk = new Chunk(REFERENCE);
    assertThrows(IndexOutOfBoundsException.class, () -> chunk.get(0));
    assertThrows(IndexOutOfBoundsException.class, () -> chunk.timeOf(-1));
  }

  @Test
  void testMemorySizeGrows() {
    Chunk chunk = new Chunk(REFERENCE);
    long previous = chunk.memorySize();
    for (int i = 0; i < 10; i++) {
      chunk.append(new Event(Entry.histogram(i), i, 0));
      assertTrue(chunk.memorySize() > previous);
      previous = chunk.memorySize();
    }
  }

  @Test
  void testCopyIsIndependent() {
    Chunk chunk = new Chunk(REFERENCE);
    chunk.append(new Event(Entry.gauge(1, Op.SET), 10, 1));
    Chunk copy = chunk.copy();
    assertEquals(chunk, copy);

    copy.append(new Event(Entry.gauge(2, Op.SET), 20, 1));
    assertEquals(1, chunk.size());
    assertNotEquals(chunk, copy);
    assertFalse(copy.isEmpty());
  }

  @Test
  void testEventRanges() {
    assertThrows(IllegalArgumentException.class, () -> new Event(Entry.histogram(1), 65536, 0));
    assertThrows(IllegalArgumentException.class, () -> new Event(Entry.histogram(1), -1, 0));
    assertThrows(IllegalArgumentException.class, () -> new Event(Entry.histogram(1), 0, 65536));
  }

  @Test
  void testCounterRejectsSubAndOutOfRange() {
    assertThrows(IllegalArgumentException.class, () -> Entry.counter(1, Op.SUB));
    assertThrows(IllegalArgumentException.class, () -> Entry.counter(-1, Op.ADD));
    assertThrows(
        IllegalArgumentException.class, () -> Entry.counter(CounterEntry.MAX_VALUE + 1, Op.ADD));
  }

  @Test
  void testGaugeNaNSurvivesStorage() {
    Chunk chunk = new Chunk(REFERENCE);
    chunk.append(new Event(Entry.gauge(Float.NaN, Op.SET), 0, 0));
    assertTrue(Float.isNaN(((GaugeEntry) chunk.get(0).getEntry()).getValue()));
    assertEquals(new Event(Entry.gauge(Float.NaN, Op.SET), 0, 0), chunk.get(0));
  }
}
