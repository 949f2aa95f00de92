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

package net.opentsdb.procession.codec;

import com.esotericsoftware.kryo.io.Output;
import com.google.common.collect.ImmutableList;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.Chunk;
import net.opentsdb.procession.core.CounterEntry;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.Event;
import net.opentsdb.procession.core.LabelEntry;
import net.opentsdb.procession.core.LabelSet;
import net.opentsdb.procession.core.Op;
import net.opentsdb.procession.core.Procession;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProcessionKryoCodecTest {

  private static final Instant T0 = Instant.parse("2023-11-11T11:11:11.111Z");

  private final ProcessionKryoCodec codec = new ProcessionKryoCodec();

  @Test
  void testRoundTrip() throws Exception {
    Procession procession = new Procession();
    int a = procession.intern(MetricKey.of("requests", "method", "GET", "status", "200"));
    int b = procession.intern(MetricKey.of("queue_depth"));
    procession.insertAt(T0, Entry.counter(CounterEntry.MAX_VALUE, Op.ADD), a);
    procession.insertAt(T0.plusMillis(1), Entry.gauge(-3.5f, Op.SUB), b);
    procession.insertAt(T0.plusSeconds(100), Entry.gauge(Float.NaN, Op.SET), b);
    procession.insertAt(T0.plusSeconds(101), Entry.histogram(1e-3f), a);

    Procession read = codec.fromBytes(codec.toBytes(procession));
    assertEquals(procession, read);
    assertEquals(4, read.eventCount());
  }

  @Test
  void testStreamRoundTrip() throws Exception {
    Procession procession = new Procession();
    procession.insertAt(T0, Entry.histogram(5), procession.intern(MetricKey.of("h")));

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    codec.write(procession, out);
    assertEquals(procession, codec.read(new ByteArrayInputStream(out.toByteArray())));
  }

  @Test
  void testKeepsLabelIdGaps() throws Exception {
    Chunk chunk = new Chunk(T0);
    chunk.append(new Event(Entry.histogram(1), 0, 40));
    LabelSet labels =
        LabelSet.fromEntries(
            ImmutableList.of(
                new LabelEntry(MetricKey.of("x"), 40), new LabelEntry(MetricKey.of("y"), 3)));
    Procession procession = new Procession(ImmutableList.of(chunk), labels);

    Procession read = codec.fromBytes(codec.toBytes(procession));
    assertEquals(procession, read);
    assertEquals(MetricKey.of("x"), read.getLabels().resolve(40));
  }

  @Test
  void testBadMagicFails() {
    byte[] bytes = codec.toBytes(new Procession());
    bytes[0] ^= 0x7f;
    assertThrows(ProcessionFormatException.class, () -> codec.fromBytes(bytes));
  }

  @Test
  void testTruncatedFails() {
    Procession procession = new Procession();
    procession.insertAt(T0, Entry.histogram(5), procession.intern(MetricKey.of("h")));
    byte[] bytes = codec.toBytes(procession);
    assertThrows(
        ProcessionFormatException.class,
        () -> codec.fromBytes(Arrays.copyOf(bytes, bytes.length - 3)));
  }

  @Test
  void testOversizedEventCountFails() {
    Output output = new Output(64, -1);
    output.writeInt(ProcessionKryoCodec.MAGIC);
    output.writeByte(ProcessionKryoCodec.VERSION);
    output.writeVarInt(0, true);
    output.writeVarInt(1, true);
    output.writeLong(0);
    output.writeVarInt(Integer.MAX_VALUE - 8, true);
    byte[] bytes = output.toBytes();

    assertThrows(ProcessionFormatException.class, () -> codec.fromBytes(bytes));
    assertThrows(
        ProcessionFormatException.class, () -> codec.read(new ByteArrayInputStream(bytes)));
  }

  @Test
  void testOversizedLabelAndChunkCountsFail() {
    Output labels = new Output(64, -1);
    labels.writeInt(ProcessionKryoCodec.MAGIC);
    labels.writeByte(ProcessionKryoCodec.VERSION);
    labels.writeVarInt(Integer.MAX_VALUE, true);
    assertThrows(ProcessionFormatException.class, () -> codec.fromBytes(labels.toBytes()));

    Output chunks = new Output(64, -1);
    chunks.writeInt(ProcessionKryoCodec.MAGIC);
    chunks.writeByte(ProcessionKryoCodec.VERSION);
    chunks.writeVarInt(0, true);
    chunks.writeVarInt(Integer.MAX_VALUE, true);
    assertThrows(ProcessionFormatException.class, () -> codec.fromBytes(chunks.toBytes()));
  }

  @Test
  void testNullLabelNameFails() {
    Output output = new Output(64, -1);
    output.writeInt(ProcessionKryoCodec.MAGIC);
    output.writeByte(ProcessionKryoCodec.VERSION);
    output.writeVarInt(1, true);
    output.writeString(null);
    output.writeVarInt(0, true);
    output.writeShort(0);
    output.writeVarInt(0, true);

    ProcessionFormatException e =
        assertThrows(ProcessionFormatException.class, () -> codec.fromBytes(output.toBytes()));
    assertTrue(e.getMessage().contains("null string"), e.getMessage());
  }

  @Test
  void testChunksOutOfOrderFail() {
    Output output = new Output(64, -1);
    output.writeInt(ProcessionKryoCodec.MAGIC);
    output.writeByte(ProcessionKryoCodec.VERSION);
    output.writeVarInt(0, true);
    output.writeVarInt(2, true);
    output.writeLong(T0.plusSeconds(100).toEpochMilli());
    output.writeVarInt(0, true);
    output.writeLong(T0.toEpochMilli());
    output.writeVarInt(0, true);

    assertThrows(ProcessionFormatException.class, () -> codec.fromBytes(output.toBytes()));
  }
}
