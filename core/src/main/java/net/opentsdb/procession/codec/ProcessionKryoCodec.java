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

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;
import net.opentsdb.procession.core.Chunk;
import net.opentsdb.procession.core.CounterEntry;
import net.opentsdb.procession.core.Entry;
import net.opentsdb.procession.core.Event;
import net.opentsdb.procession.core.GaugeEntry;
import net.opentsdb.procession.core.HistogramEntry;
import net.opentsdb.procession.core.LabelEntry;
import net.opentsdb.procession.core.LabelSet;
import net.opentsdb.procession.core.Op;
import net.opentsdb.procession.core.Procession;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Compact binary form of the canonical procession structure. Not thread safe, a {@link Kryo}
 * instance is owned per codec.
 *
 * <pre>
 *   int magic, byte version
 *   varint label count, { string name, varint pair count, { string key, string value }, short id }
 *   varint chunk count, { long reference epoch ms, varint event count,
 *                         { byte kind, [byte op], 4 byte value, short ms, short label } }
 * </pre>
 */
public class ProcessionKryoCodec {

  static final int MAGIC = 0x50524f43; // "PROC"
  static final byte VERSION = 1;

  private static final Entry.Kind[] KINDS = Entry.Kind.values();
  private static final Op[] OPS = Op.values();
  private static final int PREALLOCATE_LIMIT = Chunk.DEFAULT_CAPACITY;

  private final Kryo kryo;

  public ProcessionKryoCodec() {
    this.kryo = new Kryo();
    kryo.register(Procession.class, new ProcessionSerializer());
  }

  public void write(final Procession procession, final OutputStream out) throws IOException {
    Output output = new Output(out);
    try {
      kryo.writeObject(output, procession);
      output.flush();
    } catch (KryoException e) {
      throw new IOException("Failed writing procession", e);
    }
  }

  public byte[] toBytes(final Procession procession) {
    Output output = new Output(256, -1);
    kryo.writeObject(output, procession);
    return output.toBytes();
  }

  public Procession read(final InputStream in) throws IOException {
    return read(new Input(in));
  }

  public Procession fromBytes(final byte[] bytes) throws IOException {
    return read(new Input(bytes));
  }

  private Procession read(final Input input) throws IOException {
    try {
      return kryo.readObject(input, Procession.class);
    } catch (KryoException | IllegalArgumentException e) {
      throw new ProcessionFormatException("Invalid binary procession: " + e.getMessage(), e);
    }
  }

  static final class ProcessionSerializer extends Serializer<Procession> {

    @Override
    public void write(final Kryo kryo, final Output output, final Procession procession) {
      output.writeInt(MAGIC);
      output.writeByte(VERSION);

      List<LabelEntry> entries = procession.getLabels().entries();
      output.writeVarInt(entries.size(), true);
      for (LabelEntry entry : entries) {
        output.writeString(entry.getName());
        output.writeVarInt(entry.getLabels().size(), true);
        for (Label label : entry.getLabels()) {
          output.writeString(label.getKey());
          output.writeString(label.getValue());
        }
        output.writeShort(entry.getId());
      }

      List<Chunk> chunks = procession.getChunks();
      output.writeVarInt(chunks.size(), true);
      for (Chunk chunk : chunks) {
        output.writeLong(chunk.getReferenceTime().toEpochMilli());
        output.writeVarInt(chunk.size(), true);
        for (int i = 0; i < chunk.size(); i++) {
          writeEvent(output, chunk.get(i));
        }
      }
    }

    private static void writeEvent(final Output output, final Event event) {
      Entry entry = event.getEntry();
      output.writeByte(entry.getKind().ordinal());
      switch (entry.getKind()) {
        case COUNTER:
          CounterEntry counter = (CounterEntry) entry;
          output.writeByte(counter.getOp().ordinal());
          output.writeInt((int) counter.getValue());
          break;
        case GAUGE:
          GaugeEntry gauge = (GaugeEntry) entry;
          output.writeByte(gauge.getOp().ordinal());
          output.writeFloat(gauge.getValue());
          break;
        case HISTOGRAM:
          output.writeFloat(((HistogramEntry) entry).getValue());
          break;
        default:
          throw new KryoException("Unknown entry kind " + entry.getKind());
      }
      output.writeShort(event.getMs());
      output.writeShort(event.getLabel());
    }

    @Override
    public Procession read(
        final Kryo kryo, final Input input, final Class<? extends Procession> type) {
      int magic = input.readInt();
      if (magic != MAGIC) {
        throw new KryoException("Not a procession, magic " + Integer.toHexString(magic));
      }
      byte version = input.readByte();
      if (version != VERSION) {
        throw new KryoException("Unsupported procession version " + version);
      }

      int labelCount = readCount(input, "label");
      if (labelCount > LabelSet.CAPACITY) {
        throw new KryoException("Label count " + labelCount + " exceeds " + LabelSet.CAPACITY);
      }
      List<LabelEntry> entries = new ArrayList<>(Math.min(labelCount, PREALLOCATE_LIMIT));
      for (int i = 0; i < labelCount; i++) {
        String name = readString(input);
        int pairs = readCount(input, "label pair");
        List<Label> labels = new ArrayList<>(Math.min(pairs, PREALLOCATE_LIMIT));
        for (int j = 0; j < pairs; j++) {
          labels.add(new Label(readString(input), readString(input)));
        }
        entries.add(new LabelEntry(MetricKey.of(name, labels), input.readShortUnsigned()));
      }

      int chunkCount = readCount(input, "chunk");
      List<Chunk> chunks = new ArrayList<>(Math.min(chunkCount, PREALLOCATE_LIMIT));
      for (int i = 0; i < chunkCount; i++) {
        Instant referenceTime = Instant.ofEpochMilli(input.readLong());
        int events = readCount(input, "event");
        Chunk chunk = new Chunk(referenceTime, Math.max(Math.min(events, PREALLOCATE_LIMIT), 1));
        for (int j = 0; j < events; j++) {
          chunk.append(readEvent(input));
        }
        chunks.add(chunk);
      }
      return new Procession(chunks, LabelSet.fromEntries(entries));
    }

    /**
     * Counts come from untrusted input, so they only bound the loop. Storage grows as elements
     * are actually read and a short input fails with a buffer underflow.
     */
    private static int readCount(final Input input, final String what) {
      int count = input.readVarInt(true);
      if (count < 0) {
        throw new KryoException("Negative " + what + " count " + count);
      }
      return count;
    }

    private static String readString(final Input input) {
      String s = input.readString();
      if (s == null) {
        throw new KryoException("Unexpected null string");
      }
      return s;
    }

    private static Event readEvent(final Input input) {
      int kind = input.readByte();
      if (kind < 0 || kind >= KINDS.length) {
        throw new KryoException("Unknown entry kind " + kind);
      }
      Entry entry;
      switch (KINDS[kind]) {
        case COUNTER:
          Op counterOp = readOp(input);
          entry = Entry.counter(Integer.toUnsignedLong(input.readInt()), counterOp);
          break;
        case GAUGE:
          Op gaugeOp = readOp(input);
          entry = Entry.gauge(input.readFloat(), gaugeOp);
          break;
        default:
          entry = Entry.histogram(input.readFloat());
      }
      return new Event(entry, input.readShortUnsigned(), input.readShortUnsigned());
    }

    private static Op readOp(final Input input) {
      int op = input.readByte();
      if (op < 0 || op >= OPS.length) {
        throw new KryoException("Unknown op " + op);
      }
      return OPS[op];
    }
  }
}
