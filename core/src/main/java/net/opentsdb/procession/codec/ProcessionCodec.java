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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import net.opentsdb.procession.core.Procession;
import net.opentsdb.procession.core.ProcessionConfig;
import net.opentsdb.procession.iter.Metric;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * JSON encoding of a procession in its two forms.
 *
 * <ul>
 *   <li>Canonical: {@code {"chunks": [...], "labels": [...]}}, the compact structure as stored.
 *   <li>Flattened: self describing events, {@code {"when", "event", "key", "labels"}}, either as a
 *       JSON array or one per line.
 * </ul>
 *
 * Timestamps are ISO-8601 instants. Streams passed in are never closed.
 */
public class ProcessionCodec {

  private final ObjectMapper mapper;
  private final ObjectWriter writer;
  private final ObjectReader processionReader;
  private final ObjectReader metricReader;
  private final ObjectReader metricListReader;

  public ProcessionCodec() {
    this(new ProcessionConfig());
  }

  public ProcessionCodec(final ProcessionConfig config) {
    this.mapper = newMapper();
    this.writer =
        config.prettyPrint ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    this.processionReader = mapper.readerFor(Procession.class);
    this.metricReader = mapper.readerFor(Metric.class);
    this.metricListReader =
        mapper.readerFor(mapper.getTypeFactory().constructCollectionType(List.class, Metric.class));
  }

  /** Only annotated properties take part, timestamps as ISO strings. */
  public static ObjectMapper newMapper() {
    return JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(
            MapperFeature.AUTO_DETECT_GETTERS,
            MapperFeature.AUTO_DETECT_IS_GETTERS,
            MapperFeature.AUTO_DETECT_FIELDS,
            MapperFeature.AUTO_DETECT_SETTERS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .disable(JsonParser.Feature.AUTO_CLOSE_SOURCE)
        .build();
  }

  public ObjectMapper mapper() {
    return mapper;
  }

  public void writeProcession(final Procession procession, final OutputStream out)
      throws IOException {
    writer.writeValue(out, procession);
  }

  public String toJson(final Procession procession) throws IOException {
    return writer.writeValueAsString(procession);
  }

  /**
   * Reads the canonical form. Missing fields, out of range offsets or ids, unknown entry kinds,
   * duplicate label entries and chunks whose reference times go backwards all fail the read.
   * Offsets within a chunk are kept in append order as written, they are not required to be
   * sorted since events placed by their own timestamps may arrive out of order.
   */
  public Procession readProcession(final InputStream in) throws IOException {
    return checkPresent(processionReader.readValue(in));
  }

  public Procession fromJson(final String json) throws IOException {
    return checkPresent(processionReader.readValue(json));
  }

  public Procession fromJson(final byte[] json) throws IOException {
    return checkPresent(processionReader.readValue(json));
  }

  /** Writes flattened events, {@link Metric}s or {@code MetricRef}s, as one JSON array. */
  public void writeEventArray(final Iterator<?> events, final OutputStream out)
      throws IOException {
    try (SequenceWriter sequence = writer.writeValuesAsArray(out)) {
      while (events.hasNext()) {
        sequence.write(events.next());
      }
    }
  }

  /** Rebuilds a procession from a JSON array of flattened events. */
  public Procession readEventArray(final InputStream in) throws IOException {
    return Procession.fromMetrics(checkNoNulls(metricListReader.readValue(in)));
  }

  public Procession readEventArray(final byte[] json) throws IOException {
    return Procession.fromMetrics(checkNoNulls(metricListReader.readValue(json)));
  }

  /** Writes flattened events one per line. */
  public void writeJsonLines(final Iterator<?> events, final Writer out) throws IOException {
    ObjectWriter lineWriter = mapper.writer();
    while (events.hasNext()) {
      out.write(lineWriter.writeValueAsString(events.next()));
      out.write('\n');
    }
    out.flush();
  }

  /**
   * Rebuilds a procession from JSON lines, one flattened event per line. Blank lines are
   * skipped, any other line that doesn't parse fails the read with its line number.
   */
  public Procession readJsonLines(final Reader in) throws IOException {
    BufferedReader reader =
        in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
    List<Metric> metrics = new ArrayList<>();
    String line;
    int lineNumber = 0;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.trim().isEmpty()) {
        continue;
      }
      Metric metric;
      try {
        metric = metricReader.readValue(line);
      } catch (JsonMappingException e) {
        throw new ProcessionFormatException("Invalid event on line " + lineNumber, e);
      } catch (IOException e) {
        throw new ProcessionFormatException("Malformed JSON on line " + lineNumber, e);
      }
      if (metric == null) {
        throw new ProcessionFormatException("Null event on line " + lineNumber);
      }
      metrics.add(metric);
    }
    return Procession.fromMetrics(metrics);
  }

  private static List<Metric> checkNoNulls(final List<Metric> metrics)
      throws ProcessionFormatException {
    checkPresent(metrics);
    for (int i = 0; i < metrics.size(); i++) {
      if (metrics.get(i) == null) {
        throw new ProcessionFormatException("Null event at index " + i);
      }
    }
    return metrics;
  }

  private static <T> T checkPresent(final T value) throws ProcessionFormatException {
    if (value == null) {
      throw new ProcessionFormatException("Input held a JSON null");
    }
    return value;
  }
}
