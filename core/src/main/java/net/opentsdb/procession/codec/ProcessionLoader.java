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

import net.opentsdb.procession.core.Procession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads a procession from a file, picking the format from the extension.
 *
 * <ul>
 *   <li>{@code .jsonl}: one flattened event per line.
 *   <li>{@code .kryo}: the binary canonical form.
 *   <li>anything else: canonical JSON, falling back to a JSON array of flattened events.
 * </ul>
 */
public class ProcessionLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessionLoader.class);

  public static final String JSON_LINES_EXTENSION = ".jsonl";
  public static final String KRYO_EXTENSION = ".kryo";

  private final ProcessionCodec codec;
  private final ProcessionKryoCodec kryoCodec;

  public ProcessionLoader() {
    this(new ProcessionCodec(), new ProcessionKryoCodec());
  }

  public ProcessionLoader(final ProcessionCodec codec, final ProcessionKryoCodec kryoCodec) {
    this.codec = codec;
    this.kryoCodec = kryoCodec;
  }

  public Procession load(final Path path) throws IOException {
    String name = path.getFileName().toString();
    if (name.endsWith(JSON_LINES_EXTENSION)) {
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        return codec.readJsonLines(reader);
      }
    }
    if (name.endsWith(KRYO_EXTENSION)) {
      try (InputStream in = Files.newInputStream(path)) {
        return kryoCodec.read(in);
      }
    }

    byte[] bytes = Files.readAllBytes(path);
    try {
      return codec.fromJson(bytes);
    } catch (IOException asProcession) {
      LOGGER.debug("{} is not a canonical procession, trying an event array", path, asProcession);
      try {
        return codec.readEventArray(bytes);
      } catch (IOException asEvents) {
        asEvents.addSuppressed(asProcession);
        throw new ProcessionFormatException(
            "Unable to load " + path + " as a procession or as an array of events", asEvents);
      }
    }
  }
}
