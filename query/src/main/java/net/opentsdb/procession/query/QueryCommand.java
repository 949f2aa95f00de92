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

import net.opentsdb.procession.codec.ProcessionLoader;
import net.opentsdb.procession.core.Procession;
import net.opentsdb.procession.iter.MetricRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.regex.Pattern;

@Command(
    name = "procession-query",
    mixinStandardHelpOptions = true,
    description = "Filters and aggregates the events of a serialized procession.")
public class QueryCommand implements Callable<Integer> {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueryCommand.class);

  @Parameters(
      index = "0",
      description = "Serialized procession: canonical JSON, an event array, .jsonl or .kryo.")
  Path source;

  @Option(
      names = {"-k", "--key"},
      description = "Regex the metric name must contain. Repeat to require several.")
  List<Pattern> keys = new ArrayList<>();

  @Option(
      names = {"-l", "--label"},
      converter = LabelFilter.Converter.class,
      description = "KEY[=VALUE] regexes, at least one label must match. Repeatable.")
  List<LabelFilter> labels = new ArrayList<>();

  @Option(
      names = {"-s", "--start"},
      converter = TimeBound.Converter.class,
      description = "Inclusive lower bound, RFC 3339 date-time or date (midnight UTC).")
  Instant start;

  @Option(
      names = {"-e", "--end"},
      converter = TimeBound.Converter.class,
      description = "Exclusive upper bound, RFC 3339 date-time or date (midnight UTC).")
  Instant end;

  @CommandLine.Spec CommandLine.Model.CommandSpec commandSpec;

  private final ProcessionLoader loader;

  public QueryCommand() {
    this(new ProcessionLoader());
  }

  QueryCommand(final ProcessionLoader loader) {
    this.loader = loader;
  }

  @Override
  public Integer call() throws Exception {
    if (start != null && end != null && !start.isBefore(end)) {
      throw new CommandLine.ParameterException(
          commandSpec.commandLine(), "--start " + start + " must be before --end " + end);
    }
    Procession procession = loader.load(source);
    LOGGER.debug("Loaded {} events from {}", procession.eventCount(), source);

    QueryCollector collector = query(procession, new QueryFilter(keys, labels, start, end));
    new QueryReport(commandSpec.commandLine().getOut()).write(collector);
    if (collector.getSkipped() > 0) {
      commandSpec.commandLine()
          .getErr()
          .println("Skipped " + collector.getSkipped() + " histogram values out of range");
    }
    return 0;
  }

  static QueryCollector query(final Procession procession, final QueryFilter filter) {
    QueryCollector collector = new QueryCollector();
    for (MetricRef metric : procession) {
      if (filter.matches(metric)) {
        collector.track(metric);
      }
    }
    return collector;
  }

  public static void main(final String[] args) {
    System.exit(new CommandLine(new QueryCommand()).execute(args));
  }
}
