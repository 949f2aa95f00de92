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

import net.opentsdb.procession.api.Label;
import net.opentsdb.procession.api.MetricKey;
import picocli.CommandLine;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches keys holding at least one label whose name matches {@code key} and, when given, whose
 * value matches {@code value}. Both are unanchored regular expressions.
 */
public class LabelFilter {

  private final Pattern key;
  private final Pattern value;

  public LabelFilter(final Pattern key, final Pattern value) {
    this.key = key;
    this.value = value;
  }

  /** Parses {@code KEY} or {@code KEY=VALUE}. Anything after a second '=' is ignored. */
  public static LabelFilter parse(final String text) {
    String[] parts = text.split("=", -1);
    if (parts[0].isEmpty() && parts.length == 1) {
      throw new IllegalArgumentException("Expected KEY or KEY=VALUE but the filter was empty");
    }
    Pattern key = compile(parts[0], "key");
    Pattern value = parts.length > 1 ? compile(parts[1], "value") : null;
    return new LabelFilter(key, value);
  }

  private static Pattern compile(final String regex, final String what) {
    try {
      return Pattern.compile(regex);
    } catch (PatternSyntaxException e) {
      throw new IllegalArgumentException(
          "Invalid " + what + " regex '" + regex + "': " + e.getDescription(), e);
    }
  }

  public boolean matches(final MetricKey metricKey) {
    for (Label label : metricKey.getLabels()) {
      if (key.matcher(label.getKey()).find()
          && (value == null || value.matcher(label.getValue()).find())) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return value == null ? key.pattern() : key.pattern() + "=" + value.pattern();
  }

  static class Converter implements CommandLine.ITypeConverter<LabelFilter> {
    @Override
    public LabelFilter convert(final String value) {
      try {
        return parse(value);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException(e.getMessage());
      }
    }
  }
}
