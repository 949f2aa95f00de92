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

import picocli.CommandLine;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/** Parses the time bounds given on the command line. */
final class TimeBound {

  private TimeBound() {}

  /**
   * Accepts an RFC 3339 date-time such as {@code 2024-01-01T10:00:00Z} or a bare date such as
   * {@code 2024-01-01}, which means midnight UTC.
   */
  static Instant parse(final String text) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException notDateTime) {
      try {
        return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
      } catch (DateTimeParseException notDate) {
        IllegalArgumentException e =
            new IllegalArgumentException(
                "Expected an RFC 3339 date or date-time but found '" + text + "'", notDateTime);
        e.addSuppressed(notDate);
        throw e;
      }
    }
  }

  static class Converter implements CommandLine.ITypeConverter<Instant> {
    @Override
    public Instant convert(final String value) {
      try {
        return parse(value);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.TypeConversionException(e.getMessage());
      }
    }
  }
}
