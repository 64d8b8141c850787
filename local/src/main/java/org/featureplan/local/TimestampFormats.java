/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.DateTimeException;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import org.featureplan.exception.ExpressionException;
import org.featureplan.model.TableDescriptor;

/**
 * Converts between event times and timestamp field values. A timestamp format is {@code epoch}
 * (seconds), {@code epoch_millis} or a strftime pattern such as {@code %Y-%m-%d %H:%M:%S}.
 */
final class TimestampFormats {

  private static final ImmutableMap<Character, String> DIRECTIVES =
      ImmutableMap.<Character, String>builder()
          .put('Y', "yyyy")
          .put('y', "yy")
          .put('m', "MM")
          .put('d', "dd")
          .put('H', "HH")
          .put('I', "hh")
          .put('M', "mm")
          .put('S', "ss")
          .put('f', "SSSSSS")
          .put('p', "a")
          .put('b', "MMM")
          .put('B', "MMMM")
          .put('a', "EEE")
          .put('A', "EEEE")
          .put('j', "DDD")
          .put('z', "xx")
          .put('Z', "zzz")
          .build();

  private TimestampFormats() {}

  /** Converts a strftime pattern into a {@link DateTimeFormatter} pattern. */
  static String toJavaPattern(String strftime) {
    StringBuilder pattern = new StringBuilder();
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < strftime.length(); i++) {
      char c = strftime.charAt(i);
      if (c == '%' && i + 1 < strftime.length()) {
        char directive = strftime.charAt(++i);
        if (directive == '%') {
          literal.append('%');
          continue;
        }
        String replacement = DIRECTIVES.get(directive);
        if (replacement == null) {
          throw new ExpressionException(
              String.format("Unsupported directive %%%s in format '%s'", directive, strftime));
        }
        flushLiteral(literal, pattern);
        pattern.append(replacement);
      } else {
        literal.append(c);
      }
    }
    flushLiteral(literal, pattern);
    return pattern.toString();
  }

  private static void flushLiteral(StringBuilder literal, StringBuilder pattern) {
    if (literal.length() == 0) {
      return;
    }
    pattern.append('\'').append(literal.toString().replace("'", "''")).append('\'');
    literal.setLength(0);
  }

  static DateTimeFormatter formatter(String strftime, ZoneId zone) {
    return DateTimeFormatter.ofPattern(toJavaPattern(strftime)).withZone(zone);
  }

  /** Parser of a strftime pattern; time fields the pattern omits read as zero. */
  private static DateTimeFormatter parser(String strftime) {
    DateTimeFormatterBuilder builder =
        new DateTimeFormatterBuilder().appendPattern(toJavaPattern(strftime));
    if (!strftime.contains("%H") && !strftime.contains("%I")) {
      builder.parseDefaulting(ChronoField.HOUR_OF_DAY, 0);
    }
    return builder
        .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .toFormatter();
  }

  /** Event time of a timestamp field value, or null for a null value. */
  static Instant toInstant(Object value, String format, ZoneId zone) {
    if (value == null || value instanceof Instant) {
      return (Instant) value;
    }
    if (TableDescriptor.EPOCH.equals(format)) {
      return epoch(value, 1000L);
    }
    if (TableDescriptor.EPOCH_MILLIS.equals(format)) {
      return epoch(value, 1L);
    }
    try {
      return LocalDateTime.parse(value.toString(), parser(format)).atZone(zone).toInstant();
    } catch (DateTimeException e) {
      throw new ExpressionException(
          String.format("Cannot parse timestamp '%s' with format '%s'", value, format), e);
    }
  }

  private static Instant epoch(Object value, long millisPerUnit) {
    if (value instanceof Number number) {
      if (Values.isIntegral(number)) {
        return Instant.ofEpochMilli(number.longValue() * millisPerUnit);
      }
      return Instant.ofEpochMilli(Math.round(number.doubleValue() * millisPerUnit));
    }
    try {
      return Instant.ofEpochMilli(Long.parseLong(value.toString().trim()) * millisPerUnit);
    } catch (NumberFormatException e) {
      throw new ExpressionException(String.format("Cannot read '%s' as epoch time", value), e);
    }
  }

  /** Timestamp field value of an event time. */
  static Object fromInstant(Instant instant, String format, ZoneId zone) {
    if (instant == null) {
      return null;
    }
    if (TableDescriptor.EPOCH.equals(format)) {
      return Math.floorDiv(instant.toEpochMilli(), 1000L);
    }
    if (TableDescriptor.EPOCH_MILLIS.equals(format)) {
      return instant.toEpochMilli();
    }
    return formatter(format, zone).format(instant);
  }
}
