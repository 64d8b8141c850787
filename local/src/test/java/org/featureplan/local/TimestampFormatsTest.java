/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.featureplan.exception.ExpressionException;
import org.featureplan.model.TableDescriptor;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TimestampFormatsTest {

  @Test
  void strftime_pattern_converts_to_java_pattern() {
    assertEquals(
        "yyyy'-'MM'-'dd' 'HH':'mm':'ss", TimestampFormats.toJavaPattern("%Y-%m-%d %H:%M:%S"));
    assertEquals("yyyyMMdd'T%'", TimestampFormats.toJavaPattern("%Y%m%dT%%"));
  }

  @Test
  void unsupported_directive_fails() {
    assertThrows(ExpressionException.class, () -> TimestampFormats.toJavaPattern("%Q"));
  }

  @Test
  void epoch_values_read_as_seconds_or_millis() {
    assertEquals(
        Instant.ofEpochSecond(60),
        TimestampFormats.toInstant(60L, TableDescriptor.EPOCH, ZoneOffset.UTC));
    assertEquals(
        Instant.ofEpochMilli(1500),
        TimestampFormats.toInstant(1.5d, TableDescriptor.EPOCH, ZoneOffset.UTC));
    assertEquals(
        Instant.ofEpochMilli(60),
        TimestampFormats.toInstant("60", TableDescriptor.EPOCH_MILLIS, ZoneOffset.UTC));
    assertNull(TimestampFormats.toInstant(null, TableDescriptor.EPOCH, ZoneOffset.UTC));
  }

  @Test
  void calendar_values_are_read_in_zone() {
    assertEquals(
        Instant.parse("2024-03-01T10:15:30Z"),
        TimestampFormats.toInstant(
            "2024-03-01 11:15:30", "%Y-%m-%d %H:%M:%S", ZoneId.of("+01:00")));
    assertEquals(
        Instant.parse("2024-03-01T00:00:00Z"),
        TimestampFormats.toInstant("2024-03-01", "%Y-%m-%d", ZoneOffset.UTC));
  }

  @Test
  void unparseable_value_fails() {
    assertThrows(
        ExpressionException.class,
        () -> TimestampFormats.toInstant("yesterday", "%Y-%m-%d", ZoneOffset.UTC));
    assertThrows(
        ExpressionException.class,
        () -> TimestampFormats.toInstant("abc", TableDescriptor.EPOCH, ZoneOffset.UTC));
  }

  @Test
  void event_time_renders_in_format() {
    Instant time = Instant.ofEpochMilli(599_999);
    assertEquals(599L, TimestampFormats.fromInstant(time, TableDescriptor.EPOCH, ZoneOffset.UTC));
    assertEquals(
        599_999L, TimestampFormats.fromInstant(time, TableDescriptor.EPOCH_MILLIS, ZoneOffset.UTC));
    assertEquals(
        "1970-01-01 00:09:59",
        TimestampFormats.fromInstant(time, "%Y-%m-%d %H:%M:%S", ZoneOffset.UTC));
    assertEquals(
        -1L,
        TimestampFormats.fromInstant(
            Instant.ofEpochMilli(-1), TableDescriptor.EPOCH, ZoneOffset.UTC));
  }
}
