/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import org.featureplan.exception.ExpressionException;
import org.featureplan.model.DataType;

/** Conversions and comparisons of the values held by local tables. */
final class Values {

  private Values() {}

  static boolean isIntegral(Object value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  /**
   * Normalizes a key value for consistent hash/equals behavior. Converts all integer numeric types
   * to Long and Float to Double.
   */
  static Object normalizeKey(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Float floatValue) {
      return floatValue.doubleValue();
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  static int compare(Object left, Object right) {
    if (left instanceof Number leftNumber && right instanceof Number rightNumber) {
      if (isIntegral(left) && isIntegral(right)) {
        return Long.compare(leftNumber.longValue(), rightNumber.longValue());
      }
      return Double.compare(leftNumber.doubleValue(), rightNumber.doubleValue());
    }
    if (left instanceof Comparable && left.getClass().equals(right.getClass())) {
      return ((Comparable<Object>) left).compareTo(right);
    }
    throw new ExpressionException(
        String.format(
            "Cannot compare %s of %s with %s of %s",
            left, left.getClass().getSimpleName(), right, right.getClass().getSimpleName()));
  }

  /**
   * Casts a value to the Java class of a data type.
   *
   * @param formatter renders timestamps cast to strings
   */
  static Object cast(Object value, DataType type, DateTimeFormatter formatter) {
    if (value == null || type.getJavaClass().isInstance(value)) {
      return value;
    }
    try {
      switch (type) {
        case STRING:
          if (value instanceof Instant instant) {
            return formatter.format(instant);
          }
          if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
          }
          return String.valueOf(value);
        case INT32:
          return toNumber(value).intValue();
        case INT64:
          return toNumber(value).longValue();
        case FLOAT32:
          return toNumber(value).floatValue();
        case FLOAT64:
          return toNumber(value).doubleValue();
        case BOOLEAN:
          if (value instanceof Number number) {
            return number.doubleValue() != 0;
          }
          return parseBoolean(value.toString());
        case TIMESTAMP:
          if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
          }
          return Instant.parse(value.toString().trim());
        case BYTES:
          return value.toString().getBytes(StandardCharsets.UTF_8);
        default:
          throw new ExpressionException("Unsupported cast to " + type);
      }
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new ExpressionException(String.format("Cannot cast '%s' to %s", value, type), e);
    }
  }

  private static Number toNumber(Object value) {
    if (value instanceof Number number) {
      return number;
    }
    if (value instanceof Boolean bool) {
      return bool ? 1 : 0;
    }
    if (value instanceof Instant instant) {
      return instant.toEpochMilli();
    }
    return new BigDecimal(value.toString().trim());
  }

  private static Boolean parseBoolean(String value) {
    if ("true".equalsIgnoreCase(value.trim())) {
      return true;
    }
    if ("false".equalsIgnoreCase(value.trim())) {
      return false;
    }
    throw new ExpressionException(String.format("Cannot cast '%s' to BOOLEAN", value));
  }
}
