/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import java.time.Instant;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Semantic type of a feature or table column. */
@RequiredArgsConstructor
public enum DataType {
  BYTES(byte[].class),
  STRING(String.class),
  INT32(Integer.class),
  INT64(Long.class),
  FLOAT32(Float.class),
  FLOAT64(Double.class),
  BOOLEAN(Boolean.class),
  TIMESTAMP(Instant.class);

  /** Java class of the values of this type. */
  @Getter private final Class<?> javaClass;

  public boolean isNumeric() {
    return this == INT32 || this == INT64 || this == FLOAT32 || this == FLOAT64;
  }

  public boolean isIntegral() {
    return this == INT32 || this == INT64;
  }

  /** Zero of a numeric type, used as the empty value of counting and summing aggregations. */
  public Object zero() {
    switch (this) {
      case INT32:
        return 0;
      case INT64:
        return 0L;
      case FLOAT32:
        return 0.0f;
      case FLOAT64:
        return 0.0d;
      default:
        throw new UnsupportedOperationException("Type " + this + " has no zero value");
    }
  }

  /** Infers the type of a literal value. */
  public static DataType of(Object value) {
    for (DataType type : values()) {
      if (type.javaClass.isInstance(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException(
        "Unsupported value " + value + " of class " + value.getClass().getName());
  }
}
