/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.calcite;

import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;
import org.featureplan.model.DataType;

/** Mapping of feature data types to Calcite SQL types. */
final class CalciteTypes {

  /** Fractional second digits of event times. */
  static final int TIMESTAMP_PRECISION = 3;

  private CalciteTypes() {}

  static SqlTypeName toSqlTypeName(DataType type) {
    switch (type) {
      case STRING:
        return SqlTypeName.VARCHAR;
      case INT32:
        return SqlTypeName.INTEGER;
      case INT64:
        return SqlTypeName.BIGINT;
      case FLOAT32:
        return SqlTypeName.REAL;
      case FLOAT64:
        return SqlTypeName.DOUBLE;
      case BOOLEAN:
        return SqlTypeName.BOOLEAN;
      case TIMESTAMP:
        return SqlTypeName.TIMESTAMP;
      case BYTES:
        return SqlTypeName.VARBINARY;
      default:
        throw new IllegalArgumentException("Unsupported data type " + type);
    }
  }

  /** Nullable Calcite type of a data type. */
  static RelDataType toRelDataType(RelDataTypeFactory typeFactory, DataType type) {
    SqlTypeName typeName = toSqlTypeName(type);
    RelDataType relType =
        typeName == SqlTypeName.TIMESTAMP
            ? typeFactory.createSqlType(typeName, TIMESTAMP_PRECISION)
            : typeFactory.createSqlType(typeName);
    return typeFactory.createTypeWithNullability(relType, true);
  }

  static RelDataType eventTimeType(RelDataTypeFactory typeFactory) {
    return toRelDataType(typeFactory, DataType.TIMESTAMP);
  }
}
