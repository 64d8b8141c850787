/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.calcite;

import java.util.ArrayList;
import java.util.List;
import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;
import org.featureplan.model.Schema;

/**
 * In-memory Calcite ScannableTable holding the rows of a source table. The row type follows the
 * source schema with every column nullable.
 */
public class SourceRelTable extends AbstractTable implements ScannableTable {
  private final Schema schema;
  private final List<Object[]> rows;

  public SourceRelTable(Schema schema, List<Object[]> rows) {
    this.schema = schema;
    this.rows = rows;
  }

  /** Table of rows given as lists, one value per schema column. */
  public static SourceRelTable of(Schema schema, List<List<Object>> rows) {
    List<Object[]> arrays = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      arrays.add(row.toArray());
    }
    return new SourceRelTable(schema, arrays);
  }

  @Override
  public RelDataType getRowType(RelDataTypeFactory typeFactory) {
    RelDataTypeFactory.Builder builder = typeFactory.builder();
    for (String field : schema.fieldNames()) {
      builder.add(field, CalciteTypes.toRelDataType(typeFactory, schema.typeOf(field)));
    }
    return builder.build();
  }

  @Override
  public Enumerable<Object[]> scan(DataContext root) {
    return Linq4j.asEnumerable(rows);
  }
}
