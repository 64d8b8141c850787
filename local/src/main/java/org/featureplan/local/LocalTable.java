/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import com.google.common.base.Suppliers;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.featureplan.exception.SchemaException;

/**
 * Table of the local engine: field names and rows of values in field order. Rows are computed on
 * first access and kept, so a table reused by several plans is computed once.
 */
public final class LocalTable {

  private final List<String> fieldNames;
  private final Supplier<List<List<Object>>> rows;

  private LocalTable(List<String> fieldNames, Supplier<List<List<Object>>> rows) {
    this.fieldNames = List.copyOf(fieldNames);
    this.rows = Suppliers.memoize(rows::get);
  }

  /** Table whose rows are computed by {@code rows} when first needed. */
  public static LocalTable lazy(List<String> fieldNames, Supplier<List<List<Object>>> rows) {
    return new LocalTable(fieldNames, rows);
  }

  public static LocalTable of(List<String> fieldNames, List<List<Object>> rows) {
    return new LocalTable(fieldNames, () -> rows);
  }

  public List<String> getFieldNames() {
    return fieldNames;
  }

  public List<List<Object>> getRows() {
    return rows.get();
  }

  public boolean hasField(String fieldName) {
    return fieldNames.contains(fieldName);
  }

  public int indexOf(String fieldName) {
    int index = fieldNames.indexOf(fieldName);
    if (index < 0) {
      throw new SchemaException(
          String.format("Field %s not in table fields %s", fieldName, fieldNames));
    }
    return index;
  }

  public List<Integer> indicesOf(List<String> fields) {
    List<Integer> indices = new ArrayList<>(fields.size());
    for (String field : fields) {
      indices.add(indexOf(field));
    }
    return indices;
  }

  /** Rows as field name to value maps, in field order. */
  public List<Map<String, Object>> toMaps() {
    List<Map<String, Object>> maps = new ArrayList<>();
    for (List<Object> row : getRows()) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (int i = 0; i < fieldNames.size(); i++) {
        map.put(fieldNames.get(i), row.get(i));
      }
      maps.add(map);
    }
    return maps;
  }

  @Override
  public String toString() {
    return "LocalTable" + fieldNames;
  }
}
