/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.featureplan.exception.SchemaException;

/** Ordered mapping from column name to {@link DataType}. */
public record Schema(ImmutableMap<String, DataType> columns) {

  public Schema {
    checkArgument(!columns.isEmpty(), "Schema must have at least one column");
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<String> fieldNames() {
    return ImmutableList.copyOf(columns.keySet());
  }

  public boolean contains(String fieldName) {
    return columns.containsKey(fieldName);
  }

  public DataType typeOf(String fieldName) {
    DataType type = columns.get(fieldName);
    if (type == null) {
      throw new SchemaException(
          String.format("Field %s not in schema %s", fieldName, columns.keySet()));
    }
    return type;
  }

  /** Builder preserving column declaration order. */
  public static class Builder {
    private final Map<String, DataType> columns = new LinkedHashMap<>();

    public Builder column(String name, DataType type) {
      checkArgument(!columns.containsKey(name), "Duplicate column %s", name);
      columns.put(name, type);
      return this;
    }

    public Schema build() {
      return new Schema(ImmutableMap.copyOf(columns));
    }
  }
}
