/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.stream.Collectors;
import org.featureplan.model.transform.ExpressionTransform;

/** A physical table read by the engine. Its features are its columns. */
public record SourceTable(
    String name, Schema schema, List<String> keys, String timestampField, String timestampFormat)
    implements TableDescriptor {

  public SourceTable {
    checkNotNull(name, "name must not be null");
    checkNotNull(schema, "schema of table %s must not be null", name);
    keys = keys == null ? null : List.copyOf(keys);
    if (keys != null) {
      for (String key : keys) {
        checkArgument(schema.contains(key), "Key %s is not a column of table %s", key, name);
      }
    }
    checkArgument(
        timestampField == null || schema.contains(timestampField),
        "Timestamp field %s is not a column of table %s",
        timestampField,
        name);
    timestampFormat = timestampFormat == null ? EPOCH : timestampFormat;
  }

  public SourceTable(String name, Schema schema, List<String> keys, String timestampField) {
    this(name, schema, keys, timestampField, EPOCH);
  }

  @Override
  public List<Feature> features() {
    return schema.columns().entrySet().stream()
        .map(
            column ->
                new Feature(
                    column.getKey(),
                    column.getValue(),
                    new ExpressionTransform("`" + column.getKey() + "`"),
                    keys))
        .collect(Collectors.toList());
  }

  @Override
  public <R> R accept(TableDescriptorVisitor<R> visitor) {
    return visitor.visitSource(this);
  }
}
