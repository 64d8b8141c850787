/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.featureplan.exception.DefinitionException;
import org.featureplan.model.SourceTable;

/** Source rows held in memory by table name. */
public class InMemorySourceReader implements SourceReader {

  private final Map<String, List<List<Object>>> tables = new ConcurrentHashMap<>();

  public InMemorySourceReader put(String tableName, List<List<Object>> rows) {
    tables.put(tableName, new ArrayList<>(rows));
    return this;
  }

  @Override
  public List<List<Object>> read(SourceTable source) {
    List<List<Object>> rows = tables.get(source.name());
    if (rows == null) {
      throw new DefinitionException("No rows available for source table " + source.name());
    }
    int width = source.schema().fieldNames().size();
    for (List<Object> row : rows) {
      if (row.size() != width) {
        throw new DefinitionException(
            String.format(
                "Row %s of source table %s does not match schema %s",
                row, source.name(), source.schema().fieldNames()));
      }
    }
    return rows;
  }
}
