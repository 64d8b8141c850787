/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.registry;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.featureplan.exception.ConflictException;
import org.featureplan.exception.DefinitionException;
import org.featureplan.model.FeatureView;
import org.featureplan.model.TableDescriptor;

/** Registry kept in memory. Views are resolved against the registry when they are registered. */
@Log4j2
public class InMemoryRegistry implements Registry {

  private final Map<String, TableDescriptor> tables = new ConcurrentHashMap<>();

  /**
   * Registers descriptors in order, so a view may reference tables registered before it.
   *
   * @param override whether a different descriptor already registered under a name is replaced
   * @return the registered, resolved descriptors
   */
  public List<TableDescriptor> register(boolean override, TableDescriptor... descriptors) {
    return Arrays.stream(descriptors)
        .map(descriptor -> registerOne(descriptor, override))
        .collect(Collectors.toList());
  }

  public List<TableDescriptor> register(TableDescriptor... descriptors) {
    return register(false, descriptors);
  }

  private TableDescriptor registerOne(TableDescriptor descriptor, boolean override) {
    TableDescriptor resolved = descriptor;
    if (descriptor instanceof FeatureView view && view.isUnresolved()) {
      resolved = view.resolve(this);
    }
    TableDescriptor existing = tables.get(resolved.name());
    if (existing != null && !existing.equals(resolved) && !override) {
      throw new ConflictException(
          String.format(
              "Table %s is already registered with a different definition", resolved.name()));
    }
    tables.put(resolved.name(), resolved);
    log.debug("Registered table {}", resolved.name());
    return resolved;
  }

  @Override
  public TableDescriptor getTable(String name) {
    TableDescriptor descriptor = tables.get(name);
    if (descriptor == null) {
      throw new DefinitionException("No table registered under name " + name);
    }
    return descriptor;
  }
}
