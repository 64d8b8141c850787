/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.tuple.Pair;
import org.featureplan.exception.ConflictException;
import org.featureplan.model.TableDescriptor;

/**
 * Tables compiled in one session, by descriptor name. A name maps to at most one descriptor;
 * asking for a structurally different descriptor under a cached name is a conflict.
 */
@Log4j2
public class TableBuildCache<T> {

  private final Map<String, Pair<TableDescriptor, T>> tables = new HashMap<>();

  /**
   * Returns the table compiled for the descriptor, if any.
   *
   * @throws ConflictException if a different descriptor with the same name was compiled
   */
  public Optional<T> get(TableDescriptor descriptor) {
    Pair<TableDescriptor, T> entry = tables.get(descriptor.name());
    if (entry == null) {
      return Optional.empty();
    }
    if (!entry.getLeft().equals(descriptor)) {
      throw new ConflictException(
          String.format(
              "Encountered different descriptors named %s: %s and %s",
              descriptor.name(), descriptor, entry.getLeft()));
    }
    log.debug("Reusing compiled table {}", descriptor.name());
    return Optional.of(entry.getRight());
  }

  public void put(TableDescriptor descriptor, T table) {
    tables.put(descriptor.name(), Pair.of(descriptor, table));
  }

  public int size() {
    return tables.size();
  }
}
