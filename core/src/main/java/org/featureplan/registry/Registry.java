/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.registry;

import org.featureplan.model.TableDescriptor;

/** Lookup of table descriptors by name. */
public interface Registry {

  /**
   * Returns the descriptor registered under {@code name}.
   *
   * @throws org.featureplan.exception.DefinitionException if no table has that name
   */
  TableDescriptor getTable(String name);
}
