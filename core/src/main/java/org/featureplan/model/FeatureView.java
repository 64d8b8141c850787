/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import java.util.List;
import org.featureplan.registry.Registry;

/**
 * A table of features derived from a source descriptor. Besides the features it defines, a view
 * may name features by reference: {@code "name"} refers to a feature of the source and {@code
 * "table.name"} to a feature of another registered table. A view with pending references is
 * unresolved and must be resolved against a {@link Registry} before it is compiled.
 */
public interface FeatureView extends TableDescriptor {

  TableDescriptor source();

  /** Feature references not yet materialized into features. */
  List<String> featureReferences();

  default boolean isUnresolved() {
    if (!featureReferences().isEmpty()) {
      return true;
    }
    return source() instanceof FeatureView view && view.isUnresolved();
  }

  /** Returns an equally named view with every reference, here and in the source, materialized. */
  FeatureView resolve(Registry registry);

  /**
   * Columns of the compiled view, in order.
   *
   * @param sourceFields columns of the compiled source table
   */
  List<String> outputFields(List<String> sourceFields);
}
