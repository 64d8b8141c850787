/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import java.util.List;
import org.featureplan.exception.SchemaException;

/**
 * A named logical table. Descriptors are immutable values: two descriptors are interchangeable
 * exactly when they are equal, which is what the compiler relies on to detect conflicting
 * definitions under one name.
 */
public interface TableDescriptor {

  /** Timestamp format of integral seconds since the epoch. */
  String EPOCH = "epoch";

  /** Timestamp format of integral milliseconds since the epoch. */
  String EPOCH_MILLIS = "epoch_millis";

  String name();

  /** Entity keys of the table, or null when the table has none. */
  List<String> keys();

  /** Field holding the event time of each row, or null when rows carry no event time. */
  String timestampField();

  /**
   * Format of {@link #timestampField()}: {@link #EPOCH}, {@link #EPOCH_MILLIS} or a strftime
   * style pattern such as {@code %Y-%m-%d %H:%M:%S}.
   */
  String timestampFormat();

  List<Feature> features();

  <R> R accept(TableDescriptorVisitor<R> visitor);

  default Feature getFeature(String featureName) {
    return features().stream()
        .filter(feature -> feature.name().equals(featureName))
        .findFirst()
        .orElseThrow(
            () ->
                new SchemaException(
                    String.format("Table %s has no feature named %s", name(), featureName)));
  }
}
