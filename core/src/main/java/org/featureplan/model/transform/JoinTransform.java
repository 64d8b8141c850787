/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model.transform;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Looks up {@code featureName} in the table registered as {@code tableName}, as of the event time
 * of each row. The join keys are the keys of the owning feature.
 */
public record JoinTransform(String tableName, String featureName) implements Transform {

  public JoinTransform {
    checkNotNull(tableName, "tableName must not be null");
    checkNotNull(featureName, "featureName must not be null");
  }

  @Override
  public <R> R accept(TransformVisitor<R> visitor) {
    return visitor.visitJoin(this);
  }
}
