/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model.transform;

/**
 * Computation rule of a feature. Callers branch on the kind through {@link
 * #accept(TransformVisitor)}.
 */
public interface Transform {

  <R> R accept(TransformVisitor<R> visitor);
}
