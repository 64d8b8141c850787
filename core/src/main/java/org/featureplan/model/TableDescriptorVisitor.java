/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

/** Visitor over the {@link TableDescriptor} variants. */
public interface TableDescriptorVisitor<R> {

  R visitSource(SourceTable source);

  R visitDerivedView(DerivedFeatureView view);

  R visitSlidingView(SlidingFeatureView view);
}
