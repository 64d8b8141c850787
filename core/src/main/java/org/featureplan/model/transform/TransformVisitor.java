/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model.transform;

/** Visitor over the closed set of {@link Transform} kinds. */
public interface TransformVisitor<R> {

  R visitExpression(ExpressionTransform transform);

  R visitOverWindow(OverWindowTransform transform);

  R visitSlidingWindow(SlidingWindowTransform transform);

  R visitJoin(JoinTransform transform);
}
