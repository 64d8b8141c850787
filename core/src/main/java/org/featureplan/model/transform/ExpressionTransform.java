/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model.transform;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Per-row expression. The text is handed to the engine untouched; it is never parsed or type
 * checked while a plan is being compiled.
 */
public record ExpressionTransform(String expr) implements Transform {

  public ExpressionTransform {
    checkNotNull(expr, "expr must not be null");
  }

  @Override
  public <R> R accept(TransformVisitor<R> visitor) {
    return visitor.visitExpression(this);
  }
}
