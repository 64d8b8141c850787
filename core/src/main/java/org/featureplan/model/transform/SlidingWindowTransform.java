/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model.transform;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.time.Duration;
import java.util.List;

/**
 * Hopping window aggregation. Windows end on multiples of {@code stepSize} since the epoch and
 * each covers the preceding {@code windowSize}; one row is emitted per group and window that
 * contains data.
 */
public record SlidingWindowTransform(
    String expr,
    AggregationFunction aggFunc,
    List<String> groupByKeys,
    Duration windowSize,
    Duration stepSize)
    implements Transform {

  public SlidingWindowTransform {
    checkNotNull(expr, "expr must not be null");
    checkNotNull(aggFunc, "aggFunc must not be null");
    checkNotNull(windowSize, "windowSize must not be null");
    checkNotNull(stepSize, "stepSize must not be null");
    groupByKeys = groupByKeys == null ? List.of() : List.copyOf(groupByKeys);
    checkArgument(windowSize.toMillis() > 0, "windowSize must be positive");
    checkArgument(stepSize.toMillis() > 0, "stepSize must be positive");
  }

  @Override
  public <R> R accept(TransformVisitor<R> visitor) {
    return visitor.visitSlidingWindow(this);
  }
}
