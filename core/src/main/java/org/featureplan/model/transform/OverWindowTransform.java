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
 * Running aggregation ordered by event time. Every input row produces one output row that
 * aggregates the rows of its partition up to and including itself.
 *
 * @param expr expression evaluated per row and fed to the aggregation
 * @param aggFunc aggregation function
 * @param partitionKeys partition columns, empty for a single global partition
 * @param windowSize optional time bound on the preceding rows; null means unbounded preceding
 * @param limit optional bound on the number of rows aggregated; null means no limit
 */
public record OverWindowTransform(
    String expr,
    AggregationFunction aggFunc,
    List<String> partitionKeys,
    Duration windowSize,
    Integer limit)
    implements Transform {

  public OverWindowTransform {
    checkNotNull(expr, "expr must not be null");
    checkNotNull(aggFunc, "aggFunc must not be null");
    partitionKeys = partitionKeys == null ? List.of() : List.copyOf(partitionKeys);
    checkArgument(
        windowSize == null || windowSize.toMillis() > 0, "windowSize must be positive");
    checkArgument(limit == null || limit > 0, "limit must be positive");
  }

  /** Unbounded-preceding running aggregation. */
  public OverWindowTransform(
      String expr, AggregationFunction aggFunc, List<String> partitionKeys) {
    this(expr, aggFunc, partitionKeys, null, null);
  }

  @Override
  public <R> R accept(TransformVisitor<R> visitor) {
    return visitor.visitOverWindow(this);
  }
}
