/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model.transform;

/** Aggregation applied by over-window and sliding-window transforms. */
public enum AggregationFunction {
  SUM,
  AVG,
  MIN,
  MAX,
  FIRST_VALUE,
  LAST_VALUE,
  COUNT,
  ROW_NUMBER;

  /** Whether an empty window of this aggregation reads as zero rather than null. */
  public boolean isZeroWhenEmpty() {
    return this == SUM || this == COUNT || this == ROW_NUMBER;
  }
}
