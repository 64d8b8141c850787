/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.engine;

import org.featureplan.model.DataType;
import org.featureplan.model.Feature;
import org.featureplan.model.transform.AggregationFunction;
import org.featureplan.model.transform.OverWindowTransform;
import org.featureplan.model.transform.SlidingWindowTransform;

/**
 * One aggregated output column of a window.
 *
 * @param fieldName output column
 * @param dataType type the aggregated value is cast to
 * @param expr expression aggregated over the window rows
 * @param aggFunc aggregation function
 */
public record AggregationFieldDescriptor(
    String fieldName, DataType dataType, String expr, AggregationFunction aggFunc) {

  public static AggregationFieldDescriptor from(Feature feature, OverWindowTransform transform) {
    return new AggregationFieldDescriptor(
        feature.name(), feature.dtype(), transform.expr(), transform.aggFunc());
  }

  public static AggregationFieldDescriptor from(Feature feature, SlidingWindowTransform transform) {
    return new AggregationFieldDescriptor(
        feature.name(), feature.dtype(), transform.expr(), transform.aggFunc());
  }

  /** Value of the field over a window without rows: typed zero for counts and sums, else null. */
  public Object defaultValue() {
    return aggFunc.isZeroWhenEmpty() ? dataType.zero() : null;
  }
}
