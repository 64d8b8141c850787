/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import org.featureplan.model.transform.AggregationFunction;
import org.featureplan.model.transform.ExpressionTransform;
import org.featureplan.model.transform.OverWindowTransform;
import org.featureplan.model.transform.SlidingWindowTransform;
import org.featureplan.model.transform.Transform;

/**
 * A named, typed derived column.
 *
 * @param name column name produced by this feature
 * @param dtype semantic type the computed value is cast to
 * @param transform computation rule
 * @param keys entity keys the feature is associated with, or null when it has none
 * @param inputFeatures features whose columns the transform reads, in evaluation order
 */
public record Feature(
    String name,
    DataType dtype,
    Transform transform,
    List<String> keys,
    List<Feature> inputFeatures) {

  public Feature {
    checkNotNull(name, "name must not be null");
    checkNotNull(dtype, "dtype of feature %s must not be null", name);
    checkNotNull(transform, "transform of feature %s must not be null", name);
    AggregationFunction aggFunc = aggregation(transform);
    checkArgument(
        aggFunc == null || !aggFunc.isZeroWhenEmpty() || dtype.isNumeric(),
        "feature %s aggregates with %s and must have a numeric type, not %s",
        name,
        aggFunc,
        dtype);
    keys = keys == null ? null : List.copyOf(keys);
    inputFeatures = inputFeatures == null ? List.of() : List.copyOf(inputFeatures);
  }

  public Feature(String name, DataType dtype, Transform transform) {
    this(name, dtype, transform, null, List.of());
  }

  public Feature(String name, DataType dtype, Transform transform, List<String> keys) {
    this(name, dtype, transform, keys, List.of());
  }

  private static AggregationFunction aggregation(Transform transform) {
    if (transform instanceof OverWindowTransform overWindow) {
      return overWindow.aggFunc();
    }
    if (transform instanceof SlidingWindowTransform slidingWindow) {
      return slidingWindow.aggFunc();
    }
    return null;
  }

  /** Feature computed by evaluating an expression over the columns of its table. */
  public static Feature expression(String name, DataType dtype, String expr) {
    return new Feature(name, dtype, new ExpressionTransform(expr));
  }
}
