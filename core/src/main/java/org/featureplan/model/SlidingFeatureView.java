/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import org.featureplan.model.transform.ExpressionTransform;
import org.featureplan.model.transform.SlidingWindowTransform;
import org.featureplan.registry.Registry;

/**
 * View of sliding-window aggregations over its source. Rows are emitted per group and window end,
 * so the view has its own event time: the end of the window each row aggregates.
 *
 * <p>Expression features that read no sliding-window feature are evaluated on source rows ahead
 * of aggregation and are not part of the output. Expression features that read sliding-window
 * features are evaluated on the aggregated rows.
 */
public record SlidingFeatureView(
    String name,
    TableDescriptor source,
    List<Feature> features,
    List<String> featureReferences,
    String timestampField,
    String timestampFormat)
    implements FeatureView {

  public static final String DEFAULT_TIMESTAMP_FIELD = "window_time";

  public SlidingFeatureView {
    checkNotNull(name, "name must not be null");
    checkNotNull(source, "source of view %s must not be null", name);
    features = features == null ? List.of() : List.copyOf(features);
    featureReferences = featureReferences == null ? List.of() : List.copyOf(featureReferences);
    timestampFormat = timestampFormat == null ? EPOCH : timestampFormat;
  }

  public SlidingFeatureView(String name, TableDescriptor source, List<Feature> features) {
    this(name, source, features, List.of(), DEFAULT_TIMESTAMP_FIELD, EPOCH);
  }

  /**
   * Group-by keys of the first sliding-window feature, declared or read by a declared feature, or
   * null when the view has none.
   */
  @Override
  public List<String> keys() {
    return groupByKeys(features);
  }

  private static List<String> groupByKeys(List<Feature> features) {
    for (Feature feature : features) {
      if (feature.transform() instanceof SlidingWindowTransform transform) {
        return transform.groupByKeys();
      }
      List<String> keys = groupByKeys(feature.inputFeatures());
      if (keys != null) {
        return keys;
      }
    }
    return null;
  }

  @Override
  public SlidingFeatureView resolve(Registry registry) {
    TableDescriptor resolvedSource = FeatureReferences.resolveSource(source, registry);
    List<Feature> resolved =
        FeatureReferences.resolve(name, resolvedSource, featureReferences, features, registry);
    return new SlidingFeatureView(
        name, resolvedSource, resolved, List.of(), timestampField, timestampFormat);
  }

  @Override
  public List<String> outputFields(List<String> sourceFields) {
    List<String> outputFields = new ArrayList<>();
    List<String> keys = keys();
    if (keys != null) {
      outputFields.addAll(keys);
    }
    if (timestampField != null) {
      outputFields.add(timestampField);
    }
    for (Feature feature : features) {
      if (feature.transform() instanceof ExpressionTransform && !isPostAggregation(feature)) {
        continue;
      }
      if (!outputFields.contains(feature.name())) {
        outputFields.add(feature.name());
      }
    }
    return outputFields;
  }

  /** Whether an expression feature reads, directly or transitively, a sliding-window feature. */
  public static boolean isPostAggregation(Feature feature) {
    for (Feature input : feature.inputFeatures()) {
      if (input.transform() instanceof SlidingWindowTransform || isPostAggregation(input)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public <R> R accept(TableDescriptorVisitor<R> visitor) {
    return visitor.visitSlidingView(this);
  }
}
