/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.SlidingWindowDescriptor;
import org.featureplan.engine.TableEngine;
import org.featureplan.exception.SchemaException;
import org.featureplan.exception.UnsupportedTransformException;
import org.featureplan.model.Feature;
import org.featureplan.model.SlidingFeatureView;
import org.featureplan.model.transform.ExpressionTransform;
import org.featureplan.model.transform.JoinTransform;
import org.featureplan.model.transform.OverWindowTransform;
import org.featureplan.model.transform.SlidingWindowTransform;
import org.featureplan.model.transform.TransformVisitor;

/**
 * Compiles a {@link SlidingFeatureView}: expressions over source rows, then the sliding-window
 * aggregations merged into one table, then expressions over the aggregated values.
 */
@Log4j2
class SlidingViewPlanner<T> {

  private final TableBuilder<T> builder;
  private final TableEngine<T> engine;
  private final SlidingFeatureView view;

  private final WindowAggregationGrouper<SlidingWindowDescriptor> slidingWindows =
      new WindowAggregationGrouper<>();
  private final List<Feature> postAggregation = new ArrayList<>();
  private List<String> groupByKeys;

  SlidingViewPlanner(TableBuilder<T> builder, SlidingFeatureView view) {
    this.builder = builder;
    this.engine = builder.getEngine();
    this.view = view;
  }

  T plan() {
    T source = builder.getTable(view.source());
    List<String> sourceFields = engine.fieldNames(source);
    T table = source;
    for (Feature feature : DependencyResolver.resolve(view.features())) {
      if (engine.fieldNames(table).contains(feature.name())) {
        continue;
      }
      table = feature.transform().accept(new FeatureDispatcher(feature, table));
    }

    if (!slidingWindows.isEmpty()) {
      table = SlidingWindowMerger.merge(engine, table, slidingWindows.batches());
    }
    for (Feature feature : postAggregation) {
      ExpressionTransform transform = (ExpressionTransform) feature.transform();
      table = engine.evaluateExpression(table, transform.expr(), feature.name(), feature.dtype());
    }
    if (view.timestampField() != null) {
      table = engine.deriveTimestampField(table, view.timestampField(), view.timestampFormat());
    }

    List<String> outputFields = new ArrayList<>(view.outputFields(sourceFields));
    if (!outputFields.contains(EVENT_TIME_FIELD)) {
      outputFields.add(EVENT_TIME_FIELD);
    }
    return engine.select(table, outputFields);
  }

  private class FeatureDispatcher implements TransformVisitor<T> {

    private final Feature feature;
    private final T table;

    FeatureDispatcher(Feature feature, T table) {
      this.feature = feature;
      this.table = table;
    }

    @Override
    public T visitExpression(ExpressionTransform transform) {
      if (SlidingFeatureView.isPostAggregation(feature)) {
        postAggregation.add(feature);
        return table;
      }
      return engine.evaluateExpression(table, transform.expr(), feature.name(), feature.dtype());
    }

    @Override
    public T visitOverWindow(OverWindowTransform transform) {
      throw unsupported("over-window");
    }

    @Override
    public T visitSlidingWindow(SlidingWindowTransform transform) {
      if (view.timestampField() == null) {
        throw new SchemaException(
            String.format(
                "View %s must have a timestamp field to compute sliding-window feature %s",
                view.name(), feature.name()));
      }
      if (groupByKeys == null) {
        groupByKeys = transform.groupByKeys();
      } else if (!groupByKeys.equals(transform.groupByKeys())) {
        throw new SchemaException(
            String.format(
                "Sliding-window feature %s of view %s groups by %s, other features by %s",
                feature.name(), view.name(), transform.groupByKeys(), groupByKeys));
      }
      slidingWindows.add(
          SlidingWindowDescriptor.from(transform),
          AggregationFieldDescriptor.from(feature, transform));
      return table;
    }

    @Override
    public T visitJoin(JoinTransform transform) {
      throw unsupported("join");
    }

    private UnsupportedTransformException unsupported(String kind) {
      return new UnsupportedTransformException(
          String.format(
              "Sliding view %s cannot compute %s feature %s", view.name(), kind, feature.name()));
    }
  }
}
