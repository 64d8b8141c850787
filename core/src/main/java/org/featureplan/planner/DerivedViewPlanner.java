/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.OverWindowDescriptor;
import org.featureplan.engine.TableEngine;
import org.featureplan.exception.SchemaException;
import org.featureplan.exception.UnsupportedTransformException;
import org.featureplan.model.DerivedFeatureView;
import org.featureplan.model.Feature;
import org.featureplan.model.transform.ExpressionTransform;
import org.featureplan.model.transform.JoinTransform;
import org.featureplan.model.transform.OverWindowTransform;
import org.featureplan.model.transform.SlidingWindowTransform;
import org.featureplan.model.transform.TransformVisitor;

/**
 * Compiles a {@link DerivedFeatureView}. Expressions are evaluated as they are met; over-window
 * aggregations and joins are collected and applied in batches: over windows first, then joins.
 * A feature reading a collected, not yet applied, column makes the pending batches apply first.
 */
@Log4j2
class DerivedViewPlanner<T> {

  private final TableBuilder<T> builder;
  private final TableEngine<T> engine;
  private final DerivedFeatureView view;

  private final WindowAggregationGrouper<OverWindowDescriptor> overWindows =
      new WindowAggregationGrouper<>();
  private final TemporalJoinAssembler joins = new TemporalJoinAssembler();

  DerivedViewPlanner(TableBuilder<T> builder, DerivedFeatureView view) {
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
      if (readsPendingField(feature)) {
        table = applyBatches(table);
      }
      table = feature.transform().accept(new FeatureDispatcher(feature, table));
    }
    table = applyBatches(table);

    if (view.filterExpression() != null) {
      table = engine.filter(table, view.filterExpression());
    }
    List<String> outputFields = new ArrayList<>(view.outputFields(sourceFields));
    if (!outputFields.contains(EVENT_TIME_FIELD)) {
      outputFields.add(EVENT_TIME_FIELD);
    }
    return engine.select(table, outputFields);
  }

  private boolean readsPendingField(Feature feature) {
    if (overWindows.isEmpty() && joins.isEmpty()) {
      return false;
    }
    Set<String> pending = new HashSet<>(overWindows.pendingFields());
    pending.addAll(joins.pendingFields());
    List<String> reads = new ArrayList<>();
    feature.inputFeatures().forEach(input -> reads.add(input.name()));
    if (feature.keys() != null) {
      reads.addAll(feature.keys());
    }
    if (feature.transform() instanceof OverWindowTransform transform) {
      reads.addAll(transform.partitionKeys());
    }
    return reads.stream().anyMatch(pending::contains);
  }

  private T applyBatches(T table) {
    T result = table;
    for (Map.Entry<OverWindowDescriptor, List<AggregationFieldDescriptor>> window :
        overWindows.batches().entrySet()) {
      log.debug(
          "Evaluating {} aggregations over window {} in view {}",
          window.getValue().size(),
          window.getKey(),
          view.name());
      result = engine.evaluateOverWindow(result, window.getKey(), window.getValue());
    }
    overWindows.clear();
    if (!joins.isEmpty()) {
      result = joins.apply(result, engine, builder::getTable);
    }
    return result;
  }

  /** Evaluates or collects one feature according to its transform. */
  private class FeatureDispatcher implements TransformVisitor<T> {

    private final Feature feature;
    private final T table;

    FeatureDispatcher(Feature feature, T table) {
      this.feature = feature;
      this.table = table;
    }

    @Override
    public T visitExpression(ExpressionTransform transform) {
      return engine.evaluateExpression(table, transform.expr(), feature.name(), feature.dtype());
    }

    @Override
    public T visitOverWindow(OverWindowTransform transform) {
      if (view.timestampField() == null) {
        throw new SchemaException(
            String.format(
                "View %s must have a timestamp field to compute over-window feature %s",
                view.name(), feature.name()));
      }
      overWindows.add(
          OverWindowDescriptor.from(transform),
          AggregationFieldDescriptor.from(feature, transform));
      return table;
    }

    @Override
    public T visitSlidingWindow(SlidingWindowTransform transform) {
      throw new UnsupportedTransformException(
          String.format(
              "Derived view %s cannot compute sliding-window feature %s",
              view.name(), feature.name()));
    }

    @Override
    public T visitJoin(JoinTransform transform) {
      if (feature.keys() == null || feature.keys().isEmpty()) {
        throw new SchemaException(
            String.format(
                "Cannot join feature %s of view %s without keys", feature.name(), view.name()));
      }
      List<String> fields = engine.fieldNames(table);
      if (!fields.containsAll(feature.keys())) {
        throw new SchemaException(
            String.format(
                "Fields %s of view %s do not contain the keys %s of join feature %s",
                fields, view.name(), feature.keys(), feature.name()));
      }
      joins.add(feature, transform, builder.getRegistry().getTable(transform.tableName()));
      return table;
    }
  }
}
