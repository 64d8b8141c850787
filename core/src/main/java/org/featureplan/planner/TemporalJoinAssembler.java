/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.lang3.tuple.Pair;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.JoinFieldDescriptor;
import org.featureplan.engine.TableEngine;
import org.featureplan.exception.SchemaException;
import org.featureplan.model.Feature;
import org.featureplan.model.SlidingFeatureView;
import org.featureplan.model.TableDescriptor;
import org.featureplan.model.transform.JoinTransform;
import org.featureplan.model.transform.SlidingWindowTransform;

/**
 * Collects join features by right table and join keys. Every batch is applied as one as-of join
 * pulling all requested fields of that table at once.
 */
@Log4j2
public class TemporalJoinAssembler {

  private final Map<Pair<String, List<String>>, Map<String, JoinFieldDescriptor>> batches =
      new LinkedHashMap<>();

  static final String ALIAS_PREFIX = "__join__";

  private final Map<String, TableDescriptor> rightTables = new HashMap<>();

  /** Join features whose name differs from the right field they pull, by feature name. */
  private final Map<String, Feature> renamed = new LinkedHashMap<>();

  /** Right fields pulled under an alias, by alias and then by batch. */
  private final Map<Pair<String, List<String>>, Map<String, String>> aliases =
      new LinkedHashMap<>();

  /**
   * Adds a join feature to the batch of its right table and keys.
   *
   * @param right descriptor of the right table
   * @throws SchemaException if the right table has no timestamp field
   */
  public void add(Feature feature, JoinTransform transform, TableDescriptor right) {
    String rightTimestampField = right.timestampField();
    if (rightTimestampField == null) {
      throw new SchemaException(
          String.format(
              "Cannot join feature %s with table %s without timestamp field",
              feature.name(), right.name()));
    }
    rightTables.put(transform.tableName(), right);
    Pair<String, List<String>> batch = Pair.of(transform.tableName(), feature.keys());
    Map<String, JoinFieldDescriptor> fields =
        batches.computeIfAbsent(batch, key -> new LinkedHashMap<>());
    for (String key : feature.keys()) {
      fields.put(key, JoinFieldDescriptor.passthrough(key));
    }
    fields.put(rightTimestampField, JoinFieldDescriptor.passthrough(rightTimestampField));
    fields.put(EVENT_TIME_FIELD, JoinFieldDescriptor.passthrough(EVENT_TIME_FIELD));
    JoinFieldDescriptor pulled = pulledField(right, transform.featureName());
    if (feature.name().equals(transform.featureName())) {
      fields.put(transform.featureName(), pulled);
    } else {
      // The right field may share its name with a left column; it travels under an alias.
      String alias = ALIAS_PREFIX + feature.name();
      fields.put(
          alias,
          JoinFieldDescriptor.pulled(
              alias, pulled.dataType(), pulled.validTime(), pulled.defaultValue()));
      aliases
          .computeIfAbsent(batch, key -> new LinkedHashMap<>())
          .put(alias, transform.featureName());
      renamed.put(feature.name(), feature);
    }
  }

  /**
   * Values of sliding-window aggregates are valid for one step after their window ends, after
   * which the next, empty, window applies and the value reads as the aggregation default.
   */
  static JoinFieldDescriptor pulledField(TableDescriptor right, String featureName) {
    Feature rightFeature = right.getFeature(featureName);
    if (right instanceof SlidingFeatureView
        && rightFeature.transform() instanceof SlidingWindowTransform transform) {
      Object defaultValue = AggregationFieldDescriptor.from(rightFeature, transform).defaultValue();
      return JoinFieldDescriptor.pulled(
          featureName, rightFeature.dtype(), transform.stepSize(), defaultValue);
    }
    return JoinFieldDescriptor.pulled(featureName, rightFeature.dtype(), null, null);
  }

  /** Names of the join features collected and not yet applied. */
  public Set<String> pendingFields() {
    Set<String> pending =
        batches.values().stream()
            .flatMap(fields -> fields.values().stream())
            .filter(JoinFieldDescriptor::pulled)
            .map(JoinFieldDescriptor::fieldName)
            .collect(Collectors.toSet());
    pending.addAll(renamed.keySet());
    return pending;
  }

  public boolean isEmpty() {
    return batches.isEmpty();
  }

  Map<Pair<String, List<String>>, Map<String, JoinFieldDescriptor>> batches() {
    return batches;
  }

  /**
   * Applies every batch to {@code left} and clears the assembler.
   *
   * @param tableBuilder builds the table of a right descriptor
   */
  public <T> T apply(T left, TableEngine<T> engine, Function<TableDescriptor, T> tableBuilder) {
    T table = left;
    for (Map.Entry<Pair<String, List<String>>, Map<String, JoinFieldDescriptor>> batch :
        batches.entrySet()) {
      String tableName = batch.getKey().getLeft();
      List<String> keys = batch.getKey().getRight();
      Map<String, JoinFieldDescriptor> fields = batch.getValue();
      log.debug("Joining {} fields of table {} on keys {}", fields.size(), tableName, keys);
      T right = tableBuilder.apply(rightTables.get(tableName));
      for (Map.Entry<String, String> alias :
          aliases.getOrDefault(batch.getKey(), Map.of()).entrySet()) {
        right =
            engine.evaluateExpression(
                right,
                "`" + alias.getValue() + "`",
                alias.getKey(),
                fields.get(alias.getKey()).dataType());
      }
      right = engine.select(right, new ArrayList<>(fields.keySet()));
      table = engine.asOfJoin(table, right, keys, fields);
    }
    for (Feature feature : renamed.values()) {
      String alias = ALIAS_PREFIX + feature.name();
      table = engine.evaluateExpression(table, "`" + alias + "`", feature.name(), feature.dtype());
      table = engine.dropField(table, alias);
    }
    batches.clear();
    rightTables.clear();
    renamed.clear();
    aliases.clear();
    return table;
  }
}
