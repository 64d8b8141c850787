/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.OverWindowDescriptor;
import org.featureplan.engine.SlidingWindowDescriptor;

/** Over-window and sliding-window aggregation of local table rows. */
final class WindowEvaluator {

  private final LocalTable table;
  private final List<AggregationFieldDescriptor> aggregations;
  private final DateTimeFormatter timestampFormatter;
  private final int eventTimeIndex;

  WindowEvaluator(
      LocalTable table,
      List<AggregationFieldDescriptor> aggregations,
      DateTimeFormatter timestampFormatter) {
    this.table = table;
    this.aggregations = aggregations;
    this.timestampFormatter = timestampFormatter;
    this.eventTimeIndex = table.indexOf(EVENT_TIME_FIELD);
  }

  /** Compiles the aggregated expressions; fails on unknown fields before rows are computed. */
  List<RowExpression> compileInputs() {
    List<RowExpression> inputs = new ArrayList<>(aggregations.size());
    for (AggregationFieldDescriptor aggregation : aggregations) {
      inputs.add(
          ExpressionInterpreter.compile(
              aggregation.expr(), table.getFieldNames(), timestampFormatter));
    }
    return inputs;
  }

  /**
   * Appends one column per aggregation to every row. A row aggregates the preceding rows of its
   * partition in event time order, itself included, limited by the window size and row limit.
   */
  List<List<Object>> overWindow(OverWindowDescriptor window, List<RowExpression> inputs) {
    List<List<Object>> rows = table.getRows();
    Object[][] values = inputValues(rows, inputs);
    List<Integer> keyIndices = table.indicesOf(window.partitionKeys());
    Map<List<Object>, List<Integer>> partitions = new LinkedHashMap<>();
    for (int i = 0; i < rows.size(); i++) {
      List<Object> key = partitionKey(rows.get(i), keyIndices);
      partitions.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
    }

    Object[][] results = new Object[rows.size()][];
    for (List<Integer> partition : partitions.values()) {
      partition.sort(Comparator.comparing(i -> eventTime(rows.get(i)), nullsFirst()));
      int from = 0;
      for (int position = 0; position < partition.size(); position++) {
        Instant time = eventTime(rows.get(partition.get(position)));
        if (window.windowSize() != null && time != null) {
          Instant lowerBound = time.minus(window.windowSize());
          while (isBefore(eventTime(rows.get(partition.get(from))), lowerBound)) {
            from++;
          }
        }
        int first = from;
        if (window.limit() != null) {
          first = Math.max(first, position - window.limit() + 1);
        }
        results[partition.get(position)] =
            aggregate(values, partition.subList(first, position + 1));
      }
    }

    List<List<Object>> output = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) {
      List<Object> row = new ArrayList<>(rows.get(i));
      row.addAll(Arrays.asList(results[i]));
      output.add(row);
    }
    return output;
  }

  /**
   * Aggregates rows per group and window. Window ends are multiples of the step since the epoch;
   * the window ending at {@code end} holds the rows with event time in {@code [end - size, end)}
   * and is emitted at {@code end - 1ms}. Windows without rows are not emitted.
   */
  List<List<Object>> slidingWindow(SlidingWindowDescriptor window, List<RowExpression> inputs) {
    List<List<Object>> rows = table.getRows();
    Object[][] values = inputValues(rows, inputs);
    List<Integer> keyIndices = table.indicesOf(window.groupByKeys());
    long size = window.windowSize().toMillis();
    long step = window.stepSize().toMillis();

    List<Integer> ordered = new ArrayList<>();
    for (int i = 0; i < rows.size(); i++) {
      if (eventTime(rows.get(i)) != null) {
        ordered.add(i);
      }
    }
    ordered.sort(Comparator.comparing(i -> eventTime(rows.get(i))));

    Map<List<Object>, TreeMap<Long, List<Integer>>> groups = new LinkedHashMap<>();
    Map<List<Object>, List<Object>> groupValues = new LinkedHashMap<>();
    for (int i : ordered) {
      List<Object> row = rows.get(i);
      List<Object> key = partitionKey(row, keyIndices);
      groupValues.computeIfAbsent(key, k -> keyValues(row, keyIndices));
      long millis = eventTime(row).toEpochMilli();
      TreeMap<Long, List<Integer>> windows = groups.computeIfAbsent(key, k -> new TreeMap<>());
      long firstEnd = millis - Math.floorMod(millis, step) + step;
      for (long end = firstEnd; end - size <= millis; end += step) {
        windows.computeIfAbsent(end, e -> new ArrayList<>()).add(i);
      }
    }

    List<List<Object>> output = new ArrayList<>();
    for (Map.Entry<List<Object>, TreeMap<Long, List<Integer>>> group : groups.entrySet()) {
      for (Map.Entry<Long, List<Integer>> windowRows : group.getValue().entrySet()) {
        List<Object> row = new ArrayList<>(groupValues.get(group.getKey()));
        row.addAll(Arrays.asList(aggregate(values, windowRows.getValue())));
        row.add(Instant.ofEpochMilli(windowRows.getKey() - 1));
        output.add(row);
      }
    }
    return output;
  }

  private Object[][] inputValues(List<List<Object>> rows, List<RowExpression> inputs) {
    Object[][] values = new Object[inputs.size()][rows.size()];
    for (int a = 0; a < inputs.size(); a++) {
      for (int i = 0; i < rows.size(); i++) {
        values[a][i] = inputs.get(a).evaluate(rows.get(i));
      }
    }
    return values;
  }

  private Object[] aggregate(Object[][] values, List<Integer> rowIndices) {
    Object[] result = new Object[aggregations.size()];
    for (int a = 0; a < aggregations.size(); a++) {
      List<Object> windowValues = new ArrayList<>(rowIndices.size());
      for (int i : rowIndices) {
        windowValues.add(values[a][i]);
      }
      AggregationFieldDescriptor aggregation = aggregations.get(a);
      result[a] =
          Values.cast(
              Aggregations.aggregate(aggregation.aggFunc(), windowValues),
              aggregation.dataType(),
              timestampFormatter);
    }
    return result;
  }

  private Instant eventTime(List<Object> row) {
    return (Instant) row.get(eventTimeIndex);
  }

  private static boolean isBefore(Instant time, Instant bound) {
    return time == null || time.isBefore(bound);
  }

  private static Comparator<Instant> nullsFirst() {
    return Comparator.nullsFirst(Comparator.naturalOrder());
  }

  /** Key grouping rows with equal key values, nulls included. */
  private static List<Object> partitionKey(List<Object> row, List<Integer> keyIndices) {
    List<Object> key = new ArrayList<>(keyIndices.size());
    for (int index : keyIndices) {
      key.add(Values.normalizeKey(row.get(index)));
    }
    return key;
  }

  private static List<Object> keyValues(List<Object> row, List<Integer> keyIndices) {
    List<Object> values = new ArrayList<>(keyIndices.size());
    for (int index : keyIndices) {
      values.add(row.get(index));
    }
    return values;
  }
}
