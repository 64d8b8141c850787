/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.engine;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.featureplan.model.DataType;
import org.featureplan.model.SourceTable;

/**
 * Engine that table plans are compiled against. Every operation returns a new table value and
 * leaves its inputs untouched; whether a table is materialized rows or a lazy plan fragment is up
 * to the engine.
 *
 * <p>Every table the compiler hands to or receives from an engine carries the event time of its
 * rows in {@link #EVENT_TIME_FIELD}.
 *
 * @param <T> table representation of the engine
 */
public interface TableEngine<T> {

  /** Internal column holding the event time of each row. */
  String EVENT_TIME_FIELD = "__event_time_attribute__";

  /**
   * Reads a source table and adds the {@link #EVENT_TIME_FIELD} column computed from the source
   * timestamp field. A source without timestamp field gets a null event time.
   */
  T scanSource(SourceTable source);

  /** Builds a table of literal rows, each row holding one value per field name. */
  T fromRows(List<String> fieldNames, List<List<Object>> rows);

  List<String> fieldNames(T table);

  /** Adds, or replaces, column {@code resultName} with the value of {@code expr} cast to type. */
  T evaluateExpression(T table, String expr, String resultName, DataType resultType);

  /**
   * Adds one running aggregation column per field. Every input row yields one output row
   * aggregating the rows of its partition up to and including itself in event time order.
   */
  T evaluateOverWindow(
      T table, OverWindowDescriptor window, List<AggregationFieldDescriptor> aggregations);

  /**
   * Aggregates the table into one row per group and non-empty window. The result holds the group
   * keys, one column per field and {@link #EVENT_TIME_FIELD} set to the window end minus one
   * millisecond.
   */
  T evaluateSlidingWindow(
      T table, SlidingWindowDescriptor window, List<AggregationFieldDescriptor> aggregations);

  /** Keeps the rows of {@code table} whose key values appear in {@code keyTable}. */
  T equalityJoin(T keyTable, T table, List<String> keys);

  /**
   * Adds the pulled fields of {@code right} to every row of {@code left}, taken from the right row
   * with equal keys and the greatest event time not after the event time of the left row.
   */
  T asOfJoin(T left, T right, List<String> keys, Map<String, JoinFieldDescriptor> fields);

  /**
   * Full outer join on {@code keys}. Non-key fields missing on one side read as the value in
   * {@code defaults}, or null when the field has none.
   */
  T fullOuterJoinWithDefaults(T left, T right, List<String> keys, Map<String, Object> defaults);

  T select(T table, List<String> fields);

  T filter(T table, String expr);

  /** Keeps rows with {@code start <= event time < end}. A null bound is not applied. */
  T rangeByEventTime(T table, Instant start, Instant end);

  /** Adds {@code field} holding the event time rendered in {@code format}. */
  T deriveTimestampField(T table, String field, String format);

  T dropField(T table, String field);
}
