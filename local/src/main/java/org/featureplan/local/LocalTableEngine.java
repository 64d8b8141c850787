/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.featureplan.common.setting.Settings;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.JoinFieldDescriptor;
import org.featureplan.engine.OverWindowDescriptor;
import org.featureplan.engine.SlidingWindowDescriptor;
import org.featureplan.engine.TableEngine;
import org.featureplan.model.DataType;
import org.featureplan.model.Schema;
import org.featureplan.model.SourceTable;

/**
 * Engine computing tables in process from rows supplied by a {@link SourceReader}. Plans are
 * checked against table fields when they are built; rows are computed on first access.
 */
@Log4j2
public class LocalTableEngine implements TableEngine<LocalTable> {

  private final SourceReader sourceReader;
  private final ZoneId timeZone;
  private final DateTimeFormatter timestampFormatter;

  public LocalTableEngine(SourceReader sourceReader, Settings settings) {
    this.sourceReader = sourceReader;
    this.timeZone = settings.getTimeZone();
    this.timestampFormatter =
        TimestampFormats.formatter(settings.getTimestampFormat(), settings.getTimeZone());
  }

  @Override
  public LocalTable scanSource(SourceTable source) {
    Schema schema = source.schema();
    List<String> fields = new ArrayList<>(schema.fieldNames());
    fields.add(EVENT_TIME_FIELD);
    int timestampIndex =
        source.timestampField() == null ? -1 : schema.fieldNames().indexOf(source.timestampField());
    return LocalTable.lazy(
        fields,
        () -> {
          List<List<Object>> sourceRows = sourceReader.read(source);
          log.debug("Read {} rows of source table {}", sourceRows.size(), source.name());
          List<List<Object>> rows = new ArrayList<>(sourceRows.size());
          for (List<Object> sourceRow : sourceRows) {
            List<Object> row = new ArrayList<>(fields.size());
            for (int i = 0; i < sourceRow.size(); i++) {
              DataType type = schema.typeOf(schema.fieldNames().get(i));
              row.add(Values.cast(sourceRow.get(i), type, timestampFormatter));
            }
            row.add(
                timestampIndex < 0
                    ? null
                    : TimestampFormats.toInstant(
                        sourceRow.get(timestampIndex), source.timestampFormat(), timeZone));
            rows.add(row);
          }
          return rows;
        });
  }

  @Override
  public LocalTable fromRows(List<String> fieldNames, List<List<Object>> rows) {
    return LocalTable.of(fieldNames, rows);
  }

  @Override
  public List<String> fieldNames(LocalTable table) {
    return table.getFieldNames();
  }

  @Override
  public LocalTable evaluateExpression(
      LocalTable table, String expr, String resultName, DataType resultType) {
    RowExpression expression =
        ExpressionInterpreter.compile(expr, table.getFieldNames(), timestampFormatter);
    return withField(
        table,
        resultName,
        row -> Values.cast(expression.evaluate(row), resultType, timestampFormatter));
  }

  @Override
  public LocalTable evaluateOverWindow(
      LocalTable table,
      OverWindowDescriptor window,
      List<AggregationFieldDescriptor> aggregations) {
    WindowEvaluator evaluator = new WindowEvaluator(table, aggregations, timestampFormatter);
    List<RowExpression> inputs = evaluator.compileInputs();
    List<String> fields = new ArrayList<>(table.getFieldNames());
    table.indicesOf(window.partitionKeys());
    aggregations.forEach(aggregation -> fields.add(aggregation.fieldName()));
    return LocalTable.lazy(fields, () -> evaluator.overWindow(window, inputs));
  }

  @Override
  public LocalTable evaluateSlidingWindow(
      LocalTable table,
      SlidingWindowDescriptor window,
      List<AggregationFieldDescriptor> aggregations) {
    WindowEvaluator evaluator = new WindowEvaluator(table, aggregations, timestampFormatter);
    List<RowExpression> inputs = evaluator.compileInputs();
    table.indicesOf(window.groupByKeys());
    List<String> fields = new ArrayList<>(window.groupByKeys());
    aggregations.forEach(aggregation -> fields.add(aggregation.fieldName()));
    fields.add(EVENT_TIME_FIELD);
    return LocalTable.lazy(fields, () -> evaluator.slidingWindow(window, inputs));
  }

  @Override
  public LocalTable equalityJoin(LocalTable keyTable, LocalTable table, List<String> keys) {
    keyTable.indicesOf(keys);
    table.indicesOf(keys);
    return LocalTable.lazy(
        table.getFieldNames(), () -> RowJoins.semiJoin(keyTable, table, keys));
  }

  @Override
  public LocalTable asOfJoin(
      LocalTable left,
      LocalTable right,
      List<String> keys,
      Map<String, JoinFieldDescriptor> fields) {
    left.indicesOf(keys);
    right.indicesOf(keys);
    return LocalTable.lazy(
        RowJoins.asOfJoinFields(left, fields), () -> RowJoins.asOfJoin(left, right, keys, fields));
  }

  @Override
  public LocalTable fullOuterJoinWithDefaults(
      LocalTable left, LocalTable right, List<String> keys, Map<String, Object> defaults) {
    left.indicesOf(keys);
    right.indicesOf(keys);
    return LocalTable.lazy(
        RowJoins.fullOuterJoinFields(left, right),
        () -> RowJoins.fullOuterJoin(left, right, keys, defaults));
  }

  @Override
  public LocalTable select(LocalTable table, List<String> fields) {
    List<Integer> indices = table.indicesOf(fields);
    return LocalTable.lazy(
        fields,
        () -> {
          List<List<Object>> rows = new ArrayList<>();
          for (List<Object> row : table.getRows()) {
            List<Object> projected = new ArrayList<>(indices.size());
            indices.forEach(index -> projected.add(row.get(index)));
            rows.add(projected);
          }
          return rows;
        });
  }

  @Override
  public LocalTable filter(LocalTable table, String expr) {
    RowExpression condition =
        ExpressionInterpreter.compile(expr, table.getFieldNames(), timestampFormatter);
    return LocalTable.lazy(
        table.getFieldNames(),
        () -> {
          List<List<Object>> rows = new ArrayList<>();
          for (List<Object> row : table.getRows()) {
            if (Boolean.TRUE.equals(condition.evaluate(row))) {
              rows.add(row);
            }
          }
          return rows;
        });
  }

  @Override
  public LocalTable rangeByEventTime(LocalTable table, Instant start, Instant end) {
    int eventTimeIndex = table.indexOf(EVENT_TIME_FIELD);
    return LocalTable.lazy(
        table.getFieldNames(),
        () -> {
          List<List<Object>> rows = new ArrayList<>();
          for (List<Object> row : table.getRows()) {
            Instant time = (Instant) row.get(eventTimeIndex);
            if (time != null
                && (start == null || !time.isBefore(start))
                && (end == null || time.isBefore(end))) {
              rows.add(row);
            }
          }
          return rows;
        });
  }

  @Override
  public LocalTable deriveTimestampField(LocalTable table, String field, String format) {
    int eventTimeIndex = table.indexOf(EVENT_TIME_FIELD);
    return withField(
        table,
        field,
        row -> TimestampFormats.fromInstant((Instant) row.get(eventTimeIndex), format, timeZone));
  }

  @Override
  public LocalTable dropField(LocalTable table, String field) {
    if (!table.hasField(field)) {
      return table;
    }
    List<String> fields = new ArrayList<>(table.getFieldNames());
    fields.remove(field);
    return select(table, fields);
  }

  /** Adds, or replaces, a field computed from every row. */
  private LocalTable withField(
      LocalTable table, String field, Function<List<Object>, Object> value) {
    List<String> fields = new ArrayList<>(table.getFieldNames());
    int index = fields.indexOf(field);
    if (index < 0) {
      fields.add(field);
    }
    return LocalTable.lazy(
        fields,
        () -> {
          List<List<Object>> rows = new ArrayList<>();
          for (List<Object> row : table.getRows()) {
            List<Object> result = new ArrayList<>(row);
            if (index < 0) {
              result.add(value.apply(row));
            } else {
              result.set(index, value.apply(row));
            }
            rows.add(result);
          }
          return rows;
        });
  }
}
