/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.calcite;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.apache.calcite.avatica.util.TimeUnit;
import org.apache.calcite.plan.Contexts;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.rex.RexWindowBounds;
import org.apache.calcite.schema.SchemaPlus;
import org.apache.calcite.sql.SqlIntervalQualifier;
import org.apache.calcite.sql.fun.SqlLibraryOperators;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.parser.SqlParserPos;
import org.apache.calcite.sql.type.SqlTypeFamily;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.tools.FrameworkConfig;
import org.apache.calcite.tools.Frameworks;
import org.apache.calcite.tools.RelBuilder;
import org.apache.calcite.util.TimestampString;
import org.featureplan.common.setting.Settings;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.JoinFieldDescriptor;
import org.featureplan.engine.OverWindowDescriptor;
import org.featureplan.engine.SlidingWindowDescriptor;
import org.featureplan.engine.TableEngine;
import org.featureplan.exception.DefinitionException;
import org.featureplan.exception.SchemaException;
import org.featureplan.exception.UnsupportedTransformException;
import org.featureplan.model.DataType;
import org.featureplan.model.SourceTable;
import org.featureplan.model.TableDescriptor;
import org.featureplan.model.transform.AggregationFunction;

/**
 * Engine compiling tables into Calcite relational plans. Source tables are scanned from the
 * relations registered in {@link #getRootSchema()} under their names. Event times are {@code
 * TIMESTAMP(3)} values read and rendered in UTC.
 */
@Log4j2
public class CalciteTableEngine implements TableEngine<RelNode> {

  private static final String ROW_ID_FIELD = "__left_row__";
  private static final String MATCH_RANK_FIELD = "__match_rank__";
  private static final String RIGHT_TIME_FIELD = "__right_time__";
  private static final String RIGHT_FIELD_PREFIX = "__right__";
  private static final String LEFT_MARKER_FIELD = "__left_present__";
  private static final String RIGHT_MARKER_FIELD = "__right_present__";
  private static final String WINDOW_OFFSET_FIELD = "__window_offset__";
  private static final String WINDOW_END_FIELD = "__window_end__";
  private static final String EVENT_MILLIS_FIELD = "__event_millis__";
  private static final String INPUT_FIELD_PREFIX = "__input__";

  @Getter private final SchemaPlus rootSchema;
  private final RelBuilder relBuilder;
  private final RexBuilder rexBuilder;
  private final String timestampFormat;

  public CalciteTableEngine(Settings settings) {
    this(Frameworks.createRootSchema(true), settings);
  }

  public CalciteTableEngine(SchemaPlus rootSchema, Settings settings) {
    this.rootSchema = rootSchema;
    FrameworkConfig config =
        Frameworks.newConfigBuilder()
            .defaultSchema(rootSchema)
            .context(Contexts.of(RelBuilder.Config.DEFAULT.withBloat(-1)))
            .build();
    this.relBuilder = RelBuilder.create(config);
    this.rexBuilder = relBuilder.getRexBuilder();
    this.timestampFormat = settings.getTimestampFormat();
    if (!ZoneOffset.UTC.equals(settings.getTimeZone().normalized())) {
      log.warn(
          "Time zone {} is ignored, relational plans read and render timestamps in UTC",
          settings.getTimeZone());
    }
  }

  @Override
  public RelNode scanSource(SourceTable source) {
    if (rootSchema.getTable(source.name()) == null) {
      throw new DefinitionException("No relation registered for source table " + source.name());
    }
    log.debug("Scanning relation {}", source.name());
    relBuilder.scan(source.name());
    RexNode eventTime =
        source.timestampField() == null
            ? rexBuilder.makeNullLiteral(eventTimeType())
            : eventTime(relBuilder.field(source.timestampField()), source.timestampFormat());
    return relBuilder.projectPlus(relBuilder.alias(eventTime, EVENT_TIME_FIELD)).build();
  }

  @Override
  public RelNode fromRows(List<String> fieldNames, List<List<Object>> rows) {
    if (rows.isEmpty()) {
      RelDataTypeFactory.Builder rowType = rexBuilder.getTypeFactory().builder();
      for (String field : fieldNames) {
        rowType.add(field, SqlTypeName.VARCHAR).nullable(true);
      }
      return relBuilder.values(rowType.build()).build();
    }
    Object[] values = rows.stream().flatMap(List::stream).toArray();
    return relBuilder.values(fieldNames.toArray(new String[0]), values).build();
  }

  @Override
  public List<String> fieldNames(RelNode table) {
    return table.getRowType().getFieldNames();
  }

  @Override
  public RelNode evaluateExpression(
      RelNode table, String expr, String resultName, DataType resultType) {
    relBuilder.push(table);
    ExpressionTranslator translator = translator();
    return withField(resultName, translator.cast(translator.translate(expr), resultType));
  }

  @Override
  public RelNode evaluateOverWindow(
      RelNode table,
      OverWindowDescriptor window,
      List<AggregationFieldDescriptor> aggregations) {
    if (window.windowSize() != null && window.limit() != null) {
      throw new UnsupportedTransformException(
          "Over windows bounded by both window size and row limit are not supported by "
              + "relational plans");
    }
    relBuilder.push(table);
    ExpressionTranslator translator = translator();
    List<RexNode> partitionKeys = fields(table, window.partitionKeys());
    List<RexNode> windowed = new ArrayList<>(aggregations.size());
    for (AggregationFieldDescriptor aggregation : aggregations) {
      RelBuilder.OverCall over =
          overCall(aggregation, translator)
              .over()
              .partitionBy(partitionKeys)
              .orderBy(relBuilder.field(EVENT_TIME_FIELD));
      if (window.limit() != null) {
        over =
            over.rowsBetween(
                RexWindowBounds.preceding(relBuilder.literal(window.limit() - 1)),
                RexWindowBounds.CURRENT_ROW);
      } else if (window.windowSize() != null) {
        over =
            over.rangeBetween(
                RexWindowBounds.preceding(interval(window.windowSize())),
                RexWindowBounds.CURRENT_ROW);
      } else {
        over = over.rowsBetween(RexWindowBounds.UNBOUNDED_PRECEDING, RexWindowBounds.CURRENT_ROW);
      }
      windowed.add(
          relBuilder.alias(
              translator.cast(over.toRex(), aggregation.dataType()), aggregation.fieldName()));
    }
    return relBuilder.projectPlus(windowed).build();
  }

  /**
   * Expands every row into the windows containing it, by crossing it with the offsets of those
   * windows, then aggregates per group and window end.
   */
  @Override
  public RelNode evaluateSlidingWindow(
      RelNode table,
      SlidingWindowDescriptor window,
      List<AggregationFieldDescriptor> aggregations) {
    long size = window.windowSize().toMillis();
    long step = window.stepSize().toMillis();
    List<String> groupByKeys = window.groupByKeys();

    relBuilder.push(table);
    ExpressionTranslator translator = translator();
    List<RexNode> nodes = new ArrayList<>(fields(table, groupByKeys));
    List<String> names = new ArrayList<>(groupByKeys);
    for (int i = 0; i < aggregations.size(); i++) {
      nodes.add(translator.translate(aggregations.get(i).expr()));
      names.add(INPUT_FIELD_PREFIX + i);
    }
    nodes.add(
        rexBuilder.makeCall(SqlLibraryOperators.UNIX_MILLIS, relBuilder.field(EVENT_TIME_FIELD)));
    names.add(EVENT_MILLIS_FIELD);
    relBuilder
        .filter(relBuilder.isNotNull(relBuilder.field(EVENT_TIME_FIELD)))
        .project(nodes, names, true);

    Object[] offsets = new Object[(int) ((size + step - 1) / step)];
    for (int k = 0; k < offsets.length; k++) {
      offsets[k] = (long) k;
    }
    relBuilder
        .values(new String[] {WINDOW_OFFSET_FIELD}, offsets)
        .join(JoinRelType.INNER, relBuilder.literal(true));

    RexNode millis = relBuilder.field(EVENT_MILLIS_FIELD);
    RexNode stepLiteral = relBuilder.literal(step);
    RexNode floorMod = mod(plus(mod(millis, stepLiteral), stepLiteral), stepLiteral);
    RexNode windowEnd =
        plus(
            plus(rexBuilder.makeCall(SqlStdOperatorTable.MINUS, millis, floorMod), stepLiteral),
            rexBuilder.makeCall(
                SqlStdOperatorTable.MULTIPLY, relBuilder.field(WINDOW_OFFSET_FIELD), stepLiteral));
    relBuilder.projectPlus(relBuilder.alias(windowEnd, WINDOW_END_FIELD));
    relBuilder.filter(
        relBuilder.lessThanOrEqual(
            rexBuilder.makeCall(
                SqlStdOperatorTable.MINUS,
                relBuilder.field(WINDOW_END_FIELD),
                relBuilder.literal(size)),
            relBuilder.field(EVENT_MILLIS_FIELD)));

    List<String> groupFields = new ArrayList<>(groupByKeys);
    groupFields.add(WINDOW_END_FIELD);
    List<RelBuilder.AggCall> aggCalls = new ArrayList<>(aggregations.size());
    for (int i = 0; i < aggregations.size(); i++) {
      aggCalls.add(groupAggCall(aggregations.get(i), relBuilder.field(INPUT_FIELD_PREFIX + i)));
    }
    relBuilder.aggregate(relBuilder.groupKey(relBuilder.fields(groupFields)), aggCalls);

    List<RexNode> output = new ArrayList<>(relBuilder.fields(groupByKeys));
    for (AggregationFieldDescriptor aggregation : aggregations) {
      output.add(
          translator.cast(relBuilder.field(aggregation.fieldName()), aggregation.dataType()));
    }
    RexNode emitted =
        rexBuilder.makeCall(
            SqlLibraryOperators.TIMESTAMP_MILLIS,
            rexBuilder.makeCall(
                SqlStdOperatorTable.MINUS,
                relBuilder.field(WINDOW_END_FIELD),
                relBuilder.literal(1L)));
    output.add(rexBuilder.makeCast(eventTimeType(), emitted));
    List<String> outputNames = new ArrayList<>(groupByKeys);
    aggregations.forEach(aggregation -> outputNames.add(aggregation.fieldName()));
    outputNames.add(EVENT_TIME_FIELD);
    return relBuilder.project(output, outputNames, true).build();
  }

  @Override
  public RelNode equalityJoin(RelNode keyTable, RelNode table, List<String> keys) {
    relBuilder.push(table);
    relBuilder.push(keyTable).project(fields(keyTable, keys)).distinct();
    List<RexNode> conditions = new ArrayList<>(keys.size());
    for (String key : keys) {
      conditions.add(relBuilder.equals(relBuilder.field(2, 0, key), relBuilder.field(2, 1, key)));
    }
    return relBuilder.semiJoin(conditions).build();
  }

  /**
   * Left joins every row with the right rows of equal keys and event time not after its own, then
   * keeps the latest match of each left row.
   */
  @Override
  public RelNode asOfJoin(
      RelNode left, RelNode right, List<String> keys, Map<String, JoinFieldDescriptor> fields) {
    List<JoinFieldDescriptor> pulled =
        fields.values().stream()
            .filter(JoinFieldDescriptor::pulled)
            .collect(ImmutableList.toImmutableList());
    List<String> outputFields = new ArrayList<>(fieldNames(left));
    for (JoinFieldDescriptor field : pulled) {
      if (outputFields.contains(field.fieldName())) {
        throw new SchemaException(
            String.format(
                "Joined field %s would replace a field of the left table %s",
                field.fieldName(), fieldNames(left)));
      }
      outputFields.add(field.fieldName());
    }

    checkFields(left, keys);
    relBuilder.push(left);
    RexNode rowId =
        relBuilder
            .aggregateCall(SqlStdOperatorTable.ROW_NUMBER)
            .over()
            .orderBy(relBuilder.field(EVENT_TIME_FIELD))
            .toRex();
    relBuilder.projectPlus(relBuilder.alias(rowId, ROW_ID_FIELD));

    List<RexNode> rightNodes = new ArrayList<>();
    List<String> rightNames = new ArrayList<>();
    relBuilder.push(right);
    for (String key : keys) {
      rightNodes.add(field(right, key));
      rightNames.add(RIGHT_FIELD_PREFIX + key);
    }
    rightNodes.add(relBuilder.field(EVENT_TIME_FIELD));
    rightNames.add(RIGHT_TIME_FIELD);
    for (JoinFieldDescriptor field : pulled) {
      rightNodes.add(field(right, field.fieldName()));
      rightNames.add(RIGHT_FIELD_PREFIX + field.fieldName());
    }
    relBuilder.project(rightNodes, rightNames, true);

    List<RexNode> conditions = new ArrayList<>();
    for (String key : keys) {
      conditions.add(
          relBuilder.equals(
              relBuilder.field(2, 0, key), relBuilder.field(2, 1, RIGHT_FIELD_PREFIX + key)));
    }
    conditions.add(
        relBuilder.lessThanOrEqual(
            relBuilder.field(2, 1, RIGHT_TIME_FIELD), relBuilder.field(2, 0, EVENT_TIME_FIELD)));
    relBuilder.join(JoinRelType.LEFT, conditions);

    RexNode rank =
        relBuilder
            .aggregateCall(SqlStdOperatorTable.ROW_NUMBER)
            .over()
            .partitionBy(relBuilder.field(ROW_ID_FIELD))
            .orderBy(relBuilder.desc(relBuilder.field(RIGHT_TIME_FIELD)))
            .toRex();
    relBuilder.projectPlus(relBuilder.alias(rank, MATCH_RANK_FIELD));
    relBuilder.filter(relBuilder.equals(relBuilder.field(MATCH_RANK_FIELD), relBuilder.literal(1)));

    List<RexNode> output = new ArrayList<>(outputFields.size());
    for (String field : outputFields) {
      JoinFieldDescriptor descriptor = fields.get(field);
      output.add(
          descriptor != null && descriptor.pulled()
              ? pulledValue(descriptor)
              : relBuilder.field(field));
    }
    return relBuilder.project(output, outputFields, true).build();
  }

  private RexNode pulledValue(JoinFieldDescriptor field) {
    RexNode value = relBuilder.field(RIGHT_FIELD_PREFIX + field.fieldName());
    RexNode rightTime = relBuilder.field(RIGHT_TIME_FIELD);
    RexNode missing = relBuilder.isNull(rightTime);
    if (field.validTime() != null) {
      RexNode validUntil =
          rexBuilder.makeCall(
              SqlStdOperatorTable.DATETIME_PLUS, rightTime, interval(field.validTime()));
      RexNode expired = relBuilder.lessThan(validUntil, relBuilder.field(EVENT_TIME_FIELD));
      missing = relBuilder.or(missing, expired);
    }
    return relBuilder.call(
        SqlStdOperatorTable.CASE,
        missing,
        literal(field.defaultValue(), value.getType()),
        value);
  }

  @Override
  public RelNode fullOuterJoinWithDefaults(
      RelNode left, RelNode right, List<String> keys, Map<String, Object> defaults) {
    List<String> leftFields = fieldNames(left);
    List<String> rightFields = fieldNames(right);
    checkFields(left, keys);
    checkFields(right, keys);
    relBuilder
        .push(left)
        .projectPlus(relBuilder.alias(relBuilder.literal(true), LEFT_MARKER_FIELD));
    relBuilder
        .push(right)
        .projectPlus(relBuilder.alias(relBuilder.literal(true), RIGHT_MARKER_FIELD));
    List<RexNode> conditions = new ArrayList<>(keys.size());
    for (String key : keys) {
      conditions.add(relBuilder.equals(relBuilder.field(2, 0, key), relBuilder.field(2, 1, key)));
    }
    relBuilder.join(JoinRelType.FULL, conditions);

    int rightOffset = leftFields.size() + 1;
    RexNode leftPresent = relBuilder.isNotNull(relBuilder.field(leftFields.size()));
    RexNode rightPresent =
        relBuilder.isNotNull(relBuilder.field(rightOffset + rightFields.size()));
    List<RexNode> output = new ArrayList<>();
    List<String> outputNames = new ArrayList<>();
    for (int i = 0; i < leftFields.size(); i++) {
      String field = leftFields.get(i);
      RexNode leftValue = relBuilder.field(i);
      int rightIndex = rightFields.indexOf(field);
      RexNode otherwise =
          rightIndex >= 0
              ? relBuilder.call(
                  SqlStdOperatorTable.CASE,
                  rightPresent,
                  relBuilder.field(rightOffset + rightIndex),
                  literal(defaults.get(field), leftValue.getType()))
              : literal(defaults.get(field), leftValue.getType());
      output.add(relBuilder.call(SqlStdOperatorTable.CASE, leftPresent, leftValue, otherwise));
      outputNames.add(field);
    }
    for (int j = 0; j < rightFields.size(); j++) {
      String field = rightFields.get(j);
      if (leftFields.contains(field)) {
        continue;
      }
      RexNode rightValue = relBuilder.field(rightOffset + j);
      output.add(
          relBuilder.call(
              SqlStdOperatorTable.CASE,
              rightPresent,
              rightValue,
              literal(defaults.get(field), rightValue.getType())));
      outputNames.add(field);
    }
    return relBuilder.project(output, outputNames, true).build();
  }

  @Override
  public RelNode select(RelNode table, List<String> fields) {
    relBuilder.push(table);
    return relBuilder.project(fields(table, fields), fields, true).build();
  }

  @Override
  public RelNode filter(RelNode table, String expr) {
    relBuilder.push(table);
    RexNode condition = translator().translate(expr);
    return relBuilder.filter(condition).build();
  }

  @Override
  public RelNode rangeByEventTime(RelNode table, Instant start, Instant end) {
    relBuilder.push(table);
    RexNode eventTime = field(table, EVENT_TIME_FIELD);
    List<RexNode> conditions = new ArrayList<>();
    conditions.add(relBuilder.isNotNull(eventTime));
    if (start != null) {
      conditions.add(relBuilder.greaterThanOrEqual(eventTime, timestamp(start)));
    }
    if (end != null) {
      conditions.add(relBuilder.lessThan(eventTime, timestamp(end)));
    }
    return relBuilder.filter(conditions).build();
  }

  @Override
  public RelNode deriveTimestampField(RelNode table, String field, String format) {
    relBuilder.push(table);
    RexNode eventTime = field(table, EVENT_TIME_FIELD);
    RexNode value;
    if (TableDescriptor.EPOCH.equals(format)) {
      value = rexBuilder.makeCall(SqlLibraryOperators.UNIX_SECONDS, eventTime);
    } else if (TableDescriptor.EPOCH_MILLIS.equals(format)) {
      value = rexBuilder.makeCall(SqlLibraryOperators.UNIX_MILLIS, eventTime);
    } else {
      value =
          rexBuilder.makeCall(
              SqlLibraryOperators.FORMAT_TIMESTAMP, rexBuilder.makeLiteral(format), eventTime);
    }
    return withField(field, value);
  }

  @Override
  public RelNode dropField(RelNode table, String field) {
    List<String> fields = new ArrayList<>(fieldNames(table));
    if (!fields.remove(field)) {
      return table;
    }
    return select(table, fields);
  }

  /** Event time of a timestamp field value. */
  private RexNode eventTime(RexNode value, String format) {
    RelDataType bigint = rexBuilder.getTypeFactory().createSqlType(SqlTypeName.BIGINT);
    RexNode time;
    if (TableDescriptor.EPOCH.equals(format)) {
      time =
          rexBuilder.makeCall(
              SqlLibraryOperators.TIMESTAMP_SECONDS, rexBuilder.makeCast(bigint, value));
    } else if (TableDescriptor.EPOCH_MILLIS.equals(format)) {
      time =
          rexBuilder.makeCall(
              SqlLibraryOperators.TIMESTAMP_MILLIS, rexBuilder.makeCast(bigint, value));
    } else if (value.getType().getSqlTypeName().getFamily() == SqlTypeFamily.TIMESTAMP) {
      time = value;
    } else {
      RelDataType varchar = rexBuilder.getTypeFactory().createSqlType(SqlTypeName.VARCHAR);
      time =
          rexBuilder.makeCall(
              SqlLibraryOperators.PARSE_TIMESTAMP,
              rexBuilder.makeLiteral(format),
              rexBuilder.makeCast(varchar, value));
    }
    return rexBuilder.makeCast(eventTimeType(), time);
  }

  /** Window aggregate call over a row range of the relation on top of the stack. */
  private RelBuilder.AggCall overCall(
      AggregationFieldDescriptor aggregation, ExpressionTranslator translator) {
    if (aggregation.aggFunc() == AggregationFunction.ROW_NUMBER) {
      return relBuilder.aggregateCall(SqlStdOperatorTable.ROW_NUMBER);
    }
    RexNode input = translator.translate(aggregation.expr());
    switch (aggregation.aggFunc()) {
      case SUM:
        return relBuilder.aggregateCall(SqlStdOperatorTable.SUM, input);
      case AVG:
        return relBuilder.aggregateCall(
            SqlStdOperatorTable.AVG, translator.cast(input, DataType.FLOAT64));
      case MIN:
        return relBuilder.aggregateCall(SqlStdOperatorTable.MIN, input);
      case MAX:
        return relBuilder.aggregateCall(SqlStdOperatorTable.MAX, input);
      case FIRST_VALUE:
        return relBuilder.aggregateCall(SqlStdOperatorTable.FIRST_VALUE, input);
      case LAST_VALUE:
        return relBuilder.aggregateCall(SqlStdOperatorTable.LAST_VALUE, input);
      case COUNT:
        return relBuilder.aggregateCall(SqlStdOperatorTable.COUNT, input);
      default:
        throw new UnsupportedTransformException(
            "Unsupported window aggregation " + aggregation.aggFunc());
    }
  }

  /** Grouped aggregate call; first and last values are taken by event time. */
  private RelBuilder.AggCall groupAggCall(AggregationFieldDescriptor aggregation, RexNode input) {
    RexNode millis = relBuilder.field(EVENT_MILLIS_FIELD);
    RelBuilder.AggCall call;
    switch (aggregation.aggFunc()) {
      case SUM:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.SUM, input);
        break;
      case AVG:
        call =
            relBuilder.aggregateCall(
                SqlStdOperatorTable.AVG,
                rexBuilder.makeCast(
                    CalciteTypes.toRelDataType(rexBuilder.getTypeFactory(), DataType.FLOAT64),
                    input));
        break;
      case MIN:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.MIN, input);
        break;
      case MAX:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.MAX, input);
        break;
      case FIRST_VALUE:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.ARG_MIN, input, millis);
        break;
      case LAST_VALUE:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.ARG_MAX, input, millis);
        break;
      case COUNT:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.COUNT, input);
        break;
      case ROW_NUMBER:
        call = relBuilder.aggregateCall(SqlStdOperatorTable.COUNT);
        break;
      default:
        throw new UnsupportedTransformException(
            "Unsupported window aggregation " + aggregation.aggFunc());
    }
    return call.as(aggregation.fieldName());
  }

  /** Adds, or replaces, a field of the relation on top of the stack and pops the result. */
  private RelNode withField(String field, RexNode value) {
    List<String> fields = new ArrayList<>(relBuilder.peek().getRowType().getFieldNames());
    List<RexNode> nodes = new ArrayList<>(relBuilder.fields());
    int index = fields.indexOf(field);
    if (index < 0) {
      fields.add(field);
      nodes.add(value);
    } else {
      nodes.set(index, value);
    }
    return relBuilder.project(nodes, fields, true).build();
  }

  /** References to fields of {@code table}, which is on top of the stack. */
  private List<RexNode> fields(RelNode table, List<String> names) {
    List<RexNode> fields = new ArrayList<>(names.size());
    for (String name : names) {
      fields.add(field(table, name));
    }
    return fields;
  }

  private RexNode field(RelNode table, String name) {
    checkFields(table, List.of(name));
    return relBuilder.field(name);
  }

  private void checkFields(RelNode table, List<String> names) {
    List<String> fieldNames = fieldNames(table);
    for (String name : names) {
      if (!fieldNames.contains(name)) {
        throw new SchemaException(
            String.format("Field %s is not in the table fields %s", name, fieldNames));
      }
    }
  }

  private RexNode literal(Object value, RelDataType type) {
    if (value == null) {
      return rexBuilder.makeNullLiteral(type);
    }
    return rexBuilder.makeLiteral(value, type, true);
  }

  private RexNode interval(Duration duration) {
    return rexBuilder.makeIntervalLiteral(
        BigDecimal.valueOf(duration.toMillis()),
        new SqlIntervalQualifier(TimeUnit.DAY, TimeUnit.SECOND, SqlParserPos.ZERO));
  }

  private RexNode timestamp(Instant instant) {
    return rexBuilder.makeTimestampLiteral(
        TimestampString.fromMillisSinceEpoch(instant.toEpochMilli()),
        CalciteTypes.TIMESTAMP_PRECISION);
  }

  private RexNode mod(RexNode left, RexNode right) {
    return rexBuilder.makeCall(SqlStdOperatorTable.MOD, left, right);
  }

  private RexNode plus(RexNode left, RexNode right) {
    return rexBuilder.makeCall(SqlStdOperatorTable.PLUS, left, right);
  }

  private RelDataType eventTimeType() {
    return CalciteTypes.eventTimeType(rexBuilder.getTypeFactory());
  }

  private ExpressionTranslator translator() {
    return new ExpressionTranslator(relBuilder, timestampFormat);
  }
}
