/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.calcite;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rex.RexBuilder;
import org.apache.calcite.rex.RexNode;
import org.apache.calcite.rex.RexUtil;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.SqlOperator;
import org.apache.calcite.sql.fun.SqlCase;
import org.apache.calcite.sql.fun.SqlLibraryOperators;
import org.apache.calcite.sql.fun.SqlStdOperatorTable;
import org.apache.calcite.sql.type.SqlTypeFamily;
import org.apache.calcite.sql.type.SqlTypeName;
import org.apache.calcite.tools.RelBuilder;
import org.featureplan.exception.ExpressionException;
import org.featureplan.expression.ExpressionParser;
import org.featureplan.model.DataType;

/**
 * Translates SQL expressions into {@link RexNode}s over the relation on top of a {@link
 * RelBuilder} stack. The supported expressions are those of the local engine.
 */
class ExpressionTranslator {

  private final RelBuilder relBuilder;
  private final RexBuilder rexBuilder;
  private final String timestampFormat;

  ExpressionTranslator(RelBuilder relBuilder, String timestampFormat) {
    this.relBuilder = relBuilder;
    this.rexBuilder = relBuilder.getRexBuilder();
    this.timestampFormat = timestampFormat;
  }

  /**
   * Translates an expression over the fields of the relation on top of the stack.
   *
   * @throws ExpressionException if the expression is malformed or reads an unknown field
   */
  RexNode translate(String expr) {
    return translate(ExpressionParser.parse(expr));
  }

  /** Casts {@code node} to a data type; timestamps cast to strings render in the session format. */
  RexNode cast(RexNode node, DataType type) {
    RelDataType target = CalciteTypes.toRelDataType(rexBuilder.getTypeFactory(), type);
    if (type == DataType.STRING
        && node.getType().getSqlTypeName().getFamily() == SqlTypeFamily.TIMESTAMP) {
      return rexBuilder.makeCall(
          SqlLibraryOperators.FORMAT_TIMESTAMP, rexBuilder.makeLiteral(timestampFormat), node);
    }
    if (node.getType().equals(target)) {
      return node;
    }
    return rexBuilder.makeCast(target, node);
  }

  private RexNode translate(SqlNode node) {
    if (node instanceof SqlIdentifier identifier) {
      return field(identifier);
    }
    if (node instanceof SqlLiteral literal) {
      return literal(literal);
    }
    if (node instanceof SqlCase sqlCase) {
      return caseWhen(sqlCase);
    }
    if (node instanceof SqlCall call) {
      return call(call);
    }
    throw new ExpressionException("Unsupported expression " + node);
  }

  private RexNode field(SqlIdentifier identifier) {
    if (identifier.isStar()) {
      throw new ExpressionException("* is not a field");
    }
    String name = String.join(".", identifier.names);
    List<String> fieldNames = relBuilder.peek().getRowType().getFieldNames();
    if (!fieldNames.contains(name)) {
      throw new ExpressionException(
          String.format("Unknown field %s, expected one of %s", name, fieldNames));
    }
    return relBuilder.field(name);
  }

  private RexNode literal(SqlLiteral literal) {
    if (literal instanceof SqlNumericLiteral numeric) {
      BigDecimal value = literal.bigDecimalValue();
      if (numeric.isExact() && value.scale() <= 0) {
        return rexBuilder.makeExactLiteral(
            value, rexBuilder.getTypeFactory().createSqlType(SqlTypeName.BIGINT));
      }
      return rexBuilder.makeApproxLiteral(value);
    }
    switch (literal.getTypeName()) {
      case NULL:
        return rexBuilder.constantNull();
      case BOOLEAN:
        return rexBuilder.makeLiteral(literal.booleanValue());
      case CHAR:
        return rexBuilder.makeLiteral(literal.getValueAs(String.class));
      default:
        throw new ExpressionException("Unsupported literal " + literal);
    }
  }

  private RexNode caseWhen(SqlCase sqlCase) {
    RexNode value =
        sqlCase.getValueOperand() == null ? null : translate(sqlCase.getValueOperand());
    List<SqlNode> whens = sqlCase.getWhenOperands().getList();
    List<SqlNode> thens = sqlCase.getThenOperands().getList();
    List<RexNode> operands = new ArrayList<>();
    for (int i = 0; i < whens.size(); i++) {
      RexNode when = translate(whens.get(i));
      operands.add(
          value == null ? when : rexBuilder.makeCall(SqlStdOperatorTable.EQUALS, value, when));
      operands.add(translate(thens.get(i)));
    }
    operands.add(
        sqlCase.getElseOperand() == null
            ? rexBuilder.constantNull()
            : translate(sqlCase.getElseOperand()));
    return rexBuilder.makeCall(SqlStdOperatorTable.CASE, operands);
  }

  private RexNode call(SqlCall call) {
    List<SqlNode> operands = call.getOperandList();
    switch (call.getKind()) {
      case PLUS:
        return binary(SqlStdOperatorTable.PLUS, operands);
      case MINUS:
        return binary(SqlStdOperatorTable.MINUS, operands);
      case TIMES:
        return binary(SqlStdOperatorTable.MULTIPLY, operands);
      case DIVIDE:
        return binary(SqlStdOperatorTable.DIVIDE, operands);
      case MOD:
        return binary(SqlStdOperatorTable.MOD, operands);
      case MINUS_PREFIX:
        return rexBuilder.makeCall(SqlStdOperatorTable.UNARY_MINUS, translate(operands.get(0)));
      case PLUS_PREFIX:
        return translate(operands.get(0));
      case EQUALS:
        return binary(SqlStdOperatorTable.EQUALS, operands);
      case NOT_EQUALS:
        return binary(SqlStdOperatorTable.NOT_EQUALS, operands);
      case LESS_THAN:
        return binary(SqlStdOperatorTable.LESS_THAN, operands);
      case LESS_THAN_OR_EQUAL:
        return binary(SqlStdOperatorTable.LESS_THAN_OR_EQUAL, operands);
      case GREATER_THAN:
        return binary(SqlStdOperatorTable.GREATER_THAN, operands);
      case GREATER_THAN_OR_EQUAL:
        return binary(SqlStdOperatorTable.GREATER_THAN_OR_EQUAL, operands);
      case IN:
      case NOT_IN:
        {
          RexNode operand = translate(operands.get(0));
          List<RexNode> matches = new ArrayList<>();
          for (SqlNode candidate : (SqlNodeList) operands.get(1)) {
            matches.add(
                rexBuilder.makeCall(SqlStdOperatorTable.EQUALS, operand, translate(candidate)));
          }
          RexNode in = RexUtil.composeDisjunction(rexBuilder, matches);
          return call.getKind() == SqlKind.IN
              ? in
              : rexBuilder.makeCall(SqlStdOperatorTable.NOT, in);
        }
      case AND:
        return rexBuilder.makeCall(SqlStdOperatorTable.AND, translateAll(operands));
      case OR:
        return rexBuilder.makeCall(SqlStdOperatorTable.OR, translateAll(operands));
      case NOT:
        return rexBuilder.makeCall(SqlStdOperatorTable.NOT, translate(operands.get(0)));
      case IS_NULL:
        return rexBuilder.makeCall(SqlStdOperatorTable.IS_NULL, translate(operands.get(0)));
      case IS_NOT_NULL:
        return rexBuilder.makeCall(SqlStdOperatorTable.IS_NOT_NULL, translate(operands.get(0)));
      case CAST:
        return cast(translate(operands.get(0)), castType((SqlDataTypeSpec) operands.get(1)));
      default:
        return function(call.getOperator().getName().toUpperCase(Locale.ROOT), operands);
    }
  }

  private RexNode function(String name, List<SqlNode> operands) {
    List<RexNode> args = translateAll(operands);
    switch (name) {
      case "UPPER":
        return rexBuilder.makeCall(SqlStdOperatorTable.UPPER, args);
      case "LOWER":
        return rexBuilder.makeCall(SqlStdOperatorTable.LOWER, args);
      case "CHAR_LENGTH":
      case "CHARACTER_LENGTH":
      case "LENGTH":
        return rexBuilder.makeCall(SqlStdOperatorTable.CHAR_LENGTH, args);
      case "CONCAT":
      case "||":
        {
          RexNode result = cast(args.get(0), DataType.STRING);
          for (RexNode arg : args.subList(1, args.size())) {
            result =
                rexBuilder.makeCall(SqlStdOperatorTable.CONCAT, result, cast(arg, DataType.STRING));
          }
          return result;
        }
      case "SUBSTRING":
        return rexBuilder.makeCall(SqlStdOperatorTable.SUBSTRING, args);
      case "COALESCE":
        return rexBuilder.makeCall(SqlStdOperatorTable.COALESCE, args);
      case "ABS":
        return rexBuilder.makeCall(SqlStdOperatorTable.ABS, args);
      case "ROUND":
        return rexBuilder.makeCall(SqlStdOperatorTable.ROUND, args);
      case "FLOOR":
        return rexBuilder.makeCall(SqlStdOperatorTable.FLOOR, args);
      case "CEIL":
      case "CEILING":
        return rexBuilder.makeCall(SqlStdOperatorTable.CEIL, args);
      default:
        throw new ExpressionException("Unsupported function " + name);
    }
  }

  private RexNode binary(SqlOperator operator, List<SqlNode> operands) {
    return rexBuilder.makeCall(operator, translate(operands.get(0)), translate(operands.get(1)));
  }

  private List<RexNode> translateAll(List<SqlNode> nodes) {
    List<RexNode> translated = new ArrayList<>(nodes.size());
    for (SqlNode node : nodes) {
      translated.add(translate(node));
    }
    return translated;
  }

  private static DataType castType(SqlDataTypeSpec spec) {
    String typeName = spec.getTypeName().getSimple().toUpperCase(Locale.ROOT);
    switch (typeName) {
      case "VARCHAR":
      case "CHAR":
      case "STRING":
        return DataType.STRING;
      case "TINYINT":
      case "SMALLINT":
      case "INT":
      case "INTEGER":
        return DataType.INT32;
      case "BIGINT":
        return DataType.INT64;
      case "REAL":
        return DataType.FLOAT32;
      case "FLOAT":
      case "DOUBLE":
      case "DECIMAL":
        return DataType.FLOAT64;
      case "BOOLEAN":
        return DataType.BOOLEAN;
      case "TIMESTAMP":
        return DataType.TIMESTAMP;
      case "BINARY":
      case "VARBINARY":
      case "BYTES":
        return DataType.BYTES;
      default:
        throw new ExpressionException("Unsupported cast type " + typeName);
    }
  }
}
