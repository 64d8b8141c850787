/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.DoubleUnaryOperator;
import java.util.function.UnaryOperator;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlDataTypeSpec;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlNodeList;
import org.apache.calcite.sql.SqlNumericLiteral;
import org.apache.calcite.sql.fun.SqlCase;
import org.featureplan.exception.ExpressionException;
import org.featureplan.expression.ExpressionParser;
import org.featureplan.model.DataType;

/**
 * Compiles SQL expressions into {@link RowExpression}s over the fields of a table.
 *
 * <p>Supports field references, literals, arithmetic, comparisons, {@code IN}, boolean logic with
 * SQL null semantics, {@code IS [NOT] NULL}, {@code CASE}, {@code CAST} and the functions {@code
 * UPPER, LOWER, CONCAT, ||, SUBSTRING, CHAR_LENGTH, ABS, ROUND, FLOOR, CEIL, COALESCE}.
 */
final class ExpressionInterpreter {

  private final List<String> fieldNames;
  private final DateTimeFormatter timestampFormatter;

  private ExpressionInterpreter(List<String> fieldNames, DateTimeFormatter timestampFormatter) {
    this.fieldNames = fieldNames;
    this.timestampFormatter = timestampFormatter;
  }

  /**
   * Compiles an expression.
   *
   * @param timestampFormatter renders timestamps cast to strings
   * @throws ExpressionException if the expression is malformed or reads an unknown field
   */
  static RowExpression compile(
      String expr, List<String> fieldNames, DateTimeFormatter timestampFormatter) {
    return new ExpressionInterpreter(fieldNames, timestampFormatter)
        .compile(ExpressionParser.parse(expr));
  }

  private RowExpression compile(SqlNode node) {
    if (node instanceof SqlIdentifier identifier) {
      return field(identifier);
    }
    if (node instanceof SqlLiteral literal) {
      Object value = literal(literal);
      return row -> value;
    }
    if (node instanceof SqlCase sqlCase) {
      return caseWhen(sqlCase);
    }
    if (node instanceof SqlCall call) {
      return call(call);
    }
    throw new ExpressionException("Unsupported expression " + node);
  }

  private RowExpression field(SqlIdentifier identifier) {
    if (identifier.isStar()) {
      throw new ExpressionException("* is not a field");
    }
    String name = String.join(".", identifier.names);
    int index = fieldNames.indexOf(name);
    if (index < 0) {
      throw new ExpressionException(
          String.format("Unknown field %s, expected one of %s", name, fieldNames));
    }
    return row -> row.get(index);
  }

  private static Object literal(SqlLiteral literal) {
    if (literal instanceof SqlNumericLiteral numeric) {
      BigDecimal value = literal.bigDecimalValue();
      if (numeric.isExact() && value.scale() <= 0) {
        return value.longValueExact();
      }
      return value.doubleValue();
    }
    switch (literal.getTypeName()) {
      case NULL:
        return null;
      case BOOLEAN:
        return literal.booleanValue();
      case CHAR:
        return literal.getValueAs(String.class);
      default:
        throw new ExpressionException("Unsupported literal " + literal);
    }
  }

  private RowExpression caseWhen(SqlCase sqlCase) {
    RowExpression value =
        sqlCase.getValueOperand() == null ? null : compile(sqlCase.getValueOperand());
    List<RowExpression> whens = compileAll(sqlCase.getWhenOperands());
    List<RowExpression> thens = compileAll(sqlCase.getThenOperands());
    RowExpression otherwise =
        sqlCase.getElseOperand() == null ? row -> null : compile(sqlCase.getElseOperand());
    return row -> {
      Object caseValue = value == null ? null : value.evaluate(row);
      for (int i = 0; i < whens.size(); i++) {
        Object when = whens.get(i).evaluate(row);
        boolean matched =
            value == null
                ? Boolean.TRUE.equals(when)
                : caseValue != null && when != null && Values.compare(caseValue, when) == 0;
        if (matched) {
          return thens.get(i).evaluate(row);
        }
      }
      return otherwise.evaluate(row);
    };
  }

  private RowExpression call(SqlCall call) {
    SqlKind kind = call.getKind();
    List<SqlNode> operands = call.getOperandList();
    switch (kind) {
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case MOD:
        {
          RowExpression left = compile(operands.get(0));
          RowExpression right = compile(operands.get(1));
          return row -> arithmetic(kind, left.evaluate(row), right.evaluate(row));
        }
      case MINUS_PREFIX:
        {
          RowExpression operand = compile(operands.get(0));
          return row -> arithmetic(SqlKind.TIMES, operand.evaluate(row), -1L);
        }
      case PLUS_PREFIX:
        return compile(operands.get(0));
      case EQUALS:
      case NOT_EQUALS:
      case LESS_THAN:
      case LESS_THAN_OR_EQUAL:
      case GREATER_THAN:
      case GREATER_THAN_OR_EQUAL:
        {
          RowExpression left = compile(operands.get(0));
          RowExpression right = compile(operands.get(1));
          return row -> comparison(kind, left.evaluate(row), right.evaluate(row));
        }
      case IN:
      case NOT_IN:
        return in(kind, compile(operands.get(0)), compileAll((SqlNodeList) operands.get(1)));
      case AND:
        return and(compileAll(operands));
      case OR:
        return or(compileAll(operands));
      case NOT:
        {
          RowExpression operand = compile(operands.get(0));
          return row -> {
            Boolean value = asBoolean(operand.evaluate(row));
            return value == null ? null : !value;
          };
        }
      case IS_NULL:
        {
          RowExpression operand = compile(operands.get(0));
          return row -> operand.evaluate(row) == null;
        }
      case IS_NOT_NULL:
        {
          RowExpression operand = compile(operands.get(0));
          return row -> operand.evaluate(row) != null;
        }
      case CAST:
        {
          RowExpression operand = compile(operands.get(0));
          DataType type = castType((SqlDataTypeSpec) operands.get(1));
          return row -> Values.cast(operand.evaluate(row), type, timestampFormatter);
        }
      default:
        return function(call.getOperator().getName().toUpperCase(Locale.ROOT), operands);
    }
  }

  private RowExpression function(String name, List<SqlNode> operands) {
    List<RowExpression> args = compileAll(operands);
    switch (name) {
      case "UPPER":
        return row -> mapString(args.get(0).evaluate(row), s -> s.toUpperCase(Locale.ROOT));
      case "LOWER":
        return row -> mapString(args.get(0).evaluate(row), s -> s.toLowerCase(Locale.ROOT));
      case "CHAR_LENGTH":
      case "CHARACTER_LENGTH":
      case "LENGTH":
        return row -> {
          Object value = args.get(0).evaluate(row);
          return value == null ? null : (long) value.toString().length();
        };
      case "CONCAT":
      case "||":
        return row -> {
          StringBuilder result = new StringBuilder();
          for (RowExpression arg : args) {
            Object value = arg.evaluate(row);
            if (value == null) {
              return null;
            }
            result.append(value);
          }
          return result.toString();
        };
      case "SUBSTRING":
        return row -> substring(row, args);
      case "COALESCE":
        return row -> {
          for (RowExpression arg : args) {
            Object value = arg.evaluate(row);
            if (value != null) {
              return value;
            }
          }
          return null;
        };
      case "ABS":
        return row -> {
          Number value = asNumber(args.get(0).evaluate(row));
          if (value == null) {
            return null;
          }
          return Values.isIntegral(value)
              ? (Object) Math.abs(value.longValue())
              : (Object) Math.abs(value.doubleValue());
        };
      case "ROUND":
        return row -> {
          Number value = asNumber(args.get(0).evaluate(row));
          int scale = args.size() > 1 ? asNumber(args.get(1).evaluate(row)).intValue() : 0;
          if (value == null || Values.isIntegral(value)) {
            return value;
          }
          return BigDecimal.valueOf(value.doubleValue())
              .setScale(scale, RoundingMode.HALF_UP)
              .doubleValue();
        };
      case "FLOOR":
        return row -> rounded(args.get(0).evaluate(row), Math::floor);
      case "CEIL":
      case "CEILING":
        return row -> rounded(args.get(0).evaluate(row), Math::ceil);
      default:
        throw new ExpressionException("Unsupported function " + name);
    }
  }

  private List<RowExpression> compileAll(List<SqlNode> nodes) {
    List<RowExpression> compiled = new ArrayList<>(nodes.size());
    for (SqlNode node : nodes) {
      compiled.add(compile(node));
    }
    return compiled;
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

  static Object arithmetic(SqlKind kind, Object left, Object right) {
    if (left == null || right == null) {
      return null;
    }
    Number l = asNumber(left);
    Number r = asNumber(right);
    if (Values.isIntegral(l) && Values.isIntegral(r)) {
      long a = l.longValue();
      long b = r.longValue();
      switch (kind) {
        case PLUS:
          return a + b;
        case MINUS:
          return a - b;
        case TIMES:
          return a * b;
        case DIVIDE:
        case MOD:
          if (b == 0) {
            throw new ExpressionException("Division by zero");
          }
          return kind == SqlKind.DIVIDE ? a / b : a % b;
        default:
          throw new ExpressionException("Unsupported arithmetic " + kind);
      }
    }
    double a = l.doubleValue();
    double b = r.doubleValue();
    switch (kind) {
      case PLUS:
        return a + b;
      case MINUS:
        return a - b;
      case TIMES:
        return a * b;
      case DIVIDE:
        return a / b;
      case MOD:
        return a % b;
      default:
        throw new ExpressionException("Unsupported arithmetic " + kind);
    }
  }

  private static Boolean comparison(SqlKind kind, Object left, Object right) {
    if (left == null || right == null) {
      return null;
    }
    int cmp = Values.compare(left, right);
    switch (kind) {
      case EQUALS:
        return cmp == 0;
      case NOT_EQUALS:
        return cmp != 0;
      case LESS_THAN:
        return cmp < 0;
      case LESS_THAN_OR_EQUAL:
        return cmp <= 0;
      case GREATER_THAN:
        return cmp > 0;
      case GREATER_THAN_OR_EQUAL:
        return cmp >= 0;
      default:
        throw new ExpressionException("Unsupported comparison " + kind);
    }
  }

  private static RowExpression in(
      SqlKind kind, RowExpression operand, List<RowExpression> candidates) {
    return row -> {
      Object value = operand.evaluate(row);
      if (value == null) {
        return null;
      }
      boolean found = false;
      for (RowExpression candidate : candidates) {
        Object candidateValue = candidate.evaluate(row);
        if (candidateValue != null && Values.compare(value, candidateValue) == 0) {
          found = true;
          break;
        }
      }
      return kind == SqlKind.IN ? found : !found;
    };
  }

  private static RowExpression and(List<RowExpression> operands) {
    return row -> {
      boolean unknown = false;
      for (RowExpression operand : operands) {
        Boolean value = asBoolean(operand.evaluate(row));
        if (value == null) {
          unknown = true;
        } else if (!value) {
          return false;
        }
      }
      return unknown ? null : true;
    };
  }

  private static RowExpression or(List<RowExpression> operands) {
    return row -> {
      boolean unknown = false;
      for (RowExpression operand : operands) {
        Boolean value = asBoolean(operand.evaluate(row));
        if (value == null) {
          unknown = true;
        } else if (value) {
          return true;
        }
      }
      return unknown ? null : false;
    };
  }

  private static Object substring(List<Object> row, List<RowExpression> args) {
    Object value = args.get(0).evaluate(row);
    Number from = asNumber(args.get(1).evaluate(row));
    if (value == null || from == null) {
      return null;
    }
    String string = value.toString();
    int begin = Math.max(from.intValue() - 1, 0);
    int end = string.length();
    if (args.size() > 2) {
      Number length = asNumber(args.get(2).evaluate(row));
      if (length == null) {
        return null;
      }
      end = Math.min(end, from.intValue() - 1 + length.intValue());
    }
    return begin >= end ? "" : string.substring(begin, end);
  }

  private static Object rounded(Object value, DoubleUnaryOperator rounding) {
    Number number = asNumber(value);
    if (number == null || Values.isIntegral(number)) {
      return number;
    }
    return rounding.applyAsDouble(number.doubleValue());
  }

  private static Object mapString(Object value, UnaryOperator<String> mapper) {
    return value == null ? null : mapper.apply(value.toString());
  }

  private static Number asNumber(Object value) {
    if (value == null || value instanceof Number) {
      return (Number) value;
    }
    throw new ExpressionException(String.format("Expected a number but got '%s'", value));
  }

  private static Boolean asBoolean(Object value) {
    if (value == null || value instanceof Boolean) {
      return (Boolean) value;
    }
    throw new ExpressionException(String.format("Expected a boolean but got '%s'", value));
  }
}
