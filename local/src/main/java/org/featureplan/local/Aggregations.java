/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.util.List;
import org.apache.calcite.sql.SqlKind;
import org.featureplan.model.transform.AggregationFunction;

/** Aggregation of the values of a window, given in event time order. */
final class Aggregations {

  private Aggregations() {}

  static Object aggregate(AggregationFunction function, List<Object> values) {
    switch (function) {
      case SUM:
        {
          Object sum = null;
          for (Object value : values) {
            if (value == null) {
              continue;
            }
            sum = sum == null ? value : ExpressionInterpreter.arithmetic(SqlKind.PLUS, sum, value);
          }
          return sum;
        }
      case AVG:
        {
          double total = 0;
          int count = 0;
          for (Object value : values) {
            if (value != null) {
              total += ((Number) value).doubleValue();
              count++;
            }
          }
          return count == 0 ? null : total / count;
        }
      case MIN:
      case MAX:
        {
          Object result = null;
          for (Object value : values) {
            if (value == null) {
              continue;
            }
            int cmp = result == null ? 0 : Values.compare(value, result);
            if (result == null
                || (function == AggregationFunction.MIN && cmp < 0)
                || (function == AggregationFunction.MAX && cmp > 0)) {
              result = value;
            }
          }
          return result;
        }
      case FIRST_VALUE:
        return values.isEmpty() ? null : values.get(0);
      case LAST_VALUE:
        return values.isEmpty() ? null : values.get(values.size() - 1);
      case COUNT:
        return values.stream().filter(value -> value != null).count();
      case ROW_NUMBER:
        return (long) values.size();
      default:
        throw new UnsupportedOperationException("Unsupported aggregation " + function);
    }
  }
}
