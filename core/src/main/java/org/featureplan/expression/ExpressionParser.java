/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.expression;

import org.apache.calcite.config.Lex;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.validate.SqlConformanceEnum;
import org.featureplan.exception.ExpressionException;

/**
 * Parses feature expressions into Calcite {@link SqlNode} trees. Identifiers are case sensitive
 * and may be quoted with back-ticks, e.g. {@code `user_id` + 1}.
 */
public final class ExpressionParser {

  /** Lenient conformance accepts {@code %} as the remainder operator. */
  private static final SqlParser.Config CONFIG =
      SqlParser.config().withLex(Lex.JAVA).withConformance(SqlConformanceEnum.LENIENT);

  private ExpressionParser() {}

  public static SqlNode parse(String expr) {
    try {
      return SqlParser.create(expr, CONFIG).parseExpression();
    } catch (SqlParseException e) {
      throw new ExpressionException(String.format("Failed to parse expression '%s'", expr), e);
    }
  }
}
