/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.util.List;

/** Expression compiled against the fields of a table, evaluated per row. */
@FunctionalInterface
interface RowExpression {

  Object evaluate(List<Object> row);
}
