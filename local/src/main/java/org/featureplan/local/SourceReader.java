/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import java.util.List;
import org.featureplan.model.SourceTable;

/** Reads the rows of a source table, one value per schema column in schema order. */
@FunctionalInterface
public interface SourceReader {

  List<List<Object>> read(SourceTable source);
}
