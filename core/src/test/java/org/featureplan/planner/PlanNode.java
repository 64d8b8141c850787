/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import java.util.List;

/** Table of {@link RecordingTableEngine}: the operation that produced it and its fields. */
record PlanNode(String operation, List<String> fields, List<PlanNode> inputs) {

  PlanNode(String operation, List<String> fields, PlanNode... inputs) {
    this(operation, List.copyOf(fields), List.of(inputs));
  }
}
