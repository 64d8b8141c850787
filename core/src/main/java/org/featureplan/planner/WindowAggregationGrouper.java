/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.featureplan.engine.AggregationFieldDescriptor;

/**
 * Collects windowed aggregations by window shape, so that every shape is evaluated by a single
 * engine call. Shapes keep their first-seen order.
 *
 * @param <D> window descriptor type
 */
public class WindowAggregationGrouper<D> {

  private final Map<D, List<AggregationFieldDescriptor>> batches = new LinkedHashMap<>();

  public void add(D window, AggregationFieldDescriptor aggregation) {
    batches.computeIfAbsent(window, w -> new ArrayList<>()).add(aggregation);
  }

  public Map<D, List<AggregationFieldDescriptor>> batches() {
    return Collections.unmodifiableMap(batches);
  }

  /** Names of the fields collected and not yet evaluated. */
  public Set<String> pendingFields() {
    return batches.values().stream()
        .flatMap(List::stream)
        .map(AggregationFieldDescriptor::fieldName)
        .collect(Collectors.toSet());
  }

  public boolean isEmpty() {
    return batches.isEmpty();
  }

  public void clear() {
    batches.clear();
  }
}
