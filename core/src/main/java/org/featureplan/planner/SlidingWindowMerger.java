/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.SlidingWindowDescriptor;
import org.featureplan.engine.TableEngine;

/**
 * Evaluates every sliding window of a view and merges the aggregated tables on group keys and
 * event time. Windows with different steps emit on different grids; a grid point missing from one
 * table reads that table's fields as their aggregation defaults.
 */
@Log4j2
public final class SlidingWindowMerger {

  private SlidingWindowMerger() {}

  public static <T> T merge(
      TableEngine<T> engine,
      T table,
      Map<SlidingWindowDescriptor, List<AggregationFieldDescriptor>> windows) {
    T merged = null;
    Map<String, Object> defaults = new LinkedHashMap<>();
    for (Map.Entry<SlidingWindowDescriptor, List<AggregationFieldDescriptor>> window :
        windows.entrySet()) {
      for (AggregationFieldDescriptor aggregation : window.getValue()) {
        defaults.put(aggregation.fieldName(), aggregation.defaultValue());
      }
      log.debug(
          "Evaluating {} aggregations over sliding window {}",
          window.getValue().size(),
          window.getKey());
      T aggregated = engine.evaluateSlidingWindow(table, window.getKey(), window.getValue());
      if (merged == null) {
        merged = aggregated;
      } else {
        List<String> joinKeys = new ArrayList<>(window.getKey().groupByKeys());
        joinKeys.add(EVENT_TIME_FIELD);
        merged = engine.fullOuterJoinWithDefaults(merged, aggregated, joinKeys, defaults);
      }
    }
    return merged;
  }
}
