/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.engine;

import java.time.Duration;
import java.util.List;
import org.featureplan.model.transform.SlidingWindowTransform;

/** Shape of a sliding window: group keys, window size and step between window ends. */
public record SlidingWindowDescriptor(
    List<String> groupByKeys, Duration windowSize, Duration stepSize) {

  public SlidingWindowDescriptor {
    groupByKeys = List.copyOf(groupByKeys);
  }

  public static SlidingWindowDescriptor from(SlidingWindowTransform transform) {
    return new SlidingWindowDescriptor(
        transform.groupByKeys(), transform.windowSize(), transform.stepSize());
  }
}
