/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.engine;

import java.time.Duration;
import java.util.List;
import org.featureplan.model.transform.OverWindowTransform;

/**
 * Shape of an over window. Features whose windows have equal shape are aggregated together.
 *
 * @param partitionKeys keys partitioning the rows
 * @param windowSize range of event time preceding the current row, or null when unbounded
 * @param limit number of rows up to and including the current row, or null when unbounded
 */
public record OverWindowDescriptor(List<String> partitionKeys, Duration windowSize, Integer limit) {

  public OverWindowDescriptor {
    partitionKeys = List.copyOf(partitionKeys);
  }

  public static OverWindowDescriptor from(OverWindowTransform transform) {
    return new OverWindowDescriptor(
        transform.partitionKeys(), transform.windowSize(), transform.limit());
  }

  public boolean isUnbounded() {
    return windowSize == null && limit == null;
  }
}
