/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.engine;

import java.time.Duration;
import org.featureplan.model.DataType;

/**
 * Role of a right-side field in an as-of join.
 *
 * <p>Pass-through fields are carried as they are: join keys, the right timestamp field and the
 * event time. Pulled fields are the requested values. A pulled value reads as {@code
 * defaultValue} when no right row matches, or when the match is older than {@code validTime}
 * relative to the left row.
 */
public record JoinFieldDescriptor(
    String fieldName, boolean pulled, DataType dataType, Duration validTime, Object defaultValue) {

  public static JoinFieldDescriptor passthrough(String fieldName) {
    return new JoinFieldDescriptor(fieldName, false, null, null, null);
  }

  public static JoinFieldDescriptor pulled(
      String fieldName, DataType dataType, Duration validTime, Object defaultValue) {
    return new JoinFieldDescriptor(fieldName, true, dataType, validTime, defaultValue);
  }
}
