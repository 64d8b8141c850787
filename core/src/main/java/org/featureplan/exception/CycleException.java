/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.exception;

import java.util.List;
import lombok.Getter;

/** A descriptor references itself through its sources or join targets. */
public class CycleException extends FeaturePlanException {

  private static final long serialVersionUID = 1L;

  /** Descriptor names along the cycle, starting and ending with the revisited name. */
  @Getter private final List<String> path;

  public CycleException(List<String> path) {
    super("Cyclic table reference: " + String.join(" -> ", path));
    this.path = List.copyOf(path);
  }
}
