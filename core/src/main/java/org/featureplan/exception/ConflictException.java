/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.exception;

/** Two structurally different descriptors share a name within one compilation session. */
public class ConflictException extends FeaturePlanException {

  private static final long serialVersionUID = 1L;

  public ConflictException(String message) {
    super(message);
  }
}
