/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.exception;

/** Base class of the errors raised while compiling a feature plan. */
public class FeaturePlanException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public FeaturePlanException(String message) {
    super(message);
  }

  public FeaturePlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
