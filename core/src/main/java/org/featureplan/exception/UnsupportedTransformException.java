/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.exception;

/** A feature carries a transform its owning view cannot evaluate. */
public class UnsupportedTransformException extends FeaturePlanException {

  private static final long serialVersionUID = 1L;

  public UnsupportedTransformException(String message) {
    super(message);
  }
}
