/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import java.util.ArrayList;
import java.util.List;
import org.featureplan.exception.DefinitionException;
import org.featureplan.model.transform.ExpressionTransform;
import org.featureplan.model.transform.JoinTransform;
import org.featureplan.registry.Registry;

/** Materializes the feature references of a view. */
final class FeatureReferences {

  private FeatureReferences() {}

  static TableDescriptor resolveSource(TableDescriptor source, Registry registry) {
    if (source instanceof FeatureView view && view.isUnresolved()) {
      return view.resolve(registry);
    }
    return source;
  }

  /**
   * Resolves references in declaration order and places them ahead of the features defined by the
   * view. A reference to a source feature becomes a pass-through of the compiled source column.
   */
  static List<Feature> resolve(
      String viewName,
      TableDescriptor source,
      List<String> references,
      List<Feature> features,
      Registry registry) {
    List<Feature> resolved = new ArrayList<>(references.size() + features.size());
    for (String reference : references) {
      resolved.add(resolveReference(viewName, source, reference, registry));
    }
    resolved.addAll(features);
    return resolved;
  }

  private static Feature resolveReference(
      String viewName, TableDescriptor source, String reference, Registry registry) {
    int separator = reference.indexOf('.');
    if (separator < 0) {
      Feature column = source.getFeature(reference);
      return new Feature(
          column.name(),
          column.dtype(),
          new ExpressionTransform("`" + reference + "`"),
          column.keys());
    }
    if (separator == 0 || separator == reference.length() - 1) {
      throw new DefinitionException(
          String.format("Malformed feature reference '%s' in view %s", reference, viewName));
    }
    String tableName = reference.substring(0, separator);
    String featureName = reference.substring(separator + 1);
    TableDescriptor table = registry.getTable(tableName);
    Feature target = table.getFeature(featureName);
    return new Feature(
        featureName, target.dtype(), new JoinTransform(tableName, featureName), table.keys());
  }
}
