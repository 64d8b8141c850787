/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.featureplan.model.Feature;

/** Orders the features of a view so every feature follows all of its transitive inputs. */
public final class DependencyResolver {

  private DependencyResolver() {}

  /**
   * Returns every declared feature and its transitive inputs, inputs first. A feature reached
   * more than once, e.g. through a diamond, appears once at its first position.
   */
  public static List<Feature> resolve(List<Feature> features) {
    Set<Feature> ordered = new LinkedHashSet<>();
    for (Feature feature : features) {
      visit(feature, ordered);
    }
    return new ArrayList<>(ordered);
  }

  private static void visit(Feature feature, Set<Feature> ordered) {
    if (ordered.contains(feature)) {
      return;
    }
    for (Feature input : feature.inputFeatures()) {
      visit(input, ordered);
    }
    ordered.add(feature);
  }
}
