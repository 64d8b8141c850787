/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.model;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.featureplan.registry.Registry;

/**
 * View whose features are computed per row of its source: expressions, over-window aggregations
 * and as-of joins with other tables. The view has one row per source row.
 *
 * @param name view name
 * @param source descriptor the view reads from
 * @param features features defined by the view
 * @param featureReferences features named by reference, see {@link FeatureView}
 * @param keepSourceFields whether every source column is carried into the output
 * @param filterExpression optional row filter applied after all features are computed
 */
public record DerivedFeatureView(
    String name,
    TableDescriptor source,
    List<Feature> features,
    List<String> featureReferences,
    boolean keepSourceFields,
    String filterExpression)
    implements FeatureView {

  public DerivedFeatureView {
    checkNotNull(name, "name must not be null");
    checkNotNull(source, "source of view %s must not be null", name);
    features = features == null ? List.of() : List.copyOf(features);
    featureReferences = featureReferences == null ? List.of() : List.copyOf(featureReferences);
  }

  public DerivedFeatureView(String name, TableDescriptor source, List<Feature> features) {
    this(name, source, features, List.of(), false, null);
  }

  /** Union of the keys declared by the features, or the source keys when none declares any. */
  @Override
  public List<String> keys() {
    Set<String> keys = new LinkedHashSet<>();
    for (Feature feature : features) {
      if (feature.keys() != null) {
        keys.addAll(feature.keys());
      }
    }
    return keys.isEmpty() ? source.keys() : List.copyOf(keys);
  }

  @Override
  public String timestampField() {
    return source.timestampField();
  }

  @Override
  public String timestampFormat() {
    return source.timestampFormat();
  }

  @Override
  public DerivedFeatureView resolve(Registry registry) {
    TableDescriptor resolvedSource = FeatureReferences.resolveSource(source, registry);
    List<Feature> resolved =
        FeatureReferences.resolve(name, resolvedSource, featureReferences, features, registry);
    return new DerivedFeatureView(
        name, resolvedSource, resolved, List.of(), keepSourceFields, filterExpression);
  }

  @Override
  public List<String> outputFields(List<String> sourceFields) {
    List<String> outputFields = new ArrayList<>();
    if (keepSourceFields) {
      outputFields.addAll(sourceFields);
    } else {
      List<String> keys = keys();
      if (keys != null) {
        outputFields.addAll(keys);
      }
      if (timestampField() != null && !outputFields.contains(timestampField())) {
        outputFields.add(timestampField());
      }
    }
    for (Feature feature : features) {
      if (!outputFields.contains(feature.name())) {
        outputFields.add(feature.name());
      }
    }
    return outputFields;
  }

  @Override
  public <R> R accept(TableDescriptorVisitor<R> visitor) {
    return visitor.visitDerivedView(this);
  }
}
