/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.featureplan.engine.TableEngine;
import org.featureplan.exception.CycleException;
import org.featureplan.exception.DefinitionException;
import org.featureplan.exception.SchemaException;
import org.featureplan.model.DerivedFeatureView;
import org.featureplan.model.FeatureView;
import org.featureplan.model.SlidingFeatureView;
import org.featureplan.model.SourceTable;
import org.featureplan.model.TableDescriptor;
import org.featureplan.model.TableDescriptorVisitor;
import org.featureplan.registry.Registry;

/**
 * Compiles table descriptors into tables of a {@link TableEngine}.
 *
 * <p>A builder is one compilation session: every descriptor it compiles, including sources and
 * join targets reached from the requested one, is compiled once and reused afterwards. Calls to
 * {@link #build} are serialized.
 *
 * @param <T> table representation of the engine
 */
@Log4j2
public class TableBuilder<T> {

  @Getter private final TableEngine<T> engine;
  @Getter private final Registry registry;

  private final TableBuildCache<T> cache = new TableBuildCache<>();
  private final Set<String> inProgress = new LinkedHashSet<>();
  private final ReentrantLock lock = new ReentrantLock();

  public TableBuilder(TableEngine<T> engine, Registry registry) {
    this.engine = engine;
    this.registry = registry;
  }

  public T build(TableDescriptor descriptor) {
    return build(descriptor, null, null, null);
  }

  /**
   * Builds the table of a descriptor.
   *
   * @param keys if not null, only rows whose key fields match a key row are kept
   * @param start if not null, only rows with event time not before it are kept
   * @param end if not null, only rows with event time before it are kept
   * @return the table, without the internal event time column
   */
  public T build(TableDescriptor descriptor, KeySet keys, Instant start, Instant end) {
    lock.lock();
    try {
      log.info("Building table {}", descriptor.name());
      T table = getTable(descriptor);
      if (keys != null) {
        table = filterTableByKeys(table, keys);
      }
      if (start != null || end != null) {
        if (descriptor.timestampField() == null) {
          throw new SchemaException(
              String.format(
                  "Table %s has no timestamp field and cannot be ranged by time",
                  descriptor.name()));
        }
        table = engine.rangeByEventTime(table, start, end);
      }
      return engine.dropField(table, EVENT_TIME_FIELD);
    } finally {
      lock.unlock();
    }
  }

  /** Compiled table of a descriptor, with the internal event time column. */
  T getTable(TableDescriptor descriptor) {
    if (descriptor instanceof FeatureView view && view.isUnresolved()) {
      throw new DefinitionException(
          String.format("Feature view %s must be resolved before it is built", descriptor.name()));
    }
    Optional<T> cached = cache.get(descriptor);
    if (cached.isPresent()) {
      return cached.get();
    }
    if (!inProgress.add(descriptor.name())) {
      List<String> path = new ArrayList<>(inProgress);
      path.add(descriptor.name());
      throw new CycleException(path);
    }
    try {
      T table = descriptor.accept(new DescriptorCompiler());
      cache.put(descriptor, table);
      log.debug("Compiled table {}", descriptor.name());
      return table;
    } finally {
      inProgress.remove(descriptor.name());
    }
  }

  private T filterTableByKeys(T table, KeySet keys) {
    T keyTable =
        keys.isTable()
            ? engine.dropField(getTable(keys.getTable()), EVENT_TIME_FIELD)
            : engine.fromRows(keys.getFieldNames(), keys.getRows());
    List<String> keyFields = engine.fieldNames(keyTable);
    List<String> fields = engine.fieldNames(table);
    for (String keyField : keyFields) {
      if (!fields.contains(keyField)) {
        throw new SchemaException(
            String.format("Key %s is not in the table fields %s", keyField, fields));
      }
    }
    return engine.equalityJoin(keyTable, table, keyFields);
  }

  private class DescriptorCompiler implements TableDescriptorVisitor<T> {

    @Override
    public T visitSource(SourceTable source) {
      return engine.scanSource(source);
    }

    @Override
    public T visitDerivedView(DerivedFeatureView view) {
      return new DerivedViewPlanner<>(TableBuilder.this, view).plan();
    }

    @Override
    public T visitSlidingView(SlidingFeatureView view) {
      return new SlidingViewPlanner<>(TableBuilder.this, view).plan();
    }
  }
}
