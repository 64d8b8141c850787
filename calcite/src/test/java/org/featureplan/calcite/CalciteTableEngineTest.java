/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.calcite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.calcite.plan.RelOptUtil;
import org.apache.calcite.rel.RelNode;
import org.apache.calcite.rel.RelVisitor;
import org.apache.calcite.rel.core.Aggregate;
import org.apache.calcite.rel.core.Join;
import org.apache.calcite.rel.core.JoinRelType;
import org.apache.calcite.rel.core.Project;
import org.apache.calcite.rel.core.TableScan;
import org.apache.calcite.rex.RexOver;
import org.featureplan.common.setting.DefaultSettings;
import org.featureplan.engine.JoinFieldDescriptor;
import org.featureplan.exception.DefinitionException;
import org.featureplan.exception.ExpressionException;
import org.featureplan.exception.SchemaException;
import org.featureplan.exception.UnsupportedTransformException;
import org.featureplan.model.DataType;
import org.featureplan.model.DerivedFeatureView;
import org.featureplan.model.Feature;
import org.featureplan.model.Schema;
import org.featureplan.model.SlidingFeatureView;
import org.featureplan.model.SourceTable;
import org.featureplan.model.TableDescriptor;
import org.featureplan.model.transform.AggregationFunction;
import org.featureplan.model.transform.JoinTransform;
import org.featureplan.model.transform.OverWindowTransform;
import org.featureplan.model.transform.SlidingWindowTransform;
import org.featureplan.planner.KeySet;
import org.featureplan.planner.TableBuilder;
import org.featureplan.registry.InMemoryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class CalciteTableEngineTest {

  private static final SourceTable PURCHASES =
      new SourceTable(
          "purchases",
          Schema.builder()
              .column("user_id", DataType.INT64)
              .column("item_id", DataType.INT64)
              .column("amount", DataType.FLOAT64)
              .column("time", DataType.INT64)
              .build(),
          List.of("user_id"),
          "time",
          TableDescriptor.EPOCH_MILLIS);

  private static final SourceTable ITEMS =
      new SourceTable(
          "items",
          Schema.builder()
              .column("item_id", DataType.INT64)
              .column("price", DataType.FLOAT64)
              .column("category", DataType.STRING)
              .column("time", DataType.STRING)
              .build(),
          List.of("item_id"),
          "time",
          "%Y-%m-%d %H:%M:%S");

  private static final OverWindowTransform RUNNING_SUM =
      new OverWindowTransform("amount", AggregationFunction.SUM, List.of("user_id"));

  private CalciteTableEngine engine;

  private InMemoryRegistry registry;

  private TableBuilder<RelNode> builder;

  @BeforeEach
  void setUp() {
    engine = new CalciteTableEngine(new DefaultSettings());
    engine
        .getRootSchema()
        .add(
            "purchases",
            SourceRelTable.of(PURCHASES.schema(), List.of(List.of(1L, 10L, 2.5d, 1000L))));
    engine.getRootSchema().add("items", SourceRelTable.of(ITEMS.schema(), List.of()));
    registry = new InMemoryRegistry();
    registry.register(PURCHASES, ITEMS);
    builder = new TableBuilder<>(engine, registry);
  }

  @Test
  void source_scan_derives_event_time_from_epoch_millis() {
    RelNode plan = builder.build(PURCHASES);

    assertEquals(List.of("user_id", "item_id", "amount", "time"), engine.fieldNames(plan));
    assertEquals(1, nodes(plan, TableScan.class).size());
    assertTrue(RelOptUtil.toString(plan).contains("TIMESTAMP_MILLIS"));
  }

  @Test
  void source_scan_parses_calendar_timestamps() {
    RelNode plan = builder.build(ITEMS);

    assertTrue(RelOptUtil.toString(plan).contains("PARSE_TIMESTAMP"));
  }

  @Test
  void unregistered_relation_fails() {
    SourceTable unknown =
        new SourceTable(
            "unknown", Schema.builder().column("id", DataType.INT64).build(), List.of("id"), null);

    assertThrows(DefinitionException.class, () -> builder.build(unknown));
  }

  @Test
  void over_window_features_sharing_a_window_are_computed_in_one_projection() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "totals",
            PURCHASES,
            List.of(
                new Feature("running_total", DataType.FLOAT64, RUNNING_SUM),
                new Feature(
                    "running_count",
                    DataType.INT64,
                    new OverWindowTransform(
                        "amount", AggregationFunction.COUNT, List.of("user_id")))));

    RelNode plan = builder.build(view);

    List<Project> windowed =
        nodes(plan, Project.class).stream()
            .filter(project -> RexOver.containsOver(project.getProjects(), null))
            .collect(Collectors.toList());
    assertEquals(1, windowed.size());
    assertEquals(
        2, windowed.get(0).getProjects().stream().filter(RexOver::containsOver).count());
    assertEquals(
        List.of("user_id", "time", "running_total", "running_count"), engine.fieldNames(plan));
  }

  @Test
  void over_window_bounded_by_size_and_limit_is_unsupported() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "bounded",
            PURCHASES,
            List.of(
                new Feature(
                    "last_total",
                    DataType.FLOAT64,
                    new OverWindowTransform(
                        "amount",
                        AggregationFunction.SUM,
                        List.of("user_id"),
                        Duration.ofMinutes(5),
                        3))));

    assertThrows(UnsupportedTransformException.class, () -> builder.build(view));
  }

  @Test
  void join_features_of_one_table_share_one_join() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "purchase_items",
            PURCHASES,
            List.of(
                new Feature(
                    "price",
                    DataType.FLOAT64,
                    new JoinTransform("items", "price"),
                    List.of("item_id")),
                new Feature(
                    "category",
                    DataType.STRING,
                    new JoinTransform("items", "category"),
                    List.of("item_id"))));

    RelNode plan = builder.build(view);

    List<Join> joins = nodes(plan, Join.class);
    assertEquals(1, joins.size());
    assertEquals(JoinRelType.LEFT, joins.get(0).getJoinType());
    assertEquals(List.of("item_id", "time", "price", "category"), engine.fieldNames(plan));
  }

  @Test
  void renamed_join_feature_leaves_left_field_of_same_name() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "item_history",
            ITEMS,
            List.of(
                new Feature(
                    "latest_price",
                    DataType.FLOAT64,
                    new JoinTransform("items", "price"),
                    List.of("item_id"))),
            List.of(),
            true,
            null);

    RelNode plan = builder.build(view);

    assertEquals(
        List.of("item_id", "price", "category", "time", "latest_price"), engine.fieldNames(plan));
    assertEquals(1, nodes(plan, Join.class).size());
  }

  @Test
  void as_of_join_refuses_to_replace_left_field() {
    RelNode items = engine.scanSource(ITEMS);
    Map<String, JoinFieldDescriptor> fields = new LinkedHashMap<>();
    fields.put("item_id", JoinFieldDescriptor.passthrough("item_id"));
    fields.put("price", JoinFieldDescriptor.pulled("price", DataType.FLOAT64, null, null));

    assertThrows(
        SchemaException.class,
        () -> engine.asOfJoin(items, engine.scanSource(ITEMS), List.of("item_id"), fields));
  }

  @Test
  void sliding_windows_of_different_steps_are_merged_by_full_join() {
    SlidingFeatureView view =
        new SlidingFeatureView(
            "sliding_totals",
            PURCHASES,
            List.of(
                new Feature(
                    "total_10m",
                    DataType.FLOAT64,
                    new SlidingWindowTransform(
                        "amount",
                        AggregationFunction.SUM,
                        List.of("user_id"),
                        Duration.ofMinutes(10),
                        Duration.ofMinutes(5))),
                new Feature(
                    "cnt_10m",
                    DataType.INT64,
                    new SlidingWindowTransform(
                        "amount",
                        AggregationFunction.COUNT,
                        List.of("user_id"),
                        Duration.ofMinutes(10),
                        Duration.ofMinutes(10)))));

    RelNode plan = builder.build(view);

    assertEquals(2, nodes(plan, Aggregate.class).size());
    List<Join> fullJoins =
        nodes(plan, Join.class).stream()
            .filter(join -> join.getJoinType() == JoinRelType.FULL)
            .collect(Collectors.toList());
    assertEquals(1, fullJoins.size());
    assertEquals(
        List.of("user_id", "window_time", "total_10m", "cnt_10m"), engine.fieldNames(plan));
    assertTrue(RelOptUtil.toString(plan).contains("UNIX_SECONDS"));
  }

  @Test
  void first_and_last_value_windows_order_by_event_time() {
    SlidingFeatureView view =
        new SlidingFeatureView(
            "amount_bounds",
            PURCHASES,
            List.of(
                new Feature(
                    "first_amount", DataType.FLOAT64, tumbling(AggregationFunction.FIRST_VALUE)),
                new Feature(
                    "last_amount", DataType.FLOAT64, tumbling(AggregationFunction.LAST_VALUE))));

    RelNode plan = builder.build(view);

    String explained = RelOptUtil.toString(plan);
    assertTrue(explained.contains("ARG_MIN"));
    assertTrue(explained.contains("ARG_MAX"));
    assertEquals(1, nodes(plan, Aggregate.class).size());
  }

  @Test
  void key_rows_restrict_table_by_semi_join() {
    RelNode plan =
        builder.build(
            PURCHASES, KeySet.rows(List.of("user_id"), List.of(List.of(1L))), null, null);

    List<Join> joins = nodes(plan, Join.class);
    assertEquals(1, joins.size());
    assertEquals(JoinRelType.SEMI, joins.get(0).getJoinType());
  }

  @Test
  void time_range_keeps_fields() {
    RelNode plan =
        builder.build(PURCHASES, null, Instant.ofEpochSecond(0), Instant.ofEpochSecond(60));

    assertEquals(List.of("user_id", "item_id", "amount", "time"), engine.fieldNames(plan));
    assertTrue(RelOptUtil.toString(plan).contains("LogicalFilter"));
  }

  @Test
  void expression_feature_is_cast_to_its_type() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "labels",
            PURCHASES,
            List.of(
                Feature.expression(
                    "label", DataType.STRING, "CASE WHEN amount > 2 THEN 'big' ELSE 'small' END"),
                Feature.expression("cents", DataType.INT64, "amount * 100")));

    RelNode plan = builder.build(view);

    List<String> types =
        plan.getRowType().getFieldList().stream()
            .map(field -> field.getType().getSqlTypeName().getName())
            .collect(Collectors.toList());
    assertEquals(List.of("BIGINT", "BIGINT", "VARCHAR", "BIGINT"), types);
  }

  @Test
  void expression_on_unknown_field_fails_when_planned() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "broken",
            PURCHASES,
            List.of(Feature.expression("doubled", DataType.FLOAT64, "missing * 2")));

    assertThrows(ExpressionException.class, () -> builder.build(view));
  }

  private static SlidingWindowTransform tumbling(AggregationFunction function) {
    return new SlidingWindowTransform(
        "amount", function, List.of("user_id"), Duration.ofMinutes(5), Duration.ofMinutes(5));
  }

  private static <N extends RelNode> List<N> nodes(RelNode root, Class<N> type) {
    List<N> nodes = new ArrayList<>();
    new RelVisitor() {
      @Override
      public void visit(RelNode node, int ordinal, RelNode parent) {
        if (type.isInstance(node)) {
          nodes.add(type.cast(node));
        }
        super.visit(node, ordinal, parent);
      }
    }.go(root);
    return nodes;
  }
}
