/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.featureplan.engine.AggregationFieldDescriptor;
import org.featureplan.engine.JoinFieldDescriptor;
import org.featureplan.engine.OverWindowDescriptor;
import org.featureplan.exception.ConflictException;
import org.featureplan.exception.CycleException;
import org.featureplan.exception.DefinitionException;
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
import org.featureplan.model.transform.ExpressionTransform;
import org.featureplan.model.transform.JoinTransform;
import org.featureplan.model.transform.OverWindowTransform;
import org.featureplan.model.transform.SlidingWindowTransform;
import org.featureplan.registry.Registry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class TableBuilderTest {

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

  private static final Schema ITEM_SCHEMA =
      Schema.builder()
          .column("item_id", DataType.INT64)
          .column("price", DataType.FLOAT64)
          .column("category", DataType.STRING)
          .column("time", DataType.INT64)
          .build();

  private static final SourceTable ITEMS =
      new SourceTable("items", ITEM_SCHEMA, List.of("item_id"), "time");

  private static final OverWindowTransform RUNNING_SUM =
      new OverWindowTransform("amount", AggregationFunction.SUM, List.of("user_id"));

  private static final SlidingWindowTransform SUM_10M_BY_5M =
      new SlidingWindowTransform(
          "amount",
          AggregationFunction.SUM,
          List.of("user_id"),
          Duration.ofMinutes(10),
          Duration.ofMinutes(5));

  private static final SlidingWindowTransform COUNT_10M_BY_10M =
      new SlidingWindowTransform(
          "amount",
          AggregationFunction.COUNT,
          List.of("user_id"),
          Duration.ofMinutes(10),
          Duration.ofMinutes(10));

  @Mock private Registry registry;

  @Captor private ArgumentCaptor<List<AggregationFieldDescriptor>> aggregations;

  @Captor private ArgumentCaptor<Map<String, JoinFieldDescriptor>> joinFields;

  @Captor private ArgumentCaptor<Map<String, Object>> defaults;

  private RecordingTableEngine engine;

  private TableBuilder<PlanNode> builder;

  @BeforeEach
  void setUp() {
    engine = spy(new RecordingTableEngine());
    builder = new TableBuilder<>(engine, registry);
  }

  @Test
  void source_table_is_compiled_once_per_session() {
    PlanNode first = builder.build(PURCHASES);
    PlanNode second = builder.build(PURCHASES);

    assertEquals(first, second);
    assertEquals(List.of("user_id", "item_id", "amount", "time"), first.fields());
    verify(engine, times(1)).scanSource(PURCHASES);
  }

  @Test
  void shared_source_is_compiled_once_across_views() {
    builder.build(new DerivedFeatureView("a", PURCHASES, List.of()));
    builder.build(new DerivedFeatureView("b", PURCHASES, List.of()));

    verify(engine, times(1)).scanSource(PURCHASES);
  }

  @Test
  void concurrent_builds_share_one_compilation_of_common_source() throws Exception {
    doAnswer(
            invocation -> {
              Thread.sleep(50);
              return invocation.callRealMethod();
            })
        .when(engine)
        .scanSource(PURCHASES);
    DerivedFeatureView first = new DerivedFeatureView("a", PURCHASES, List.of());
    DerivedFeatureView second = new DerivedFeatureView("b", PURCHASES, List.of());
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Future<PlanNode> firstTable =
          executor.submit(
              () -> {
                start.await();
                return builder.build(first);
              });
      Future<PlanNode> secondTable =
          executor.submit(
              () -> {
                start.await();
                return builder.build(second);
              });
      start.countDown();

      assertEquals(
          firstTable.get(10, TimeUnit.SECONDS).fields(),
          secondTable.get(10, TimeUnit.SECONDS).fields());
    } finally {
      executor.shutdownNow();
    }
    verify(engine, times(1)).scanSource(PURCHASES);
  }

  @Test
  void different_descriptor_with_cached_name_conflicts() {
    builder.build(PURCHASES);
    SourceTable other = new SourceTable("purchases", ITEM_SCHEMA, List.of("item_id"), "time");

    assertThrows(ConflictException.class, () -> builder.build(other));
  }

  @Test
  void unresolved_view_is_rejected_before_any_table_is_built() {
    DerivedFeatureView view =
        new DerivedFeatureView("v", PURCHASES, List.of(), List.of("amount"), false, null);

    assertThrows(DefinitionException.class, () -> builder.build(view));
    verifyNoInteractions(engine);
  }

  @Test
  void over_window_features_of_one_window_are_aggregated_in_one_call() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "stats",
            PURCHASES,
            List.of(
                new Feature("total", DataType.FLOAT64, RUNNING_SUM),
                new Feature(
                    "cnt",
                    DataType.INT64,
                    new OverWindowTransform(
                        "amount", AggregationFunction.COUNT, List.of("user_id"))),
                new Feature(
                    "max_amount",
                    DataType.FLOAT64,
                    new OverWindowTransform(
                        "amount", AggregationFunction.MAX, List.of("user_id")))));

    PlanNode table = builder.build(view);

    verify(engine, times(1))
        .evaluateOverWindow(
            any(),
            eq(new OverWindowDescriptor(List.of("user_id"), null, null)),
            aggregations.capture());
    assertEquals(List.of("total", "cnt", "max_amount"), fieldNames(aggregations.getValue()));
    assertEquals(List.of("user_id", "time", "total", "cnt", "max_amount"), table.fields());
  }

  @Test
  void over_windows_of_different_shapes_are_aggregated_separately() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "stats",
            PURCHASES,
            List.of(
                new Feature("total", DataType.FLOAT64, RUNNING_SUM),
                new Feature(
                    "total_1h",
                    DataType.FLOAT64,
                    new OverWindowTransform(
                        "amount",
                        AggregationFunction.SUM,
                        List.of("user_id"),
                        Duration.ofHours(1),
                        null))));

    builder.build(view);

    verify(engine, times(2)).evaluateOverWindow(any(), any(), anyList());
  }

  @Test
  void over_window_requires_timestamp_field() {
    SourceTable untimed = new SourceTable("untimed", ITEM_SCHEMA, List.of("item_id"), null);
    DerivedFeatureView view =
        new DerivedFeatureView(
            "v",
            untimed,
            List.of(
                new Feature(
                    "total",
                    DataType.FLOAT64,
                    new OverWindowTransform(
                        "price", AggregationFunction.SUM, List.of("item_id")))));

    assertThrows(SchemaException.class, () -> builder.build(view));
  }

  @Test
  void expression_reading_over_window_feature_is_evaluated_after_the_window() {
    Feature total = new Feature("total", DataType.FLOAT64, RUNNING_SUM);
    Feature doubled =
        new Feature(
            "doubled",
            DataType.FLOAT64,
            new ExpressionTransform("total * 2"),
            null,
            List.of(total));
    DerivedFeatureView view = new DerivedFeatureView("v", PURCHASES, List.of(doubled));

    PlanNode table = builder.build(view);

    InOrder inOrder = inOrder(engine);
    inOrder.verify(engine).evaluateOverWindow(any(), any(), anyList());
    inOrder.verify(engine).evaluateExpression(any(), eq("total * 2"), eq("doubled"), any());
    assertEquals(List.of("user_id", "time", "doubled"), table.fields());
  }

  @Test
  void join_features_on_same_table_and_keys_are_joined_once() {
    when(registry.getTable("items")).thenReturn(ITEMS);
    DerivedFeatureView view =
        new DerivedFeatureView(
            "enriched",
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

    PlanNode table = builder.build(view);

    verify(engine, times(1)).asOfJoin(any(), any(), eq(List.of("item_id")), joinFields.capture());
    Map<String, JoinFieldDescriptor> fields = joinFields.getValue();
    assertEquals(
        List.of("item_id", "time", EVENT_TIME_FIELD, "price", "category"),
        new ArrayList<>(fields.keySet()));
    assertFalse(fields.get("item_id").pulled());
    assertTrue(fields.get("price").pulled());
    assertNull(fields.get("price").validTime());
    verify(engine)
        .select(any(), eq(List.of("item_id", "time", EVENT_TIME_FIELD, "price", "category")));
    assertEquals(List.of("item_id", "time", "price", "category"), table.fields());
  }

  @Test
  void join_feature_may_rename_the_pulled_field() {
    when(registry.getTable("items")).thenReturn(ITEMS);
    DerivedFeatureView view =
        new DerivedFeatureView(
            "enriched",
            PURCHASES,
            List.of(
                new Feature(
                    "item_price",
                    DataType.FLOAT64,
                    new JoinTransform("items", "price"),
                    List.of("item_id"))));

    PlanNode table = builder.build(view);

    verify(engine)
        .evaluateExpression(any(), eq("`price`"), eq("__join__item_price"), eq(DataType.FLOAT64));
    verify(engine).asOfJoin(any(), any(), eq(List.of("item_id")), joinFields.capture());
    assertTrue(joinFields.getValue().get("__join__item_price").pulled());
    assertFalse(joinFields.getValue().containsKey("price"));
    verify(engine)
        .evaluateExpression(any(), eq("`__join__item_price`"), eq("item_price"), any());
    verify(engine).dropField(any(), eq("__join__item_price"));
    assertEquals(List.of("item_id", "time", "item_price"), table.fields());
  }

  @Test
  void join_with_sliding_view_is_valid_for_one_step() {
    SlidingFeatureView windows =
        new SlidingFeatureView(
            "windows",
            PURCHASES,
            List.of(new Feature("cnt_10m", DataType.INT64, COUNT_10M_BY_10M)));
    when(registry.getTable("windows")).thenReturn(windows);
    DerivedFeatureView view =
        new DerivedFeatureView(
            "enriched",
            PURCHASES,
            List.of(
                new Feature(
                    "cnt_10m",
                    DataType.INT64,
                    new JoinTransform("windows", "cnt_10m"),
                    List.of("user_id"))));

    builder.build(view);

    verify(engine).asOfJoin(any(), any(), eq(List.of("user_id")), joinFields.capture());
    JoinFieldDescriptor count = joinFields.getValue().get("cnt_10m");
    assertEquals(Duration.ofMinutes(10), count.validTime());
    assertEquals(0L, count.defaultValue());
    assertTrue(joinFields.getValue().containsKey("window_time"));
  }

  @Test
  void join_feature_without_keys_is_rejected() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "v",
            PURCHASES,
            List.of(new Feature("price", DataType.FLOAT64, new JoinTransform("items", "price"))));

    assertThrows(SchemaException.class, () -> builder.build(view));
  }

  @Test
  void join_keys_must_be_fields_of_the_view() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "v",
            PURCHASES,
            List.of(
                new Feature(
                    "price",
                    DataType.FLOAT64,
                    new JoinTransform("items", "price"),
                    List.of("sku"))));

    assertThrows(SchemaException.class, () -> builder.build(view));
  }

  @Test
  void join_target_requires_timestamp_field() {
    when(registry.getTable("items"))
        .thenReturn(new SourceTable("items", ITEM_SCHEMA, List.of("item_id"), null));
    DerivedFeatureView view =
        new DerivedFeatureView(
            "v",
            PURCHASES,
            List.of(
                new Feature(
                    "price",
                    DataType.FLOAT64,
                    new JoinTransform("items", "price"),
                    List.of("item_id"))));

    assertThrows(SchemaException.class, () -> builder.build(view));
  }

  @Test
  void views_joining_each_other_are_reported_as_cycle() {
    DerivedFeatureView a =
        new DerivedFeatureView(
            "a",
            PURCHASES,
            List.of(
                new Feature(
                    "b_value",
                    DataType.FLOAT64,
                    new JoinTransform("b", "a_value"),
                    List.of("user_id"))));
    DerivedFeatureView b =
        new DerivedFeatureView(
            "b",
            PURCHASES,
            List.of(
                new Feature(
                    "a_value",
                    DataType.FLOAT64,
                    new JoinTransform("a", "b_value"),
                    List.of("user_id"))));
    when(registry.getTable("a")).thenReturn(a);
    when(registry.getTable("b")).thenReturn(b);

    CycleException exception = assertThrows(CycleException.class, () -> builder.build(a));

    assertEquals(List.of("a", "b", "a"), exception.getPath());
  }

  @Test
  void sliding_window_in_derived_view_is_unsupported() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "v", PURCHASES, List.of(new Feature("total", DataType.FLOAT64, SUM_10M_BY_5M)));

    assertThrows(UnsupportedTransformException.class, () -> builder.build(view));
  }

  @Test
  void filter_expression_is_applied_before_projection() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "big",
            PURCHASES,
            List.of(Feature.expression("cents", DataType.FLOAT64, "amount * 100")),
            List.of(),
            true,
            "amount > 10");

    PlanNode table = builder.build(view);

    verify(engine).filter(any(), eq("amount > 10"));
    assertEquals(List.of("user_id", "item_id", "amount", "time", "cents"), table.fields());
  }

  @Test
  void sliding_windows_of_different_steps_are_merged_with_typed_defaults() {
    SlidingFeatureView view =
        new SlidingFeatureView(
            "windows",
            PURCHASES,
            List.of(
                new Feature("total_10m", DataType.FLOAT64, SUM_10M_BY_5M),
                new Feature("cnt_10m", DataType.INT64, COUNT_10M_BY_10M)));

    PlanNode table = builder.build(view);

    verify(engine, times(2)).evaluateSlidingWindow(any(), any(), anyList());
    verify(engine)
        .fullOuterJoinWithDefaults(
            any(), any(), eq(List.of("user_id", EVENT_TIME_FIELD)), defaults.capture());
    assertEquals(Map.of("total_10m", 0.0d, "cnt_10m", 0L), defaults.getValue());
    verify(engine).deriveTimestampField(any(), eq("window_time"), eq(TableDescriptor.EPOCH));
    assertEquals(List.of("user_id", "window_time", "total_10m", "cnt_10m"), table.fields());
  }

  @Test
  void sliding_view_with_one_window_is_not_joined() {
    SlidingFeatureView view =
        new SlidingFeatureView(
            "windows",
            PURCHASES,
            List.of(new Feature("total_10m", DataType.FLOAT64, SUM_10M_BY_5M)));

    builder.build(view);

    verify(engine, never()).fullOuterJoinWithDefaults(any(), any(), anyList(), any());
  }

  @Test
  void sliding_view_evaluates_expressions_around_the_aggregation() {
    Feature cents = Feature.expression("cents", DataType.FLOAT64, "amount * 100");
    Feature total =
        new Feature(
            "total_cents",
            DataType.FLOAT64,
            new SlidingWindowTransform(
                "cents",
                AggregationFunction.SUM,
                List.of("user_id"),
                Duration.ofMinutes(10),
                Duration.ofMinutes(5)),
            null,
            List.of(cents));
    Feature dollars =
        new Feature(
            "total_dollars",
            DataType.FLOAT64,
            new ExpressionTransform("total_cents / 100"),
            null,
            List.of(total));
    SlidingFeatureView view = new SlidingFeatureView("windows", PURCHASES, List.of(dollars));

    PlanNode table = builder.build(view);

    InOrder inOrder = inOrder(engine);
    inOrder.verify(engine).evaluateExpression(any(), eq("amount * 100"), eq("cents"), any());
    inOrder.verify(engine).evaluateSlidingWindow(any(), any(), anyList());
    inOrder
        .verify(engine)
        .evaluateExpression(any(), eq("total_cents / 100"), eq("total_dollars"), any());
    assertEquals(List.of("user_id", "window_time", "total_dollars"), table.fields());
  }

  @Test
  void sliding_features_must_share_group_keys() {
    SlidingFeatureView view =
        new SlidingFeatureView(
            "windows",
            PURCHASES,
            List.of(
                new Feature("total_10m", DataType.FLOAT64, SUM_10M_BY_5M),
                new Feature(
                    "item_total",
                    DataType.FLOAT64,
                    new SlidingWindowTransform(
                        "amount",
                        AggregationFunction.SUM,
                        List.of("item_id"),
                        Duration.ofMinutes(10),
                        Duration.ofMinutes(5)))));

    assertThrows(SchemaException.class, () -> builder.build(view));
  }

  @Test
  void over_window_and_join_in_sliding_view_are_unsupported() {
    SlidingFeatureView overWindow =
        new SlidingFeatureView(
            "w1", PURCHASES, List.of(new Feature("total", DataType.FLOAT64, RUNNING_SUM)));
    SlidingFeatureView join =
        new SlidingFeatureView(
            "w2",
            PURCHASES,
            List.of(
                new Feature(
                    "price",
                    DataType.FLOAT64,
                    new JoinTransform("items", "price"),
                    List.of("item_id"))));

    assertThrows(UnsupportedTransformException.class, () -> builder.build(overWindow));
    assertThrows(UnsupportedTransformException.class, () -> builder.build(join));
  }

  @Test
  void range_is_applied_on_event_time() {
    Instant start = Instant.ofEpochMilli(10);
    Instant end = Instant.ofEpochMilli(20);

    PlanNode table = builder.build(PURCHASES, null, start, end);

    verify(engine).rangeByEventTime(any(), eq(start), eq(end));
    assertFalse(table.fields().contains(EVENT_TIME_FIELD));
  }

  @Test
  void range_requires_timestamp_field() {
    SourceTable untimed = new SourceTable("untimed", ITEM_SCHEMA, List.of("item_id"), null);

    assertThrows(
        SchemaException.class, () -> builder.build(untimed, null, Instant.EPOCH, null));
  }

  @Test
  void key_rows_are_semi_joined() {
    KeySet keys = KeySet.rows(List.of("user_id"), List.of(List.of(1L), List.of(2L)));

    builder.build(PURCHASES, keys, null, null);

    verify(engine).fromRows(List.of("user_id"), keys.getRows());
    verify(engine).equalityJoin(any(), any(), eq(List.of("user_id")));
  }

  @Test
  void key_table_is_built_through_the_cache() {
    SourceTable users =
        new SourceTable(
            "users",
            Schema.builder().column("user_id", DataType.INT64).build(),
            List.of("user_id"),
            null);

    builder.build(PURCHASES, KeySet.table(users), null, null);

    verify(engine).scanSource(users);
    verify(engine).equalityJoin(any(), any(), eq(List.of("user_id")));
  }

  @Test
  void key_field_missing_from_table_is_rejected() {
    KeySet keys = KeySet.rows(List.of("account_id"), List.of(List.of(1L)));

    assertThrows(SchemaException.class, () -> builder.build(PURCHASES, keys, null, null));
  }

  @Test
  void compiled_views_are_reused() {
    DerivedFeatureView view =
        new DerivedFeatureView(
            "stats", PURCHASES, List.of(new Feature("total", DataType.FLOAT64, RUNNING_SUM)));

    PlanNode first = builder.build(view);
    PlanNode second = builder.build(view);

    assertSame(first.inputs().get(0), second.inputs().get(0));
    verify(engine, times(1)).evaluateOverWindow(any(), any(), anyList());
  }

  private static List<String> fieldNames(List<AggregationFieldDescriptor> aggregations) {
    List<String> names = new ArrayList<>();
    aggregations.forEach(aggregation -> names.add(aggregation.fieldName()));
    return names;
  }
}
