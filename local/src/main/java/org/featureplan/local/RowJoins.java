/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.local;

import static org.featureplan.engine.TableEngine.EVENT_TIME_FIELD;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.featureplan.engine.JoinFieldDescriptor;
import org.featureplan.exception.SchemaException;

/**
 * Hash joins of local tables. The right side is the build side; rows with a null key never
 * match.
 */
final class RowJoins {

  private RowJoins() {}

  /** Rows of {@code table} whose key values appear in {@code keyTable}. */
  static List<List<Object>> semiJoin(LocalTable keyTable, LocalTable table, List<String> keys) {
    Map<Object, List<List<Object>>> hashTable =
        buildHashTable(keyTable.getRows(), keyTable.indicesOf(keys));
    List<Integer> keyIndices = table.indicesOf(keys);
    List<List<Object>> result = new ArrayList<>();
    for (List<Object> row : table.getRows()) {
      Object key = extractJoinKey(row, keyIndices);
      if (key != null && hashTable.containsKey(key)) {
        result.add(row);
      }
    }
    return result;
  }

  /** Fields of {@link #fullOuterJoin}: left fields, then right fields the left lacks. */
  static List<String> fullOuterJoinFields(LocalTable left, LocalTable right) {
    List<String> fields = new ArrayList<>(left.getFieldNames());
    for (String field : right.getFieldNames()) {
      if (!fields.contains(field)) {
        fields.add(field);
      }
    }
    return fields;
  }

  /**
   * Full outer join. Key fields of a row present on one side only come from that side; its other
   * fields read as their default.
   */
  static List<List<Object>> fullOuterJoin(
      LocalTable left, LocalTable right, List<String> keys, Map<String, Object> defaults) {
    List<String> fields = fullOuterJoinFields(left, right);
    List<String> leftFields = left.getFieldNames();
    List<String> rightFields = right.getFieldNames();
    List<Integer> leftKeyIndices = left.indicesOf(keys);
    List<Integer> rightKeyIndices = right.indicesOf(keys);
    List<List<Object>> rightRows = right.getRows();
    Map<Object, List<Integer>> hashTable = new HashMap<>();
    for (int i = 0; i < rightRows.size(); i++) {
      Object key = extractJoinKey(rightRows.get(i), rightKeyIndices);
      if (key != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
      }
    }

    List<List<Object>> result = new ArrayList<>();
    Set<Integer> matchedRightIndices = new HashSet<>();
    for (List<Object> leftRow : left.getRows()) {
      Object key = extractJoinKey(leftRow, leftKeyIndices);
      List<Integer> matches = key == null ? null : hashTable.get(key);
      if (matches == null) {
        result.add(combine(fields, leftFields, leftRow, rightFields, null, defaults));
        continue;
      }
      for (int match : matches) {
        List<Object> rightRow = rightRows.get(match);
        result.add(combine(fields, leftFields, leftRow, rightFields, rightRow, defaults));
        matchedRightIndices.add(match);
      }
    }
    for (int i = 0; i < rightRows.size(); i++) {
      if (!matchedRightIndices.contains(i)) {
        result.add(combine(fields, leftFields, null, rightFields, rightRows.get(i), defaults));
      }
    }
    return result;
  }

  private static List<Object> combine(
      List<String> fields,
      List<String> leftFields,
      List<Object> leftRow,
      List<String> rightFields,
      List<Object> rightRow,
      Map<String, Object> defaults) {
    List<Object> combined = new ArrayList<>(fields.size());
    for (String field : fields) {
      int leftIndex = leftFields.indexOf(field);
      int rightIndex = rightFields.indexOf(field);
      if (leftRow != null && leftIndex >= 0) {
        combined.add(leftRow.get(leftIndex));
      } else if (rightRow != null && rightIndex >= 0) {
        combined.add(rightRow.get(rightIndex));
      } else {
        combined.add(defaults.get(field));
      }
    }
    return combined;
  }

  /**
   * Fields of {@link #asOfJoin}: left fields, then pulled fields.
   *
   * @throws SchemaException if a pulled field is already a left field
   */
  static List<String> asOfJoinFields(LocalTable left, Map<String, JoinFieldDescriptor> fields) {
    List<String> result = new ArrayList<>(left.getFieldNames());
    for (JoinFieldDescriptor field : fields.values()) {
      if (!field.pulled()) {
        continue;
      }
      if (result.contains(field.fieldName())) {
        throw new SchemaException(
            String.format(
                "Joined field %s would replace a field of the left table %s",
                field.fieldName(), left.getFieldNames()));
      }
      result.add(field.fieldName());
    }
    return result;
  }

  /**
   * As-of join: every left row takes its pulled fields from the right row with equal keys and the
   * greatest event time not after its own. Among right rows with equal event time the last one
   * wins.
   */
  static List<List<Object>> asOfJoin(
      LocalTable left,
      LocalTable right,
      List<String> keys,
      Map<String, JoinFieldDescriptor> fields) {
    int rightTimeIndex = right.indexOf(EVENT_TIME_FIELD);
    Map<Object, List<List<Object>>> hashTable =
        buildHashTable(right.getRows(), right.indicesOf(keys));
    Comparator<List<Object>> byTime =
        Comparator.comparing(row -> (Instant) row.get(rightTimeIndex));
    for (List<List<Object>> versions : hashTable.values()) {
      versions.removeIf(row -> row.get(rightTimeIndex) == null);
      versions.sort(byTime);
    }

    List<String> outputFields = asOfJoinFields(left, fields);
    List<JoinFieldDescriptor> pulled = new ArrayList<>();
    for (JoinFieldDescriptor field : fields.values()) {
      if (field.pulled()) {
        pulled.add(field);
      }
    }
    int leftTimeIndex = left.indexOf(EVENT_TIME_FIELD);
    List<Integer> leftKeyIndices = left.indicesOf(keys);
    List<List<Object>> result = new ArrayList<>();
    for (List<Object> leftRow : left.getRows()) {
      Instant time = (Instant) leftRow.get(leftTimeIndex);
      Object key = extractJoinKey(leftRow, leftKeyIndices);
      List<Object> match = null;
      List<List<Object>> versions = key == null ? null : hashTable.get(key);
      if (time != null && versions != null) {
        for (List<Object> version : versions) {
          if (((Instant) version.get(rightTimeIndex)).isAfter(time)) {
            break;
          }
          match = version;
        }
      }
      List<Object> row = new ArrayList<>(leftRow);
      while (row.size() < outputFields.size()) {
        row.add(null);
      }
      for (JoinFieldDescriptor field : pulled) {
        row.set(
            outputFields.indexOf(field.fieldName()),
            pulledValue(field, match, time, right, rightTimeIndex));
      }
      result.add(row);
    }
    return result;
  }

  private static Object pulledValue(
      JoinFieldDescriptor field,
      List<Object> match,
      Instant time,
      LocalTable right,
      int rightTimeIndex) {
    if (match == null) {
      return field.defaultValue();
    }
    if (field.validTime() != null) {
      Instant matchTime = (Instant) match.get(rightTimeIndex);
      if (matchTime.plus(field.validTime()).isBefore(time)) {
        return field.defaultValue();
      }
    }
    return match.get(right.indexOf(field.fieldName()));
  }

  /**
   * Builds a hash table from the given rows using the specified key indices. Rows with null keys
   * are excluded.
   */
  static Map<Object, List<List<Object>>> buildHashTable(
      List<List<Object>> rows, List<Integer> keyIndices) {
    Map<Object, List<List<Object>>> hashTable = new HashMap<>();
    for (List<Object> row : rows) {
      Object key = extractJoinKey(row, keyIndices);
      if (key != null) {
        hashTable.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
      }
    }
    return hashTable;
  }

  /**
   * Extracts the join key from a row: the normalized value of a single key column, or the list of
   * normalized values of several. Returns null if any key column is null.
   */
  static Object extractJoinKey(List<Object> row, List<Integer> keyIndices) {
    if (keyIndices.size() == 1) {
      return Values.normalizeKey(row.get(keyIndices.get(0)));
    }
    List<Object> compositeKey = new ArrayList<>(keyIndices.size());
    for (int index : keyIndices) {
      Object value = row.get(index);
      if (value == null) {
        return null;
      }
      compositeKey.add(Values.normalizeKey(value));
    }
    return compositeKey;
  }
}
