/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.planner;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.featureplan.model.TableDescriptor;

/** Keys a built table is restricted to: literal key rows, or the rows of another table. */
@Getter
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class KeySet {

  private final List<String> fieldNames;
  private final List<List<Object>> rows;
  private final TableDescriptor table;

  public static KeySet rows(List<String> fieldNames, List<List<Object>> rows) {
    checkArgument(!fieldNames.isEmpty(), "Key set must name at least one field");
    for (List<Object> row : rows) {
      checkArgument(
          row.size() == fieldNames.size(),
          "Key row %s does not match fields %s",
          row,
          fieldNames);
    }
    return new KeySet(
        List.copyOf(fieldNames),
        rows.stream()
            .map(row -> Collections.unmodifiableList(new ArrayList<>(row)))
            .collect(Collectors.toList()),
        null);
  }

  /** Key set made of every field of the table built for {@code descriptor}. */
  public static KeySet table(TableDescriptor descriptor) {
    checkNotNull(descriptor, "descriptor must not be null");
    return new KeySet(null, null, descriptor);
  }

  public boolean isTable() {
    return table != null;
  }
}
