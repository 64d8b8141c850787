/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.common.setting;

import com.google.common.collect.ImmutableMap;
import java.time.ZoneId;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Settings accessor for the plan compiler and its engines. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Time zone used to parse and format calendar timestamp strings. */
    TIMEZONE("featureplan.timezone"),

    /** Calendar pattern used to render timestamps cast to strings. */
    TIMESTAMP_FORMAT("featureplan.timestamp.format");

    @Getter private final String keyValue;

    private static final ImmutableMap<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = ImmutableMap.builder();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }
  }

  /** Get setting value by key. Return default value if not configured explicitly. */
  public abstract <T> T getSettingValue(Key key);

  public ZoneId getTimeZone() {
    return ZoneId.of(this.<String>getSettingValue(Key.TIMEZONE));
  }

  public String getTimestampFormat() {
    return getSettingValue(Key.TIMESTAMP_FORMAT);
  }
}
