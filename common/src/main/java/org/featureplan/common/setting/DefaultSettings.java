/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;

/**
 * {@link Settings} backed by an in-memory map. Keys that are not set explicitly fall back to the
 * built-in defaults.
 */
@Log4j2
public class DefaultSettings extends Settings {

  private static final Map<Key, Object> DEFAULTS =
      ImmutableMap.of(
          Key.TIMEZONE, "UTC",
          Key.TIMESTAMP_FORMAT, "%Y-%m-%d %H:%M:%S");

  private final Map<Key, Object> values;

  public DefaultSettings() {
    this(Map.of());
  }

  public DefaultSettings(Map<Key, ?> overrides) {
    this.values = new EnumMap<>(Key.class);
    this.values.putAll(DEFAULTS);
    this.values.putAll(overrides);
  }

  /**
   * Create settings from properties keyed by {@link Key#getKeyValue()}. Unknown property names are
   * ignored.
   */
  public static DefaultSettings fromProperties(Properties properties) {
    Map<Key, Object> overrides = new EnumMap<>(Key.class);
    for (String name : properties.stringPropertyNames()) {
      Key.of(name)
          .ifPresentOrElse(
              key -> overrides.put(key, properties.getProperty(name)),
              () -> log.warn("Ignoring unknown setting {}", name));
    }
    return new DefaultSettings(overrides);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }
}
