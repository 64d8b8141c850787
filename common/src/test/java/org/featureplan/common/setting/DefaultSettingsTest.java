/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.featureplan.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class DefaultSettingsTest {

  @Test
  void defaults_apply_when_nothing_is_configured() {
    Settings settings = new DefaultSettings();

    assertEquals(ZoneId.of("UTC"), settings.getTimeZone());
    assertEquals("%Y-%m-%d %H:%M:%S", settings.getTimestampFormat());
  }

  @Test
  void overrides_replace_defaults() {
    Settings settings =
        new DefaultSettings(Map.of(Settings.Key.TIMEZONE, "Asia/Shanghai"));

    assertEquals(ZoneId.of("Asia/Shanghai"), settings.getTimeZone());
    assertEquals("%Y-%m-%d %H:%M:%S", settings.getTimestampFormat());
  }

  @Test
  void properties_are_mapped_by_key_value_and_unknown_names_ignored() {
    Properties properties = new Properties();
    properties.setProperty("featureplan.timestamp.format", "%Y-%m-%d");
    properties.setProperty("featureplan.unknown", "ignored");

    Settings settings = DefaultSettings.fromProperties(properties);

    assertEquals("%Y-%m-%d", settings.getTimestampFormat());
    assertEquals(ZoneId.of("UTC"), settings.getTimeZone());
  }

  @Test
  void key_lookup_by_value() {
    assertEquals(Settings.Key.TIMEZONE, Settings.Key.of("featureplan.timezone").get());
    assertTrue(Settings.Key.of("no.such.key").isEmpty());
  }
}
