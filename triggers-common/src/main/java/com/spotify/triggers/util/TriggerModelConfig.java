/*-
 * -\-\-
 * Dataflow Triggers Common
 * --
 * Copyright (C) 2026 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.triggers.util;

import com.google.common.base.MoreObjects;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Defaults applied when parsing trigger settings, read from the {@code dataflow-triggers}
 * section of the application config.
 */
public final class TriggerModelConfig {

  static final String DEFAULT_ZONE_ID = "dataflow-triggers.default-zone-id";
  static final String DEFAULT_LOCALE = "dataflow-triggers.default-locale";

  private static final String FALLBACK_ZONE_ID = "UTC";
  private static final String FALLBACK_LOCALE = "en_US";

  private static final Supplier<TriggerModelConfig> DEFAULTS =
      Suppliers.memoize(TriggerModelConfig::load);

  private final String defaultZoneId;
  private final String defaultLocale;

  private TriggerModelConfig(String defaultZoneId, String defaultLocale) {
    this.defaultZoneId = Objects.requireNonNull(defaultZoneId);
    this.defaultLocale = Objects.requireNonNull(defaultLocale);
  }

  /**
   * The config loaded from the classpath, loaded once.
   */
  public static TriggerModelConfig defaults() {
    return DEFAULTS.get();
  }

  public static TriggerModelConfig load() {
    return fromConfig(ConfigFactory.load());
  }

  public static TriggerModelConfig fromConfig(Config config) {
    final String zoneId = getString(config, DEFAULT_ZONE_ID).orElse(FALLBACK_ZONE_ID);
    try {
      ZoneId.of(zoneId);
    } catch (DateTimeException e) {
      throw new ConfigException.BadValue(DEFAULT_ZONE_ID, "not a valid zone id: " + zoneId, e);
    }
    final String locale = getString(config, DEFAULT_LOCALE).orElse(FALLBACK_LOCALE);
    return new TriggerModelConfig(zoneId, locale);
  }

  public static TriggerModelConfig of(String defaultZoneId, String defaultLocale) {
    return new TriggerModelConfig(defaultZoneId, defaultLocale);
  }

  public String defaultZoneId() {
    return defaultZoneId;
  }

  public String defaultLocale() {
    return defaultLocale;
  }

  private static Optional<String> getString(Config config, String path) {
    if (!config.hasPath(path)) {
      return Optional.empty();
    }
    return Optional.of(config.getString(path));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final TriggerModelConfig that = (TriggerModelConfig) o;
    return defaultZoneId.equals(that.defaultZoneId) && defaultLocale.equals(that.defaultLocale);
  }

  @Override
  public int hashCode() {
    return Objects.hash(defaultZoneId, defaultLocale);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("defaultZoneId", defaultZoneId)
        .add("defaultLocale", defaultLocale)
        .toString();
  }
}
