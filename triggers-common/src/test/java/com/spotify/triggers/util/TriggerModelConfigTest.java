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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.Test;

public class TriggerModelConfigTest {

  @Test
  public void shouldLoadReferenceConfig() {
    final TriggerModelConfig config = TriggerModelConfig.load();

    assertThat(config.defaultZoneId(), is("UTC"));
    assertThat(config.defaultLocale(), is("en_US"));
    assertThat(TriggerModelConfig.defaults(), is(config));
  }

  @Test
  public void shouldReadOverrides() {
    final TriggerModelConfig config = TriggerModelConfig.fromConfig(ConfigFactory.parseString(
        "dataflow-triggers { default-zone-id = \"Europe/Stockholm\", default-locale = sv_SE }"));

    assertThat(config, is(TriggerModelConfig.of("Europe/Stockholm", "sv_SE")));
  }

  @Test
  public void shouldFallBackWhenPathsAreMissing() {
    final TriggerModelConfig config = TriggerModelConfig.fromConfig(ConfigFactory.empty());

    assertThat(config, is(TriggerModelConfig.of("UTC", "en_US")));
  }

  @Test
  public void shouldRejectInvalidZone() {
    final ConfigException.BadValue e = assertThrows(ConfigException.BadValue.class,
        () -> TriggerModelConfig.fromConfig(ConfigFactory.parseString(
            "dataflow-triggers.default-zone-id = \"Mars/Olympus\"")));

    assertThat(e.getMessage(), containsString("Mars/Olympus"));
  }
}
