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

package com.spotify.triggers.serialization;

import static com.spotify.triggers.testdata.TestData.MIXED;
import static com.spotify.triggers.testdata.TestData.WEBHOOK_EVENT;
import static com.spotify.triggers.testdata.TestData.json;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.spotify.triggers.model.Trigger;
import com.spotify.triggers.model.TriggerCondition;
import com.spotify.triggers.model.TriggerEvent;
import com.spotify.triggers.model.TriggerSettings;
import com.spotify.triggers.schedule.ScheduleSpec;
import java.util.List;
import java.util.Map;
import okio.ByteString;
import org.junit.Test;

public class JsonTest {

  private static final TriggerSettings SETTINGS = TriggerSettings.fromJson(json(MIXED));

  @Test
  public void shouldReadSettings() throws Exception {
    assertThat(Json.OBJECT_MAPPER.readValue(MIXED, TriggerSettings.class), is(SETTINGS));
  }

  @Test
  public void shouldWriteSettingsInMinimalForm() throws Exception {
    assertThat(Json.OBJECT_MAPPER.readTree(Json.OBJECT_MAPPER.writeValueAsString(SETTINGS)),
        is(SETTINGS.toJson()));
  }

  @Test
  public void shouldRoundTripSettingsThroughBytes() {
    final ByteString bytes = Json.serialize(SETTINGS);

    assertThat(Json.deserializeTriggerSettings(bytes), is(SETTINGS));
  }

  @Test
  public void shouldBindNestedModelTypes() throws Exception {
    final Map<String, Trigger> triggers = Json.OBJECT_MAPPER.readValue(
        "{\"nightly\": " + SETTINGS.get(0).toJson() + "}",
        new TypeReference<Map<String, Trigger>>() { });

    assertThat(triggers.get("nightly"), is(SETTINGS.get(0)));
  }

  @Test
  public void shouldBindEventsPolymorphically() {
    final List<TriggerEvent> events = SETTINGS.get(2).events();

    final JsonNode tree = Json.OBJECT_MAPPER.valueToTree(events);

    assertThat(tree.get(2), is(json(WEBHOOK_EVENT)));
    assertThat(Json.OBJECT_MAPPER.convertValue(tree,
        new TypeReference<List<TriggerEvent>>() { }), is(events));
  }

  @Test
  public void shouldBindConditions() {
    final TriggerCondition condition = SETTINGS.get(1).conditions().get(0);

    assertThat(Json.deserialize(Json.serialize(condition), TriggerCondition.class),
        is(condition));
  }

  @Test
  public void shouldBindSchedules() {
    final ScheduleSpec schedule = ScheduleSpec.fromJson(
        json("{\"cronExpression\": \"0 2 * * *\"}")).orElseThrow();

    assertThat(Json.deserialize(Json.serialize(schedule), ScheduleSpec.class), is(schedule));
  }

  @Test
  public void shouldReadUnresolvableScheduleAsNull() {
    assertThat(Json.deserialize(ByteString.encodeUtf8("{\"timezone\": \"UTC\"}"),
        ScheduleSpec.class), is(nullValue()));
  }
}
