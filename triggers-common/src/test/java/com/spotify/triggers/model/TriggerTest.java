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

package com.spotify.triggers.model;

import static com.spotify.triggers.testdata.TestData.DATASET_EVENT;
import static com.spotify.triggers.testdata.TestData.WEBHOOK_EVENT;
import static com.spotify.triggers.testdata.TestData.json;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertThrows;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.junit.Test;

public class TriggerTest {

  private static final String SCHEDULE_EVENT =
      "{\"type\": \"SCHEDULE\", \"schedule\": {\"hour\": \"9\", \"minute\": \"0\"}}";

  private static final String BOTH = "{\"triggerId\": 3, \"title\": \"Both\", "
      + "\"triggerEvents\": [" + SCHEDULE_EVENT + ", " + DATASET_EVENT + ", " + WEBHOOK_EVENT + "], "
      + "\"triggerConditions\": [{\"type\": \"ALWAYS\", \"parameters\": {}}]}";

  @Test
  public void shouldParseTrigger() {
    final Trigger trigger = Trigger.fromJson(json(BOTH));

    assertThat(trigger.triggerId(), is(3));
    assertThat(trigger.title(), is("Both"));
    assertThat(trigger.events().size(), is(3));
    assertThat(trigger.conditions().size(), is(1));
    assertThat(trigger.hasScheduleEvent(), is(true));
    assertThat(trigger.hasDatasetEvent(), is(true));
    assertThat(trigger.scheduleEvents().size(), is(1));
    assertThat(trigger.datasetEvents(),
        contains(DatasetUpdatedTriggerEvent.of("abc-123", true)));
  }

  @Test
  public void shouldDescribeTrigger() {
    assertThat(Trigger.fromJson(json(BOTH)).humanReadableDescription(),
        is("'Both' | Events: Schedule: Every day at 09:00, "
           + "Dataset abc-123 updated (when data changes), Event: WEBHOOK"));
  }

  @Test
  public void shouldTolerateTriggerWithoutEvents() {
    final Trigger trigger = Trigger.fromJson(json("{\"triggerId\": 1, \"title\": \"\"}"));

    assertThat(trigger.events(), is(empty()));
    assertThat(trigger.conditions(), is(empty()));
    assertThat(trigger.hasScheduleEvent(), is(false));
    assertThat(trigger.scheduleEvents(), is(empty()));
    assertThat(trigger.humanReadableDescription(), is("'' | Events: (none)"));
  }

  @Test
  public void shouldAcceptNumericTextId() {
    assertThat(Trigger.fromJson(json("{\"triggerId\": \"7\", \"title\": \"t\"}")).triggerId(),
        is(7));
  }

  @Test
  public void shouldRejectNonIntegerId() {
    final InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
        () -> Trigger.fromJson(json("{\"triggerId\": \"seven\", \"title\": \"t\"}")));

    assertThat(e.path(), is("$.triggerId"));
  }

  @Test
  public void shouldRequireIdAndTitle() {
    final MissingRequiredFieldException missingId = assertThrows(
        MissingRequiredFieldException.class,
        () -> Trigger.fromJson(json("{\"title\": \"t\"}")));
    final MissingRequiredFieldException missingTitle = assertThrows(
        MissingRequiredFieldException.class,
        () -> Trigger.fromJson(json("{\"triggerId\": 1}")));

    assertThat(missingId.field(), is("triggerId"));
    assertThat(missingTitle.field(), is("title"));
  }

  @Test
  public void shouldRejectEventsThatAreNotAnArray() {
    final InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
        () -> Trigger.fromJson(json("{\"triggerId\": 1, \"title\": \"t\", \"triggerEvents\": {}}")));

    assertThat(e.path(), is("$.triggerEvents"));
  }

  @Test
  public void shouldNameElementPathOfInvalidEvent() {
    final MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
        () -> Trigger.fromJson(json("{\"triggerId\": 1, \"title\": \"t\", \"triggerEvents\": ["
            + SCHEDULE_EVENT + ", {\"type\": \"DATASET_UPDATED\"}]}")));

    assertThat(e.path(), is("$.triggerEvents[1]"));
    assertThat(e.getMessage(), is("$.triggerEvents[1]: missing required field 'datasetId'"));
  }

  @Test
  public void shouldWriteTriggerBack() {
    final Trigger trigger = Trigger.fromJson(json(BOTH));

    assertThat(Trigger.fromJson(trigger.toJson()), is(trigger));
    assertThat(trigger.toJson(), is(json("{\"triggerId\": 3, \"title\": \"Both\", "
        + "\"triggerEvents\": ["
        + "{\"type\": \"SCHEDULE\", \"schedule\": {\"hour\": \"9\", \"minute\": \"0\"}}, "
        + DATASET_EVENT + ", " + WEBHOOK_EVENT + "], "
        + "\"triggerConditions\": [{\"type\": \"ALWAYS\", \"parameters\": {}}]}")));
  }

  @Test
  public void shouldExportChildrenInFull() {
    final ObjectNode export = Trigger.fromJson(json(BOTH)).exportJson();

    assertThat(export.get("humanReadable").asText(), is(Trigger.fromJson(json(BOTH))
        .humanReadableDescription()));
    assertThat(export.get("triggerEvents").get(0).get("schedule").get("scheduleKind").asText(),
        is("SIMPLE"));
    assertThat(export.get("triggerConditions").get(0).get("humanReadable").asText(),
        is("Condition: ALWAYS"));
  }

  @Test
  public void shouldRebuildWithChangedEvents() {
    final Trigger trigger = Trigger.fromJson(json(BOTH));
    final Trigger rebuilt = trigger.toBuilder()
        .events(List.of(DatasetUpdatedTriggerEvent.of("other", false)))
        .build();

    assertThat(rebuilt.triggerId(), is(3));
    assertThat(rebuilt.hasScheduleEvent(), is(false));
    assertThat(rebuilt.toJson().get("triggerEvents"), is(json("[{\"type\": \"DATASET_UPDATED\", "
        + "\"datasetId\": \"other\", \"triggerOnDataChanged\": false}]")));
  }
}
