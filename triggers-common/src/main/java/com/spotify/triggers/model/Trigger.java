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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A named unit of execution initiation: fires on any of its events, subject to its conditions.
 * A trigger without events is valid but can never fire.
 */
@AutoValue
public abstract class Trigger {

  static final String TRIGGER_ID = "triggerId";
  static final String TITLE = "title";
  static final String TRIGGER_EVENTS = "triggerEvents";
  static final String TRIGGER_CONDITIONS = "triggerConditions";

  public abstract int triggerId();

  public abstract String title();

  public abstract ImmutableList<TriggerEvent> events();

  public abstract ImmutableList<TriggerCondition> conditions();

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_Trigger.Builder()
        .events(ImmutableList.of())
        .conditions(ImmutableList.of());
  }

  public static Trigger create(int triggerId, String title, List<TriggerEvent> events,
      List<TriggerCondition> conditions) {
    return builder()
        .triggerId(triggerId)
        .title(title)
        .events(events)
        .conditions(conditions)
        .build();
  }

  /**
   * @throws InvalidConfigurationException if the trigger or one of its events or conditions is
   *                                       malformed
   */
  public static Trigger fromJson(JsonNode raw) {
    return parse(raw, ModelJson.ROOT);
  }

  static Trigger parse(JsonNode raw, String path) {
    if (raw == null || !raw.isObject()) {
      throw new InvalidConfigurationException(path, "trigger is not an object");
    }
    return builder()
        .triggerId(ModelJson.requiredInteger(raw, TRIGGER_ID, path))
        .title(ModelJson.requiredText(raw, TITLE, path))
        .events(ModelJson.parseArray(raw, TRIGGER_EVENTS, path, TriggerEvent::parse))
        .conditions(ModelJson.parseArray(raw, TRIGGER_CONDITIONS, path, TriggerCondition::parse))
        .build();
  }

  public boolean hasScheduleEvent() {
    return events().stream().anyMatch(event -> event instanceof ScheduleTriggerEvent);
  }

  public boolean hasDatasetEvent() {
    return events().stream().anyMatch(event -> event instanceof DatasetUpdatedTriggerEvent);
  }

  public List<ScheduleTriggerEvent> scheduleEvents() {
    return eventsOf(ScheduleTriggerEvent.class);
  }

  public List<DatasetUpdatedTriggerEvent> datasetEvents() {
    return eventsOf(DatasetUpdatedTriggerEvent.class);
  }

  private <T extends TriggerEvent> List<T> eventsOf(Class<T> type) {
    return events().stream()
        .filter(type::isInstance)
        .map(type::cast)
        .collect(ImmutableList.toImmutableList());
  }

  public String humanReadableDescription() {
    final String events = events().isEmpty()
        ? "(none)"
        : events().stream()
            .map(TriggerEvent::humanReadableDescription)
            .collect(Collectors.joining(", "));
    return String.format("'%s' | Events: %s", title(), events);
  }

  public ObjectNode toJson() {
    return json(TriggerEvent::toJson, TriggerCondition::toJson);
  }

  public ObjectNode exportJson() {
    final ObjectNode json = json(TriggerEvent::exportJson, TriggerCondition::exportJson);
    json.put(ModelJson.HUMAN_READABLE, humanReadableDescription());
    return json;
  }

  private ObjectNode json(Function<TriggerEvent, ObjectNode> event,
      Function<TriggerCondition, ObjectNode> condition) {
    final ObjectNode json = ModelJson.newObject();
    json.put(TRIGGER_ID, triggerId());
    json.put(TITLE, title());
    final ArrayNode events = json.putArray(TRIGGER_EVENTS);
    events().stream().map(event).forEach(events::add);
    final ArrayNode conditions = json.putArray(TRIGGER_CONDITIONS);
    conditions().stream().map(condition).forEach(conditions::add);
    return json;
  }

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder triggerId(int triggerId);

    public abstract Builder title(String title);

    public abstract Builder events(List<TriggerEvent> events);

    public abstract Builder conditions(List<TriggerCondition> conditions);

    public abstract Trigger build();
  }
}
